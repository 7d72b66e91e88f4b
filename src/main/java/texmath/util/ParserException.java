// This file is part of the TeXMath Library (texmath).
//
// The TeXMath Library is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The TeXMath Library is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the TeXMath Library. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package texmath.util;

/**
 * Raised when a sequence of tokens does not form a well-formed expression, or
 * when parsing would exceed one of the configured resource limits.
 *
 * @author David J. Pearce
 */
public class ParserException extends MathError {

	public ParserException(String msg, String src, int start, int end) {
		super(msg, src, start, end, null);
	}

	public ParserException(String msg, String src, int start, int end, String suggestion) {
		super(msg, src, start, end, suggestion);
	}

	@Override
	public String stage() {
		return "parser";
	}

	public static final long serialVersionUID = 1l;
}

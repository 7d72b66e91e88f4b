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
 * Raised when an expression cannot be evaluated or transformed: an undefined
 * variable, a type mismatch between operands, a domain violation, or an
 * exhausted resource limit.
 *
 * @author David J. Pearce
 */
public class EvaluatorException extends MathError {

	public EvaluatorException(String msg) {
		super(msg, null, -1, -1, null);
	}

	public EvaluatorException(String msg, String suggestion) {
		super(msg, null, -1, -1, suggestion);
	}

	public EvaluatorException(String msg, SyntacticElement elem) {
		super(msg, null, startOf(elem), endOf(elem), null);
	}

	public EvaluatorException(String msg, SyntacticElement elem, String suggestion) {
		super(msg, null, startOf(elem), endOf(elem), suggestion);
	}

	public EvaluatorException(String msg, Throwable cause) {
		super(msg, null, -1, -1, null, cause);
	}

	@Override
	public String stage() {
		return "evaluation";
	}

	public static final long serialVersionUID = 1l;
}

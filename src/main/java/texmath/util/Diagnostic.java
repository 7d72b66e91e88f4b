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
 * A non-throwing record of a single problem found in the source text. These
 * are collected when validating an expression, where we want to report every
 * problem found rather than stopping at the first.
 *
 * @author David J. Pearce
 */
public final class Diagnostic {
	private final String stage;
	private final String message;
	private final int start;
	private final int end;
	private final String suggestion;

	public Diagnostic(String stage, String message, int start, int end, String suggestion) {
		this.stage = stage;
		this.message = message;
		this.start = start;
		this.end = end;
		this.suggestion = suggestion;
	}

	public static Diagnostic of(MathError e) {
		return new Diagnostic(e.stage(), e.msg(), e.start(), e.end(), e.suggestion());
	}

	public String stage() {
		return stage;
	}

	public String message() {
		return message;
	}

	public int start() {
		return start;
	}

	public int end() {
		return end;
	}

	/**
	 * A hint for fixing the problem, or null if there is none.
	 *
	 * @return
	 */
	public String suggestion() {
		return suggestion;
	}

	@Override
	public String toString() {
		String s = stage + "@" + start + ": " + message;
		if (suggestion != null) {
			s += " (" + suggestion + ")";
		}
		return s;
	}
}

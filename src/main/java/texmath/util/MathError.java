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

import java.io.PrintStream;

import texmath.util.SyntacticElement.Attribute;

/**
 * The root of all errors raised whilst tokenising, parsing, evaluating or
 * transforming an expression. An error identifies a region of the source text
 * (where one is known) and may offer a suggestion for how to fix it.
 *
 * @author David J. Pearce
 */
public abstract class MathError extends RuntimeException {

	private final String msg;
	private final String src;
	private final int start;
	private final int end;
	private final String suggestion;

	/**
	 * Identify an error at a particular point in the source text.
	 *
	 * @param msg
	 *            Message detailing the problem.
	 * @param src
	 *            The source text this error is referring to (may be null).
	 * @param start
	 *            Index of the first offending character, or -1 if unknown.
	 * @param end
	 *            Index of the last offending character, or -1 if unknown.
	 * @param suggestion
	 *            An optional hint for fixing the problem (may be null).
	 */
	public MathError(String msg, String src, int start, int end, String suggestion) {
		this.msg = msg;
		this.src = src;
		this.start = start;
		this.end = end;
		this.suggestion = suggestion;
	}

	public MathError(String msg, String src, int start, int end, String suggestion, Throwable cause) {
		super(cause);
		this.msg = msg;
		this.src = src;
		this.start = start;
		this.end = end;
		this.suggestion = suggestion;
	}

	@Override
	public String getMessage() {
		if (msg == null) {
			return "";
		} else if (suggestion == null) {
			return msg;
		} else {
			return msg + " (" + suggestion + ")";
		}
	}

	/**
	 * Error message, without any suggestion attached.
	 *
	 * @return
	 */
	public String msg() {
		return msg;
	}

	/**
	 * The source text where the error arose, or null if not known.
	 *
	 * @return
	 */
	public String source() {
		return src;
	}

	/**
	 * Get index of first character of offending location.
	 *
	 * @return
	 */
	public int start() {
		return start;
	}

	/**
	 * Get index of last character of offending location.
	 *
	 * @return
	 */
	public int end() {
		return end;
	}

	public String suggestion() {
		return suggestion;
	}

	/**
	 * The stage of the pipeline which raised this error (e.g.
	 * <code>"parse"</code>).
	 *
	 * @return
	 */
	public abstract String stage();

	/**
	 * Output the error to a given output stream, underlining the offending
	 * region of the source text.
	 */
	public void outputSourceError(PrintStream output) {
		if (src == null || start < 0) {
			output.println(stage() + " error: " + getMessage());
		} else {
			int lineStart = 0;
			int line = 1;
			for (int i = 0; i < start && i < src.length(); ++i) {
				if (src.charAt(i) == '\n') {
					lineStart = i + 1;
					line = line + 1;
				}
			}
			int lineEnd = src.indexOf('\n', lineStart);
			if (lineEnd < 0) {
				lineEnd = src.length();
			}
			output.println("line " + line + ": " + getMessage());
			output.println(src.substring(lineStart, lineEnd));
			StringBuilder str = new StringBuilder();
			for (int i = lineStart; i < start && i < src.length(); ++i) {
				str.append(src.charAt(i) == '\t' ? '\t' : ' ');
			}
			int last = Math.max(start, Math.min(end, lineEnd - 1));
			for (int i = start; i <= last; ++i) {
				str.append('^');
			}
			output.println(str);
		}
	}

	/**
	 * Extract the start of the source region associated with a given element,
	 * or -1 if it has none.
	 *
	 * @param elem
	 * @return
	 */
	public static int startOf(SyntacticElement elem) {
		Attribute.Source attr = elem == null ? null : elem.source();
		return attr == null ? -1 : attr.start;
	}

	/**
	 * Extract the end of the source region associated with a given element, or
	 * -1 if it has none.
	 *
	 * @param elem
	 * @return
	 */
	public static int endOf(SyntacticElement elem) {
		Attribute.Source attr = elem == null ? null : elem.source();
		return attr == null ? -1 : attr.end;
	}

	public static final long serialVersionUID = 1l;
}

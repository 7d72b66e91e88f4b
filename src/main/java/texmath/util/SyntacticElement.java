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
 * Anything parsed from LaTeX source which may carry positional information
 * back into that source. Expression nodes built by the parser carry a
 * {@link Attribute.Source}; nodes built by rewriting usually carry nothing.
 *
 * @author David J. Pearce
 */
public interface SyntacticElement {

	/**
	 * Get the list of attributes associated with this syntactic element.
	 *
	 * @return
	 */
	public Attribute[] attributes();

	/**
	 * Get the first attribute of the given class type. This is useful short-hand.
	 *
	 * @param c
	 * @return
	 */
	public <T extends Attribute> T attribute(Class<T> c);

	/**
	 * Get the source range of this element, or null if it was not parsed
	 * directly from source text.
	 *
	 * @return
	 */
	public default Attribute.Source source() {
		return attribute(Attribute.Source.class);
	}

	public class Impl implements SyntacticElement {
		private static final Attribute[] NONE = new Attribute[0];

		private final Attribute[] attributes;

		public Impl(Attribute... attributes) {
			this.attributes = attributes.length == 0 ? NONE : attributes.clone();
		}

		@Override
		public Attribute[] attributes() {
			return attributes.clone();
		}

		@Override
		@SuppressWarnings("unchecked")
		public <T extends Attribute> T attribute(Class<T> c) {
			for (Attribute a : attributes) {
				if (c.isInstance(a)) {
					return (T) a;
				}
			}
			return null;
		}
	}

	/**
	 * Represents an attribute that can be associated with a syntactic element.
	 * Attributes never take part in structural equality.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Attribute {

		/**
		 * Identifies the (inclusive) range of characters in the source text
		 * from which an element was parsed.
		 */
		public static final class Source implements Attribute {

			public final int start;
			public final int end;

			public Source(int start, int end) {
				this.start = start;
				this.end = end;
			}

			/**
			 * Number of source characters covered.
			 */
			public int length() {
				return end - start + 1;
			}

			@Override
			public String toString() {
				return "@" + start + ":" + end;
			}
		}
	}
}

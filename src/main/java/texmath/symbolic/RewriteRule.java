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
package texmath.symbolic;

import java.util.function.BiFunction;

import texmath.core.Syntax.Expression;

/**
 * A single named rewrite on expressions, such as <code>x + 0 => x</code>.
 * Rules are applied to one node at a time by the {@link RuleEngine}, which
 * takes care of traversing the expression.
 *
 * @author David J. Pearce
 *
 */
public interface RewriteRule {

	public String name();

	public RuleCategory category();

	/**
	 * Check whether this rule applies to a given node under some assumptions.
	 *
	 * @param e
	 * @param assumptions
	 * @return
	 */
	public boolean matches(Expression e, Assumptions assumptions);

	/**
	 * Apply this rule to a node which it matches.
	 *
	 * @param e
	 * @param assumptions
	 * @return
	 */
	public Expression apply(Expression e, Assumptions assumptions);

	/**
	 * Construct a rule from a function which either rewrites a node, or returns
	 * null when it does not apply.
	 *
	 * @param name
	 * @param category
	 * @param rewrite
	 * @return
	 */
	public static RewriteRule of(String name, RuleCategory category,
			BiFunction<Expression, Assumptions, Expression> rewrite) {
		return new RewriteRule() {
			@Override
			public String name() {
				return name;
			}

			@Override
			public RuleCategory category() {
				return category;
			}

			@Override
			public boolean matches(Expression e, Assumptions assumptions) {
				return rewrite.apply(e, assumptions) != null;
			}

			@Override
			public Expression apply(Expression e, Assumptions assumptions) {
				Expression r = rewrite.apply(e, assumptions);
				return r == null ? e : r;
			}

			@Override
			public String toString() {
				return name;
			}
		};
	}
}

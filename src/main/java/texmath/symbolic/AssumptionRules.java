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

import static texmath.core.Terms.*;
import static texmath.symbolic.RuleCategory.IDENTITY;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import texmath.core.Syntax.Expression;
import texmath.core.Syntax.Expression.Binary;

/**
 * Rewrite rules whose validity depends on what is assumed about the variables
 * involved.
 *
 * @author David J. Pearce
 *
 */
public final class AssumptionRules {

	private AssumptionRules() {

	}

	public static final List<RewriteRule> RULES = Collections.unmodifiableList(Arrays.asList(
			// sqrt(x^2) => x when x >= 0, and |x| otherwise
			RewriteRule.of("sqrt-of-square", IDENTITY, (e, a) -> {
				if (isCall(e, "sqrt") && is(argument(e), Binary.Op.POW)) {
					Binary p = (Binary) argument(e);
					if (isNumber(p.rightOperand(), 2)) {
						Expression x = p.leftOperand();
						return a.isNonNegative(x) ? x : new Expression.Abs(x);
					}
				}
				return null;
			}),
			// |x| => x when x >= 0
			RewriteRule.of("abs-of-non-negative", IDENTITY, (e, a) -> {
				Expression x = null;
				if (e instanceof Expression.Abs) {
					x = ((Expression.Abs) e).operand();
				} else if (isCall(e, "abs")) {
					x = argument(e);
				}
				return x != null && a.isNonNegative(x) ? x : null;
			})));

	private static Expression argument(Expression e) {
		return ((Expression.Call) e).argument(0);
	}
}

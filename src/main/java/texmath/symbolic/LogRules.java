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
import static texmath.symbolic.RuleCategory.EXPANSION;
import static texmath.symbolic.RuleCategory.IDENTITY;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import texmath.core.Syntax.Expression;
import texmath.core.Syntax.Expression.Binary;

/**
 * Rewrite rules for logarithms, covering both the natural logarithm
 * <code>\ln</code> and <code>\log</code> (whose base defaults to ten).
 *
 * @author David J. Pearce
 *
 */
public final class LogRules {

	private LogRules() {

	}

	public static final List<RewriteRule> RULES = Collections.unmodifiableList(Arrays.asList(
			// ln(1) => 0
			RewriteRule.of("log-one", IDENTITY, (e, a) -> {
				return isLog(e) && isNumber(argument(e), 1) ? ZERO : null;
			}),
			// ln(e) => 1, log(10) => 1
			RewriteRule.of("log-base", IDENTITY, (e, a) -> {
				return isLog(e) && argument(e).equals(base(e)) ? ONE : null;
			}),
			// ln(e^u) => u
			RewriteRule.of("log-exp", IDENTITY, (e, a) -> {
				if (isLog(e)) {
					Expression u = argument(e);
					if (is(u, Binary.Op.POW) && ((Binary) u).leftOperand().equals(base(e))) {
						return ((Binary) u).rightOperand();
					} else if (isCall(u, "exp") && isCall(e, "ln")) {
						return ((Expression.Call) u).argument(0);
					}
				}
				return null;
			}),
			// ln(x^n) => n ln(x), provided x is positive
			RewriteRule.of("log-power", IDENTITY, (e, a) -> {
				if (isLog(e) && is(argument(e), Binary.Op.POW)) {
					Binary p = (Binary) argument(e);
					if (a.isPositive(p.leftOperand())) {
						return mul(p.rightOperand(), withArgument(e, p.leftOperand()));
					}
				}
				return null;
			}),
			// ln(ab) => ln(a) + ln(b)
			RewriteRule.of("log-product", EXPANSION, (e, a) -> {
				if (isLog(e) && is(argument(e), Binary.Op.MUL) && !((Binary) argument(e)).isCross()) {
					Binary p = (Binary) argument(e);
					return add(withArgument(e, p.leftOperand()), withArgument(e, p.rightOperand()));
				}
				return null;
			}),
			// ln(a/b) => ln(a) - ln(b)
			RewriteRule.of("log-quotient", EXPANSION, (e, a) -> {
				if (isLog(e) && is(argument(e), Binary.Op.DIV)) {
					Binary p = (Binary) argument(e);
					return sub(withArgument(e, p.leftOperand()), withArgument(e, p.rightOperand()));
				}
				return null;
			})));

	private static boolean isLog(Expression e) {
		if (e instanceof Expression.Call) {
			Expression.Call c = (Expression.Call) e;
			return c.size() == 1 && c.parameter() == null
					&& (c.name().equals("log") || c.name().equals("ln") && c.base() == null);
		}
		return false;
	}

	private static Expression argument(Expression e) {
		return ((Expression.Call) e).argument(0);
	}

	/**
	 * Get the base of a logarithm, which is either given explicitly or implied
	 * by its name.
	 */
	private static Expression base(Expression e) {
		Expression.Call c = (Expression.Call) e;
		if (c.base() != null) {
			return c.base();
		}
		return c.name().equals("ln") ? var("e") : num(10);
	}

	private static Expression withArgument(Expression e, Expression argument) {
		Expression.Call c = (Expression.Call) e;
		return new Expression.Call(c.name(), Collections.singletonList(argument), c.base(), null);
	}
}

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
 * Rewrite rules for trigonometric identities. The double and half angle
 * formulae are expansions, and so only apply when expanding.
 *
 * @author David J. Pearce
 *
 */
public final class TrigRules {

	private TrigRules() {

	}

	public static final List<RewriteRule> RULES = Collections.unmodifiableList(Arrays.asList(
			// sin^2 u + cos^2 u => 1
			RewriteRule.of("pythagorean", IDENTITY, (e, a) -> {
				if (!is(e, Binary.Op.ADD)) {
					return null;
				}
				Binary b = (Binary) e;
				if (isPythagorean(b.leftOperand(), b.rightOperand())) {
					return ONE;
				} else if (is(b.rightOperand(), Binary.Op.ADD)) {
					// sin^2 u + (cos^2 u + r) => 1 + r
					Binary r = (Binary) b.rightOperand();
					if (isPythagorean(b.leftOperand(), r.leftOperand())) {
						return add(ONE, r.rightOperand());
					}
				}
				return null;
			}),
			// sin(-u) => -sin(u)
			RewriteRule.of("sin-odd", IDENTITY, (e, a) -> {
				return isCall(e, "sin") && isNegated(argument(e)) ? neg(call("sin", negated(argument(e)))) : null;
			}),
			// cos(-u) => cos(u)
			RewriteRule.of("cos-even", IDENTITY, (e, a) -> {
				return isCall(e, "cos") && isNegated(argument(e)) ? call("cos", negated(argument(e))) : null;
			}),
			// tan(-u) => -tan(u)
			RewriteRule.of("tan-odd", IDENTITY, (e, a) -> {
				return isCall(e, "tan") && isNegated(argument(e)) ? neg(call("tan", negated(argument(e)))) : null;
			}),
			// sin(0) => 0, cos(0) => 1, tan(0) => 0
			RewriteRule.of("trig-zero", IDENTITY, (e, a) -> {
				if (isCall(e, "sin") || isCall(e, "tan")) {
					return isNumber(argument(e), 0) ? ZERO : null;
				} else if (isCall(e, "cos")) {
					return isNumber(argument(e), 0) ? ONE : null;
				}
				return null;
			}),
			// sin(2u) => 2 sin(u) cos(u)
			RewriteRule.of("sin-double-angle", EXPANSION, (e, a) -> {
				Expression u = isCall(e, "sin") ? half(argument(e)) : null;
				return u == null ? null : mul(mul(TWO, call("sin", u)), call("cos", u));
			}),
			// cos(2u) => cos^2 u - sin^2 u
			RewriteRule.of("cos-double-angle", EXPANSION, (e, a) -> {
				Expression u = isCall(e, "cos") ? half(argument(e)) : null;
				return u == null ? null : sub(pow(call("cos", u), TWO), pow(call("sin", u), TWO));
			}),
			// sin^2(u/2) => (1 - cos u) / 2
			RewriteRule.of("sin-half-angle", EXPANSION, (e, a) -> {
				Expression u = halfAngleSquare(e, "sin");
				return u == null ? null : div(sub(ONE, call("cos", u)), TWO);
			}),
			// cos^2(u/2) => (1 + cos u) / 2
			RewriteRule.of("cos-half-angle", EXPANSION, (e, a) -> {
				Expression u = halfAngleSquare(e, "cos");
				return u == null ? null : div(add(ONE, call("cos", u)), TWO);
			})));

	private static boolean isPythagorean(Expression l, Expression r) {
		Expression sl = squareOf(l, "sin");
		Expression cl = squareOf(l, "cos");
		if (sl != null) {
			return sl.equals(squareOf(r, "cos"));
		} else if (cl != null) {
			return cl.equals(squareOf(r, "sin"));
		}
		return false;
	}

	/**
	 * Match <code>f(u)^2</code> for a given function <code>f</code>, returning
	 * <code>u</code>.
	 */
	private static Expression squareOf(Expression e, String f) {
		if (is(e, Binary.Op.POW)) {
			Binary b = (Binary) e;
			if (isCall(b.leftOperand(), f) && isNumber(b.rightOperand(), 2)) {
				return argument(b.leftOperand());
			}
		}
		return null;
	}

	private static Expression halfAngleSquare(Expression e, String f) {
		Expression v = squareOf(e, f);
		if (v == null) {
			return null;
		} else if (is(v, Binary.Op.DIV) && isNumber(((Binary) v).rightOperand(), 2)) {
			return ((Binary) v).leftOperand();
		} else if (is(v, Binary.Op.MUL) && isNumber(((Binary) v).leftOperand(), 0.5)) {
			return ((Binary) v).rightOperand();
		}
		return null;
	}

	/**
	 * Match <code>2u</code> (or <code>u \cdot 2</code>), returning
	 * <code>u</code>.
	 */
	private static Expression half(Expression e) {
		if (is(e, Binary.Op.MUL) && !((Binary) e).isCross()) {
			Binary b = (Binary) e;
			if (isNumber(b.leftOperand(), 2)) {
				return b.rightOperand();
			} else if (isNumber(b.rightOperand(), 2)) {
				return b.leftOperand();
			}
		}
		return null;
	}

	private static Expression argument(Expression call) {
		return ((Expression.Call) call).argument(0);
	}

	private static boolean isNegated(Expression e) {
		return e instanceof Expression.Negation || (isNumber(e) && numberValue(e) < 0);
	}

	private static Expression negated(Expression e) {
		return e instanceof Expression.Negation ? ((Expression.Negation) e).operand() : num(-numberValue(e));
	}
}

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
import static texmath.symbolic.RuleCategory.NORMALIZATION;
import static texmath.symbolic.RuleCategory.SIMPLIFICATION;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import texmath.core.Syntax.Expression;
import texmath.core.Syntax.Expression.Binary;

/**
 * Rewrite rules for elementary arithmetic, such as removing identities and
 * folding operations on numbers.
 *
 * @author David J. Pearce
 *
 */
public final class ArithmeticRules {

	private ArithmeticRules() {

	}

	public static final List<RewriteRule> RULES = Collections.unmodifiableList(Arrays.asList(
			// a + (-b) => a - b
			RewriteRule.of("add-negation", NORMALIZATION, (e, a) -> {
				if (is(e, Binary.Op.ADD) && right(e) instanceof Expression.Negation) {
					return sub(left(e), ((Expression.Negation) right(e)).operand());
				}
				return null;
			}),
			// a - (-b) => a + b
			RewriteRule.of("subtract-negation", NORMALIZATION, (e, a) -> {
				if (is(e, Binary.Op.SUB) && right(e) instanceof Expression.Negation) {
					return add(left(e), ((Expression.Negation) right(e)).operand());
				}
				return null;
			}),
			RewriteRule.of("constant-folding", SIMPLIFICATION, (e, a) -> {
				if (e instanceof Binary && isNumber(left(e)) && isNumber(right(e)) && !((Binary) e).isCross()) {
					return fold(((Binary) e).op(), numberValue(left(e)), numberValue(right(e)));
				} else if (e instanceof Expression.Negation
						&& ((Expression.Negation) e).operand() instanceof Expression.Literal) {
					return num(numberValue(e));
				}
				return null;
			}),
			// 0 + x => x, x + 0 => x
			RewriteRule.of("add-zero", SIMPLIFICATION, (e, a) -> {
				if (is(e, Binary.Op.ADD)) {
					if (isNumber(left(e), 0)) {
						return right(e);
					} else if (isNumber(right(e), 0)) {
						return left(e);
					}
				}
				return null;
			}),
			// x - 0 => x
			RewriteRule.of("subtract-zero", SIMPLIFICATION, (e, a) -> {
				return is(e, Binary.Op.SUB) && isNumber(right(e), 0) ? left(e) : null;
			}),
			// 0 - x => -x
			RewriteRule.of("zero-subtract", SIMPLIFICATION, (e, a) -> {
				return is(e, Binary.Op.SUB) && isNumber(left(e), 0) ? neg(right(e)) : null;
			}),
			// x * 1 => x, 1 * x => x
			RewriteRule.of("multiply-one", SIMPLIFICATION, (e, a) -> {
				if (isScalarProduct(e)) {
					if (isNumber(left(e), 1)) {
						return right(e);
					} else if (isNumber(right(e), 1)) {
						return left(e);
					}
				}
				return null;
			}),
			// x * 0 => 0, 0 * x => 0
			RewriteRule.of("multiply-zero", SIMPLIFICATION, (e, a) -> {
				return isScalarProduct(e) && (isNumber(left(e), 0) || isNumber(right(e), 0)) ? ZERO : null;
			}),
			// -1 * x => -x
			RewriteRule.of("multiply-minus-one", SIMPLIFICATION, (e, a) -> {
				if (isScalarProduct(e)) {
					if (isNumber(left(e), -1)) {
						return neg(right(e));
					} else if (isNumber(right(e), -1)) {
						return neg(left(e));
					}
				}
				return null;
			}),
			// x / 1 => x
			RewriteRule.of("divide-one", SIMPLIFICATION, (e, a) -> {
				return is(e, Binary.Op.DIV) && isNumber(right(e), 1) ? left(e) : null;
			}),
			// 0 / x => 0, provided x is not zero
			RewriteRule.of("zero-divide", SIMPLIFICATION, (e, a) -> {
				return is(e, Binary.Op.DIV) && isNumber(left(e), 0) && !isNumber(right(e), 0) ? ZERO : null;
			}),
			// x - x => 0
			RewriteRule.of("subtract-self", SIMPLIFICATION, (e, a) -> {
				return is(e, Binary.Op.SUB) && left(e).equals(right(e)) ? ZERO : null;
			}),
			// x / x => 1, provided x is not zero
			RewriteRule.of("divide-self", SIMPLIFICATION, (e, a) -> {
				return is(e, Binary.Op.DIV) && left(e).equals(right(e)) && !isNumber(right(e), 0) ? ONE : null;
			}),
			// x^0 => 1
			RewriteRule.of("power-zero", SIMPLIFICATION, (e, a) -> {
				return is(e, Binary.Op.POW) && isNumber(right(e), 0) ? ONE : null;
			}),
			// x^1 => x
			RewriteRule.of("power-one", SIMPLIFICATION, (e, a) -> {
				return is(e, Binary.Op.POW) && isNumber(right(e), 1) ? left(e) : null;
			}),
			// 1^x => 1
			RewriteRule.of("one-power", SIMPLIFICATION, (e, a) -> {
				return is(e, Binary.Op.POW) && isNumber(left(e), 1) ? ONE : null;
			}),
			// 0^x => 0, provided x is a positive number
			RewriteRule.of("zero-power", SIMPLIFICATION, (e, a) -> {
				if (is(e, Binary.Op.POW) && isNumber(left(e), 0) && isNumber(right(e))) {
					return numberValue(right(e)) > 0 ? ZERO : null;
				}
				return null;
			}),
			// (x^a)^b => x^(a*b), provided x is non-negative or both exponents
			// are integers. For even a, (x^a)^b => |x|^(a*b) instead.
			RewriteRule.of("power-power", SIMPLIFICATION, (e, a) -> {
				if (is(e, Binary.Op.POW) && is(left(e), Binary.Op.POW)) {
					Expression inner = left(e);
					Expression base = left(inner);
					Expression exponent = mul(right(inner), right(e));
					if (isNumber(right(inner)) && isNumber(right(e))) {
						exponent = num(numberValue(right(inner)) * numberValue(right(e)));
					}
					if (a.isNonNegative(base) || isInteger(right(inner)) && isInteger(right(e))) {
						return pow(base, exponent);
					} else if (isInteger(right(inner)) && numberValue(right(inner)) % 2 == 0) {
						return pow(new Expression.Abs(base), exponent);
					}
				}
				return null;
			}),
			// (-x)^n => x^n for even n, and -(x^n) for odd n
			RewriteRule.of("power-of-negation", SIMPLIFICATION, (e, a) -> {
				if (is(e, Binary.Op.POW) && left(e) instanceof Expression.Negation && isInteger(right(e))) {
					Expression p = pow(((Expression.Negation) left(e)).operand(), right(e));
					return numberValue(right(e)) % 2 == 0 ? p : neg(p);
				}
				return null;
			}),
			// --x => x
			RewriteRule.of("double-negation", SIMPLIFICATION, (e, a) -> {
				if (e instanceof Expression.Negation) {
					Expression operand = ((Expression.Negation) e).operand();
					if (operand instanceof Expression.Negation) {
						return ((Expression.Negation) operand).operand();
					}
				}
				return null;
			}),
			// x + x => 2x
			RewriteRule.of("add-self", SIMPLIFICATION, (e, a) -> {
				return is(e, Binary.Op.ADD) && left(e).equals(right(e)) ? mul(TWO, left(e)) : null;
			}),
			// x * x => x^2
			RewriteRule.of("multiply-self", SIMPLIFICATION, (e, a) -> {
				return isScalarProduct(e) && left(e).equals(right(e)) ? pow(left(e), TWO) : null;
			}),
			// ax + bx => (a+b)x
			RewriteRule.of("combine-like-terms", SIMPLIFICATION, (e, a) -> {
				if (is(e, Binary.Op.ADD) || is(e, Binary.Op.SUB)) {
					Expression l = left(e);
					Expression r = right(e);
					Expression lc = core(l);
					Expression rc = core(r);
					if (lc != null && lc.equals(rc)) {
						double c = is(e, Binary.Op.ADD) ? coefficient(l) + coefficient(r)
								: coefficient(l) - coefficient(r);
						return mul(num(c), lc);
					}
				}
				return null;
			})));

	private static Expression left(Expression e) {
		return ((Binary) e).leftOperand();
	}

	private static Expression right(Expression e) {
		return ((Binary) e).rightOperand();
	}

	private static boolean isScalarProduct(Expression e) {
		return is(e, Binary.Op.MUL) && !((Binary) e).isCross();
	}

	/**
	 * Get the symbolic part of a term <code>c * x</code>, or null for a number.
	 */
	private static Expression core(Expression e) {
		if (isNumber(e)) {
			return null;
		} else if (isScalarProduct(e) && isNumber(left(e))) {
			return right(e);
		}
		return e;
	}

	private static double coefficient(Expression e) {
		return isScalarProduct(e) && isNumber(left(e)) ? numberValue(left(e)) : 1;
	}
}

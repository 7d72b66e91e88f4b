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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import texmath.core.Functions;
import texmath.core.Syntax.Expression;
import texmath.core.Syntax.Expression.Binary;
import texmath.util.EvaluatorException;
import texmath.util.Trace;

/**
 * Operations on polynomials: expanding products and integer powers of sums,
 * and factoring a few common forms. Factoring works on the collected terms of
 * a sum, so it expects a normalised expression.
 *
 * @author David J. Pearce
 *
 */
public class PolynomialOperations {
	/**
	 * Largest power of a sum which will be expanded.
	 */
	public static final int MAX_BINOMIAL_POWER = 10;
	/**
	 * Bound on the integer roots tried when factoring a quadratic.
	 */
	public static final int ROOT_BOUND = 100;

	private final Normalizer normalizer;
	private final int maxDepth;

	public PolynomialOperations(Normalizer normalizer, int maxDepth) {
		this.normalizer = normalizer;
		this.maxDepth = maxDepth;
	}

	/**
	 * Rules for multiplying out products and powers of sums.
	 *
	 * @return
	 */
	public List<RewriteRule> expansionRules() {
		return Collections.unmodifiableList(Arrays.asList(
				RewriteRule.of("binomial-expansion", EXPANSION, (e, a) -> expandBinomial(e)),
				RewriteRule.of("distribute", EXPANSION, (e, a) -> distribute(e))));
	}

	/**
	 * Factor every sum within an expression which is a difference of squares
	 * or a monic quadratic. Sums are factored from the outside in, and the
	 * trailing part of a sum is never factored on its own. Thus, in
	 * <code>6 + (5x + x^2)</code> the inner sum is left alone.
	 *
	 * @param e
	 * @return
	 */
	public Expression factor(Expression e) {
		return factor(e, null, false, 0);
	}

	/**
	 * Factor an expression as for {@link #factor(Expression)}, adding each
	 * factorisation made to the given list of steps (unless it is null).
	 *
	 * @param e
	 * @param steps
	 * @return
	 */
	public Expression factor(Expression e, List<Trace.Step> steps) {
		return factor(e, steps, false, 0);
	}

	private Expression factor(Expression e, List<Trace.Step> steps, boolean trailing, int depth) {
		if (depth > maxDepth) {
			throw new EvaluatorException("maximum recursion depth of " + maxDepth + " exceeded", e);
		}
		if (!trailing) {
			String rule = "difference-of-squares";
			Expression r = differenceOfSquares(e);
			if (r == null) {
				rule = "factor-quadratic";
				r = factorQuadratic(e);
			}
			if (r != null) {
				if (steps != null) {
					steps.add(new Trace.Step(rule, e, r));
				}
				return r;
			}
		}
		List<Expression> children = e.children();
		if (children.isEmpty()) {
			return e;
		}
		ArrayList<Expression> nchildren = new ArrayList<>();
		boolean changed = false;
		for (Expression child : children) {
			Expression nchild = factor(child, steps, isSum(e) && isSum(child), depth + 1);
			changed |= nchild != child;
			nchildren.add(nchild);
		}
		return changed ? e.withChildren(nchildren) : e;
	}

	/**
	 * Expand <code>(a + b)^n</code> using the binomial theorem, for an integer
	 * <code>n</code> between zero and the maximum power.
	 *
	 * @param e
	 * @return The expansion, or null if not applicable.
	 */
	public Expression expandBinomial(Expression e) {
		if (!is(e, Binary.Op.POW)) {
			return null;
		}
		Binary p = (Binary) e;
		Expression s = p.leftOperand();
		Expression n = p.rightOperand();
		if (!isSum(s) || !isInteger(n) || numberValue(n) < 0 || numberValue(n) > MAX_BINOMIAL_POWER) {
			return null;
		}
		int k = (int) numberValue(n);
		if (k == 0) {
			return ONE;
		} else if (k == 1) {
			return s;
		}
		Binary b = (Binary) s;
		Expression x = b.leftOperand();
		Expression y = b.op() == Binary.Op.ADD ? b.rightOperand() : neg(b.rightOperand());
		Expression result = null;
		for (int i = 0; i <= k; ++i) {
			double c = Functions.binomial(k, i);
			Expression term = mul(num(c), mul(pow(x, num(k - i)), pow(y, num(i))));
			result = result == null ? term : add(result, term);
		}
		return result;
	}

	/**
	 * Distribute a product over a sum, as in <code>a(b + c) => ab + ac</code>.
	 *
	 * @param e
	 * @return The distributed form, or null if not applicable.
	 */
	public Expression distribute(Expression e) {
		if (!is(e, Binary.Op.MUL) || ((Binary) e).isCross()) {
			return null;
		}
		Binary m = (Binary) e;
		Expression l = m.leftOperand();
		Expression r = m.rightOperand();
		if (isSum(r)) {
			Binary s = (Binary) r;
			return new Binary(s.op(), mul(l, s.leftOperand()), mul(l, s.rightOperand()));
		} else if (isSum(l)) {
			Binary s = (Binary) l;
			return new Binary(s.op(), mul(s.leftOperand(), r), mul(s.rightOperand(), r));
		}
		return null;
	}

	/**
	 * Factor <code>a^2 - b^2</code> as <code>(a - b)(a + b)</code>, where
	 * <code>b</code> may also be a perfect square number.
	 *
	 * @param e
	 * @return The factored form, or null if not applicable.
	 */
	public Expression differenceOfSquares(Expression e) {
		if (!isSum(e)) {
			return null;
		}
		List<Normalizer.Term> terms = normalizer.terms(e);
		if (terms.size() != 2) {
			return null;
		}
		Expression a = null;
		Expression b = null;
		for (Normalizer.Term t : terms) {
			Expression root = squareRoot(t);
			if (root == null) {
				return null;
			} else if (t.coefficient() > 0) {
				a = root;
			} else {
				b = root;
			}
		}
		if (a == null || b == null) {
			return null;
		}
		return mul(sub(a, b), add(a, b));
	}

	private static Expression squareRoot(Normalizer.Term t) {
		double c = Math.abs(t.coefficient());
		if (t.core() == null) {
			double r = Math.sqrt(c);
			return r == Math.rint(r) ? num(r) : null;
		} else if (c == 1 && is(t.core(), Binary.Op.POW)) {
			Binary p = (Binary) t.core();
			return isNumber(p.rightOperand(), 2) ? p.leftOperand() : null;
		}
		return null;
	}

	/**
	 * Factor a monic quadratic <code>x^2 + bx + c</code> with integer
	 * coefficients as <code>(x + p)(x + q)</code>, provided suitable integers
	 * <code>p</code> and <code>q</code> exist within the root bound.
	 *
	 * @param e
	 * @return The factored form, or null if not applicable.
	 */
	public Expression factorQuadratic(Expression e) {
		if (!isSum(e)) {
			return null;
		}
		String x = null;
		double[] coefficients = new double[3];
		for (Normalizer.Term t : normalizer.terms(e)) {
			Expression core = t.core();
			int degree;
			Expression v;
			if (core == null) {
				degree = 0;
				v = null;
			} else if (core instanceof Expression.Variable) {
				degree = 1;
				v = core;
			} else if (is(core, Binary.Op.POW) && ((Binary) core).leftOperand() instanceof Expression.Variable
					&& isNumber(((Binary) core).rightOperand(), 2)) {
				degree = 2;
				v = ((Binary) core).leftOperand();
			} else {
				return null;
			}
			if (v != null) {
				String name = ((Expression.Variable) v).name();
				if (x != null && !x.equals(name)) {
					return null;
				}
				x = name;
			}
			coefficients[degree] = t.coefficient();
		}
		double b = coefficients[1];
		double c = coefficients[0];
		if (x == null || coefficients[2] != 1 || b != Math.rint(b) || c != Math.rint(c)) {
			return null;
		}
		for (int p = -ROOT_BOUND; p <= ROOT_BOUND; ++p) {
			double q = b - p;
			if (p <= q && Math.abs(q) <= ROOT_BOUND && p * q == c) {
				return mul(linear(x, p), linear(x, q));
			}
		}
		return null;
	}

	private static Expression linear(String x, double p) {
		if (p == 0) {
			return var(x);
		} else if (p > 0) {
			return add(var(x), num(p));
		}
		return sub(var(x), num(-p));
	}

	private static boolean isSum(Expression e) {
		return is(e, Binary.Op.ADD) || is(e, Binary.Op.SUB);
	}
}

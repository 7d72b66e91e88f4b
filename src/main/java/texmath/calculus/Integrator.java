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
package texmath.calculus;

import static texmath.core.Terms.*;

import java.util.ArrayList;

import texmath.core.Syntax;
import texmath.core.Syntax.Expression;
import texmath.core.Syntax.Expression.Binary;
import texmath.core.Syntax.Expression.Piecewise;
import texmath.util.EvaluatorException;
import texmath.util.Pair;

/**
 * Constructs antiderivatives for a limited family of integrands: linear
 * combinations of constants, powers of the variable, and exponentials and
 * sinusoids of linear arguments. An integrand outside this family is left as
 * an unresolved integral.
 *
 * @author David J. Pearce
 *
 */
public class Integrator {
	public static final int DEFAULT_MAX_DEPTH = 500;

	private final int maxDepth;
	private final Differentiator tidier;

	public Integrator() {
		this(DEFAULT_MAX_DEPTH);
	}

	public Integrator(int maxDepth) {
		this.maxDepth = maxDepth;
		this.tidier = new Differentiator(maxDepth);
	}

	/**
	 * Construct an antiderivative of a given expression with respect to a
	 * given variable (taking the constant of integration as zero).
	 *
	 * @param body
	 * @param variable
	 * @return The antiderivative, or an indefinite integral node when none
	 *         could be found.
	 */
	public Expression integrate(Expression body, String variable) {
		Expression r = antiderivative(body, variable, 0);
		return r == null ? new Expression.Integral(body, variable) : tidier.cleanup(r);
	}

	/**
	 * Resolve an integral node. An indefinite integral resolves to its
	 * antiderivative, and a definite integral to the difference of its
	 * antiderivative at the upper and lower bounds. When no antiderivative
	 * can be found, the node is returned unchanged.
	 *
	 * @param integral
	 * @return
	 */
	public Expression integrate(Expression.Integral integral) {
		String x = integral.variable();
		Expression F = antiderivative(integral.body(), x, 0);
		if (F == null || integral.isClosed()) {
			return integral;
		} else if (!integral.isDefinite()) {
			return tidier.cleanup(F);
		}
		Expression upper = Syntax.substitute(F, x, integral.upper());
		Expression lower = Syntax.substitute(F, x, integral.lower());
		return tidier.cleanup(sub(upper, lower));
	}

	private Expression antiderivative(Expression e, String x, int depth) {
		if (depth > maxDepth) {
			throw new EvaluatorException("maximum recursion depth of " + maxDepth + " exceeded", e);
		}
		int next = depth + 1;
		if (e instanceof Piecewise) {
			ArrayList<Piecewise.Case> cases = new ArrayList<>();
			for (Piecewise.Case c : ((Piecewise) e).cases()) {
				Expression F = antiderivative(c.body(), x, next);
				if (F == null) {
					return null;
				}
				cases.add(new Piecewise.Case(F, c.guard()));
			}
			return new Piecewise(cases);
		} else if (e instanceof Expression.Conditional) {
			Expression.Conditional c = (Expression.Conditional) e;
			Expression F = antiderivative(c.body(), x, next);
			return F == null ? null : new Expression.Conditional(F, c.guard());
		} else if (isConstant(e, x)) {
			// c => c*x
			return mul(e, var(x));
		} else if (e instanceof Expression.Negation) {
			Expression F = antiderivative(((Expression.Negation) e).operand(), x, next);
			return F == null ? null : neg(F);
		} else if (e instanceof Expression.Variable) {
			// x => x^2 / 2
			return div(pow(e, TWO), TWO);
		} else if (e instanceof Binary) {
			return antiderivative((Binary) e, x, next);
		} else if (e instanceof Expression.Call) {
			return antiderivative((Expression.Call) e, x);
		}
		return null;
	}

	private Expression antiderivative(Binary e, String x, int depth) {
		Expression l = e.leftOperand();
		Expression r = e.rightOperand();
		switch (e.op()) {
		case ADD:
		case SUB: {
			// Linearity
			Expression Fl = antiderivative(l, x, depth);
			Expression Fr = antiderivative(r, x, depth);
			if (Fl == null || Fr == null) {
				return null;
			}
			return e.op() == Binary.Op.ADD ? add(Fl, Fr) : sub(Fl, Fr);
		}
		case MUL:
			if (isConstant(l, x)) {
				Expression F = antiderivative(r, x, depth);
				return F == null ? null : mul(l, F);
			} else if (isConstant(r, x)) {
				Expression F = antiderivative(l, x, depth);
				return F == null ? null : mul(F, r);
			}
			return null;
		case DIV:
			if (isConstant(r, x)) {
				Expression F = antiderivative(l, x, depth);
				return F == null ? null : div(F, r);
			} else if (isConstant(l, x)) {
				// c / x => c * ln|x|, and c / x^n => c * x^(1-n) / (1-n)
				Expression reciprocal;
				if (isVariable(r, x)) {
					reciprocal = pow(r, num(-1));
				} else if (is(r, Binary.Op.POW)) {
					Binary p = (Binary) r;
					reciprocal = pow(p.leftOperand(), negate(p.rightOperand()));
				} else {
					return null;
				}
				Expression F = antiderivative(reciprocal, x, depth);
				return F == null ? null : isNumber(l, 1) ? F : mul(l, F);
			}
			return null;
		case POW:
			return power(e, l, r, x);
		default:
			return null;
		}
	}

	private Expression power(Binary e, Expression base, Expression exponent, String x) {
		if (isVariable(base, x) && isConstant(exponent, x)) {
			if (isNumber(exponent, -1)) {
				// x^-1 => ln|x|
				return call("ln", new Expression.Abs(base));
			}
			// x^n => x^(n+1) / (n+1)
			Expression n1 = isNumber(exponent) ? num(numberValue(exponent) + 1) : add(exponent, ONE);
			return div(pow(base, n1), n1);
		} else if (isConstant(base, x)) {
			Pair<Expression, Expression> linear = linear(exponent, x);
			if (linear == null) {
				return null;
			} else if (isVariable(base, "e")) {
				// e^(ax+b) => e^(ax+b) / a
				return divide(e, linear.first());
			}
			// c^(ax+b) => c^(ax+b) / (a * ln c)
			return div(e, mul(linear.first(), call("ln", base)));
		}
		return null;
	}

	private Expression antiderivative(Expression.Call e, String x) {
		if (e.size() != 1 || e.base() != null || e.parameter() != null) {
			return null;
		}
		Pair<Expression, Expression> linear = linear(e.argument(0), x);
		if (linear == null) {
			return null;
		}
		Expression u = e.argument(0);
		switch (e.name()) {
		case "exp":
			return divide(e, linear.first());
		case "sin":
			return divide(neg(call("cos", u)), linear.first());
		case "cos":
			return divide(call("sin", u), linear.first());
		default:
			return null;
		}
	}

	private static Expression divide(Expression e, Expression a) {
		return isNumber(a, 1) ? e : div(e, a);
	}

	private static Expression negate(Expression e) {
		return isNumber(e) ? num(-numberValue(e)) : neg(e);
	}

	/**
	 * Extract the coefficients <code>(a, b)</code> of an expression which is
	 * linear in a given variable, meaning it has the form <code>a*x + b</code>
	 * for some non-zero <code>a</code>.
	 *
	 * @param e
	 * @param x
	 * @return The coefficients, or null if the expression is not linear.
	 */
	public Pair<Expression, Expression> linear(Expression e, String x) {
		Pair<Expression, Expression> p = coefficients(e, x);
		if (p == null) {
			return null;
		}
		Expression a = tidier.cleanup(p.first());
		if (isNumber(a, 0)) {
			return null;
		}
		return new Pair<>(a, tidier.cleanup(p.second()));
	}

	private static Pair<Expression, Expression> coefficients(Expression e, String x) {
		if (isConstant(e, x)) {
			return new Pair<>(ZERO, e);
		} else if (isVariable(e, x)) {
			return new Pair<>(ONE, ZERO);
		} else if (e instanceof Expression.Negation) {
			Pair<Expression, Expression> p = coefficients(((Expression.Negation) e).operand(), x);
			return p == null ? null : new Pair<>(neg(p.first()), neg(p.second()));
		} else if (!(e instanceof Binary)) {
			return null;
		}
		Binary b = (Binary) e;
		Expression l = b.leftOperand();
		Expression r = b.rightOperand();
		switch (b.op()) {
		case ADD:
		case SUB: {
			Pair<Expression, Expression> pl = coefficients(l, x);
			Pair<Expression, Expression> pr = coefficients(r, x);
			if (pl == null || pr == null) {
				return null;
			} else if (b.op() == Binary.Op.ADD) {
				return new Pair<>(add(pl.first(), pr.first()), add(pl.second(), pr.second()));
			}
			return new Pair<>(sub(pl.first(), pr.first()), sub(pl.second(), pr.second()));
		}
		case MUL:
			if (isConstant(l, x)) {
				Pair<Expression, Expression> p = coefficients(r, x);
				return p == null ? null : new Pair<>(mul(l, p.first()), mul(l, p.second()));
			} else if (isConstant(r, x)) {
				Pair<Expression, Expression> p = coefficients(l, x);
				return p == null ? null : new Pair<>(mul(p.first(), r), mul(p.second(), r));
			}
			return null;
		case DIV:
			if (isConstant(r, x)) {
				Pair<Expression, Expression> p = coefficients(l, x);
				return p == null ? null : new Pair<>(div(p.first(), r), div(p.second(), r));
			}
			return null;
		default:
			return null;
		}
	}

	private static boolean isVariable(Expression e, String name) {
		return e instanceof Expression.Variable && ((Expression.Variable) e).name().equals(name);
	}
}

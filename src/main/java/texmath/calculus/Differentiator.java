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
import java.util.List;

import texmath.core.Syntax.Expression;
import texmath.core.Syntax.Expression.Binary;
import texmath.core.Syntax.Expression.Piecewise;
import texmath.util.AbstractTransformer;
import texmath.util.EvaluatorException;
import texmath.util.Trace;

/**
 * Computes symbolic derivatives. The result of differentiation is tidied by a
 * small fixed set of cleanups (such as removing multiplication by one), but is
 * otherwise not simplified.
 *
 * @author David J. Pearce
 *
 */
public class Differentiator {
	public static final int MAX_ORDER = 10;
	public static final int DEFAULT_MAX_DEPTH = 500;

	private final int maxDepth;

	public Differentiator() {
		this(DEFAULT_MAX_DEPTH);
	}

	public Differentiator(int maxDepth) {
		this.maxDepth = maxDepth;
	}

	public Expression differentiate(Expression e, String variable) {
		return differentiate(e, variable, 1);
	}

	/**
	 * Differentiate an expression with respect to a given variable a given
	 * number of times.
	 *
	 * @param e
	 * @param variable
	 * @param order    Between 1 and 10 inclusive
	 * @return
	 */
	public Expression differentiate(Expression e, String variable, int order) {
		return differentiate(e, variable, order, null);
	}

	/**
	 * Differentiate an expression as for
	 * {@link #differentiate(Expression, String, int)}, recording the rule used
	 * at each subexpression. Steps are listed innermost first.
	 *
	 * @param e
	 * @param variable
	 * @param order
	 * @return
	 */
	public Trace differentiateWithSteps(Expression e, String variable, int order) {
		ArrayList<Trace.Step> steps = new ArrayList<>();
		Expression r = differentiate(e, variable, order, steps);
		return new Trace(r, steps);
	}

	private Expression differentiate(Expression e, String variable, int order, List<Trace.Step> steps) {
		if (order < 1 || order > MAX_ORDER) {
			throw new EvaluatorException("derivative order must be between 1 and " + MAX_ORDER + ", found " + order);
		}
		Rules rules = new Rules(variable, steps);
		for (int i = 0; i != order; ++i) {
			Expression raw = rules.apply(0, e);
			e = cleanup(raw, 0);
			if (steps != null && !e.equals(raw)) {
				steps.add(new Trace.Step("cleanup", raw, e));
			}
		}
		return e;
	}

	/**
	 * Apply the differentiation rules for a fixed variable. Any subexpression
	 * in which the variable does not occur has derivative zero.
	 */
	private final class Rules extends AbstractTransformer<Integer, Expression> {
		private final String variable;
		private final List<Trace.Step> steps;

		public Rules(String variable, List<Trace.Step> steps) {
			this.variable = variable;
			this.steps = steps;
		}

		@Override
		public Expression apply(Integer depth, Expression e) {
			checkDepth(depth, e);
			Expression r = isConstant(e, variable) ? ZERO : super.apply(depth, e);
			if (steps != null) {
				steps.add(new Trace.Step(ruleOf(e), new Expression.Derivative(e, variable, 1), r));
			}
			return r;
		}

		/**
		 * Name the rule by which a given expression is differentiated.
		 */
		private String ruleOf(Expression e) {
			if (isConstant(e, variable)) {
				return "constant-rule";
			} else if (e instanceof Expression.Binary) {
				switch (((Expression.Binary) e).op()) {
				case ADD:
					return "sum-rule";
				case SUB:
					return "difference-rule";
				case MUL:
					return "product-rule";
				case DIV:
					return isConstant(((Expression.Binary) e).rightOperand(), variable) ? "constant-multiple-rule"
							: "quotient-rule";
				default:
					return "power-rule";
				}
			} else if (e instanceof Expression.Variable) {
				return "identity-rule";
			} else if (e instanceof Expression.Negation) {
				return "constant-multiple-rule";
			} else if (e instanceof Expression.Call || e instanceof Expression.Abs) {
				return "chain-rule";
			}
			return "derivative";
		}

		private Expression d(Integer depth, Expression e) {
			return apply(depth + 1, e);
		}

		@Override
		public Expression apply(Integer depth, Expression.Literal e) {
			return ZERO;
		}

		@Override
		public Expression apply(Integer depth, Expression.Variable e) {
			return e.name().equals(variable) ? ONE : ZERO;
		}

		@Override
		public Expression apply(Integer depth, Expression.Binary e) {
			Expression f = e.leftOperand();
			Expression g = e.rightOperand();
			switch (e.op()) {
			case ADD:
				return add(d(depth, f), d(depth, g));
			case SUB:
				return sub(d(depth, f), d(depth, g));
			case MUL:
				// Product rule
				return add(mul(d(depth, f), g), mul(f, d(depth, g)));
			case DIV:
				if (isConstant(g, variable)) {
					return div(d(depth, f), g);
				}
				// Quotient rule
				return div(sub(mul(d(depth, f), g), mul(f, d(depth, g))), pow(g, TWO));
			default:
				return power(depth, e, f, g);
			}
		}

		private Expression power(Integer depth, Expression e, Expression f, Expression g) {
			if (isConstant(g, variable)) {
				// n * f^(n-1) * f'
				Expression n1 = isNumber(g) ? num(numberValue(g) - 1) : sub(g, ONE);
				return mul(mul(g, pow(f, n1)), d(depth, f));
			} else if (isConstant(f, variable)) {
				// a^g * ln(a) * g'
				boolean euler = f instanceof Expression.Variable && ((Expression.Variable) f).name().equals("e");
				Expression ln = euler ? ONE : call("ln", f);
				return mul(mul(e, ln), d(depth, g));
			} else {
				// f^g * (g' * ln(f) + g * f' / f)
				Expression inner = add(mul(d(depth, g), call("ln", f)), div(mul(g, d(depth, f)), f));
				return mul(e, inner);
			}
		}

		@Override
		public Expression apply(Integer depth, Expression.Negation e) {
			return neg(d(depth, e.operand()));
		}

		@Override
		public Expression apply(Integer depth, Expression.Abs e) {
			return mul(d(depth, e.operand()), call("sgn", e.operand()));
		}

		@Override
		public Expression apply(Integer depth, Expression.Call e) {
			if (e.size() != 1 || (e.base() != null && !isConstant(e.base(), variable))
					|| (e.parameter() != null && !isConstant(e.parameter(), variable))) {
				throw cannotDifferentiate(e);
			}
			Expression u = e.argument(0);
			Expression outer;
			switch (e.name()) {
			case "sin":
				outer = call("cos", u);
				break;
			case "cos":
				outer = neg(call("sin", u));
				break;
			case "tan":
				outer = pow(call("sec", u), TWO);
				break;
			case "cot":
				outer = neg(pow(call("csc", u), TWO));
				break;
			case "sec":
				outer = mul(call("sec", u), call("tan", u));
				break;
			case "csc":
				outer = neg(mul(call("csc", u), call("cot", u)));
				break;
			case "asin":
				outer = div(ONE, call("sqrt", sub(ONE, pow(u, TWO))));
				break;
			case "acos":
				outer = neg(div(ONE, call("sqrt", sub(ONE, pow(u, TWO)))));
				break;
			case "atan":
				outer = div(ONE, add(ONE, pow(u, TWO)));
				break;
			case "sinh":
				outer = call("cosh", u);
				break;
			case "cosh":
				outer = call("sinh", u);
				break;
			case "tanh":
				outer = pow(call("sech", u), TWO);
				break;
			case "exp":
				outer = e;
				break;
			case "ln":
				outer = div(ONE, u);
				break;
			case "log": {
				Expression base = e.base() == null ? num(10) : e.base();
				outer = div(ONE, mul(u, call("ln", base)));
				break;
			}
			case "sqrt":
				if (e.parameter() == null) {
					outer = div(ONE, mul(TWO, e));
				} else {
					Expression n = div(ONE, e.parameter());
					outer = mul(n, pow(u, sub(n, ONE)));
				}
				break;
			case "abs":
				outer = call("sgn", u);
				break;
			case "sgn":
			case "floor":
			case "ceil":
			case "round":
				// Piecewise constant
				return ZERO;
			default:
				throw cannotDifferentiate(e);
			}
			// Chain rule
			return mul(outer, d(depth, u));
		}

		@Override
		public Expression apply(Integer depth, Expression.Derivative e) {
			Expression inner = differentiate(e.body(), e.variable(), e.order());
			return d(depth, inner);
		}

		@Override
		public Expression apply(Integer depth, Expression.PartialDerivative e) {
			return apply(depth, (Expression.Derivative) e);
		}

		@Override
		public Expression apply(Integer depth, Expression.Gradient e) {
			if (!e.isLaplacian()) {
				// vector valued
				throw cannotDifferentiate(e);
			}
			// Partial derivatives commute
			return new Expression.Gradient(d(depth, e.body()), true);
		}

		@Override
		public Expression apply(Integer depth, Expression.Conditional e) {
			return new Expression.Conditional(d(depth, e.body()), e.guard());
		}

		@Override
		public Expression apply(Integer depth, Expression.Piecewise e) {
			ArrayList<Piecewise.Case> cases = new ArrayList<>();
			for (Piecewise.Case c : e.cases()) {
				cases.add(new Piecewise.Case(d(depth, c.body()), c.guard()));
			}
			return new Piecewise(cases);
		}

		@Override
		public Expression apply(Integer depth, Expression.Matrix e) {
			throw cannotDifferentiate(e);
		}

		@Override
		public Expression apply(Integer depth, Expression.Vector e) {
			throw cannotDifferentiate(e);
		}

		@Override
		public Expression apply(Integer depth, Expression.Interval e) {
			throw cannotDifferentiate(e);
		}

		@Override
		public Expression apply(Integer depth, Expression.Sum e) {
			throw cannotDifferentiate(e);
		}

		@Override
		public Expression apply(Integer depth, Expression.Product e) {
			throw cannotDifferentiate(e);
		}

		@Override
		public Expression apply(Integer depth, Expression.Limit e) {
			throw cannotDifferentiate(e);
		}

		@Override
		public Expression apply(Integer depth, Expression.Integral e) {
			throw cannotDifferentiate(e);
		}

		@Override
		public Expression apply(Integer depth, Expression.Binomial e) {
			throw cannotDifferentiate(e);
		}

		@Override
		public Expression apply(Integer depth, Expression.Comparison e) {
			throw cannotDifferentiate(e);
		}

		@Override
		public Expression apply(Integer depth, Expression.ChainedComparison e) {
			throw cannotDifferentiate(e);
		}

		@Override
		public Expression apply(Integer depth, Expression.Logical e) {
			throw cannotDifferentiate(e);
		}
	}

	private static EvaluatorException cannotDifferentiate(Expression e) {
		return new EvaluatorException("Cannot differentiate " + e.toLatex(), e);
	}

	private void checkDepth(int depth, Expression e) {
		if (depth > maxDepth) {
			throw new EvaluatorException("maximum recursion depth of " + maxDepth + " exceeded", e);
		}
	}

	// ==============================================================
	// Cleanup
	// ==============================================================

	/**
	 * Tidy up an expression produced by differentiation, by removing trivial
	 * operations (e.g. <code>0 + x</code> or <code>1 * x</code>) and folding
	 * operations on numeric literals.
	 *
	 * @param e
	 * @return
	 */
	public Expression cleanup(Expression e) {
		return cleanup(e, 0);
	}

	private Expression cleanup(Expression e, int depth) {
		checkDepth(depth, e);
		List<Expression> children = e.children();
		if (children.isEmpty()) {
			return e;
		}
		ArrayList<Expression> nchildren = new ArrayList<>();
		boolean changed = false;
		for (Expression child : children) {
			Expression nchild = cleanup(child, depth + 1);
			changed |= nchild != child;
			nchildren.add(nchild);
		}
		if (changed) {
			e = e.withChildren(nchildren);
		}
		if (e instanceof Binary) {
			return tidy((Binary) e);
		} else if (e instanceof Expression.Negation) {
			Expression operand = ((Expression.Negation) e).operand();
			if (operand instanceof Expression.Negation) {
				return ((Expression.Negation) operand).operand();
			} else if (operand instanceof Expression.Literal) {
				return num(-((Expression.Literal) operand).value());
			}
		}
		return e;
	}

	private static Expression tidy(Binary b) {
		Expression l = b.leftOperand();
		Expression r = b.rightOperand();
		if (isNumber(l) && isNumber(r)) {
			Expression folded = fold(b.op(), numberValue(l), numberValue(r));
			if (folded != null) {
				return folded;
			}
		}
		switch (b.op()) {
		case ADD:
			if (isNumber(l, 0)) {
				return r;
			} else if (isNumber(r, 0)) {
				return l;
			}
			break;
		case SUB:
			if (isNumber(r, 0)) {
				return l;
			} else if (isNumber(l, 0)) {
				return neg(r);
			}
			break;
		case MUL:
			if (isNumber(l, 0) || isNumber(r, 0)) {
				return ZERO;
			} else if (isNumber(l, 1)) {
				return r;
			} else if (isNumber(r, 1)) {
				return l;
			}
			break;
		case DIV:
			if (isNumber(r, 1)) {
				return l;
			}
			break;
		default:
			if (isNumber(r, 0)) {
				return ONE;
			} else if (isNumber(r, 1)) {
				return l;
			}
		}
		return b;
	}
}

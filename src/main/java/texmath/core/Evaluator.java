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
package texmath.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import texmath.calculus.Differentiator;
import texmath.calculus.Integrator;
import texmath.calculus.NumericIntegrator;
import texmath.calculus.SimpsonIntegrator;
import texmath.core.Syntax.Expression;
import texmath.core.Syntax.Expression.Binary;
import texmath.core.Syntax.Expression.Comparison;
import texmath.core.Value.Bool;
import texmath.core.Value.Complex;
import texmath.core.Value.Interval;
import texmath.core.Value.Real;
import texmath.util.AbstractTransformer;
import texmath.util.EvaluatorException;
import texmath.util.MathError;
import texmath.util.Suggestions;

/**
 * Evaluates an expression to a value under a given binding of variables.
 * Evaluation is strict: the operands of every node are fully evaluated before
 * the node itself.
 *
 * @author David J. Pearce
 *
 */
public class Evaluator extends AbstractTransformer<Evaluator.Environment, Value> {
	private static final Logger logger = Logger.getLogger(Evaluator.class.getName());

	public static final int DEFAULT_MAX_ITERATIONS = 100_000;
	public static final int DEFAULT_MAX_DEPTH = 500;

	/**
	 * Absolute tolerance used when comparing values for equality.
	 */
	public static final double EQUALITY_TOLERANCE = 1e-9;

	/**
	 * Tolerance used to decide when the two-sided approach to a limit has
	 * converged.
	 */
	public static final double LIMIT_TOLERANCE = 1e-7;

	/**
	 * Names which always denote constants, and so cannot be bound.
	 */
	public static final Set<String> RESERVED = Collections
			.unmodifiableSet(new HashSet<>(Arrays.asList("e", "i", "pi", "tau", "phi")));

	/**
	 * A hook for supplying additional functions, which is consulted before the
	 * builtin functions.
	 */
	public interface FunctionHook {
		/**
		 * Apply the named function to some evaluated arguments.
		 *
		 * @param name
		 * @param arguments
		 * @return The result, or empty if this hook does not define the
		 *         function.
		 */
		public Optional<Value> apply(String name, List<Value> arguments);
	}

	/**
	 * The variable bindings under which an expression is evaluated, along with
	 * the current depth of recursion.
	 */
	public static final class Environment {
		private final Map<String, Value> bindings;
		private final int depth;

		public Environment(Map<String, Value> bindings) {
			this(new HashMap<>(bindings), 0);
		}

		private Environment(Map<String, Value> bindings, int depth) {
			this.bindings = bindings;
			this.depth = depth;
		}

		public Value lookup(String name) {
			return bindings.get(name);
		}

		public Environment bind(String name, Value value) {
			HashMap<String, Value> nbindings = new HashMap<>(bindings);
			nbindings.put(name, value);
			return new Environment(nbindings, depth);
		}

		public Map<String, Value> bindings() {
			return Collections.unmodifiableMap(bindings);
		}

		public int depth() {
			return depth;
		}

		private Environment enter() {
			return new Environment(bindings, depth + 1);
		}
	}

	private final Arithmetic arithmetic;
	private final Functions functions;
	private final FunctionHook hook;
	private final int maxIterations;
	private final int maxDepth;
	private final NumericIntegrator numeric;
	private final Differentiator differentiator;
	private final Integrator integrator;

	public Evaluator() {
		this(null);
	}

	public Evaluator(FunctionHook hook) {
		this(new Arithmetic(), new Functions(), hook, DEFAULT_MAX_ITERATIONS, DEFAULT_MAX_DEPTH,
				new SimpsonIntegrator());
	}

	public Evaluator(Arithmetic arithmetic, Functions functions, FunctionHook hook, int maxIterations, int maxDepth,
			NumericIntegrator numeric) {
		this.arithmetic = arithmetic;
		this.functions = functions;
		this.hook = hook;
		this.maxIterations = maxIterations;
		this.maxDepth = maxDepth;
		this.numeric = numeric;
		this.differentiator = new Differentiator(maxDepth);
		this.integrator = new Integrator(maxDepth);
	}

	/**
	 * Evaluate an expression which has no free variables.
	 *
	 * @param expr
	 * @return
	 */
	public Value evaluate(Expression expr) {
		return evaluate(expr, Collections.emptyMap());
	}

	/**
	 * Evaluate an expression under a given binding of its free variables.
	 *
	 * @param expr
	 * @param variables
	 * @return
	 */
	public Value evaluate(Expression expr, Map<String, Value> variables) {
		for (String name : variables.keySet()) {
			if (RESERVED.contains(name)) {
				throw new EvaluatorException("cannot bind reserved name '" + name + "'",
						"use a different variable name");
			}
		}
		return apply(new Environment(variables), expr);
	}

	@Override
	public Value apply(Environment env, Expression expr) {
		if (env.depth() >= maxDepth) {
			throw new EvaluatorException("maximum recursion depth of " + maxDepth + " exceeded", expr);
		}
		return super.apply(env.enter(), expr);
	}

	@Override
	public Value apply(Environment env, Expression.Literal expr) {
		return new Real(expr.value());
	}

	@Override
	public Value apply(Environment env, Expression.Variable expr) {
		String name = expr.name();
		// Bound variables shadow constants, as for a summation index i.
		Value v = env.lookup(name);
		if (v != null) {
			return v;
		}
		switch (name) {
		case "e":
			return new Real(Math.E);
		case "i":
			return Complex.I;
		case "pi":
			return new Real(Math.PI);
		case "tau":
			return new Real(2 * Math.PI);
		case "phi":
			return new Real((1 + Math.sqrt(5)) / 2);
		case "infty":
			return new Real(Double.POSITIVE_INFINITY);
		default:
			String suggestion = Suggestions.closest(name, env.bindings().keySet(), 2);
			throw new EvaluatorException("undefined variable '" + name + "'", expr,
					suggestion == null ? null : "did you mean '" + suggestion + "'?");
		}
	}

	@Override
	public Value apply(Environment env, Expression.Binary expr) {
		Expression rhs = expr.rightOperand();
		// Evaluate operands
		Value lhs = apply(env, expr.leftOperand());
		if (expr.op() == Binary.Op.POW && lhs instanceof Value.Matrix && isTransposeMarker(env, rhs)) {
			return ((Value.Matrix) lhs).transpose();
		}
		Value r = apply(env, rhs);
		// Apply operator
		return arithmetic.apply(expr.op(), expr.isCross(), lhs, r);
	}

	private static boolean isTransposeMarker(Environment env, Expression e) {
		return e instanceof Expression.Variable && ((Expression.Variable) e).name().equals("T")
				&& env.lookup("T") == null;
	}

	@Override
	public Value apply(Environment env, Expression.Negation expr) {
		return arithmetic.negate(apply(env, expr.operand()));
	}

	@Override
	public Value apply(Environment env, Expression.Abs expr) {
		Value v = apply(env, expr.operand());
		return functions.apply("abs", Collections.singletonList(v), null, null);
	}

	@Override
	public Value apply(Environment env, Expression.Call expr) {
		// Evaluate arguments
		ArrayList<Value> arguments = new ArrayList<>();
		for (Expression arg : expr.arguments()) {
			arguments.add(apply(env, arg));
		}
		Value base = expr.base() == null ? null : apply(env, expr.base());
		Value parameter = expr.parameter() == null ? null : apply(env, expr.parameter());
		// Consult hook before builtins
		if (hook != null) {
			Optional<Value> r = hook.apply(expr.name(), Collections.unmodifiableList(arguments));
			if (r.isPresent()) {
				return r.get();
			}
		}
		try {
			return functions.apply(expr.name(), arguments, base, parameter);
		} catch (EvaluatorException e) {
			if (e.start() < 0 && MathError.startOf(expr) >= 0) {
				// Locate error at the call site
				throw new EvaluatorException(e.msg(), expr, e.suggestion());
			}
			throw e;
		}
	}

	@Override
	public Value apply(Environment env, Expression.Matrix expr) {
		double[][] cells = new double[expr.height()][expr.width()];
		for (int i = 0; i != expr.height(); ++i) {
			List<Expression> row = expr.rows().get(i);
			for (int j = 0; j != row.size(); ++j) {
				cells[i][j] = apply(env, row.get(j)).asReal();
			}
		}
		return new Value.Matrix(cells);
	}

	@Override
	public Value apply(Environment env, Expression.Vector expr) {
		List<Expression> components = expr.components();
		double[] vs = new double[components.size()];
		for (int i = 0; i != vs.length; ++i) {
			vs[i] = apply(env, components.get(i)).asReal();
		}
		Value.Vector v = new Value.Vector(vs);
		return expr.isUnit() ? v.normalize() : v;
	}

	@Override
	public Value apply(Environment env, Expression.Interval expr) {
		double lower = apply(env, expr.lower()).asReal();
		double upper = apply(env, expr.upper()).asReal();
		return new Interval(lower, upper);
	}

	@Override
	public Value apply(Environment env, Expression.Sum expr) {
		return iterate(env, expr, Binary.Op.ADD, Real.ZERO);
	}

	@Override
	public Value apply(Environment env, Expression.Product expr) {
		return iterate(env, expr, Binary.Op.MUL, Real.ONE);
	}

	/**
	 * Evaluate a summation or product by iterating its index variable over the
	 * bounds, which must be integers.
	 *
	 * @param env
	 * @param expr
	 * @param op
	 * @param empty
	 * @return
	 */
	private Value iterate(Environment env, Expression.Series expr, Binary.Op op, Value empty) {
		double start = apply(env, expr.start()).asReal();
		double end = apply(env, expr.end()).asReal();
		if (Double.isNaN(start) || Double.isNaN(end) || start != Math.rint(start)
				|| (end != Math.rint(end) && !Double.isInfinite(end))) {
			throw new EvaluatorException("bounds of " + expr.toLatex() + " must be integers", expr);
		} else if (end - start + 1 > maxIterations) {
			throw new EvaluatorException("iteration count exceeds maximum of " + maxIterations, expr,
					"reduce the range of the index variable");
		}
		Value acc = null;
		for (long i = (long) start; i <= end; ++i) {
			Value v = apply(env.bind(expr.variable(), new Real(i)), expr.body());
			acc = acc == null ? v : arithmetic.apply(op, false, acc, v);
		}
		return acc == null ? empty : acc;
	}

	/**
	 * Evaluate a limit. At a finite point this is first attempted by direct
	 * substitution, falling back to a numeric two-sided approach when that
	 * fails. At infinity the body is sampled at increasingly large points.
	 */
	@Override
	public Value apply(Environment env, Expression.Limit expr) {
		Value target = apply(env, expr.target());
		double a = target.asReal();
		if (Double.isInfinite(a)) {
			return limitAtInfinity(env, expr, Math.signum(a));
		}
		try {
			Value v = apply(env.bind(expr.variable(), target), expr.body());
			if (!(v instanceof Real) || !Double.isNaN(v.asReal())) {
				return v;
			}
		} catch (EvaluatorException e) {
			logger.log(Level.FINE, "substitution failed for " + expr.toLatex() + ": " + e.getMessage());
		}
		return approach(env, expr, a);
	}

	private Value limitAtInfinity(Environment env, Expression.Limit expr, double sign) {
		double last = Double.NaN;
		double result = Double.NaN;
		for (double x : new double[] { 1e2, 1e4, 1e6, 1e8 }) {
			last = sample(env, expr, sign * x);
			if (!Double.isNaN(last) && !Double.isInfinite(last)) {
				result = last;
			}
		}
		return new Real(Double.isNaN(result) ? last : result);
	}

	private Value approach(Environment env, Expression.Limit expr, double a) {
		double previous = Double.NaN;
		double left = Double.NaN;
		double right = Double.NaN;
		for (int k = 1; k <= 9; ++k) {
			double h = Math.pow(10, -k);
			left = sample(env, expr, a - h);
			right = sample(env, expr, a + h);
			if (!isFinite(left) || !isFinite(right)) {
				continue;
			}
			double estimate = (left + right) / 2;
			double scale = Math.max(1, Math.abs(estimate));
			if (Math.abs(left - right) <= LIMIT_TOLERANCE * scale
					&& Math.abs(estimate - previous) <= LIMIT_TOLERANCE * scale) {
				logger.log(Level.FINE, "limit {0} approached numerically", expr.toLatex());
				return new Real(estimate);
			}
			previous = estimate;
		}
		if (Math.abs(left) > 1e12 && Math.abs(right) > 1e12 && Math.signum(left) == Math.signum(right)) {
			return new Real(Math.signum(left) * Double.POSITIVE_INFINITY);
		}
		logger.log(Level.FINE, "limit {0} does not converge", expr.toLatex());
		return Real.NaN;
	}

	private double sample(Environment env, Expression.Limit expr, double x) {
		try {
			Value v = apply(env.bind(expr.variable(), new Real(x)), expr.body());
			return v instanceof Real ? v.asReal() : Double.NaN;
		} catch (EvaluatorException e) {
			return Double.NaN;
		}
	}

	private static boolean isFinite(double d) {
		return !Double.isNaN(d) && !Double.isInfinite(d);
	}

	/**
	 * Evaluate an integral. A definite integral is computed from a closed-form
	 * antiderivative where one can be found, and numerically otherwise. An
	 * indefinite integral evaluates its antiderivative (with a constant of
	 * zero) at the current binding of its variable.
	 */
	@Override
	public Value apply(Environment env, Expression.Integral expr) {
		if (expr.isClosed()) {
			throw new EvaluatorException("contour integrals cannot be evaluated", expr);
		} else if ((expr.lower() == null) != (expr.upper() == null)) {
			throw new EvaluatorException("integral requires both an upper and lower bound", expr);
		}
		String x = expr.variable();
		Expression antiderivative = integrator.integrate(expr.body(), x);
		boolean closedForm = !(antiderivative instanceof Expression.Integral);
		if (!expr.isDefinite()) {
			if (!closedForm) {
				throw new EvaluatorException("no closed form for " + expr.toLatex(), expr);
			}
			return apply(env, antiderivative);
		}
		double lower = apply(env, expr.lower()).asReal();
		double upper = apply(env, expr.upper()).asReal();
		if (closedForm) {
			try {
				double fu = apply(env.bind(x, new Real(upper)), antiderivative).asReal();
				double fl = apply(env.bind(x, new Real(lower)), antiderivative).asReal();
				if (!Double.isNaN(fu - fl)) {
					return new Real(fu - fl);
				}
			} catch (EvaluatorException e) {
				logger.log(Level.FINE, "antiderivative of " + expr.toLatex() + " failed at bounds: " + e.getMessage());
			}
		}
		logger.log(Level.FINE, "integrating {0} numerically", expr.toLatex());
		return new Real(numeric.integrate(expr.body(), x, lower, upper, this, env));
	}

	@Override
	public Value apply(Environment env, Expression.Derivative expr) {
		Expression d = differentiator.differentiate(expr.body(), expr.variable(), expr.order());
		return apply(env, d);
	}

	@Override
	public Value apply(Environment env, Expression.PartialDerivative expr) {
		return apply(env, (Expression.Derivative) expr);
	}

	@Override
	public Value apply(Environment env, Expression.Gradient expr) {
		List<String> variables = gradientVariables(expr.body());
		int order = expr.isLaplacian() ? 2 : 1;
		double[] components = new double[variables.size()];
		for (int i = 0; i != components.length; ++i) {
			Expression d = differentiator.differentiate(expr.body(), variables.get(i), order);
			components[i] = apply(env, d).asReal();
		}
		if (expr.isLaplacian()) {
			double sum = 0;
			for (double c : components) {
				sum += c;
			}
			return new Real(sum);
		} else if (components.length == 0) {
			throw new EvaluatorException("gradient of an expression without variables", expr);
		}
		return new Value.Vector(components);
	}

	/**
	 * Determine the variables a gradient ranges over, in name order. Reserved
	 * constants are excluded.
	 *
	 * @param body
	 * @return
	 */
	public static List<String> gradientVariables(Expression body) {
		TreeSet<String> names = new TreeSet<>(Syntax.freeVariables(body));
		names.removeAll(RESERVED);
		return new ArrayList<>(names);
	}

	@Override
	public Value apply(Environment env, Expression.Binomial expr) {
		double n = apply(env, expr.top()).asReal();
		double k = apply(env, expr.bottom()).asReal();
		return new Real(Functions.binomial(n, k));
	}

	@Override
	public Value apply(Environment env, Expression.Comparison expr) {
		Value lhs = apply(env, expr.leftOperand());
		Value rhs = apply(env, expr.rightOperand());
		return Bool.of(compare(expr.op(), lhs, rhs));
	}

	@Override
	public Value apply(Environment env, Expression.ChainedComparison expr) {
		List<Expression> operands = expr.operands();
		ArrayList<Value> values = new ArrayList<>();
		for (Expression e : operands) {
			values.add(apply(env, e));
		}
		boolean r = true;
		for (int i = 0; i != expr.operators().size(); ++i) {
			r &= compare(expr.operators().get(i), values.get(i), values.get(i + 1));
		}
		return Bool.of(r);
	}

	private static boolean compare(Comparison.Op op, Value lhs, Value rhs) {
		switch (op) {
		case EQ:
			return equal(lhs, rhs);
		case NEQ:
			return !equal(lhs, rhs);
		case IN:
			return rhs.asInterval().contains(lhs.asReal());
		case LT:
			return lhs.asReal() < rhs.asReal();
		case LTEQ:
			return lhs.asReal() <= rhs.asReal();
		case GT:
			return lhs.asReal() > rhs.asReal();
		default:
			return lhs.asReal() >= rhs.asReal();
		}
	}

	private static boolean equal(Value lhs, Value rhs) {
		if (lhs instanceof Real && rhs instanceof Real) {
			return close(lhs.asReal(), rhs.asReal());
		} else if ((lhs instanceof Real || lhs instanceof Complex) && (rhs instanceof Real || rhs instanceof Complex)) {
			Complex l = lhs instanceof Real ? new Complex(lhs.asReal(), 0) : (Complex) lhs;
			Complex r = rhs instanceof Real ? new Complex(rhs.asReal(), 0) : (Complex) rhs;
			return close(l.re(), r.re()) && close(l.im(), r.im());
		}
		return lhs.equals(rhs);
	}

	private static boolean close(double a, double b) {
		return a == b || Math.abs(a - b) <= EQUALITY_TOLERANCE;
	}

	@Override
	public Value apply(Environment env, Expression.Logical expr) {
		ArrayList<Boolean> values = new ArrayList<>();
		for (Expression e : expr.operands()) {
			values.add(isTruthy(apply(env, e)));
		}
		switch (expr.op()) {
		case NOT:
			return Bool.of(!values.get(0));
		case AND:
			return Bool.of(!values.contains(false));
		default:
			return Bool.of(values.contains(true));
		}
	}

	@Override
	public Value apply(Environment env, Expression.Conditional expr) {
		if (isTruthy(apply(env, expr.guard()))) {
			return apply(env, expr.body());
		}
		return Real.NaN;
	}

	@Override
	public Value apply(Environment env, Expression.Piecewise expr) {
		// Cases are tried in order, and an otherwise case always holds
		for (Expression.Piecewise.Case c : expr.cases()) {
			if (c.guard() == null || isTruthy(apply(env, c.guard()))) {
				return apply(env, c.body());
			}
		}
		return Real.NaN;
	}

	/**
	 * Determine whether a value holds as a condition. This is the case for
	 * true, and for any real other than zero or NaN.
	 *
	 * @param v
	 * @return
	 */
	public static boolean isTruthy(Value v) {
		if (v instanceof Bool) {
			return v.asBoolean();
		} else if (v instanceof Real) {
			double d = v.asReal();
			return d != 0 && !Double.isNaN(d);
		}
		throw new EvaluatorException("expected a condition, found " + v.domain() + " value " + v);
	}
}

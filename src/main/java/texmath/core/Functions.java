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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import texmath.core.Value.Complex;
import texmath.core.Value.Interval;
import texmath.core.Value.Matrix;
import texmath.core.Value.Real;
import texmath.core.Value.Vector;
import texmath.util.EvaluatorException;
import texmath.util.Suggestions;

/**
 * The builtin functions. Arguments are checked against the domain of each
 * function, and a violation raises an {@link EvaluatorException}. The
 * exceptions are the square root and logarithm of a negative real, which
 * give complex results.
 *
 * @author David J. Pearce
 *
 */
public class Functions {
	/**
	 * The names of every builtin function.
	 */
	public static final Set<String> NAMES = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList("sin",
			"cos", "tan", "cot", "sec", "csc", "asin", "acos", "atan", "acot", "asec", "acsc", "sinh", "cosh", "tanh",
			"sech", "csch", "coth", "asinh", "acosh", "atanh", "ln", "log", "exp", "sqrt", "abs", "ceil", "floor",
			"round", "sgn", "factorial", "fibonacci", "gcd", "lcm", "min", "max", "det", "trace", "norm", "Re", "Im",
			"conj", "arg", "dot", "ddot", "bar", "overline")));

	/**
	 * The largest argument for which the factorial is finite.
	 */
	public static final int MAX_FACTORIAL = 170;

	/**
	 * Apply a builtin function.
	 *
	 * @param name      The name of the function
	 * @param arguments The evaluated arguments
	 * @param base      The evaluated subscript (e.g. the base of a logarithm),
	 *                  or null
	 * @param parameter The evaluated bracket parameter (e.g. the index of a
	 *                  root), or null
	 * @return
	 */
	public Value apply(String name, List<Value> arguments, Value base, Value parameter) {
		switch (name) {
		case "min":
		case "max":
		case "gcd":
		case "lcm":
			return variadic(name, base == null ? arguments : prepend(base, arguments));
		case "log":
			return log(unary(name, arguments), base);
		case "sqrt":
			return sqrt(unary(name, arguments), parameter);
		default:
			if (!NAMES.contains(name)) {
				String suggestion = Suggestions.closest(name, NAMES, 2);
				throw new EvaluatorException("unknown function '" + name + "'",
						suggestion == null ? null : "did you mean \\" + suggestion + "?");
			}
			return unary(name, unary(name, arguments));
		}
	}

	private static Value unary(String name, List<Value> arguments) {
		if (arguments.size() != 1) {
			throw new EvaluatorException(name + " expects one argument, found " + arguments.size());
		}
		return arguments.get(0);
	}

	private static List<Value> prepend(Value v, List<Value> vs) {
		ArrayList<Value> r = new ArrayList<>();
		r.add(v);
		r.addAll(vs);
		return r;
	}

	private Value unary(String name, Value arg) {
		switch (name) {
		case "dot":
		case "ddot":
		case "bar":
		case "overline":
			return arg;
		case "abs":
			return abs(arg);
		case "norm":
			return norm(arg);
		case "det":
			return new Real(arg.asMatrix().determinant());
		case "trace":
			return new Real(arg.asMatrix().trace());
		case "Re":
			return new Real(complex(arg).re());
		case "Im":
			return new Real(complex(arg).im());
		case "conj":
			return arg instanceof Real ? arg : complex(arg).conjugate();
		case "arg":
			return new Real(complex(arg).arg());
		case "exp":
			if (arg instanceof Complex) {
				return ((Complex) arg).exp();
			} else if (arg instanceof Interval) {
				return ((Interval) arg).exp();
			}
			return new Real(Math.exp(arg.asReal()));
		case "ln":
			return ln(arg);
		case "sin":
		case "cos":
		case "tan":
			if (arg instanceof Complex) {
				return complexTrig(name, (Complex) arg);
			}
		default:
			return new Real(real(name, arg.asReal()));
		}
	}

	private static Value complexTrig(String name, Complex z) {
		switch (name) {
		case "sin":
			return z.sin();
		case "cos":
			return z.cos();
		default:
			return z.tan();
		}
	}

	/**
	 * Apply a function of a single real argument.
	 *
	 * @param name
	 * @param x
	 * @return
	 */
	private static double real(String name, double x) {
		switch (name) {
		case "sin":
			return Math.sin(x);
		case "cos":
			return Math.cos(x);
		case "tan":
			return Math.tan(x);
		case "cot":
			return 1 / nonZero(name, Math.tan(x));
		case "sec":
			return 1 / nonZero(name, Math.cos(x));
		case "csc":
			return 1 / nonZero(name, Math.sin(x));
		case "asin":
			return Math.asin(unitRange(name, x));
		case "acos":
			return Math.acos(unitRange(name, x));
		case "atan":
			return Math.atan(x);
		case "acot":
			return x == 0 ? Math.PI / 2 : Math.atan(1 / x);
		case "asec":
			return Math.acos(1 / outsideUnitRange(name, x));
		case "acsc":
			return Math.asin(1 / outsideUnitRange(name, x));
		case "sinh":
			return Math.sinh(x);
		case "cosh":
			return Math.cosh(x);
		case "tanh":
			return Math.tanh(x);
		case "sech":
			return 1 / Math.cosh(x);
		case "csch":
			return 1 / nonZero(name, Math.sinh(x));
		case "coth":
			return 1 / nonZero(name, Math.tanh(x));
		case "asinh":
			return Math.log(x + Math.sqrt(x * x + 1));
		case "acosh":
			if (x < 1) {
				throw domainError(name, x, "[1, \\infty)");
			}
			return Math.log(x + Math.sqrt(x * x - 1));
		case "atanh":
			if (x <= -1 || x >= 1) {
				throw domainError(name, x, "(-1, 1)");
			}
			return 0.5 * Math.log((1 + x) / (1 - x));
		case "ceil":
			return Math.ceil(x);
		case "floor":
			return Math.floor(x);
		case "round":
			return Math.floor(x + 0.5);
		case "sgn":
			return Math.signum(x);
		case "factorial":
			return factorial(x);
		default:
			return fibonacci(x);
		}
	}

	private static double nonZero(String name, double x) {
		if (x == 0) {
			throw new EvaluatorException(name + " is undefined at this point");
		}
		return x;
	}

	private static double unitRange(String name, double x) {
		if (x < -1 || x > 1) {
			throw domainError(name, x, "[-1, 1]");
		}
		return x;
	}

	private static double outsideUnitRange(String name, double x) {
		if (x > -1 && x < 1) {
			throw domainError(name, x, "(-\\infty, -1] \\cup [1, \\infty)");
		}
		return x;
	}

	private static EvaluatorException domainError(String name, double x, String domain) {
		return new EvaluatorException(name + " is only defined on " + domain + ", found " + x);
	}

	private static Complex complex(Value v) {
		return v instanceof Real ? new Complex(v.asReal(), 0) : v.asComplex();
	}

	private static Value abs(Value v) {
		if (v instanceof Complex) {
			return new Real(((Complex) v).abs());
		} else if (v instanceof Vector) {
			return new Real(((Vector) v).magnitude());
		} else if (v instanceof Interval) {
			return ((Interval) v).abs();
		} else if (v instanceof Matrix) {
			return new Real(((Matrix) v).determinant());
		}
		return new Real(Math.abs(v.asReal()));
	}

	private static Value norm(Value v) {
		if (v instanceof Matrix) {
			// Frobenius norm
			Matrix m = (Matrix) v;
			double s = 0;
			for (int i = 0; i != m.rows(); ++i) {
				for (int j = 0; j != m.columns(); ++j) {
					s += m.get(i, j) * m.get(i, j);
				}
			}
			return new Real(Math.sqrt(s));
		}
		return abs(v);
	}

	private static Value ln(Value v) {
		if (v instanceof Complex) {
			return ((Complex) v).log();
		} else if (v instanceof Interval) {
			return ((Interval) v).log();
		}
		double x = v.asReal();
		if (x == 0) {
			throw new EvaluatorException("logarithm of zero");
		} else if (x < 0) {
			return new Complex(x, 0).log();
		}
		return new Real(Math.log(x));
	}

	private static Value log(Value v, Value base) {
		double b = base == null ? 10 : base.asReal();
		if (b <= 0 || b == 1) {
			throw new EvaluatorException("logarithm base must be positive and not 1, found " + b);
		}
		Value l = ln(v);
		double lb = Math.log(b);
		if (l instanceof Complex) {
			Complex c = (Complex) l;
			return new Complex(c.re() / lb, c.im() / lb);
		} else if (l instanceof Interval) {
			Interval i = (Interval) l;
			return new Interval(i.lower() / lb, i.upper() / lb);
		}
		return new Real(l.asReal() / lb);
	}

	private static Value sqrt(Value v, Value parameter) {
		double n = parameter == null ? 2 : parameter.asReal();
		if (n == 0) {
			throw new EvaluatorException("root index cannot be zero");
		}
		if (v instanceof Complex) {
			return ((Complex) v).pow(new Complex(1 / n, 0));
		} else if (v instanceof Interval) {
			if (n != 2) {
				throw new EvaluatorException("only square roots of intervals are supported");
			}
			return ((Interval) v).sqrt();
		}
		double x = v.asReal();
		if (x >= 0) {
			return new Real(n == 2 ? Math.sqrt(x) : Math.pow(x, 1 / n));
		} else if (n == Math.rint(n) && Math.abs(n) % 2 == 1) {
			// Odd roots of negative reals are real
			return new Real(-Math.pow(-x, 1 / n));
		}
		return new Complex(x, 0).pow(new Complex(1 / n, 0));
	}

	private static Value variadic(String name, List<Value> arguments) {
		if (arguments.isEmpty()) {
			throw new EvaluatorException(name + " expects at least one argument");
		}
		double r = arguments.get(0).asReal();
		if (name.equals("gcd") || name.equals("lcm")) {
			r = integer(name, r);
		}
		for (int i = 1; i < arguments.size(); ++i) {
			double x = arguments.get(i).asReal();
			switch (name) {
			case "min":
				r = Math.min(r, x);
				break;
			case "max":
				r = Math.max(r, x);
				break;
			case "gcd":
				r = gcd(r, integer(name, x));
				break;
			default:
				x = integer(name, x);
				r = (r == 0 || x == 0) ? 0 : Math.abs(r * x) / gcd(r, x);
			}
		}
		return new Real(name.equals("gcd") || name.equals("lcm") ? Math.abs(r) : r);
	}

	private static double integer(String name, double x) {
		if (x != Math.rint(x) || Double.isInfinite(x)) {
			throw new EvaluatorException(name + " expects integer arguments, found " + x);
		}
		return x;
	}

	private static double gcd(double a, double b) {
		a = Math.abs(a);
		b = Math.abs(b);
		while (b != 0) {
			double t = a % b;
			a = b;
			b = t;
		}
		return a;
	}

	public static double factorial(double n) {
		if (n < 0 || n != Math.rint(n) || n > MAX_FACTORIAL) {
			throw new EvaluatorException("factorial is only defined for integers 0.." + MAX_FACTORIAL + ", found " + n);
		}
		double r = 1;
		for (int i = 2; i <= n; ++i) {
			r *= i;
		}
		return r;
	}

	public static double fibonacci(double n) {
		if (n < 0 || n != Math.rint(n) || n > 1476) {
			throw new EvaluatorException("fibonacci is only defined for integers 0..1476, found " + n);
		}
		double a = 0;
		double b = 1;
		for (int i = 0; i < n; ++i) {
			double t = a + b;
			a = b;
			b = t;
		}
		return a;
	}

	/**
	 * Compute the binomial coefficient <code>n choose k</code> for
	 * non-negative integers.
	 *
	 * @param n
	 * @param k
	 * @return
	 */
	public static double binomial(double n, double k) {
		if (n < 0 || k < 0 || n != Math.rint(n) || k != Math.rint(k)) {
			throw new EvaluatorException("binomial coefficient requires non-negative integers, found (" + n + ", "
					+ k + ")");
		} else if (k > n) {
			return 0;
		}
		k = Math.min(k, n - k);
		double r = 1;
		// Each factor is at least one, so once infinite r stays infinite
		for (int i = 1; i <= k && !Double.isInfinite(r); ++i) {
			r = r * (n - k + i) / i;
		}
		return Math.rint(r);
	}
}

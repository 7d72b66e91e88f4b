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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import texmath.core.Syntax.Expression.Binary;
import texmath.core.Value.Complex;
import texmath.core.Value.Interval;
import texmath.core.Value.Matrix;
import texmath.core.Value.Real;
import texmath.core.Value.Vector;
import texmath.util.EvaluatorException;

/**
 * Applies arithmetic operators to values of arbitrary domains. Each
 * combination of operand domains is handled by a {@link Strategy}, and
 * strategies are tried in a fixed order from most to least specific (matrix,
 * vector, complex, interval, then real). Hence, for example, a complex scalar
 * multiplying a matrix is handled by the matrix strategy.
 *
 * @author David J. Pearce
 *
 */
public class Arithmetic {

	/**
	 * Implements binary operators for some combination of operand domains.
	 */
	public interface Strategy {
		/**
		 * Determine whether this strategy is responsible for a given pair of
		 * operands.
		 *
		 * @param lhs
		 * @param rhs
		 * @return
		 */
		public boolean accepts(Value lhs, Value rhs);

		/**
		 * Apply an operator to two operands which this strategy accepts.
		 *
		 * @param op    The operator to apply
		 * @param cross Whether a multiplication was written with
		 *              <code>\times</code>
		 * @param lhs
		 * @param rhs
		 * @return
		 */
		public Value apply(Binary.Op op, boolean cross, Value lhs, Value rhs);
	}

	public static final Strategy MATRIX = new MatrixStrategy();
	public static final Strategy VECTOR = new VectorStrategy();
	public static final Strategy COMPLEX = new ComplexStrategy();
	public static final Strategy INTERVAL = new IntervalStrategy();
	public static final Strategy REAL = new RealStrategy();

	private final List<Strategy> strategies;

	public Arithmetic() {
		this(Arrays.asList(MATRIX, VECTOR, COMPLEX, INTERVAL, REAL));
	}

	public Arithmetic(List<Strategy> strategies) {
		this.strategies = Collections.unmodifiableList(strategies);
	}

	public List<Strategy> strategies() {
		return strategies;
	}

	/**
	 * Apply a binary operator to two values using the first strategy which
	 * accepts them.
	 *
	 * @param op
	 * @param cross
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public Value apply(Binary.Op op, boolean cross, Value lhs, Value rhs) {
		for (Strategy s : strategies) {
			if (s.accepts(lhs, rhs)) {
				return s.apply(op, cross, lhs, rhs);
			}
		}
		throw unsupported(op, lhs, rhs);
	}

	public Value negate(Value v) {
		if (v instanceof Real) {
			return new Real(-v.asReal());
		} else if (v instanceof Complex) {
			return ((Complex) v).negate();
		} else if (v instanceof Interval) {
			return ((Interval) v).negate();
		} else if (v instanceof Vector) {
			return ((Vector) v).scale(-1);
		} else if (v instanceof Matrix) {
			return ((Matrix) v).scale(-1);
		}
		throw new EvaluatorException("cannot negate " + v.domain() + " value");
	}

	private static EvaluatorException unsupported(Binary.Op op, Value lhs, Value rhs) {
		return new EvaluatorException(
				"cannot apply '" + op.symbol() + "' to " + lhs.domain() + " and " + rhs.domain() + " values");
	}

	/**
	 * Check whether a value is a real, or a complex number with no imaginary
	 * part, and so can act as a scalar.
	 *
	 * @param v
	 * @return
	 */
	private static boolean isScalar(Value v) {
		return v instanceof Real || (v instanceof Complex && ((Complex) v).im() == 0);
	}

	private static double scalar(Value v) {
		return v instanceof Complex ? ((Complex) v).re() : v.asReal();
	}

	private static int integerExponent(Value v) {
		double d = scalar(v);
		if (d != Math.rint(d) || Math.abs(d) > Integer.MAX_VALUE) {
			throw new EvaluatorException("exponent must be an integer, found " + d);
		}
		return (int) d;
	}

	// ==============================================================
	// Matrix
	// ==============================================================

	private static final class MatrixStrategy implements Strategy {
		@Override
		public boolean accepts(Value lhs, Value rhs) {
			return lhs instanceof Matrix || rhs instanceof Matrix;
		}

		@Override
		public Value apply(Binary.Op op, boolean cross, Value lhs, Value rhs) {
			if (lhs instanceof Matrix && rhs instanceof Matrix) {
				Matrix l = (Matrix) lhs;
				Matrix r = (Matrix) rhs;
				switch (op) {
				case ADD:
					return l.add(r);
				case SUB:
					return l.subtract(r);
				case MUL:
					return l.multiply(r);
				default:
				}
			} else if (lhs instanceof Matrix && isScalar(rhs)) {
				Matrix l = (Matrix) lhs;
				switch (op) {
				case MUL:
					return l.scale(scalar(rhs));
				case DIV:
					if (scalar(rhs) == 0) {
						throw new EvaluatorException("division by zero");
					}
					return l.scale(1 / scalar(rhs));
				case POW:
					return l.power(integerExponent(rhs));
				default:
				}
			} else if (isScalar(lhs) && rhs instanceof Matrix && op == Binary.Op.MUL) {
				return ((Matrix) rhs).scale(scalar(lhs));
			} else if (lhs instanceof Matrix && rhs instanceof Vector && op == Binary.Op.MUL) {
				Matrix m = (Matrix) lhs;
				Vector v = (Vector) rhs;
				if (m.columns() != v.size()) {
					throw new EvaluatorException("dimension mismatch: " + m.rows() + "x" + m.columns()
							+ " matrix applied to vector of size " + v.size());
				}
				double[] r = new double[m.rows()];
				for (int i = 0; i != m.rows(); ++i) {
					for (int j = 0; j != m.columns(); ++j) {
						r[i] += m.get(i, j) * v.get(j);
					}
				}
				return new Vector(r);
			} else if (lhs instanceof Complex || rhs instanceof Complex) {
				throw new EvaluatorException("complex matrices are not supported");
			}
			throw unsupported(op, lhs, rhs);
		}
	}

	// ==============================================================
	// Vector
	// ==============================================================

	private static final class VectorStrategy implements Strategy {
		@Override
		public boolean accepts(Value lhs, Value rhs) {
			return lhs instanceof Vector || rhs instanceof Vector;
		}

		@Override
		public Value apply(Binary.Op op, boolean cross, Value lhs, Value rhs) {
			if (lhs instanceof Vector && rhs instanceof Vector) {
				Vector l = (Vector) lhs;
				Vector r = (Vector) rhs;
				switch (op) {
				case ADD:
					return l.add(r);
				case SUB:
					return l.subtract(r);
				case MUL:
					return cross ? l.cross(r) : new Real(l.dot(r));
				default:
				}
			} else if (lhs instanceof Vector && isScalar(rhs)) {
				Vector l = (Vector) lhs;
				if (op == Binary.Op.MUL) {
					return l.scale(scalar(rhs));
				} else if (op == Binary.Op.DIV) {
					if (scalar(rhs) == 0) {
						throw new EvaluatorException("division by zero");
					}
					return l.scale(1 / scalar(rhs));
				}
			} else if (isScalar(lhs) && rhs instanceof Vector && op == Binary.Op.MUL) {
				return ((Vector) rhs).scale(scalar(lhs));
			}
			throw unsupported(op, lhs, rhs);
		}
	}

	// ==============================================================
	// Complex
	// ==============================================================

	private static final class ComplexStrategy implements Strategy {
		@Override
		public boolean accepts(Value lhs, Value rhs) {
			return (lhs instanceof Complex && (rhs instanceof Complex || rhs instanceof Real))
					|| (lhs instanceof Real && rhs instanceof Complex);
		}

		@Override
		public Value apply(Binary.Op op, boolean cross, Value lhs, Value rhs) {
			Complex l = promote(lhs);
			Complex r = promote(rhs);
			switch (op) {
			case ADD:
				return l.add(r);
			case SUB:
				return l.subtract(r);
			case MUL:
				return l.multiply(r);
			case DIV:
				return l.divide(r);
			default:
				return l.pow(r);
			}
		}

		private static Complex promote(Value v) {
			return v instanceof Real ? new Complex(v.asReal(), 0) : (Complex) v;
		}
	}

	// ==============================================================
	// Interval
	// ==============================================================

	private static final class IntervalStrategy implements Strategy {
		@Override
		public boolean accepts(Value lhs, Value rhs) {
			return (lhs instanceof Interval && (rhs instanceof Interval || rhs instanceof Real))
					|| (lhs instanceof Real && rhs instanceof Interval);
		}

		@Override
		public Value apply(Binary.Op op, boolean cross, Value lhs, Value rhs) {
			if (op == Binary.Op.POW) {
				return power(lhs, rhs);
			}
			Interval l = promote(lhs);
			Interval r = promote(rhs);
			switch (op) {
			case ADD:
				return l.add(r);
			case SUB:
				return l.subtract(r);
			case MUL:
				return l.multiply(r);
			default:
				return l.divide(r);
			}
		}

		private static Value power(Value lhs, Value rhs) {
			if (lhs instanceof Interval && rhs instanceof Real) {
				int n = integerExponent(rhs);
				Interval l = (Interval) lhs;
				return n >= 0 ? l.pow(n) : l.pow(-n).reciprocal();
			} else if (lhs instanceof Real && rhs instanceof Interval) {
				double base = lhs.asReal();
				Interval r = (Interval) rhs;
				if (base <= 0) {
					throw new EvaluatorException("interval exponent requires a positive base, found " + base);
				}
				double a = Math.pow(base, r.lower());
				double b = Math.pow(base, r.upper());
				return new Interval(Math.min(a, b), Math.max(a, b));
			}
			throw unsupported(Binary.Op.POW, lhs, rhs);
		}

		private static Interval promote(Value v) {
			return v instanceof Real ? Interval.point(v.asReal()) : (Interval) v;
		}
	}

	// ==============================================================
	// Real
	// ==============================================================

	private static final class RealStrategy implements Strategy {
		@Override
		public boolean accepts(Value lhs, Value rhs) {
			return lhs instanceof Real && rhs instanceof Real;
		}

		@Override
		public Value apply(Binary.Op op, boolean cross, Value lhs, Value rhs) {
			double l = lhs.asReal();
			double r = rhs.asReal();
			switch (op) {
			case ADD:
				return new Real(l + r);
			case SUB:
				return new Real(l - r);
			case MUL:
				return new Real(l * r);
			case DIV:
				if (r == 0) {
					throw new EvaluatorException("division by zero");
				}
				return new Real(l / r);
			default:
				if (l < 0 && r != Math.rint(r) && !Double.isInfinite(r)) {
					// Negative base with fractional exponent
					return new Complex(l, 0).pow(new Complex(r, 0));
				}
				return new Real(Math.pow(l, r));
			}
		}
	}
}

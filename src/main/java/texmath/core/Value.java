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

import texmath.util.EvaluatorException;

/**
 * The result of evaluating an expression. Every value belongs to exactly one
 * domain, and conversions between domains are explicit: each
 * <code>asXXX()</code> accessor fails with an {@link EvaluatorException} if
 * the value is not of the requested domain.
 *
 * @author David J. Pearce
 *
 */
public abstract class Value {

	/**
	 * A human-readable name for the domain of this value, used in error
	 * messages.
	 *
	 * @return
	 */
	public abstract String domain();

	public double asReal() {
		throw mismatch("real");
	}

	public Complex asComplex() {
		throw mismatch("complex");
	}

	public Interval asInterval() {
		throw mismatch("interval");
	}

	public Vector asVector() {
		throw mismatch("vector");
	}

	public Matrix asMatrix() {
		throw mismatch("matrix");
	}

	public boolean asBoolean() {
		throw mismatch("boolean");
	}

	public boolean isReal() {
		return false;
	}

	private EvaluatorException mismatch(String expected) {
		return new EvaluatorException("expected " + expected + " value, found " + domain() + " " + this);
	}

	// ==============================================================
	// Real
	// ==============================================================

	public static final class Real extends Value {
		public static final Real ZERO = new Real(0);
		public static final Real ONE = new Real(1);
		public static final Real NaN = new Real(Double.NaN);

		private final double value;

		public Real(double value) {
			this.value = value;
		}

		public double value() {
			return value;
		}

		@Override
		public double asReal() {
			return value;
		}

		@Override
		public boolean isReal() {
			return true;
		}

		@Override
		public String domain() {
			return "real";
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Real && Double.compare(((Real) o).value, value) == 0;
		}

		@Override
		public int hashCode() {
			return Double.hashCode(value);
		}

		@Override
		public String toString() {
			return Double.toString(value);
		}
	}

	// ==============================================================
	// Complex
	// ==============================================================

	public static final class Complex extends Value {
		public static final Complex I = new Complex(0, 1);

		private final double re;
		private final double im;

		public Complex(double re, double im) {
			this.re = re;
			this.im = im;
		}

		public static Complex polar(double r, double theta) {
			return new Complex(r * Math.cos(theta), r * Math.sin(theta));
		}

		public double re() {
			return re;
		}

		public double im() {
			return im;
		}

		public double abs() {
			return Math.hypot(re, im);
		}

		public double arg() {
			return Math.atan2(im, re);
		}

		public Complex add(Complex c) {
			return new Complex(re + c.re, im + c.im);
		}

		public Complex subtract(Complex c) {
			return new Complex(re - c.re, im - c.im);
		}

		public Complex multiply(Complex c) {
			return new Complex(re * c.re - im * c.im, re * c.im + im * c.re);
		}

		public Complex divide(Complex c) {
			double d = c.re * c.re + c.im * c.im;
			if (d == 0) {
				throw new EvaluatorException("division by zero");
			}
			return new Complex((re * c.re + im * c.im) / d, (im * c.re - re * c.im) / d);
		}

		public Complex negate() {
			return new Complex(-re, -im);
		}

		public Complex conjugate() {
			return new Complex(re, -im);
		}

		public Complex exp() {
			return polar(Math.exp(re), im);
		}

		/**
		 * The principal branch of the natural logarithm.
		 *
		 * @return
		 */
		public Complex log() {
			if (re == 0 && im == 0) {
				throw new EvaluatorException("logarithm of zero");
			}
			return new Complex(Math.log(abs()), arg());
		}

		public Complex pow(Complex w) {
			if (re == 0 && im == 0) {
				if (w.re == 0 && w.im == 0) {
					return new Complex(1, 0);
				}
				return new Complex(0, 0);
			}
			if (w.im == 0) {
				return polar(Math.pow(abs(), w.re), arg() * w.re);
			}
			return w.multiply(log()).exp();
		}

		public Complex sqrt() {
			return pow(new Complex(0.5, 0));
		}

		public Complex sin() {
			return new Complex(Math.sin(re) * Math.cosh(im), Math.cos(re) * Math.sinh(im));
		}

		public Complex cos() {
			return new Complex(Math.cos(re) * Math.cosh(im), -Math.sin(re) * Math.sinh(im));
		}

		public Complex tan() {
			return sin().divide(cos());
		}

		@Override
		public Complex asComplex() {
			return this;
		}

		@Override
		public String domain() {
			return "complex";
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Complex) {
				Complex c = (Complex) o;
				return Double.compare(re, c.re) == 0 && Double.compare(im, c.im) == 0;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Double.hashCode(re) * 31 + Double.hashCode(im);
		}

		@Override
		public String toString() {
			if (im < 0) {
				return re + " - " + (-im) + "i";
			}
			return re + " + " + im + "i";
		}
	}

	// ==============================================================
	// Interval
	// ==============================================================

	public static final class Interval extends Value {
		private final double lower;
		private final double upper;

		public Interval(double lower, double upper) {
			if (!(lower <= upper)) {
				throw new EvaluatorException("invalid interval [" + lower + ", " + upper + "]");
			}
			this.lower = lower;
			this.upper = upper;
		}

		public static Interval point(double v) {
			return new Interval(v, v);
		}

		public double lower() {
			return lower;
		}

		public double upper() {
			return upper;
		}

		public double width() {
			return upper - lower;
		}

		public double midpoint() {
			return (lower + upper) / 2;
		}

		public boolean contains(double v) {
			return lower <= v && v <= upper;
		}

		public boolean containsZero() {
			return contains(0);
		}

		public Interval add(Interval i) {
			return new Interval(lower + i.lower, upper + i.upper);
		}

		public Interval subtract(Interval i) {
			return new Interval(lower - i.upper, upper - i.lower);
		}

		public Interval multiply(Interval i) {
			double a = lower * i.lower;
			double b = lower * i.upper;
			double c = upper * i.lower;
			double d = upper * i.upper;
			return new Interval(Math.min(Math.min(a, b), Math.min(c, d)), Math.max(Math.max(a, b), Math.max(c, d)));
		}

		public Interval divide(Interval i) {
			return multiply(i.reciprocal());
		}

		public Interval reciprocal() {
			if (containsZero()) {
				throw new EvaluatorException("division by interval containing zero: " + this);
			}
			return new Interval(1 / upper, 1 / lower);
		}

		public Interval negate() {
			return new Interval(-upper, -lower);
		}

		public Interval abs() {
			if (lower >= 0) {
				return this;
			} else if (upper <= 0) {
				return negate();
			} else {
				return new Interval(0, Math.max(-lower, upper));
			}
		}

		public Interval pow(int n) {
			if (n == 0) {
				return point(1);
			} else if (n < 0) {
				return reciprocal().pow(-n);
			} else if (n % 2 == 1 || lower >= 0) {
				return new Interval(Math.pow(lower, n), Math.pow(upper, n));
			} else if (upper <= 0) {
				return new Interval(Math.pow(upper, n), Math.pow(lower, n));
			} else {
				return new Interval(0, Math.pow(Math.max(-lower, upper), n));
			}
		}

		public Interval exp() {
			return new Interval(Math.exp(lower), Math.exp(upper));
		}

		public Interval log() {
			if (lower <= 0) {
				throw new EvaluatorException("logarithm of interval with non-positive values: " + this);
			}
			return new Interval(Math.log(lower), Math.log(upper));
		}

		public Interval sqrt() {
			if (lower < 0) {
				throw new EvaluatorException("square root of interval with negative values: " + this);
			}
			return new Interval(Math.sqrt(lower), Math.sqrt(upper));
		}

		@Override
		public Interval asInterval() {
			return this;
		}

		@Override
		public String domain() {
			return "interval";
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Interval) {
				Interval i = (Interval) o;
				return Double.compare(lower, i.lower) == 0 && Double.compare(upper, i.upper) == 0;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Double.hashCode(lower) * 31 + Double.hashCode(upper);
		}

		@Override
		public String toString() {
			return "[" + lower + ", " + upper + "]";
		}
	}

	// ==============================================================
	// Vector
	// ==============================================================

	public static final class Vector extends Value {
		private final double[] components;

		public Vector(double... components) {
			this.components = components.clone();
		}

		public int size() {
			return components.length;
		}

		public double get(int i) {
			return components[i];
		}

		public double[] toArray() {
			return components.clone();
		}

		public double magnitude() {
			return Math.sqrt(dot(this));
		}

		public Vector normalize() {
			double m = magnitude();
			if (m == 0) {
				throw new EvaluatorException("cannot normalise the zero vector");
			}
			return scale(1 / m);
		}

		public Vector add(Vector v) {
			checkSize(v);
			double[] r = new double[components.length];
			for (int i = 0; i != r.length; ++i) {
				r[i] = components[i] + v.components[i];
			}
			return new Vector(r);
		}

		public Vector subtract(Vector v) {
			return add(v.scale(-1));
		}

		public Vector scale(double s) {
			double[] r = new double[components.length];
			for (int i = 0; i != r.length; ++i) {
				r[i] = components[i] * s;
			}
			return new Vector(r);
		}

		public double dot(Vector v) {
			checkSize(v);
			double r = 0;
			for (int i = 0; i != components.length; ++i) {
				r += components[i] * v.components[i];
			}
			return r;
		}

		public Vector cross(Vector v) {
			if (components.length != 3 || v.components.length != 3) {
				throw new EvaluatorException("cross product requires 3-dimensional vectors");
			}
			double[] a = components;
			double[] b = v.components;
			return new Vector(a[1] * b[2] - a[2] * b[1], a[2] * b[0] - a[0] * b[2], a[0] * b[1] - a[1] * b[0]);
		}

		private void checkSize(Vector v) {
			if (v.components.length != components.length) {
				throw new EvaluatorException(
						"vector dimension mismatch (" + components.length + " vs " + v.components.length + ")");
			}
		}

		@Override
		public Vector asVector() {
			return this;
		}

		@Override
		public String domain() {
			return "vector";
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Vector && Arrays.equals(((Vector) o).components, components);
		}

		@Override
		public int hashCode() {
			return Arrays.hashCode(components);
		}

		@Override
		public String toString() {
			return Arrays.toString(components);
		}
	}

	// ==============================================================
	// Matrix
	// ==============================================================

	public static final class Matrix extends Value {
		/**
		 * Largest exponent magnitude accepted by {@link #power(int)}.
		 */
		public static final int MAX_POWER = 1 << 20;

		private final double[][] cells;

		public Matrix(double[][] cells) {
			if (cells.length == 0) {
				throw new EvaluatorException("matrix must have at least one row");
			}
			this.cells = new double[cells.length][];
			for (int i = 0; i != cells.length; ++i) {
				if (cells[i].length != cells[0].length) {
					throw new EvaluatorException("matrix rows must have the same length");
				}
				this.cells[i] = cells[i].clone();
			}
		}

		public static Matrix identity(int n) {
			double[][] r = new double[n][n];
			for (int i = 0; i != n; ++i) {
				r[i][i] = 1;
			}
			return new Matrix(r);
		}

		public int rows() {
			return cells.length;
		}

		public int columns() {
			return cells[0].length;
		}

		public double get(int i, int j) {
			return cells[i][j];
		}

		public boolean isSquare() {
			return rows() == columns();
		}

		public Matrix add(Matrix m) {
			checkSameShape(m);
			double[][] r = new double[rows()][columns()];
			for (int i = 0; i != rows(); ++i) {
				for (int j = 0; j != columns(); ++j) {
					r[i][j] = cells[i][j] + m.cells[i][j];
				}
			}
			return new Matrix(r);
		}

		public Matrix subtract(Matrix m) {
			return add(m.scale(-1));
		}

		public Matrix scale(double s) {
			double[][] r = new double[rows()][columns()];
			for (int i = 0; i != rows(); ++i) {
				for (int j = 0; j != columns(); ++j) {
					r[i][j] = cells[i][j] * s;
				}
			}
			return new Matrix(r);
		}

		public Matrix multiply(Matrix m) {
			if (columns() != m.rows()) {
				throw new EvaluatorException("matrix dimension mismatch for multiplication (" + rows() + "x"
						+ columns() + " * " + m.rows() + "x" + m.columns() + ")");
			}
			double[][] r = new double[rows()][m.columns()];
			for (int i = 0; i != rows(); ++i) {
				for (int j = 0; j != m.columns(); ++j) {
					double s = 0;
					for (int k = 0; k != columns(); ++k) {
						s += cells[i][k] * m.cells[k][j];
					}
					r[i][j] = s;
				}
			}
			return new Matrix(r);
		}

		public Matrix transpose() {
			double[][] r = new double[columns()][rows()];
			for (int i = 0; i != rows(); ++i) {
				for (int j = 0; j != columns(); ++j) {
					r[j][i] = cells[i][j];
				}
			}
			return new Matrix(r);
		}

		/**
		 * Raise this matrix to an integer power by repeated squaring. A
		 * negative power inverts first.
		 *
		 * @param n
		 *            Exponent, whose magnitude is at most {@link #MAX_POWER}.
		 * @return
		 */
		public Matrix power(int n) {
			checkSquare("power");
			if (n > MAX_POWER || n < -MAX_POWER) {
				throw new EvaluatorException("matrix exponent " + n + " exceeds maximum of " + MAX_POWER);
			} else if (n < 0) {
				return inverse().power(-n);
			}
			Matrix r = identity(rows());
			Matrix b = this;
			while (n != 0) {
				if ((n & 1) != 0) {
					r = r.multiply(b);
				}
				n = n >> 1;
				if (n != 0) {
					b = b.multiply(b);
				}
			}
			return r;
		}

		public double trace() {
			checkSquare("trace");
			double t = 0;
			for (int i = 0; i != rows(); ++i) {
				t += cells[i][i];
			}
			return t;
		}

		/**
		 * Compute the determinant using Gaussian elimination with partial
		 * pivoting.
		 *
		 * @return
		 */
		public double determinant() {
			checkSquare("determinant");
			int n = rows();
			double[][] a = copy();
			double det = 1;
			for (int c = 0; c != n; ++c) {
				int pivot = c;
				for (int r = c + 1; r < n; ++r) {
					if (Math.abs(a[r][c]) > Math.abs(a[pivot][c])) {
						pivot = r;
					}
				}
				if (a[pivot][c] == 0) {
					return 0;
				}
				if (pivot != c) {
					double[] tmp = a[pivot];
					a[pivot] = a[c];
					a[c] = tmp;
					det = -det;
				}
				det *= a[c][c];
				for (int r = c + 1; r < n; ++r) {
					double f = a[r][c] / a[c][c];
					for (int k = c; k < n; ++k) {
						a[r][k] -= f * a[c][k];
					}
				}
			}
			return det;
		}

		/**
		 * Compute the inverse using Gauss-Jordan elimination.
		 *
		 * @return
		 */
		public Matrix inverse() {
			checkSquare("inverse");
			int n = rows();
			double[][] a = copy();
			double[][] inv = identity(n).copy();
			for (int c = 0; c != n; ++c) {
				int pivot = c;
				for (int r = c + 1; r < n; ++r) {
					if (Math.abs(a[r][c]) > Math.abs(a[pivot][c])) {
						pivot = r;
					}
				}
				if (Math.abs(a[pivot][c]) < 1e-12) {
					throw new EvaluatorException("matrix is singular and cannot be inverted");
				}
				double[] tmp = a[pivot];
				a[pivot] = a[c];
				a[c] = tmp;
				tmp = inv[pivot];
				inv[pivot] = inv[c];
				inv[c] = tmp;
				double p = a[c][c];
				for (int k = 0; k != n; ++k) {
					a[c][k] /= p;
					inv[c][k] /= p;
				}
				for (int r = 0; r != n; ++r) {
					if (r != c) {
						double f = a[r][c];
						for (int k = 0; k != n; ++k) {
							a[r][k] -= f * a[c][k];
							inv[r][k] -= f * inv[c][k];
						}
					}
				}
			}
			return new Matrix(inv);
		}

		private double[][] copy() {
			double[][] r = new double[rows()][];
			for (int i = 0; i != rows(); ++i) {
				r[i] = cells[i].clone();
			}
			return r;
		}

		private void checkSquare(String operation) {
			if (!isSquare()) {
				throw new EvaluatorException(operation + " requires a square matrix");
			}
		}

		private void checkSameShape(Matrix m) {
			if (rows() != m.rows() || columns() != m.columns()) {
				throw new EvaluatorException("matrix dimension mismatch (" + rows() + "x" + columns() + " vs "
						+ m.rows() + "x" + m.columns() + ")");
			}
		}

		@Override
		public Matrix asMatrix() {
			return this;
		}

		@Override
		public String domain() {
			return "matrix";
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Matrix && Arrays.deepEquals(((Matrix) o).cells, cells);
		}

		@Override
		public int hashCode() {
			return Arrays.deepHashCode(cells);
		}

		@Override
		public String toString() {
			return Arrays.deepToString(cells);
		}
	}

	// ==============================================================
	// Boolean
	// ==============================================================

	public static final class Bool extends Value {
		public static final Bool TRUE = new Bool(true);
		public static final Bool FALSE = new Bool(false);

		private final boolean value;

		private Bool(boolean value) {
			this.value = value;
		}

		public static Bool of(boolean b) {
			return b ? TRUE : FALSE;
		}

		@Override
		public boolean asBoolean() {
			return value;
		}

		@Override
		public String domain() {
			return "boolean";
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Bool && ((Bool) o).value == value;
		}

		@Override
		public int hashCode() {
			return value ? 1 : 0;
		}

		@Override
		public String toString() {
			return Boolean.toString(value);
		}
	}
}

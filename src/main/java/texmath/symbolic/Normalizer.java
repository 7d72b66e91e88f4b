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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;

import texmath.core.Syntax.Expression;
import texmath.core.Syntax.Expression.Binary;
import texmath.util.EvaluatorException;

/**
 * Puts sums and products into a canonical form, such that expressions which
 * differ only in the order or grouping of their terms become structurally
 * equal. Sums are flattened and like terms collected, and the same is done
 * for the factors of a product (so <code>x \cdot 2 \cdot x</code> becomes
 * <code>2 \cdot x^{2}</code>). Terms are ordered with numbers first, then
 * variables alphabetically, then everything else by its LaTeX form.
 * Multiplication written with <code>\times</code> is never reordered.
 *
 * @author David J. Pearce
 *
 */
public class Normalizer {
	public static final int DEFAULT_MAX_DEPTH = 500;

	/**
	 * A term of a sum, made up from a numeric coefficient and a symbolic core.
	 * A constant term has a null core.
	 */
	public static final class Term {
		private final double coefficient;
		private final Expression core;

		public Term(double coefficient, Expression core) {
			this.coefficient = coefficient;
			this.core = core;
		}

		public double coefficient() {
			return coefficient;
		}

		public Expression core() {
			return core;
		}

		@Override
		public String toString() {
			return coefficient + (core == null ? "" : "*" + core);
		}
	}

	private static final Comparator<Expression> ORDER = new Comparator<Expression>() {
		@Override
		public int compare(Expression lhs, Expression rhs) {
			boolean lv = lhs instanceof Expression.Variable;
			boolean rv = rhs instanceof Expression.Variable;
			if (lv && rv) {
				return ((Expression.Variable) lhs).name().compareTo(((Expression.Variable) rhs).name());
			} else if (lv != rv) {
				return lv ? -1 : 1;
			}
			return lhs.toLatex().compareTo(rhs.toLatex());
		}
	};

	private final int maxDepth;

	public Normalizer() {
		this(DEFAULT_MAX_DEPTH);
	}

	public Normalizer(int maxDepth) {
		this.maxDepth = maxDepth;
	}

	public Expression normalize(Expression e) {
		return normalize(e, 0);
	}

	private Expression normalize(Expression e, int depth) {
		if (depth > maxDepth) {
			throw new EvaluatorException("maximum recursion depth of " + maxDepth + " exceeded", e);
		}
		// Normalise children
		List<Expression> children = e.children();
		if (!children.isEmpty()) {
			ArrayList<Expression> nchildren = new ArrayList<>();
			boolean changed = false;
			for (Expression child : children) {
				Expression nchild = normalize(child, depth + 1);
				changed |= nchild != child;
				nchildren.add(nchild);
			}
			if (changed) {
				e = e.withChildren(nchildren);
			}
		}
		// Normalise this node
		if (isSum(e)) {
			return sum(terms(e));
		} else if (isProduct(e)) {
			return product(e);
		} else if (e instanceof Expression.Negation) {
			Expression operand = ((Expression.Negation) e).operand();
			if (operand instanceof Expression.Negation) {
				return ((Expression.Negation) operand).operand();
			} else if (operand instanceof Expression.Literal) {
				return num(-((Expression.Literal) operand).value());
			}
		} else if (e instanceof Binary) {
			Binary b = (Binary) e;
			if (isNumber(b.leftOperand()) && isNumber(b.rightOperand())) {
				Expression folded = fold(b.op(), numberValue(b.leftOperand()), numberValue(b.rightOperand()));
				return folded == null ? e : folded;
			}
		}
		return e;
	}

	// ==============================================================
	// Sums
	// ==============================================================

	/**
	 * Split an expression into its terms, treating it as a sum. Like terms are
	 * combined, zero terms dropped, and the remainder put into canonical order.
	 * The expression is assumed to be normalised already.
	 *
	 * @param e
	 * @return
	 */
	public List<Term> terms(Expression e) {
		ArrayList<Term> raw = new ArrayList<>();
		collect(e, 1, raw);
		double constant = 0;
		LinkedHashMap<Expression, Double> cores = new LinkedHashMap<>();
		for (Term t : raw) {
			if (t.core == null) {
				constant += t.coefficient;
			} else {
				Double c = cores.get(t.core);
				cores.put(t.core, c == null ? t.coefficient : c + t.coefficient);
			}
		}
		ArrayList<Expression> order = new ArrayList<>(cores.keySet());
		order.sort(ORDER);
		ArrayList<Term> result = new ArrayList<>();
		if (constant != 0) {
			result.add(new Term(constant, null));
		}
		for (Expression core : order) {
			double c = cores.get(core);
			if (c != 0) {
				result.add(new Term(c, core));
			}
		}
		return result;
	}

	private static void collect(Expression e, double sign, List<Term> terms) {
		if (is(e, Binary.Op.ADD)) {
			Binary b = (Binary) e;
			collect(b.leftOperand(), sign, terms);
			collect(b.rightOperand(), sign, terms);
		} else if (is(e, Binary.Op.SUB)) {
			Binary b = (Binary) e;
			collect(b.leftOperand(), sign, terms);
			collect(b.rightOperand(), -sign, terms);
		} else if (e instanceof Expression.Negation) {
			collect(((Expression.Negation) e).operand(), -sign, terms);
		} else if (isNumber(e)) {
			terms.add(new Term(sign * numberValue(e), null));
		} else {
			List<Expression> factors = factors(e);
			if (factors.size() > 1 && isNumber(factors.get(0))) {
				double c = numberValue(factors.get(0));
				terms.add(new Term(sign * c, chain(factors.subList(1, factors.size()))));
			} else {
				terms.add(new Term(sign, e));
			}
		}
	}

	/**
	 * Build a sum from a list of terms, as a right-associated chain in which
	 * negative terms are negations.
	 *
	 * @param terms
	 * @return
	 */
	public Expression sum(List<Term> terms) {
		Expression result = null;
		for (int i = terms.size() - 1; i >= 0; --i) {
			Term t = terms.get(i);
			double c = t.coefficient;
			Expression term;
			if (t.core == null) {
				term = num(c);
			} else if (c < 0) {
				term = neg(magnitude(-c, t.core));
			} else {
				term = magnitude(c, t.core);
			}
			result = result == null ? term : add(term, result);
		}
		return result == null ? ZERO : result;
	}

	private static Expression magnitude(double c, Expression core) {
		if (c == 1) {
			return core;
		}
		ArrayList<Expression> factors = new ArrayList<>();
		factors.add(num(c));
		factors.addAll(factors(core));
		return chain(factors);
	}

	private static boolean isSum(Expression e) {
		if (e instanceof Expression.Negation) {
			e = ((Expression.Negation) e).operand();
		}
		return is(e, Binary.Op.ADD) || is(e, Binary.Op.SUB);
	}

	// ==============================================================
	// Products
	// ==============================================================

	private static boolean isProduct(Expression e) {
		return is(e, Binary.Op.MUL) && !((Binary) e).isCross();
	}

	private static List<Expression> factors(Expression e) {
		ArrayList<Expression> factors = new ArrayList<>();
		factors(e, factors);
		return factors;
	}

	private static void factors(Expression e, List<Expression> factors) {
		if (isProduct(e)) {
			Binary b = (Binary) e;
			factors(b.leftOperand(), factors);
			factors(b.rightOperand(), factors);
		} else {
			factors.add(e);
		}
	}

	private static Expression chain(List<Expression> factors) {
		Expression result = factors.get(factors.size() - 1);
		for (int i = factors.size() - 2; i >= 0; --i) {
			result = mul(factors.get(i), result);
		}
		return result;
	}

	private Expression product(Expression e) {
		double coefficient = 1;
		LinkedHashMap<Expression, Double> powers = new LinkedHashMap<>();
		for (Expression f : factors(e)) {
			while (f instanceof Expression.Negation) {
				coefficient = -coefficient;
				f = ((Expression.Negation) f).operand();
			}
			if (isNumber(f)) {
				coefficient *= numberValue(f);
				continue;
			}
			Expression base = f;
			double exponent = 1;
			if (is(f, Binary.Op.POW) && isNumber(((Binary) f).rightOperand())) {
				base = ((Binary) f).leftOperand();
				exponent = numberValue(((Binary) f).rightOperand());
			}
			Double n = powers.get(base);
			powers.put(base, n == null ? exponent : n + exponent);
		}
		if (coefficient == 0) {
			return ZERO;
		}
		ArrayList<Expression> bases = new ArrayList<>(powers.keySet());
		bases.sort(ORDER);
		ArrayList<Expression> factors = new ArrayList<>();
		if (Math.abs(coefficient) != 1 || bases.isEmpty()) {
			factors.add(num(Math.abs(coefficient)));
		}
		for (Expression base : bases) {
			double exponent = powers.get(base);
			if (exponent == 1) {
				factors.add(base);
			} else if (exponent != 0) {
				factors.add(pow(base, num(exponent)));
			}
		}
		if (factors.isEmpty()) {
			factors.add(ONE);
		}
		Expression result = chain(factors);
		return coefficient < 0 ? normalizeSign(result) : result;
	}

	private static Expression normalizeSign(Expression e) {
		return e instanceof Expression.Literal ? num(-((Expression.Literal) e).value()) : neg(e);
	}
}

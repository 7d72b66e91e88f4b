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

import java.util.HashMap;
import java.util.Random;
import java.util.TreeSet;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

import texmath.core.Evaluator;
import texmath.core.Syntax;
import texmath.core.Syntax.Expression;
import texmath.core.Value;
import texmath.core.Value.Complex;
import texmath.core.Value.Real;
import texmath.util.EvaluatorException;

/**
 * Decides whether two expressions are equivalent, at one of three levels of
 * increasing strength. Each level accepts everything the previous one does,
 * so a pair found equivalent at some level is also equivalent at every level
 * above it.
 *
 * @author David J. Pearce
 *
 */
public class EquivalenceChecker {
	private static final Logger logger = Logger.getLogger(EquivalenceChecker.class.getName());

	public enum Level {
		/**
		 * The expressions are identical as trees.
		 */
		STRUCTURAL,
		/**
		 * The expressions simplify to identical trees.
		 */
		ALGEBRAIC,
		/**
		 * The expressions agree at a fixed set of sample points.
		 */
		NUMERIC
	}

	public static final int SAMPLES = 10;
	public static final long SEED = 42;
	public static final double RANGE = 10;
	public static final double TOLERANCE = 1e-9;

	private final UnaryOperator<Expression> simplifier;
	private final Evaluator evaluator;

	public EquivalenceChecker(UnaryOperator<Expression> simplifier, Evaluator evaluator) {
		this.simplifier = simplifier;
		this.evaluator = evaluator;
	}

	public boolean areEquivalent(Expression lhs, Expression rhs, Level level) {
		switch (level) {
		case STRUCTURAL:
			return lhs.equals(rhs);
		case ALGEBRAIC:
			return areEquivalent(lhs, rhs, Level.STRUCTURAL)
					|| simplifier.apply(lhs).equals(simplifier.apply(rhs));
		default:
			return areEquivalent(lhs, rhs, Level.ALGEBRAIC) || agreeNumerically(lhs, rhs);
		}
	}

	/**
	 * Compare two expressions at pseudo-random values of their free variables,
	 * drawn from a fixed seed so the outcome is reproducible. Points at which
	 * either side fails to evaluate, or is not finite, are skipped. The
	 * expressions agree if they agree at every remaining point, and at least
	 * one point remains.
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	private boolean agreeNumerically(Expression lhs, Expression rhs) {
		TreeSet<String> variables = new TreeSet<>(Syntax.freeVariables(lhs));
		variables.addAll(Syntax.freeVariables(rhs));
		variables.removeAll(Evaluator.RESERVED);
		variables.remove("infty");
		Random random = new Random(SEED);
		int compared = 0;
		for (int i = 0; i != SAMPLES; ++i) {
			HashMap<String, Value> bindings = new HashMap<>();
			for (String v : variables) {
				bindings.put(v, new Real(RANGE * (2 * random.nextDouble() - 1)));
			}
			Value l;
			Value r;
			try {
				l = evaluator.evaluate(lhs, bindings);
				r = evaluator.evaluate(rhs, bindings);
			} catch (EvaluatorException e) {
				logger.fine(() -> "skipping sample " + bindings + ": " + e.getMessage());
				continue;
			}
			if (!isFinite(l) || !isFinite(r)) {
				continue;
			} else if (!close(l, r)) {
				return false;
			}
			compared++;
		}
		return compared > 0;
	}

	private static boolean isFinite(Value v) {
		if (v instanceof Real) {
			double d = ((Real) v).value();
			return !Double.isNaN(d) && !Double.isInfinite(d);
		} else if (v instanceof Complex) {
			Complex c = (Complex) v;
			return Double.isFinite(c.re()) && Double.isFinite(c.im());
		}
		return true;
	}

	private static boolean close(Value l, Value r) {
		if (l instanceof Real && r instanceof Real) {
			return close(((Real) l).value(), ((Real) r).value());
		} else if ((l instanceof Real || l instanceof Complex) && (r instanceof Real || r instanceof Complex)) {
			Complex lc = toComplex(l);
			Complex rc = toComplex(r);
			return close(lc.re(), rc.re()) && close(lc.im(), rc.im());
		}
		return l.equals(r);
	}

	private static Complex toComplex(Value v) {
		return v instanceof Real ? new Complex(((Real) v).value(), 0) : (Complex) v;
	}

	private static boolean close(double a, double b) {
		return Math.abs(a - b) <= TOLERANCE + TOLERANCE * Math.max(Math.abs(a), Math.abs(b));
	}
}

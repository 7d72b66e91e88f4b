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

import texmath.core.Evaluator;
import texmath.core.Syntax.Expression;
import texmath.core.Value;
import texmath.util.EvaluatorException;

/**
 * Numeric integration using the composite Simpson's rule. Infinite bounds are
 * clamped to a finite range before integrating.
 *
 * @author David J. Pearce
 *
 */
public class SimpsonIntegrator implements NumericIntegrator {
	public static final int DEFAULT_STEPS = 10_000;
	public static final double DEFAULT_CLAMP = 100;

	private final int steps;
	private final double clamp;

	public SimpsonIntegrator() {
		this(DEFAULT_STEPS, DEFAULT_CLAMP);
	}

	public SimpsonIntegrator(int steps, double clamp) {
		if (steps <= 0 || steps % 2 != 0) {
			throw new IllegalArgumentException("number of steps must be positive and even");
		}
		this.steps = steps;
		this.clamp = clamp;
	}

	@Override
	public double integrate(Expression body, String variable, double lower, double upper, Evaluator evaluator,
			Evaluator.Environment environment) {
		if (Double.isNaN(lower) || Double.isNaN(upper)) {
			throw new EvaluatorException("integral bounds cannot be NaN");
		}
		double a = clamp(lower);
		double b = clamp(upper);
		if (a == b) {
			return 0;
		}
		double h = (b - a) / steps;
		double sum = f(body, variable, a, evaluator, environment) + f(body, variable, b, evaluator, environment);
		for (int k = 1; k < steps; ++k) {
			double x = a + k * h;
			sum += (k % 2 == 1 ? 4 : 2) * f(body, variable, x, evaluator, environment);
		}
		return sum * h / 3;
	}

	private double clamp(double x) {
		return Math.max(-clamp, Math.min(clamp, x));
	}

	private static double f(Expression body, String variable, double x, Evaluator evaluator,
			Evaluator.Environment environment) {
		return evaluator.apply(environment.bind(variable, new Value.Real(x)), body).asReal();
	}
}

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

/**
 * Computes definite integrals numerically, for use when no closed-form
 * antiderivative can be found.
 *
 * @author David J. Pearce
 *
 */
public interface NumericIntegrator {

	/**
	 * Approximate the integral of a given body over an interval.
	 *
	 * @param body        The integrand
	 * @param variable    The variable of integration
	 * @param lower       The lower bound, which may be infinite
	 * @param upper       The upper bound, which may be infinite
	 * @param evaluator   Used to evaluate the integrand at each point
	 * @param environment Bindings for any other free variables of the body
	 * @return
	 */
	public double integrate(Expression body, String variable, double lower, double upper, Evaluator evaluator,
			Evaluator.Environment environment);
}

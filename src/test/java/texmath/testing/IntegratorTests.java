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
package texmath.testing;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import texmath.TexMath;
import texmath.core.Syntax.Expression;
import texmath.core.Value;
import texmath.core.Value.Real;
import texmath.util.EvaluatorException;

public class IntegratorTests {
	private static final TexMath tm = new TexMath(new TexMath.Options());
	private static final double H = 1e-5;

	@Test
	public void test_0x001() {
		assertEquals(9, eval(tm.integrate("x^2", "x"), 3), 1e-9);
	}

	@Test
	public void test_0x002() {
		assertEquals(Math.log(2), eval(tm.integrate("\\frac{1}{x}", "x"), -2), 1e-9);
	}

	@Test
	public void test_0x003() {
		check("3x^2 + 2x + 1", 1.5);
		check("\\sin(x)", 0.4);
	}

	@Test
	public void test_0x004() {
		check("\\cos(2x)", 0.8);
		check("e^{3x}", 0.2);
		check("\\exp(2x + 1)", -0.5);
	}

	@Test
	public void test_0x005() {
		check("\\frac{5}{x^3}", 1.7);
		check("2^{x}", 1.1);
	}

	@Test
	public void test_0x006() {
		// No closed form
		assertTrue(tm.integrate("e^{x^2}", "x") instanceof Expression.Integral);
		assertTrue(tm.integrate("x \\sin(x)", "x") instanceof Expression.Integral);
	}

	@Test
	public void test_0x007() {
		// Indefinite integrals evaluate their antiderivative at the current binding
		assertEquals(8.0 / 3, eval(tm.parse("\\int x^2 dx"), 2), 1e-9);
		assertThrows(EvaluatorException.class, () -> eval(tm.parse("\\int e^{x^2} dx"), 2));
	}

	@Test
	public void test_0x008() {
		assertThrows(EvaluatorException.class, () -> tm.evaluate("\\oint_0^1 x dx"));
	}

	/**
	 * Check that differentiating the antiderivative recovers the integrand,
	 * using a central finite difference.
	 */
	private static void check(String input, double x) {
		Expression f = tm.parse(input);
		Expression F = tm.integrate(input, "x");
		assertFalse(F instanceof Expression.Integral);
		double derivative = (eval(F, x + H) - eval(F, x - H)) / (2 * H);
		assertEquals(eval(f, x), derivative, 1e-5 * Math.max(1, Math.abs(eval(f, x))));
	}

	private static double eval(Expression e, double x) {
		Map<String, Value> env = new HashMap<>();
		env.put("x", new Real(x));
		return tm.evaluate(e, env).asReal();
	}
}

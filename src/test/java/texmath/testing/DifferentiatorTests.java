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
import texmath.core.Terms;
import texmath.core.Value;
import texmath.core.Value.Real;
import texmath.util.EvaluatorException;

public class DifferentiatorTests {
	private static final TexMath tm = new TexMath(new TexMath.Options());
	private static final double H = 1e-5;

	@Test
	public void test_0x001() {
		assertEquals(tm.parse("3x^2"), tm.differentiate("x^3", "x"));
	}

	@Test
	public void test_0x002() {
		assertEquals(Terms.ZERO, tm.differentiate("y^2", "x"));
	}

	@Test
	public void test_0x003() {
		check("x^3", 2);
		check("x^3 + \\sin(x)", 0);
	}

	@Test
	public void test_0x004() {
		check("\\sin(x) x^2", 0.7);
		check("\\cos(3x)", 1.1);
	}

	@Test
	public void test_0x005() {
		check("e^{2x}", 0.3);
		check("\\exp(x^2)", 0.5);
	}

	@Test
	public void test_0x006() {
		check("\\ln(x^2 + 1)", 0.7);
		check("\\log_{2}(x)", 3);
	}

	@Test
	public void test_0x007() {
		check("\\frac{x}{1 + x^2}", 1.5);
		check("\\sqrt{x}", 2);
	}

	@Test
	public void test_0x008() {
		check("\\tan(x)", 0.5);
		check("x^x", 1.3);
	}

	@Test
	public void test_0x009() {
		check("|x|", -2);
		check("-x^4 + 2x - 7", 1.2);
	}

	@Test
	public void test_0x010() {
		// Higher order
		assertEquals(12, eval(tm.differentiate("x^3", "x", 2), 2), 1e-9);
		assertEquals(6, eval(tm.differentiate("x^3", "x", 3), 2), 1e-9);
		assertEquals(-Math.sin(0.4), eval(tm.differentiate("\\sin(x)", "x", 2), 0.4), 1e-9);
	}

	@Test
	public void test_0x011() {
		assertThrows(EvaluatorException.class, () -> tm.differentiate("x^3", "x", 11));
	}

	@Test
	public void test_0x012() {
		// Partial derivatives hold other variables constant
		HashMap<String, Value> env = new HashMap<>();
		env.put("x", new Real(2));
		env.put("y", new Real(3));
		assertEquals(12, tm.evaluate("\\frac{\\partial}{\\partial x} x^2 y", env).asReal(), 1e-9);
	}

	/**
	 * Compare the derivative at a point against a central finite difference.
	 */
	private static void check(String input, double x) {
		Expression f = tm.parse(input);
		Expression df = tm.differentiate(input, "x");
		double expected = (eval(f, x + H) - eval(f, x - H)) / (2 * H);
		assertEquals(expected, eval(df, x), 1e-5);
	}

	private static double eval(Expression e, double x) {
		Map<String, Value> env = new HashMap<>();
		env.put("x", new Real(x));
		return tm.evaluate(e, env).asReal();
	}
}

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

/**
 * Check that printing an expression back to LaTeX gives source text which
 * parses to an expression with the same meaning.
 */
public class RoundTripTests {
	private static final TexMath tm = new TexMath(new TexMath.Options());

	@Test
	public void test_0x001() {
		check("2 + 3 \\cdot 4");
		check("x^2 - 3x + 1");
		check("x - (y - 1)");
		check("-x^3 + |x|");
	}

	@Test
	public void test_0x002() {
		check("\\frac{x + 1}{x - 1}");
		check("(x - y)(x + y)");
		check("2^{3^{x}}");
		check("e^{-x} \\cdot y");
	}

	@Test
	public void test_0x003() {
		check("\\sin(x)^2 + \\cos(2x)");
		check("\\sqrt{x^2 + 1}");
		check("\\sqrt[3]{x}");
		check("\\log_{2}(x + 4)");
	}

	@Test
	public void test_0x004() {
		check("\\sum_{i=1}^{5} i x");
		check("\\prod_{k=1}^{4} (k + y)");
		check("\\binom{5}{2} x");
	}

	@Test
	public void test_0x005() {
		check("\\int_0^1 t^2 y \\, dt");
		check("\\frac{d}{dx}(x^3 + y)");
		check("\\lim_{t \\to 1} t^2 + x");
		check("\\nabla^2{x^3 y} + x");
	}

	@Test
	public void test_0x006() {
		check("x^2, x > 0");
		check("\\begin{cases} x & x > 1 \\\\ y & \\text{otherwise} \\end{cases}");
	}

	@Test
	public void test_0x007() {
		// Normalised forms print and reparse too
		String[] inputs = { "a - b - c", "-2x + 3y - 1", "x (y + 1) z" };
		for (String input : inputs) {
			Expression n = tm.symbolic().normalize(tm.parse(input));
			assertEquals(eval(n), eval(tm.parse(n.toLatex())), 1e-9, n.toLatex());
		}
	}

	@Test
	public void test_0x008() {
		String input = "x^2 - 3x + 1";
		Expression e = tm.parse(input);
		assertEquals(e, tm.parse(e.toLatex()));
	}

	private static void check(String input) {
		Expression e = tm.parse(input);
		String latex = e.toLatex();
		Expression r = tm.parse(latex);
		assertEquals(eval(e), eval(r), 1e-9, latex);
	}

	private static double eval(Expression e) {
		Map<String, Value> env = new HashMap<>();
		env.put("x", new Real(0.7));
		env.put("y", new Real(1.3));
		env.put("a", new Real(2.5));
		env.put("b", new Real(-1.5));
		env.put("c", new Real(4));
		env.put("z", new Real(-0.4));
		return tm.evaluate(e, env).asReal();
	}
}

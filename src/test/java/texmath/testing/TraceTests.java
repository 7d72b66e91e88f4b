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
import static texmath.core.Terms.*;

import org.junit.jupiter.api.Test;

import texmath.TexMath;
import texmath.core.Syntax.Expression;
import texmath.util.Trace;

public class TraceTests {
	private static final TexMath tm = new TexMath(new TexMath.Options());

	@Test
	public void test_0x001() {
		// Tracing never changes the result
		String[] inputs = { "x + 0", "\\ln(e) + x \\cdot 1", "\\sin^2 x + \\cos^2 x", "2x + 3x", "(x^2)^{0.5}" };
		for (String input : inputs) {
			assertEquals(tm.simplify(input), tm.simplifyWithSteps(input).result(), input);
		}
		assertEquals(tm.expand("(a+b)^2"), tm.expandWithSteps("(a+b)^2").result());
		assertEquals(tm.expandTrig("\\sin(2x)"), tm.expandTrigWithSteps("\\sin(2x)").result());
		assertEquals(tm.factor("x^2 + 5x + 6"), tm.factorWithSteps("x^2 + 5x + 6").result());
	}

	@Test
	public void test_0x002() {
		Trace t = tm.simplifyWithSteps("\\ln(e) + y");
		assertFalse(t.isEmpty());
		assertTrue(hasStep(t, "log-base", call("ln", var("e")), ONE), t.toString());
		for (Trace.Step s : t.steps()) {
			assertNotEquals(s.before(), s.after(), s.rule());
		}
	}

	@Test
	public void test_0x003() {
		// Nothing to do
		Trace t = tm.simplifyWithSteps("x");
		assertTrue(t.isEmpty());
		assertEquals(var("x"), t.result());
		assertEquals("no steps", t.toString());
	}

	@Test
	public void test_0x004() {
		Trace t = tm.factorWithSteps("x^2 - 4");
		assertEquals(tm.parse("(x-2)(x+2)"), t.result());
		assertEquals("difference-of-squares", t.steps().get(t.steps().size() - 1).rule());
		// Normalisation alone, since nothing factors
		for (Trace.Step s : tm.factorWithSteps("x^2 + 1").steps()) {
			assertEquals("normalize", s.rule());
		}
	}

	@Test
	public void test_0x005() {
		Trace t = tm.differentiateWithSteps("x^2 + \\sin(x)", "x");
		assertEquals(tm.differentiate("x^2 + \\sin(x)", "x"), t.result());
		Expression body = tm.parse("x^2 + \\sin(x)");
		Trace.Step last = null;
		for (Trace.Step s : t.steps()) {
			if (s.rule().equals("sum-rule")) {
				last = s;
			}
		}
		assertNotNull(last, t.toString());
		assertEquals(new Expression.Derivative(body, "x", 1), last.before());
		assertTrue(t.steps().stream().anyMatch(s -> s.rule().equals("power-rule")));
		assertTrue(t.steps().stream().anyMatch(s -> s.rule().equals("chain-rule")));
	}

	@Test
	public void test_0x006() {
		// Steps are numbered in the order applied
		Trace t = tm.differentiateWithSteps("3x", "x");
		String text = t.toString();
		assertTrue(text.startsWith("Step 1 ["), text);
		assertTrue(text.contains("product-rule"), text);
	}

	private static boolean hasStep(Trace t, String rule, Expression before, Expression after) {
		for (Trace.Step s : t.steps()) {
			if (s.rule().equals(rule) && s.before().equals(before) && s.after().equals(after)) {
				return true;
			}
		}
		return false;
	}
}

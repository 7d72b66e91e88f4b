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

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import texmath.TexMath;
import texmath.core.Syntax.Expression;
import texmath.core.Value;
import texmath.core.Value.Real;
import texmath.symbolic.Assumptions.Property;

public class SymbolicTests {
	private static final TexMath tm = new TexMath(new TexMath.Options());

	// ==============================================================
	// Simplification
	// ==============================================================

	@Test
	public void test_0x001() {
		checkSimplify("x + 0", "x");
		checkSimplify("x \\cdot 1", "x");
		checkSimplify("0 \\cdot x + y", "y");
	}

	@Test
	public void test_0x002() {
		checkSimplify("x - x", "0");
		checkSimplify("2x + 3x", "5x");
		checkSimplify("x + x", "2x");
	}

	@Test
	public void test_0x003() {
		checkSimplify("\\sin^2 x + \\cos^2 x", "1");
		checkSimplify("\\cos^2 x + y + \\sin^2 x", "1 + y");
	}

	@Test
	public void test_0x004() {
		checkSimplify("\\ln(e)", "1");
		checkSimplify("\\log(10)", "1");
		checkSimplify("\\ln(1)", "0");
	}

	@Test
	public void test_0x005() {
		checkSimplify("(x^2)^3", "x^6");
		checkSimplify("x^1", "x");
		checkSimplify("x^0", "1");
	}

	@Test
	public void test_0x006() {
		checkSimplify("--x", "x");
		checkSimplify("\\sin(-x) + \\sin(x)", "0");
		checkSimplify("\\cos(-x)", "\\cos(x)");
	}

	@Test
	public void test_0x007() {
		checkSimplify("2 + 3 \\cdot 4", "14");
		// Division by zero is left alone
		assertEquals(div(num(1), num(0)), tm.simplify("\\frac{1}{0}"));
	}

	@Test
	public void test_0x008() {
		checkSimplify("x \\cdot x^2", "x^3");
	}

	// ==============================================================
	// Assumptions
	// ==============================================================

	@Test
	public void test_0x009() {
		assertEquals(new Expression.Abs(var("x")), new TexMath(new TexMath.Options()).simplify("\\sqrt{x^2}"));
	}

	@Test
	public void test_0x010() {
		TexMath t = new TexMath(new TexMath.Options());
		t.assume("x", Property.NON_NEGATIVE);
		assertEquals(var("x"), t.simplify("\\sqrt{x^2}"));
		assertEquals(var("x"), t.simplify("|x|"));
	}

	@Test
	public void test_0x011() {
		TexMath t = new TexMath(new TexMath.Options());
		assertEquals(t.parse("\\ln(x^3)"), t.simplify("\\ln(x^3)"));
		t.assume("x", Property.POSITIVE);
		assertEquals(t.parse("3\\ln(x)"), t.simplify("\\ln(x^3)"));
	}

	@Test
	public void test_0x012() {
		TexMath t = new TexMath(new TexMath.Options());
		t.assume("x", Property.POSITIVE);
		assertThrows(IllegalArgumentException.class, () -> t.assume("x", Property.NEGATIVE));
		// The failed assumption leaves earlier ones intact
		assertTrue(t.symbolic().assumptions().has("x", Property.POSITIVE));
		assertFalse(t.symbolic().assumptions().has("x", Property.NEGATIVE));
	}

	@Test
	public void test_0x013() {
		TexMath t = new TexMath(new TexMath.Options());
		t.assume("x", Property.POSITIVE);
		t.symbolic().clearAssumptions();
		assertTrue(t.symbolic().assumptions().isEmpty());
		assertEquals(new Expression.Abs(var("x")), t.simplify("\\sqrt{x^2}"));
	}

	// ==============================================================
	// Expansion
	// ==============================================================

	@Test
	public void test_0x014() {
		checkExpand("(a+b)^2", "a^2 + 2ab + b^2");
	}

	@Test
	public void test_0x015() {
		checkExpand("(x-1)(x+1)", "x^2 - 1");
		checkExpand("2(x+3)", "2x + 6");
	}

	@Test
	public void test_0x016() {
		checkExpand("\\ln(ab)", "\\ln(a) + \\ln(b)");
	}

	@Test
	public void test_0x017() {
		// Numerically equivalent, even where the forms differ
		String[] inputs = { "(x+y)^3", "(x - 2y)^2 (x + 1)", "(a + b + c)^2" };
		for (String input : inputs) {
			Expression e = tm.expand(input);
			assertTrue(tm.symbolic().areEquivalent(tm.parse(input), e,
					texmath.symbolic.EquivalenceChecker.Level.NUMERIC), input);
		}
	}

	@Test
	public void test_0x018() {
		assertEquals(tm.symbolic().normalize(tm.parse("2\\sin(x)\\cos(x)")), tm.expandTrig("\\sin(2x)"));
		assertEquals(tm.symbolic().normalize(tm.parse("\\cos^2 x - \\sin^2 x")), tm.expandTrig("\\cos(2x)"));
	}

	// ==============================================================
	// Factoring
	// ==============================================================

	@Test
	public void test_0x019() {
		assertEquals(tm.parse("(x-2)(x+2)"), tm.factor("x^2 - 4"));
		assertEquals(tm.parse("(x-y)(x+y)"), tm.factor("x^2 - y^2"));
	}

	@Test
	public void test_0x020() {
		assertEquals(tm.parse("(x+2)(x+3)"), tm.factor("x^2 + 5x + 6"));
		assertEquals(tm.parse("(x-3)(x+1)"), tm.factor("x^2 - 2x - 3"));
	}

	@Test
	public void test_0x021() {
		// Nothing to factor
		assertEquals(tm.symbolic().normalize(tm.parse("x^2 + 1")), tm.factor("x^2 + 1"));
	}

	@Test
	public void test_0x022() {
		// Factoring applies within larger expressions
		assertEquals(tm.parse("\\sqrt{(x-1)(x+1)}"), tm.factor("\\sqrt{x^2 - 1}"));
	}

	@Test
	public void test_0x023() {
		// Powers of powers only merge when the base cannot be negative
		TexMath t = new TexMath(new TexMath.Options());
		assertEquals(new Expression.Abs(var("x")), t.simplify("(x^2)^{0.5}"));
		assertEquals(t.symbolic().normalize(t.parse("(x^3)^{0.5}")), t.simplify("(x^3)^{0.5}"));
		t.assume("x", Property.NON_NEGATIVE);
		assertEquals(var("x"), t.simplify("(x^2)^{0.5}"));
		assertEquals(t.parse("x^{1.5}"), t.simplify("(x^3)^{0.5}"));
	}

	@Test
	public void test_0x024() {
		// The simplified form agrees with the input at a negative point
		Map<String, Value> bindings = new HashMap<>();
		bindings.put("x", new Real(-3));
		Expression e = tm.simplify("(x^2)^{0.5}");
		assertEquals(3, tm.evaluate(e, bindings).asReal(), 1e-12);
	}

	private static void checkSimplify(String input, String expected) {
		assertEquals(tm.symbolic().normalize(tm.parse(expected)), tm.simplify(input), input);
	}

	private static void checkExpand(String input, String expected) {
		assertEquals(tm.symbolic().normalize(tm.parse(expected)), tm.expand(input), input);
	}
}

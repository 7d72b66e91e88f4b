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
import static texmath.symbolic.EquivalenceChecker.Level.*;

import org.junit.jupiter.api.Test;

import texmath.TexMath;
import texmath.symbolic.EquivalenceChecker.Level;

public class EquivalenceTests {
	private static final TexMath tm = new TexMath(new TexMath.Options());

	@Test
	public void test_0x001() {
		check("x + 1", "x+1", STRUCTURAL);
		checkNot("x + 1", "1 + x", STRUCTURAL);
	}

	@Test
	public void test_0x002() {
		check("x + 1", "1 + x", ALGEBRAIC);
		check("2x + 3x", "5x", ALGEBRAIC);
		check("\\sin^2 x + \\cos^2 x", "1", ALGEBRAIC);
		check("\\sqrt{x^2}", "|x|", ALGEBRAIC);
	}

	@Test
	public void test_0x003() {
		checkNot("(a+b)^2", "a^2 + 2ab + b^2", ALGEBRAIC);
		check("(a+b)^2", "a^2 + 2ab + b^2", NUMERIC);
	}

	@Test
	public void test_0x004() {
		check("\\sin(2x)", "2\\sin(x)\\cos(x)", NUMERIC);
		check("\\frac{x^2 - 1}{x - 1}", "x + 1", NUMERIC);
		check("e^{\\ln(2)} y", "2y", NUMERIC);
	}

	@Test
	public void test_0x005() {
		checkNot("x^2", "x^3", NUMERIC);
		checkNot("\\sin(x)", "\\cos(x)", NUMERIC);
	}

	@Test
	public void test_0x006() {
		// Undefined everywhere, so never equivalent to anything
		checkNot("\\frac{1}{x - x}", "1", NUMERIC);
	}

	@Test
	public void test_0x007() {
		// Each level accepts everything the one below it does
		String[][] pairs = { { "x + 1", "x + 1" }, { "x + 1", "1 + x" }, { "(x+1)^2", "x^2 + 2x + 1" },
				{ "x", "y" }, { "\\cos(-x)", "\\cos(x)" }, { "\\ln(e^x)", "x" } };
		for (String[] p : pairs) {
			boolean previous = false;
			for (Level level : Level.values()) {
				boolean r = tm.areEquivalent(p[0], p[1], level);
				assertTrue(!previous || r, p[0] + " vs " + p[1] + " at " + level);
				previous = r;
			}
		}
	}

	@Test
	public void test_0x008() {
		// Sampling is deterministic
		for (int i = 0; i != 5; ++i) {
			check("\\tan(x)", "\\frac{\\sin(x)}{\\cos(x)}", NUMERIC);
		}
	}

	@Test
	public void test_0x009() {
		// Merging exponents is unsound for a base of unknown sign
		checkNot("(x^2)^{0.5}", "x", ALGEBRAIC);
		checkNot("(x^2)^{0.5}", "x", NUMERIC);
		check("(x^2)^{0.5}", "|x|", ALGEBRAIC);
	}

	private static void check(String lhs, String rhs, Level level) {
		assertTrue(tm.areEquivalent(lhs, rhs, level), lhs + " vs " + rhs);
	}

	private static void checkNot(String lhs, String rhs, Level level) {
		assertFalse(tm.areEquivalent(lhs, rhs, level), lhs + " vs " + rhs);
	}
}

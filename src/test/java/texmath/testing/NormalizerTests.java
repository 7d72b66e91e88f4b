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

import java.util.List;

import org.junit.jupiter.api.Test;

import texmath.core.Syntax.Expression;
import texmath.io.Lexer;
import texmath.io.Parser;
import texmath.symbolic.Normalizer;

public class NormalizerTests {
	private static final Normalizer normalizer = new Normalizer();

	@Test
	public void test_0x001() {
		check("b + a", add(var("a"), var("b")));
		check("y x", mul(var("x"), var("y")));
	}

	@Test
	public void test_0x002() {
		// Sums are grouped to the right
		check("a + b + c", add(var("a"), add(var("b"), var("c"))));
		check("c + (b + a)", add(var("a"), add(var("b"), var("c"))));
	}

	@Test
	public void test_0x003() {
		check("x + 2 + x", add(num(2), mul(num(2), var("x"))));
		check("x - x", ZERO);
		check("3 - 5", num(-2));
	}

	@Test
	public void test_0x004() {
		check("-(-x)", var("x"));
		check("a - b", add(var("a"), neg(var("b"))));
		check("-2x", neg(mul(num(2), var("x"))));
	}

	@Test
	public void test_0x005() {
		check("2 \\cdot 3", num(6));
		check("x \\cdot x^2", pow(var("x"), num(3)));
		check("0 \\cdot x", ZERO);
	}

	@Test
	public void test_0x006() {
		// Cross products are neither reordered nor combined
		Expression e = parse("b \\times a");
		assertEquals(e, normalizer.normalize(e));
	}

	@Test
	public void test_0x007() {
		// Normalising is idempotent
		String[] inputs = { "x^2 + 3x - 2 + x", "\\sin(y) x - 2 \\cos(x)", "(a + b)(b + a)", "-\\frac{x}{2} + y" };
		for (String input : inputs) {
			Expression n = normalizer.normalize(parse(input));
			assertEquals(n, normalizer.normalize(n), input);
		}
	}

	@Test
	public void test_0x008() {
		List<Normalizer.Term> terms = normalizer.terms(normalizer.normalize(parse("3x - 4 + y - x")));
		assertEquals(3, terms.size());
		assertNull(terms.get(0).core());
		assertEquals(-4, terms.get(0).coefficient(), 0);
		assertEquals(var("x"), terms.get(1).core());
		assertEquals(2, terms.get(1).coefficient(), 0);
		assertEquals(var("y"), terms.get(2).core());
	}

	private static Expression parse(String input) {
		return new Parser(input, new Lexer(input).scan()).parse();
	}

	private static void check(String input, Expression expected) {
		assertEquals(expected, normalizer.normalize(parse(input)), input);
	}
}

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

import texmath.core.Syntax.Expression;
import texmath.io.Lexer;
import texmath.io.Parser;
import texmath.util.ParserException;
import texmath.util.SyntacticElement;

public class ParserTests {

	@Test
	public void test_0x001() {
		check("2 + 3 * 4", add(num(2), mul(num(3), num(4))));
	}

	@Test
	public void test_0x002() {
		check("2x", mul(num(2), var("x")));
	}

	@Test
	public void test_0x003() {
		check("a - b - c", sub(sub(var("a"), var("b")), var("c")));
	}

	@Test
	public void test_0x004() {
		check("-x^2", neg(pow(var("x"), num(2))));
	}

	@Test
	public void test_0x005() {
		check("\\frac{1}{2}", div(num(1), num(2)));
		check("\\frac 1 2", div(num(1), num(2)));
	}

	@Test
	public void test_0x006() {
		// Two digits split into numerator and denominator
		check("\\frac12", div(num(1), num(2)));
		check("\\frac34 + 1", add(div(num(3), num(4)), num(1)));
		// More than two is ambiguous
		ParserException e = assertThrows(ParserException.class, () -> parse("\\frac123"));
		assertNotNull(e.suggestion());
	}

	@Test
	public void test_0x007() {
		check("\\sin^2 x", pow(call("sin", var("x")), num(2)));
	}

	@Test
	public void test_0x008() {
		check("2\\sin(x)\\cos(x)", mul(mul(num(2), call("sin", var("x"))), call("cos", var("x"))));
	}

	@Test
	public void test_0x009() {
		check("|x|", new Expression.Abs(var("x")));
	}

	@Test
	public void test_0x010() {
		check("(x-2)(x+2)", mul(sub(var("x"), num(2)), add(var("x"), num(2))));
	}

	@Test
	public void test_0x011() {
		Expression e = parse("x^2, -5 < x < 5");
		assertTrue(e instanceof Expression.Conditional);
		Expression.Conditional c = (Expression.Conditional) e;
		assertEquals(pow(var("x"), num(2)), c.body());
		assertTrue(c.guard() instanceof Expression.ChainedComparison);
		assertEquals(3, ((Expression.ChainedComparison) c.guard()).operands().size());
	}

	@Test
	public void test_0x012() {
		Expression e = parse("\\begin{cases} x & x > 0 \\\\ -x & \\text{otherwise} \\end{cases}");
		assertTrue(e instanceof Expression.Piecewise);
		Expression.Piecewise p = (Expression.Piecewise) e;
		assertEquals(2, p.cases().size());
		assertNotNull(p.cases().get(0).guard());
		assertNull(p.cases().get(1).guard());
		assertEquals(neg(var("x")), p.cases().get(1).body());
	}

	@Test
	public void test_0x013() {
		Expression e = parse("\\int_0^1 x^2 dx");
		assertTrue(e instanceof Expression.Integral);
		Expression.Integral i = (Expression.Integral) e;
		assertEquals("x", i.variable());
		assertEquals(num(0), i.lower());
		assertEquals(num(1), i.upper());
		assertEquals(pow(var("x"), num(2)), i.body());
	}

	@Test
	public void test_0x014() {
		Expression e = parse("\\int x \\, dx");
		assertTrue(e instanceof Expression.Integral);
		assertFalse(((Expression.Integral) e).isDefinite());
	}

	@Test
	public void test_0x015() {
		Expression e = parse("\\sum_{i=1}^{10} i");
		assertTrue(e instanceof Expression.Sum);
		assertEquals("i", ((Expression.Sum) e).variable());
		assertEquals(var("i"), ((Expression.Sum) e).body());
	}

	@Test
	public void test_0x016() {
		Expression e = parse("\\lim_{x \\to 0} \\frac{\\sin(x)}{x}");
		assertTrue(e instanceof Expression.Limit);
		assertEquals(num(0), ((Expression.Limit) e).target());
	}

	@Test
	public void test_0x017() {
		Expression e = parse("\\frac{d}{dx}(x^3 + \\sin(x))");
		assertTrue(e instanceof Expression.Derivative);
		assertEquals("x", ((Expression.Derivative) e).variable());
		assertEquals(1, ((Expression.Derivative) e).order());
	}

	@Test
	public void test_0x018() {
		Expression e = parse("\\begin{pmatrix} 1 & 2 \\\\ 3 & 4 \\end{pmatrix}");
		assertTrue(e instanceof Expression.Matrix);
		assertEquals(2, ((Expression.Matrix) e).height());
		assertEquals(2, ((Expression.Matrix) e).width());
	}

	@Test
	public void test_0x019() {
		checkInvalid("(x");
	}

	@Test
	public void test_0x020() {
		ParserException e = assertThrows(ParserException.class, () -> parse("x)"));
		assertNotNull(e.suggestion());
		assertEquals(1, e.start());
	}

	@Test
	public void test_0x021() {
		checkInvalid("x +");
	}

	@Test
	public void test_0x022() {
		checkInvalid("\\begin{matrix} 1 & 2 \\end{pmatrix}");
	}

	@Test
	public void test_0x023() {
		// Nesting beyond the depth limit
		String input = "(".repeat(600) + "x" + ")".repeat(600);
		checkInvalid(input);
	}

	@Test
	public void test_0x024() {
		String input = "(".repeat(20) + "x" + ")".repeat(20);
		assertThrows(ParserException.class, () -> new Parser(input, new Lexer(input).scan(), 10, 1000).parse());
		assertEquals(var("x"), new Parser(input, new Lexer(input).scan(), 100, 1000).parse());
	}

	@Test
	public void test_0x025() {
		// Too many nodes
		StringBuilder sb = new StringBuilder("x");
		for (int i = 0; i != 100; ++i) {
			sb.append(" + x");
		}
		String input = sb.toString();
		assertThrows(ParserException.class, () -> new Parser(input, new Lexer(input).scan(), 500, 50).parse());
	}

	@Test
	public void test_0x026() {
		String input = "x + 1 ) )";
		Parser.Result r = new Parser(input, new Lexer(input).scan()).recover();
		assertFalse(r.isValid());
		assertEquals(2, r.errors().size());
		assertEquals(add(var("x"), num(1)), r.expression());
	}

	@Test
	public void test_0x027() {
		String input = "x + 1";
		Parser.Result r = new Parser(input, new Lexer(input).scan()).recover();
		assertTrue(r.isValid());
	}

	@Test
	public void test_0x028() {
		// Parsed nodes record the region of source they cover
		SyntacticElement.Attribute.Source src = parse("x + 12").source();
		assertNotNull(src);
		assertEquals(0, src.start);
		assertEquals(5, src.end);
		assertEquals(6, src.length());
	}

	@Test
	public void test_0x029() {
		check("\\nabla f", new Expression.Gradient(var("f"), false));
		check("\\nabla f^2", new Expression.Gradient(pow(var("f"), num(2)), false));
		check("\\nabla{x^2 + y^2}", new Expression.Gradient(add(pow(var("x"), num(2)), pow(var("y"), num(2))), false));
		check("2\\nabla f", mul(num(2), new Expression.Gradient(var("f"), false)));
	}

	@Test
	public void test_0x030() {
		check("\\nabla^2 f", new Expression.Gradient(var("f"), true));
		check("\\nabla^{2}{x y}", new Expression.Gradient(mul(var("x"), var("y")), true));
		checkInvalid("\\nabla^3 f");
		checkInvalid("\\nabla");
	}

	private static Expression parse(String input) {
		return new Parser(input, new Lexer(input).scan()).parse();
	}

	private static void check(String input, Expression expected) {
		assertEquals(expected, parse(input));
	}

	private static void checkInvalid(String input) {
		assertThrows(ParserException.class, () -> parse(input));
	}
}

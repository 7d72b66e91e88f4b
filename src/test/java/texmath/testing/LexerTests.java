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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import texmath.io.CommandTable;
import texmath.io.Lexer;
import texmath.io.Lexer.Token;
import texmath.io.Lexer.Token.Kind;
import texmath.util.TokenizerException;

public class LexerTests {

	@Test
	public void test_0x001() {
		check("2 + 3", Kind.NUMBER, Kind.PLUS, Kind.NUMBER);
	}

	@Test
	public void test_0x002() {
		check("3.14", Kind.NUMBER);
		assertEquals("3.14", scan("3.14").get(0).text);
	}

	@Test
	public void test_0x003() {
		// Letters split under implicit multiplication
		List<Token> tokens = scan("xy");
		check("xy", Kind.VARIABLE, Kind.VARIABLE);
		assertEquals("x", tokens.get(0).value);
		assertEquals("y", tokens.get(1).value);
	}

	@Test
	public void test_0x004() {
		List<Token> tokens = new Lexer("xy", CommandTable.standard(), false, 100).scan();
		assertEquals(2, tokens.size());
		assertEquals(Kind.VARIABLE, tokens.get(0).kind);
		assertEquals("xy", tokens.get(0).value);
	}

	@Test
	public void test_0x005() {
		check("\\sin(x)", Kind.FUNCTION, Kind.LEFT_PAREN, Kind.VARIABLE, Kind.RIGHT_PAREN);
		assertEquals("sin", scan("\\sin(x)").get(0).value);
	}

	@Test
	public void test_0x006() {
		assertEquals("asin", scan("\\arcsin").get(0).value);
	}

	@Test
	public void test_0x007() {
		check("sin(x)", Kind.FUNCTION, Kind.LEFT_PAREN, Kind.VARIABLE, Kind.RIGHT_PAREN);
	}

	@Test
	public void test_0x008() {
		check("\\pi", Kind.CONSTANT);
		Token t = scan("π").get(0);
		assertEquals(Kind.CONSTANT, t.kind);
		assertEquals("pi", t.value);
	}

	@Test
	public void test_0x009() {
		check("\\left( x \\right)", Kind.LEFT_PAREN, Kind.VARIABLE, Kind.RIGHT_PAREN);
	}

	@Test
	public void test_0x010() {
		check("x \\, + \\; y", Kind.VARIABLE, Kind.PLUS, Kind.VARIABLE);
	}

	@Test
	public void test_0x011() {
		Token t = scan("\\text{otherwise}").get(0);
		assertEquals(Kind.TEXT, t.kind);
		assertEquals("otherwise", t.value);
	}

	@Test
	public void test_0x012() {
		check("x <= 2", Kind.VARIABLE, Kind.LESS_EQUALS, Kind.NUMBER);
		check("x \\leq 2", Kind.VARIABLE, Kind.LESS_EQUALS, Kind.NUMBER);
		check("x \\le 2", Kind.VARIABLE, Kind.LESS_EQUALS, Kind.NUMBER);
	}

	@Test
	public void test_0x013() {
		check("a \\times b \\cdot c", Kind.VARIABLE, Kind.MULTIPLY, Kind.VARIABLE, Kind.MULTIPLY, Kind.VARIABLE);
	}

	@Test
	public void test_0x014() {
		check("\\begin{pmatrix} 1 & 2 \\\\ 3 & 4 \\end{pmatrix}", Kind.BEGIN, Kind.NUMBER, Kind.AMPERSAND,
				Kind.NUMBER, Kind.ROW_SEPARATOR, Kind.NUMBER, Kind.AMPERSAND, Kind.NUMBER, Kind.END);
		assertEquals("pmatrix", scan("\\begin{pmatrix}").get(0).value);
	}

	@Test
	public void test_0x015() {
		TokenizerException e = assertThrows(TokenizerException.class, () -> scan("\\sinn(x)"));
		assertNotNull(e.suggestion());
		assertTrue(e.suggestion().contains("\\sin"));
		assertEquals(0, e.start());
	}

	@Test
	public void test_0x016() {
		assertThrows(TokenizerException.class, () -> scan("x # y"));
	}

	@Test
	public void test_0x017() {
		assertThrows(TokenizerException.class, () -> new Lexer("x+x+x+x", CommandTable.standard(), true, 5).scan());
	}

	@Test
	public void test_0x018() {
		assertThrows(TokenizerException.class, () -> scan("\\text{abc"));
	}

	@Test
	public void test_0x019() {
		// Token positions refer to the source text
		List<Token> tokens = scan("12 + \\alpha");
		assertEquals(0, tokens.get(0).start);
		assertEquals(3, tokens.get(1).start);
		assertEquals(5, tokens.get(2).start);
		assertEquals("alpha", tokens.get(2).value);
	}

	private static List<Token> scan(String input) {
		return new Lexer(input).scan();
	}

	private static void check(String input, Kind... kinds) {
		List<Kind> expected = new ArrayList<>(Arrays.asList(kinds));
		expected.add(Kind.EOF);
		List<Kind> actual = new ArrayList<>();
		for (Token t : scan(input)) {
			actual.add(t.kind);
		}
		assertEquals(expected, actual);
	}
}

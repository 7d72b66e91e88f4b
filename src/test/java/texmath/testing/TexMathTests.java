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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import texmath.TexMath;
import texmath.TexMath.Options;
import texmath.util.Diagnostic;
import texmath.util.ParserException;
import texmath.util.TokenizerException;

public class TexMathTests {

	@Test
	public void test_0x001() {
		Options o = new Options();
		assertTrue(o.implicitMultiplication());
		assertEquals(500, o.maxRecursionDepth());
		assertEquals(10000, o.maxNodes());
		assertEquals(100000, o.maxIterations());
		assertEquals(100000, o.maxInputLength());
	}

	@Test
	public void test_0x002() {
		Options o = new Options().withMaxNodes(20).withImplicitMultiplication(false);
		assertEquals(20, o.maxNodes());
		assertFalse(o.implicitMultiplication());
		// Options are immutable
		assertEquals(10000, new Options().maxNodes());
		assertThrows(IllegalArgumentException.class, () -> new Options().withMaxIterations(0));
	}

	@Test
	public void test_0x003() {
		Properties p = new Properties();
		p.setProperty("texmath.maxIterations", "50");
		p.setProperty("texmath.implicitMultiplication", "false");
		Options o = Options.fromProperties(p);
		assertEquals(50, o.maxIterations());
		assertFalse(o.implicitMultiplication());
		assertEquals(500, o.maxRecursionDepth());
	}

	@Test
	public void test_0x004() {
		Properties p = new Properties();
		p.setProperty("texmath.maxNodes", "lots");
		assertThrows(IllegalArgumentException.class, () -> Options.fromProperties(p));
	}

	@Test
	public void test_0x005() {
		// Read from texmath.properties on the test classpath
		Options o = Options.load();
		assertEquals(50000, o.maxInputLength());
		assertEquals(50000, new TexMath().options().maxInputLength());
	}

	@Test
	public void test_0x006() {
		TexMath tm = new TexMath(new Options().withImplicitMultiplication(false));
		assertEquals(1, tm.tokenize("xy").size() - 1);
		assertThrows(TokenizerException.class, () -> new TexMath(new Options().withMaxInputLength(4)).parse("x + y"));
	}

	@Test
	public void test_0x007() {
		TexMath tm = new TexMath(new Options());
		assertTrue(tm.validate("2 + 2").isEmpty());
		assertTrue(tm.validate("x^2 + 1").isEmpty());
	}

	@Test
	public void test_0x008() {
		List<Diagnostic> ds = new TexMath(new Options()).validate("x + 1 ) )");
		assertEquals(2, ds.size());
		for (Diagnostic d : ds) {
			assertEquals("parser", d.stage());
			assertNotNull(d.suggestion());
		}
		assertEquals(6, ds.get(0).start());
		assertEquals(8, ds.get(1).start());
	}

	@Test
	public void test_0x009() {
		List<Diagnostic> ds = new TexMath(new Options()).validate("\\sinn(x)");
		assertEquals(1, ds.size());
		assertEquals("tokenizer", ds.get(0).stage());
		assertNotNull(ds.get(0).suggestion());
	}

	@Test
	public void test_0x010() {
		List<Diagnostic> ds = new TexMath(new Options()).validate("\\frac{1}{0}");
		assertEquals(1, ds.size());
		assertEquals("evaluation", ds.get(0).stage());
	}

	@Test
	public void test_0x011() {
		// Constants are not free variables
		assertTrue(new TexMath(new Options()).validate("\\sin(\\pi) + e").isEmpty());
	}

	@Test
	public void test_0x012() {
		ParserException e = assertThrows(ParserException.class, () -> new TexMath(new Options()).parse("x + )"));
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		e.outputSourceError(new PrintStream(bytes, true, StandardCharsets.UTF_8));
		String[] lines = bytes.toString(StandardCharsets.UTF_8).split("\\R");
		assertEquals("x + )", lines[1]);
		assertEquals("    ^", lines[2]);
	}
}

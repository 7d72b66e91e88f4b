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

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import texmath.TexMath;
import texmath.core.Value;
import texmath.core.Value.Real;
import texmath.io.CommandTable;
import texmath.util.EvaluatorException;

public class EvaluatorTests {
	private static final TexMath tm = new TexMath(new TexMath.Options());

	@Test
	public void test_0x001() {
		check("2 + 3 * 4", 14);
	}

	@Test
	public void test_0x002() {
		check("2^3^2", 512);
	}

	@Test
	public void test_0x003() {
		check("\\frac{1}{4} + 0.25", 0.5);
	}

	@Test
	public void test_0x004() {
		check("5!", 120);
		check("\\binom{5}{2}", 10);
	}

	@Test
	public void test_0x005() {
		check("\\sqrt{16}", 4);
		check("\\sqrt[3]{27}", 3);
		check("|-3|", 3);
	}

	@Test
	public void test_0x006() {
		check("\\sin(\\pi)", 0);
		check("\\cos(0)", 1);
		check("\\ln(e)", 1);
		check("\\log_{2}(8)", 3);
		check("\\log(1000)", 3);
	}

	@Test
	public void test_0x007() {
		check("x^2 + y", 7, "x", 2, "y", 3);
	}

	@Test
	public void test_0x008() {
		// Guarded expressions outside their domain are undefined
		assertTrue(Double.isNaN(eval("x^2, -5 < x < 5", "x", 10)));
		assertTrue(Double.isNaN(eval("x^2, -5 < x < 5", "x", -5)));
		check("x^2, -5 \\leq x \\leq 5", 25, "x", -5);
		check("x^2, -5 < x < 5", 9, "x", 3);
	}

	@Test
	public void test_0x009() {
		String input = "\\begin{cases} x & x > 0 \\\\ -x & \\text{otherwise} \\end{cases}";
		check(input, 2, "x", 2);
		check(input, 3, "x", -3);
		check(input, 0, "x", 0);
	}

	@Test
	public void test_0x010() {
		check("\\frac{d}{dx}(x^3 + \\sin(x))", 1, "x", 0);
		check("\\frac{d}{dx}(x^3)", 12, "x", 2);
	}

	@Test
	public void test_0x011() {
		check("\\sum_{i=1}^{100} i", 5050);
		check("\\prod_{i=1}^{5} i", 120);
	}

	@Test
	public void test_0x012() {
		assertThrows(EvaluatorException.class, () -> tm.evaluate("\\sum_{i=1}^{200000} i"));
	}

	@Test
	public void test_0x013() {
		check("\\int_0^1 x^2 dx", 1.0 / 3);
		check("\\int_0^{\\pi} \\sin(x) dx", 2);
		check("\\int_1^{e} \\frac{1}{x} dx", 1);
	}

	@Test
	public void test_0x014() {
		// No closed form, so integrated numerically
		assertEquals(1.4626517459071816, eval("\\int_0^1 e^{x^2} dx"), 1e-6);
	}

	@Test
	public void test_0x015() {
		assertEquals(1, eval("\\lim_{x \\to 0} \\frac{\\sin(x)}{x}"), 1e-6);
		assertEquals(0, eval("\\lim_{x \\to \\infty} \\frac{1}{x}"), 1e-6);
		check("\\lim_{x \\to 2} x^2", 4);
	}

	@Test
	public void test_0x016() {
		check("\\det(\\begin{pmatrix} 1 & 2 \\\\ 3 & 4 \\end{pmatrix})", -2);
	}

	@Test
	public void test_0x017() {
		Value v = tm.evaluate("[1, 2] + [3, 4]");
		assertEquals(4, v.asInterval().lower(), 1e-12);
		assertEquals(6, v.asInterval().upper(), 1e-12);
	}

	@Test
	public void test_0x018() {
		assertTrue(tm.evaluate("3 \\in [1, 5]").asBoolean());
		assertFalse(tm.evaluate("7 \\in [1, 5]").asBoolean());
		assertTrue(tm.evaluate("1 < 2").asBoolean());
	}

	@Test
	public void test_0x019() {
		Value v = tm.evaluate("i \\cdot i");
		assertEquals(-1, v.asComplex().re(), 1e-12);
		assertEquals(0, v.asComplex().im(), 1e-12);
	}

	@Test
	public void test_0x020() {
		assertThrows(EvaluatorException.class, () -> tm.evaluate("x + 1"));
	}

	@Test
	public void test_0x021() {
		assertThrows(EvaluatorException.class, () -> tm.evaluate("\\frac{1}{0}"));
	}

	@Test
	public void test_0x022() {
		// Reserved constants cannot be rebound
		HashMap<String, Value> bindings = new HashMap<>();
		bindings.put("pi", new Real(3));
		assertThrows(EvaluatorException.class, () -> tm.evaluate("\\pi", bindings));
	}

	@Test
	public void test_0x023() {
		// User-defined functions are resolved through the hook
		TexMath hooked = new TexMath(new TexMath.Options(), CommandTable.standard(),
				(String name, List<Value> args) -> name.equals("f")
						? Optional.of(new Real(args.get(0).asReal() + args.get(1).asReal()))
						: Optional.empty());
		assertEquals(5, hooked.evaluate("f(2, 3)").asReal(), 1e-12);
	}

	@Test
	public void test_0x024() {
		// Bounded iteration
		TexMath small = new TexMath(new TexMath.Options().withMaxIterations(10));
		assertThrows(EvaluatorException.class, () -> small.evaluate("\\sum_{i=1}^{11} i"));
		assertEquals(55, small.evaluate("\\sum_{i=1}^{10} i").asReal(), 1e-12);
	}

	@Test
	public void test_0x025() {
		// Cases are tried in order, so a leading otherwise case always wins
		String cases = "\\begin{cases} 1 & \\text{otherwise} \\\\ 2 & x > 0 \\end{cases}";
		check(cases, 1, "x", 1);
		check(cases, 1, "x", -1);
		check("\\begin{cases} 2 & x > 0 \\\\ 1 & \\text{otherwise} \\end{cases}", 2, "x", 1);
	}

	@Test
	public void test_0x026() {
		// Huge binomial coefficients overflow rather than loop
		assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
			assertEquals(Double.POSITIVE_INFINITY, eval("\\binom{10^{15}}{5 \\cdot 10^{14}}"));
		});
		check("\\binom{10^{15}}{1}", 1e15);
		check("\\binom{52}{5}", 2598960);
	}

	@Test
	public void test_0x027() {
		String fib = "\\begin{pmatrix} 1 & 1 \\\\ 1 & 0 \\end{pmatrix}";
		Value.Matrix m = tm.evaluate(fib + "^{10}").asMatrix();
		assertEquals(89, m.get(0, 0), 1e-9);
		assertEquals(55, m.get(0, 1), 1e-9);
		String id = "\\begin{pmatrix} 1 & 0 \\\\ 0 & 1 \\end{pmatrix}";
		assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
			assertEquals(1, tm.evaluate(id + "^{1000000}").asMatrix().get(0, 0), 1e-9);
			assertThrows(EvaluatorException.class, () -> tm.evaluate(id + "^{2000000000}"));
		});
	}

	@Test
	public void test_0x028() {
		// A transpose marker on a non-matrix evaluates its operand once
		int[] calls = new int[1];
		TexMath hooked = new TexMath(new TexMath.Options(), CommandTable.standard(),
				(String name, List<Value> args) -> {
					calls[0]++;
					return Optional.of(new Real(2));
				});
		assertThrows(EvaluatorException.class, () -> hooked.evaluate("f(1, 2)^T"));
		assertEquals(1, calls[0]);
		Value.Matrix m = tm.evaluate("\\begin{pmatrix} 1 & 2 \\\\ 3 & 4 \\end{pmatrix}^T").asMatrix();
		assertEquals(3, m.get(0, 1), 1e-12);
	}

	@Test
	public void test_0x029() {
		// Gradients range over the free variables in name order
		checkVector("\\nabla{x^2}", new double[] { 6 }, "x", 3);
		checkVector("\\nabla{x^2 + y^2}", new double[] { 2, 4 }, "x", 1, "y", 2);
		checkVector("\\nabla{z \\cdot y \\cdot x}", new double[] { 6, 3, 2 }, "x", 1, "y", 2, "z", 3);
		checkVector("\\nabla{\\sin(x) + \\cos(y) + \\pi}", new double[] { 1, 0 }, "x", 0, "y", 0);
		assertThrows(EvaluatorException.class, () -> tm.evaluate("\\nabla{5}"));
	}

	@Test
	public void test_0x030() {
		// Laplacian is the sum of unmixed second partials
		check("\\nabla^2{x^2 + y^2}", 4, "x", 1, "y", 2);
		check("\\nabla^2{x^3 y}", 12, "x", 1, "y", 2);
		check("\\frac{d}{dx}(\\nabla^2{x^3 y})", 12, "x", 1, "y", 2);
		assertThrows(EvaluatorException.class, () -> eval("\\frac{d}{dx}(\\nabla{x^2})", "x", 1));
	}

	private static double eval(String input, Object... bindings) {
		Map<String, Value> env = new HashMap<>();
		for (int i = 0; i < bindings.length; i += 2) {
			env.put((String) bindings[i], new Real(((Number) bindings[i + 1]).doubleValue()));
		}
		return tm.evaluate(input, env).asReal();
	}

	private static void check(String input, double expected, Object... bindings) {
		assertEquals(expected, eval(input, bindings), 1e-9);
	}

	private static void checkVector(String input, double[] expected, Object... bindings) {
		Map<String, Value> env = new HashMap<>();
		for (int i = 0; i < bindings.length; i += 2) {
			env.put((String) bindings[i], new Real(((Number) bindings[i + 1]).doubleValue()));
		}
		assertArrayEquals(expected, tm.evaluate(input, env).asVector().toArray(), 1e-9);
	}
}

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

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import org.junit.jupiter.api.Test;

import texmath.core.Syntax.Expression;
import texmath.symbolic.ArithmeticRules;
import texmath.symbolic.Assumptions;
import texmath.symbolic.Assumptions.Property;
import texmath.symbolic.RewriteRule;
import texmath.symbolic.RuleCategory;
import texmath.symbolic.RuleEngine;
import texmath.util.EvaluatorException;
import texmath.util.Trace;

public class RuleEngineTests {
	private static final RewriteRule TO_A = RewriteRule.of("x-to-a", RuleCategory.SIMPLIFICATION,
			(e, a) -> e.equals(var("x")) ? var("a") : null);
	private static final RewriteRule TO_B = RewriteRule.of("x-to-b", RuleCategory.IDENTITY,
			(e, a) -> e.equals(var("x")) ? var("b") : null);
	private static final RewriteRule SWAP = RewriteRule.of("swap", RuleCategory.NORMALIZATION,
			(e, a) -> is(e, Expression.Binary.Op.ADD)
					? add(((Expression.Binary) e).rightOperand(), ((Expression.Binary) e).leftOperand())
					: null);

	@Test
	public void test_0x001() {
		// Earlier categories take priority
		List<RewriteRule> rules = Arrays.asList(TO_B, TO_A);
		RuleEngine engine = new RuleEngine(rules, EnumSet.allOf(RuleCategory.class));
		assertEquals(var("a"), engine.rewrite(var("x"), Assumptions.NONE));
	}

	@Test
	public void test_0x002() {
		// Disabled categories never apply
		List<RewriteRule> rules = Arrays.asList(TO_B, TO_A);
		RuleEngine engine = new RuleEngine(rules, EnumSet.of(RuleCategory.IDENTITY));
		assertEquals(var("b"), engine.rewrite(var("x"), Assumptions.NONE));
		engine = new RuleEngine(rules, EnumSet.noneOf(RuleCategory.class));
		assertEquals(var("x"), engine.rewrite(var("x"), Assumptions.NONE));
	}

	@Test
	public void test_0x003() {
		// Rules apply bottom up, throughout the tree
		RuleEngine engine = new RuleEngine(Arrays.asList(TO_A), EnumSet.allOf(RuleCategory.class));
		assertEquals(mul(var("a"), call("sin", var("a"))),
				engine.rewrite(mul(var("x"), call("sin", var("x"))), Assumptions.NONE));
	}

	@Test
	public void test_0x004() {
		// A non-terminating rule set stops at the iteration limit
		RuleEngine engine = new RuleEngine(Arrays.asList(SWAP), EnumSet.allOf(RuleCategory.class), 5, 100);
		Expression r = engine.rewrite(add(var("x"), var("y")), Assumptions.NONE);
		assertTrue(r.equals(add(var("x"), var("y"))) || r.equals(add(var("y"), var("x"))));
	}

	@Test
	public void test_0x005() {
		Expression e = var("x");
		for (int i = 0; i != 20; ++i) {
			e = neg(e);
		}
		RuleEngine engine = new RuleEngine(ArithmeticRules.RULES, EnumSet.allOf(RuleCategory.class), 100, 10);
		final Expression input = e;
		assertThrows(EvaluatorException.class, () -> engine.rewrite(input, Assumptions.NONE));
	}

	@Test
	public void test_0x006() {
		RuleEngine engine = new RuleEngine(ArithmeticRules.RULES, EnumSet.allOf(RuleCategory.class));
		assertEquals(var("x"), engine.rewrite(add(mul(num(1), var("x")), num(0)), Assumptions.NONE));
		assertEquals(num(7), engine.rewrite(add(num(3), num(4)), Assumptions.NONE));
	}

	@Test
	public void test_0x007() {
		Assumptions a = Assumptions.NONE.with("x", Property.POSITIVE);
		assertTrue(a.has("x", Property.NON_NEGATIVE));
		assertTrue(a.has("x", Property.NON_ZERO));
		assertTrue(a.has("x", Property.REAL));
		assertTrue(a.has("x", Property.COMPLEX));
		assertFalse(a.has("y", Property.REAL));
		// The original is unchanged
		assertTrue(Assumptions.NONE.isEmpty());
	}

	@Test
	public void test_0x008() {
		Assumptions a = Assumptions.NONE.with("x", Property.NON_NEGATIVE).with("x", Property.NON_ZERO);
		assertTrue(a.has("x", Property.POSITIVE));
		assertThrows(IllegalArgumentException.class, () -> a.with("x", Property.NEGATIVE));
		assertThrows(IllegalArgumentException.class, () -> a.with("x", Property.NON_POSITIVE));
	}

	@Test
	public void test_0x009() {
		Assumptions a = Assumptions.NONE.with("x", Property.POSITIVE);
		assertTrue(a.isPositive(var("x")));
		assertTrue(a.isPositive(var("pi")));
		assertTrue(a.isNonNegative(pow(var("y"), num(2))));
		assertTrue(a.isPositive(mul(var("x"), num(3))));
		assertFalse(a.isNonNegative(var("y")));
		assertFalse(a.isNonNegative(num(-1)));
	}

	@Test
	public void test_0x00A() {
		// Each rule application is recorded
		RuleEngine engine = new RuleEngine(Arrays.asList(TO_A), EnumSet.allOf(RuleCategory.class));
		Trace t = engine.trace(mul(var("x"), call("sin", var("x"))), Assumptions.NONE);
		assertEquals(mul(var("a"), call("sin", var("a"))), t.result());
		assertEquals(2, t.steps().size());
		for (Trace.Step s : t.steps()) {
			assertEquals("x-to-a", s.rule());
			assertEquals(var("x"), s.before());
			assertEquals(var("a"), s.after());
		}
	}

	@Test
	public void test_0x00B() {
		RuleEngine engine = new RuleEngine(Arrays.asList(SWAP), EnumSet.allOf(RuleCategory.class), 5, 100);
		assertEquals(5, engine.trace(add(var("x"), var("y")), Assumptions.NONE).steps().size());
	}
}

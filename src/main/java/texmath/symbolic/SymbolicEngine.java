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
package texmath.symbolic;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import texmath.core.Evaluator;
import texmath.core.Syntax.Expression;
import texmath.util.Trace;

/**
 * Provides the symbolic manipulations on expressions: simplification,
 * expansion, factoring and equivalence checking. Each is built from a
 * {@link RuleEngine} over some subset of the available rules, with the input
 * normalised beforehand. Assumptions made about variables are held by the
 * engine and consulted by the rules which depend on them.
 *
 * @author David J. Pearce
 *
 */
public class SymbolicEngine {
	private final Normalizer normalizer;
	private final RuleEngine simplifier;
	private final RuleEngine expander;
	private final RuleEngine trigExpander;
	private final PolynomialOperations polynomials;
	private final EquivalenceChecker checker;
	private Assumptions assumptions = Assumptions.NONE;

	public SymbolicEngine() {
		this(new Evaluator(), RuleEngine.DEFAULT_MAX_ITERATIONS, RuleEngine.DEFAULT_MAX_DEPTH);
	}

	public SymbolicEngine(Evaluator evaluator, int maxIterations, int maxDepth) {
		this.normalizer = new Normalizer(maxDepth);
		this.polynomials = new PolynomialOperations(normalizer, maxDepth);
		// Simplification
		List<RewriteRule> rules = new ArrayList<>();
		rules.addAll(ArithmeticRules.RULES);
		rules.addAll(TrigRules.RULES);
		rules.addAll(LogRules.RULES);
		rules.addAll(AssumptionRules.RULES);
		this.simplifier = new RuleEngine(rules, EnumSet.of(RuleCategory.SIMPLIFICATION, RuleCategory.IDENTITY),
				maxIterations, maxDepth);
		// Algebraic expansion
		List<RewriteRule> expansions = new ArrayList<>();
		expansions.addAll(ArithmeticRules.RULES);
		expansions.addAll(polynomials.expansionRules());
		expansions.addAll(LogRules.RULES);
		this.expander = new RuleEngine(expansions,
				EnumSet.of(RuleCategory.NORMALIZATION, RuleCategory.SIMPLIFICATION, RuleCategory.EXPANSION),
				maxIterations, maxDepth);
		// Trigonometric expansion
		List<RewriteRule> trig = new ArrayList<>();
		trig.addAll(ArithmeticRules.RULES);
		trig.addAll(TrigRules.RULES);
		this.trigExpander = new RuleEngine(trig, EnumSet.of(RuleCategory.SIMPLIFICATION, RuleCategory.EXPANSION),
				maxIterations, maxDepth);
		this.checker = new EquivalenceChecker(this::simplify, evaluator);
	}

	/**
	 * Simplify an expression by normalising it, then applying the
	 * simplification and identity rules to a fixed point.
	 *
	 * @param e
	 * @return
	 */
	public Expression simplify(Expression e) {
		return rewrite(simplifier, e, null);
	}

	public Trace simplifyWithSteps(Expression e) {
		return trace(simplifier, e);
	}

	/**
	 * Multiply out products and integer powers of sums, and split logarithms of
	 * products and quotients.
	 *
	 * @param e
	 * @return
	 */
	public Expression expand(Expression e) {
		return rewrite(expander, e, null);
	}

	public Trace expandWithSteps(Expression e) {
		return trace(expander, e);
	}

	/**
	 * Expand trigonometric functions of double and half angles.
	 *
	 * @param e
	 * @return
	 */
	public Expression expandTrig(Expression e) {
		return rewrite(trigExpander, e, null);
	}

	public Trace expandTrigWithSteps(Expression e) {
		return trace(trigExpander, e);
	}

	/**
	 * Factor differences of squares and monic quadratics with integer roots.
	 * Anything which cannot be factored is returned in normalised form.
	 *
	 * @param e
	 * @return
	 */
	public Expression factor(Expression e) {
		return polynomials.factor(normalizer.normalize(e));
	}

	public Trace factorWithSteps(Expression e) {
		ArrayList<Trace.Step> steps = new ArrayList<>();
		Expression r = polynomials.factor(normalize(e, steps), steps);
		return new Trace(r, steps);
	}

	private Trace trace(RuleEngine engine, Expression e) {
		ArrayList<Trace.Step> steps = new ArrayList<>();
		Expression r = rewrite(engine, e, steps);
		return new Trace(r, steps);
	}

	/**
	 * Normalise an expression, rewrite it to a fixed point with a given
	 * engine, then normalise the result.
	 *
	 * @param engine
	 * @param e
	 * @param steps  Receives each step taken, or null if none are wanted.
	 * @return
	 */
	private Expression rewrite(RuleEngine engine, Expression e, List<Trace.Step> steps) {
		Expression n = normalize(e, steps);
		return normalize(engine.rewrite(n, assumptions, steps), steps);
	}

	private Expression normalize(Expression e, List<Trace.Step> steps) {
		Expression n = normalizer.normalize(e);
		if (steps != null && !n.equals(e)) {
			steps.add(new Trace.Step("normalize", e, n));
		}
		return n;
	}

	public Expression normalize(Expression e) {
		return normalizer.normalize(e);
	}

	public boolean areEquivalent(Expression lhs, Expression rhs, EquivalenceChecker.Level level) {
		return checker.areEquivalent(lhs, rhs, level);
	}

	/**
	 * Record an assumption about a variable, which subsequent operations may
	 * rely upon.
	 *
	 * @param variable
	 * @param property
	 * @throws IllegalArgumentException if the assumption contradicts an
	 *                                  earlier one.
	 */
	public void assume(String variable, Assumptions.Property property) {
		assumptions = assumptions.with(variable, property);
	}

	public Assumptions assumptions() {
		return assumptions;
	}

	public void clearAssumptions() {
		assumptions = Assumptions.NONE;
	}
}

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
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import texmath.core.Syntax.Expression;
import texmath.util.EvaluatorException;
import texmath.util.Trace;

/**
 * Repeatedly applies a set of rewrite rules to an expression until no rule
 * changes it, or an iteration limit is reached. Each pass rewrites the
 * expression bottom-up, and at each node the first rule (by category, then
 * in the order given) which changes the node is applied.
 *
 * @author David J. Pearce
 *
 */
public class RuleEngine {
	private static final Logger logger = Logger.getLogger(RuleEngine.class.getName());

	public static final int DEFAULT_MAX_ITERATIONS = 100;
	public static final int DEFAULT_MAX_DEPTH = 500;

	private final Map<RuleCategory, List<RewriteRule>> rules = new EnumMap<>(RuleCategory.class);
	private final int maxIterations;
	private final int maxDepth;

	public RuleEngine(Collection<RewriteRule> rules, Set<RuleCategory> enabled) {
		this(rules, enabled, DEFAULT_MAX_ITERATIONS, DEFAULT_MAX_DEPTH);
	}

	public RuleEngine(Collection<RewriteRule> rules, Set<RuleCategory> enabled, int maxIterations, int maxDepth) {
		this.maxIterations = maxIterations;
		this.maxDepth = maxDepth;
		for (RuleCategory c : RuleCategory.values()) {
			if (enabled.contains(c)) {
				this.rules.put(c, new ArrayList<>());
			}
		}
		for (RewriteRule r : rules) {
			List<RewriteRule> bucket = this.rules.get(r.category());
			if (bucket != null) {
				bucket.add(r);
			}
		}
	}

	/**
	 * Rewrite an expression to a fixed point, or until the iteration limit is
	 * reached (in which case the last expression produced is returned).
	 *
	 * @param e
	 * @param assumptions
	 * @return
	 */
	public Expression rewrite(Expression e, Assumptions assumptions) {
		return rewrite(e, assumptions, null);
	}

	/**
	 * Rewrite an expression as for {@link #rewrite(Expression, Assumptions)},
	 * recording each rule application.
	 *
	 * @param e
	 * @param assumptions
	 * @return
	 */
	public Trace trace(Expression e, Assumptions assumptions) {
		ArrayList<Trace.Step> steps = new ArrayList<>();
		Expression r = rewrite(e, assumptions, steps);
		return new Trace(r, steps);
	}

	/**
	 * Rewrite an expression to a fixed point, adding every rule applied to the
	 * given list of steps (unless it is null).
	 *
	 * @param e
	 * @param assumptions
	 * @param steps
	 * @return
	 */
	Expression rewrite(Expression e, Assumptions assumptions, List<Trace.Step> steps) {
		for (int i = 0; i != maxIterations; ++i) {
			Expression n = pass(e, assumptions, steps, 0);
			if (n.equals(e)) {
				return n;
			}
			e = n;
		}
		logger.log(Level.WARNING, "rewriting stopped after {0} iterations at {1}", new Object[] { maxIterations, e });
		return e;
	}

	private Expression pass(Expression e, Assumptions assumptions, List<Trace.Step> steps, int depth) {
		if (depth > maxDepth) {
			throw new EvaluatorException("maximum recursion depth of " + maxDepth + " exceeded", e);
		}
		List<Expression> children = e.children();
		if (!children.isEmpty()) {
			ArrayList<Expression> nchildren = new ArrayList<>();
			boolean changed = false;
			for (Expression child : children) {
				Expression nchild = pass(child, assumptions, steps, depth + 1);
				changed |= nchild != child;
				nchildren.add(nchild);
			}
			if (changed) {
				e = e.withChildren(nchildren);
			}
		}
		return step(e, assumptions, steps);
	}

	private Expression step(Expression e, Assumptions assumptions, List<Trace.Step> steps) {
		for (List<RewriteRule> bucket : rules.values()) {
			for (RewriteRule rule : bucket) {
				if (rule.matches(e, assumptions)) {
					Expression r = rule.apply(e, assumptions);
					if (!r.equals(e)) {
						logger.log(Level.FINE, "{0}: {1} => {2}", new Object[] { rule.name(), e, r });
						if (steps != null) {
							steps.add(new Trace.Step(rule.name(), e, r));
						}
						return r;
					}
				}
			}
		}
		return e;
	}
}

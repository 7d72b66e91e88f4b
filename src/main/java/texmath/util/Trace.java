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
package texmath.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import texmath.core.Syntax.Expression;

/**
 * The result of a symbolic manipulation, together with the individual rewrite
 * steps which produced it. Steps are listed in the order they were applied,
 * and each records the subexpression it rewrote rather than the whole
 * expression.
 *
 * @author David J. Pearce
 */
public final class Trace {
	private final Expression result;
	private final List<Step> steps;

	public Trace(Expression result, List<Step> steps) {
		this.result = result;
		this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
	}

	public Expression result() {
		return result;
	}

	public List<Step> steps() {
		return steps;
	}

	public boolean isEmpty() {
		return steps.isEmpty();
	}

	@Override
	public String toString() {
		if (steps.isEmpty()) {
			return "no steps";
		}
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i != steps.size(); ++i) {
			if (i != 0) {
				sb.append("\n");
			}
			sb.append("Step ").append(i + 1).append(" ").append(steps.get(i));
		}
		return sb.toString();
	}

	/**
	 * A single named rewrite from one expression to another.
	 */
	public static final class Step {
		private final String rule;
		private final Expression before;
		private final Expression after;

		public Step(String rule, Expression before, Expression after) {
			this.rule = rule;
			this.before = before;
			this.after = after;
		}

		public String rule() {
			return rule;
		}

		public Expression before() {
			return before;
		}

		public Expression after() {
			return after;
		}

		@Override
		public String toString() {
			return "[" + rule + "] " + before.toLatex() + " => " + after.toLatex();
		}
	}
}

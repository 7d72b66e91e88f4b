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

import texmath.core.Syntax;
import texmath.core.Syntax.Expression;

/**
 * Dispatches over the syntactic forms of an expression. Every form has its own
 * abstract method, hence any concrete transformer must say what it does for
 * each form of expression (even if that is simply to fail).
 *
 * @author David J. Pearce
 *
 * @param <S> The state threaded through the transformation (e.g. the variable
 *            environment)
 * @param <R> The result of transforming an expression
 */
public abstract class AbstractTransformer<S, R> {

	public R apply(S state, Expression expr) {
		switch (expr.getOpcode()) {
		case Syntax.EXPR_literal:
			return apply(state, (Expression.Literal) expr);
		case Syntax.EXPR_variable:
			return apply(state, (Expression.Variable) expr);
		case Syntax.EXPR_binary:
			return apply(state, (Expression.Binary) expr);
		case Syntax.EXPR_negation:
			return apply(state, (Expression.Negation) expr);
		case Syntax.EXPR_abs:
			return apply(state, (Expression.Abs) expr);
		case Syntax.EXPR_call:
			return apply(state, (Expression.Call) expr);
		case Syntax.EXPR_matrix:
			return apply(state, (Expression.Matrix) expr);
		case Syntax.EXPR_vector:
			return apply(state, (Expression.Vector) expr);
		case Syntax.EXPR_interval:
			return apply(state, (Expression.Interval) expr);
		case Syntax.EXPR_sum:
			return apply(state, (Expression.Sum) expr);
		case Syntax.EXPR_product:
			return apply(state, (Expression.Product) expr);
		case Syntax.EXPR_limit:
			return apply(state, (Expression.Limit) expr);
		case Syntax.EXPR_integral:
			return apply(state, (Expression.Integral) expr);
		case Syntax.EXPR_derivative:
			return apply(state, (Expression.Derivative) expr);
		case Syntax.EXPR_partial:
			return apply(state, (Expression.PartialDerivative) expr);
		case Syntax.EXPR_binomial:
			return apply(state, (Expression.Binomial) expr);
		case Syntax.EXPR_comparison:
			return apply(state, (Expression.Comparison) expr);
		case Syntax.EXPR_chain:
			return apply(state, (Expression.ChainedComparison) expr);
		case Syntax.EXPR_logical:
			return apply(state, (Expression.Logical) expr);
		case Syntax.EXPR_conditional:
			return apply(state, (Expression.Conditional) expr);
		case Syntax.EXPR_piecewise:
			return apply(state, (Expression.Piecewise) expr);
		case Syntax.EXPR_gradient:
			return apply(state, (Expression.Gradient) expr);
		}
		// Give up
		throw new IllegalArgumentException("Invalid expression encountered: " + expr);
	}

	/**
	 * Apply this transformer to a given numeric literal.
	 *
	 * @param state The current state (e.g. variable environment)
	 * @param expr  The expression being transformed.
	 * @return
	 */
	public abstract R apply(S state, Expression.Literal expr);

	public abstract R apply(S state, Expression.Variable expr);

	public abstract R apply(S state, Expression.Binary expr);

	public abstract R apply(S state, Expression.Negation expr);

	public abstract R apply(S state, Expression.Abs expr);

	public abstract R apply(S state, Expression.Call expr);

	public abstract R apply(S state, Expression.Matrix expr);

	public abstract R apply(S state, Expression.Vector expr);

	public abstract R apply(S state, Expression.Interval expr);

	public abstract R apply(S state, Expression.Sum expr);

	public abstract R apply(S state, Expression.Product expr);

	public abstract R apply(S state, Expression.Limit expr);

	public abstract R apply(S state, Expression.Integral expr);

	public abstract R apply(S state, Expression.Derivative expr);

	public abstract R apply(S state, Expression.PartialDerivative expr);

	public abstract R apply(S state, Expression.Binomial expr);

	public abstract R apply(S state, Expression.Comparison expr);

	public abstract R apply(S state, Expression.ChainedComparison expr);

	public abstract R apply(S state, Expression.Logical expr);

	public abstract R apply(S state, Expression.Conditional expr);

	public abstract R apply(S state, Expression.Piecewise expr);

	public abstract R apply(S state, Expression.Gradient expr);

}

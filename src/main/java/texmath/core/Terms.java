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
package texmath.core;

import java.util.Collections;

import texmath.core.Syntax.Expression;
import texmath.core.Syntax.Expression.Binary;

/**
 * Shorthand constructors and queries for building expressions
 * programmatically, as the symbolic engines do.
 *
 * @author David J. Pearce
 *
 */
public final class Terms {
	public static final Expression.Literal ZERO = new Expression.Literal(0);
	public static final Expression.Literal ONE = new Expression.Literal(1);
	public static final Expression.Literal TWO = new Expression.Literal(2);

	private Terms() {

	}

	public static Expression num(double value) {
		// Avoid negative zero, which compares unequal to zero
		return new Expression.Literal(value == 0 ? 0 : value);
	}

	public static Expression var(String name) {
		return new Expression.Variable(name);
	}

	public static Expression add(Expression lhs, Expression rhs) {
		return new Binary(Binary.Op.ADD, lhs, rhs);
	}

	public static Expression sub(Expression lhs, Expression rhs) {
		return new Binary(Binary.Op.SUB, lhs, rhs);
	}

	public static Expression mul(Expression lhs, Expression rhs) {
		return new Binary(Binary.Op.MUL, lhs, rhs);
	}

	public static Expression div(Expression lhs, Expression rhs) {
		return new Binary(Binary.Op.DIV, lhs, rhs);
	}

	public static Expression pow(Expression lhs, Expression rhs) {
		return new Binary(Binary.Op.POW, lhs, rhs);
	}

	public static Expression neg(Expression operand) {
		return new Expression.Negation(operand);
	}

	public static Expression call(String name, Expression argument) {
		return new Expression.Call(name, Collections.singletonList(argument), null, null);
	}

	/**
	 * Check whether an expression is a binary operation of a given kind.
	 *
	 * @param e
	 * @param op
	 * @return
	 */
	public static boolean is(Expression e, Binary.Op op) {
		return e instanceof Binary && ((Binary) e).op() == op;
	}

	/**
	 * Check whether an expression is a call to the named function with a
	 * single argument, and neither base nor parameter.
	 *
	 * @param e
	 * @param name
	 * @return
	 */
	public static boolean isCall(Expression e, String name) {
		if (e instanceof Expression.Call) {
			Expression.Call c = (Expression.Call) e;
			return c.name().equals(name) && c.size() == 1 && c.base() == null && c.parameter() == null;
		}
		return false;
	}

	/**
	 * Check whether an expression is a numeric constant, written either as a
	 * literal or as the negation of one.
	 *
	 * @param e
	 * @return
	 */
	public static boolean isNumber(Expression e) {
		if (e instanceof Expression.Literal) {
			return true;
		} else if (e instanceof Expression.Negation) {
			return ((Expression.Negation) e).operand() instanceof Expression.Literal;
		}
		return false;
	}

	public static boolean isNumber(Expression e, double value) {
		return isNumber(e) && numberValue(e) == value;
	}

	public static boolean isInteger(Expression e) {
		if (isNumber(e)) {
			double v = numberValue(e);
			return v == Math.rint(v) && !Double.isInfinite(v);
		}
		return false;
	}

	public static double numberValue(Expression e) {
		if (e instanceof Expression.Literal) {
			return ((Expression.Literal) e).value();
		}
		return -((Expression.Literal) ((Expression.Negation) e).operand()).value();
	}

	/**
	 * Check whether an expression is constant with respect to a given
	 * variable, meaning the variable does not occur free in it.
	 *
	 * @param e
	 * @param variable
	 * @return
	 */
	public static boolean isConstant(Expression e, String variable) {
		return !Syntax.contains(e, variable);
	}

	/**
	 * Fold an operation on two numeric literals, provided the result is an
	 * ordinary finite number.
	 *
	 * @param op
	 * @param l
	 * @param r
	 * @return The folded literal, or null
	 */
	public static Expression fold(Binary.Op op, double l, double r) {
		double v;
		switch (op) {
		case ADD:
			v = l + r;
			break;
		case SUB:
			v = l - r;
			break;
		case MUL:
			v = l * r;
			break;
		case DIV:
			if (r == 0) {
				return null;
			}
			v = l / r;
			break;
		default:
			v = Math.pow(l, r);
		}
		return Double.isNaN(v) || Double.isInfinite(v) ? null : num(v);
	}
}

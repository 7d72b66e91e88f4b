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

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import texmath.core.Syntax.Expression;
import texmath.core.Syntax.Expression.Binary;
import texmath.core.Terms;

/**
 * An immutable record of what is known about the variables of an expression,
 * such as <code>x &gt; 0</code>. Each assumption is closed under its obvious
 * implications when added, so a positive variable is also known to be
 * non-negative, non-zero and real.
 *
 * @author David J. Pearce
 *
 */
public final class Assumptions {
	public enum Property {
		REAL, COMPLEX, INTEGER, POSITIVE, NEGATIVE, NON_NEGATIVE, NON_POSITIVE, NON_ZERO
	}

	public static final Assumptions NONE = new Assumptions(Collections.emptyMap());

	private final Map<String, Set<Property>> properties;

	private Assumptions(Map<String, Set<Property>> properties) {
		this.properties = properties;
	}

	/**
	 * Construct a new set of assumptions which extends this one with a given
	 * property of a given variable.
	 *
	 * @param variable
	 * @param property
	 * @return
	 * @throws IllegalArgumentException if the property contradicts what is
	 *                                  already assumed of the variable.
	 */
	public Assumptions with(String variable, Property property) {
		EnumSet<Property> ps = EnumSet.noneOf(Property.class);
		ps.addAll(of(variable));
		ps.add(property);
		close(ps);
		if (ps.contains(Property.POSITIVE) && ps.contains(Property.NON_POSITIVE)
				|| ps.contains(Property.NEGATIVE) && ps.contains(Property.NON_NEGATIVE)) {
			throw new IllegalArgumentException("contradictory assumptions for " + variable + ": " + ps);
		}
		HashMap<String, Set<Property>> nproperties = new HashMap<>(properties);
		nproperties.put(variable, Collections.unmodifiableSet(ps));
		return new Assumptions(Collections.unmodifiableMap(nproperties));
	}

	public Set<Property> of(String variable) {
		Set<Property> ps = properties.get(variable);
		return ps == null ? Collections.emptySet() : ps;
	}

	public boolean has(String variable, Property property) {
		return of(variable).contains(property);
	}

	public boolean isEmpty() {
		return properties.isEmpty();
	}

	private static void close(EnumSet<Property> ps) {
		int size;
		do {
			size = ps.size();
			if (ps.contains(Property.POSITIVE)) {
				ps.add(Property.NON_NEGATIVE);
				ps.add(Property.NON_ZERO);
			}
			if (ps.contains(Property.NEGATIVE)) {
				ps.add(Property.NON_POSITIVE);
				ps.add(Property.NON_ZERO);
			}
			if (ps.contains(Property.NON_NEGATIVE) && ps.contains(Property.NON_ZERO)) {
				ps.add(Property.POSITIVE);
			}
			if (ps.contains(Property.NON_POSITIVE) && ps.contains(Property.NON_ZERO)) {
				ps.add(Property.NEGATIVE);
			}
			if (ps.contains(Property.NON_NEGATIVE) || ps.contains(Property.NON_POSITIVE)
					|| ps.contains(Property.INTEGER)) {
				ps.add(Property.REAL);
			}
			if (ps.contains(Property.REAL)) {
				ps.add(Property.COMPLEX);
			}
		} while (ps.size() != size);
	}

	/**
	 * Determine whether an expression is known to be non-negative. This is
	 * conservative, so a false result means only that nothing could be shown.
	 *
	 * @param e
	 * @return
	 */
	public boolean isNonNegative(Expression e) {
		if (isPositive(e)) {
			return true;
		} else if (Terms.isNumber(e)) {
			return Terms.numberValue(e) >= 0;
		} else if (e instanceof Expression.Variable) {
			return has(((Expression.Variable) e).name(), Property.NON_NEGATIVE);
		} else if (e instanceof Expression.Abs) {
			return true;
		} else if (e instanceof Expression.Call) {
			String name = ((Expression.Call) e).name();
			return name.equals("abs") || name.equals("sqrt") || name.equals("exp") || name.equals("cosh");
		} else if (e instanceof Binary) {
			Binary b = (Binary) e;
			Expression l = b.leftOperand();
			Expression r = b.rightOperand();
			switch (b.op()) {
			case ADD:
			case MUL:
			case DIV:
				return !b.isCross() && isNonNegative(l) && isNonNegative(r);
			case POW:
				if (Terms.isInteger(r) && Terms.numberValue(r) % 2 == 0) {
					return true;
				}
				return isNonNegative(l);
			default:
				return false;
			}
		}
		return false;
	}

	/**
	 * Determine whether an expression is known to be strictly positive.
	 *
	 * @param e
	 * @return
	 */
	public boolean isPositive(Expression e) {
		if (Terms.isNumber(e)) {
			return Terms.numberValue(e) > 0;
		} else if (e instanceof Expression.Variable) {
			String name = ((Expression.Variable) e).name();
			switch (name) {
			case "e":
			case "pi":
			case "tau":
			case "phi":
				return !properties.containsKey(name) || has(name, Property.POSITIVE);
			default:
				return has(name, Property.POSITIVE);
			}
		} else if (e instanceof Expression.Call) {
			String name = ((Expression.Call) e).name();
			return name.equals("exp") || name.equals("cosh");
		} else if (e instanceof Binary) {
			Binary b = (Binary) e;
			Expression l = b.leftOperand();
			Expression r = b.rightOperand();
			switch (b.op()) {
			case ADD:
				return isPositive(l) && isNonNegative(r) || isNonNegative(l) && isPositive(r);
			case MUL:
			case DIV:
				return !b.isCross() && isPositive(l) && isPositive(r);
			case POW:
				return isPositive(l);
			default:
				return false;
			}
		}
		return false;
	}

	@Override
	public String toString() {
		return properties.toString();
	}
}

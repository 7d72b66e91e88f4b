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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import texmath.util.SyntacticElement;

/**
 * The abstract syntax of mathematical expressions. Every node is identified by
 * an opcode and is immutable once constructed. Equality between nodes is
 * structural and ignores any source attributes.
 *
 * @author David J. Pearce
 *
 */
public class Syntax {
	public final static int EXPR_literal = 0;
	public final static int EXPR_variable = 1;
	public final static int EXPR_binary = 2;
	public final static int EXPR_negation = 3;
	public final static int EXPR_abs = 4;
	public final static int EXPR_call = 5;
	public final static int EXPR_matrix = 6;
	public final static int EXPR_vector = 7;
	public final static int EXPR_interval = 8;
	public final static int EXPR_sum = 9;
	public final static int EXPR_product = 10;
	public final static int EXPR_limit = 11;
	public final static int EXPR_integral = 12;
	public final static int EXPR_derivative = 13;
	public final static int EXPR_partial = 14;
	public final static int EXPR_binomial = 15;
	public final static int EXPR_comparison = 16;
	public final static int EXPR_chain = 17;
	public final static int EXPR_logical = 18;
	public final static int EXPR_conditional = 19;
	public final static int EXPR_piecewise = 20;
	public final static int EXPR_gradient = 21;

	/**
	 * Names which are written as backslash commands when unparsed (e.g.
	 * <code>\alpha</code>), rather than as plain letters.
	 */
	public static final Set<String> GREEK = Collections.unmodifiableSet(new HashSet<>(Arrays.asList("alpha", "beta",
			"gamma", "delta", "epsilon", "varepsilon", "zeta", "eta", "theta", "vartheta", "iota", "kappa", "lambda",
			"mu", "nu", "xi", "omicron", "rho", "varrho", "sigma", "varsigma", "upsilon", "chi", "psi", "omega",
			"varphi", "Gamma", "Delta", "Theta", "Lambda", "Xi", "Pi", "Sigma", "Upsilon", "Phi", "Psi", "Omega",
			"pi", "tau", "phi", "infty")));

	// Binding strengths used when deciding where brackets are needed.
	private static final int PREC_CONDITIONAL = -1;
	private static final int PREC_RELATION = 0;
	private static final int PREC_ADDITIVE = 1;
	private static final int PREC_MULTIPLICATIVE = 2;
	private static final int PREC_UNARY = 3;
	private static final int PREC_POWER = 4;
	private static final int PREC_ATOM = 5;

	public interface Expression extends SyntacticElement {

		/**
		 * Get the opcode associated with the syntactic form of this expression.
		 *
		 * @return
		 */
		public int getOpcode();

		/**
		 * Get the immediate subexpressions of this expression, in a fixed order.
		 *
		 * @return
		 */
		public List<Expression> children();

		/**
		 * Construct an expression of the same form as this, but whose children
		 * are replaced with those given. The list must have the same length and
		 * order as that returned by <code>children()</code>.
		 *
		 * @param children
		 * @return
		 */
		public Expression withChildren(List<Expression> children);

		/**
		 * Write this expression back out in the surface notation, such that
		 * parsing the result gives an equivalent expression.
		 *
		 * @return
		 */
		public String toLatex();

		/**
		 * An abstract expression to be implemented by all other expressions.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static abstract class AbstractExpression extends SyntacticElement.Impl implements Expression {
			private final int opcode;

			public AbstractExpression(int opcode, Attribute... attributes) {
				super(attributes);
				this.opcode = opcode;
			}

			@Override
			public int getOpcode() {
				return opcode;
			}

			@Override
			public List<Expression> children() {
				return Collections.emptyList();
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				return this;
			}

			@Override
			public String toString() {
				return toLatex();
			}
		}

		/**
		 * A numeric literal, such as <code>3.14</code>.
		 */
		public class Literal extends AbstractExpression {
			private final double value;

			public Literal(double value, Attribute... attributes) {
				super(EXPR_literal, attributes);
				this.value = value;
			}

			public double value() {
				return value;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Literal && Double.compare(((Literal) o).value, value) == 0;
			}

			@Override
			public int hashCode() {
				return Double.hashCode(value);
			}

			@Override
			public String toLatex() {
				if (Double.isNaN(value)) {
					return "\\frac{0}{0}";
				} else if (value == Double.POSITIVE_INFINITY) {
					return "\\infty";
				} else if (value == Double.NEGATIVE_INFINITY) {
					return "-\\infty";
				} else if (value == Math.rint(value) && Math.abs(value) < 1e15) {
					return Long.toString((long) value);
				} else {
					return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
				}
			}
		}

		/**
		 * A named variable, such as <code>x</code>, <code>x_1</code> or
		 * <code>\alpha</code>.
		 */
		public class Variable extends AbstractExpression {
			private final String name;

			public Variable(String name, Attribute... attributes) {
				super(EXPR_variable, attributes);
				this.name = Objects.requireNonNull(name);
			}

			public String name() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Variable && ((Variable) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toLatex() {
				int split = name.indexOf('_');
				if (split > 0) {
					return latexName(name.substring(0, split)) + "_{" + name.substring(split + 1) + "}";
				}
				return latexName(name);
			}

			private static String latexName(String name) {
				if (GREEK.contains(name)) {
					return "\\" + name;
				} else if (name.length() == 1) {
					return name;
				} else {
					return "\\text{" + name + "}";
				}
			}
		}

		/**
		 * A binary arithmetic operation, such as <code>x + 1</code>. For
		 * multiplication, the surface symbol is retained as it distinguishes a
		 * cross product (<code>\times</code>) from a dot product.
		 */
		public class Binary extends AbstractExpression {
			public enum Op {
				ADD("+"), SUB("-"), MUL("*"), DIV("/"), POW("^");

				private final String symbol;

				Op(String symbol) {
					this.symbol = symbol;
				}

				public String symbol() {
					return symbol;
				}
			}

			public static final String TIMES = "\\times";
			public static final String CDOT = "\\cdot";

			private final Op op;
			private final Expression lhs;
			private final Expression rhs;
			private final String symbol;

			public Binary(Op op, Expression lhs, Expression rhs, Attribute... attributes) {
				this(op, lhs, rhs, null, attributes);
			}

			public Binary(Op op, Expression lhs, Expression rhs, String symbol, Attribute... attributes) {
				super(EXPR_binary, attributes);
				this.op = Objects.requireNonNull(op);
				this.lhs = Objects.requireNonNull(lhs);
				this.rhs = Objects.requireNonNull(rhs);
				this.symbol = symbol;
			}

			public Op op() {
				return op;
			}

			public Expression leftOperand() {
				return lhs;
			}

			public Expression rightOperand() {
				return rhs;
			}

			/**
			 * The surface symbol used for this operation, or null if it was
			 * written with the plain operator (or implicitly).
			 *
			 * @return
			 */
			public String symbol() {
				return symbol;
			}

			/**
			 * Check whether this is a multiplication written with
			 * <code>\times</code>.
			 *
			 * @return
			 */
			public boolean isCross() {
				return op == Op.MUL && TIMES.equals(symbol);
			}

			@Override
			public List<Expression> children() {
				return Arrays.asList(lhs, rhs);
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				return new Binary(op, children.get(0), children.get(1), symbol, attributes());
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Binary) {
					Binary b = (Binary) o;
					return op == b.op && isCross() == b.isCross() && lhs.equals(b.lhs) && rhs.equals(b.rhs);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(op, lhs, rhs, isCross());
			}

			@Override
			public String toLatex() {
				switch (op) {
				case ADD:
					return bracket(lhs, PREC_ADDITIVE) + continuation(rhs);
				case SUB:
					return bracket(lhs, PREC_ADDITIVE) + " - " + bracket(rhs, PREC_ADDITIVE + 1);
				case MUL:
					String s = isCross() ? TIMES : CDOT;
					// Right-nested products print without brackets
					boolean chain = !isCross() && rhs instanceof Binary && ((Binary) rhs).op == Op.MUL
							&& !((Binary) rhs).isCross();
					return bracket(lhs, PREC_MULTIPLICATIVE) + " " + s + " "
							+ (chain ? rhs.toLatex() : bracket(rhs, PREC_MULTIPLICATIVE + 1));
				case DIV:
					return "\\frac{" + lhs.toLatex() + "}{" + rhs.toLatex() + "}";
				default:
					return bracket(lhs, PREC_POWER + 1) + "^{" + rhs.toLatex() + "}";
				}
			}

			/**
			 * Print the remainder of a sum, following a term already printed.
			 * Nested sums are printed flat, and negated terms as subtractions.
			 */
			private static String continuation(Expression e) {
				if (e instanceof Binary && ((Binary) e).op == Op.ADD) {
					Binary b = (Binary) e;
					return continuation(b.lhs) + continuation(b.rhs);
				} else if (e instanceof Binary && ((Binary) e).op == Op.SUB) {
					Binary b = (Binary) e;
					return continuation(b.lhs) + " - " + bracket(b.rhs, PREC_ADDITIVE + 1);
				} else if (e instanceof Negation) {
					return " - " + bracket(((Negation) e).operand, PREC_ADDITIVE + 1);
				} else if (e instanceof Literal && ((Literal) e).value < 0) {
					return " - " + new Literal(-((Literal) e).value).toLatex();
				}
				return " + " + bracket(e, PREC_ADDITIVE + 1);
			}
		}

		/**
		 * The arithmetic negation of an expression, such as <code>-x</code>.
		 */
		public class Negation extends AbstractExpression {
			private final Expression operand;

			public Negation(Expression operand, Attribute... attributes) {
				super(EXPR_negation, attributes);
				this.operand = Objects.requireNonNull(operand);
			}

			public Expression operand() {
				return operand;
			}

			@Override
			public List<Expression> children() {
				return Collections.singletonList(operand);
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				return new Negation(children.get(0), attributes());
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Negation && ((Negation) o).operand.equals(operand);
			}

			@Override
			public int hashCode() {
				return 31 * operand.hashCode() + 1;
			}

			@Override
			public String toLatex() {
				return "-" + bracket(operand, PREC_UNARY);
			}
		}

		/**
		 * The absolute value (or magnitude) of an expression, written
		 * <code>|x|</code>.
		 */
		public class Abs extends AbstractExpression {
			private final Expression operand;

			public Abs(Expression operand, Attribute... attributes) {
				super(EXPR_abs, attributes);
				this.operand = Objects.requireNonNull(operand);
			}

			public Expression operand() {
				return operand;
			}

			@Override
			public List<Expression> children() {
				return Collections.singletonList(operand);
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				return new Abs(children.get(0), attributes());
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Abs && ((Abs) o).operand.equals(operand);
			}

			@Override
			public int hashCode() {
				return 31 * operand.hashCode() + 2;
			}

			@Override
			public String toLatex() {
				return "|" + operand.toLatex() + "|";
			}
		}

		/**
		 * A call to a named function, such as <code>\sin(x)</code>,
		 * <code>\log_{2}(x)</code> or <code>\sqrt[3]{x}</code>. The subscript
		 * base and the bracketed parameter are both optional.
		 */
		public class Call extends AbstractExpression {
			private final String name;
			private final List<Expression> arguments;
			private final Expression base;
			private final Expression parameter;

			public Call(String name, List<Expression> arguments, Expression base, Expression parameter,
					Attribute... attributes) {
				super(EXPR_call, attributes);
				this.name = Objects.requireNonNull(name);
				this.arguments = immutable(arguments);
				this.base = base;
				this.parameter = parameter;
			}

			public Call(String name, Expression argument, Attribute... attributes) {
				this(name, Collections.singletonList(argument), null, null, attributes);
			}

			public String name() {
				return name;
			}

			public List<Expression> arguments() {
				return arguments;
			}

			public Expression argument(int i) {
				return arguments.get(i);
			}

			public int size() {
				return arguments.size();
			}

			/**
			 * Check whether this calls a function named like a variable (e.g.
			 * <code>f(x, y)</code>) rather than a builtin command.
			 *
			 * @return
			 */
			public boolean isUserDefined() {
				return name.length() == 1 || name.contains("_") || GREEK.contains(name);
			}

			/**
			 * The subscript of this call (e.g. the base of a logarithm), or null.
			 *
			 * @return
			 */
			public Expression base() {
				return base;
			}

			/**
			 * The bracketed parameter of this call (e.g. the index of a root), or
			 * null.
			 *
			 * @return
			 */
			public Expression parameter() {
				return parameter;
			}

			@Override
			public List<Expression> children() {
				ArrayList<Expression> r = new ArrayList<>(arguments);
				if (base != null) {
					r.add(base);
				}
				if (parameter != null) {
					r.add(parameter);
				}
				return r;
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				int n = arguments.size();
				Expression b = base == null ? null : children.get(n++);
				Expression p = parameter == null ? null : children.get(n);
				return new Call(name, children.subList(0, arguments.size()), b, p, attributes());
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Call) {
					Call c = (Call) o;
					return name.equals(c.name) && arguments.equals(c.arguments) && Objects.equals(base, c.base)
							&& Objects.equals(parameter, c.parameter);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(name, arguments, base, parameter);
			}

			@Override
			public String toLatex() {
				StringBuilder sb = new StringBuilder();
				if (isUserDefined()) {
					sb.append(new Variable(name).toLatex());
				} else {
					sb.append("\\").append(name);
				}
				if (parameter != null) {
					sb.append("[").append(parameter.toLatex()).append("]");
				}
				if (base != null) {
					sb.append("_{").append(base.toLatex()).append("}");
				}
				boolean braces = name.equals("sqrt") || name.equals("dot") || name.equals("ddot")
						|| name.equals("bar") || name.equals("overline");
				sb.append(braces ? "{" : "(");
				sb.append(join(arguments, ", "));
				sb.append(braces ? "}" : ")");
				return sb.toString();
			}
		}

		/**
		 * A matrix literal, given as a rectangular grid of expressions.
		 */
		public class Matrix extends AbstractExpression {
			private final List<List<Expression>> rows;

			public Matrix(List<List<Expression>> rows, Attribute... attributes) {
				super(EXPR_matrix, attributes);
				ArrayList<List<Expression>> rs = new ArrayList<>();
				for (List<Expression> row : rows) {
					rs.add(immutable(row));
				}
				this.rows = Collections.unmodifiableList(rs);
			}

			public List<List<Expression>> rows() {
				return rows;
			}

			public int height() {
				return rows.size();
			}

			public int width() {
				return rows.isEmpty() ? 0 : rows.get(0).size();
			}

			@Override
			public List<Expression> children() {
				ArrayList<Expression> r = new ArrayList<>();
				for (List<Expression> row : rows) {
					r.addAll(row);
				}
				return r;
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				ArrayList<List<Expression>> rs = new ArrayList<>();
				int k = 0;
				for (List<Expression> row : rows) {
					rs.add(children.subList(k, k + row.size()));
					k += row.size();
				}
				return new Matrix(rs, attributes());
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Matrix && ((Matrix) o).rows.equals(rows);
			}

			@Override
			public int hashCode() {
				return rows.hashCode();
			}

			@Override
			public String toLatex() {
				StringBuilder sb = new StringBuilder("\\begin{pmatrix} ");
				for (int i = 0; i != rows.size(); ++i) {
					if (i != 0) {
						sb.append(" \\\\ ");
					}
					sb.append(join(rows.get(i), " & "));
				}
				return sb.append(" \\end{pmatrix}").toString();
			}
		}

		/**
		 * A vector literal, such as <code>\vec{1, 2, 3}</code>. A unit vector
		 * (written <code>\hat{...}</code>) is normalised when evaluated.
		 */
		public class Vector extends AbstractExpression {
			private final List<Expression> components;
			private final boolean unit;

			public Vector(List<Expression> components, boolean unit, Attribute... attributes) {
				super(EXPR_vector, attributes);
				this.components = immutable(components);
				this.unit = unit;
			}

			public List<Expression> components() {
				return components;
			}

			public boolean isUnit() {
				return unit;
			}

			@Override
			public List<Expression> children() {
				return components;
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				return new Vector(children, unit, attributes());
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Vector && ((Vector) o).unit == unit && ((Vector) o).components.equals(components);
			}

			@Override
			public int hashCode() {
				return components.hashCode() + (unit ? 1 : 0);
			}

			@Override
			public String toLatex() {
				return (unit ? "\\hat{" : "\\vec{") + join(components, ", ") + "}";
			}
		}

		/**
		 * A closed interval literal, written <code>[a, b]</code>.
		 */
		public class Interval extends AbstractExpression {
			private final Expression lower;
			private final Expression upper;

			public Interval(Expression lower, Expression upper, Attribute... attributes) {
				super(EXPR_interval, attributes);
				this.lower = Objects.requireNonNull(lower);
				this.upper = Objects.requireNonNull(upper);
			}

			public Expression lower() {
				return lower;
			}

			public Expression upper() {
				return upper;
			}

			@Override
			public List<Expression> children() {
				return Arrays.asList(lower, upper);
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				return new Interval(children.get(0), children.get(1), attributes());
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Interval && ((Interval) o).lower.equals(lower) && ((Interval) o).upper.equals(upper);
			}

			@Override
			public int hashCode() {
				return Objects.hash(lower, upper, EXPR_interval);
			}

			@Override
			public String toLatex() {
				return "[" + lower.toLatex() + ", " + upper.toLatex() + "]";
			}
		}

		/**
		 * Common structure of summations and products, which bind an index
		 * variable ranging over the integers from <code>start</code> to
		 * <code>end</code> (inclusive).
		 */
		public static abstract class Series extends AbstractExpression {
			private final String variable;
			private final Expression start;
			private final Expression end;
			private final Expression body;

			public Series(int opcode, String variable, Expression start, Expression end, Expression body,
					Attribute... attributes) {
				super(opcode, attributes);
				this.variable = Objects.requireNonNull(variable);
				this.start = Objects.requireNonNull(start);
				this.end = Objects.requireNonNull(end);
				this.body = Objects.requireNonNull(body);
			}

			public String variable() {
				return variable;
			}

			public Expression start() {
				return start;
			}

			public Expression end() {
				return end;
			}

			public Expression body() {
				return body;
			}

			@Override
			public List<Expression> children() {
				return Arrays.asList(start, end, body);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Series) {
					Series s = (Series) o;
					return getOpcode() == s.getOpcode() && variable.equals(s.variable) && start.equals(s.start)
							&& end.equals(s.end) && body.equals(s.body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(getOpcode(), variable, start, end, body);
			}

			protected String toLatex(String command) {
				return command + "_{" + new Variable(variable).toLatex() + "=" + start.toLatex() + "}^{" + end.toLatex()
						+ "} " + body.toLatex();
			}
		}

		/**
		 * A summation, such as <code>\sum_{i=1}^{n} i^2</code>.
		 */
		public class Sum extends Series {
			public Sum(String variable, Expression start, Expression end, Expression body, Attribute... attributes) {
				super(EXPR_sum, variable, start, end, body, attributes);
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				return new Sum(variable(), children.get(0), children.get(1), children.get(2), attributes());
			}

			@Override
			public String toLatex() {
				return toLatex("\\sum");
			}
		}

		/**
		 * A product, such as <code>\prod_{i=1}^{n} i</code>.
		 */
		public class Product extends Series {
			public Product(String variable, Expression start, Expression end, Expression body,
					Attribute... attributes) {
				super(EXPR_product, variable, start, end, body, attributes);
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				return new Product(variable(), children.get(0), children.get(1), children.get(2), attributes());
			}

			@Override
			public String toLatex() {
				return toLatex("\\prod");
			}
		}

		/**
		 * A limit, such as <code>\lim_{x \to 0} \frac{\sin(x)}{x}</code>.
		 */
		public class Limit extends AbstractExpression {
			private final String variable;
			private final Expression target;
			private final Expression body;

			public Limit(String variable, Expression target, Expression body, Attribute... attributes) {
				super(EXPR_limit, attributes);
				this.variable = Objects.requireNonNull(variable);
				this.target = Objects.requireNonNull(target);
				this.body = Objects.requireNonNull(body);
			}

			public String variable() {
				return variable;
			}

			public Expression target() {
				return target;
			}

			public Expression body() {
				return body;
			}

			@Override
			public List<Expression> children() {
				return Arrays.asList(target, body);
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				return new Limit(variable, children.get(0), children.get(1), attributes());
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Limit) {
					Limit l = (Limit) o;
					return variable.equals(l.variable) && target.equals(l.target) && body.equals(l.body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(EXPR_limit, variable, target, body);
			}

			@Override
			public String toLatex() {
				return "\\lim_{" + new Variable(variable).toLatex() + " \\to " + target.toLatex() + "} "
						+ body.toLatex();
			}
		}

		/**
		 * An integral with respect to a given variable. Either bound may be null,
		 * in which case the integral is indefinite. A closed integral is a
		 * contour integral, written <code>\oint</code>.
		 */
		public class Integral extends AbstractExpression {
			private final Expression lower;
			private final Expression upper;
			private final Expression body;
			private final String variable;
			private final boolean closed;

			public Integral(Expression lower, Expression upper, Expression body, String variable, boolean closed,
					Attribute... attributes) {
				super(EXPR_integral, attributes);
				this.lower = lower;
				this.upper = upper;
				this.body = Objects.requireNonNull(body);
				this.variable = Objects.requireNonNull(variable);
				this.closed = closed;
			}

			public Integral(Expression body, String variable, Attribute... attributes) {
				this(null, null, body, variable, false, attributes);
			}

			public Expression lower() {
				return lower;
			}

			public Expression upper() {
				return upper;
			}

			public Expression body() {
				return body;
			}

			public String variable() {
				return variable;
			}

			public boolean isClosed() {
				return closed;
			}

			public boolean isDefinite() {
				return lower != null && upper != null;
			}

			@Override
			public List<Expression> children() {
				ArrayList<Expression> r = new ArrayList<>();
				if (lower != null) {
					r.add(lower);
				}
				if (upper != null) {
					r.add(upper);
				}
				r.add(body);
				return r;
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				int k = 0;
				Expression l = lower == null ? null : children.get(k++);
				Expression u = upper == null ? null : children.get(k++);
				return new Integral(l, u, children.get(k), variable, closed, attributes());
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Integral) {
					Integral i = (Integral) o;
					return closed == i.closed && variable.equals(i.variable) && Objects.equals(lower, i.lower)
							&& Objects.equals(upper, i.upper) && body.equals(i.body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(EXPR_integral, lower, upper, body, variable, closed);
			}

			@Override
			public String toLatex() {
				StringBuilder sb = new StringBuilder(closed ? "\\oint" : "\\int");
				if (lower != null) {
					sb.append("_{").append(lower.toLatex()).append("}");
				}
				if (upper != null) {
					sb.append("^{").append(upper.toLatex()).append("}");
				}
				sb.append(" ").append(body.toLatex()).append(" \\, d").append(new Variable(variable).toLatex());
				return sb.toString();
			}
		}

		/**
		 * An ordinary derivative of some order, written
		 * <code>\frac{d}{dx}(...)</code> or <code>\frac{d^n}{dx^n}(...)</code>.
		 */
		public class Derivative extends AbstractExpression {
			private final Expression body;
			private final String variable;
			private final int order;

			public Derivative(Expression body, String variable, int order, Attribute... attributes) {
				this(EXPR_derivative, body, variable, order, attributes);
			}

			protected Derivative(int opcode, Expression body, String variable, int order, Attribute... attributes) {
				super(opcode, attributes);
				this.body = Objects.requireNonNull(body);
				this.variable = Objects.requireNonNull(variable);
				this.order = order;
			}

			public Expression body() {
				return body;
			}

			public String variable() {
				return variable;
			}

			public int order() {
				return order;
			}

			@Override
			public List<Expression> children() {
				return Collections.singletonList(body);
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				return new Derivative(children.get(0), variable, order, attributes());
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Derivative) {
					Derivative d = (Derivative) o;
					return getOpcode() == d.getOpcode() && order == d.order && variable.equals(d.variable)
							&& body.equals(d.body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(getOpcode(), body, variable, order);
			}

			@Override
			public String toLatex() {
				return toLatex("d", "d");
			}

			protected String toLatex(String top, String bottom) {
				String v = new Variable(variable).toLatex();
				if (order == 1) {
					return "\\frac{" + top + "}{" + bottom + " " + v + "}(" + body.toLatex() + ")";
				} else {
					return "\\frac{" + top + "^{" + order + "}}{" + bottom + " " + v + "^{" + order + "}}("
							+ body.toLatex() + ")";
				}
			}
		}

		/**
		 * A partial derivative, written
		 * <code>\frac{\partial}{\partial x}(...)</code>.
		 */
		public class PartialDerivative extends Derivative {
			public PartialDerivative(Expression body, String variable, int order, Attribute... attributes) {
				super(EXPR_partial, body, variable, order, attributes);
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				return new PartialDerivative(children.get(0), variable(), order(), attributes());
			}

			@Override
			public String toLatex() {
				return toLatex("\\partial", "\\partial");
			}
		}

		/**
		 * The gradient <code>\nabla f</code> of a scalar expression, or its
		 * Laplacian <code>\nabla^2 f</code>. The variables are those occurring
		 * free in the body.
		 */
		public class Gradient extends AbstractExpression {
			private final Expression body;
			private final boolean laplacian;

			public Gradient(Expression body, boolean laplacian, Attribute... attributes) {
				super(EXPR_gradient, attributes);
				this.body = Objects.requireNonNull(body);
				this.laplacian = laplacian;
			}

			public Expression body() {
				return body;
			}

			public boolean isLaplacian() {
				return laplacian;
			}

			@Override
			public List<Expression> children() {
				return Collections.singletonList(body);
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				return new Gradient(children.get(0), laplacian, attributes());
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Gradient) {
					Gradient g = (Gradient) o;
					return laplacian == g.laplacian && body.equals(g.body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(EXPR_gradient, body, laplacian);
			}

			@Override
			public String toLatex() {
				return (laplacian ? "\\nabla^2{" : "\\nabla{") + body.toLatex() + "}";
			}
		}

		/**
		 * A binomial coefficient, written <code>\binom{n}{k}</code>.
		 */
		public class Binomial extends AbstractExpression {
			private final Expression n;
			private final Expression k;

			public Binomial(Expression n, Expression k, Attribute... attributes) {
				super(EXPR_binomial, attributes);
				this.n = Objects.requireNonNull(n);
				this.k = Objects.requireNonNull(k);
			}

			public Expression top() {
				return n;
			}

			public Expression bottom() {
				return k;
			}

			@Override
			public List<Expression> children() {
				return Arrays.asList(n, k);
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				return new Binomial(children.get(0), children.get(1), attributes());
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Binomial && ((Binomial) o).n.equals(n) && ((Binomial) o).k.equals(k);
			}

			@Override
			public int hashCode() {
				return Objects.hash(EXPR_binomial, n, k);
			}

			@Override
			public String toLatex() {
				return "\\binom{" + n.toLatex() + "}{" + k.toLatex() + "}";
			}
		}

		/**
		 * A relation between two expressions, such as <code>x \leq 5</code>.
		 */
		public class Comparison extends AbstractExpression {
			public enum Op {
				LT("<"), GT(">"), LTEQ("\\leq"), GTEQ("\\geq"), EQ("="), NEQ("\\neq"), IN("\\in");

				private final String symbol;

				Op(String symbol) {
					this.symbol = symbol;
				}

				public String symbol() {
					return symbol;
				}
			}

			private final Op op;
			private final Expression lhs;
			private final Expression rhs;

			public Comparison(Op op, Expression lhs, Expression rhs, Attribute... attributes) {
				super(EXPR_comparison, attributes);
				this.op = Objects.requireNonNull(op);
				this.lhs = Objects.requireNonNull(lhs);
				this.rhs = Objects.requireNonNull(rhs);
			}

			public Op op() {
				return op;
			}

			public Expression leftOperand() {
				return lhs;
			}

			public Expression rightOperand() {
				return rhs;
			}

			@Override
			public List<Expression> children() {
				return Arrays.asList(lhs, rhs);
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				return new Comparison(op, children.get(0), children.get(1), attributes());
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Comparison) {
					Comparison c = (Comparison) o;
					return op == c.op && lhs.equals(c.lhs) && rhs.equals(c.rhs);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(EXPR_comparison, op, lhs, rhs);
			}

			@Override
			public String toLatex() {
				return bracket(lhs, PREC_ADDITIVE) + " " + op.symbol() + " " + bracket(rhs, PREC_ADDITIVE);
			}
		}

		/**
		 * A chain of two or more relations sharing operands, such as
		 * <code>-5 &lt; x &lt; 5</code>. This holds when every adjacent pair of
		 * operands is related.
		 */
		public class ChainedComparison extends AbstractExpression {
			private final List<Expression> operands;
			private final List<Comparison.Op> operators;

			public ChainedComparison(List<Expression> operands, List<Comparison.Op> operators,
					Attribute... attributes) {
				super(EXPR_chain, attributes);
				if (operands.size() != operators.size() + 1) {
					throw new IllegalArgumentException("chained comparison requires one more operand than operator");
				}
				this.operands = immutable(operands);
				this.operators = Collections.unmodifiableList(new ArrayList<>(operators));
			}

			public List<Expression> operands() {
				return operands;
			}

			public List<Comparison.Op> operators() {
				return operators;
			}

			@Override
			public List<Expression> children() {
				return operands;
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				return new ChainedComparison(children, operators, attributes());
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof ChainedComparison) {
					ChainedComparison c = (ChainedComparison) o;
					return operators.equals(c.operators) && operands.equals(c.operands);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(EXPR_chain, operands, operators);
			}

			@Override
			public String toLatex() {
				StringBuilder sb = new StringBuilder(bracket(operands.get(0), PREC_ADDITIVE));
				for (int i = 0; i != operators.size(); ++i) {
					sb.append(" ").append(operators.get(i).symbol()).append(" ");
					sb.append(bracket(operands.get(i + 1), PREC_ADDITIVE));
				}
				return sb.toString();
			}
		}

		/**
		 * A logical connective over boolean operands. Negation has exactly one
		 * operand, whilst conjunction and disjunction have two.
		 */
		public class Logical extends AbstractExpression {
			public enum Op {
				AND("\\land"), OR("\\lor"), NOT("\\neg");

				private final String symbol;

				Op(String symbol) {
					this.symbol = symbol;
				}

				public String symbol() {
					return symbol;
				}
			}

			private final Op op;
			private final List<Expression> operands;

			public Logical(Op op, List<Expression> operands, Attribute... attributes) {
				super(EXPR_logical, attributes);
				if (operands.size() != (op == Op.NOT ? 1 : 2)) {
					throw new IllegalArgumentException("invalid number of operands for " + op);
				}
				this.op = op;
				this.operands = immutable(operands);
			}

			public Op op() {
				return op;
			}

			public List<Expression> operands() {
				return operands;
			}

			@Override
			public List<Expression> children() {
				return operands;
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				return new Logical(op, children, attributes());
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Logical && ((Logical) o).op == op && ((Logical) o).operands.equals(operands);
			}

			@Override
			public int hashCode() {
				return Objects.hash(EXPR_logical, op, operands);
			}

			@Override
			public String toLatex() {
				if (op == Op.NOT) {
					return "\\neg (" + operands.get(0).toLatex() + ")";
				}
				return "(" + operands.get(0).toLatex() + ") " + op.symbol() + " (" + operands.get(1).toLatex() + ")";
			}
		}

		/**
		 * An expression which is only defined where its guard holds, written
		 * <code>x^2, -5 &lt; x &lt; 5</code>.
		 */
		public class Conditional extends AbstractExpression {
			private final Expression body;
			private final Expression guard;

			public Conditional(Expression body, Expression guard, Attribute... attributes) {
				super(EXPR_conditional, attributes);
				this.body = Objects.requireNonNull(body);
				this.guard = Objects.requireNonNull(guard);
			}

			public Expression body() {
				return body;
			}

			public Expression guard() {
				return guard;
			}

			@Override
			public List<Expression> children() {
				return Arrays.asList(body, guard);
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				return new Conditional(children.get(0), children.get(1), attributes());
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Conditional && ((Conditional) o).body.equals(body)
						&& ((Conditional) o).guard.equals(guard);
			}

			@Override
			public int hashCode() {
				return Objects.hash(EXPR_conditional, body, guard);
			}

			@Override
			public String toLatex() {
				return body.toLatex() + ", " + guard.toLatex();
			}
		}

		/**
		 * A piecewise expression, written as a <code>cases</code> environment.
		 * Cases are tried in order and a case without a guard (i.e. the
		 * "otherwise" case) always applies.
		 */
		public class Piecewise extends AbstractExpression {

			public static final class Case {
				private final Expression body;
				private final Expression guard;

				public Case(Expression body, Expression guard) {
					this.body = Objects.requireNonNull(body);
					this.guard = guard;
				}

				public Expression body() {
					return body;
				}

				/**
				 * The guard of this case, or null if this is the "otherwise" case.
				 *
				 * @return
				 */
				public Expression guard() {
					return guard;
				}

				@Override
				public boolean equals(Object o) {
					return o instanceof Case && ((Case) o).body.equals(body) && Objects.equals(((Case) o).guard, guard);
				}

				@Override
				public int hashCode() {
					return Objects.hash(body, guard);
				}
			}

			private final List<Case> cases;

			public Piecewise(List<Case> cases, Attribute... attributes) {
				super(EXPR_piecewise, attributes);
				this.cases = Collections.unmodifiableList(new ArrayList<>(cases));
			}

			public List<Case> cases() {
				return cases;
			}

			@Override
			public List<Expression> children() {
				ArrayList<Expression> r = new ArrayList<>();
				for (Case c : cases) {
					r.add(c.body);
					if (c.guard != null) {
						r.add(c.guard);
					}
				}
				return r;
			}

			@Override
			public Expression withChildren(List<Expression> children) {
				ArrayList<Case> cs = new ArrayList<>();
				int k = 0;
				for (Case c : cases) {
					Expression b = children.get(k++);
					Expression g = c.guard == null ? null : children.get(k++);
					cs.add(new Case(b, g));
				}
				return new Piecewise(cs, attributes());
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Piecewise && ((Piecewise) o).cases.equals(cases);
			}

			@Override
			public int hashCode() {
				return Objects.hash(EXPR_piecewise, cases);
			}

			@Override
			public String toLatex() {
				StringBuilder sb = new StringBuilder("\\begin{cases} ");
				for (int i = 0; i != cases.size(); ++i) {
					Case c = cases.get(i);
					if (i != 0) {
						sb.append(" \\\\ ");
					}
					sb.append(c.body.toLatex()).append(" & ");
					sb.append(c.guard == null ? "\\text{otherwise}" : c.guard.toLatex());
				}
				return sb.append(" \\end{cases}").toString();
			}
		}
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	/**
	 * Determine the set of variables which occur free in a given expression.
	 * Index variables of summations, products, limits, integrals and
	 * derivatives are bound within their bodies.
	 *
	 * @param e
	 * @return
	 */
	public static Set<String> freeVariables(Expression e) {
		LinkedHashSet<String> vars = new LinkedHashSet<>();
		freeVariables(e, Collections.emptySet(), vars);
		return vars;
	}

	private static void freeVariables(Expression e, Set<String> bound, Set<String> vars) {
		if (e instanceof Expression.Variable) {
			String name = ((Expression.Variable) e).name();
			if (!bound.contains(name)) {
				vars.add(name);
			}
			return;
		}
		String binder = binderOf(e);
		for (Expression child : e.children()) {
			if (binder != null && isBoundIn(e, child)) {
				HashSet<String> nbound = new HashSet<>(bound);
				nbound.add(binder);
				freeVariables(child, nbound, vars);
			} else {
				freeVariables(child, bound, vars);
			}
		}
	}

	/**
	 * Check whether a given variable occurs free in an expression.
	 *
	 * @param e
	 * @param variable
	 * @return
	 */
	public static boolean contains(Expression e, String variable) {
		return freeVariables(e).contains(variable);
	}

	/**
	 * Replace every free occurrence of a variable with a given expression.
	 *
	 * @param e
	 * @param variable
	 * @param replacement
	 * @return
	 */
	public static Expression substitute(Expression e, String variable, Expression replacement) {
		if (e instanceof Expression.Variable) {
			return ((Expression.Variable) e).name().equals(variable) ? replacement : e;
		}
		List<Expression> children = e.children();
		if (children.isEmpty()) {
			return e;
		}
		String binder = binderOf(e);
		ArrayList<Expression> nchildren = new ArrayList<>();
		boolean changed = false;
		for (Expression child : children) {
			Expression nchild = child;
			if (!(variable.equals(binder) && isBoundIn(e, child))) {
				nchild = substitute(child, variable, replacement);
			}
			changed |= nchild != child;
			nchildren.add(nchild);
		}
		return changed ? e.withChildren(nchildren) : e;
	}

	/**
	 * Count the number of nodes in an expression tree.
	 *
	 * @param e
	 * @return
	 */
	public static int size(Expression e) {
		int n = 1;
		for (Expression child : e.children()) {
			n += size(child);
		}
		return n;
	}

	private static String binderOf(Expression e) {
		switch (e.getOpcode()) {
		case EXPR_sum:
		case EXPR_product:
			return ((Expression.Series) e).variable();
		case EXPR_limit:
			return ((Expression.Limit) e).variable();
		case EXPR_integral:
			Expression.Integral i = (Expression.Integral) e;
			// the variable of an indefinite integral remains free
			return i.isDefinite() ? i.variable() : null;
		default:
			return null;
		}
	}

	private static boolean isBoundIn(Expression e, Expression child) {
		switch (e.getOpcode()) {
		case EXPR_sum:
		case EXPR_product:
			return child == ((Expression.Series) e).body();
		case EXPR_limit:
			return child == ((Expression.Limit) e).body();
		case EXPR_integral:
			return child == ((Expression.Integral) e).body();
		default:
			return false;
		}
	}

	private static int precedence(Expression e) {
		switch (e.getOpcode()) {
		case EXPR_literal:
			return ((Expression.Literal) e).value() < 0 ? PREC_UNARY : PREC_ATOM;
		case EXPR_binary:
			switch (((Expression.Binary) e).op()) {
			case ADD:
			case SUB:
				return PREC_ADDITIVE;
			case MUL:
				return PREC_MULTIPLICATIVE;
			case DIV:
				return PREC_ATOM;
			default:
				return PREC_POWER;
			}
		case EXPR_negation:
		case EXPR_gradient:
			return PREC_UNARY;
		case EXPR_sum:
		case EXPR_product:
		case EXPR_limit:
		case EXPR_integral:
		case EXPR_comparison:
		case EXPR_chain:
		case EXPR_logical:
			return PREC_RELATION;
		case EXPR_conditional:
			return PREC_CONDITIONAL;
		default:
			return PREC_ATOM;
		}
	}

	private static String bracket(Expression e, int minimum) {
		String s = e.toLatex();
		return precedence(e) < minimum ? "(" + s + ")" : s;
	}

	private static String join(List<Expression> items, String separator) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i != items.size(); ++i) {
			if (i != 0) {
				sb.append(separator);
			}
			sb.append(items.get(i).toLatex());
		}
		return sb.toString();
	}

	private static List<Expression> immutable(List<Expression> items) {
		for (Expression e : items) {
			Objects.requireNonNull(e);
		}
		return Collections.unmodifiableList(new ArrayList<>(items));
	}
}

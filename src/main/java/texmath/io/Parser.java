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
package texmath.io;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import texmath.core.Syntax.Expression;
import texmath.core.Syntax.Expression.Binary;
import texmath.core.Syntax.Expression.Comparison;
import texmath.core.Syntax.Expression.Logical;
import texmath.core.Syntax.Expression.Piecewise;
import texmath.io.Lexer.Token;
import texmath.io.Lexer.Token.Kind;
import texmath.util.ParserException;
import texmath.util.Suggestions;
import texmath.util.SyntacticElement.Attribute;

/**
 * A recursive descent parser for mathematical expressions. The grammar is, in
 * order of increasing binding strength:
 *
 * <pre>
 * Expr       ::= Or [ ',' Or ]
 * Or         ::= And ( '\lor' And )*
 * And        ::= Not ( '\land' Not )*
 * Not        ::= '\neg' Not | Comparison
 * Comparison ::= Additive ( RelOp Additive )*
 * Additive   ::= Term ( ('+' | '-') Term )*
 * Term       ::= Unary ( ('*' | '/')? Unary )*
 * Unary      ::= ('-' | '+') Unary | Power
 * Power      ::= Postfix [ '^' Exponent ]
 * Postfix    ::= Primary [ '!' ]
 * </pre>
 *
 * Every recursive descent into a nested subexpression increments a depth
 * counter, which is passed explicitly. Exceeding the configured maximum depth
 * is an error, even for an otherwise well-formed expression.
 *
 * @author David J. Pearce
 *
 */
public class Parser {
	private static final Logger logger = Logger.getLogger(Parser.class.getName());

	public static final int DEFAULT_MAX_DEPTH = 500;
	public static final int DEFAULT_MAX_NODES = 10_000;

	/**
	 * Placeholder variable used in place of an unparseable subexpression in
	 * recovery mode.
	 */
	public static final String ERROR_PLACEHOLDER = "__error__";

	private static final List<String> MATRIX_ENVIRONMENTS = Arrays.asList("matrix", "pmatrix", "bmatrix", "Bmatrix",
			"vmatrix", "Vmatrix", "smallmatrix");

	private final String source;
	private final List<Token> tokens;
	private final int maxDepth;
	private final int maxNodes;
	private final ArrayDeque<Kind> delimiters = new ArrayDeque<>();
	private int index;
	private int nodes;
	private int integralNesting;
	private List<ParserException> errors;

	public Parser(String source, List<Token> tokens) {
		this(source, tokens, DEFAULT_MAX_DEPTH, DEFAULT_MAX_NODES);
	}

	public Parser(String source, List<Token> tokens, int maxDepth, int maxNodes) {
		this.source = source;
		this.tokens = new ArrayList<>(tokens);
		if (this.tokens.isEmpty() || this.tokens.get(this.tokens.size() - 1).kind != Kind.EOF) {
			int end = source == null ? 0 : source.length();
			this.tokens.add(new Token(Kind.EOF, "", end, null));
		}
		this.maxDepth = maxDepth;
		this.maxNodes = maxNodes;
	}

	/**
	 * The outcome of parsing in recovery mode: a (possibly partial) expression,
	 * together with every error encountered along the way.
	 */
	public static final class Result {
		private final Expression expression;
		private final List<ParserException> errors;

		public Result(Expression expression, List<ParserException> errors) {
			this.expression = expression;
			this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
		}

		public Expression expression() {
			return expression;
		}

		public List<ParserException> errors() {
			return errors;
		}

		public boolean isValid() {
			return errors.isEmpty();
		}
	}

	/**
	 * Parse the tokens as a complete expression, failing with a
	 * {@link ParserException} on the first error.
	 *
	 * @return
	 */
	public Expression parse() {
		index = 0;
		nodes = 0;
		errors = null;
		return parseTopLevel();
	}

	/**
	 * Parse the tokens as a complete expression, continuing past errors where
	 * possible so that as many problems as possible are reported in a single
	 * pass. Exceeding a resource limit is never recovered from.
	 *
	 * @return
	 */
	public Result recover() {
		index = 0;
		nodes = 0;
		errors = new ArrayList<>();
		Expression e;
		try {
			e = parseTopLevel();
		} catch (ParserException ex) {
			errors.add(ex);
			e = null;
		}
		Result r = new Result(e, errors);
		errors = null;
		return r;
	}

	private Expression parseTopLevel() {
		int start = index;
		Expression e = parseExpression(0);
		if (is(Kind.COMMA)) {
			match(Kind.COMMA, "','");
			Expression guard = parseExpression(0);
			e = node(new Expression.Conditional(e, guard, sourceAttr(start, index - 1)));
		}
		while (!is(Kind.EOF)) {
			Token t = tokens.get(index);
			String suggestion = null;
			if (t.kind == Kind.RIGHT_PAREN || t.kind == Kind.RIGHT_BRACE || t.kind == Kind.RIGHT_BRACKET) {
				suggestion = "remove the unmatched '" + t.text + "'";
			}
			syntaxError("unexpected token '" + t.text + "'", t, suggestion);
			// Only reachable in recovery mode
			index = index + 1;
		}
		return e;
	}

	/**
	 * Parse an expression, which may include logical connectives and
	 * comparisons.
	 *
	 * @param depth
	 * @return
	 */
	public Expression parseExpression(int depth) {
		checkDepth(depth);
		return parseDisjunction(depth);
	}

	private Expression parseDisjunction(int depth) {
		int start = index;
		Expression lhs = parseConjunction(depth);
		while (is(Kind.OR)) {
			index = index + 1;
			Expression rhs = parseConjunction(depth);
			lhs = node(new Logical(Logical.Op.OR, Arrays.asList(lhs, rhs), sourceAttr(start, index - 1)));
		}
		return lhs;
	}

	private Expression parseConjunction(int depth) {
		int start = index;
		Expression lhs = parseNegation(depth);
		while (is(Kind.AND)) {
			index = index + 1;
			Expression rhs = parseNegation(depth);
			lhs = node(new Logical(Logical.Op.AND, Arrays.asList(lhs, rhs), sourceAttr(start, index - 1)));
		}
		return lhs;
	}

	private Expression parseNegation(int depth) {
		int start = index;
		if (is(Kind.NOT)) {
			index = index + 1;
			checkDepth(depth + 1);
			Expression operand = parseNegation(depth + 1);
			return node(new Logical(Logical.Op.NOT, Collections.singletonList(operand), sourceAttr(start, index - 1)));
		}
		return parseComparison(depth);
	}

	/**
	 * Parse a comparison, or chain of comparisons, such as
	 * <code>-5 &lt; x \leq 5</code>.
	 *
	 * @param depth
	 * @return
	 */
	private Expression parseComparison(int depth) {
		int start = index;
		Expression first = parseAdditive(depth);
		ArrayList<Expression> operands = new ArrayList<>();
		ArrayList<Comparison.Op> operators = new ArrayList<>();
		operands.add(first);
		Comparison.Op op;
		while ((op = comparisonOperator(tokens.get(index))) != null) {
			index = index + 1;
			operators.add(op);
			operands.add(parseAdditive(depth));
		}
		if (operators.isEmpty()) {
			return first;
		} else if (operators.size() == 1) {
			return node(new Comparison(operators.get(0), operands.get(0), operands.get(1), sourceAttr(start, index - 1)));
		} else {
			return node(new Expression.ChainedComparison(operands, operators, sourceAttr(start, index - 1)));
		}
	}

	private static Comparison.Op comparisonOperator(Token t) {
		switch (t.kind) {
		case LESS:
			return Comparison.Op.LT;
		case LESS_EQUALS:
			return Comparison.Op.LTEQ;
		case GREATER:
			return Comparison.Op.GT;
		case GREATER_EQUALS:
			return Comparison.Op.GTEQ;
		case EQUALS:
			return Comparison.Op.EQ;
		case NOT_EQUALS:
			return Comparison.Op.NEQ;
		case IN:
			return Comparison.Op.IN;
		default:
			return null;
		}
	}

	public Expression parseAdditive(int depth) {
		int start = index;
		Expression lhs = parseMultiplicative(depth);
		while (is(Kind.PLUS) || is(Kind.MINUS)) {
			Binary.Op op = tokens.get(index).kind == Kind.PLUS ? Binary.Op.ADD : Binary.Op.SUB;
			index = index + 1;
			Expression rhs = parseMultiplicative(depth);
			lhs = node(new Binary(op, lhs, rhs, sourceAttr(start, index - 1)));
		}
		return lhs;
	}

	/**
	 * Parse a sequence of multiplications and divisions. Two adjacent operands
	 * with no operator between them are implicitly multiplied (e.g.
	 * <code>2x</code>), unless the next token is the closing delimiter we are
	 * currently expecting.
	 *
	 * @param depth
	 * @return
	 */
	public Expression parseMultiplicative(int depth) {
		int start = index;
		Expression lhs = parseUnary(depth);
		while (true) {
			Token t = tokens.get(index);
			if (t.kind == Kind.MULTIPLY || t.kind == Kind.DIVIDE) {
				index = index + 1;
				Expression rhs = parseUnary(depth);
				if (t.kind == Kind.MULTIPLY) {
					lhs = node(new Binary(Binary.Op.MUL, lhs, rhs, t.value, sourceAttr(start, index - 1)));
				} else {
					lhs = node(new Binary(Binary.Op.DIV, lhs, rhs, sourceAttr(start, index - 1)));
				}
			} else if (isImplicitOperand(t)) {
				Expression rhs = parseUnary(depth);
				lhs = node(new Binary(Binary.Op.MUL, lhs, rhs, sourceAttr(start, index - 1)));
			} else {
				return lhs;
			}
		}
	}

	private boolean isImplicitOperand(Token t) {
		if (!delimiters.isEmpty() && delimiters.peek() == t.kind) {
			return false;
		} else if (integralNesting > 0 && isDifferential(index)) {
			return false;
		}
		switch (t.kind) {
		case NUMBER:
		case VARIABLE:
		case CONSTANT:
		case FUNCTION:
		case LEFT_PAREN:
		case LEFT_BRACE:
		case LIM:
		case SUM:
		case PROD:
		case INT:
		case OINT:
		case FRAC:
		case BINOM:
		case TEXT:
		case FONT:
		case INFTY:
		case BEGIN:
		case PIPE:
		case LANGLE:
		case NABLA:
			return true;
		default:
			return false;
		}
	}

	/**
	 * Check whether the tokens at a given position form a differential, such
	 * as <code>dx</code> or <code>\mathrm{d}x</code>.
	 *
	 * @param i
	 * @return
	 */
	private boolean isDifferential(int i) {
		Token t = tokens.get(i);
		boolean d = (t.kind == Kind.VARIABLE || t.kind == Kind.FONT) && "d".equals(t.value);
		return d && i + 1 < tokens.size() && tokens.get(i + 1).kind == Kind.VARIABLE;
	}

	public Expression parseUnary(int depth) {
		checkDepth(depth);
		int start = index;
		if (is(Kind.MINUS)) {
			index = index + 1;
			Expression operand = parseUnary(depth + 1);
			return node(new Expression.Negation(operand, sourceAttr(start, index - 1)));
		} else if (is(Kind.PLUS)) {
			index = index + 1;
			return parseUnary(depth + 1);
		}
		return parsePower(depth);
	}

	/**
	 * Parse a base, optionally raised to a power. Exponentiation is right
	 * associative, so <code>a^b^c</code> is <code>a^(b^c)</code>.
	 *
	 * @param depth
	 * @return
	 */
	public Expression parsePower(int depth) {
		checkDepth(depth);
		int start = index;
		Expression base = parsePostfix(depth);
		if (is(Kind.POWER)) {
			index = index + 1;
			Expression exponent = parseExponent(depth + 1);
			return node(new Binary(Binary.Op.POW, base, exponent, sourceAttr(start, index - 1)));
		}
		return base;
	}

	private Expression parseExponent(int depth) {
		if (is(Kind.LEFT_BRACE)) {
			return parseGroup(Kind.LEFT_BRACE, Kind.RIGHT_BRACE, "'}'", depth);
		} else if (is(Kind.MINUS)) {
			return parseUnary(depth);
		} else {
			return parsePower(depth);
		}
	}

	private Expression parsePostfix(int depth) {
		int start = index;
		Expression e = parsePrimary(depth);
		while (is(Kind.FACTORIAL)) {
			index = index + 1;
			e = node(new Expression.Call("factorial", Collections.singletonList(e), null, null,
					sourceAttr(start, index - 1)));
		}
		return e;
	}

	/**
	 * Parse a primary expression, such as a number, variable, function call,
	 * bracketed expression or environment.
	 *
	 * @param depth
	 * @return
	 */
	public Expression parsePrimary(int depth) {
		checkDepth(depth);
		int start = index;
		Token lookahead = tokens.get(index);
		switch (lookahead.kind) {
		case NUMBER:
			index = index + 1;
			return node(new Expression.Literal(Double.parseDouble(lookahead.text), sourceAttr(start, start)));
		case VARIABLE:
			return parseVariable(depth);
		case CONSTANT:
			index = index + 1;
			return node(new Expression.Variable(lookahead.value, sourceAttr(start, start)));
		case INFTY:
			index = index + 1;
			return node(new Expression.Variable("infty", sourceAttr(start, start)));
		case FUNCTION:
			return parseFunctionCall(depth + 1);
		case LIM:
			return parseLimit(depth + 1);
		case SUM:
		case PROD:
			return parseSeries(depth + 1);
		case INT:
		case OINT:
			return parseIntegral(depth + 1);
		case FRAC:
			return parseFraction(depth + 1);
		case BINOM: {
			index = index + 1;
			Expression n = parseGroup(Kind.LEFT_BRACE, Kind.RIGHT_BRACE, "'}'", depth + 1);
			Expression k = parseGroup(Kind.LEFT_BRACE, Kind.RIGHT_BRACE, "'}'", depth + 1);
			return node(new Expression.Binomial(n, k, sourceAttr(start, index - 1)));
		}
		case TEXT:
		case FONT:
			return parseText();
		case NABLA:
			return parseGradient(depth + 1);
		case BEGIN:
			return parseEnvironment(depth + 1);
		case LANGLE:
			return parseAngleVector(depth + 1);
		case PIPE: {
			index = index + 1;
			delimiters.push(Kind.PIPE);
			Expression operand;
			try {
				operand = parseExpression(depth + 1);
			} finally {
				delimiters.pop();
			}
			match(Kind.PIPE, "'|'", "close the absolute value with '|'");
			return node(new Expression.Abs(operand, sourceAttr(start, index - 1)));
		}
		case LEFT_PAREN:
			return parseBracketedExpression(Kind.LEFT_PAREN, Kind.RIGHT_PAREN, "')'", depth + 1);
		case LEFT_BRACE:
			return parseBracketedExpression(Kind.LEFT_BRACE, Kind.RIGHT_BRACE, "'}'", depth + 1);
		case LEFT_BRACKET:
			return parseBracketedExpression(Kind.LEFT_BRACKET, Kind.RIGHT_BRACKET, "']'", depth + 1);
		case EOF:
			syntaxError("unexpected end of input", lookahead, null);
			return placeholder(start);
		default:
			String suggestion = null;
			if (lookahead.kind == Kind.RIGHT_PAREN || lookahead.kind == Kind.RIGHT_BRACE
					|| lookahead.kind == Kind.RIGHT_BRACKET) {
				suggestion = "remove the unmatched '" + lookahead.text + "'";
			}
			syntaxError("unexpected token '" + lookahead.text + "'", lookahead, suggestion);
			index = index + 1;
			return placeholder(start);
		}
	}

	/**
	 * Parse a variable, which may be subscripted (e.g. <code>x_1</code> or
	 * <code>x_{12}</code>). A variable immediately applied to two or more
	 * arguments, such as <code>f(x, y)</code>, is a call to a user-defined
	 * function.
	 *
	 * @param depth
	 * @return
	 */
	private Expression parseVariable(int depth) {
		int start = index;
		Token t = match(Kind.VARIABLE, "a variable");
		String name = t.value;
		if (is(Kind.UNDERSCORE)) {
			index = index + 1;
			name = name + "_" + parseSubscript();
		}
		if (is(Kind.LEFT_PAREN) && hasTopLevelComma(index)) {
			List<Expression> arguments = parseArguments(Kind.LEFT_PAREN, Kind.RIGHT_PAREN, "')'", depth + 1);
			return node(new Expression.Call(name, arguments, null, null, sourceAttr(start, index - 1)));
		}
		return node(new Expression.Variable(name, sourceAttr(start, index - 1)));
	}

	private String parseSubscript() {
		if (is(Kind.LEFT_BRACE)) {
			index = index + 1;
			StringBuilder sb = new StringBuilder();
			while (!is(Kind.RIGHT_BRACE) && !is(Kind.EOF)) {
				Token t = tokens.get(index);
				if (t.kind != Kind.NUMBER && t.kind != Kind.VARIABLE) {
					syntaxError("expecting subscript, found '" + t.text + "'", t, null);
				}
				sb.append(t.text);
				index = index + 1;
			}
			match(Kind.RIGHT_BRACE, "'}'", "close the subscript with '}'");
			if (sb.length() == 0) {
				syntaxError("empty subscript", tokens.get(index - 1), null);
			}
			return sb.toString();
		}
		Token t = tokens.get(index);
		if (t.kind != Kind.NUMBER && t.kind != Kind.VARIABLE) {
			syntaxError("expecting subscript, found '" + t.text + "'", t, null);
			return ERROR_PLACEHOLDER;
		}
		index = index + 1;
		return t.text;
	}

	private boolean hasTopLevelComma(int i) {
		int nesting = 0;
		for (; i < tokens.size(); ++i) {
			switch (tokens.get(i).kind) {
			case LEFT_PAREN:
			case LEFT_BRACE:
			case LEFT_BRACKET:
				nesting++;
				break;
			case RIGHT_PAREN:
			case RIGHT_BRACE:
			case RIGHT_BRACKET:
				nesting--;
				if (nesting == 0) {
					return false;
				}
				break;
			case COMMA:
				if (nesting == 1) {
					return true;
				}
				break;
			case EOF:
				return false;
			default:
			}
		}
		return false;
	}

	/**
	 * Parse a call to a builtin function, such as <code>\sin(x)</code>,
	 * <code>\sin^2 x</code>, <code>\log_{2}(8)</code> or
	 * <code>\sqrt[3]{x}</code>.
	 *
	 * @param depth
	 * @return
	 */
	private Expression parseFunctionCall(int depth) {
		checkDepth(depth);
		int start = index;
		Token t = match(Kind.FUNCTION, "a function");
		String name = t.value;
		Expression parameter = null;
		Expression power = null;
		Expression base = null;
		if (is(Kind.LEFT_BRACKET)) {
			parameter = parseGroup(Kind.LEFT_BRACKET, Kind.RIGHT_BRACKET, "']'", depth + 1);
		}
		if (is(Kind.POWER)) {
			index = index + 1;
			power = is(Kind.LEFT_BRACE) ? parseGroup(Kind.LEFT_BRACE, Kind.RIGHT_BRACE, "'}'", depth + 1)
					: parsePrimary(depth + 1);
		}
		Expression result;
		if (name.equals("vec") || name.equals("hat")) {
			List<Expression> components = parseArguments(Kind.LEFT_BRACE, Kind.RIGHT_BRACE, "'}'", depth + 1);
			result = node(new Expression.Vector(components, name.equals("hat"), sourceAttr(start, index - 1)));
		} else {
			if (is(Kind.UNDERSCORE)) {
				index = index + 1;
				base = is(Kind.LEFT_BRACE) ? parseGroup(Kind.LEFT_BRACE, Kind.RIGHT_BRACE, "'}'", depth + 1)
						: parsePrimary(depth + 1);
			}
			List<Expression> arguments;
			if (is(Kind.LEFT_PAREN)) {
				arguments = parseArguments(Kind.LEFT_PAREN, Kind.RIGHT_PAREN, "')'", depth + 1);
			} else if (is(Kind.LEFT_BRACE)) {
				arguments = parseArguments(Kind.LEFT_BRACE, Kind.RIGHT_BRACE, "'}'", depth + 1);
			} else {
				arguments = Collections.singletonList(parseUnary(depth + 1));
			}
			result = node(new Expression.Call(name, arguments, base, parameter, sourceAttr(start, index - 1)));
		}
		if (power != null) {
			result = node(new Binary(Binary.Op.POW, result, power, sourceAttr(start, index - 1)));
		}
		return result;
	}

	private List<Expression> parseArguments(Kind open, Kind close, String closeText, int depth) {
		match(open, "'" + tokens.get(index).text + "'");
		ArrayList<Expression> arguments = new ArrayList<>();
		delimiters.push(close);
		try {
			arguments.add(parseExpression(depth));
			while (is(Kind.COMMA)) {
				index = index + 1;
				arguments.add(parseExpression(depth));
			}
		} finally {
			delimiters.pop();
		}
		match(close, closeText, "add a matching " + closeText);
		return arguments;
	}

	/**
	 * Parse a limit, such as <code>\lim_{x \to 0} \frac{\sin x}{x}</code>.
	 *
	 * @param depth
	 * @return
	 */
	private Expression parseLimit(int depth) {
		int start = index;
		match(Kind.LIM, "'\\lim'");
		match(Kind.UNDERSCORE, "'_'", "write the limit as \\lim_{x \\to a}");
		match(Kind.LEFT_BRACE, "'{'");
		String variable = match(Kind.VARIABLE, "a variable").value;
		match(Kind.TO, "'\\to'", "write the limit as \\lim_{x \\to a}");
		Expression target = parseDelimited(Kind.RIGHT_BRACE, depth);
		match(Kind.RIGHT_BRACE, "'}'", "close the limit subscript with '}'");
		Expression body = parseAdditive(depth);
		return node(new Expression.Limit(variable, target, body, sourceAttr(start, index - 1)));
	}

	/**
	 * Parse a summation or product, such as <code>\sum_{i=1}^{n} i^2</code>.
	 *
	 * @param depth
	 * @return
	 */
	private Expression parseSeries(int depth) {
		int start = index;
		Token t = tokens.get(index);
		index = index + 1;
		match(Kind.UNDERSCORE, "'_'", "write the bounds as " + t.text + "_{i=a}^{b}");
		match(Kind.LEFT_BRACE, "'{'");
		String variable = match(Kind.VARIABLE, "an index variable").value;
		match(Kind.EQUALS, "'='");
		Expression first = parseDelimited(Kind.RIGHT_BRACE, depth);
		match(Kind.RIGHT_BRACE, "'}'");
		match(Kind.POWER, "'^'", "write the bounds as " + t.text + "_{i=a}^{b}");
		Expression last = is(Kind.LEFT_BRACE) ? parseGroup(Kind.LEFT_BRACE, Kind.RIGHT_BRACE, "'}'", depth)
				: parsePrimary(depth);
		Expression body = parseAdditive(depth);
		if (t.kind == Kind.SUM) {
			return node(new Expression.Sum(variable, first, last, body, sourceAttr(start, index - 1)));
		} else {
			return node(new Expression.Product(variable, first, last, body, sourceAttr(start, index - 1)));
		}
	}

	/**
	 * Parse an integral, such as <code>\int_{0}^{1} x^2 \, dx</code>. The
	 * differential at the end determines the variable of integration, and
	 * defaults to <code>x</code> when omitted.
	 *
	 * @param depth
	 * @return
	 */
	private Expression parseIntegral(int depth) {
		int start = index;
		boolean closed = tokens.get(index).kind == Kind.OINT;
		index = index + 1;
		Expression lower = null;
		Expression upper = null;
		while (is(Kind.UNDERSCORE) || is(Kind.POWER)) {
			boolean isLower = is(Kind.UNDERSCORE);
			index = index + 1;
			Expression bound;
			if (is(Kind.LEFT_BRACE)) {
				bound = parseGroup(Kind.LEFT_BRACE, Kind.RIGHT_BRACE, "'}'", depth);
			} else if (is(Kind.MINUS)) {
				bound = parseUnary(depth);
			} else {
				bound = parsePrimary(depth);
			}
			if (isLower) {
				lower = bound;
			} else {
				upper = bound;
			}
		}
		Expression body;
		if (isDifferential(index)) {
			body = node(new Expression.Literal(1));
		} else {
			integralNesting++;
			try {
				body = parseAdditive(depth);
			} finally {
				integralNesting--;
			}
		}
		String variable = "x";
		if (isDifferential(index)) {
			index = index + 1;
			variable = match(Kind.VARIABLE, "a variable").value;
		}
		return node(new Expression.Integral(lower, upper, body, variable, closed, sourceAttr(start, index - 1)));
	}

	/**
	 * Parse a fraction. This is either an ordinary fraction such as
	 * <code>\frac{a}{b}</code> (or <code>\frac12</code>), or the Leibniz
	 * notation for a derivative, such as <code>\frac{d}{dx}</code>,
	 * <code>\frac{d^2}{dx^2}</code> or
	 * <code>\frac{\partial}{\partial x}</code>.
	 *
	 * @param depth
	 * @return
	 */
	private Expression parseFraction(int depth) {
		int start = index;
		match(Kind.FRAC, "'\\frac'");
		if (isDerivativeNotation()) {
			return parseDerivative(start, depth);
		}
		Token t = tokens.get(index);
		if (t.kind == Kind.NUMBER && t.text.length() == 2) {
			// Braceless form, e.g. \frac12
			index = index + 1;
			Expression num = node(new Expression.Literal(t.text.charAt(0) - '0', sourceAttr(start + 1, start + 1)));
			Expression den = node(new Expression.Literal(t.text.charAt(1) - '0', sourceAttr(start + 1, start + 1)));
			return node(new Binary(Binary.Op.DIV, num, den, sourceAttr(start, index - 1)));
		}
		Expression num = parseFractionArgument(depth);
		Expression den = parseFractionArgument(depth);
		return node(new Binary(Binary.Op.DIV, num, den, sourceAttr(start, index - 1)));
	}

	private Expression parseFractionArgument(int depth) {
		if (is(Kind.LEFT_BRACE)) {
			return parseGroup(Kind.LEFT_BRACE, Kind.RIGHT_BRACE, "'}'", depth);
		}
		Token t = tokens.get(index);
		if (t.kind == Kind.NUMBER && t.text.length() > 1 && t.text.indexOf('.') < 0) {
			syntaxError("ambiguous fraction argument '" + t.text + "'", t, "use braces, e.g. \\frac{" + t.text
					+ "}{...}");
		}
		return parsePrimary(depth);
	}

	private boolean isDerivativeNotation() {
		if (!is(Kind.LEFT_BRACE)) {
			return false;
		}
		Token d = tokens.get(index + 1);
		boolean leibniz = (d.kind == Kind.VARIABLE && "d".equals(d.value)) || d.kind == Kind.PARTIAL;
		if (!leibniz) {
			return false;
		}
		Kind next = tokens.get(index + 2).kind;
		return next == Kind.RIGHT_BRACE || next == Kind.POWER;
	}

	private Expression parseDerivative(int start, int depth) {
		match(Kind.LEFT_BRACE, "'{'");
		boolean partial = is(Kind.PARTIAL);
		index = index + 1;
		int order = 1;
		if (is(Kind.POWER)) {
			index = index + 1;
			order = parseOrder();
		}
		match(Kind.RIGHT_BRACE, "'}'");
		match(Kind.LEFT_BRACE, "'{'");
		if (partial) {
			match(Kind.PARTIAL, "'\\partial'", "write the derivative as \\frac{\\partial}{\\partial x}");
		} else {
			Token d = match(Kind.VARIABLE, "'d'");
			if (!"d".equals(d.value)) {
				syntaxError("expecting 'd', found '" + d.text + "'", d, "write the derivative as \\frac{d}{dx}");
			}
		}
		String variable = match(Kind.VARIABLE, "a variable", "write the derivative as \\frac{d}{dx}").value;
		if (is(Kind.POWER)) {
			index = index + 1;
			int denominator = parseOrder();
			if (denominator != order) {
				syntaxError("mismatched derivative order", tokens.get(index - 1), "use the same order above and below");
			}
		}
		match(Kind.RIGHT_BRACE, "'}'");
		Expression body;
		if (is(Kind.LEFT_PAREN)) {
			body = parseGroup(Kind.LEFT_PAREN, Kind.RIGHT_PAREN, "')'", depth);
		} else {
			body = parseMultiplicative(depth);
		}
		if (partial) {
			return node(new Expression.PartialDerivative(body, variable, order, sourceAttr(start, index - 1)));
		} else {
			return node(new Expression.Derivative(body, variable, order, sourceAttr(start, index - 1)));
		}
	}

	private int parseOrder() {
		boolean braced = is(Kind.LEFT_BRACE);
		if (braced) {
			index = index + 1;
		}
		Token n = match(Kind.NUMBER, "the order of the derivative");
		double order = n.text.isEmpty() ? 1 : Double.parseDouble(n.text);
		if (order < 1 || order != Math.rint(order)) {
			syntaxError("invalid derivative order '" + n.text + "'", n, null);
		}
		if (braced) {
			match(Kind.RIGHT_BRACE, "'}'");
		}
		return (int) order;
	}

	/**
	 * Parse a gradient <code>\nabla f</code> or Laplacian
	 * <code>\nabla^2 f</code>. The operand binds as tightly as the base of a
	 * power, so <code>\nabla f^2</code> is the gradient of <code>f^2</code>.
	 *
	 * @param depth
	 * @return
	 */
	private Expression parseGradient(int depth) {
		int start = index;
		match(Kind.NABLA, "'\\nabla'");
		boolean laplacian = false;
		if (is(Kind.POWER)) {
			index = index + 1;
			Token t = tokens.get(index);
			Expression exponent = parseExponent(depth + 1);
			if (!(exponent instanceof Expression.Literal) || ((Expression.Literal) exponent).value() != 2) {
				syntaxError("unsupported power of '\\nabla'", t, "write \\nabla^2 for the Laplacian");
			}
			laplacian = true;
		}
		Expression body = parsePower(depth);
		return node(new Expression.Gradient(body, laplacian, sourceAttr(start, index - 1)));
	}

	/**
	 * Parse the argument of a <code>\text{...}</code> or font command as a
	 * variable (e.g. <code>\mathbf{v}</code>).
	 *
	 * @return
	 */
	private Expression parseText() {
		int start = index;
		Token t = tokens.get(index);
		index = index + 1;
		String name = t.value;
		if (name.startsWith("\\")) {
			name = name.substring(1);
		}
		if (name.isEmpty()) {
			syntaxError("empty " + t.text, t, null);
			return placeholder(start);
		}
		return node(new Expression.Variable(name, sourceAttr(start, start)));
	}

	/**
	 * Parse an environment, such as a matrix or a set of cases.
	 *
	 * @param depth
	 * @return
	 */
	private Expression parseEnvironment(int depth) {
		int start = index;
		Token begin = tokens.get(index);
		index = index + 1;
		String environment = begin.value;
		if (environment.equals("cases")) {
			return parseCases(start, depth);
		} else if (MATRIX_ENVIRONMENTS.contains(environment)) {
			return parseMatrix(start, environment, depth);
		}
		ArrayList<String> known = new ArrayList<>(MATRIX_ENVIRONMENTS);
		known.add("cases");
		String suggestion = Suggestions.closest(environment, known, 2);
		syntaxError("unknown environment '" + environment + "'", begin,
				suggestion == null ? null : "did you mean " + suggestion + "?");
		return placeholder(start);
	}

	private Expression parseMatrix(int start, String environment, int depth) {
		ArrayList<List<Expression>> rows = new ArrayList<>();
		ArrayList<Expression> row = new ArrayList<>();
		while (!is(Kind.END) && !is(Kind.EOF)) {
			row.add(parseExpression(depth));
			if (is(Kind.AMPERSAND)) {
				index = index + 1;
			} else if (is(Kind.ROW_SEPARATOR)) {
				index = index + 1;
				rows.add(row);
				row = new ArrayList<>();
			} else if (!is(Kind.END)) {
				Token t = tokens.get(index);
				syntaxError("expecting '&', '\\\\' or \\end{" + environment + "}, found '" + t.text + "'", t, null);
				index = index + 1;
			}
		}
		if (!row.isEmpty()) {
			rows.add(row);
		}
		matchEnd(environment);
		if (rows.isEmpty()) {
			syntaxError("empty matrix", tokens.get(index - 1), null);
			return placeholder(start);
		}
		for (List<Expression> r : rows) {
			if (r.size() != rows.get(0).size()) {
				syntaxError("matrix rows have different lengths", tokens.get(start), null);
				return placeholder(start);
			}
		}
		Expression m = node(new Expression.Matrix(rows, sourceAttr(start, index - 1)));
		if (environment.equals("vmatrix") || environment.equals("Vmatrix")) {
			return node(new Expression.Call("det", Collections.singletonList(m), null, null,
					sourceAttr(start, index - 1)));
		}
		return m;
	}

	/**
	 * Parse a <code>cases</code> environment. Each case consists of an
	 * expression and a guard separated by <code>&amp;</code>, with a guard of
	 * <code>\text{otherwise}</code> indicating the case always applies.
	 *
	 * @param start
	 * @param depth
	 * @return
	 */
	private Expression parseCases(int start, int depth) {
		ArrayList<Piecewise.Case> cases = new ArrayList<>();
		while (!is(Kind.END) && !is(Kind.EOF)) {
			Expression body = parseExpression(depth);
			Expression guard = null;
			if (is(Kind.AMPERSAND)) {
				index = index + 1;
				Token t = tokens.get(index);
				if (t.kind == Kind.TEXT && isOtherwise(t.value)) {
					index = index + 1;
				} else {
					guard = parseExpression(depth);
				}
			}
			cases.add(new Piecewise.Case(body, guard));
			if (is(Kind.ROW_SEPARATOR)) {
				index = index + 1;
			} else if (!is(Kind.END)) {
				Token t = tokens.get(index);
				syntaxError("expecting '\\\\' or \\end{cases}, found '" + t.text + "'", t, null);
				index = index + 1;
			}
		}
		matchEnd("cases");
		if (cases.isEmpty()) {
			syntaxError("empty cases environment", tokens.get(index - 1), "add at least one case");
			return placeholder(start);
		}
		return node(new Piecewise(cases, sourceAttr(start, index - 1)));
	}

	private static boolean isOtherwise(String text) {
		return text.equals("otherwise") || text.equals("else");
	}

	private void matchEnd(String environment) {
		Token t = tokens.get(index);
		if (t.kind != Kind.END) {
			syntaxError("missing \\end{" + environment + "}", t, "add \\end{" + environment + "}");
			return;
		}
		index = index + 1;
		if (!t.value.equals(environment)) {
			syntaxError("environment mismatch: \\begin{" + environment + "} ended by \\end{" + t.value + "}", t,
					"use \\end{" + environment + "}");
		}
	}

	/**
	 * Parse a vector written with angle brackets, such as
	 * <code>\langle 1, 2 \rangle</code>.
	 *
	 * @param depth
	 * @return
	 */
	private Expression parseAngleVector(int depth) {
		int start = index;
		match(Kind.LANGLE, "'\\langle'");
		ArrayList<Expression> components = new ArrayList<>();
		delimiters.push(Kind.RANGLE);
		try {
			components.add(parseExpression(depth));
			while (is(Kind.COMMA)) {
				index = index + 1;
				components.add(parseExpression(depth));
			}
		} finally {
			delimiters.pop();
		}
		match(Kind.RANGLE, "'\\rangle'", "close the vector with \\rangle");
		return node(new Expression.Vector(components, false, sourceAttr(start, index - 1)));
	}

	/**
	 * Parse a bracketed expression. Within round or curly brackets a trailing
	 * guard may be given, as in <code>(x^2, x &gt; 0)</code>. Within square
	 * brackets, two comma-separated bounds give an interval, as in
	 * <code>[0, 1]</code>.
	 *
	 * @param open
	 * @param close
	 * @param closeText
	 * @param depth
	 * @return
	 */
	private Expression parseBracketedExpression(Kind open, Kind close, String closeText, int depth) {
		int start = index;
		match(open, "'" + tokens.get(index).text + "'");
		Expression e;
		delimiters.push(close);
		try {
			e = parseExpression(depth);
			if (is(Kind.COMMA)) {
				index = index + 1;
				Expression second = parseExpression(depth);
				if (open == Kind.LEFT_BRACKET) {
					e = node(new Expression.Interval(e, second, sourceAttr(start, index - 1)));
				} else {
					e = node(new Expression.Conditional(e, second, sourceAttr(start, index - 1)));
				}
			}
		} finally {
			delimiters.pop();
		}
		match(close, closeText, "add a matching " + closeText);
		return e;
	}

	private Expression parseGroup(Kind open, Kind close, String closeText, int depth) {
		match(open, "'" + tokens.get(index).text + "'");
		Expression e = parseDelimited(close, depth);
		match(close, closeText, "add a matching " + closeText);
		return e;
	}

	private Expression parseDelimited(Kind close, int depth) {
		delimiters.push(close);
		try {
			return parseExpression(depth);
		} finally {
			delimiters.pop();
		}
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private boolean is(Kind kind) {
		return tokens.get(index).kind == kind;
	}

	private Token match(Kind kind, String name) {
		return match(kind, name, null);
	}

	private Token match(Kind kind, String name, String suggestion) {
		Token t = tokens.get(index);
		if (t.kind != kind) {
			if (t.kind == Kind.EOF) {
				syntaxError("expecting " + name + ", found end of input", t, suggestion);
			} else {
				syntaxError("expecting " + name + ", found '" + t.text + "'", t, suggestion);
			}
			// Recovery mode: pretend the expected token was present.
			return new Token(kind, "", t.start, "");
		}
		index = index + 1;
		return t;
	}

	private void checkDepth(int depth) {
		if (depth > maxDepth) {
			Token t = tokens.get(index);
			throw new ParserException("maximum recursion depth of " + maxDepth + " exceeded", source, t.start,
					t.end(), "reduce the nesting of the expression");
		}
	}

	private Expression node(Expression e) {
		nodes = nodes + 1;
		if (nodes > maxNodes) {
			Token t = tokens.get(Math.max(0, index - 1));
			throw new ParserException("expression exceeds maximum of " + maxNodes + " nodes", source, t.start,
					t.end(), "split the expression into smaller parts");
		}
		return e;
	}

	private Expression placeholder(int start) {
		int end = Math.max(start, index - 1);
		return new Expression.Variable(ERROR_PLACEHOLDER, sourceAttr(start, end));
	}

	private Attribute.Source sourceAttr(int start, int end) {
		Token t1 = tokens.get(Math.min(start, tokens.size() - 1));
		Token t2 = tokens.get(Math.max(Math.min(end, tokens.size() - 1), 0));
		return new Attribute.Source(t1.start, Math.max(t1.start, t2.end()));
	}

	/**
	 * Report a syntax error against a given token. When recovering, the error
	 * is recorded and parsing continues. Otherwise, it is thrown.
	 *
	 * @param msg
	 * @param t
	 * @param suggestion
	 */
	private void syntaxError(String msg, Token t, String suggestion) {
		ParserException e = new ParserException(msg, source, t.start, t.end(), suggestion);
		if (errors == null) {
			throw e;
		}
		logger.log(Level.FINE, "recovered from parse error: {0}", e.getMessage());
		errors.add(e);
	}
}

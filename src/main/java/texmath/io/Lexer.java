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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import texmath.util.Suggestions;
import texmath.util.TokenizerException;

/**
 * Responsible for turning a string of characters into a sequence of tokens.
 * Whitespace and purely presentational commands (such as <code>\left</code>
 * or <code>\quad</code>) are discarded.
 *
 * @author David J. Pearce
 *
 */
public class Lexer {
	public static final int DEFAULT_MAX_LENGTH = 100_000;

	/**
	 * Unicode symbols which are understood as shorthand for commands.
	 */
	private static final Map<Character, String> UNICODE = new HashMap<>();

	static {
		UNICODE.put('√', "sqrt");
		UNICODE.put('π', "pi");
		UNICODE.put('τ', "tau");
		UNICODE.put('φ', "phi");
		UNICODE.put('×', "times");
		UNICODE.put('·', "cdot");
		UNICODE.put('÷', "div");
		UNICODE.put('≤', "leq");
		UNICODE.put('≥', "geq");
		UNICODE.put('≠', "neq");
		UNICODE.put('∞', "infty");
		UNICODE.put('∑', "sum");
		UNICODE.put('∏', "prod");
		UNICODE.put('∫', "int");
		UNICODE.put('∮', "oint");
		UNICODE.put('∂', "partial");
		UNICODE.put('∇', "nabla");
		UNICODE.put('∈', "in");
		UNICODE.put('→', "to");
		UNICODE.put('∧', "land");
		UNICODE.put('∨', "lor");
		UNICODE.put('¬', "neg");
		String[] lower = { "alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta", "iota", "kappa",
				"lambda", "mu", "nu", "xi", "omicron", null, "rho", "varsigma", "sigma", null, "upsilon", null, "chi",
				"psi", "omega" };
		for (int i = 0; i != lower.length; ++i) {
			if (lower[i] != null) {
				UNICODE.put((char) ('α' + i), lower[i]);
			}
		}
		UNICODE.put('Γ', "Gamma");
		UNICODE.put('Δ', "Delta");
		UNICODE.put('Θ', "Theta");
		UNICODE.put('Λ', "Lambda");
		UNICODE.put('Ξ', "Xi");
		UNICODE.put('Π', "Pi");
		UNICODE.put('Σ', "Sigma");
		UNICODE.put('Φ', "Phi");
		UNICODE.put('Ψ', "Psi");
		UNICODE.put('Ω', "Omega");
	}

	private final String input;
	private final CommandTable commands;
	private final boolean implicitMultiplication;
	private final int maxLength;
	private int pos;

	public Lexer(String input) {
		this(input, CommandTable.standard(), true, DEFAULT_MAX_LENGTH);
	}

	public Lexer(String input, CommandTable commands, boolean implicitMultiplication, int maxLength) {
		this.input = input;
		this.commands = commands;
		this.implicitMultiplication = implicitMultiplication;
		this.maxLength = maxLength;
	}

	/**
	 * Scan all characters from the input and generate a corresponding list of
	 * tokens, whilst discarding all whitespace and formatting commands. The
	 * list is always terminated by an end-of-input token.
	 *
	 * @return
	 */
	public List<Token> scan() {
		if (input.length() > maxLength) {
			throw new TokenizerException("input exceeds maximum length of " + maxLength + " characters", input, 0,
					0, null);
		}
		ArrayList<Token> tokens = new ArrayList<>();
		pos = 0;

		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (Character.isWhitespace(c)) {
				skipWhitespace();
			} else if (Character.isDigit(c)) {
				tokens.add(scanNumericConstant());
			} else if (c == '\\') {
				Token t = scanCommand();
				if (t != null) {
					tokens.add(t);
				}
			} else if (isLetter(c)) {
				scanIdentifier(tokens);
			} else if (UNICODE.containsKey(c)) {
				Token t = resolve(UNICODE.get(c), String.valueOf(c), pos, pos + 1);
				pos = pos + 1;
				if (t != null) {
					tokens.add(t);
				}
			} else {
				tokens.add(scanOperator());
			}
		}
		tokens.add(new Token(Token.Kind.EOF, "", input.length(), null));
		return tokens;
	}

	/**
	 * Scan a numeric constant. That is a sequence of digits, optionally
	 * followed by a decimal point and a further sequence of digits.
	 *
	 * @return
	 */
	public Token scanNumericConstant() {
		int start = pos;
		while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
			pos = pos + 1;
		}
		if (pos + 1 < input.length() && input.charAt(pos) == '.' && Character.isDigit(input.charAt(pos + 1))) {
			pos = pos + 1;
			while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
				pos = pos + 1;
			}
		}
		String text = input.substring(start, pos);
		return new Token(Token.Kind.NUMBER, text, start, text);
	}

	/**
	 * Scan a run of letters. With implicit multiplication enabled, each letter
	 * is a variable in its own right (so <code>xy</code> is <code>x</code>
	 * times <code>y</code>), unless the run begins with the name of a known
	 * function applied to a bracketed argument. Otherwise, the whole run is a
	 * single identifier.
	 *
	 * @param tokens
	 */
	public void scanIdentifier(List<Token> tokens) {
		int start = pos;
		String function = matchUnprefixedFunction();
		if (function != null) {
			pos = pos + function.length();
			tokens.add(resolve(function, function, start, pos));
		} else if (implicitMultiplication) {
			pos = pos + 1;
			String text = input.substring(start, pos);
			tokens.add(new Token(Token.Kind.VARIABLE, text, start, text));
		} else {
			while (pos < input.length() && isLetter(input.charAt(pos))) {
				pos++;
			}
			String text = input.substring(start, pos);
			tokens.add(new Token(Token.Kind.VARIABLE, text, start, text));
		}
	}

	/**
	 * Determine whether the input at the current position begins with a
	 * function name followed by an opening bracket, returning the longest such
	 * name.
	 *
	 * @return
	 */
	private String matchUnprefixedFunction() {
		String best = null;
		for (String name : CommandTable.UNPREFIXED_FUNCTIONS) {
			if (input.startsWith(name, pos) && (best == null || name.length() > best.length())) {
				int next = pos + name.length();
				while (next < input.length() && Character.isWhitespace(input.charAt(next))) {
					next++;
				}
				if (next < input.length() && input.charAt(next) == '(') {
					best = name;
				}
			}
		}
		return best;
	}

	/**
	 * Scan a command beginning with a backslash. This may be a single
	 * character escape (e.g. <code>\\</code>, <code>\{</code> or
	 * <code>\,</code>) or a named command. Returns null for commands which
	 * produce no token.
	 *
	 * @return
	 */
	public Token scanCommand() {
		int start = pos;
		pos = pos + 1;
		if (pos >= input.length()) {
			syntaxError("unexpected end of input after '\\'", start);
		}
		char c = input.charAt(pos);
		if (!isLetter(c)) {
			pos = pos + 1;
			switch (c) {
			case '\\':
				return new Token(Token.Kind.ROW_SEPARATOR, "\\\\", start, null);
			case '{':
				return new Token(Token.Kind.LEFT_BRACE, "\\{", start, null);
			case '}':
				return new Token(Token.Kind.RIGHT_BRACE, "\\}", start, null);
			case '|':
				return new Token(Token.Kind.PIPE, "\\|", start, null);
			case ',':
			case ';':
			case ':':
			case '!':
			case ' ':
				return null;
			default:
				syntaxError("unexpected character after '\\': " + c, start);
			}
		}
		while (pos < input.length() && isLetter(input.charAt(pos))) {
			pos++;
		}
		String name = input.substring(start + 1, pos);
		return resolve(name, input.substring(start, pos), start, pos);
	}

	/**
	 * Resolve a command name against the command table. Commands which take a
	 * verbatim argument (e.g. <code>\text{...}</code> or
	 * <code>\begin{...}</code>) have that argument consumed here.
	 *
	 * @param name
	 * @param text
	 * @param start
	 * @param end
	 * @return
	 */
	private Token resolve(String name, String text, int start, int end) {
		Optional<CommandTable.Entry> entry = commands.lookup(name);
		if (!entry.isPresent()) {
			String suggestion = Suggestions.closest(name, commands.names(), 2);
			throw new TokenizerException("unknown command \\" + name, input, start, end - 1,
					suggestion == null ? null : "did you mean \\" + suggestion + "?");
		}
		CommandTable.Entry e = entry.get();
		switch (e.kind()) {
		case IGNORED:
			return null;
		case TEXT:
		case FONT:
		case BEGIN:
		case END:
			String argument = scanVerbatimArgument(name);
			return new Token(e.kind(), input.substring(start, pos), start, argument);
		default:
			return new Token(e.kind(), text, start, e.value());
		}
	}

	/**
	 * Scan a braced argument whose contents are taken verbatim, such as the
	 * name of an environment.
	 *
	 * @param command
	 * @return
	 */
	private String scanVerbatimArgument(String command) {
		skipWhitespace();
		if (pos >= input.length() || input.charAt(pos) != '{') {
			syntaxError("expected '{' after \\" + command, pos);
		}
		int start = pos + 1;
		int depth = 1;
		pos = pos + 1;
		while (pos < input.length() && depth > 0) {
			char c = input.charAt(pos);
			if (c == '{') {
				depth++;
			} else if (c == '}') {
				depth--;
			}
			pos++;
		}
		if (depth != 0) {
			syntaxError("missing '}' after \\" + command, start - 1);
		}
		return input.substring(start, pos - 1).trim();
	}

	public Token scanOperator() {
		char c = input.charAt(pos);
		int start = pos;
		pos = pos + 1;
		switch (c) {
		case '+':
			return new Token(Token.Kind.PLUS, "+", start, null);
		case '-':
			return new Token(Token.Kind.MINUS, "-", start, null);
		case '*':
			return new Token(Token.Kind.MULTIPLY, "*", start, "*");
		case '/':
			return new Token(Token.Kind.DIVIDE, "/", start, "/");
		case '^':
			return new Token(Token.Kind.POWER, "^", start, null);
		case '_':
			return new Token(Token.Kind.UNDERSCORE, "_", start, null);
		case '=':
			return new Token(Token.Kind.EQUALS, "=", start, "=");
		case '<':
			if (pos < input.length() && input.charAt(pos) == '=') {
				pos = pos + 1;
				return new Token(Token.Kind.LESS_EQUALS, "<=", start, "\\leq");
			}
			return new Token(Token.Kind.LESS, "<", start, "<");
		case '>':
			if (pos < input.length() && input.charAt(pos) == '=') {
				pos = pos + 1;
				return new Token(Token.Kind.GREATER_EQUALS, ">=", start, "\\geq");
			}
			return new Token(Token.Kind.GREATER, ">", start, ">");
		case '(':
			return new Token(Token.Kind.LEFT_PAREN, "(", start, null);
		case ')':
			return new Token(Token.Kind.RIGHT_PAREN, ")", start, null);
		case '{':
			return new Token(Token.Kind.LEFT_BRACE, "{", start, null);
		case '}':
			return new Token(Token.Kind.RIGHT_BRACE, "}", start, null);
		case '[':
			return new Token(Token.Kind.LEFT_BRACKET, "[", start, null);
		case ']':
			return new Token(Token.Kind.RIGHT_BRACKET, "]", start, null);
		case '|':
			return new Token(Token.Kind.PIPE, "|", start, null);
		case ',':
			return new Token(Token.Kind.COMMA, ",", start, null);
		case '&':
			return new Token(Token.Kind.AMPERSAND, "&", start, null);
		case '!':
			return new Token(Token.Kind.FACTORIAL, "!", start, null);
		}
		syntaxError("unexpected character '" + c + "'", start);
		return null;
	}

	/**
	 * Skip over any whitespace at the current index position in the input
	 * string.
	 */
	public void skipWhitespace() {
		while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
			pos++;
		}
	}

	private static boolean isLetter(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	/**
	 * Raise a syntax error with a given message at the given index.
	 *
	 * @param msg
	 * @param index
	 */
	private void syntaxError(String msg, int index) {
		throw new TokenizerException(msg, input, index);
	}

	/**
	 * A token produced by the lexer. The text is exactly that found in the
	 * input, whilst the value (where present) is its canonical form, such as
	 * the normalised name of a function.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Token {
		public enum Kind {
			NUMBER, VARIABLE, FUNCTION, CONSTANT,
			// Operators
			PLUS, MINUS, MULTIPLY, DIVIDE, POWER, UNDERSCORE, FACTORIAL, EQUALS, NOT_EQUALS, LESS, LESS_EQUALS,
			GREATER, GREATER_EQUALS, IN, AND, OR, NOT,
			// Delimiters
			LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET, PIPE, COMMA, AMPERSAND,
			ROW_SEPARATOR, LANGLE, RANGLE,
			// Structure
			LIM, SUM, PROD, INT, OINT, TO, INFTY, FRAC, BINOM, PARTIAL, NABLA, TEXT, FONT, BEGIN, END,
			// Never produced, but used in the command table
			IGNORED,
			// End of input
			EOF
		}

		public final Kind kind;
		public final String text;
		public final int start;
		public final String value;

		public Token(Kind kind, String text, int start, String value) {
			this.kind = kind;
			this.text = text;
			this.start = start;
			this.value = value;
		}

		public int end() {
			return start + Math.max(text.length(), 1) - 1;
		}

		@Override
		public String toString() {
			return kind + "(" + text + ")@" + start;
		}
	}
}

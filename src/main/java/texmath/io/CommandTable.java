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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import texmath.core.Syntax;
import texmath.io.Lexer.Token;

/**
 * Maps the names of backslash commands (e.g. <code>\sin</code> or
 * <code>\frac</code>) to the kind of token they produce. Aliases are resolved
 * here, so that (for example) both <code>\arcsin</code> and
 * <code>\asin</code> produce a function token named <code>asin</code>.
 * Tables are plain values: a lexer is given the table it should use.
 *
 * @author David J. Pearce
 *
 */
public class CommandTable {

	/**
	 * Describes how a command should be tokenised.
	 */
	public static final class Entry {
		private final Token.Kind kind;
		private final String value;

		public Entry(Token.Kind kind, String value) {
			this.kind = kind;
			this.value = value;
		}

		public Token.Kind kind() {
			return kind;
		}

		/**
		 * The canonical name associated with this command (e.g.
		 * <code>asin</code> for <code>\arcsin</code>).
		 *
		 * @return
		 */
		public String value() {
			return value;
		}

		@Override
		public String toString() {
			return kind + ":" + value;
		}
	}

	/**
	 * A hook consulted before the builtin entries, allowing additional commands
	 * to be recognised (or builtin ones to be overridden).
	 */
	public interface Extension {
		/**
		 * Lookup a command name which has had its leading backslash removed.
		 *
		 * @param name
		 * @return The entry for this command, or empty to fall back to the
		 *         builtin table.
		 */
		public Optional<Entry> lookup(String name);
	}

	/**
	 * Functions which may be written without a leading backslash, such as
	 * <code>sin(x)</code>.
	 */
	public static final String[] UNPREFIXED_FUNCTIONS = { "arcsin", "arccos", "arctan", "sinh", "cosh", "tanh",
			"sin", "cos", "tan", "cot", "sec", "csc", "sqrt", "abs", "exp", "log", "ln" };

	private final Map<String, Entry> commands;
	private final Extension extension;

	private CommandTable(Map<String, Entry> commands, Extension extension) {
		this.commands = commands;
		this.extension = extension;
	}

	/**
	 * Construct the table of builtin commands.
	 *
	 * @return
	 */
	public static CommandTable standard() {
		LinkedHashMap<String, Entry> t = new LinkedHashMap<>();
		// Functions
		for (String f : new String[] { "sin", "cos", "tan", "cot", "sec", "csc", "asin", "acos", "atan", "acot",
				"asec", "acsc", "sinh", "cosh", "tanh", "sech", "csch", "coth", "asinh", "acosh", "atanh", "ln", "log",
				"exp", "sqrt", "abs", "ceil", "floor", "round", "sgn", "factorial", "fibonacci", "gcd", "lcm", "min",
				"max", "det", "trace", "norm", "Re", "Im", "conj", "arg", "dot", "ddot", "bar", "overline", "vec",
				"hat" }) {
			function(t, f, f);
		}
		function(t, "arcsin", "asin");
		function(t, "arccos", "acos");
		function(t, "arctan", "atan");
		function(t, "arccot", "acot");
		function(t, "arcsec", "asec");
		function(t, "arccsc", "acsc");
		function(t, "arsinh", "asinh");
		function(t, "arcosh", "acosh");
		function(t, "artanh", "atanh");
		function(t, "sign", "sgn");
		function(t, "tr", "trace");
		function(t, "lceil", "ceil");
		function(t, "lfloor", "floor");
		function(t, "conjugate", "conj");
		// Constants
		for (String c : new String[] { "pi", "tau", "phi" }) {
			t.put(c, new Entry(Token.Kind.CONSTANT, c));
		}
		// Greek letters
		for (String g : Syntax.GREEK) {
			if (!t.containsKey(g) && !g.equals("infty")) {
				t.put(g, new Entry(Token.Kind.VARIABLE, g));
			}
		}
		// Operators
		t.put("times", new Entry(Token.Kind.MULTIPLY, "\\times"));
		t.put("cdot", new Entry(Token.Kind.MULTIPLY, "\\cdot"));
		t.put("ast", new Entry(Token.Kind.MULTIPLY, "*"));
		t.put("div", new Entry(Token.Kind.DIVIDE, "/"));
		t.put("leq", new Entry(Token.Kind.LESS_EQUALS, "\\leq"));
		t.put("le", new Entry(Token.Kind.LESS_EQUALS, "\\leq"));
		t.put("geq", new Entry(Token.Kind.GREATER_EQUALS, "\\geq"));
		t.put("ge", new Entry(Token.Kind.GREATER_EQUALS, "\\geq"));
		t.put("neq", new Entry(Token.Kind.NOT_EQUALS, "\\neq"));
		t.put("ne", new Entry(Token.Kind.NOT_EQUALS, "\\neq"));
		t.put("lt", new Entry(Token.Kind.LESS, "<"));
		t.put("gt", new Entry(Token.Kind.GREATER, ">"));
		t.put("in", new Entry(Token.Kind.IN, "\\in"));
		t.put("land", new Entry(Token.Kind.AND, "\\land"));
		t.put("wedge", new Entry(Token.Kind.AND, "\\land"));
		t.put("lor", new Entry(Token.Kind.OR, "\\lor"));
		t.put("vee", new Entry(Token.Kind.OR, "\\lor"));
		t.put("neg", new Entry(Token.Kind.NOT, "\\neg"));
		t.put("lnot", new Entry(Token.Kind.NOT, "\\neg"));
		// Structure
		t.put("lim", new Entry(Token.Kind.LIM, "lim"));
		t.put("sum", new Entry(Token.Kind.SUM, "sum"));
		t.put("prod", new Entry(Token.Kind.PROD, "prod"));
		t.put("int", new Entry(Token.Kind.INT, "int"));
		t.put("oint", new Entry(Token.Kind.OINT, "oint"));
		t.put("to", new Entry(Token.Kind.TO, "to"));
		t.put("rightarrow", new Entry(Token.Kind.TO, "to"));
		t.put("infty", new Entry(Token.Kind.INFTY, "infty"));
		t.put("frac", new Entry(Token.Kind.FRAC, "frac"));
		t.put("dfrac", new Entry(Token.Kind.FRAC, "frac"));
		t.put("tfrac", new Entry(Token.Kind.FRAC, "frac"));
		t.put("binom", new Entry(Token.Kind.BINOM, "binom"));
		t.put("partial", new Entry(Token.Kind.PARTIAL, "partial"));
		t.put("nabla", new Entry(Token.Kind.NABLA, "nabla"));
		t.put("langle", new Entry(Token.Kind.LANGLE, "langle"));
		t.put("rangle", new Entry(Token.Kind.RANGLE, "rangle"));
		t.put("begin", new Entry(Token.Kind.BEGIN, "begin"));
		t.put("end", new Entry(Token.Kind.END, "end"));
		t.put("text", new Entry(Token.Kind.TEXT, "text"));
		t.put("mbox", new Entry(Token.Kind.TEXT, "text"));
		t.put("operatorname", new Entry(Token.Kind.TEXT, "text"));
		for (String f : new String[] { "mathbf", "mathrm", "mathit", "mathsf", "mathtt", "mathcal", "mathbb",
				"boldsymbol" }) {
			t.put(f, new Entry(Token.Kind.FONT, f));
		}
		// Formatting
		for (String f : new String[] { "left", "right", "big", "Big", "bigg", "Bigg", "bigl", "bigr", "Bigl",
				"Bigr", "displaystyle", "limits", "quad", "qquad", "thinspace", "negspace", "medspace",
				"thickspace" }) {
			t.put(f, new Entry(Token.Kind.IGNORED, f));
		}
		return new CommandTable(Collections.unmodifiableMap(t), null);
	}

	private static void function(Map<String, Entry> t, String name, String canonical) {
		t.put(name, new Entry(Token.Kind.FUNCTION, canonical));
	}

	/**
	 * Construct a table which first consults a given extension, falling back to
	 * the entries of this table.
	 *
	 * @param extension
	 * @return
	 */
	public CommandTable withExtension(Extension extension) {
		return new CommandTable(commands, extension);
	}

	/**
	 * Lookup the entry for a given command name (without its leading
	 * backslash).
	 *
	 * @param name
	 * @return
	 */
	public Optional<Entry> lookup(String name) {
		if (extension != null) {
			Optional<Entry> e = extension.lookup(name);
			if (e.isPresent()) {
				return e;
			}
		}
		return Optional.ofNullable(commands.get(name));
	}

	/**
	 * Get the names of all builtin commands.
	 *
	 * @return
	 */
	public Set<String> names() {
		return commands.keySet();
	}
}

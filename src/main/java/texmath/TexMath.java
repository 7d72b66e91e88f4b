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
package texmath;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import texmath.calculus.Differentiator;
import texmath.calculus.Integrator;
import texmath.calculus.SimpsonIntegrator;
import texmath.core.Arithmetic;
import texmath.core.Evaluator;
import texmath.core.Functions;
import texmath.core.Syntax;
import texmath.core.Syntax.Expression;
import texmath.core.Value;
import texmath.io.CommandTable;
import texmath.io.Lexer;
import texmath.io.Lexer.Token;
import texmath.io.Parser;
import texmath.symbolic.Assumptions;
import texmath.symbolic.EquivalenceChecker;
import texmath.symbolic.RuleEngine;
import texmath.symbolic.SymbolicEngine;
import texmath.util.Diagnostic;
import texmath.util.EvaluatorException;
import texmath.util.ParserException;
import texmath.util.TokenizerException;
import texmath.util.Trace;

/**
 * The entry point for working with LaTeX mathematics. This ties together the
 * lexer, parser, evaluator, calculus and symbolic engines under a single set
 * of options, and provides the operations on source text which most clients
 * need.
 *
 * @author David J. Pearce
 *
 */
public class TexMath {
	private static final Logger logger = Logger.getLogger(TexMath.class.getName());

	/**
	 * Resource limits and parsing switches. Options are immutable, and each
	 * <code>with</code> method returns an updated copy.
	 */
	public static final class Options {
		public static final String PROPERTIES = "texmath.properties";

		private final boolean implicitMultiplication;
		private final int maxRecursionDepth;
		private final int maxNodes;
		private final int maxIterations;
		private final int maxInputLength;

		public Options() {
			this(true, Parser.DEFAULT_MAX_DEPTH, Parser.DEFAULT_MAX_NODES, Evaluator.DEFAULT_MAX_ITERATIONS,
					Lexer.DEFAULT_MAX_LENGTH);
		}

		private Options(boolean implicitMultiplication, int maxRecursionDepth, int maxNodes, int maxIterations,
				int maxInputLength) {
			if (maxRecursionDepth <= 0 || maxNodes <= 0 || maxIterations <= 0 || maxInputLength <= 0) {
				throw new IllegalArgumentException("limits must be positive");
			}
			this.implicitMultiplication = implicitMultiplication;
			this.maxRecursionDepth = maxRecursionDepth;
			this.maxNodes = maxNodes;
			this.maxIterations = maxIterations;
			this.maxInputLength = maxInputLength;
		}

		public boolean implicitMultiplication() {
			return implicitMultiplication;
		}

		public int maxRecursionDepth() {
			return maxRecursionDepth;
		}

		public int maxNodes() {
			return maxNodes;
		}

		public int maxIterations() {
			return maxIterations;
		}

		public int maxInputLength() {
			return maxInputLength;
		}

		public Options withImplicitMultiplication(boolean flag) {
			return new Options(flag, maxRecursionDepth, maxNodes, maxIterations, maxInputLength);
		}

		public Options withMaxRecursionDepth(int depth) {
			return new Options(implicitMultiplication, depth, maxNodes, maxIterations, maxInputLength);
		}

		public Options withMaxNodes(int nodes) {
			return new Options(implicitMultiplication, maxRecursionDepth, nodes, maxIterations, maxInputLength);
		}

		public Options withMaxIterations(int iterations) {
			return new Options(implicitMultiplication, maxRecursionDepth, maxNodes, iterations, maxInputLength);
		}

		public Options withMaxInputLength(int length) {
			return new Options(implicitMultiplication, maxRecursionDepth, maxNodes, maxIterations, length);
		}

		/**
		 * Read options from a set of properties, using the keys
		 * <code>texmath.implicitMultiplication</code>,
		 * <code>texmath.maxRecursionDepth</code>, <code>texmath.maxNodes</code>,
		 * <code>texmath.maxIterations</code> and
		 * <code>texmath.maxInputLength</code>. Missing keys take their default
		 * values.
		 *
		 * @param properties
		 * @return
		 */
		public static Options fromProperties(Properties properties) {
			Options defaults = new Options();
			return new Options(
					Boolean.parseBoolean(properties.getProperty("texmath.implicitMultiplication",
							Boolean.toString(defaults.implicitMultiplication))),
					intProperty(properties, "texmath.maxRecursionDepth", defaults.maxRecursionDepth),
					intProperty(properties, "texmath.maxNodes", defaults.maxNodes),
					intProperty(properties, "texmath.maxIterations", defaults.maxIterations),
					intProperty(properties, "texmath.maxInputLength", defaults.maxInputLength));
		}

		/**
		 * Load options from <code>texmath.properties</code> on the classpath,
		 * or return the defaults if there is no such resource.
		 *
		 * @return
		 */
		public static Options load() {
			try (InputStream in = TexMath.class.getClassLoader().getResourceAsStream(PROPERTIES)) {
				if (in == null) {
					return new Options();
				}
				Properties properties = new Properties();
				properties.load(in);
				logger.log(Level.FINE, "loaded options from {0}", PROPERTIES);
				return fromProperties(properties);
			} catch (IOException e) {
				throw new UncheckedIOException("unable to read " + PROPERTIES, e);
			}
		}

		private static int intProperty(Properties properties, String key, int dflt) {
			String value = properties.getProperty(key);
			if (value == null) {
				return dflt;
			}
			try {
				return Integer.parseInt(value.trim());
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("invalid value for " + key + ": " + value, e);
			}
		}

		@Override
		public String toString() {
			return "{implicitMultiplication=" + implicitMultiplication + ", maxRecursionDepth=" + maxRecursionDepth
					+ ", maxNodes=" + maxNodes + ", maxIterations=" + maxIterations + ", maxInputLength="
					+ maxInputLength + "}";
		}
	}

	private final Options options;
	private final CommandTable commands;
	private final Evaluator evaluator;
	private final Differentiator differentiator;
	private final Integrator integrator;
	private final SymbolicEngine symbolic;

	public TexMath() {
		this(Options.load());
	}

	public TexMath(Options options) {
		this(options, CommandTable.standard(), null);
	}

	public TexMath(Options options, CommandTable commands, Evaluator.FunctionHook hook) {
		this.options = options;
		this.commands = commands;
		int depth = options.maxRecursionDepth();
		this.evaluator = new Evaluator(new Arithmetic(), new Functions(), hook, options.maxIterations(), depth,
				new SimpsonIntegrator());
		this.differentiator = new Differentiator(depth);
		this.integrator = new Integrator(depth);
		this.symbolic = new SymbolicEngine(evaluator, RuleEngine.DEFAULT_MAX_ITERATIONS, depth);
	}

	public Options options() {
		return options;
	}

	public List<Token> tokenize(String source) {
		return new Lexer(source, commands, options.implicitMultiplication(), options.maxInputLength()).scan();
	}

	public Expression parse(String source) {
		return new Parser(source, tokenize(source), options.maxRecursionDepth(), options.maxNodes()).parse();
	}

	public Value evaluate(String source) {
		return evaluator.evaluate(parse(source));
	}

	public Value evaluate(String source, Map<String, Value> variables) {
		return evaluator.evaluate(parse(source), variables);
	}

	public Value evaluate(Expression expr, Map<String, Value> variables) {
		return evaluator.evaluate(expr, variables);
	}

	public Expression differentiate(String source, String variable) {
		return differentiator.differentiate(parse(source), variable);
	}

	public Expression differentiate(String source, String variable, int order) {
		return differentiator.differentiate(parse(source), variable, order);
	}

	public Trace differentiateWithSteps(String source, String variable) {
		return differentiator.differentiateWithSteps(parse(source), variable, 1);
	}

	/**
	 * Construct an antiderivative of a given expression. When none can be
	 * found, the result is an unresolved integral node.
	 *
	 * @param source
	 * @param variable
	 * @return
	 */
	public Expression integrate(String source, String variable) {
		return integrator.integrate(parse(source), variable);
	}

	public Expression simplify(String source) {
		return symbolic.simplify(parse(source));
	}

	public Expression expand(String source) {
		return symbolic.expand(parse(source));
	}

	public Expression expandTrig(String source) {
		return symbolic.expandTrig(parse(source));
	}

	public Expression factor(String source) {
		return symbolic.factor(parse(source));
	}

	/**
	 * Simplify an expression, recording each rule applied along the way.
	 *
	 * @param source
	 * @return
	 */
	public Trace simplifyWithSteps(String source) {
		return symbolic.simplifyWithSteps(parse(source));
	}

	public Trace expandWithSteps(String source) {
		return symbolic.expandWithSteps(parse(source));
	}

	public Trace expandTrigWithSteps(String source) {
		return symbolic.expandTrigWithSteps(parse(source));
	}

	public Trace factorWithSteps(String source) {
		return symbolic.factorWithSteps(parse(source));
	}

	public boolean areEquivalent(String lhs, String rhs, EquivalenceChecker.Level level) {
		return symbolic.areEquivalent(parse(lhs), parse(rhs), level);
	}

	public void assume(String variable, Assumptions.Property property) {
		symbolic.assume(variable, property);
	}

	public SymbolicEngine symbolic() {
		return symbolic;
	}

	/**
	 * Check a piece of source text, reporting every problem found rather than
	 * throwing. Parsing runs in recovery mode, so several syntax errors may be
	 * reported at once. A well-formed expression without free variables is
	 * also evaluated, so that problems such as division by zero are reported.
	 *
	 * @param source
	 * @return The list of problems found, which is empty if there are none.
	 */
	public List<Diagnostic> validate(String source) {
		List<Token> tokens;
		try {
			tokens = tokenize(source);
		} catch (TokenizerException e) {
			return Collections.singletonList(Diagnostic.of(e));
		}
		Parser.Result result = new Parser(source, tokens, options.maxRecursionDepth(), options.maxNodes())
				.recover();
		ArrayList<Diagnostic> diagnostics = new ArrayList<>();
		for (ParserException e : result.errors()) {
			diagnostics.add(Diagnostic.of(e));
		}
		if (!result.isValid()) {
			return diagnostics;
		}
		Set<String> free = Syntax.freeVariables(result.expression());
		free.removeAll(Evaluator.RESERVED);
		free.remove("infty");
		if (free.isEmpty()) {
			try {
				evaluator.evaluate(result.expression());
			} catch (EvaluatorException e) {
				diagnostics.add(Diagnostic.of(e));
			}
		}
		return diagnostics;
	}
}

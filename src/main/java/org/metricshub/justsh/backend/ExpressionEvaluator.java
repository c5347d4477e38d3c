package org.metricshub.justsh.backend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * JustSh
 * ჻჻჻჻჻჻
 * Copyright (C) 2024 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import org.metricshub.justsh.builtin.BuiltinCatalog;
import org.metricshub.justsh.frontend.ast.Backtick;
import org.metricshub.justsh.frontend.ast.Condition;
import org.metricshub.justsh.frontend.ast.Conditional;
import org.metricshub.justsh.frontend.ast.Div;
import org.metricshub.justsh.frontend.ast.Expression;
import org.metricshub.justsh.frontend.ast.ExpressionVisitor;
import org.metricshub.justsh.frontend.ast.FunctionCall;
import org.metricshub.justsh.frontend.ast.StringLiteral;
import org.metricshub.justsh.frontend.ast.Sum;
import org.metricshub.justsh.frontend.ast.Variable;

/**
 * Renders expressions as shell text that expands to their value.
 * <p>
 * In quoting mode (the default) the result is one shell word, safe to use
 * as a command argument or on the right of an assignment. Without quoting,
 * literal text is emitted as is, for contexts that do their own quoting.
 */
public class ExpressionEvaluator {

	private final NameSanitizer sanitizer;

	/**
	 * <p>
	 * Constructor for ExpressionEvaluator.
	 * </p>
	 *
	 * @param sanitizer names of the compilation in progress
	 */
	public ExpressionEvaluator(NameSanitizer sanitizer) {
		this.sanitizer = sanitizer;
	}

	public NameSanitizer getSanitizer() {
		return sanitizer;
	}

	/**
	 * @param expression expression to render
	 * @return a quoted shell word expanding to its value
	 */
	public String evaluate(Expression expression) {
		return evaluate(expression, true);
	}

	/**
	 * @param expression expression to render
	 * @param quote whether literal text is quoted
	 * @return shell text expanding to the value of <code>expression</code>
	 */
	public String evaluate(Expression expression, boolean quote) {
		return expression.accept(new Renderer(quote));
	}

	/**
	 * @param literal raw text
	 * @return the text as a single-quoted shell word
	 */
	public String evaluate(String literal) {
		return ShellQuoting.singleQuote(literal);
	}

	/**
	 * Names the function evaluating a conditional. Conditionals that print
	 * the same share a name, wherever they appear.
	 *
	 * @param conditional the expression
	 * @return the function name
	 */
	public String conditionalName(Conditional conditional) {
		return sanitizer.plain("if_" + ShellQuoting.sha256Hex(conditional.toString()).substring(0, 16));
	}

	/**
	 * Renders the shell function evaluating a conditional.
	 *
	 * @param name name of the function, from {@link #conditionalName(Conditional)}
	 * @param conditional the expression
	 * @return the function definition, ending with a newline
	 */
	public String conditionalFunction(String name, Conditional conditional) {
		Condition condition = conditional.getCondition();
		String left = evaluate(condition.getLeft());
		String right = evaluate(condition.getRight());
		StringBuilder sb = new StringBuilder();
		sb.append(name).append("() {\n");
		switch (condition.getOperator()) {
		case REGEX_EQ:
			sb.append("  if echo ").append(left).append(" \\\n");
			sb.append("      | grep -E -e ").append(right).append(" > /dev/null; then\n");
			break;
		case NEQ:
			sb.append("  if [ ").append(left).append(" != ").append(right).append(" ]; then\n");
			break;
		default:
			sb.append("  if [ ").append(left).append(" = ").append(right).append(" ]; then\n");
			break;
		}
		sb.append("    THEN_EXPR=").append(evaluate(conditional.getThenValue())).append(" || exit \"${?}\"\n");
		sb.append("    echo \"${THEN_EXPR}\"\n");
		sb.append("  else\n");
		sb.append("    ELSE_EXPR=").append(evaluate(conditional.getElseValue())).append(" || exit \"${?}\"\n");
		sb.append("    echo \"${ELSE_EXPR}\"\n");
		sb.append("  fi\n");
		sb.append("}\n");
		return sb.toString();
	}

	private final class Renderer implements ExpressionVisitor<String> {

		private final boolean quote;

		Renderer(boolean quote) {
			this.quote = quote;
		}

		private String literal(String value) {
			return quote ? ShellQuoting.singleQuote(value) : value;
		}

		private String expansion(String value) {
			return quote ? ShellQuoting.doubleQuote(value) : value;
		}

		@Override
		public String visitString(StringLiteral string) {
			return literal(string.getValue());
		}

		@Override
		public String visitVariable(Variable variable) {
			return expansion("${" + sanitizer.variable(variable.getName()) + "}");
		}

		@Override
		public String visitSum(Sum sum) {
			return sum.getLeft().accept(this) + sum.getRight().accept(this);
		}

		@Override
		public String visitDiv(Div div) {
			Expression left = div.getLeft();
			String prefix = left.literalValue();
			if (prefix != null) {
				if (!prefix.endsWith("/")) {
					prefix += "/";
				}
				return literal(prefix) + div.getRight().accept(this);
			}
			return "\"$(" + BuiltinCatalog.PATH_PREFIX + " " + evaluate(left) + ")\"" + div.getRight().accept(this);
		}

		@Override
		public String visitBacktick(Backtick backtick) {
			return "\"$(env \"${DEFAULT_SHELL}\" ${DEFAULT_SHELL_ARGS} " + literal(backtick.getCommand())
					+ " || " + BuiltinCatalog.BACKTICK_ERROR + ")\"";
		}

		@Override
		public String visitConditional(Conditional conditional) {
			return expansion("$(" + conditionalName(conditional) + ")");
		}

		@Override
		public String visitFunctionCall(FunctionCall call) {
			StringBuilder sb = new StringBuilder("\"$(").append(call.getName());
			for (Expression argument : call.getArguments()) {
				sb.append(' ').append(evaluate(argument));
			}
			return sb.append(")\"").toString();
		}
	}
}

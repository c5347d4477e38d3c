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

import org.metricshub.justsh.frontend.ast.Backtick;
import org.metricshub.justsh.frontend.ast.Conditional;
import org.metricshub.justsh.frontend.ast.Div;
import org.metricshub.justsh.frontend.ast.Expression;
import org.metricshub.justsh.frontend.ast.ExpressionVisitor;
import org.metricshub.justsh.frontend.ast.FunctionCall;
import org.metricshub.justsh.frontend.ast.StringLiteral;
import org.metricshub.justsh.frontend.ast.Sum;
import org.metricshub.justsh.frontend.ast.Variable;

/**
 * Prints expressions back in justfile syntax, the way recipe listings show
 * parameter defaults.
 * <p>
 * String literals are double-quoted with backslash escapes. Compound
 * expressions are parenthesized at the top level only.
 */
public final class ExpressionPrinter {

	private static final char[] HEX = "0123456789abcdef".toCharArray();

	private ExpressionPrinter() {}

	/**
	 * @param expression expression to print
	 * @return its justfile source form
	 */
	public static String print(Expression expression) {
		return expression.accept(new Printer(0));
	}

	/**
	 * Double-quotes a string, escaping backslashes, quotes, control and
	 * non-ASCII characters.
	 *
	 * @param value raw text
	 * @return the quoted literal
	 */
	public static String quote(String value) {
		StringBuilder sb = new StringBuilder("\"");
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			switch (c) {
			case '\\':
				sb.append("\\\\");
				break;
			case '"':
				sb.append("\\\"");
				break;
			case '\n':
				sb.append("\\n");
				break;
			case '\t':
				sb.append("\\t");
				break;
			case '\r':
				sb.append("\\r");
				break;
			default:
				if (c < 0x20 || (c >= 0x7f && c <= 0xff)) {
					sb.append("\\x").append(HEX[(c >> 4) & 0xf]).append(HEX[c & 0xf]);
				} else if (c > 0xff) {
					sb.append("\\u");
					for (int shift = 12; shift >= 0; shift -= 4) {
						sb.append(HEX[(c >> shift) & 0xf]);
					}
				} else {
					sb.append(c);
				}
				break;
			}
		}
		return sb.append('"').toString();
	}

	private static final class Printer implements ExpressionVisitor<String> {

		private final int depth;

		Printer(int depth) {
			this.depth = depth;
		}

		private static String nested(Expression expression) {
			return expression.accept(new Printer(1));
		}

		private String group(String text) {
			return depth == 0 ? "(" + text + ")" : text;
		}

		@Override
		public String visitString(StringLiteral string) {
			return quote(string.getValue());
		}

		@Override
		public String visitVariable(Variable variable) {
			return variable.getName();
		}

		@Override
		public String visitSum(Sum sum) {
			return group(nested(sum.getLeft()) + " + " + nested(sum.getRight()));
		}

		@Override
		public String visitDiv(Div div) {
			return group(nested(div.getLeft()) + " / " + nested(div.getRight()));
		}

		@Override
		public String visitBacktick(Backtick backtick) {
			return "`" + backtick.getCommand() + "`";
		}

		@Override
		public String visitConditional(Conditional conditional) {
			return group(
					"if " + nested(conditional.getCondition().getLeft())
							+ " " + conditional.getCondition().getOperator().getSymbol() + " "
							+ nested(conditional.getCondition().getRight())
							+ " { " + nested(conditional.getThenValue()) + " }"
							+ " else { " + nested(conditional.getElseValue()) + " }");
		}

		@Override
		public String visitFunctionCall(FunctionCall call) {
			StringBuilder sb = new StringBuilder(call.getName()).append('(');
			for (int i = 0; i < call.getArguments().size(); i++) {
				if (i > 0) {
					sb.append(", ");
				}
				sb.append(nested(call.getArguments().get(i)));
			}
			return sb.append(')').toString();
		}
	}
}

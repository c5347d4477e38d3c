package org.metricshub.justsh.frontend;

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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import org.metricshub.justsh.frontend.ast.Alias;
import org.metricshub.justsh.frontend.ast.Assignment;
import org.metricshub.justsh.frontend.ast.Backtick;
import org.metricshub.justsh.frontend.ast.Comment;
import org.metricshub.justsh.frontend.ast.Condition;
import org.metricshub.justsh.frontend.ast.Conditional;
import org.metricshub.justsh.frontend.ast.Declaration;
import org.metricshub.justsh.frontend.ast.Dependency;
import org.metricshub.justsh.frontend.ast.Div;
import org.metricshub.justsh.frontend.ast.Export;
import org.metricshub.justsh.frontend.ast.Expression;
import org.metricshub.justsh.frontend.ast.Fragment;
import org.metricshub.justsh.frontend.ast.FunctionCall;
import org.metricshub.justsh.frontend.ast.Item;
import org.metricshub.justsh.frontend.ast.LexerException;
import org.metricshub.justsh.frontend.ast.Parameter;
import org.metricshub.justsh.frontend.ast.ParserException;
import org.metricshub.justsh.frontend.ast.Recipe;
import org.metricshub.justsh.frontend.ast.RecipeLine;
import org.metricshub.justsh.frontend.ast.Setting;
import org.metricshub.justsh.frontend.ast.StringLiteral;
import org.metricshub.justsh.frontend.ast.Sum;
import org.metricshub.justsh.frontend.ast.Variable;
import org.metricshub.justsh.frontend.ast.Variadic;
import org.metricshub.justsh.util.JustShLogger;
import org.metricshub.justsh.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Converts the text of a justfile into a list of {@link Item}s.
 * <p>
 * The parser is a recursive descent parser with backtracking: every
 * grammar method either consumes what it recognizes and returns a node, or
 * leaves the reader where it found it and returns {@code null}. Only
 * unterminated strings and backticks are reported on the spot (as
 * {@link LexerException}); any other syntax error is reported once the
 * document cannot be parsed further, at the furthest position the parser
 * reached (as {@link ParserException}).
 * <p>
 * A parser instance is not thread-safe, but may be reused for several
 * documents.
 */
public class JustfileParser {

	private static final Logger LOG = JustShLogger.getLogger(JustfileParser.class);

	private static final Pattern NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_-]*");
	private static final Pattern INDENT = Pattern.compile("(?:    |  |\\t)+");
	private static final Pattern BLANK_LINES = Pattern.compile("(?:[ \\t]*\\n)*");
	private static final Pattern COMMENT_START = Pattern.compile("[ \\t]*#[ \\t]*");
	private static final String[] LINE_PREFIXES = { "@-", "-@", "@", "-" };

	private SourceReader reader;

	/**
	 * Parses a whole justfile.
	 *
	 * @param source where the justfile comes from
	 * @return the items of the justfile, in source order
	 * @throws IOException when the source cannot be read
	 */
	public List<Item> parse(ScriptSource source) throws IOException {
		return parse(source.getDescription(), source.readFully());
	}

	/**
	 * Parses a whole justfile.
	 *
	 * @param description name of the source, used in error messages
	 * @param text contents of the justfile
	 * @return the items of the justfile, in source order
	 */
	public List<Item> parse(String description, String text) {
		reader = new SourceReader(description, text);
		List<Item> items = JUSTFILE();
		LOG.debug("Parsed {} items from {}", items.size(), description);
		return items;
	}

	/**
	 * Parses a single expression, as found on the right of <code>:=</code>.
	 *
	 * @param text the expression
	 * @return its syntax tree
	 */
	public Expression parseExpression(String text) {
		reader = new SourceReader(ScriptSource.DESCRIPTION_INLINE_JUSTFILE, text);
		Expression expression = EXPRESSION();
		reader.whitespace();
		if (expression == null || !reader.atEnd()) {
			throw parserException(reader.describeFurthestFailure());
		}
		return expression;
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName
	// JUSTFILE : [SHEBANG] ITEM* EOL* EOF
	List<Item> JUSTFILE() {
		if (reader.lookingAt("#!")) {
			reader.restOfLine();
		}
		List<Item> items = new ArrayList<Item>();
		while (true) {
			int start = reader.mark();
			if (!ITEM(items) || reader.mark() == start) {
				reader.reset(start);
				break;
			}
		}
		reader.whitespace();
		if (!reader.atEnd()) {
			throw parserException(reader.describeFurthestFailure());
		}
		return items;
	}

	// ITEM : ws ATTRIBUTES ws ( RECIPE | ALIAS | ASSIGNMENT | EXPORT | SETTING | COMMENT | EOL )
	boolean ITEM(List<Item> items) {
		int start = reader.mark();
		reader.whitespace();
		List<String> attributes = ATTRIBUTES();
		reader.whitespace();
		int lineNumber = reader.getLineNumber();
		Declaration declaration = DECLARATION();
		if (declaration != null) {
			Item item = new Item(attributes, declaration, lineNumber);
			LOG.debug("item: {}", item);
			items.add(item);
			return true;
		}
		if (EOL()) {
			return true;
		}
		reader.reset(start);
		return false;
	}

	// DECLARATION : RECIPE | ALIAS | ASSIGNMENT | EXPORT | SETTING | COMMENT
	Declaration DECLARATION() {
		Declaration declaration = RECIPE();
		if (declaration == null) {
			declaration = ALIAS();
		}
		if (declaration == null) {
			declaration = ASSIGNMENT();
		}
		if (declaration == null) {
			declaration = EXPORT();
		}
		if (declaration == null) {
			declaration = SETTING();
		}
		if (declaration == null) {
			declaration = COMMENT();
		}
		return declaration;
	}

	// ATTRIBUTES : ( '[' [ NAME ( ',' NAME )* ] [','] ']' EOL )*
	List<String> ATTRIBUTES() {
		List<String> names = new ArrayList<String>();
		while (true) {
			int start = reader.mark();
			reader.spaces();
			if (!reader.literal("[")) {
				reader.reset(start);
				return names;
			}
			List<String> line = new ArrayList<String>();
			reader.whitespace();
			String name = reader.regex(NAME, "attribute name");
			while (name != null) {
				line.add(name);
				int afterName = reader.mark();
				reader.whitespace();
				if (!reader.literal(",")) {
					reader.reset(afterName);
					break;
				}
				reader.whitespace();
				name = reader.regex(NAME, "attribute name");
			}
			reader.whitespace();
			if (!reader.literal("]")) {
				reader.reset(start);
				return names;
			}
			reader.spaces();
			if (!EOL()) {
				reader.reset(start);
				return names;
			}
			names.addAll(line);
		}
	}

	// EOL : COMMENT NEWLINE | NEWLINE+
	boolean EOL() {
		int start = reader.mark();
		if (COMMENT() != null) {
			if (reader.literal("\n")) {
				return true;
			}
			reader.reset(start);
			return false;
		}
		if (!reader.literal("\n")) {
			return false;
		}
		while (reader.literal("\n")) {
			// swallow blank lines
		}
		return true;
	}

	// COMMENT : spaces '#' spaces (not '!') text
	Comment COMMENT() {
		int start = reader.mark();
		if (reader.regex(COMMENT_START, "comment") == null || reader.peek() == '!') {
			reader.reset(start);
			return null;
		}
		return new Comment(reader.restOfLine());
	}

	// ALIAS : 'alias' ws NAME ws ':=' ws NAME spaces EOL
	Alias ALIAS() {
		int start = reader.mark();
		if (!keyword("alias") || reader.whitespace() == 0) {
			reader.reset(start);
			return null;
		}
		String name = reader.regex(NAME, "alias name");
		if (name != null) {
			reader.whitespace();
			if (reader.literal(":=")) {
				reader.whitespace();
				String target = reader.regex(NAME, "recipe name");
				if (target != null) {
					reader.spaces();
					if (EOL()) {
						return new Alias(name, target);
					}
				}
			}
		}
		reader.reset(start);
		return null;
	}

	// ASSIGNMENT : NAME spaces ':=' ws EXPRESSION spaces EOL
	Assignment ASSIGNMENT() {
		int start = reader.mark();
		String name = reader.regex(NAME, "variable name");
		if (name != null) {
			reader.spaces();
			if (reader.literal(":=")) {
				reader.whitespace();
				Expression value = EXPRESSION();
				if (value != null) {
					reader.spaces();
					if (EOL()) {
						return new Assignment(name, value);
					}
				}
			}
		}
		reader.reset(start);
		return null;
	}

	// EXPORT : 'export' ws ASSIGNMENT
	Export EXPORT() {
		int start = reader.mark();
		if (keyword("export") && reader.whitespace() > 0) {
			Assignment assignment = ASSIGNMENT();
			if (assignment != null) {
				return new Export(assignment);
			}
		}
		reader.reset(start);
		return null;
	}

	// SETTING : 'set' ws NAME spaces [ ':=' ws ( 'true' | 'false' | STRING | LIST ) ] spaces EOL
	Setting SETTING() {
		int start = reader.mark();
		if (!keyword("set") || reader.whitespace() == 0) {
			reader.reset(start);
			return null;
		}
		String name = reader.regex(NAME, "setting name");
		if (name != null) {
			reader.spaces();
			Setting setting;
			int beforeValue = reader.mark();
			if (reader.literal(":=")) {
				reader.whitespace();
				setting = SETTING_VALUE(name);
			} else {
				reader.reset(beforeValue);
				setting = Setting.ofBoolean(name, true);
			}
			if (setting != null) {
				reader.spaces();
				if (EOL()) {
					return setting;
				}
			}
		}
		reader.reset(start);
		return null;
	}

	Setting SETTING_VALUE(String name) {
		if (keyword("true")) {
			return Setting.ofBoolean(name, true);
		}
		if (keyword("false")) {
			return Setting.ofBoolean(name, false);
		}
		String value = STRING();
		if (value != null) {
			return Setting.ofString(name, value);
		}
		List<String> list = LIST();
		return list == null ? null : Setting.ofList(name, list);
	}

	// LIST : '[' ws [ STRING ( ws ',' ws STRING )* ] ws [','] ws ']'
	List<String> LIST() {
		int start = reader.mark();
		if (!reader.literal("[")) {
			return null;
		}
		List<String> values = new ArrayList<String>();
		reader.whitespace();
		String value = STRING();
		while (value != null) {
			values.add(value);
			int afterValue = reader.mark();
			reader.whitespace();
			if (!reader.literal(",")) {
				reader.reset(afterValue);
				break;
			}
			reader.whitespace();
			value = STRING();
		}
		reader.whitespace();
		if (reader.literal("]")) {
			return values;
		}
		reader.reset(start);
		return null;
	}

	// RECIPE : ['@'] NAME PARAMETER* DEFAULT_PARAMETER* [VARIADIC] ':' DEPENDENCY* ['&&' DEPENDENCY+] EOL [BODY] NEWLINE*
	Recipe RECIPE() {
		int start = reader.mark();
		reader.spaces();
		boolean echo = !reader.literal("@");
		reader.spaces();
		String name = reader.regex(NAME, "recipe name");
		if (name == null) {
			reader.reset(start);
			return null;
		}
		reader.spaces();

		List<Parameter> parameters = new ArrayList<Parameter>();
		Parameter parameter;
		while ((parameter = PARAMETER()) != null) {
			parameters.add(parameter);
			reader.spaces();
		}
		while ((parameter = DEFAULT_PARAMETER()) != null) {
			parameters.add(parameter);
			reader.spaces();
		}
		Variadic variadic = VARIADIC();
		reader.spaces();
		if (!reader.literal(":") || reader.lookingAt("=")) {
			reader.reset(start);
			return null;
		}
		reader.spaces();

		List<Dependency> before = new ArrayList<Dependency>();
		Dependency dependency;
		while ((dependency = DEPENDENCY()) != null) {
			before.add(dependency);
			reader.spaces();
		}
		List<Dependency> after = new ArrayList<Dependency>();
		int beforeAnd = reader.mark();
		if (reader.literal("&&")) {
			reader.spaces();
			while ((dependency = DEPENDENCY()) != null) {
				after.add(dependency);
				reader.spaces();
			}
			if (after.isEmpty()) {
				reader.reset(beforeAnd);
			}
		}
		if (!EOL()) {
			reader.reset(start);
			return null;
		}
		List<RecipeLine> body = BODY();
		while (reader.literal("\n")) {
			// trailing blank lines
		}
		return new Recipe(echo, name, parameters, variadic, before, after, body);
	}

	// PARAMETER : ['$'] NAME (not followed by ws '=')
	Parameter PARAMETER() {
		int start = reader.mark();
		boolean exported = reader.literal("$");
		String name = reader.regex(NAME, "parameter name");
		if (name != null) {
			int afterName = reader.mark();
			reader.whitespace();
			boolean defaulted = reader.lookingAt("=");
			reader.reset(afterName);
			if (!defaulted) {
				return new Parameter(exported, name, null);
			}
		}
		reader.reset(start);
		return null;
	}

	// DEFAULT_PARAMETER : ['$'] NAME ws '=' ws VALUE
	Parameter DEFAULT_PARAMETER() {
		int start = reader.mark();
		boolean exported = reader.literal("$");
		String name = reader.regex(NAME, "parameter name");
		if (name != null) {
			reader.whitespace();
			if (reader.literal("=")) {
				reader.whitespace();
				Expression value = VALUE();
				if (value != null) {
					return new Parameter(exported, name, value);
				}
			}
		}
		reader.reset(start);
		return null;
	}

	// VARIADIC : ( '*' | '+' ) ( PARAMETER | DEFAULT_PARAMETER )
	Variadic VARIADIC() {
		int start = reader.mark();
		Variadic.Kind kind;
		if (reader.literal("*")) {
			kind = Variadic.Kind.STAR;
		} else if (reader.literal("+")) {
			kind = Variadic.Kind.PLUS;
		} else {
			return null;
		}
		Parameter parameter = PARAMETER();
		if (parameter == null) {
			parameter = DEFAULT_PARAMETER();
		}
		if (parameter == null) {
			reader.reset(start);
			return null;
		}
		return new Variadic(kind, parameter);
	}

	// DEPENDENCY : NAME | '(' NAME ( ws EXPRESSION )* ws ')'
	Dependency DEPENDENCY() {
		int start = reader.mark();
		String name = reader.regex(NAME, "dependency");
		if (name != null) {
			return new Dependency(name, Collections.<Expression>emptyList());
		}
		if (!reader.literal("(")) {
			return null;
		}
		name = reader.regex(NAME, "dependency");
		if (name != null) {
			List<Expression> arguments = new ArrayList<Expression>();
			while (true) {
				int beforeArgument = reader.mark();
				reader.whitespace();
				Expression argument = EXPRESSION();
				if (argument == null) {
					reader.reset(beforeArgument);
					break;
				}
				arguments.add(argument);
			}
			reader.whitespace();
			if (reader.literal(")")) {
				return new Dependency(name, arguments);
			}
		}
		reader.reset(start);
		return null;
	}

	// BODY : blank-lines INDENT LINE ( INDENT LINE )*
	// the indentation of the first line is required on every other line
	List<RecipeLine> BODY() {
		int start = reader.mark();
		reader.regex(BLANK_LINES, "blank lines");
		int firstLine = reader.mark();
		String indent = reader.regex(INDENT, "indentation");
		if (indent == null) {
			reader.reset(start);
			return Collections.emptyList();
		}
		reader.reset(firstLine);
		List<RecipeLine> lines = new ArrayList<RecipeLine>();
		while (true) {
			int lineStart = reader.mark();
			if (!reader.literal(indent)) {
				break;
			}
			RecipeLine line = LINE();
			if (line == null) {
				reader.reset(lineStart);
				break;
			}
			lines.add(line);
		}
		if (lines.isEmpty()) {
			reader.reset(start);
		}
		return lines;
	}

	// LINE : [LINE_PREFIX] ( '{{{{' | INTERPOLATION | text )+ '\n' blank-lines
	RecipeLine LINE() {
		int start = reader.mark();
		String prefix = null;
		for (String candidate : LINE_PREFIXES) {
			if (reader.lookingAt(candidate)) {
				prefix = candidate;
				reader.literal(candidate);
				break;
			}
		}
		List<Fragment> fragments = new ArrayList<Fragment>();
		StringBuilder text = new StringBuilder();
		while (!reader.atEnd() && reader.peek() != '\n') {
			if (reader.lookingAt("{{{{")) {
				reader.literal("{{{{");
				text.append("{{");
				continue;
			}
			if (reader.lookingAt("{{")) {
				Expression interpolated = INTERPOLATION();
				if (interpolated != null) {
					if (text.length() > 0) {
						fragments.add(Fragment.text(text.toString()));
						text.setLength(0);
					}
					fragments.add(Fragment.interpolation(interpolated));
					continue;
				}
			}
			text.append(reader.next());
		}
		if (text.length() > 0) {
			fragments.add(Fragment.text(text.toString()));
		}
		if (fragments.isEmpty() || !reader.literal("\n")) {
			reader.reset(start);
			return null;
		}
		reader.regex(BLANK_LINES, "blank lines");
		return new RecipeLine(prefix, fragments);
	}

	// INTERPOLATION : '{{' ws EXPRESSION ws '}}'
	Expression INTERPOLATION() {
		int start = reader.mark();
		if (reader.literal("{{")) {
			reader.whitespace();
			Expression expression = EXPRESSION();
			if (expression != null) {
				reader.whitespace();
				if (reader.literal("}}")) {
					return expression;
				}
			}
		}
		reader.reset(start);
		return null;
	}

	// EXPRESSION : CONDITIONAL | [VALUE] ws '/' ws EXPRESSION | VALUE ws '+' ws EXPRESSION | VALUE
	Expression EXPRESSION() {
		Expression conditional = CONDITIONAL();
		if (conditional != null) {
			return conditional;
		}
		int start = reader.mark();
		Expression value = VALUE();
		int afterValue = reader.mark();

		reader.whitespace();
		if (reader.literal("/")) {
			reader.whitespace();
			Expression right = EXPRESSION();
			if (right != null) {
				return new Div(value == null ? StringLiteral.EMPTY : value, right);
			}
		}
		reader.reset(afterValue);
		if (value == null) {
			reader.reset(start);
			return null;
		}

		reader.whitespace();
		if (reader.literal("+")) {
			reader.whitespace();
			Expression right = EXPRESSION();
			if (right != null) {
				return new Sum(value, right);
			}
		}
		reader.reset(afterValue);
		return value;
	}

	// CONDITIONAL : ws 'if' CONDITION ws '{' ws EXPRESSION ws '}' ws 'else' ( CONDITIONAL | ws '{' ws EXPRESSION ws '}' )
	Conditional CONDITIONAL() {
		int start = reader.mark();
		reader.whitespace();
		if (keyword("if")) {
			reader.whitespace();
			Condition condition = CONDITION();
			if (condition != null) {
				Expression thenValue = BRACED();
				if (thenValue != null) {
					reader.whitespace();
					if (keyword("else")) {
						reader.whitespace();
						Expression elseValue = CONDITIONAL();
						if (elseValue == null) {
							elseValue = BRACED();
						}
						if (elseValue != null) {
							return new Conditional(condition, thenValue, elseValue);
						}
					}
				}
			}
		}
		reader.reset(start);
		return null;
	}

	// BRACED : ws '{' ws EXPRESSION ws '}'
	private Expression BRACED() {
		int start = reader.mark();
		reader.whitespace();
		if (reader.literal("{")) {
			reader.whitespace();
			Expression expression = EXPRESSION();
			if (expression != null) {
				reader.whitespace();
				if (reader.literal("}")) {
					return expression;
				}
			}
		}
		reader.reset(start);
		return null;
	}

	// CONDITION : EXPRESSION ws ( '==' | '!=' | '=~' ) ws EXPRESSION
	Condition CONDITION() {
		int start = reader.mark();
		Expression left = EXPRESSION();
		if (left != null) {
			reader.whitespace();
			Condition.Operator operator = null;
			for (Condition.Operator candidate : Condition.Operator.values()) {
				if (reader.literal(candidate.getSymbol())) {
					operator = candidate;
					break;
				}
			}
			if (operator != null) {
				reader.whitespace();
				Expression right = EXPRESSION();
				if (right != null) {
					return new Condition(operator, left, right);
				}
			}
		}
		reader.reset(start);
		return null;
	}

	// VALUE : NAME '(' [ARGUMENTS] ')' | '(' ws EXPRESSION ws ')' | BACKTICK | STRING | NAME
	Expression VALUE() {
		int start = reader.mark();
		String name = reader.regex(NAME, "name");
		if (name != null) {
			int afterName = reader.mark();
			if (reader.literal("(")) {
				List<Expression> arguments = ARGUMENTS();
				reader.whitespace();
				if (reader.literal(")")) {
					return new FunctionCall(name, arguments);
				}
				reader.reset(afterName);
			}
			return new Variable(name);
		}
		if (reader.literal("(")) {
			reader.whitespace();
			Expression expression = EXPRESSION();
			if (expression != null) {
				reader.whitespace();
				if (reader.literal(")")) {
					return expression;
				}
			}
			reader.reset(start);
			return null;
		}
		Backtick backtick = BACKTICK();
		if (backtick != null) {
			return backtick;
		}
		String string = STRING();
		if (string != null) {
			return new StringLiteral(string);
		}
		return null;
	}

	// ARGUMENTS : ws EXPRESSION ( ws ',' ws EXPRESSION )* [ ws ',' ]
	List<Expression> ARGUMENTS() {
		List<Expression> arguments = new ArrayList<Expression>();
		while (true) {
			int start = reader.mark();
			reader.whitespace();
			Expression argument = EXPRESSION();
			if (argument == null) {
				reader.reset(start);
				return arguments;
			}
			arguments.add(argument);
			int afterArgument = reader.mark();
			reader.whitespace();
			if (!reader.literal(",")) {
				reader.reset(afterArgument);
				return arguments;
			}
		}
	}

	// BACKTICK : '```' raw '```' | '`' raw '`'
	Backtick BACKTICK() {
		if (reader.lookingAt("```")) {
			return new Backtick(TextBlocks.dedent(delimited("```", false)));
		}
		if (reader.lookingAt("`")) {
			return new Backtick(delimited("`", false));
		}
		reader.fail("backtick");
		return null;
	}

	// STRING : '"""' escaped '"""' | '"' escaped '"' | "'''" raw "'''" | "'" raw "'"
	String STRING() {
		if (reader.lookingAt("\"\"\"")) {
			return TextBlocks.dedent(delimited("\"\"\"", true));
		}
		if (reader.lookingAt("\"")) {
			return delimited("\"", true);
		}
		if (reader.lookingAt("'''")) {
			return TextBlocks.dedent(delimited("'''", false));
		}
		if (reader.lookingAt("'")) {
			return delimited("'", false);
		}
		reader.fail("string");
		return null;
	}
	// CHECKSTYLE.ON MethodName

	/**
	 * Reads the text between <code>delimiter</code> and its next occurrence,
	 * which may be on another line.
	 *
	 * @param delimiter opening and closing delimiter
	 * @param escapes whether <code>\\ \" \n \r \t</code> are decoded; any
	 *        other backslash is kept as is
	 * @return the text between the delimiters
	 */
	private String delimited(String delimiter, boolean escapes) {
		int line = reader.getLineNumber();
		int column = reader.getColumn();
		reader.literal(delimiter);
		StringBuilder value = new StringBuilder();
		while (!reader.atEnd()) {
			if (reader.lookingAt(delimiter)) {
				reader.literal(delimiter);
				return value.toString();
			}
			char c = reader.next();
			if (escapes && c == '\\') {
				char escaped = unescape(reader.peek());
				if (escaped != 0) {
					reader.next();
					value.append(escaped);
					continue;
				}
			}
			value.append(c);
		}
		String kind = delimiter.startsWith("`") ? "backtick" : "string";
		throw new LexerException("Unterminated " + kind + " starting with " + delimiter, reader.getDescription(), line, column);
	}

	private static char unescape(char c) {
		switch (c) {
		case '\\':
			return '\\';
		case '"':
			return '"';
		case 'n':
			return '\n';
		case 'r':
			return '\r';
		case 't':
			return '\t';
		default:
			return 0;
		}
	}

	/**
	 * Consumes <code>word</code> when it is not the start of a longer name.
	 */
	private boolean keyword(String word) {
		int start = reader.mark();
		if (reader.literal(word)) {
			char next = reader.peek();
			if (!Character.isLetterOrDigit(next) && next != '_' && next != '-') {
				return true;
			}
		}
		reader.reset(start);
		return false;
	}

	private ParserException parserException(String msg) {
		return new ParserException(
				msg,
				reader.getDescription(),
				reader.getFurthestLineNumber(),
				reader.getFurthestColumn());
	}
}

package org.metricshub.justsh.backend;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.justsh.frontend.JustfileParser;
import org.metricshub.justsh.frontend.ast.Conditional;
import org.metricshub.justsh.frontend.ast.Expression;

public class ExpressionEvaluatorTest {

	private final ExpressionEvaluator evaluator = new ExpressionEvaluator(new NameSanitizer());

	private static Expression parse(String expression) {
		return new JustfileParser().parseExpression(expression);
	}

	private String evaluate(String expression) {
		return evaluator.evaluate(parse(expression));
	}

	@Test
	public void testString() {
		assertEquals("'hello world'", evaluate("\"hello world\""));
		assertEquals("'it'\"'\"'s'", evaluate("\"it's\""));
		assertEquals("'$HOME'", evaluate("'$HOME'"));
	}

	@Test
	public void testUnquoted() {
		assertEquals("a b", evaluator.evaluate(parse("'a b'"), false));
		assertEquals("${VAR_x}", evaluator.evaluate(parse("x"), false));
	}

	@Test
	public void testVariable() {
		assertEquals("\"${VAR_build_dir}\"", evaluate("build-dir"));
	}

	@Test
	public void testSum() {
		assertEquals("\"${VAR_a}\"'-suffix'", evaluate("a + \"-suffix\""));
	}

	@Test
	public void testDivisionOfLiterals() {
		assertEquals("'a/''b'", evaluate("\"a\" / \"b\""));
		assertEquals("'a/''b'", evaluate("\"a/\" / \"b\""));
		assertEquals("'/''usr'", evaluate("/ \"usr\""));
	}

	@Test
	public void testDivisionOfComputedValue() {
		assertEquals("\"$(path_prefix \"${VAR_dir}\")\"'file'", evaluate("dir / \"file\""));
	}

	@Test
	public void testBacktick() {
		assertEquals(
				"\"$(env \"${DEFAULT_SHELL}\" ${DEFAULT_SHELL_ARGS} 'git rev-parse HEAD' || backtick_error)\"",
				evaluate("`git rev-parse HEAD`"));
	}

	@Test
	public void testFunctionCall() {
		assertEquals("\"$(uppercase \"${VAR_name}\")\"", evaluate("uppercase(name)"));
		assertEquals("\"$(env_var_or_default 'HOME' '/root')\"", evaluate("env_var_or_default(\"HOME\", \"/root\")"));
		assertEquals("\"$(arch)\"", evaluate("arch()"));
	}

	@Test
	public void testConditionalName() {
		Conditional first = (Conditional) parse("if a == \"b\" { \"c\" } else { \"d\" }");
		Conditional same = (Conditional) parse("if a==\"b\"{\"c\"}else{\"d\"}");
		Conditional other = (Conditional) parse("if a == \"b\" { \"c\" } else { \"e\" }");
		String name = evaluator.conditionalName(first);
		assertTrue(name.matches("if_[0-9a-f]{16}"));
		assertEquals(name, evaluator.conditionalName(same));
		assertNotEquals(name, evaluator.conditionalName(other));
		assertEquals("\"$(" + name + ")\"", evaluator.evaluate(first));
	}

	@Test
	public void testConditionalFunction() {
		Conditional equality = (Conditional) parse("if a == \"b\" { \"c\" } else { \"d\" }");
		String function = evaluator.conditionalFunction("if_test", equality);
		assertTrue(function.startsWith("if_test() {\n"));
		assertTrue(function.contains("  if [ \"${VAR_a}\" = 'b' ]; then\n"));
		assertTrue(function.contains("    THEN_EXPR='c' || exit \"${?}\"\n"));
		assertTrue(function.contains("    ELSE_EXPR='d' || exit \"${?}\"\n"));
		assertTrue(function.endsWith("}\n"));

		Conditional inequality = (Conditional) parse("if a != \"b\" { \"c\" } else { \"d\" }");
		assertTrue(evaluator.conditionalFunction("f", inequality).contains("[ \"${VAR_a}\" != 'b' ]"));

		Conditional regex = (Conditional) parse("if a =~ \"^b+$\" { \"c\" } else { \"d\" }");
		assertTrue(evaluator.conditionalFunction("f", regex).contains("| grep -E -e '^b+$' > /dev/null; then"));
	}
}

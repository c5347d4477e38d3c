package org.metricshub.justsh.builtin;

import static org.metricshub.justsh.JustShTestSupport.justTest;

import java.util.Arrays;
import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

/**
 * Evaluates built-in calls in a generated script.
 */
@RunWith(Parameterized.class)
public class BuiltinFunctionsTest {

	@Parameter(0)
	public String expression;

	@Parameter(1)
	public String expected;

	@Parameters(name = "{0}")
	public static Collection<Object[]> data() {
		return Arrays
				.asList(
						new Object[][] {
								{ "uppercase(\"abc\")", "ABC" },
								{ "lowercase(\"AbC\")", "abc" },
								{ "join(\"a\", \"b\", \"c\")", "a/b/c" },
								{ "quote(\"it's\")", "'it'\\''s'" },
								{ "sha256(\"abc\")", "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad" },
								{ "path_exists(\"just.sh\")", "true" },
								{ "path_exists(\"missing\")", "false" },
								{ "env_var_or_default(\"JUSTSH_SURELY_UNSET\", \"fallback\")", "fallback" },
								{ "env_var(\"JUSTSH_SURELY_UNSET\")", null },
								{ "os_family()", "unix" },
								{ "(\"a\" + \"/\") / \"b\"", "a/b" },
								{ "(\"a\" + \"\") / \"b\"", "a/b" },
								{ "`printf 'x%s' y`", "xy" },
								{ "if \"hello\" =~ 'hel+o' { \"match\" } else { \"mismatch\" }", "match" },
								{ "if \"2\" == \"2\" { \"Good!\" } else { \"1984\" }", "Good!" } });
	}

	@Test
	public void testEvaluate() throws Exception {
		if (expected == null) {
			justTest(expression)
					.justfile("x := " + expression + "\n")
					.argument("--evaluate", "x")
					.expectExit(1)
					.expectError("not present")
					.runAndAssert();
			return;
		}
		justTest(expression)
				.justfile("x := " + expression + "\n")
				.argument("--evaluate", "x")
				.expect(expected)
				.runAndAssert();
	}
}

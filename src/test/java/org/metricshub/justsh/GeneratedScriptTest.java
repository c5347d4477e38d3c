package org.metricshub.justsh;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assume.assumeTrue;
import static org.metricshub.justsh.JustShTestSupport.justTest;

import java.util.Locale;
import org.junit.Test;

/**
 * Runs generated scripts with <code>sh</code> and checks what they print.
 */
public class GeneratedScriptTest {

	/**
	 * The first recipe runs when no recipe is named.
	 */
	@Test
	public void testSimpleRecipe() throws Exception {
		justTest("simple recipe")
				.justfile("simple:\n    echo Simple!\n")
				.expectLines("Simple!")
				.runAndAssert();
	}

	@Test
	public void testEchoedLinesGoToStandardError() throws Exception {
		justTest("recipe line echo")
				.justfile("hello:\n    echo hello\n")
				.argument("hello")
				.expectLines("hello")
				.expectError("echo hello")
				.runAndAssert();
	}

	@Test
	public void testQuietRecipe() throws Exception {
		JustShTestSupport.TestResult result = justTest("quiet recipe")
				.justfile("@quiet:\n    echo shh\n")
				.expectLines("shh")
				.run();
		result.assertExpected();
		assertEquals("", result.error());
	}

	@Test
	public void testDependenciesRunInOrder() throws Exception {
		justTest("default with dependencies")
				.justfile("default: lint build test\n\nlint:\n    echo lint\n\nbuild:\n    echo build\n\ntest:\n    echo test\n")
				.expectLines("lint", "build", "test")
				.runAndAssert();
	}

	/**
	 * A dependency shared by two recipes runs once.
	 */
	@Test
	public void testSharedDependencyRunsOnce() throws Exception {
		justTest("memoized dependency")
				.justfile("all: a b\n\na: c\n    echo a\n\nb: c\n    echo b\n\nc:\n    echo c\n")
				.expectLines("c", "a", "b")
				.runAndAssert();
	}

	@Test
	public void testAfterDependencies() throws Exception {
		justTest("after dependencies")
				.justfile("main: first && last\n    echo main\n\nfirst:\n    echo first\n\nlast:\n    echo last\n")
				.expectLines("first", "main", "last")
				.runAndAssert();
	}

	@Test
	public void testDependencyWithArguments() throws Exception {
		justTest("dependency with arguments")
				.justfile("build: (say 'x' \"y\")\n\nsay first second:\n    echo {{first}}-{{second}}\n")
				.expectLines("x-y")
				.runAndAssert();
	}

	@Test
	public void testMissingArguments() throws Exception {
		justTest("too few arguments")
				.justfile("r a b='x':\n    echo {{a}} {{b}}\n")
				.argument("r")
				.expectExit(1)
				.expectError("Recipe `r` got 0 arguments but takes at least 1")
				.runAndAssert();
	}

	@Test
	public void testDefaultedParameter() throws Exception {
		justTest("defaulted parameter")
				.justfile("r a b='x':\n    echo {{a}} {{b}}\n")
				.argument("r", "one")
				.expectLines("one x")
				.runAndAssert();
	}

	@Test
	public void testArgumentsThenNextRecipe() throws Exception {
		justTest("arguments consumed before next recipe")
				.justfile("r a:\n    echo {{a}}\n\ns:\n    echo s\n")
				.argument("r", "one", "s")
				.expectLines("one", "s")
				.runAndAssert();
	}

	@Test
	public void testVariadicParameter() throws Exception {
		justTest("variadic parameter")
				.justfile("greet +names:\n    echo hello {{names}}\n")
				.argument("greet", "a", "b")
				.expectLines("hello a b")
				.runAndAssert();
	}

	@Test
	public void testDefaultRecipeNeedsArguments() throws Exception {
		justTest("default recipe with required parameter")
				.justfile("r a:\n    echo {{a}}\n")
				.expectExit(1)
				.expectError("Recipe `r` cannot be used as default recipe since it requires at least 1 argument.")
				.runAndAssert();
	}

	@Test
	public void testConditionals() throws Exception {
		justTest("conditionals")
				.justfile(
						"equal := if \"a\" == \"a\" { \"Good!\" } else { \"Bad\" }\n"
								+ "regex := if \"abc\" =~ \"a.c\" { \"match\" } else { \"no match\" }\n"
								+ "other := if \"a\" != \"a\" { \"Bad\" } else if \"b\" == \"b\" { \"chained\" } else { \"Bad\" }\n"
								+ "\n"
								+ "show:\n"
								+ "    echo {{equal}}\n"
								+ "    echo {{regex}}\n"
								+ "    echo {{other}}\n")
				.expectLines("Good!", "match", "chained")
				.runAndAssert();
	}

	@Test
	public void testPathJoin() throws Exception {
		justTest("path join")
				.justfile("x := \"a\" / \"b\"\n")
				.argument("--evaluate", "x")
				.expect("a/b")
				.runAndAssert();
	}

	@Test
	public void testPathJoinWithoutDoubleSlash() throws Exception {
		justTest("path join with trailing slash")
				.justfile("x := \"a/\" / \"b\"\n")
				.argument("--evaluate", "x")
				.expect("a/b")
				.runAndAssert();
	}

	@Test
	public void testEvaluateAll() throws Exception {
		justTest("evaluate all variables")
				.justfile("name := \"value\"\nlonger := name + \"!\"\n")
				.argument("--evaluate")
				.expectLines("longer := \"value!\"", "name   := \"value\"")
				.runAndAssert();
	}

	@Test
	public void testEvaluateUnknownVariable() throws Exception {
		justTest("evaluate unknown variable")
				.justfile("name := \"value\"\n")
				.argument("--evaluate", "nope")
				.expectExit(1)
				.expectError("Justfile does not contain variable `nope`.")
				.runAndAssert();
	}

	@Test
	public void testSetOverride() throws Exception {
		justTest("--set override")
				.justfile("x := \"a\"\n\nr:\n    echo {{x}}\n")
				.argument("--set", "x", "b", "r")
				.expectLines("b")
				.runAndAssert();
	}

	@Test
	public void testAssignmentOverride() throws Exception {
		justTest("NAME=VALUE override")
				.justfile("x := \"a\"\n\nr:\n    echo {{x}}\n")
				.argument("x=c", "r")
				.expectLines("c")
				.runAndAssert();
	}

	@Test
	public void testOverrideUnknownVariable() throws Exception {
		justTest("override of unknown variable")
				.justfile("x := \"a\"\n\nr:\n    echo {{x}}\n")
				.argument("y=c", "r")
				.expectExit(1)
				.expectError("Variable `y` overridden on the command line but not present in justfile")
				.runAndAssert();
	}

	@Test
	public void testDumpWithTrailingNewline() throws Exception {
		String justfile = "# (unbalanced\nr:\n    echo 'it''s' $HOME\n";
		justTest("dump with trailing newline")
				.justfile(justfile)
				.argument("--dump")
				.expect(justfile)
				.runAndAssert();
	}

	@Test
	public void testDumpWithoutTrailingNewline() throws Exception {
		String justfile = "r:\n    echo r";
		justTest("dump without trailing newline")
				.justfile(justfile)
				.argument("--dump")
				.expect(justfile)
				.runAndAssert();
	}

	@Test
	public void testUnknownRecipe() throws Exception {
		justTest("unknown recipe")
				.justfile("r:\n    echo r\n")
				.argument("nope")
				.expectExit(1)
				.expectError("Justfile does not contain recipe `nope`.")
				.runAndAssert();
	}

	@Test
	public void testUnknownFlag() throws Exception {
		justTest("unknown flag")
				.justfile("r:\n    echo r\n")
				.argument("--nope")
				.expectExit(1)
				.expectError("Found argument '--nope' that wasn't expected")
				.runAndAssert();
	}

	@Test
	public void testList() throws Exception {
		justTest("--list with docstring")
				.justfile("# say hi\nhello name:\n    echo hi {{name}}\n\n_hidden:\n    echo hidden\n")
				.argument("--list")
				.expectLines("Available recipes:", "    hello name # say hi")
				.runAndAssert();
	}

	@Test
	public void testListWithAliasAndHeading() throws Exception {
		justTest("--list with alias and custom heading")
				.justfile("alias b := build\n\nbuild:\n    echo built\n")
				.argument("--list", "--list-heading", "Recipes:\n", "--list-prefix", "- ")
				.expectLines("Recipes:", "- build", "- b # alias for `build`")
				.runAndAssert();
	}

	@Test
	public void testAlias() throws Exception {
		justTest("alias")
				.justfile("alias b := build\n\nbuild:\n    echo built\n")
				.argument("b")
				.expectLines("built")
				.runAndAssert();
	}

	@Test
	public void testFailingRecipe() throws Exception {
		justTest("failing recipe")
				.justfile("fail:\n    exit 3\n")
				.expectExit(3)
				.expectError("Recipe `fail` failed")
				.expectError("with exit code 3")
				.runAndAssert();
	}

	@Test
	public void testIgnoredError() throws Exception {
		justTest("ignored error")
				.justfile("r:\n    -exit 3\n    echo after\n")
				.expectLines("after")
				.runAndAssert();
	}

	@Test
	public void testShebangRecipe() throws Exception {
		justTest("shebang recipe")
				.justfile("script:\n    #!/bin/sh\n    echo from {{\"shebang\"}}\n")
				.expectLines("from shebang")
				.runAndAssert();
	}

	@Test
	public void testExportedVariable() throws Exception {
		justTest("exported variable")
				.justfile("export GREETING := \"bonjour\"\n\nr:\n    echo $GREETING\n")
				.expectLines("bonjour")
				.runAndAssert();
	}

	@Test
	public void testExportedParameter() throws Exception {
		justTest("exported parameter")
				.justfile("r $WHO:\n    echo hello $WHO\n")
				.argument("r", "world")
				.expectLines("hello world")
				.runAndAssert();
	}

	@Test
	public void testPositionalArguments() throws Exception {
		justTest("positional arguments")
				.justfile("set positional-arguments\n\nr a b:\n    echo $0 $2 $1\n")
				.argument("r", "one", "two")
				.expectLines("r two one")
				.runAndAssert();
	}

	@Test
	public void testDotenvLoad() throws Exception {
		justTest("dotenv load")
				.justfile("set dotenv-load\n\nr:\n    echo $FROM_DOTENV\n")
				.file(".env", "FROM_DOTENV=loaded\n")
				.expectLines("loaded")
				.runAndAssert();
	}

	@Test
	public void testBacktick() throws Exception {
		justTest("backtick")
				.justfile("value := `echo computed`\n\nr:\n    echo {{value}}\n")
				.expectLines("computed")
				.runAndAssert();
	}

	@Test
	public void testBuiltinFunctions() throws Exception {
		justTest("builtin functions")
				.justfile(
						"r:\n"
								+ "    echo {{uppercase(\"abc\")}}\n"
								+ "    echo {{lowercase(\"ABC\")}}\n"
								+ "    echo {{env_var_or_default(\"JUSTSH_SURELY_UNSET\", \"fallback\")}}\n")
				.expectLines("ABC", "abc", "fallback")
				.runAndAssert();
	}

	@Test
	public void testRecursiveJustInvocation() throws Exception {
		justTest("just invocation inside a recipe")
				.justfile("outer:\n    just inner\n\ninner:\n    echo inner\n")
				.expectLines("inner")
				.runAndAssert();
	}

	@Test
	public void testVersion() throws Exception {
		justTest("--version")
				.justfile("r:\n    echo r\n")
				.argument("--version")
				.expectLines("justsh test")
				.runAndAssert();
	}

	@Test
	public void testSummary() throws Exception {
		JustShTestSupport.TestResult result = justTest("--summary")
				.justfile("b:\n    echo b\n\na:\n    echo a\n")
				.argument("--summary")
				.run();
		result.assertExpected();
		assertEquals("a b", result.output().trim());
	}

	@Test
	public void testUnsortedSummary() throws Exception {
		JustShTestSupport.TestResult result = justTest("--summary --unsorted")
				.justfile("b:\n    echo b\n\na:\n    echo a\n")
				.argument("--summary", "-u")
				.run();
		result.assertExpected();
		assertEquals("b a", result.output().trim());
	}

	@Test
	public void testUnsortedList() throws Exception {
		justTest("-u before --list")
				.justfile("b:\n    echo b\n\na:\n    echo a\n")
				.argument("-u", "--list")
				.expectLines("Available recipes:", "    b", "    a")
				.runAndAssert();
	}

	@Test
	public void testHelp() throws Exception {
		JustShTestSupport.TestResult result = justTest("--help")
				.justfile("r:\n    echo r\n")
				.argument("--help")
				.run();
		result.assertExpected();
		assertTrue(result.output().contains("USAGE:"));
		assertTrue(result.output().contains("./just.sh [FLAGS] [OPTIONS] [ARGUMENTS]..."));
		assertTrue(result.output().contains("--choose"));
	}

	@Test
	public void testShortHelp() throws Exception {
		JustShTestSupport.TestResult result = justTest("-h")
				.justfile("r:\n    echo r\n")
				.argument("-h")
				.run();
		result.assertExpected();
		assertTrue(result.output().contains("USAGE:"));
	}

	@Test
	public void testShellOverride() throws Exception {
		justTest("--shell and --shell-arg")
				.justfile("r:\n    echo hi\n")
				.argument("--shell", "sh", "--shell-arg", "-xc", "r")
				.expectLines("hi")
				.expectError("+ echo hi")
				.runAndAssert();
	}

	@Test
	public void testChooseWithCustomChooser() throws Exception {
		justTest("--chooser then --choose")
				.justfile("a:\n    echo A\n\nb:\n    echo B\n\n_hidden:\n    echo hidden\n")
				.argument("--chooser", "cut -d ' ' -f 2", "--choose")
				.expectLines("B")
				.runAndAssert();
	}

	@Test
	public void testChooseSkipsPrivateRecipes() throws Exception {
		justTest("--choose lists public targets")
				.justfile("_hidden:\n    echo hidden\n\na:\n    echo A\n")
				.argument("--chooser", "head -n 1", "--choose")
				.expectLines("A")
				.runAndAssert();
	}

	@Test
	public void testInit() throws Exception {
		JustShTestSupport.TestResult result = justTest("--init")
				.justfile("r:\n    echo r\n")
				.argument("--init")
				.expectFile("justfile", "default:\n    echo 'Hello, world!'\n")
				.run();
		result.assertExpected();
		assertTrue(result.output().startsWith("Wrote justfile to `"));
		assertTrue(result.output().endsWith("/justfile`\n"));
	}

	@Test
	public void testInitKeepsExistingJustfile() throws Exception {
		justTest("--init with an existing justfile")
				.justfile("r:\n    echo r\n")
				.file("justfile", "mine:\n    true\n")
				.argument("--init")
				.expectExit(1)
				.expectError("already exists")
				.expectFile("justfile", "mine:\n    true\n")
				.runAndAssert();
	}

	@Test
	public void testForcedRecipeForcesItsDependencies() throws Exception {
		justTest("after dependency re-runs its own dependencies")
				.justfile("a: b\n    echo a\n\nb:\n    echo b\n\nc: && a\n    echo c\n")
				.argument("a", "c")
				.expectLines("b", "a", "c", "b", "a")
				.runAndAssert();
	}

	@Test
	public void testPlatformDispatch() throws Exception {
		String osName = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
		String expected = osName.contains("linux") ? "linux" : osName.contains("mac") ? "macos" : null;
		assumeTrue("Dispatch is checked on Linux and macOS", expected != null);
		justTest("platform variants")
				.justfile(
						"[linux]\nb:\n    echo linux\n\n[macos]\nb:\n    echo macos\n\n[windows]\nb:\n    echo windows\n")
				.argument("b")
				.expectLines(expected)
				.runAndAssert();
	}

	@Test
	public void testUnixFamilyDispatch() throws Exception {
		justTest("unix variant")
				.justfile("[windows]\nb:\n    echo windows\n\n[unix]\nb:\n    echo unix\n")
				.expectLines("unix")
				.runAndAssert();
	}

	@Test
	public void testParameterLeavesVariableUntouched() throws Exception {
		justTest("parameter shadowing a variable")
				.justfile("name := \"world\"\n\ngreet name:\n    echo {{name}}\n\nhello:\n    echo {{name}}\n")
				.argument("greet", "bob", "hello")
				.expectLines("bob", "world")
				.runAndAssert();
	}

	@Test
	public void testDependencyParameterLeavesCallerParameterUntouched() throws Exception {
		justTest("same parameter name in recipe and dependency")
				.justfile("a x:\n    echo a {{x}}\n\nb x: (a \"inner\")\n    echo b {{x}}\n")
				.argument("b", "outer")
				.expectLines("a inner", "b outer")
				.runAndAssert();
	}

	@Test
	public void testRegexStartingWithDash() throws Exception {
		justTest("regex starting with a dash")
				.justfile("x := if \"-v\" =~ '-v' { \"match\" } else { \"mismatch\" }\n")
				.argument("--evaluate", "x")
				.expect("match")
				.runAndAssert();
	}
}

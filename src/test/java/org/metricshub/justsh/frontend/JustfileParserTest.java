package org.metricshub.justsh.frontend;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.justsh.frontend.ast.Alias;
import org.metricshub.justsh.frontend.ast.Assignment;
import org.metricshub.justsh.frontend.ast.Backtick;
import org.metricshub.justsh.frontend.ast.Comment;
import org.metricshub.justsh.frontend.ast.Condition;
import org.metricshub.justsh.frontend.ast.Conditional;
import org.metricshub.justsh.frontend.ast.DeclarationVisitor;
import org.metricshub.justsh.frontend.ast.Div;
import org.metricshub.justsh.frontend.ast.Export;
import org.metricshub.justsh.frontend.ast.Expression;
import org.metricshub.justsh.frontend.ast.Fragment;
import org.metricshub.justsh.frontend.ast.FunctionCall;
import org.metricshub.justsh.frontend.ast.Item;
import org.metricshub.justsh.frontend.ast.LexerException;
import org.metricshub.justsh.frontend.ast.ParserException;
import org.metricshub.justsh.frontend.ast.Recipe;
import org.metricshub.justsh.frontend.ast.RecipeLine;
import org.metricshub.justsh.frontend.ast.Setting;
import org.metricshub.justsh.frontend.ast.StringLiteral;
import org.metricshub.justsh.frontend.ast.Sum;
import org.metricshub.justsh.frontend.ast.Variable;
import org.metricshub.justsh.frontend.ast.Variadic;

public class JustfileParserTest {

	private static List<Item> parse(String text) {
		return new JustfileParser().parse("test", text);
	}

	private static Expression expression(String text) {
		return new JustfileParser().parseExpression(text);
	}

	private static Assignment assignment(Item item) {
		return item.getDeclaration().accept(new DeclarationVisitor.Default<Assignment>() {
			@Override
			public Assignment visitAssignment(Assignment assignment) {
				return assignment;
			}
		});
	}

	private static Export export(Item item) {
		return item.getDeclaration().accept(new DeclarationVisitor.Default<Export>() {
			@Override
			public Export visitExport(Export export) {
				return export;
			}
		});
	}

	@Test
	public void testEmptyJustfile() {
		assertTrue(parse("").isEmpty());
		assertTrue(parse("\n\n   \n").isEmpty());
	}

	@Test
	public void testSimpleRecipe() {
		List<Item> items = parse("build:\n    cc main.c\n");
		assertEquals(1, items.size());
		Recipe recipe = items.get(0).asRecipe();
		assertNotNull(recipe);
		assertEquals("build", recipe.getName());
		assertTrue(recipe.isEcho());
		assertEquals(1, recipe.getBody().size());
		List<Fragment> fragments = recipe.getBody().get(0).getFragments();
		assertEquals(1, fragments.size());
		assertEquals("cc main.c", fragments.get(0).getText());
		assertEquals(1, items.get(0).getLineNumber());
	}

	@Test
	public void testQuietRecipe() {
		Recipe recipe = parse("@quiet:\n    true\n").get(0).asRecipe();
		assertEquals("quiet", recipe.getName());
		assertFalse(recipe.isEcho());
	}

	@Test
	public void testParameters() {
		Recipe recipe = parse("r a $b c='x' d=(\"y\" + e) *rest:\n    true\n").get(0).asRecipe();
		assertEquals(4, recipe.getParameters().size());
		assertEquals("a", recipe.getParameters().get(0).getName());
		assertFalse(recipe.getParameters().get(0).isExported());
		assertTrue(recipe.getParameters().get(1).isExported());
		assertTrue(recipe.getParameters().get(2).hasDefault());
		assertEquals("x", recipe.getParameters().get(2).getDefaultValue().literalValue());
		assertTrue(recipe.getParameters().get(3).getDefaultValue() instanceof Sum);
		assertEquals(2, recipe.getRequiredParameterCount());
		assertEquals(2, recipe.getDefaultedParameterCount());
		assertEquals(Variadic.Kind.STAR, recipe.getVariadic().getKind());
		assertEquals("rest", recipe.getVariadic().getParameter().getName());
		assertEquals(2, recipe.getMinimumArgumentCount());
	}

	@Test
	public void testPlusVariadicIsRequired() {
		Recipe recipe = parse("r a +$rest:\n    true\n").get(0).asRecipe();
		assertEquals(Variadic.Kind.PLUS, recipe.getVariadic().getKind());
		assertEquals('+', recipe.getVariadic().getKind().getSymbol());
		assertTrue(recipe.getVariadic().getParameter().isExported());
		assertEquals(2, recipe.getMinimumArgumentCount());

		Recipe defaulted = parse("r +rest='x':\n    true\n").get(0).asRecipe();
		assertEquals(0, defaulted.getMinimumArgumentCount());
	}

	@Test
	public void testDependencies() {
		Recipe recipe = parse("r: a (b \"x\" y) && c (d 'z')\n    true\n").get(0).asRecipe();
		assertEquals(2, recipe.getBeforeDependencies().size());
		assertEquals("a", recipe.getBeforeDependencies().get(0).getName());
		assertTrue(recipe.getBeforeDependencies().get(0).getArguments().isEmpty());
		assertEquals("b", recipe.getBeforeDependencies().get(1).getName());
		assertEquals(2, recipe.getBeforeDependencies().get(1).getArguments().size());
		assertTrue(recipe.getBeforeDependencies().get(1).getArguments().get(1) instanceof Variable);
		assertEquals(2, recipe.getAfterDependencies().size());
		assertEquals("c", recipe.getAfterDependencies().get(0).getName());
		assertEquals("z", recipe.getAfterDependencies().get(1).getArguments().get(0).literalValue());
	}

	@Test
	public void testRecipeWithoutBody() {
		List<Item> items = parse("all: a b\n\na:\n    echo a\n\nb:\n    echo b\n");
		assertEquals(3, items.size());
		assertTrue(items.get(0).asRecipe().getBody().isEmpty());
		assertEquals(3, items.get(1).getLineNumber());
		assertEquals(6, items.get(2).getLineNumber());
	}

	@Test
	public void testLinePrefixes() {
		List<RecipeLine> body = parse("r:\n    @-echo x\n    -echo y\n    @echo z\n    echo w\n").get(0).asRecipe().getBody();
		assertEquals(4, body.size());
		assertTrue(body.get(0).isEchoToggled());
		assertTrue(body.get(0).isErrorIgnored());
		assertEquals("echo x", body.get(0).getFragments().get(0).getText());
		assertFalse(body.get(1).isEchoToggled());
		assertTrue(body.get(1).isErrorIgnored());
		assertTrue(body.get(2).isEchoToggled());
		assertFalse(body.get(2).isErrorIgnored());
		assertNull(body.get(3).getPrefix());
	}

	@Test
	public void testInterpolation() {
		List<Fragment> fragments = parse("r a:\n    echo {{ a + \"!\" }} done\n").get(0).asRecipe().getBody().get(0).getFragments();
		assertEquals(3, fragments.size());
		assertEquals("echo ", fragments.get(0).getText());
		assertTrue(fragments.get(1).isInterpolation());
		assertTrue(fragments.get(1).getExpression() instanceof Sum);
		assertEquals(" done", fragments.get(2).getText());
	}

	@Test
	public void testEscapedInterpolation() {
		List<Fragment> fragments = parse("r:\n    echo {{{{literal}}\n").get(0).asRecipe().getBody().get(0).getFragments();
		assertEquals(1, fragments.size());
		assertEquals("echo {{literal}}", fragments.get(0).getText());
	}

	@Test
	public void testBodyKeepsExtraIndentation() {
		List<RecipeLine> body = parse("r:\n\tif true; then\n\t  echo yes\n\tfi\n").get(0).asRecipe().getBody();
		assertEquals(3, body.size());
		assertEquals("  echo yes", body.get(1).getFragments().get(0).getText());
	}

	@Test
	public void testShebangRecipe() {
		Recipe recipe = parse("r:\n    #!/usr/bin/env python3\n    print('hi')\n").get(0).asRecipe();
		assertTrue(recipe.isShebang());
		assertEquals(2, recipe.getBody().size());
	}

	@Test
	public void testAttributes() {
		Item item = parse("[private, no-cd]\n[no-exit-message]\nr:\n    true\n").get(0);
		assertTrue(item.hasAttribute(Item.ATTRIBUTE_PRIVATE));
		assertTrue(item.hasAttribute(Item.ATTRIBUTE_NO_CD));
		assertTrue(item.hasAttribute(Item.ATTRIBUTE_NO_EXIT_MESSAGE));
		assertFalse(item.hasAttribute("linux"));
		assertEquals(3, item.getLineNumber());
	}

	@Test
	public void testAlias() {
		Alias alias = parse("alias b := build\n").get(0).asAlias();
		assertEquals("b", alias.getName());
		assertEquals("build", alias.getTarget());
	}

	@Test
	public void testAssignmentAndExport() {
		List<Item> items = parse("x := \"a\"\nexport Y := x\n");
		assertEquals(2, items.size());
		Assignment x = assignment(items.get(0));
		assertEquals("x", x.getName());
		assertEquals("a", x.getValue().literalValue());
		Export y = export(items.get(1));
		assertEquals("Y", y.getAssignment().getName());
		assertTrue(y.getAssignment().getValue() instanceof Variable);
	}

	@Test
	public void testExportAsVariableName() {
		Assignment assignment = assignment(parse("export := \"e\"\n").get(0));
		assertNotNull(assignment);
		assertEquals("export", assignment.getName());
	}

	@Test
	public void testSettings() {
		List<Item> items = parse(
				"set export\nset fallback := false\nset tempdir := \"/tmp/x\"\nset shell := [\"bash\", \"-uc\",]\n");
		Setting export = items.get(0).asSetting();
		assertEquals(Setting.Kind.BOOLEAN, export.getKind());
		assertTrue(export.getBooleanValue());
		assertFalse(items.get(1).asSetting().getBooleanValue());
		assertEquals("/tmp/x", items.get(2).asSetting().getStringValue());
		assertEquals(Arrays.asList("bash", "-uc"), items.get(3).asSetting().getListValue());
	}

	@Test
	public void testComments() {
		List<Item> items = parse("#!/usr/bin/env just\n# hello world\nr: # trailing\n    true\n");
		assertEquals(2, items.size());
		Comment comment = items.get(0).asComment();
		assertEquals("hello world", comment.getText());
		assertNotNull(items.get(1).asRecipe());
	}

	@Test
	public void testLineContinuation() {
		List<Item> items = parse("x := \"a\" + \\\n    \"b\"\nr:\n    true\n");
		assertTrue(assignment(items.get(0)).getValue() instanceof Sum);
		assertEquals(3, items.get(1).getLineNumber());
	}

	@Test
	public void testCrlf() {
		Recipe recipe = parse("r:\r\n    echo r\r\n").get(0).asRecipe();
		assertEquals("echo r", recipe.getBody().get(0).getFragments().get(0).getText());
	}

	@Test
	public void testStringEscapes() {
		assertEquals("a\tb\n\"c\\d\\q", expression("\"a\\tb\\n\\\"c\\\\d\\q\"").literalValue());
		assertEquals("raw\\n", expression("'raw\\n'").literalValue());
	}

	@Test
	public void testTripleQuotedStrings() {
		assertEquals("a\n  b\n", expression("\"\"\"\n    a\n      b\n\"\"\"").literalValue());
		assertEquals("x\ny\n", expression("'''\n  x\n  y\n'''").literalValue());
	}

	@Test
	public void testBacktick() {
		Expression backtick = expression("`git rev-parse HEAD`");
		assertTrue(backtick instanceof Backtick);
		assertEquals("git rev-parse HEAD", ((Backtick) backtick).getCommand());
	}

	@Test
	public void testSumIsRightAssociative() {
		Sum sum = (Sum) expression("a + \"b\" + c");
		assertTrue(sum.getLeft() instanceof Variable);
		assertTrue(sum.getRight() instanceof Sum);
	}

	@Test
	public void testDivision() {
		Div div = (Div) expression("\"a\" / \"b\" + \"c\"");
		assertEquals("a", div.getLeft().literalValue());
		assertTrue(div.getRight() instanceof Sum);

		Div absolute = (Div) expression("/ \"usr\"");
		assertSame(StringLiteral.EMPTY, absolute.getLeft());
	}

	@Test
	public void testFunctionCall() {
		FunctionCall call = (FunctionCall) expression("env_var_or_default(\"HOME\", x,)");
		assertEquals("env_var_or_default", call.getName());
		assertEquals(2, call.getArguments().size());
		assertTrue(((FunctionCall) expression("arch()")).getArguments().isEmpty());
	}

	@Test
	public void testConditional() {
		Conditional conditional = (Conditional) expression("if os() == \"linux\" { \"l\" } else if a =~ 'b.*' { \"m\" } else { \"o\" }");
		assertEquals(Condition.Operator.EQ, conditional.getCondition().getOperator());
		assertTrue(conditional.getCondition().getLeft() instanceof FunctionCall);
		Conditional nested = (Conditional) conditional.getElseValue();
		assertEquals(Condition.Operator.REGEX_EQ, nested.getCondition().getOperator());
		assertEquals("=~", nested.getCondition().getOperator().getSymbol());
		assertEquals("o", nested.getElseValue().literalValue());
	}

	@Test
	public void testParenthesizedExpression() {
		Sum sum = (Sum) expression("(\"a\" / \"b\") + \"c\"");
		assertTrue(sum.getLeft() instanceof Div);
	}

	@Test
	public void testUnterminatedString() {
		LexerException e = assertThrows(LexerException.class, () -> parse("x := \"a\"\ny := \"abc\n"));
		assertEquals(2, e.getLineNumber());
		assertEquals("test", e.getSourceDescription());
		assertTrue(e.getMessage().contains("Unterminated string"));
	}

	@Test
	public void testUnterminatedBacktick() {
		assertThrows(LexerException.class, () -> parse("x := `ls\n"));
	}

	@Test
	public void testSyntaxError() {
		ParserException e = assertThrows(ParserException.class, () -> parse("r:\n    ok\n!!!\n"));
		assertEquals(3, e.getLineNumber());
	}

	@Test
	public void testTrailingGarbageInExpression() {
		assertThrows(ParserException.class, () -> expression("\"a\" \"b\""));
	}
}

package org.metricshub.justsh;

import static org.junit.Assert.*;

import java.io.StringReader;
import java.util.List;
import org.junit.Test;
import org.metricshub.justsh.frontend.ast.Item;
import org.metricshub.justsh.frontend.ast.ParserException;
import org.metricshub.justsh.semantic.JustfileAnalysis;
import org.metricshub.justsh.semantic.SemanticException;
import org.metricshub.justsh.util.JustShSettings;
import org.metricshub.justsh.util.ScriptSource;

public class JustShTest {

	private static final String JUSTFILE = "name := \"world\"\n\n# greets\nhello:\n    echo hello {{name}}\n";

	@Test
	public void testCompileString() {
		JustSh justSh = new JustSh();
		String script = justSh.compile(JUSTFILE);
		assertTrue(script.startsWith("#!/bin/sh\n"));
		assertTrue(script.contains("FUN_hello() {"));
		assertEquals(3, justSh.getLastItems().size());
	}

	@Test
	public void testCompileReader() throws Exception {
		assertTrue(new JustSh().compile(new StringReader(JUSTFILE)).contains("VAR_name='world'"));
	}

	@Test
	public void testCompileIsDeterministic() throws Exception {
		assertEquals(JustShTestSupport.compile(JUSTFILE), JustShTestSupport.compile(JUSTFILE));
	}

	@Test
	public void testScriptNameFollowsOutput() throws Exception {
		JustShSettings settings = JustShTestSupport.fixedSettings();
		settings.setOutputFilename("out/dir/run.sh");
		String script = new JustSh()
				.compile(new ScriptSource(ScriptSource.DESCRIPTION_INLINE_JUSTFILE, new StringReader(JUSTFILE)), settings);
		assertTrue(script.contains("./run.sh --dump"));

		settings.setOutputFilename("-");
		script = new JustSh()
				.compile(new ScriptSource(ScriptSource.DESCRIPTION_INLINE_JUSTFILE, new StringReader(JUSTFILE)), settings);
		assertTrue(script.contains("./just.sh --dump"));
	}

	@Test
	public void testParseAndAnalyze() {
		JustSh justSh = new JustSh();
		List<Item> items = justSh.parse("inline", JUSTFILE);
		assertSame(items, justSh.getLastItems());
		JustfileAnalysis analysis = justSh.analyze(items);
		assertEquals("greets", analysis.getDocstrings().get("hello"));
	}

	@Test
	public void testParserErrorClearsLastItems() {
		JustSh justSh = new JustSh();
		justSh.parse("inline", JUSTFILE);
		ParserException e = assertThrows(ParserException.class, () -> justSh.parse("broken", "hello:\n    true\n)\n"));
		assertEquals("broken", e.getSourceDescription());
		assertNull(justSh.getLastItems());
	}

	@Test
	public void testSemanticError() {
		SemanticException e = assertThrows(SemanticException.class, () -> new JustSh().compile("x := nope()\n"));
		assertEquals(1, e.getLineNumber());
	}
}

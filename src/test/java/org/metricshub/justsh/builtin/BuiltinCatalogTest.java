package org.metricshub.justsh.builtin;

import static org.junit.Assert.*;

import java.util.Map;
import org.junit.Test;

public class BuiltinCatalogTest {

	@Test
	public void testEverySnippetDefinesItsFunction() {
		Map<String, BuiltinFunction> functions = BuiltinCatalog.listFunctions();
		assertEquals(19, functions.size());
		for (Map.Entry<String, BuiltinFunction> entry : functions.entrySet()) {
			assertEquals(entry.getKey(), entry.getValue().getName());
			assertTrue(entry.getKey(), entry.getValue().getSnippet().contains(entry.getKey() + "() {\n"));
			assertTrue(entry.getKey(), entry.getValue().getSnippet().endsWith("}\n"));
		}
	}

	@Test
	public void testLookup() {
		assertNull(BuiltinCatalog.get("nope"));
		assertEquals(2, BuiltinCatalog.get("env_var_or_default").getArity());
		assertTrue(BuiltinCatalog.get("join").isVarArgs());
		assertEquals("join/2+", BuiltinCatalog.get("join").toString());
	}

	@Test
	public void testCatalogIsReadOnly() {
		assertThrows(UnsupportedOperationException.class, () -> BuiltinCatalog.listFunctions().remove("os"));
	}

	@Test
	public void testArgumentCount() {
		BuiltinCatalog.get("arch").verifyArgCount(0);
		BuiltinCatalog.get("join").verifyArgCount(2);
		BuiltinCatalog.get("join").verifyArgCount(5);
		IllegalArgumentException e = assertThrows(
				IllegalArgumentException.class,
				() -> BuiltinCatalog.get("uppercase").verifyArgCount(2));
		assertEquals("Function 'uppercase' expects 1 argument(s), not 2", e.getMessage());
		assertThrows(IllegalArgumentException.class, () -> BuiltinCatalog.get("join").verifyArgCount(1));
	}

	@Test
	public void testInternalSnippets() {
		assertTrue(BuiltinCatalog.internalSnippet(BuiltinCatalog.BACKTICK_ERROR).startsWith("backtick_error() {"));
		assertTrue(BuiltinCatalog.internalSnippet(BuiltinCatalog.PATH_PREFIX).startsWith("path_prefix() {"));
		assertNull(BuiltinCatalog.get(BuiltinCatalog.BACKTICK_ERROR));
		assertThrows(IllegalStateException.class, () -> BuiltinCatalog.internalSnippet("missing"));
	}
}

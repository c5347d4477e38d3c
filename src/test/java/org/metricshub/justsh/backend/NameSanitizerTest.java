package org.metricshub.justsh.backend;

import static org.junit.Assert.*;

import java.util.HashSet;
import java.util.Set;
import org.junit.Test;

public class NameSanitizerTest {

	@Test
	public void testPrefixes() {
		NameSanitizer names = new NameSanitizer();
		assertEquals("VAR_version", names.variable("version"));
		assertEquals("FUN_build", names.function("build"));
		assertEquals("HAS_RUN_build", names.hasRun("build"));
		assertEquals("FORCE_build", names.force("build"));
		assertEquals("OVERRIDE_VAR_version", names.override("version"));
		assertEquals("HOME", names.plain("HOME"));
	}

	@Test
	public void testDisallowedCharacters() {
		NameSanitizer names = new NameSanitizer();
		assertEquals("FUN_build_all", names.function("build-all"));
		assertEquals("some_name", names.plain("some-name"));
	}

	@Test
	public void testCollisionsGetSuffixes() {
		NameSanitizer names = new NameSanitizer();
		assertEquals("VAR_a_b", names.variable("a-b"));
		assertEquals("VAR_a_b_2", names.variable("a_b"));
		assertEquals("VAR_a_b_3", names.sanitize(NameSanitizer.VARIABLE_PREFIX, "a.b"));
		// stable on repeated lookups
		assertEquals("VAR_a_b", names.variable("a-b"));
		assertEquals("VAR_a_b_2", names.variable("a_b"));
	}

	@Test
	public void testSuffixedNameDoesNotCollide() {
		NameSanitizer names = new NameSanitizer();
		assertEquals("x", names.plain("x"));
		assertEquals("x_2", names.plain("x-2"));
		assertEquals("x_2_2", names.plain("x_2"));
	}

	@Test
	public void testPrefixesDoNotCollide() {
		NameSanitizer names = new NameSanitizer();
		Set<String> identifiers = new HashSet<String>();
		for (String name : new String[] { "a", "a-", "a_", "-a", "_a" }) {
			identifiers.add(names.variable(name));
			identifiers.add(names.function(name));
		}
		assertEquals(10, identifiers.size());
	}
}

package org.metricshub.justsh.backend;

import static org.junit.Assert.*;

import org.junit.Test;

public class ShellQuotingTest {

	@Test
	public void testSingleQuote() {
		assertEquals("'plain'", ShellQuoting.singleQuote("plain"));
		assertEquals("''", ShellQuoting.singleQuote(""));
		assertEquals("'it'\"'\"'s'", ShellQuoting.singleQuote("it's"));
		assertEquals("'$HOME `x` \\n'", ShellQuoting.singleQuote("$HOME `x` \\n"));
	}

	@Test
	public void testDoubleQuote() {
		assertEquals("\"${VAR_x}\"", ShellQuoting.doubleQuote("${VAR_x}"));
		assertEquals("\"a\"'\"'\"b\"", ShellQuoting.doubleQuote("a\"b"));
	}

	@Test
	public void testPadLine() {
		String padded = ShellQuoting.padLine("# Recipes");
		assertEquals(ShellQuoting.LINE_LENGTH, padded.length());
		assertTrue(padded.startsWith("# Recipes "));
		assertTrue(padded.endsWith(" #"));

		StringBuilder longLine = new StringBuilder("#");
		for (int i = 0; i < 100; i++) {
			longLine.append('x');
		}
		assertEquals(longLine + " #", ShellQuoting.padLine(longLine.toString()));
	}

	@Test
	public void testHeaderComment() {
		String[] lines = ShellQuoting.headerComment("Variables").split("\n");
		assertEquals(3, lines.length);
		assertTrue(lines[0].matches("#{89}"));
		assertEquals(lines[0], lines[2]);
		assertTrue(lines[1].startsWith("# Variables "));
		assertEquals(89, lines[1].length());
	}

	@Test
	public void testHeaderCommentWithBlankLines() {
		String[] lines = ShellQuoting.headerComment("\na\n\n").split("\n");
		assertEquals(5, lines.length);
		assertTrue(lines[1].matches("# +#"));
		assertTrue(lines[2].startsWith("# a "));
		assertTrue(lines[3].matches("# +#"));
	}

	@Test
	public void testSha256Hex() {
		assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", ShellQuoting.sha256Hex(""));
		assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", ShellQuoting.sha256Hex("abc"));
	}
}

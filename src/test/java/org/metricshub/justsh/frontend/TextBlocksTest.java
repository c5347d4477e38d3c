package org.metricshub.justsh.frontend;

import static org.junit.Assert.*;

import java.util.Arrays;
import org.junit.Test;

public class TextBlocksTest {

	@Test
	public void testCommonIndentationIsRemoved() {
		assertEquals("a\n  b\nc\n", TextBlocks.dedent("\n    a\n      b\n    c\n"));
	}

	@Test
	public void testBlankLinesBecomeEmpty() {
		assertEquals("a\n\nb\n", TextBlocks.dedent("\n  a\n \n  b\n"));
	}

	@Test
	public void testTrailingBlankLineIsDropped() {
		assertEquals("a\n\nb\n", TextBlocks.dedent("\n  a\n\n  b\n\n"));
	}

	@Test
	public void testUnindentedBlockIsKept() {
		assertEquals("abc", TextBlocks.dedent("abc"));
		assertEquals("a\n b\n", TextBlocks.dedent("\na\n b\n"));
	}

	@Test
	public void testIsBlank() {
		assertTrue(TextBlocks.isBlank(""));
		assertTrue(TextBlocks.isBlank(" \t "));
		assertFalse(TextBlocks.isBlank(" x "));
	}

	@Test
	public void testSplitLines() {
		assertTrue(TextBlocks.splitLines("").isEmpty());
		assertEquals(Arrays.asList("a", "b"), TextBlocks.splitLines("a\nb\n"));
		assertEquals(Arrays.asList("a", "", "b"), TextBlocks.splitLines("a\n\nb"));
	}
}

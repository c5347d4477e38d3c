package org.metricshub.justsh.util;

import static org.junit.Assert.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class ScriptFileSourceTest {

	private Path directory;

	@Before
	public void setUp() throws IOException {
		directory = Files.createTempDirectory("justsh-source");
	}

	@After
	public void tearDown() throws IOException {
		for (String name : ScriptFileSource.DEFAULT_FILE_NAMES) {
			Files.deleteIfExists(directory.resolve(name));
		}
		Files.deleteIfExists(directory);
	}

	private void write(String name, String contents) throws IOException {
		Files.write(directory.resolve(name), contents.getBytes(StandardCharsets.UTF_8));
	}

	@Test
	public void testNothingToDiscover() {
		assertNull(ScriptFileSource.discover(directory));
	}

	@Test
	public void testDiscoveryOrder() throws IOException {
		write(".Justfile", "d");
		assertEquals(directory.resolve(".Justfile").toString(), ScriptFileSource.discover(directory).getFilePath());
		write("Justfile", "c");
		assertEquals(directory.resolve("Justfile").toString(), ScriptFileSource.discover(directory).getFilePath());
		write(".justfile", "b");
		assertEquals(directory.resolve(".justfile").toString(), ScriptFileSource.discover(directory).getFilePath());
		write("justfile", "a");
		ScriptFileSource source = ScriptFileSource.discover(directory);
		assertEquals(directory.resolve("justfile").toString(), source.getFilePath());
		assertEquals("a", source.readFully());
	}

	@Test
	public void testDirectoryIsNotAJustfile() throws IOException {
		Files.createDirectory(directory.resolve("justfile"));
		assertNull(ScriptFileSource.discover(directory));
	}

	@Test
	public void testMissingFile() {
		ScriptFileSource source = new ScriptFileSource(directory.resolve("missing").toString());
		assertThrows(UncheckedIOException.class, source::getReader);
	}
}

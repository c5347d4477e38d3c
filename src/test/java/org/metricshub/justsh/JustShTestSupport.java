package org.metricshub.justsh;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assume.assumeTrue;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.metricshub.justsh.util.JustShSettings;
import org.metricshub.justsh.util.ScriptSource;

/**
 * Reusable helpers for compiling a justfile and running the generated script.
 * The fluent builder ({@link #justTest(String)}) lets tests describe the
 * justfile, extra files, command line and expectations before executing.
 * <p>
 * Scripts are run as <code>sh ./just.sh</code> in a fresh temporary directory; tests
 * are skipped where no POSIX shell is available.
 */
public final class JustShTestSupport {

	/** Name under which generated scripts are written. */
	public static final String SCRIPT_NAME = "just.sh";

	/** Instant the banner of every generated test script is dated with. */
	public static final Instant FIXED_INSTANT = Instant.parse("2024-05-01T12:00:00Z");

	private static final boolean IS_POSIX = !System
			.getProperty("os.name", "")
			.toLowerCase(Locale.ROOT)
			.contains("win") && new File("/bin/sh").canExecute();

	private static final long TIMEOUT_SECONDS = 30;

	private JustShTestSupport() {}

	/**
	 * Creates a builder for a test that compiles a justfile and runs it.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static JustTestBuilder justTest(String description) {
		return new JustTestBuilder(description);
	}

	/**
	 * @return settings with a fixed clock and version, writing {@link #SCRIPT_NAME}
	 */
	public static JustShSettings fixedSettings() {
		JustShSettings settings = new JustShSettings();
		settings.setClock(Clock.fixed(FIXED_INSTANT, ZoneOffset.UTC));
		settings.setToolVersion("test");
		settings.setOutputFilename(SCRIPT_NAME);
		return settings;
	}

	/**
	 * @return {@code true} when generated scripts can be executed here
	 */
	public static boolean isPosix() {
		return IS_POSIX;
	}

	/**
	 * Compiles a justfile with {@link #fixedSettings()}.
	 *
	 * @param justfile the justfile
	 * @return the generated script
	 * @throws IOException never for in-memory sources
	 */
	public static String compile(String justfile) throws IOException {
		return new JustSh()
				.compile(
						new ScriptSource(ScriptSource.DESCRIPTION_INLINE_JUSTFILE, new StringReader(justfile)),
						fixedSettings());
	}

	/**
	 * Output, error output and exit code of one run of a generated script.
	 */
	public static final class TestResult {
		private final String description;
		private final String output;
		private final String error;
		private final int exitCode;
		private final String expectedOutput;
		private final List<String> expectedLines;
		private final int expectedExitCode;
		private final List<String> expectedErrorFragments;
		private final Map<String, String> files;
		private final Map<String, String> expectedFiles;

		TestResult(
				String description,
				String output,
				String error,
				int exitCode,
				String expectedOutput,
				List<String> expectedLines,
				int expectedExitCode,
				List<String> expectedErrorFragments,
				Map<String, String> files,
				Map<String, String> expectedFiles) {
			this.description = description;
			this.output = output;
			this.error = error;
			this.exitCode = exitCode;
			this.expectedOutput = expectedOutput;
			this.expectedLines = expectedLines;
			this.expectedExitCode = expectedExitCode;
			this.expectedErrorFragments = expectedErrorFragments;
			this.files = files;
			this.expectedFiles = expectedFiles;
		}

		public String output() {
			return output;
		}

		public String error() {
			return error;
		}

		public int exitCode() {
			return exitCode;
		}

		/**
		 * @param name name of a file in the working directory of the run
		 * @return its contents once the script finished, {@code null} if absent
		 */
		public String file(String name) {
			return files.get(name);
		}

		/**
		 * Verifies the captured output, error output and exit code against the
		 * expectations defined in the builder.
		 */
		public void assertExpected() {
			if (expectedLines != null) {
				assertEquals("Unexpected output for " + description, expectedLines, lines(output));
			} else if (expectedOutput != null) {
				assertEquals("Unexpected output for " + description, expectedOutput, output);
			}
			for (String fragment : expectedErrorFragments) {
				assertTrue(
						"Error output of " + description + " should contain <" + fragment + "> but was <" + error + ">",
						error.contains(fragment));
			}
			assertEquals(
					"Unexpected exit code for " + description + " (stderr: " + error + ")",
					expectedExitCode,
					exitCode);
			for (Map.Entry<String, String> file : expectedFiles.entrySet()) {
				assertEquals("Unexpected contents of " + file.getKey() + " after " + description, file.getValue(), file(file.getKey()));
			}
		}

		private static List<String> lines(String text) {
			if (text.isEmpty()) {
				return Collections.emptyList();
			}
			String normalized = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
			return Arrays.asList(normalized.split("\n", -1));
		}
	}

	/**
	 * Fluent builder for a compile-and-run test.
	 */
	public static final class JustTestBuilder {
		private final String description;
		private String justfile;
		private final Map<String, String> files = new LinkedHashMap<>();
		private final List<String> arguments = new ArrayList<>();
		private String expectedOutput;
		private List<String> expectedLines;
		private int expectedExitCode;
		private final List<String> expectedErrorFragments = new ArrayList<>();
		private final Map<String, String> expectedFiles = new LinkedHashMap<>();

		private JustTestBuilder(String description) {
			this.description = description;
		}

		/**
		 * @param text contents of the justfile to compile
		 * @return this builder for method chaining
		 */
		public JustTestBuilder justfile(String text) {
			this.justfile = text;
			return this;
		}

		/**
		 * Creates an extra file next to the generated script.
		 *
		 * @param name file name
		 * @param contents file contents
		 * @return this builder for method chaining
		 */
		public JustTestBuilder file(String name, String contents) {
			files.put(name, contents);
			return this;
		}

		/**
		 * @param args command line arguments of the generated script
		 * @return this builder for method chaining
		 */
		public JustTestBuilder argument(String... args) {
			arguments.addAll(Arrays.asList(args));
			return this;
		}

		/**
		 * @param expected exact standard output
		 * @return this builder for method chaining
		 */
		public JustTestBuilder expect(String expected) {
			this.expectedOutput = expected;
			return this;
		}

		/**
		 * @param lines expected standard output, line by line
		 * @return this builder for method chaining
		 */
		public JustTestBuilder expectLines(String... lines) {
			this.expectedLines = Arrays.asList(lines);
			return this;
		}

		/**
		 * @param code expected exit code; zero when not set
		 * @return this builder for method chaining
		 */
		public JustTestBuilder expectExit(int code) {
			this.expectedExitCode = code;
			return this;
		}

		/**
		 * @param fragment text the error output must contain
		 * @return this builder for method chaining
		 */
		public JustTestBuilder expectError(String fragment) {
			expectedErrorFragments.add(fragment);
			return this;
		}

		/**
		 * @param name file the script is expected to leave in its directory
		 * @param contents expected contents of that file
		 * @return this builder for method chaining
		 */
		public JustTestBuilder expectFile(String name, String contents) {
			expectedFiles.put(name, contents);
			return this;
		}

		/**
		 * Compiles, runs and returns the result without asserting it.
		 *
		 * @return the captured result
		 * @throws Exception when compiling or running fails unexpectedly
		 */
		public TestResult run() throws Exception {
			assumeTrue("A POSIX shell is required", IS_POSIX);
			String script = compile(justfile);
			Path directory = Files.createTempDirectory("justsh-test");
			try {
				Path scriptPath = directory.resolve(SCRIPT_NAME);
				Files.write(scriptPath, script.getBytes(StandardCharsets.UTF_8));
				assertTrue(scriptPath.toFile().setExecutable(true));
				for (Map.Entry<String, String> file : files.entrySet()) {
					Files.write(directory.resolve(file.getKey()), file.getValue().getBytes(StandardCharsets.UTF_8));
				}
				List<String> command = new ArrayList<>();
				command.add("sh");
				command.add("./" + SCRIPT_NAME);
				command.addAll(arguments);
				Path stdout = directory.resolve(".stdout");
				Path stderr = directory.resolve(".stderr");
				Process process = new ProcessBuilder(command)
						.directory(directory.toFile())
						.redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")))
						.redirectOutput(stdout.toFile())
						.redirectError(stderr.toFile())
						.start();
				if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
					process.destroyForcibly();
					throw new AssertionError("Timed out running " + description);
				}
				String output = new String(Files.readAllBytes(stdout), StandardCharsets.UTF_8);
				String error = new String(Files.readAllBytes(stderr), StandardCharsets.UTF_8);
				Map<String, String> remaining = new LinkedHashMap<>();
				try (Stream<Path> list = Files.list(directory)) {
					for (Path path : (Iterable<Path>) list::iterator) {
						if (Files.isRegularFile(path)) {
							remaining
									.put(
											path.getFileName().toString(),
											new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
						}
					}
				}
				return new TestResult(
						description,
						output,
						error,
						process.exitValue(),
						expectedOutput,
						expectedLines,
						expectedExitCode,
						expectedErrorFragments,
						remaining,
						expectedFiles);
			} finally {
				deleteRecursively(directory);
			}
		}

		/**
		 * Compiles, runs and asserts the configured expectations.
		 *
		 * @throws Exception when compiling or running fails unexpectedly
		 */
		public void runAndAssert() throws Exception {
			run().assertExpected();
		}
	}

	static void deleteRecursively(Path root) throws IOException {
		if (!Files.exists(root)) {
			return;
		}
		try (Stream<Path> walk = Files.walk(root)) {
			walk.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
		}
	}
}

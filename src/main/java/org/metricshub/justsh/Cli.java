package org.metricshub.justsh;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * JustSh
 * ჻჻჻჻჻჻
 * Copyright (C) 2024 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.metricshub.justsh.frontend.ast.Item;
import org.metricshub.justsh.util.JustShLogger;
import org.metricshub.justsh.util.JustShSettings;
import org.metricshub.justsh.util.JustShVersion;
import org.metricshub.justsh.util.ScriptFileSource;
import org.metricshub.justsh.util.ScriptSource;

/**
 * Command-line interface for JustSh.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "justsh.jar";
		}
		JAR_NAME = myName;
	}

	private final JustShSettings settings = new JustShSettings();
	private final InputStream in;
	private final PrintStream out;
	private final PrintStream err;
	private final Path workingDirectory;

	private String inputFilename;
	private boolean printUsage;
	private boolean printVersion;

	/**
	 * Creates a CLI instance wired to the standard streams and the current
	 * directory.
	 */
	public Cli() {
		this(System.in, System.out, System.err, Paths.get("").toAbsolutePath());
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param in stream read when the justfile is <code>-</code>
	 * @param out stream where the script goes when the output is <code>-</code>
	 * @param err stream for progress messages
	 * @param workingDirectory directory searched for a justfile when none is given
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, PrintStream err, Path workingDirectory) {
		this.in = in;
		this.out = out;
		this.err = err;
		this.workingDirectory = workingDirectory;
	}

	/**
	 * Returns the mutable {@link JustShSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public JustShSettings getSettings() {
		return settings;
	}

	/**
	 * @return the justfile given with <code>-i</code>, or {@code null}
	 */
	public String getInputFilename() {
		return inputFilename;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {
		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.equals("-i") || arg.equals("--infile")) {
				// -i/--infile filename : read the justfile from filename, - for stdin
				checkParameterHasArgument(args, argIdx);
				inputFilename = args[++argIdx];
			} else if (arg.equals("-o") || arg.equals("--outfile")) {
				// -o/--outfile filename : write the script to filename, - for stdout
				checkParameterHasArgument(args, argIdx);
				settings.setOutputFilename(args[++argIdx]);
			} else if (arg.equals("-v") || arg.equals("--verbose")) {
				// -v/--verbose : log parser and analysis details
				settings.setVerbose(true);
			} else if (arg.equals("--dump-syntax")) {
				// --dump-syntax : print the parsed items instead of compiling
				settings.setDumpSyntaxTree(true);
			} else if (arg.equals("--version")) {
				// --version : print the compiler version and exit
				printVersion = true;
			} else if (arg.equals("-h") || arg.equals("-?") || arg.equals("--help")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException if the justfile cannot be read or the script cannot be written
	 * @throws ExitException if no justfile can be found
	 */
	public void run() throws IOException, ExitException {
		if (printUsage) {
			usage(out);
			return;
		}
		if (printVersion) {
			out.println("justsh " + JustShVersion.get() + "  Justfile to POSIX shell script compiler");
			return;
		}
		if (settings.isVerbose()) {
			JustShLogger.enableDebug();
			JustShLogger.getLogger(Cli.class).debug("Settings:\n{}", settings.toDescriptionString());
		}

		ScriptSource source = resolveSource();
		JustSh justSh = new JustSh();

		if (settings.isDumpSyntaxTree()) {
			for (Item item : justSh.parse(source)) {
				item.dump(out);
			}
			return;
		}

		String outputFilename = settings.getOutputFilename(JustShSettings.DEFAULT_OUTPUT_FILENAME);
		err
				.println(
						"Compiling Justfile to shell script: `"
								+ (ScriptSource.DESCRIPTION_STANDARD_INPUT.equals(source.getDescription()) ? "stdin" : source.getDescription())
								+ "` -> `"
								+ ("-".equals(outputFilename) ? "stdout" : outputFilename)
								+ "`");
		String script = justSh.compile(source, settings);
		if ("-".equals(outputFilename)) {
			out.print(script);
			out.flush();
			return;
		}
		Path output = workingDirectory.resolve(outputFilename);
		Files.write(output, script.getBytes(StandardCharsets.UTF_8));
		if (!output.toFile().setExecutable(true)) {
			err.println("Unable to make " + output + " executable");
		}
	}

	private ScriptSource resolveSource() throws ExitException {
		if ("-".equals(inputFilename)) {
			return new ScriptSource(ScriptSource.DESCRIPTION_STANDARD_INPUT, new InputStreamReader(in, StandardCharsets.UTF_8));
		}
		if (inputFilename != null) {
			return new ScriptFileSource(workingDirectory.resolve(inputFilename).toString());
		}
		ScriptFileSource discovered = ScriptFileSource.discover(workingDirectory);
		if (discovered == null) {
			throw new ExitException(1, "No justfile found in " + workingDirectory);
		}
		return discovered;
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-i|--infile justfile]" +
								" [-o|--outfile script]" +
								" [-v|--verbose]" +
								" [--dump-syntax]" +
								" [--version]");
		dest.println();
		dest.println(" -i justfile = Compile justfile, - for the standard input.");
		dest.println("               Defaults to the first of justfile, .justfile, Justfile, .Justfile found.");
		dest.println(" -o script = Write the shell script to script, - for the standard output. Defaults to just.sh.");
		dest.println(" -v = Log parser and analysis details.");
		dest.println(" --dump-syntax = Print the syntax tree instead of compiling.");
		dest.println(" --version = Print the compiler version.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			cli.run();
		} catch (ExitException e) {
			if (e.getMessage() != null) {
				System.err.println(e.getMessage());
			}
			System.exit(e.getCode());
		} catch (CompileException e) {
			if (e.getLineNumber() >= 0) {
				System.err.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
			} else {
				System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			}
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			System.err.println(e.getMessage());
			System.exit(ExitException.EXIT_CODE_USAGE);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}

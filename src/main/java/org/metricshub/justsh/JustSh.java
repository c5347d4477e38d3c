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
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import org.metricshub.justsh.backend.ExpressionEvaluator;
import org.metricshub.justsh.backend.NameSanitizer;
import org.metricshub.justsh.backend.ScriptGenerator;
import org.metricshub.justsh.frontend.JustfileParser;
import org.metricshub.justsh.frontend.ast.Item;
import org.metricshub.justsh.semantic.JustfileAnalysis;
import org.metricshub.justsh.semantic.SemanticAnalyzer;
import org.metricshub.justsh.util.CompileSettings;
import org.metricshub.justsh.util.JustShLogger;
import org.metricshub.justsh.util.JustShSettings;
import org.metricshub.justsh.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the parsing, analysis and code generation of a
 * justfile.
 * <p>
 * Compiling a justfile goes through three stages:
 * <ul>
 * <li>Parse the justfile, producing a list of items.
 * <li>Analyze the items: check settings, recipe names and function calls,
 * and collect what the code generator needs.
 * <li>Generate the shell script.
 * </ul>
 * Any stage may throw a {@link CompileException}; no script is produced in
 * that case. An instance may be reused: every compilation has its own
 * naming context.
 */
public class JustSh {

	private static final Logger LOG = JustShLogger.getLogger(JustSh.class);

	/**
	 * The items parsed by the last compilation.
	 */
	private List<Item> lastItems;

	/**
	 * Returns the items parsed by the last call to one of the
	 * <code>compile</code> or <code>parse</code> methods.
	 *
	 * @return the items, or {@code null} if nothing was parsed yet
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public List<Item> getLastItems() {
		return lastItems;
	}

	/**
	 * Compiles a justfile with the default settings.
	 *
	 * @param justfile contents of the justfile
	 * @return the generated shell script
	 */
	public String compile(String justfile) {
		try {
			return compile(new ScriptSource(ScriptSource.DESCRIPTION_INLINE_JUSTFILE, new StringReader(justfile)));
		} catch (IOException e) {
			throw new IllegalStateException("Reading a string cannot fail", e);
		}
	}

	/**
	 * Compiles a justfile with the default settings.
	 *
	 * @param justfile reader serving the justfile
	 * @return the generated shell script
	 * @throws IOException if the justfile cannot be read
	 */
	public String compile(Reader justfile) throws IOException {
		return compile(new ScriptSource(ScriptSource.DESCRIPTION_INLINE_JUSTFILE, justfile));
	}

	/**
	 * Compiles a justfile with the default settings.
	 *
	 * @param source the justfile
	 * @return the generated shell script
	 * @throws IOException if the justfile cannot be read
	 */
	public String compile(ScriptSource source) throws IOException {
		return compile(source, new JustShSettings());
	}

	/**
	 * Compiles a justfile.
	 *
	 * @param source the justfile
	 * @param settings output file name, banner date and tool version
	 * @return the generated shell script
	 * @throws IOException if the justfile cannot be read
	 */
	public String compile(ScriptSource source, CompileSettings settings) throws IOException {
		String justfile = source.readFully();
		List<Item> items = parse(source.getDescription(), justfile);
		ExpressionEvaluator evaluator = new ExpressionEvaluator(new NameSanitizer());
		JustfileAnalysis analysis = new SemanticAnalyzer(evaluator).analyze(items);
		if (settings.isVerbose()) {
			LOG
					.info(
							"{}: {} recipes, {} variables, {} functions",
							source.getDescription(),
							analysis.getRecipes().size(),
							analysis.getVariables().size(),
							analysis.getFunctions().size());
		}
		String script = new ScriptGenerator(evaluator, settings).generate(analysis, justfile, scriptName(settings));
		LOG.debug("Generated {} characters of shell script", script.length());
		return script;
	}

	/**
	 * Parses a justfile without compiling it.
	 *
	 * @param description name of the justfile, used in error messages
	 * @param justfile contents of the justfile
	 * @return the items of the justfile
	 */
	public List<Item> parse(String description, String justfile) {
		lastItems = null;
		List<Item> items = Collections.unmodifiableList(new JustfileParser().parse(description, justfile));
		lastItems = items;
		return items;
	}

	/**
	 * Parses a justfile without compiling it.
	 *
	 * @param source the justfile
	 * @return the items of the justfile
	 * @throws IOException if the justfile cannot be read
	 */
	public List<Item> parse(ScriptSource source) throws IOException {
		return parse(source.getDescription(), source.readFully());
	}

	/**
	 * Runs the semantic analysis on parsed items, in a fresh naming context.
	 *
	 * @param items items of a justfile
	 * @return the analysis
	 */
	public JustfileAnalysis analyze(List<Item> items) {
		return new SemanticAnalyzer(new ExpressionEvaluator(new NameSanitizer())).analyze(items);
	}

	private static String scriptName(CompileSettings settings) {
		String output = settings.getOutputFilename(JustShSettings.DEFAULT_OUTPUT_FILENAME);
		if ("-".equals(output)) {
			return JustShSettings.DEFAULT_OUTPUT_FILENAME;
		}
		return Paths.get(output).getFileName().toString();
	}
}

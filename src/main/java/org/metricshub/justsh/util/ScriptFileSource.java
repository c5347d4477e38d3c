package org.metricshub.justsh.util;

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

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Represents one justfile read from the file system.
 */
public class ScriptFileSource extends ScriptSource {

	/**
	 * File names probed, in order, when no justfile is given explicitly.
	 */
	public static final List<String> DEFAULT_FILE_NAMES = Collections
			.unmodifiableList(Arrays.asList("justfile", ".justfile", "Justfile", ".Justfile"));

	private String filePath;
	private Reader fileReader;

	/**
	 * <p>
	 * Constructor for ScriptFileSource.
	 * </p>
	 *
	 * @param filePath a {@link java.lang.String} object
	 */
	public ScriptFileSource(String filePath) {
		super(filePath, null);
		this.filePath = filePath;
		this.fileReader = null;
	}

	/**
	 * Looks for the first existing regular file among
	 * {@link #DEFAULT_FILE_NAMES} in the given directory.
	 *
	 * @param directory directory to search
	 * @return the source of the justfile found, or {@code null} if none exists
	 */
	public static ScriptFileSource discover(Path directory) {
		for (String name : DEFAULT_FILE_NAMES) {
			Path candidate = directory.resolve(name);
			if (Files.isRegularFile(candidate)) {
				return new ScriptFileSource(candidate.toString());
			}
		}
		return null;
	}

	/**
	 * <p>
	 * Getter for the field <code>filePath</code>.
	 * </p>
	 *
	 * @return a {@link java.lang.String} object
	 */
	public String getFilePath() {
		return filePath;
	}

	/** {@inheritDoc} */
	@Override
	public Reader getReader() {
		if (fileReader == null) {
			try {
				fileReader = Files.newBufferedReader(Paths.get(filePath), StandardCharsets.UTF_8);
			} catch (IOException ex) {
				throw new UncheckedIOException("Failed to open justfile for reading: " + filePath, ex);
			}
		}

		return fileReader;
	}
}

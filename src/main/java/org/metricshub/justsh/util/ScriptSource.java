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

/**
 * Represents one justfile content source.
 * This is usually either a file found in the working directory,
 * given with the "-i" command line switch, or the standard input.
 */
public class ScriptSource {

	/** Constant <code>DESCRIPTION_STANDARD_INPUT="&lt;stdin&gt;"</code> */
	public static final String DESCRIPTION_STANDARD_INPUT = "<stdin>";

	/** Constant <code>DESCRIPTION_INLINE_JUSTFILE="&lt;inline-justfile&gt;"</code> */
	public static final String DESCRIPTION_INLINE_JUSTFILE = "<inline-justfile>";

	private String description;
	private Reader reader;

	/**
	 * <p>
	 * Constructor for ScriptSource.
	 * </p>
	 *
	 * @param description a {@link java.lang.String} object
	 * @param reader a {@link java.io.Reader} object
	 */
	public ScriptSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * <p>
	 * Getter for the field <code>description</code>.
	 * </p>
	 *
	 * @return a {@link java.lang.String} object
	 */
	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the justfile contents.
	 *
	 * @return The reader which contains the justfile contents.
	 * @throws java.io.IOException if any.
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	/**
	 * Reads the whole source into memory. The code generator needs the exact
	 * text twice: once for parsing and once for the embedded copy printed by
	 * <code>--dump</code>.
	 *
	 * @return the complete contents of this source
	 * @throws IOException when the underlying reader fails
	 */
	public String readFully() throws IOException {
		StringBuilder content = new StringBuilder();
		char[] buffer = new char[8192];
		try (Reader in = getReader()) {
			int read;
			while ((read = in.read(buffer)) != -1) {
				content.append(buffer, 0, read);
			}
		}
		return content.toString();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}

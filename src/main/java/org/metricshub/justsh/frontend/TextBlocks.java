package org.metricshub.justsh.frontend;

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Text helpers for triple-quoted strings and triple backticks.
 */
public final class TextBlocks {

	private TextBlocks() {
		// utility class
	}

	/**
	 * Removes the indentation shared by the lines of a triple-quoted block.
	 * <ul>
	 * <li>one leading newline is dropped;
	 * <li>if the block ends with two newlines, one of them is dropped;
	 * <li>the leading whitespace of the common prefix of the non-blank lines
	 * is removed from every line, and blank lines become empty;
	 * <li>a dedented block always ends with a newline.
	 * </ul>
	 * A block whose lines share no leading whitespace is returned as is,
	 * after the first two steps.
	 *
	 * @param block contents between the triple delimiters
	 * @return the dedented text
	 */
	public static String dedent(String block) {
		String s = block;
		if (s.startsWith("\n")) {
			s = s.substring(1);
		}
		if (s.endsWith("\n\n")) {
			s = s.substring(0, s.length() - 1);
		}
		List<String> lines = splitLines(s);
		String prefix = null;
		for (String line : lines) {
			if (isBlank(line)) {
				continue;
			}
			prefix = prefix == null ? line : commonPrefix(prefix, line);
		}
		if (prefix == null) {
			return s;
		}
		int indent = 0;
		while (indent < prefix.length() && Character.isWhitespace(prefix.charAt(indent))) {
			indent++;
		}
		if (indent == 0) {
			return s;
		}
		StringBuilder result = new StringBuilder(s.length());
		for (int i = 0; i < lines.size(); i++) {
			String line = lines.get(i);
			if (i > 0) {
				result.append('\n');
			}
			if (line.startsWith(prefix)) {
				result.append(line, indent, line.length());
			}
		}
		return result.append('\n').toString();
	}

	/**
	 * @param line one line of text
	 * @return whether it holds nothing but whitespace
	 */
	public static boolean isBlank(String line) {
		return line.trim().isEmpty();
	}

	/**
	 * Splits on newlines. A trailing newline does not start an extra empty
	 * line, and the empty string has no lines.
	 */
	static List<String> splitLines(String s) {
		if (s.isEmpty()) {
			return new ArrayList<String>();
		}
		List<String> lines = new ArrayList<String>(Arrays.asList(s.split("\n", -1)));
		if (s.endsWith("\n")) {
			lines.remove(lines.size() - 1);
		}
		return lines;
	}

	private static String commonPrefix(String a, String b) {
		int n = Math.min(a.length(), b.length());
		int i = 0;
		while (i < n && a.charAt(i) == b.charAt(i)) {
			i++;
		}
		return a.substring(0, i);
	}
}

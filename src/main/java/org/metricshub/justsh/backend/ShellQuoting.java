package org.metricshub.justsh.backend;

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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Quoting and formatting helpers for generated shell source.
 */
public final class ShellQuoting {

	/** Width of the boxed comments of the generated script. */
	public static final int LINE_LENGTH = 89;

	private static final char[] HEX = "0123456789abcdef".toCharArray();

	private ShellQuoting() {
		// utility class
	}

	/**
	 * Single-quotes <code>value</code> for the shell. Embedded single quotes
	 * are spliced in as <code>'"'"'</code>.
	 *
	 * @param value raw text
	 * @return a shell word expanding to exactly <code>value</code>
	 */
	public static String singleQuote(String value) {
		return "'" + value.replace("'", "'\"'\"'") + "'";
	}

	/**
	 * Double-quotes <code>value</code>, leaving parameter expansions and
	 * command substitutions in it active. Embedded double quotes are spliced
	 * in as <code>"'"'"</code>.
	 *
	 * @param value shell text
	 * @return a double-quoted shell word
	 */
	public static String doubleQuote(String value) {
		return "\"" + value.replace("\"", "\"'\"'\"") + "\"";
	}

	/**
	 * Pads a comment line so that it ends with <code> #</code> at
	 * {@link #LINE_LENGTH}. Longer lines only get the terminator.
	 *
	 * @param line the line, starting with <code>#</code>
	 * @return the padded line
	 */
	public static String padLine(String line) {
		String terminator = " #";
		StringBuilder padded = new StringBuilder(line);
		for (int i = line.length() + terminator.length(); i < LINE_LENGTH; i++) {
			padded.append(' ');
		}
		return padded.append(terminator).toString();
	}

	/**
	 * Boxes <code>text</code> in a comment block, one padded line per line
	 * of text, between two lines of <code>#</code>.
	 *
	 * @param text text of the comment
	 * @return the comment block, without a trailing newline
	 */
	public static String headerComment(String text) {
		StringBuilder border = new StringBuilder(LINE_LENGTH);
		for (int i = 0; i < LINE_LENGTH; i++) {
			border.append('#');
		}
		StringBuilder block = new StringBuilder();
		block.append(border).append('\n');
		String[] lines = text.split("\n", -1);
		int count = lines.length;
		if (text.endsWith("\n")) {
			count--;
		}
		for (int i = 0; i < count; i++) {
			block.append(padLine("# " + lines[i])).append('\n');
		}
		return block.append(border).toString();
	}

	/**
	 * @param value text to hash, as UTF-8
	 * @return the lowercase hexadecimal SHA-256 of <code>value</code>
	 */
	public static String sha256Hex(String value) {
		try {
			byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
			StringBuilder hex = new StringBuilder(digest.length * 2);
			for (byte b : digest) {
				hex.append(HEX[(b >> 4) & 0xf]).append(HEX[b & 0xf]);
			}
			return hex.toString();
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 is not available", e);
		}
	}
}

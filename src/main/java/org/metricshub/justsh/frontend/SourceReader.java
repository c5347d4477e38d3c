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

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cursor over the text of a justfile, with backtracking.
 * <p>
 * The text is normalized on construction: CRLF becomes LF, backslash line
 * continuations are folded away, surrounding whitespace is trimmed and a
 * blank line is appended. Line numbers reported by the reader refer to the
 * text as it was given, not to the normalized one.
 * <p>
 * Every failed match is recorded. The failures at the furthest position
 * reached describe what the parser expected there, which is what gets
 * reported when the whole document cannot be parsed.
 */
public class SourceReader {

	private static final Pattern SPACES = Pattern.compile("[ \\t]*");
	private static final Pattern WHITESPACE = Pattern.compile("\\s*");

	private final String description;
	private final String text;
	private final int[] lines;
	private final Matcher matcher;
	private int position;

	private int furthest = -1;
	private final Set<String> expected = new LinkedHashSet<String>();

	/**
	 * <p>
	 * Constructor for SourceReader.
	 * </p>
	 *
	 * @param description name of the source, used in error messages
	 * @param raw text of the justfile, as read
	 */
	public SourceReader(String description, String raw) {
		this.description = description;
		String normalized = raw.replace("\r\n", "\n");
		StringBuilder folded = new StringBuilder(normalized.length() + 2);
		int[] lineOf = new int[normalized.length() + 2];
		int line = 1;
		int i = 0;
		while (i < normalized.length()) {
			int end = continuationEnd(normalized, i);
			if (end > i) {
				for (int j = i; j < end; j++) {
					if (normalized.charAt(j) == '\n') {
						line++;
					}
				}
				i = end;
				continue;
			}
			char c = normalized.charAt(i);
			lineOf[folded.length()] = line;
			folded.append(c);
			if (c == '\n') {
				line++;
			}
			i++;
		}

		// trim, keeping the line numbers aligned
		int start = 0;
		int stop = folded.length();
		while (start < stop && Character.isWhitespace(folded.charAt(start))) {
			start++;
		}
		while (stop > start && Character.isWhitespace(folded.charAt(stop - 1))) {
			stop--;
		}
		int lastLine = stop > start ? lineOf[stop - 1] : 1;
		this.text = folded.substring(start, stop) + "\n\n";
		this.lines = new int[text.length() + 1];
		System.arraycopy(lineOf, start, lines, 0, stop - start);
		Arrays.fill(lines, stop - start, lines.length, lastLine);
		lines[stop - start + 1] = lastLine + 1;
		lines[lines.length - 1] = lastLine + 1;
		this.matcher = Pattern.compile("").matcher(text);
		this.position = 0;
	}

	/**
	 * A backslash, optional blanks, a newline and the whitespace that
	 * follows it join two lines.
	 *
	 * @return the end of the continuation starting at <code>i</code>, or
	 *         <code>i</code> if there is none
	 */
	private static int continuationEnd(String s, int i) {
		if (s.charAt(i) != '\\') {
			return i;
		}
		int j = i + 1;
		while (j < s.length() && (s.charAt(j) == ' ' || s.charAt(j) == '\t')) {
			j++;
		}
		if (j >= s.length() || s.charAt(j) != '\n') {
			return i;
		}
		j++;
		while (j < s.length() && Character.isWhitespace(s.charAt(j))) {
			j++;
		}
		return j;
	}

	public String getDescription() {
		return description;
	}

	/**
	 * @return the normalized text being read
	 */
	public String getText() {
		return text;
	}

	/**
	 * @return the current position, to be given back to {@link #reset(int)}
	 */
	public int mark() {
		return position;
	}

	public void reset(int mark) {
		position = mark;
	}

	public boolean atEnd() {
		return position >= text.length();
	}

	/**
	 * @return the current character, or <code>0</code> at the end of the text
	 */
	public char peek() {
		return atEnd() ? 0 : text.charAt(position);
	}

	/**
	 * @param offset distance from the current position
	 * @return the character at that distance, or <code>0</code> past the end
	 */
	public char peek(int offset) {
		int at = position + offset;
		return at < text.length() ? text.charAt(at) : 0;
	}

	/**
	 * Moves one character forward.
	 *
	 * @return the character passed
	 */
	public char next() {
		return text.charAt(position++);
	}

	/**
	 * @param literal text to look for
	 * @return whether the text at the current position starts with
	 *         <code>literal</code>; nothing is consumed
	 */
	public boolean lookingAt(String literal) {
		return text.startsWith(literal, position);
	}

	/**
	 * Consumes <code>literal</code> if the text continues with it.
	 *
	 * @param literal text to match
	 * @return whether it matched
	 */
	public boolean literal(String literal) {
		if (text.startsWith(literal, position)) {
			position += literal.length();
			return true;
		}
		fail("'" + literal + "'");
		return false;
	}

	/**
	 * Consumes the match of <code>pattern</code> anchored at the current
	 * position.
	 *
	 * @param pattern pattern to match
	 * @param label what the pattern stands for in error messages
	 * @return the matched text, or {@code null} if the pattern does not match
	 */
	public String regex(Pattern pattern, String label) {
		matcher.usePattern(pattern);
		matcher.region(position, text.length());
		if (matcher.lookingAt()) {
			position = matcher.end();
			return matcher.group();
		}
		fail(label);
		return null;
	}

	/**
	 * Consumes blanks, staying on the current line.
	 *
	 * @return the number of characters consumed
	 */
	public int spaces() {
		return regex(SPACES, "spaces").length();
	}

	/**
	 * Consumes any whitespace, newlines included.
	 *
	 * @return the number of characters consumed
	 */
	public int whitespace() {
		return regex(WHITESPACE, "whitespace").length();
	}

	/**
	 * Consumes the rest of the current line, not its newline.
	 *
	 * @return the text consumed
	 */
	public String restOfLine() {
		int end = text.indexOf('\n', position);
		if (end < 0) {
			end = text.length();
		}
		String rest = text.substring(position, end);
		position = end;
		return rest;
	}

	/**
	 * Records that <code>what</code> was expected at the current position.
	 *
	 * @param what description of the expected token
	 */
	public void fail(String what) {
		if (position > furthest) {
			furthest = position;
			expected.clear();
		}
		if (position == furthest) {
			expected.add(what);
		}
	}

	/**
	 * @return 1-based line of the current position in the original text
	 */
	public int getLineNumber() {
		return lineAt(position);
	}

	/**
	 * @return 1-based column of the current position in the normalized text
	 */
	public int getColumn() {
		return columnAt(position);
	}

	/**
	 * @return 1-based line of the furthest position a match was attempted at
	 */
	public int getFurthestLineNumber() {
		return lineAt(Math.max(furthest, position));
	}

	/**
	 * @return 1-based column of the furthest position a match was attempted at
	 */
	public int getFurthestColumn() {
		return columnAt(Math.max(furthest, position));
	}

	/**
	 * @return a sentence describing what was expected at the furthest
	 *         position and what was found there instead
	 */
	public String describeFurthestFailure() {
		int at = Math.max(furthest, position);
		String found;
		if (at >= text.length() - 2 && text.substring(at).trim().isEmpty()) {
			found = "end of file";
		} else if (text.charAt(at) == '\n') {
			found = "end of line";
		} else {
			found = "'" + text.charAt(at) + "'";
		}
		if (expected.isEmpty() || furthest < position) {
			return "Unexpected " + found;
		}
		return "Expected one of " + String.join(", ", expected) + " but found " + found;
	}

	private int lineAt(int at) {
		return lines[Math.min(at, lines.length - 1)];
	}

	private int columnAt(int at) {
		int lineStart = text.lastIndexOf('\n', Math.min(at, text.length()) - 1) + 1;
		return at - lineStart + 1;
	}
}

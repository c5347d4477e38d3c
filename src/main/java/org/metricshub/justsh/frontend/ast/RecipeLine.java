package org.metricshub.justsh.frontend.ast;

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
import java.util.Collections;
import java.util.List;

/**
 * One line of a recipe body, without its indentation.
 */
public final class RecipeLine extends AstNode {

	private final String prefix;
	private final List<Fragment> fragments;

	/**
	 * @param prefix one of <code>@</code>, <code>-</code>, <code>@-</code>,
	 *        <code>-@</code>, or {@code null}
	 * @param fragments the text and interpolations of the line
	 */
	public RecipeLine(String prefix, List<Fragment> fragments) {
		this.prefix = prefix;
		this.fragments = Collections.unmodifiableList(new ArrayList<Fragment>(fragments));
	}

	public String getPrefix() {
		return prefix;
	}

	public List<Fragment> getFragments() {
		return fragments;
	}

	/**
	 * @return {@code true} when the <code>@</code> prefix inverts echoing
	 */
	public boolean isEchoToggled() {
		return prefix != null && prefix.indexOf('@') >= 0;
	}

	/**
	 * @return {@code true} when the <code>-</code> prefix ignores failures
	 */
	public boolean isErrorIgnored() {
		return prefix != null && prefix.indexOf('-') >= 0;
	}

	/**
	 * @param marker text to look for
	 * @return {@code true} when the line opens with literal text starting with <code>marker</code>
	 */
	public boolean startsWithText(String marker) {
		return !fragments.isEmpty() && !fragments.get(0).isInterpolation() && fragments.get(0).getText().startsWith(marker);
	}

	@Override
	public String toString() {
		return "Line(" + (prefix == null ? "" : prefix + " ") + fragments + ")";
	}
}

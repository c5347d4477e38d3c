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

import java.io.PrintStream;
import java.util.Collections;
import java.util.List;

/**
 * Base of every node produced by the justfile parser. Nodes are immutable
 * once built.
 */
public abstract class AstNode {

	/**
	 * Dump a meaningful text representation of this
	 * abstract syntax tree node to the output (print)
	 * stream. Either it is called directly by the
	 * application program, or it is called by the
	 * parent node of this tree node.
	 *
	 * @param ps The print stream to dump the text
	 *        representation.
	 */
	public void dump(PrintStream ps) {
		dump(ps, 0);
	}

	private void dump(PrintStream ps, int lvl) {
		StringBuilder spaces = new StringBuilder();
		for (int i = 0; i < lvl; i++) {
			spaces.append(' ');
		}
		ps.println(spaces + describe());
		for (AstNode child : children()) {
			child.dump(ps, lvl + 1);
		}
	}

	/**
	 * @return the one-line label printed by {@link #dump(PrintStream)}
	 */
	protected String describe() {
		return toString();
	}

	/**
	 * @return the nodes printed below this one by {@link #dump(PrintStream)}
	 */
	protected List<? extends AstNode> children() {
		return Collections.emptyList();
	}
}

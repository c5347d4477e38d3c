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

/**
 * <code>if condition { then } else { otherwise }</code>. An
 * <code>else if</code> chain nests another conditional in the else branch.
 */
public final class Conditional extends Expression {

	private final Condition condition;
	private final Expression thenValue;
	private final Expression elseValue;

	public Conditional(Condition condition, Expression thenValue, Expression elseValue) {
		this.condition = condition;
		this.thenValue = thenValue;
		this.elseValue = elseValue;
	}

	public Condition getCondition() {
		return condition;
	}

	public Expression getThenValue() {
		return thenValue;
	}

	public Expression getElseValue() {
		return elseValue;
	}

	@Override
	public <T> T accept(ExpressionVisitor<T> visitor) {
		return visitor.visitConditional(this);
	}

	@Override
	public String toString() {
		return "Conditional(" + condition + ", " + thenValue + ", " + elseValue + ")";
	}
}

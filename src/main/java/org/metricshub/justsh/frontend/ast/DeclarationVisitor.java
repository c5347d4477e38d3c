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
 * One method per kind of {@link Declaration}.
 *
 * @param <T> result of a visit
 */
public interface DeclarationVisitor<T> {

	T visitRecipe(Recipe recipe);

	T visitAlias(Alias alias);

	T visitAssignment(Assignment assignment);

	T visitExport(Export export);

	T visitSetting(Setting setting);

	T visitComment(Comment comment);

	/**
	 * Visitor that ignores every declaration except the ones a subclass
	 * overrides.
	 *
	 * @param <T> result of a visit
	 */
	abstract class Default<T> implements DeclarationVisitor<T> {

		/**
		 * @return the value returned by every method that is not overridden
		 */
		protected T fallback() {
			return null;
		}

		@Override
		public T visitRecipe(Recipe recipe) {
			return fallback();
		}

		@Override
		public T visitAlias(Alias alias) {
			return fallback();
		}

		@Override
		public T visitAssignment(Assignment assignment) {
			return fallback();
		}

		@Override
		public T visitExport(Export export) {
			return fallback();
		}

		@Override
		public T visitSetting(Setting setting) {
			return fallback();
		}

		@Override
		public T visitComment(Comment comment) {
			return fallback();
		}
	}
}

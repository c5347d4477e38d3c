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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A top-level entry of a justfile: one declaration with the attributes
 * written on the lines above it.
 */
public final class Item extends AstNode {

	/** Marks a recipe or alias as hidden from listings. */
	public static final String ATTRIBUTE_PRIVATE = "private";

	/** Runs a recipe in the current directory. */
	public static final String ATTRIBUTE_NO_CD = "no-cd";

	/** Suppresses the error message of a failing recipe. */
	public static final String ATTRIBUTE_NO_EXIT_MESSAGE = "no-exit-message";

	private final Set<String> attributes;
	private final Declaration declaration;
	private final int lineNumber;

	public Item(List<String> attributes, Declaration declaration, int lineNumber) {
		this.attributes = Collections.unmodifiableSet(new LinkedHashSet<String>(attributes));
		this.declaration = declaration;
		this.lineNumber = lineNumber;
	}

	/**
	 * @return the attribute names, in the order they were first written
	 */
	public Set<String> getAttributes() {
		return attributes;
	}

	public boolean hasAttribute(String name) {
		return attributes.contains(name);
	}

	public Declaration getDeclaration() {
		return declaration;
	}

	/**
	 * @return the declared recipe, or {@code null} if this item declares something else
	 */
	public Recipe asRecipe() {
		return declaration.accept(new DeclarationVisitor.Default<Recipe>() {
			@Override
			public Recipe visitRecipe(Recipe recipe) {
				return recipe;
			}
		});
	}

	/**
	 * @return the declared alias, or {@code null} if this item declares something else
	 */
	public Alias asAlias() {
		return declaration.accept(new DeclarationVisitor.Default<Alias>() {
			@Override
			public Alias visitAlias(Alias alias) {
				return alias;
			}
		});
	}

	/**
	 * @return the comment, or {@code null} if this item declares something else
	 */
	public Comment asComment() {
		return declaration.accept(new DeclarationVisitor.Default<Comment>() {
			@Override
			public Comment visitComment(Comment comment) {
				return comment;
			}
		});
	}

	/**
	 * @return the setting, or {@code null} if this item declares something else
	 */
	public Setting asSetting() {
		return declaration.accept(new DeclarationVisitor.Default<Setting>() {
			@Override
			public Setting visitSetting(Setting setting) {
				return setting;
			}
		});
	}

	/**
	 * @return 1-based line of the declaration in the justfile
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	@Override
	protected String describe() {
		return "Item(line " + lineNumber + ", attributes " + new ArrayList<String>(attributes) + ")";
	}

	@Override
	protected List<? extends AstNode> children() {
		return Collections.singletonList(declaration);
	}

	@Override
	public String toString() {
		return "Item(" + new ArrayList<String>(attributes) + ", " + declaration + ")";
	}
}

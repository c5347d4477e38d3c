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
 * <code>set name [:= value]</code>. The value is a boolean, a string or a
 * list of strings; whether it suits the setting is checked after parsing.
 */
public final class Setting extends Declaration {

	/**
	 * Shape of the value.
	 */
	public enum Kind {
		BOOLEAN,
		STRING,
		LIST
	}

	private final String name;
	private final Kind kind;
	private final boolean booleanValue;
	private final String stringValue;
	private final List<String> listValue;

	private Setting(String name, Kind kind, boolean booleanValue, String stringValue, List<String> listValue) {
		this.name = name;
		this.kind = kind;
		this.booleanValue = booleanValue;
		this.stringValue = stringValue;
		this.listValue = listValue;
	}

	/**
	 * @param name setting name
	 * @param value the value; a bare <code>set name</code> means {@code true}
	 * @return a boolean setting
	 */
	public static Setting ofBoolean(String name, boolean value) {
		return new Setting(name, Kind.BOOLEAN, value, null, null);
	}

	public static Setting ofString(String name, String value) {
		return new Setting(name, Kind.STRING, false, value, null);
	}

	public static Setting ofList(String name, List<String> value) {
		return new Setting(name, Kind.LIST, false, null, Collections.unmodifiableList(new ArrayList<String>(value)));
	}

	public String getName() {
		return name;
	}

	public Kind getKind() {
		return kind;
	}

	public boolean getBooleanValue() {
		return booleanValue;
	}

	public String getStringValue() {
		return stringValue;
	}

	public List<String> getListValue() {
		return listValue;
	}

	@Override
	public <T> T accept(DeclarationVisitor<T> visitor) {
		return visitor.visitSetting(this);
	}

	@Override
	public String toString() {
		String value;
		switch (kind) {
		case BOOLEAN:
			value = String.valueOf(booleanValue);
			break;
		case STRING:
			value = Expression.canonicalString(stringValue);
			break;
		default:
			value = listValue.toString();
			break;
		}
		return "Setting(" + name + " := " + value + ")";
	}
}

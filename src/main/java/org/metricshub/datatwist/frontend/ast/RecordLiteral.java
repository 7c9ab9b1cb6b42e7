package org.metricshub.datatwist.frontend.ast;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * DataTwist
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
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

import java.util.List;

/**
 * {@code {key: value key: value}}. Fields keep their declaration order and
 * keys are unique within one record.
 */
public final class RecordLiteral extends SyntaxNode {

	/**
	 * A {@code key: value} pair.
	 */
	public static final class Field {

		private final String key;
		private final SyntaxNode value;
		private final SourceSpan span;

		public Field(String key, SyntaxNode value, SourceSpan span) {
			this.key = required(key, "Field key");
			this.value = required(value, "Field value");
			this.span = required(span, "Field span");
		}

		public String getKey() {
			return key;
		}

		public SyntaxNode getValue() {
			return value;
		}

		public SourceSpan getSpan() {
			return span;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Field)) {
				return false;
			}
			Field other = (Field) o;
			return key.equals(other.key) && value.equals(other.value);
		}

		@Override
		public int hashCode() {
			return 31 * key.hashCode() + value.hashCode();
		}

		@Override
		public String toString() {
			return key + ": " + value;
		}
	}

	private final List<Field> fields;

	public RecordLiteral(List<Field> fields, SourceSpan span) {
		super(span);
		this.fields = immutableList(fields, "Record fields");
	}

	public List<Field> getFields() {
		return fields;
	}

	/**
	 * @param key field key
	 * @return the value of the field, or {@code null} if the record has no such field
	 */
	public SyntaxNode get(String key) {
		for (Field field : fields) {
			if (field.getKey().equals(key)) {
				return field.getValue();
			}
		}
		return null;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.RECORD_LITERAL;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitRecordLiteral(this);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof RecordLiteral && fields.equals(((RecordLiteral) o).fields);
	}

	@Override
	public int hashCode() {
		return fields.hashCode();
	}

	@Override
	public String toString() {
		return "Record" + fields;
	}
}

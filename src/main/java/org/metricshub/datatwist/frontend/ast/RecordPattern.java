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
 * {@code {name status: "vip" tier: t other: _}}: matches records, binding or
 * constraining some of their fields.
 */
public final class RecordPattern extends Pattern {

	/**
	 * What a record pattern says about one field.
	 */
	public enum Constraint {
		/** {@code field} or {@code field: name}: the value is bound to a name */
		BIND,
		/** {@code field: "literal"}: the value must equal the literal */
		LITERAL,
		/** {@code field: _}: the field must be present */
		PRESENT
	}

	/**
	 * Constraint on one field of the matched record.
	 */
	public static final class FieldPattern {

		private final String field;
		private final Constraint constraint;
		private final String binding;
		private final SyntaxNode literal;
		private final SourceSpan span;

		private FieldPattern(String field, Constraint constraint, String binding, SyntaxNode literal, SourceSpan span) {
			this.field = required(field, "Pattern field");
			this.constraint = constraint;
			this.binding = binding;
			this.literal = literal;
			this.span = required(span, "Pattern field span");
		}

		public static FieldPattern bind(String field, String binding, SourceSpan span) {
			return new FieldPattern(field, Constraint.BIND, required(binding, "Binding"), null, span);
		}

		public static FieldPattern literal(String field, SyntaxNode literal, SourceSpan span) {
			return new FieldPattern(field, Constraint.LITERAL, null, required(literal, "Literal"), span);
		}

		public static FieldPattern present(String field, SourceSpan span) {
			return new FieldPattern(field, Constraint.PRESENT, null, null, span);
		}

		public String getField() {
			return field;
		}

		public Constraint getConstraint() {
			return constraint;
		}

		/**
		 * @return the bound name for {@link Constraint#BIND}, {@code null} otherwise
		 */
		public String getBinding() {
			return binding;
		}

		/**
		 * @return the required value for {@link Constraint#LITERAL}, {@code null} otherwise
		 */
		public SyntaxNode getLiteral() {
			return literal;
		}

		public SourceSpan getSpan() {
			return span;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof FieldPattern)) {
				return false;
			}
			FieldPattern other = (FieldPattern) o;
			return field.equals(other.field)
					&& constraint == other.constraint
					&& (binding == null ? other.binding == null : binding.equals(other.binding))
					&& (literal == null ? other.literal == null : literal.equals(other.literal));
		}

		@Override
		public int hashCode() {
			int h = field.hashCode();
			h = 31 * h + constraint.hashCode();
			h = 31 * h + (binding == null ? 0 : binding.hashCode());
			return 31 * h + (literal == null ? 0 : literal.hashCode());
		}

		@Override
		public String toString() {
			switch (constraint) {
			case LITERAL:
				return field + ": " + literal;
			case PRESENT:
				return field + ": _";
			default:
				return field.equals(binding) ? field : field + ": " + binding;
			}
		}
	}

	private final List<FieldPattern> fields;

	public RecordPattern(List<FieldPattern> fields, SourceSpan span) {
		super(span);
		this.fields = immutableList(fields, "Record pattern fields");
	}

	public List<FieldPattern> getFields() {
		return fields;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.RECORD_PATTERN;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitRecordPattern(this);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof RecordPattern && fields.equals(((RecordPattern) o).fields);
	}

	@Override
	public int hashCode() {
		return fields.hashCode();
	}

	@Override
	public String toString() {
		return "RecordPattern" + fields;
	}
}

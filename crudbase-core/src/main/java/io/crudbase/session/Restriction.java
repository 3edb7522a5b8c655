/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.session;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A predicate on one persistent field of the queried entity: either
 * equality with a single value, or membership in a collection of values.
 */
public final class Restriction {

	public enum Kind {
		EQUAL,
		IN
	}

	private final String field;
	private final Kind kind;
	private final Object value;

	private Restriction(String field, Kind kind, Object value) {
		this.field = Objects.requireNonNull( field );
		this.kind = kind;
		this.value = value;
	}

	public static Restriction equal(String field, Object value) {
		return new Restriction( field, Kind.EQUAL, Objects.requireNonNull( value ) );
	}

	public static Restriction in(String field, Collection<?> values) {
		return new Restriction( field, Kind.IN, List.copyOf( values ) );
	}

	public String getField() {
		return field;
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * The value to compare with, or the {@code List} of candidate values
	 * when the kind is {@link Kind#IN}.
	 */
	public Object getValue() {
		return value;
	}

	public List<?> getValues() {
		return kind == Kind.IN ? (List<?>) value : List.of( value );
	}

	@Override
	public boolean equals(Object o) {
		if ( this == o ) {
			return true;
		}
		if ( o == null || getClass() != o.getClass() ) {
			return false;
		}
		Restriction that = (Restriction) o;
		return field.equals( that.field ) && kind == that.kind && value.equals( that.value );
	}

	@Override
	public int hashCode() {
		return Objects.hash( field, kind, value );
	}

	@Override
	public String toString() {
		return kind == Kind.EQUAL
				? field + " = " + value
				: field + " in " + value;
	}
}

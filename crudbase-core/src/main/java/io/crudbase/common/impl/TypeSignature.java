/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.common.impl;

import java.util.Objects;

/**
 * The four type arguments of a specialization: entity, create payload,
 * update payload and filter payload. Two signatures are equal when they
 * name the very same classes.
 */
public final class TypeSignature {

	private final Class<?> entityType;
	private final Class<?> createType;
	private final Class<?> updateType;
	private final Class<?> filterType;

	public TypeSignature(Class<?> entityType, Class<?> createType, Class<?> updateType, Class<?> filterType) {
		this.entityType = entityType;
		this.createType = createType;
		this.updateType = updateType;
		this.filterType = filterType;
	}

	public Class<?> getEntityType() {
		return entityType;
	}

	public Class<?> getCreateType() {
		return createType;
	}

	public Class<?> getUpdateType() {
		return updateType;
	}

	public Class<?> getFilterType() {
		return filterType;
	}

	@Override
	public boolean equals(Object o) {
		if ( this == o ) {
			return true;
		}
		if ( o == null || getClass() != o.getClass() ) {
			return false;
		}
		TypeSignature that = (TypeSignature) o;
		return entityType == that.entityType
				&& createType == that.createType
				&& updateType == that.updateType
				&& filterType == that.filterType;
	}

	@Override
	public int hashCode() {
		return Objects.hash( entityType, createType, updateType, filterType );
	}

	@Override
	public String toString() {
		return "[" + name( entityType )
				+ "," + name( createType )
				+ "," + name( updateType )
				+ "," + name( filterType ) + "]";
	}

	private static String name(Class<?> type) {
		return type == null ? "null" : type.getSimpleName();
	}
}

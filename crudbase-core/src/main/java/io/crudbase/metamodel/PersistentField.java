/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.metamodel;

import java.lang.invoke.MethodType;
import java.lang.invoke.VarHandle;

/**
 * A named, typed persistent field of an {@link EntityDescriptor entity}.
 * <p>
 * Reads and writes go straight to the field, bypassing accessor methods,
 * which matches field-based access in Hibernate.
 */
public final class PersistentField {

	private final String name;
	private final Class<?> type;
	private final VarHandle handle;

	PersistentField(String name, Class<?> type, VarHandle handle) {
		this.name = name;
		this.type = type;
		this.handle = handle;
	}

	public String getName() {
		return name;
	}

	public Class<?> getType() {
		return type;
	}

	/**
	 * Whether values of the given type can be assigned to this field,
	 * boxing and unboxing included.
	 */
	public boolean isAssignableFrom(Class<?> valueType) {
		return wrap( type ).isAssignableFrom( wrap( valueType ) );
	}

	/**
	 * Whether the value can be assigned to this field. A {@code null} can
	 * not be assigned to a primitive field.
	 */
	public boolean accepts(Object value) {
		return value == null ? !type.isPrimitive() : wrap( type ).isInstance( value );
	}

	public Object get(Object entity) {
		return handle.get( entity );
	}

	public void set(Object entity, Object value) {
		handle.set( entity, value );
	}

	private static Class<?> wrap(Class<?> type) {
		return type.isPrimitive() ? MethodType.methodType( type ).wrap().returnType() : type;
	}

	@Override
	public String toString() {
		return name + ":" + type.getSimpleName();
	}
}

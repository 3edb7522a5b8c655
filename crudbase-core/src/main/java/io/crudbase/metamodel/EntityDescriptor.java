/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.metamodel;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.invoke.VarHandle;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

import io.crudbase.logging.impl.Log;
import io.crudbase.logging.impl.LoggerFactory;

import jakarta.persistence.Entity;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.Transient;

/**
 * Describes a mapped entity class: its name, its persistent fields, and how
 * to instantiate it.
 * <p>
 * The persistent fields are the instance fields of the class and of its
 * {@link MappedSuperclass} or {@link Entity} superclasses, minus the ones
 * that are {@code transient} or annotated {@link Transient}. Descriptors are
 * computed once per class and never change afterwards.
 *
 * @param <E> the entity class
 */
public final class EntityDescriptor<E> {

	private static final Log LOG = LoggerFactory.make( Log.class, MethodHandles.lookup() );

	private static final String ENHANCEMENT_PREFIX = "$$_hibernate_";

	private static final ClassValue<EntityDescriptor<?>> DESCRIPTORS = new ClassValue<>() {
		@Override
		protected EntityDescriptor<?> computeValue(Class<?> type) {
			return new EntityDescriptor<>( type );
		}
	};

	private final Class<E> entityClass;
	private final String entityName;
	private final Map<String, PersistentField> fields;
	private final MethodHandle constructor;
	private final Throwable constructorFailure;

	private EntityDescriptor(Class<E> entityClass) {
		this.entityClass = entityClass;
		this.entityName = entityName( entityClass );
		this.fields = Collections.unmodifiableMap( collectFields( entityClass ) );
		MethodHandle found = null;
		Throwable failure = null;
		try {
			found = MethodHandles.privateLookupIn( entityClass, MethodHandles.lookup() )
					.findConstructor( entityClass, MethodType.methodType( void.class ) );
		}
		catch (NoSuchMethodException | IllegalAccessException e) {
			failure = e;
		}
		this.constructor = found;
		this.constructorFailure = failure;
	}

	/**
	 * Whether the given type is marked as a mapped entity.
	 */
	public static boolean isEntity(Class<?> type) {
		return type != null && type.isAnnotationPresent( Entity.class );
	}

	/**
	 * The descriptor of the given entity class.
	 *
	 * @throws io.crudbase.exception.CrudValidationException if the class is not annotated {@link Entity}
	 */
	@SuppressWarnings("unchecked")
	public static <E> EntityDescriptor<E> of(Class<E> entityClass) {
		if ( !isEntity( entityClass ) ) {
			throw LOG.notAnEntityType( entityClass == null ? "null" : entityClass.getName() );
		}
		return (EntityDescriptor<E>) DESCRIPTORS.get( entityClass );
	}

	public Class<E> getEntityClass() {
		return entityClass;
	}

	/**
	 * The entity name, as given by {@link Entity#name()}, or the simple class
	 * name when none is given.
	 */
	public String getEntityName() {
		return entityName;
	}

	/**
	 * The persistent fields by name, superclass fields first.
	 */
	public Map<String, PersistentField> getFields() {
		return fields;
	}

	public boolean hasField(String name) {
		return fields.containsKey( name );
	}

	/**
	 * @return the field, or {@code null} if the entity maps no such field
	 */
	public PersistentField getField(String name) {
		return fields.get( name );
	}

	/**
	 * A new, transient instance created through the no-argument constructor.
	 */
	@SuppressWarnings("unchecked")
	public E instantiate() {
		if ( constructor == null ) {
			throw LOG.noDefaultConstructor( entityName, constructorFailure );
		}
		try {
			return (E) constructor.invoke();
		}
		catch (RuntimeException | Error e) {
			throw e;
		}
		catch (Throwable t) {
			throw LOG.couldNotInstantiate( entityName, t );
		}
	}

	@Override
	public String toString() {
		return entityName + fields.values();
	}

	private static String entityName(Class<?> entityClass) {
		final Entity entity = entityClass.getAnnotation( Entity.class );
		return entity == null || entity.name().isEmpty()
				? entityClass.getSimpleName()
				: entity.name();
	}

	private static Map<String, PersistentField> collectFields(Class<?> entityClass) {
		final Deque<Class<?>> hierarchy = new ArrayDeque<>();
		for ( Class<?> type = entityClass; type != null && type != Object.class; type = type.getSuperclass() ) {
			if ( type != entityClass
					&& !type.isAnnotationPresent( MappedSuperclass.class )
					&& !type.isAnnotationPresent( Entity.class ) ) {
				break;
			}
			hierarchy.push( type );
		}

		final Map<String, PersistentField> fields = new LinkedHashMap<>();
		for ( Class<?> type : hierarchy ) {
			final MethodHandles.Lookup lookup = lookupIn( type );
			for ( Field field : type.getDeclaredFields() ) {
				if ( isPersistent( field ) ) {
					fields.put( field.getName(), new PersistentField( field.getName(), field.getType(), varHandle( lookup, field ) ) );
				}
			}
		}
		return fields;
	}

	private static boolean isPersistent(Field field) {
		final int modifiers = field.getModifiers();
		return !Modifier.isStatic( modifiers )
				&& !Modifier.isTransient( modifiers )
				&& !field.isSynthetic()
				&& !field.getName().startsWith( ENHANCEMENT_PREFIX )
				&& !field.isAnnotationPresent( Transient.class );
	}

	private static MethodHandles.Lookup lookupIn(Class<?> type) {
		try {
			return MethodHandles.privateLookupIn( type, MethodHandles.lookup() );
		}
		catch (IllegalAccessException e) {
			throw new IllegalStateException( "Cannot access the fields of " + type.getName(), e );
		}
	}

	private static VarHandle varHandle(MethodHandles.Lookup lookup, Field field) {
		try {
			return lookup.unreflectVarHandle( field );
		}
		catch (IllegalAccessException e) {
			throw new IllegalStateException( "Cannot access field " + field, e );
		}
	}
}

/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.metamodel;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.crudbase.logging.impl.Log;
import io.crudbase.logging.impl.LoggerFactory;

/**
 * Describes a payload type: a {@link Record} whose components carry the
 * input of an operation.
 * <p>
 * A component is <em>explicitly set</em> when its value is not {@code null}.
 * Components declared as {@link Optional} let the caller set a field to
 * {@code null}: an empty {@code Optional} is an explicit {@code null}, while
 * a {@code null} {@code Optional} is a component left unset.
 *
 * @param <P> the payload record type
 */
public final class PayloadDescriptor<P> {

	private static final Log LOG = LoggerFactory.make( Log.class, MethodHandles.lookup() );

	private static final ClassValue<PayloadDescriptor<?>> DESCRIPTORS = new ClassValue<>() {
		@Override
		protected PayloadDescriptor<?> computeValue(Class<?> type) {
			return new PayloadDescriptor<>( type );
		}
	};

	private final Class<P> payloadClass;
	private final List<Component> components;

	private PayloadDescriptor(Class<P> payloadClass) {
		this.payloadClass = payloadClass;
		this.components = Collections.unmodifiableList( components( payloadClass ) );
	}

	/**
	 * Whether the given type can be used as a payload.
	 */
	public static boolean isPayload(Class<?> type) {
		return type != null && type.isRecord();
	}

	@SuppressWarnings("unchecked")
	public static <P> PayloadDescriptor<P> of(Class<P> payloadClass) {
		if ( !isPayload( payloadClass ) ) {
			throw new IllegalArgumentException( "Not a record: " + payloadClass );
		}
		return (PayloadDescriptor<P>) DESCRIPTORS.get( payloadClass );
	}

	public Class<P> getPayloadClass() {
		return payloadClass;
	}

	/**
	 * The component names, in declaration order.
	 */
	public List<String> getComponentNames() {
		final List<String> names = new ArrayList<>( components.size() );
		for ( Component component : components ) {
			names.add( component.name );
		}
		return names;
	}

	/**
	 * The type of the values a component sets: its declared type, or the
	 * type argument of an {@link Optional} component. {@code null} when the
	 * type argument is not a concrete class.
	 *
	 * @throws IllegalArgumentException if there is no such component
	 */
	public Class<?> getValueType(String componentName) {
		for ( Component component : components ) {
			if ( component.name.equals( componentName ) ) {
				return component.valueType;
			}
		}
		throw new IllegalArgumentException( "No component '" + componentName + "' in " + payloadClass.getName() );
	}

	/**
	 * The explicitly set components, with {@link Optional} values unwrapped.
	 */
	public Map<String, Object> explicitlySet(P payload) {
		final Map<String, Object> values = new LinkedHashMap<>();
		for ( Component component : components ) {
			final Object value = component.read( payload );
			if ( value instanceof Optional ) {
				values.put( component.name, ( (Optional<?>) value ).orElse( null ) );
			}
			else if ( value != null ) {
				values.put( component.name, value );
			}
		}
		return values;
	}

	@Override
	public String toString() {
		return payloadClass.getSimpleName() + getComponentNames();
	}

	private static List<Component> components(Class<?> payloadClass) {
		final MethodHandles.Lookup lookup;
		try {
			lookup = MethodHandles.privateLookupIn( payloadClass, MethodHandles.lookup() );
		}
		catch (IllegalAccessException e) {
			throw new IllegalStateException( "Cannot access the components of " + payloadClass.getName(), e );
		}
		final List<Component> components = new ArrayList<>();
		for ( RecordComponent component : payloadClass.getRecordComponents() ) {
			try {
				components.add( new Component(
						payloadClass,
						component.getName(),
						valueType( component ),
						lookup.unreflect( component.getAccessor() )
				) );
			}
			catch (IllegalAccessException e) {
				throw LOG.couldNotReadComponent( payloadClass.getName(), component.getName(), e );
			}
		}
		return components;
	}

	private static Class<?> valueType(RecordComponent component) {
		if ( component.getType() != Optional.class ) {
			return component.getType();
		}
		if ( component.getGenericType() instanceof ParameterizedType ) {
			final Type argument = ( (ParameterizedType) component.getGenericType() ).getActualTypeArguments()[0];
			if ( argument instanceof Class ) {
				return (Class<?>) argument;
			}
			if ( argument instanceof ParameterizedType ) {
				return (Class<?>) ( (ParameterizedType) argument ).getRawType();
			}
		}
		// Optional<?>, Optional<T> or a raw Optional
		return null;
	}

	private static final class Component {
		private final Class<?> owner;
		private final String name;
		private final Class<?> valueType;
		private final MethodHandle accessor;

		private Component(Class<?> owner, String name, Class<?> valueType, MethodHandle accessor) {
			this.owner = owner;
			this.name = name;
			this.valueType = valueType;
			this.accessor = accessor;
		}

		Object read(Object payload) {
			try {
				return accessor.invoke( payload );
			}
			catch (RuntimeException | Error e) {
				throw e;
			}
			catch (Throwable t) {
				throw LOG.couldNotReadComponent( owner.getName(), name, t );
			}
		}
	}
}

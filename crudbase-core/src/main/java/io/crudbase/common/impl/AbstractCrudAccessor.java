/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.common.impl;

import java.lang.invoke.MethodHandles;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.crudbase.CrudSpecialization;
import io.crudbase.exception.CrudException;
import io.crudbase.logging.impl.Log;
import io.crudbase.logging.impl.LoggerFactory;
import io.crudbase.metamodel.EntityDescriptor;
import io.crudbase.metamodel.PayloadDescriptor;
import io.crudbase.metamodel.PersistentField;
import io.crudbase.session.EntityQuery;
import io.crudbase.session.Restriction;

import jakarta.persistence.PersistenceException;

import static io.crudbase.util.impl.CompletionStages.unwrap;

/**
 * The part of the CRUD algorithm that does not depend on how the session is
 * called: turning payloads into entities, field assignments and queries.
 * <p>
 * The blocking and the non-blocking accessors extend this class and only
 * decide how the session calls are sequenced.
 *
 * @param <E> the entity type
 * @param <C> the create payload type
 * @param <U> the update payload type
 * @param <F> the filter payload type
 */
public abstract class AbstractCrudAccessor<E, C, U, F> {

	private static final Log LOG = LoggerFactory.make( Log.class, MethodHandles.lookup() );

	private final CrudSpecialization<E, C, U, F> specialization;
	private final EntityDescriptor<E> entityDescriptor;
	private final String idFieldName;
	private final PersistentField idField;

	/**
	 * @throws io.crudbase.exception.CrudConfigurationException if the
	 * specialization or the session is missing, or if the entity does not
	 * map the identifier field
	 */
	protected AbstractCrudAccessor(CrudSpecialization<E, C, U, F> specialization, Object session, String idFieldName) {
		if ( specialization == null ) {
			throw LOG.notSpecialized();
		}
		if ( session == null ) {
			throw LOG.nullSession();
		}
		this.specialization = specialization;
		this.entityDescriptor = specialization.getEntityDescriptor();
		this.idField = idFieldName == null ? null : entityDescriptor.getField( idFieldName );
		if ( idField == null ) {
			throw LOG.unknownIdentifierField( entityDescriptor.getEntityName(), idFieldName );
		}
		this.idFieldName = idFieldName;
	}

	public CrudSpecialization<E, C, U, F> getSpecialization() {
		return specialization;
	}

	public String getIdFieldName() {
		return idFieldName;
	}

	protected String entityName() {
		return entityDescriptor.getEntityName();
	}

	protected Object identifierOf(E entity) {
		return idField.get( entity );
	}

	/**
	 * A new transient entity carrying the non-null components of the
	 * payload. Fields the payload leaves null keep the value the entity
	 * class initializes them with.
	 */
	protected E newEntity(C payload) {
		PayloadValidation.validate( payload );
		final Map<String, Object> values = specialization.getCreateDescriptor().explicitlySet( payload );
		checkAssignable( values );
		final E entity = entityDescriptor.instantiate();
		assign( entity, values );
		return entity;
	}

	/**
	 * The fields an update assigns: the explicitly set components of the
	 * payload that the entity maps.
	 *
	 * @throws io.crudbase.exception.CrudValidationException if there is no such
	 * field, or if a value cannot be assigned to its field
	 */
	protected Map<String, Object> updatedFields(Object id, U payload) {
		PayloadValidation.validate( payload );
		final PayloadDescriptor<U> descriptor = specialization.getUpdateDescriptor();
		final Map<String, Object> updates = new LinkedHashMap<>();
		for ( Map.Entry<String, Object> entry : descriptor.explicitlySet( payload ).entrySet() ) {
			if ( entityDescriptor.hasField( entry.getKey() ) ) {
				updates.put( entry.getKey(), entry.getValue() );
			}
			else {
				LOG.ignoringUnmappedField( entityName(), entry.getKey(), descriptor.getPayloadClass().getSimpleName() );
			}
		}
		if ( updates.isEmpty() ) {
			throw LOG.nothingToUpdate( entityName(), idFieldName, id );
		}
		checkAssignable( updates );
		return updates;
	}

	/**
	 * @throws io.crudbase.exception.CrudValidationException if a value, an
	 * explicit {@code null} for a primitive field included, does not fit its field
	 */
	private void checkAssignable(Map<String, Object> values) {
		for ( Map.Entry<String, Object> entry : values.entrySet() ) {
			final PersistentField field = entityDescriptor.getField( entry.getKey() );
			if ( !field.accepts( entry.getValue() ) ) {
				throw LOG.incompatibleValue( entityName(), field.getName(), entry.getValue(), field.getType().getName() );
			}
		}
	}

	protected void assign(E entity, Map<String, Object> values) {
		for ( Map.Entry<String, Object> entry : values.entrySet() ) {
			entityDescriptor.getField( entry.getKey() ).set( entity, entry.getValue() );
		}
	}

	/**
	 * The query selecting the entities matching the filter, with the
	 * offset applied before the limit.
	 *
	 * @param limit the maximum number of results, or {@code null}
	 * @param offset the number of results to skip, or {@code null}
	 * @param filter the filter, or {@code null} to select every entity
	 */
	protected EntityQuery<E> selectQuery(Integer limit, Integer offset, F filter) {
		if ( limit != null && limit < 0 ) {
			throw LOG.negativeLimit( limit );
		}
		if ( offset != null && offset < 0 ) {
			throw LOG.negativeOffset( offset );
		}
		return new EntityQuery<>( entityDescriptor.getEntityClass(), restrictions( filter ), offset, limit );
	}

	protected EntityQuery<E> identifierQuery(Object id) {
		return new EntityQuery<>(
				entityDescriptor.getEntityClass(),
				List.of( Restriction.equal( idFieldName, id ) ),
				null,
				1
		);
	}

	/**
	 * One restriction per filter component that is set and mapped by the
	 * entity. A {@code null} component is skipped, it never means
	 * {@code is null}.
	 */
	protected List<Restriction> restrictions(F filter) {
		if ( filter == null ) {
			return List.of();
		}
		final PayloadDescriptor<F> descriptor = specialization.getFilterDescriptor();
		final List<Restriction> restrictions = new ArrayList<>();
		for ( Map.Entry<String, Object> entry : descriptor.explicitlySet( filter ).entrySet() ) {
			final String name = entry.getKey();
			final Object value = entry.getValue();
			final PersistentField field = entityDescriptor.getField( name );
			if ( field == null ) {
				LOG.ignoringUnmappedField( entityName(), name, descriptor.getPayloadClass().getSimpleName() );
			}
			else if ( value != null ) {
				restrictions.add( restriction( field, value ) );
			}
		}
		return restrictions;
	}

	private static Restriction restriction(PersistentField field, Object value) {
		if ( value instanceof Collection ) {
			return Restriction.in( field.getName(), withoutNulls( (Collection<?>) value ) );
		}
		if ( value.getClass().isArray() && !field.getType().isArray() ) {
			final int length = Array.getLength( value );
			final List<Object> values = new ArrayList<>( length );
			for ( int i = 0; i < length; i++ ) {
				values.add( Array.get( value, i ) );
			}
			return Restriction.in( field.getName(), withoutNulls( values ) );
		}
		return Restriction.equal( field.getName(), value );
	}

	private static List<Object> withoutNulls(Collection<?> values) {
		final List<Object> result = new ArrayList<>( values.size() );
		for ( Object value : values ) {
			if ( value != null ) {
				result.add( value );
			}
		}
		return result;
	}

	protected static <T> T first(List<T> results) {
		return results.isEmpty() ? null : results.get( 0 );
	}

	/**
	 * Whether the failure comes from the store, as opposed to a mistake of
	 * the caller. Only store failures are logged by the accessors.
	 */
	protected static boolean isStorageFailure(Throwable failure) {
		final Throwable cause = unwrap( failure );
		return cause instanceof PersistenceException && !( cause instanceof CrudException );
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + specialization.getSignature() + "(" + idFieldName + ")";
	}
}

/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.List;

import io.crudbase.common.impl.TypeSignature;
import io.crudbase.logging.impl.Log;
import io.crudbase.logging.impl.LoggerFactory;
import io.crudbase.metamodel.EntityDescriptor;
import io.crudbase.metamodel.PayloadDescriptor;
import io.crudbase.metamodel.PersistentField;
import io.crudbase.mutiny.MutinyCrudAccessor;
import io.crudbase.session.CrudSession;
import io.crudbase.session.ReactiveCrudSession;
import io.crudbase.stage.StageCrudAccessor;

/**
 * The generic accessor bound to concrete types: an entity class, the record
 * used to create it, the record used to update it, and the record used to
 * filter it.
 * <p>
 * Obtained from {@link Crud#specialize(Class, Class, Class, Class)}, which
 * returns the same instance for the same four classes as long as it is
 * referenced. A specialization is immutable and can be shared between
 * threads; the accessors it creates cannot.
 *
 * @param <E> the entity type
 * @param <C> the create payload type
 * @param <U> the update payload type
 * @param <F> the filter payload type
 */
public final class CrudSpecialization<E, C, U, F> {

	private static final Log LOG = LoggerFactory.make( Log.class, MethodHandles.lookup() );

	private final TypeSignature signature;
	private final EntityDescriptor<E> entityDescriptor;
	private final PayloadDescriptor<C> createDescriptor;
	private final PayloadDescriptor<U> updateDescriptor;
	private final PayloadDescriptor<F> filterDescriptor;

	private CrudSpecialization(
			TypeSignature signature,
			EntityDescriptor<E> entityDescriptor,
			PayloadDescriptor<C> createDescriptor,
			PayloadDescriptor<U> updateDescriptor,
			PayloadDescriptor<F> filterDescriptor) {
		this.signature = signature;
		this.entityDescriptor = entityDescriptor;
		this.createDescriptor = createDescriptor;
		this.updateDescriptor = updateDescriptor;
		this.filterDescriptor = filterDescriptor;
	}

	/**
	 * Validate the type arguments and build the specialization.
	 *
	 * @throws io.crudbase.exception.CrudValidationException if the entity
	 * type is not an entity, if a payload type is not a record, if the
	 * create payload has components the entity does not map, or if a create
	 * or update component cannot be assigned to the field it names
	 */
	static <E, C, U, F> CrudSpecialization<E, C, U, F> create(
			Class<E> entityType,
			Class<C> createType,
			Class<U> updateType,
			Class<F> filterType) {
		final TypeSignature signature = new TypeSignature( entityType, createType, updateType, filterType );
		final EntityDescriptor<E> entityDescriptor = EntityDescriptor.of( entityType );
		if ( !PayloadDescriptor.isPayload( createType ) ) {
			throw LOG.createPayloadNotARecord( createType.getName() );
		}
		if ( !PayloadDescriptor.isPayload( updateType ) ) {
			throw LOG.updatePayloadNotARecord( updateType.getName() );
		}
		if ( !PayloadDescriptor.isPayload( filterType ) ) {
			throw LOG.filterPayloadNotARecord( filterType.getName() );
		}
		final PayloadDescriptor<C> createDescriptor = PayloadDescriptor.of( createType );
		final List<String> unmapped = new ArrayList<>();
		for ( String component : createDescriptor.getComponentNames() ) {
			if ( !entityDescriptor.hasField( component ) ) {
				unmapped.add( component );
			}
		}
		if ( !unmapped.isEmpty() ) {
			throw LOG.createPayloadHasUnmappedFields( createType.getName(), entityDescriptor.getEntityName(), unmapped );
		}
		final PayloadDescriptor<U> updateDescriptor = PayloadDescriptor.of( updateType );
		checkComponentTypes( entityDescriptor, createDescriptor );
		checkComponentTypes( entityDescriptor, updateDescriptor );
		final CrudSpecialization<E, C, U, F> specialization = new CrudSpecialization<>(
				signature,
				entityDescriptor,
				createDescriptor,
				updateDescriptor,
				PayloadDescriptor.of( filterType )
		);
		LOG.specialized( signature.toString() );
		return specialization;
	}

	/**
	 * Every component that names a persistent field must carry values the
	 * field can hold. Components the entity does not map are skipped.
	 */
	private static void checkComponentTypes(EntityDescriptor<?> entityDescriptor, PayloadDescriptor<?> payloadDescriptor) {
		for ( String component : payloadDescriptor.getComponentNames() ) {
			final PersistentField field = entityDescriptor.getField( component );
			final Class<?> valueType = payloadDescriptor.getValueType( component );
			if ( field != null && valueType != null && !field.isAssignableFrom( valueType ) ) {
				throw LOG.incompatibleComponentType(
						payloadDescriptor.getPayloadClass().getName(),
						component,
						valueType.getName(),
						entityDescriptor.getEntityName(),
						field.getType().getName()
				);
			}
		}
	}

	/**
	 * A blocking accessor working with the given session.
	 *
	 * @param session the session the operations run against
	 * @param idFieldName the name of the entity field identifying an entity
	 *
	 * @throws io.crudbase.exception.CrudConfigurationException if the
	 * session is null or the entity has no such field
	 */
	public CrudAccessor<E, C, U, F> accessor(CrudSession session, String idFieldName) {
		return new CrudAccessor<>( this, session, idFieldName );
	}

	/**
	 * A non-blocking accessor with a {@link java.util.concurrent.CompletionStage}-based API.
	 *
	 * @see #accessor(CrudSession, String)
	 */
	public StageCrudAccessor<E, C, U, F> stage(ReactiveCrudSession session, String idFieldName) {
		return new StageCrudAccessor<>( this, session, idFieldName );
	}

	/**
	 * A non-blocking accessor with a Mutiny {@link io.smallrye.mutiny.Uni}-based API.
	 *
	 * @see #accessor(CrudSession, String)
	 */
	public MutinyCrudAccessor<E, C, U, F> mutiny(ReactiveCrudSession session, String idFieldName) {
		return new MutinyCrudAccessor<>( this, session, idFieldName );
	}

	public TypeSignature getSignature() {
		return signature;
	}

	public EntityDescriptor<E> getEntityDescriptor() {
		return entityDescriptor;
	}

	public PayloadDescriptor<C> getCreateDescriptor() {
		return createDescriptor;
	}

	public PayloadDescriptor<U> getUpdateDescriptor() {
		return updateDescriptor;
	}

	public PayloadDescriptor<F> getFilterDescriptor() {
		return filterDescriptor;
	}

	public Class<E> getEntityType() {
		return entityDescriptor.getEntityClass();
	}

	@Override
	public String toString() {
		return "CrudSpecialization" + signature;
	}
}

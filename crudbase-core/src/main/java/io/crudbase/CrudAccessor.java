/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase;

import java.lang.invoke.MethodHandles;
import java.util.List;
import java.util.Map;

import io.crudbase.common.impl.AbstractCrudAccessor;
import io.crudbase.logging.impl.Log;
import io.crudbase.logging.impl.LoggerFactory;
import io.crudbase.session.CrudSession;

import jakarta.persistence.PersistenceException;

/**
 * Blocking CRUD operations on one entity type.
 * <p>
 * Every operation runs to completion on the calling thread and is a single
 * unit of work: it either commits or fails. Failures raised by the store
 * are logged and rethrown as they are; nothing is retried.
 * <p>
 * An accessor is not thread-safe, since the {@link CrudSession} it works
 * with is not.
 *
 * @param <E> the entity type
 * @param <C> the create payload type
 * @param <U> the update payload type
 * @param <F> the filter payload type
 *
 * @see Crud#specialize(Class, Class, Class, Class)
 * @see io.crudbase.stage.StageCrudAccessor
 */
public class CrudAccessor<E, C, U, F> extends AbstractCrudAccessor<E, C, U, F> {

	private static final Log LOG = LoggerFactory.make( Log.class, MethodHandles.lookup() );

	private final CrudSession session;

	/**
	 * @throws io.crudbase.exception.CrudConfigurationException if the
	 * specialization or the session is missing, or if the entity has no
	 * field named {@code idFieldName}
	 */
	public CrudAccessor(CrudSpecialization<E, C, U, F> specialization, CrudSession session, String idFieldName) {
		super( specialization, session, idFieldName );
		this.session = session;
	}

	public CrudSession getSession() {
		return session;
	}

	/**
	 * Create a new entity from the payload.
	 *
	 * @return the entity after the commit, with its generated values
	 *
	 * @throws jakarta.validation.ConstraintViolationException if the payload violates its constraints
	 * @throws PersistenceException if the store rejects the entity
	 */
	public E create(C payload) {
		LOG.creating( entityName(), payload );
		final E entity = newEntity( payload );
		try {
			session.persist( entity );
			session.commit();
			session.refresh( entity );
		}
		catch (PersistenceException e) {
			LOG.createFailed( entityName(), e );
			throw e;
		}
		LOG.created( entityName(), getIdFieldName(), identifierOf( entity ) );
		return entity;
	}

	/**
	 * Every entity, in the order the store returns them.
	 */
	public List<E> read() {
		return read( null, null, null );
	}

	/**
	 * The entities matching the filter.
	 */
	public List<E> read(F filter) {
		return read( null, null, filter );
	}

	/**
	 * A page of entities.
	 */
	public List<E> read(Integer limit, Integer offset) {
		return read( limit, offset, null );
	}

	/**
	 * A page of the entities matching the filter.
	 * <p>
	 * Each non-null component of the filter that names a persistent field
	 * restricts the result to the entities whose field equals the value or,
	 * for a collection or an array, is one of its elements.
	 *
	 * @param limit the maximum number of results, or {@code null}
	 * @param offset the number of results to skip, or {@code null}
	 * @param filter the filter, or {@code null}
	 *
	 * @return the matches, possibly none
	 */
	public List<E> read(Integer limit, Integer offset, F filter) {
		LOG.reading( entityName(), limit, offset, filter );
		final List<E> results = session.list( selectQuery( limit, offset, filter ) );
		LOG.retrieved( entityName(), results.size() );
		return results;
	}

	/**
	 * @return the entity with the given identifier, or {@code null} if there is none
	 */
	public E readById(Object id) {
		LOG.readingById( entityName(), getIdFieldName(), id );
		final E entity = id == null ? null : first( session.list( identifierQuery( id ) ) );
		if ( entity == null ) {
			LOG.notFound( entityName(), getIdFieldName(), id );
			return null;
		}
		LOG.found( entityName(), getIdFieldName(), id );
		return entity;
	}

	/**
	 * Assign the explicitly set fields of the payload to an existing entity.
	 *
	 * @return the entity after the commit
	 *
	 * @throws io.crudbase.exception.CrudValidationException if the payload sets no field of the entity
	 * @throws jakarta.persistence.EntityNotFoundException if there is no entity with the given identifier
	 * @throws PersistenceException if the store rejects the change
	 */
	public E update(Object id, U payload) {
		final Map<String, Object> updates = updatedFields( id, payload );
		final E entity = readById( id );
		if ( entity == null ) {
			throw LOG.noEntityToUpdate( entityName(), getIdFieldName(), id );
		}
		LOG.updating( entityName(), getIdFieldName(), id, updates.keySet() );
		assign( entity, updates );
		try {
			session.commit();
			session.refresh( entity );
		}
		catch (PersistenceException e) {
			LOG.updateFailed( entityName(), getIdFieldName(), id, e );
			throw e;
		}
		LOG.updated( entityName(), getIdFieldName(), id );
		return entity;
	}

	/**
	 * Delete the entity with the given identifier, if there is one.
	 *
	 * @return the entity as it was before the deletion, or {@code null} if there was none
	 *
	 * @throws PersistenceException if the store rejects the deletion
	 */
	public E delete(Object id) {
		final E entity = readById( id );
		if ( entity == null ) {
			LOG.nothingToDelete( entityName(), getIdFieldName(), id );
			return null;
		}
		try {
			session.remove( entity );
			session.commit();
		}
		catch (PersistenceException e) {
			LOG.deleteFailed( entityName(), getIdFieldName(), id, e );
			throw e;
		}
		LOG.deleted( entityName(), getIdFieldName(), id );
		return entity;
	}
}

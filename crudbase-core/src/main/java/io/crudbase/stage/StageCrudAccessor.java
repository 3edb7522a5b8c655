/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.stage;

import java.lang.invoke.MethodHandles;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;

import io.crudbase.CrudSpecialization;
import io.crudbase.common.impl.AbstractCrudAccessor;
import io.crudbase.logging.impl.Log;
import io.crudbase.logging.impl.LoggerFactory;
import io.crudbase.session.ReactiveCrudSession;

import static io.crudbase.util.impl.CompletionStages.failedFuture;
import static io.crudbase.util.impl.CompletionStages.nullFuture;
import static io.crudbase.util.impl.CompletionStages.supplyStage;
import static io.crudbase.util.impl.CompletionStages.unwrap;

/**
 * Non-blocking CRUD operations on one entity type, returning
 * {@link CompletionStage}s.
 * <p>
 * The semantics are those of {@link io.crudbase.CrudAccessor}: the same
 * payloads are accepted, and the same exceptions are reported, except that
 * they complete the returned stage exceptionally instead of being thrown.
 * <p>
 * The session must not be used by anything else until the returned stage
 * has completed.
 *
 * @param <E> the entity type
 * @param <C> the create payload type
 * @param <U> the update payload type
 * @param <F> the filter payload type
 *
 * @see io.crudbase.mutiny.MutinyCrudAccessor
 */
public class StageCrudAccessor<E, C, U, F> extends AbstractCrudAccessor<E, C, U, F> {

	private static final Log LOG = LoggerFactory.make( Log.class, MethodHandles.lookup() );

	private final ReactiveCrudSession session;

	public StageCrudAccessor(CrudSpecialization<E, C, U, F> specialization, ReactiveCrudSession session, String idFieldName) {
		super( specialization, session, idFieldName );
		this.session = session;
	}

	public ReactiveCrudSession getSession() {
		return session;
	}

	/**
	 * Create a new entity from the payload.
	 *
	 * @return a stage completing with the entity after the commit
	 */
	public CompletionStage<E> create(C payload) {
		return supplyStage( () -> {
			LOG.creating( entityName(), payload );
			final E entity = newEntity( payload );
			return session.persist( entity )
					.thenCompose( v -> session.commit() )
					.thenCompose( v -> session.refresh( entity ) )
					.thenApply( v -> entity )
					.whenComplete( (created, failure) -> {
						if ( failure == null ) {
							LOG.created( entityName(), getIdFieldName(), identifierOf( created ) );
						}
						else if ( isStorageFailure( failure ) ) {
							LOG.createFailed( entityName(), unwrap( failure ) );
						}
					} );
		} );
	}

	public CompletionStage<List<E>> read() {
		return read( null, null, null );
	}

	public CompletionStage<List<E>> read(F filter) {
		return read( null, null, filter );
	}

	public CompletionStage<List<E>> read(Integer limit, Integer offset) {
		return read( limit, offset, null );
	}

	/**
	 * A page of the entities matching the filter.
	 *
	 * @param limit the maximum number of results, or {@code null}
	 * @param offset the number of results to skip, or {@code null}
	 * @param filter the filter, or {@code null}
	 *
	 * @see io.crudbase.CrudAccessor#read(Integer, Integer, Object)
	 */
	public CompletionStage<List<E>> read(Integer limit, Integer offset, F filter) {
		return supplyStage( () -> {
			LOG.reading( entityName(), limit, offset, filter );
			return session.list( selectQuery( limit, offset, filter ) )
					.thenApply( results -> {
						LOG.retrieved( entityName(), results.size() );
						return results;
					} );
		} );
	}

	/**
	 * @return a stage completing with the entity, or with {@code null} if there is none
	 */
	public CompletionStage<E> readById(Object id) {
		return supplyStage( () -> {
			LOG.readingById( entityName(), getIdFieldName(), id );
			final CompletionStage<E> lookup = id == null
					? nullFuture()
					: session.list( identifierQuery( id ) ).thenApply( AbstractCrudAccessor::first );
			return lookup.thenApply( entity -> {
				if ( entity == null ) {
					LOG.notFound( entityName(), getIdFieldName(), id );
				}
				else {
					LOG.found( entityName(), getIdFieldName(), id );
				}
				return entity;
			} );
		} );
	}

	/**
	 * Assign the explicitly set fields of the payload to an existing entity.
	 * <p>
	 * The stage fails with {@link jakarta.persistence.EntityNotFoundException}
	 * if there is no entity with the given identifier.
	 */
	public CompletionStage<E> update(Object id, U payload) {
		return supplyStage( () -> {
			final Map<String, Object> updates = updatedFields( id, payload );
			return readById( id ).thenCompose( entity -> {
				if ( entity == null ) {
					return failedFuture( LOG.noEntityToUpdate( entityName(), getIdFieldName(), id ) );
				}
				LOG.updating( entityName(), getIdFieldName(), id, updates.keySet() );
				assign( entity, updates );
				return session.commit()
						.thenCompose( v -> session.refresh( entity ) )
						.thenApply( v -> entity )
						.whenComplete( (updated, failure) -> {
							if ( failure == null ) {
								LOG.updated( entityName(), getIdFieldName(), id );
							}
							else if ( isStorageFailure( failure ) ) {
								LOG.updateFailed( entityName(), getIdFieldName(), id, unwrap( failure ) );
							}
						} );
			} );
		} );
	}

	/**
	 * Delete the entity with the given identifier, if there is one.
	 *
	 * @return a stage completing with the deleted entity, or with {@code null} if there was none
	 */
	public CompletionStage<E> delete(Object id) {
		return supplyStage( () -> readById( id ).thenCompose( entity -> {
			if ( entity == null ) {
				LOG.nothingToDelete( entityName(), getIdFieldName(), id );
				return nullFuture();
			}
			return session.remove( entity )
					.thenCompose( v -> session.commit() )
					.thenApply( v -> entity )
					.whenComplete( (deleted, failure) -> {
						if ( failure == null ) {
							LOG.deleted( entityName(), getIdFieldName(), id );
						}
						else if ( isStorageFailure( failure ) ) {
							LOG.deleteFailed( entityName(), getIdFieldName(), id, unwrap( failure ) );
						}
					} );
		} ) );
	}
}

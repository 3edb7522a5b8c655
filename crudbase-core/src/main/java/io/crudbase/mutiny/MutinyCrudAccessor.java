/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.mutiny;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

import io.crudbase.CrudSpecialization;
import io.crudbase.session.ReactiveCrudSession;
import io.crudbase.stage.StageCrudAccessor;
import io.smallrye.mutiny.Uni;

/**
 * Non-blocking CRUD operations on one entity type, returning Mutiny
 * {@link Uni}s.
 * <p>
 * Each operation is lazy: nothing happens until the returned {@code Uni}
 * is subscribed, and subscribing twice runs the operation twice.
 *
 * @param <E> the entity type
 * @param <C> the create payload type
 * @param <U> the update payload type
 * @param <F> the filter payload type
 *
 * @see StageCrudAccessor
 */
public class MutinyCrudAccessor<E, C, U, F> {

	private final StageCrudAccessor<E, C, U, F> delegate;

	public MutinyCrudAccessor(CrudSpecialization<E, C, U, F> specialization, ReactiveCrudSession session, String idFieldName) {
		this( new StageCrudAccessor<>( specialization, session, idFieldName ) );
	}

	public MutinyCrudAccessor(StageCrudAccessor<E, C, U, F> delegate) {
		this.delegate = Objects.requireNonNull( delegate );
	}

	<T> Uni<T> uni(Supplier<CompletionStage<T>> stageSupplier) {
		return Uni.createFrom().completionStage( stageSupplier );
	}

	public CrudSpecialization<E, C, U, F> getSpecialization() {
		return delegate.getSpecialization();
	}

	public String getIdFieldName() {
		return delegate.getIdFieldName();
	}

	public Uni<E> create(C payload) {
		return uni( () -> delegate.create( payload ) );
	}

	public Uni<List<E>> read() {
		return uni( () -> delegate.read() );
	}

	public Uni<List<E>> read(F filter) {
		return uni( () -> delegate.read( filter ) );
	}

	public Uni<List<E>> read(Integer limit, Integer offset) {
		return uni( () -> delegate.read( limit, offset ) );
	}

	public Uni<List<E>> read(Integer limit, Integer offset, F filter) {
		return uni( () -> delegate.read( limit, offset, filter ) );
	}

	/**
	 * @return a {@code Uni} emitting the entity, or {@code null} if there is none
	 */
	public Uni<E> readById(Object id) {
		return uni( () -> delegate.readById( id ) );
	}

	/**
	 * @see StageCrudAccessor#update(Object, Object)
	 */
	public Uni<E> update(Object id, U payload) {
		return uni( () -> delegate.update( id, payload ) );
	}

	/**
	 * @return a {@code Uni} emitting the deleted entity, or {@code null} if there was none
	 */
	public Uni<E> delete(Object id) {
		return uni( () -> delegate.delete( id ) );
	}

	@Override
	public String toString() {
		return "Mutiny" + delegate;
	}
}

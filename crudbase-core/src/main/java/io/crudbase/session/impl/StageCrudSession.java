/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.session.impl;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;

import org.hibernate.reactive.stage.Stage;

import io.crudbase.session.EntityQuery;
import io.crudbase.session.ReactiveCrudSession;

import static io.crudbase.util.impl.CompletionStages.voidFuture;

/**
 * A {@link ReactiveCrudSession} backed by a Hibernate Reactive
 * {@link Stage.Session}.
 * <p>
 * {@link #commit()} flushes the session inside
 * {@link Stage.Session#withTransaction(java.util.function.Function) a transaction},
 * so the staged changes are written and committed together. A failed
 * commit, persist or remove clears the session.
 * <p>
 * Like the session it wraps, this object must only be used from the Vert.x
 * context the session was opened on.
 */
public class StageCrudSession implements ReactiveCrudSession {

	private final Stage.SessionFactory factory;
	private final Stage.Session delegate;

	public StageCrudSession(Stage.SessionFactory factory, Stage.Session delegate) {
		this.factory = Objects.requireNonNull( factory );
		this.delegate = Objects.requireNonNull( delegate );
	}

	public Stage.Session getDelegate() {
		return delegate;
	}

	@Override
	public CompletionStage<Void> persist(Object entity) {
		// an identity column makes persist() execute the insert
		return clearAfterFailure( delegate.persist( entity ) );
	}

	@Override
	public CompletionStage<Void> remove(Object entity) {
		return clearAfterFailure( delegate.remove( entity ) );
	}

	@Override
	public <E> CompletionStage<List<E>> list(EntityQuery<E> query) {
		final Stage.SelectionQuery<E> selection = delegate.createQuery(
				CriteriaQueries.createCriteriaQuery( factory.getCriteriaBuilder(), query )
		);
		if ( query.getFirstResult() != null ) {
			selection.setFirstResult( query.getFirstResult() );
		}
		if ( query.getMaxResults() != null ) {
			selection.setMaxResults( query.getMaxResults() );
		}
		return selection.getResultList();
	}

	@Override
	public CompletionStage<Void> commit() {
		return clearAfterFailure( delegate.withTransaction( transaction -> delegate.flush() ) );
	}

	@Override
	public CompletionStage<Void> rollback() {
		final Stage.Transaction transaction = delegate.currentTransaction();
		if ( transaction != null ) {
			transaction.markForRollback();
		}
		delegate.clear();
		return voidFuture();
	}

	@Override
	public CompletionStage<Void> refresh(Object entity) {
		return delegate.refresh( entity );
	}

	private CompletionStage<Void> clearAfterFailure(CompletionStage<Void> stage) {
		return stage.whenComplete( (v, failure) -> {
			if ( failure != null ) {
				// the persistence context is unusable after a failed flush
				delegate.clear();
			}
		} );
	}
}

/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.session.impl;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionStage;

import io.crudbase.session.CrudSession;
import io.crudbase.session.EntityQuery;
import io.crudbase.session.ReactiveCrudSession;

import io.vertx.core.Context;
import io.vertx.core.Vertx;

/**
 * Exposes a blocking {@link CrudSession} as a {@link ReactiveCrudSession}
 * by running each call on a Vert.x worker thread.
 * <p>
 * This lets the non-blocking accessors work with stores that only have a
 * JDBC driver. Calls are queued in order on the Vert.x context captured at
 * construction, so two calls on the same session never overlap. The stages
 * returned by this class complete on that context.
 */
public class WorkerCrudSession implements ReactiveCrudSession {

	private final Context context;
	private final CrudSession delegate;

	public WorkerCrudSession(Vertx vertx, CrudSession delegate) {
		this( vertx.getOrCreateContext(), delegate );
	}

	public WorkerCrudSession(Context context, CrudSession delegate) {
		this.context = Objects.requireNonNull( context );
		this.delegate = Objects.requireNonNull( delegate );
	}

	public CrudSession getDelegate() {
		return delegate;
	}

	@Override
	public CompletionStage<Void> persist(Object entity) {
		return onWorker( () -> {
			delegate.persist( entity );
			return null;
		} );
	}

	@Override
	public CompletionStage<Void> remove(Object entity) {
		return onWorker( () -> {
			delegate.remove( entity );
			return null;
		} );
	}

	@Override
	public <E> CompletionStage<List<E>> list(EntityQuery<E> query) {
		return onWorker( () -> delegate.list( query ) );
	}

	@Override
	public CompletionStage<Void> commit() {
		return onWorker( () -> {
			delegate.commit();
			return null;
		} );
	}

	@Override
	public CompletionStage<Void> rollback() {
		return onWorker( () -> {
			delegate.rollback();
			return null;
		} );
	}

	@Override
	public CompletionStage<Void> refresh(Object entity) {
		return onWorker( () -> {
			delegate.refresh( entity );
			return null;
		} );
	}

	private <T> CompletionStage<T> onWorker(Callable<T> work) {
		return context.executeBlocking( work, true ).toCompletionStage();
	}
}

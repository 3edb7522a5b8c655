/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.session;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * The non-blocking counterpart of {@link CrudSession}: each operation
 * returns a {@link CompletionStage} that completes once the store has
 * answered.
 * <p>
 * The caller must wait for a stage to complete before calling the session
 * again.
 *
 * @see io.crudbase.session.impl.StageCrudSession
 * @see io.crudbase.session.impl.WorkerCrudSession
 */
public interface ReactiveCrudSession {

	CompletionStage<Void> persist(Object entity);

	CompletionStage<Void> remove(Object entity);

	<E> CompletionStage<List<E>> list(EntityQuery<E> query);

	CompletionStage<Void> commit();

	CompletionStage<Void> rollback();

	CompletionStage<Void> refresh(Object entity);
}

/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.session;

import java.util.List;

/**
 * The blocking unit of work an {@link io.crudbase.CrudAccessor} runs its
 * operations against.
 * <p>
 * Changes staged with {@link #persist(Object)} and {@link #remove(Object)},
 * and changes made to entities returned by {@link #list(EntityQuery)}, are
 * written by {@link #commit()}. A session is owned by one caller at a time.
 *
 * @see io.crudbase.session.impl.OrmCrudSession
 */
public interface CrudSession {

	/**
	 * Stage a new entity for insertion.
	 */
	void persist(Object entity);

	/**
	 * Stage a managed entity for deletion.
	 */
	void remove(Object entity);

	/**
	 * Execute the query and return the managed entities it selects.
	 */
	<E> List<E> list(EntityQuery<E> query);

	/**
	 * Write the staged changes and commit them. If the commit fails, the
	 * session rolls back, and forgets the entities it manages, before
	 * rethrowing the failure.
	 */
	void commit();

	/**
	 * Discard the changes of the current unit of work, if any.
	 */
	void rollback();

	/**
	 * Reload the state of a managed entity from the store.
	 */
	void refresh(Object entity);
}

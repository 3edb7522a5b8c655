/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.session.impl;

import java.lang.invoke.MethodHandles;
import java.util.List;
import java.util.Objects;

import org.hibernate.Session;
import org.hibernate.Transaction;
import org.hibernate.query.Query;

import io.crudbase.logging.impl.Log;
import io.crudbase.logging.impl.LoggerFactory;
import io.crudbase.session.CrudSession;
import io.crudbase.session.EntityQuery;

/**
 * A {@link CrudSession} backed by a Hibernate ORM {@link Session}.
 * <p>
 * A transaction is started on demand, by the first change staged after
 * the previous commit, and ended by {@link #commit()}. A failure while
 * staging or committing rolls the transaction back, and clears the
 * session, before it is rethrown.
 * <p>
 * Entities read outside a transaction remain managed, so changes made to
 * them are written by the next commit.
 * <p>
 * The session is not closed by this class: whoever opened it closes it.
 */
public class OrmCrudSession implements CrudSession {

	private static final Log LOG = LoggerFactory.make( Log.class, MethodHandles.lookup() );

	private final Session delegate;

	public OrmCrudSession(Session delegate) {
		this.delegate = Objects.requireNonNull( delegate );
	}

	public Session getDelegate() {
		return delegate;
	}

	@Override
	public void persist(Object entity) {
		final Transaction transaction = begin();
		try {
			delegate.persist( entity );
		}
		catch (RuntimeException e) {
			// an identity column makes persist() execute the insert
			rollbackAfterFailure( transaction, e );
			throw e;
		}
	}

	@Override
	public void remove(Object entity) {
		final Transaction transaction = begin();
		try {
			delegate.remove( entity );
		}
		catch (RuntimeException e) {
			rollbackAfterFailure( transaction, e );
			throw e;
		}
	}

	@Override
	public <E> List<E> list(EntityQuery<E> query) {
		final Query<E> selection = delegate.createQuery(
				CriteriaQueries.createCriteriaQuery( delegate.getCriteriaBuilder(), query )
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
	public void commit() {
		final Transaction transaction = begin();
		try {
			transaction.commit();
		}
		catch (RuntimeException e) {
			rollbackAfterFailure( transaction, e );
			throw e;
		}
	}

	@Override
	public void rollback() {
		final Transaction transaction = delegate.getTransaction();
		if ( transaction.getStatus().canRollback() ) {
			transaction.rollback();
		}
		delegate.clear();
	}

	@Override
	public void refresh(Object entity) {
		delegate.refresh( entity );
	}

	private Transaction begin() {
		final Transaction transaction = delegate.getTransaction();
		if ( !transaction.isActive() ) {
			transaction.begin();
		}
		return transaction;
	}

	private void rollbackAfterFailure(Transaction transaction, RuntimeException failure) {
		// Hibernate usually rolls back itself when the commit fails
		if ( transaction.getStatus().canRollback() ) {
			try {
				transaction.rollback();
			}
			catch (RuntimeException e) {
				failure.addSuppressed( e );
				LOG.rollbackFailed( e );
			}
		}
		// the persistence context is unusable after a failed flush
		delegate.clear();
	}
}

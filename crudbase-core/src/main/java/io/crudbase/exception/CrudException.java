/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.exception;

import org.hibernate.HibernateException;

/**
 * Base class for the failures raised by the accessors themselves, as opposed
 * to the storage errors which are propagated as thrown by Hibernate.
 */
public class CrudException extends HibernateException {

	public CrudException(String message) {
		super( message );
	}

	public CrudException(String message, Throwable cause) {
		super( message, cause );
	}
}

/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.exception;

/**
 * An accessor was set up incorrectly: it was not obtained from a
 * specialization, it has no session, or its identifier field is not
 * mapped by the entity.
 * <p>
 * Not recoverable without fixing the code that builds the accessor.
 */
public class CrudConfigurationException extends CrudException {

	public CrudConfigurationException(String message) {
		super( message );
	}

	public CrudConfigurationException(String message, Throwable cause) {
		super( message, cause );
	}
}

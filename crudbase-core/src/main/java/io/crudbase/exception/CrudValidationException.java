/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.exception;

/**
 * The caller supplied something the accessor cannot work with: type
 * arguments that are not an entity or not records, an update without any
 * field to change, or negative pagination values.
 */
public class CrudValidationException extends CrudException {

	public CrudValidationException(String message) {
		super( message );
	}

	public CrudValidationException(String message, Throwable cause) {
		super( message, cause );
	}
}

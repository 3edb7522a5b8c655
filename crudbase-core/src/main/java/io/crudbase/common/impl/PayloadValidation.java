/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.common.impl;

import java.util.Objects;
import java.util.Set;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validation;
import jakarta.validation.Validator;

/**
 * Checks the Bean Validation constraints declared on payload records.
 */
public final class PayloadValidation {

	private PayloadValidation() {
	}

	/**
	 * @throws ConstraintViolationException if the payload violates any of
	 * its constraints
	 */
	public static <P> P validate(P payload) {
		Objects.requireNonNull( payload, "payload" );
		final Set<ConstraintViolation<P>> violations = ValidatorHolder.VALIDATOR.validate( payload );
		if ( !violations.isEmpty() ) {
			throw new ConstraintViolationException( violations );
		}
		return payload;
	}

	// bootstrapped on first use
	private static final class ValidatorHolder {
		private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();
	}
}

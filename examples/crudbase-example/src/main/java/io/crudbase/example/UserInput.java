/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.example;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * The fields needed to create a {@link User}.
 */
public record UserInput(
		@NotNull @Size(min = 1, max = 50) String username,
		@NotNull @Email String email,
		@Size(max = 255) String bio) {
}

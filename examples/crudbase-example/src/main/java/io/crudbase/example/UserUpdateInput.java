/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.example;

import java.util.Optional;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

/**
 * The fields of a {@link User} that can change. A {@code null} component
 * is left alone; an empty {@code bio} removes it.
 */
public record UserUpdateInput(
		@Size(min = 1, max = 50) String username,
		@Email String email,
		Optional<@Size(max = 255) String> bio,
		Boolean active) {
}

/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase;

import java.lang.invoke.MethodHandles;

import io.crudbase.common.impl.SpecializationCache;
import io.crudbase.common.impl.TypeSignature;
import io.crudbase.logging.impl.Log;
import io.crudbase.logging.impl.LoggerFactory;

/**
 * Entry point for obtaining generic CRUD accessors.
 * <p>
 * An accessor is bound to four types: a mapped entity class and three
 * records used as create, update and filter payloads.
 *
 * <pre>
 * CrudAccessor&lt;User, UserInput, UserUpdateInput, UserFilter&gt; users =
 * 		Crud.specialize( User.class, UserInput.class, UserUpdateInput.class, UserFilter.class )
 * 				.accessor( new OrmCrudSession( session ), "id" );
 * </pre>
 */
public final class Crud {

	private static final Log LOG = LoggerFactory.make( Log.class, MethodHandles.lookup() );

	private static final SpecializationCache<CrudSpecialization<?, ?, ?, ?>> SPECIALIZATIONS = new SpecializationCache<>();

	private Crud() {
	}

	/**
	 * The specialization for the given types.
	 * <p>
	 * Specializing twice with the same four classes returns the same
	 * instance, as long as the first one is still referenced.
	 *
	 * @param entityType a class annotated {@link jakarta.persistence.Entity}
	 * @param createType a record whose components are persistent fields of the entity
	 * @param updateType a record whose non-null components are the fields to update
	 * @param filterType a record whose non-null components are the fields to filter on
	 *
	 * @throws io.crudbase.exception.CrudValidationException if the types do not qualify
	 */
	@SuppressWarnings("unchecked")
	public static <E, C, U, F> CrudSpecialization<E, C, U, F> specialize(
			Class<E> entityType,
			Class<C> createType,
			Class<U> updateType,
			Class<F> filterType) {
		checkNotNull( entityType, "entity" );
		checkNotNull( createType, "create" );
		checkNotNull( updateType, "update" );
		checkNotNull( filterType, "filter" );
		return (CrudSpecialization<E, C, U, F>) SPECIALIZATIONS.computeIfAbsent(
				new TypeSignature( entityType, createType, updateType, filterType ),
				signature -> CrudSpecialization.create( entityType, createType, updateType, filterType )
		);
	}

	private static void checkNotNull(Class<?> type, String role) {
		if ( type == null ) {
			throw LOG.nullTypeArgument( role );
		}
	}
}

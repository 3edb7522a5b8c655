/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.session.impl;

import java.util.ArrayList;
import java.util.List;

import io.crudbase.session.EntityQuery;
import io.crudbase.session.Restriction;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

/**
 * Translates an {@link EntityQuery} into a JPA {@link CriteriaQuery}.
 * <p>
 * Pagination is not part of a criteria query: callers apply
 * {@link EntityQuery#getFirstResult()} and {@link EntityQuery#getMaxResults()}
 * to the query object they create from it.
 */
public final class CriteriaQueries {

	private CriteriaQueries() {
	}

	public static <E> CriteriaQuery<E> createCriteriaQuery(CriteriaBuilder builder, EntityQuery<E> query) {
		final CriteriaQuery<E> criteria = builder.createQuery( query.getEntityClass() );
		final Root<E> root = criteria.from( query.getEntityClass() );
		criteria.select( root );
		final List<Predicate> predicates = new ArrayList<>();
		for ( Restriction restriction : query.getRestrictions() ) {
			predicates.add( toPredicate( builder, root, restriction ) );
		}
		if ( !predicates.isEmpty() ) {
			criteria.where( predicates.toArray( new Predicate[0] ) );
		}
		return criteria;
	}

	private static Predicate toPredicate(CriteriaBuilder builder, Root<?> root, Restriction restriction) {
		final Path<Object> path = root.get( restriction.getField() );
		switch ( restriction.getKind() ) {
			case EQUAL:
				return builder.equal( path, restriction.getValue() );
			case IN:
				final List<?> values = restriction.getValues();
				if ( values.isEmpty() ) {
					// nothing is a member of an empty collection
					return builder.disjunction();
				}
				final CriteriaBuilder.In<Object> in = builder.in( path );
				for ( Object value : values ) {
					in.value( value );
				}
				return in;
			default:
				throw new AssertionError( "Unknown restriction kind: " + restriction.getKind() );
		}
	}
}

/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.session;

import java.util.List;

/**
 * A selection of entities of one type: the conjunction of some
 * {@link Restriction restrictions}, optionally paginated.
 * <p>
 * The first result is applied before the maximum number of results.
 *
 * @param <E> the entity type
 */
public final class EntityQuery<E> {

	private final Class<E> entityClass;
	private final List<Restriction> restrictions;
	private final Integer firstResult;
	private final Integer maxResults;

	public EntityQuery(Class<E> entityClass, List<Restriction> restrictions, Integer firstResult, Integer maxResults) {
		this.entityClass = entityClass;
		this.restrictions = List.copyOf( restrictions );
		this.firstResult = firstResult;
		this.maxResults = maxResults;
	}

	public Class<E> getEntityClass() {
		return entityClass;
	}

	/**
	 * The restrictions, all of which must hold. Empty when every entity
	 * matches.
	 */
	public List<Restriction> getRestrictions() {
		return restrictions;
	}

	/**
	 * @return the number of results to skip, or {@code null}
	 */
	public Integer getFirstResult() {
		return firstResult;
	}

	/**
	 * @return the maximum number of results, or {@code null} for no limit
	 */
	public Integer getMaxResults() {
		return maxResults;
	}

	@Override
	public String toString() {
		return "EntityQuery{" + entityClass.getSimpleName()
				+ ", restrictions=" + restrictions
				+ ", firstResult=" + firstResult
				+ ", maxResults=" + maxResults + '}';
	}
}

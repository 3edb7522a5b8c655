/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.session.impl;

import java.util.List;

import io.crudbase.BaseCrudTest;
import io.crudbase.metamodel.EntityDescriptor;
import io.crudbase.model.User;
import io.crudbase.session.EntityQuery;
import io.crudbase.session.Restriction;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import jakarta.persistence.PersistenceException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests {@link OrmCrudSession}, including the translation of restrictions
 * done by {@link CriteriaQueries}.
 */
public class OrmCrudSessionTest extends BaseCrudTest {

	private OrmCrudSession session;

	@BeforeEach
	public void openOrmSession() {
		session = new OrmCrudSession( openSession() );
		session.persist( user( "a", "a@x.com", true ) );
		session.persist( user( "b", "b@x.com", false ) );
		session.persist( user( "c", "c@x.com", true ) );
		session.commit();
	}

	@Test
	public void testListAll() {
		assertThat( session.list( query( List.of() ) ) )
				.extracting( User::getUsername )
				.containsExactlyInAnyOrder( "a", "b", "c" );
	}

	@Test
	public void testEqualRestrictions() {
		assertThat( session.list( query( List.of( Restriction.equal( "username", "b" ) ) ) ) )
				.extracting( User::getUsername )
				.containsExactly( "b" );
		assertThat( session.list( query( List.of(
				Restriction.equal( "active", true ),
				Restriction.equal( "email", "c@x.com" )
		) ) ) )
				.extracting( User::getUsername )
				.containsExactly( "c" );
		assertThat( session.list( query( List.of(
				Restriction.equal( "active", false ),
				Restriction.equal( "email", "c@x.com" )
		) ) ) ).isEmpty();
	}

	@Test
	public void testInRestrictions() {
		assertThat( session.list( query( List.of( Restriction.in( "username", List.of( "a", "c", "z" ) ) ) ) ) )
				.extracting( User::getUsername )
				.containsExactlyInAnyOrder( "a", "c" );
		assertThat( session.list( query( List.of( Restriction.in( "username", List.of() ) ) ) ) ).isEmpty();
	}

	@Test
	public void testPagination() {
		EntityQuery<User> firstTwo = new EntityQuery<>( User.class, List.of(), null, 2 );
		EntityQuery<User> skipTwo = new EntityQuery<>( User.class, List.of(), 2, null );

		assertThat( session.list( firstTwo ) ).hasSize( 2 );
		assertThat( session.list( skipTwo ) ).hasSize( 1 );
	}

	@Test
	public void testChangesToListedEntitiesAreCommitted() {
		User a = session.list( query( List.of( Restriction.equal( "username", "a" ) ) ) ).get( 0 );
		EntityDescriptor.of( User.class ).getField( "bio" ).set( a, "changed" );

		session.commit();

		assertThat( findUser( a.getId() ).getBio() ).isEqualTo( "changed" );
	}

	@Test
	public void testRemove() {
		User b = session.list( query( List.of( Restriction.equal( "username", "b" ) ) ) ).get( 0 );

		session.remove( b );
		session.commit();

		assertThat( findUser( b.getId() ) ).isNull();
	}

	@Test
	public void testRollbackDiscardsChanges() {
		User c = session.list( query( List.of( Restriction.equal( "username", "c" ) ) ) ).get( 0 );

		session.remove( c );
		session.rollback();

		assertThat( findUser( c.getId() ) ).isNotNull();
		assertThat( session.getDelegate().contains( c ) ).isFalse();
	}

	@Test
	public void testFailedPersistRollsBack() {
		assertThatThrownBy( () -> session.persist( user( "a", "duplicate@x.com", true ) ) )
				.isInstanceOf( PersistenceException.class );

		assertThat( session.getDelegate().getTransaction().isActive() ).isFalse();
		assertThat( session.list( query( List.of() ) ) ).hasSize( 3 );
	}

	private static EntityQuery<User> query(List<Restriction> restrictions) {
		return new EntityQuery<>( User.class, restrictions, null, null );
	}

	private static User user(String username, String email, boolean active) {
		EntityDescriptor<User> descriptor = EntityDescriptor.of( User.class );
		User user = descriptor.instantiate();
		descriptor.getField( "username" ).set( user, username );
		descriptor.getField( "email" ).set( user, email );
		descriptor.getField( "active" ).set( user, active );
		return user;
	}
}

/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase;

import java.util.List;
import java.util.Optional;

import io.crudbase.exception.CrudConfigurationException;
import io.crudbase.exception.CrudValidationException;
import io.crudbase.model.User;
import io.crudbase.model.UserFilter;
import io.crudbase.model.UserInput;
import io.crudbase.model.UserUpdateInput;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import jakarta.persistence.EntityNotFoundException;
import jakarta.persistence.PersistenceException;
import jakarta.validation.ConstraintViolationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CrudAccessorTest extends BaseCrudTest {

	private CrudAccessor<User, UserInput, UserUpdateInput, UserFilter> users;

	@BeforeEach
	public void createAccessor() {
		users = Crud.specialize( User.class, UserInput.class, UserUpdateInput.class, UserFilter.class )
				.accessor( openCrudSession(), "id" );
	}

	@Test
	public void testCreateThenReadById() {
		User created = users.create( new UserInput( "a", "a@x.com" ) );

		assertThat( created.getId() ).isNotNull();
		User found = users.readById( created.getId() );
		assertThat( found ).isNotNull();
		assertThat( found.getUsername() ).isEqualTo( "a" );
		assertThat( found.getEmail() ).isEqualTo( "a@x.com" );
		assertThat( found.isActive() ).isTrue();
	}

	@Test
	public void testCreateCommits() {
		User created = users.create( new UserInput( "committed", "committed@x.com", "bio" ) );

		User stored = findUser( created.getId() );
		assertThat( stored ).isNotNull();
		assertThat( stored.getUsername() ).isEqualTo( "committed" );
		assertThat( stored.getBio() ).isEqualTo( "bio" );
	}

	@Test
	public void testCreateAppliesEntityDefaults() {
		User created = users.create( new UserInput( "defaults", "defaults@x.com" ) );

		assertThat( created.getBio() ).isNull();
		assertThat( created.isActive() ).isTrue();
		assertThat( created.getCreatedAt() ).isNotNull();
		assertThat( created.getUpdatedAt() ).isNull();
	}

	@Test
	public void testCreateWithInvalidPayload() {
		assertThatThrownBy( () -> users.create( new UserInput( "invalid", "not an email" ) ) )
				.isInstanceOf( ConstraintViolationException.class );
		assertThat( users.read() ).isEmpty();
	}

	@Test
	public void testCreateWithDuplicateUsername() {
		users.create( new UserInput( "twice", "first@x.com" ) );

		assertThatThrownBy( () -> users.create( new UserInput( "twice", "second@x.com" ) ) )
				.isInstanceOf( PersistenceException.class );

		// the session can still be used after the failure
		assertThat( users.read( UserFilter.byUsername( "twice" ) ) )
				.extracting( User::getEmail )
				.containsExactly( "first@x.com" );
	}

	@Test
	public void testReadAll() {
		users.create( new UserInput( "a", "a@x.com" ) );
		users.create( new UserInput( "b", "b@x.com" ) );
		users.create( new UserInput( "c", "c@x.com" ) );

		assertThat( users.read() )
				.extracting( User::getUsername )
				.containsExactlyInAnyOrder( "a", "b", "c" );
	}

	@Test
	public void testReadEmpty() {
		assertThat( users.read() ).isEmpty();
		assertThat( users.read( UserFilter.byUsername( "nobody" ) ) ).isEmpty();
	}

	@Test
	public void testReadWithPagination() {
		for ( int i = 0; i < 5; i++ ) {
			users.create( new UserInput( "user" + i, "user" + i + "@x.com" ) );
		}

		List<User> all = users.read();
		List<User> page = users.read( 2, 1 );
		assertThat( page ).hasSize( 2 );
		assertThat( all ).containsAll( page );
		assertThat( users.read( null, 4 ) ).hasSize( 1 );
		assertThat( users.read( 10, 0 ) ).hasSize( 5 );
		assertThat( users.read( null, 5 ) ).isEmpty();
	}

	@Test
	public void testReadWithNegativeLimitOrOffset() {
		assertThatThrownBy( () -> users.read( -1, null ) )
				.isInstanceOf( CrudValidationException.class )
				.hasMessageContaining( "CRUD000107" );
		assertThatThrownBy( () -> users.read( null, -1 ) )
				.isInstanceOf( CrudValidationException.class )
				.hasMessageContaining( "CRUD000108" );
	}

	@Test
	public void testFilterWithoutValuesIsNoFilter() {
		users.create( new UserInput( "a", "a@x.com" ) );
		users.create( new UserInput( "b", "b@x.com" ) );

		assertThat( users.read( UserFilter.none() ) ).hasSameElementsAs( users.read() );
		assertThat( users.read( (UserFilter) null ) ).hasSameElementsAs( users.read() );
	}

	@Test
	public void testFilterByField() {
		users.create( new UserInput( "a", "a@x.com" ) );
		users.create( new UserInput( "b", "b@x.com" ) );

		assertThat( users.read( UserFilter.byUsername( "b" ) ) )
				.extracting( User::getUsername )
				.containsExactly( "b" );
	}

	@Test
	public void testFilterCombinesFields() {
		users.create( new UserInput( "a", "a@x.com" ) );
		User b = users.create( new UserInput( "b", "b@x.com" ) );
		users.update( b.getId(), UserUpdateInput.settingActive( false ) );

		assertThat( users.read( new UserFilter( "b", null, true, null, null ) ) ).isEmpty();
		assertThat( users.read( new UserFilter( "b", null, false, null, null ) ) )
				.extracting( User::getUsername )
				.containsExactly( "b" );
		assertThat( users.read( UserFilter.byActive( true ) ) )
				.extracting( User::getUsername )
				.containsExactly( "a" );
	}

	@Test
	public void testFilterWithCollection() {
		User a = users.create( new UserInput( "a", "a@x.com" ) );
		users.create( new UserInput( "b", "b@x.com" ) );
		User c = users.create( new UserInput( "c", "c@x.com" ) );

		assertThat( users.read( UserFilter.byIds( List.of( a.getId(), c.getId() ) ) ) )
				.extracting( User::getUsername )
				.containsExactlyInAnyOrder( "a", "c" );
		assertThat( users.read( UserFilter.byIds( List.of() ) ) ).isEmpty();
	}

	@Test
	public void testFilterWithArray() {
		User a = users.create( new UserInput( "a", "a@x.com" ) );
		users.create( new UserInput( "b", "b@x.com" ) );
		User c = users.create( new UserInput( "c", "c@x.com" ) );
		CrudAccessor<User, UserInput, UserUpdateInput, IdArrayFilter> byIds =
				Crud.specialize( User.class, UserInput.class, UserUpdateInput.class, IdArrayFilter.class )
						.accessor( users.getSession(), "id" );

		assertThat( byIds.read( new IdArrayFilter( new Long[] { a.getId(), c.getId() } ) ) )
				.extracting( User::getUsername )
				.containsExactlyInAnyOrder( "a", "c" );
		// null elements are dropped
		assertThat( byIds.read( new IdArrayFilter( new Long[] { null, a.getId(), null } ) ) )
				.extracting( User::getUsername )
				.containsExactly( "a" );
		assertThat( byIds.read( new IdArrayFilter( new Long[] { null } ) ) ).isEmpty();
		assertThat( byIds.read( new IdArrayFilter( new Long[0] ) ) ).isEmpty();
		// an unset array is no restriction
		assertThat( byIds.read( new IdArrayFilter( null ) ) ).hasSize( 3 );
	}

	@Test
	public void testFilterWithPrimitiveArray() {
		User a = users.create( new UserInput( "a", "a@x.com" ) );
		User b = users.create( new UserInput( "b", "b@x.com" ) );
		users.create( new UserInput( "c", "c@x.com" ) );
		CrudAccessor<User, UserInput, UserUpdateInput, PrimitiveIdArrayFilter> byIds =
				Crud.specialize( User.class, UserInput.class, UserUpdateInput.class, PrimitiveIdArrayFilter.class )
						.accessor( users.getSession(), "id" );

		assertThat( byIds.read( new PrimitiveIdArrayFilter( new long[] { a.getId(), b.getId(), 404L } ) ) )
				.extracting( User::getUsername )
				.containsExactlyInAnyOrder( "a", "b" );
		assertThat( byIds.read( new PrimitiveIdArrayFilter( new long[0] ) ) ).isEmpty();
	}

	@Test
	public void testFilterIgnoresUnmappedFields() {
		users.create( new UserInput( "a", "a@x.com" ) );

		assertThat( users.read( UserFilter.byNickname( "whatever" ) ) ).hasSize( 1 );
	}

	@Test
	public void testFilterWithPagination() {
		for ( int i = 0; i < 4; i++ ) {
			users.create( new UserInput( "user" + i, "user" + i + "@x.com" ) );
		}
		users.create( new UserInput( "other", "other@x.com" ) );

		UserFilter filter = new UserFilter( null, null, true, null, null );
		assertThat( users.read( 3, 0, filter ) ).hasSize( 3 );
		assertThat( users.read( 3, 3, filter ) ).hasSize( 2 );
	}

	@Test
	public void testReadByIdNotFound() {
		assertThat( users.readById( 404L ) ).isNull();
		assertThat( users.readById( null ) ).isNull();
	}

	@Test
	public void testUpdate() {
		User created = users.create( new UserInput( "a", "a@x.com", "old" ) );

		User updated = users.update( created.getId(), UserUpdateInput.settingBio( "new" ) );

		assertThat( updated.getBio() ).isEqualTo( "new" );
		assertThat( updated.getUsername() ).isEqualTo( "a" );
		assertThat( updated.getEmail() ).isEqualTo( "a@x.com" );
		assertThat( updated.isActive() ).isTrue();
		assertThat( updated.getUpdatedAt() ).isNotNull();
		assertThat( findUser( created.getId() ).getBio() ).isEqualTo( "new" );
	}

	@Test
	public void testUpdateWithFalseValue() {
		User created = users.create( new UserInput( "a", "a@x.com" ) );

		User updated = users.update( created.getId(), UserUpdateInput.settingActive( false ) );

		assertThat( updated.isActive() ).isFalse();
		assertThat( findUser( created.getId() ).isActive() ).isFalse();
	}

	@Test
	public void testUpdateClearsFieldWithEmptyOptional() {
		User created = users.create( new UserInput( "a", "a@x.com", "something" ) );

		User updated = users.update( created.getId(), new UserUpdateInput( null, null, Optional.empty(), null ) );

		assertThat( updated.getBio() ).isNull();
		assertThat( findUser( created.getId() ).getBio() ).isNull();
	}

	@Test
	public void testUpdateWithoutFields() {
		User created = users.create( new UserInput( "a", "a@x.com" ) );

		assertThatThrownBy( () -> users.update( created.getId(), UserUpdateInput.empty() ) )
				.isInstanceOf( CrudValidationException.class )
				.hasMessageContaining( "CRUD000106" );
		// the identifier is never looked up
		assertThatThrownBy( () -> users.update( 404L, UserUpdateInput.empty() ) )
				.isInstanceOf( CrudValidationException.class )
				.hasMessageContaining( "CRUD000106" );
	}

	@Test
	public void testUpdateCannotClearPrimitiveField() {
		User created = users.create( new UserInput( "a", "a@x.com" ) );
		CrudAccessor<User, UserInput, ActiveUpdate, UserFilter> activity =
				Crud.specialize( User.class, UserInput.class, ActiveUpdate.class, UserFilter.class )
						.accessor( users.getSession(), "id" );

		assertThatThrownBy( () -> activity.update( created.getId(), new ActiveUpdate( Optional.empty() ) ) )
				.isInstanceOf( CrudValidationException.class )
				.hasMessageContaining( "CRUD000110" )
				.hasMessageContaining( "'active'" );
		assertThat( findUser( created.getId() ).isActive() ).isTrue();

		// the session is still usable
		assertThat( activity.update( created.getId(), new ActiveUpdate( Optional.of( false ) ) ).isActive() ).isFalse();
		assertThat( findUser( created.getId() ).isActive() ).isFalse();
	}

	@Test
	public void testUpdateNotFound() {
		assertThatThrownBy( () -> users.update( 404L, UserUpdateInput.settingBio( "new" ) ) )
				.isInstanceOf( EntityNotFoundException.class )
				.hasMessageContaining( "CRUD000300" );
	}

	@Test
	public void testUpdateWithInvalidPayload() {
		User created = users.create( new UserInput( "a", "a@x.com" ) );

		assertThatThrownBy( () -> users.update( created.getId(), new UserUpdateInput( null, "not an email", null, null ) ) )
				.isInstanceOf( ConstraintViolationException.class );
	}

	@Test
	public void testDelete() {
		User created = users.create( new UserInput( "a", "a@x.com" ) );

		User deleted = users.delete( created.getId() );

		assertThat( deleted ).isNotNull();
		assertThat( deleted.getId() ).isEqualTo( created.getId() );
		assertThat( deleted.getUsername() ).isEqualTo( "a" );
		assertThat( users.readById( created.getId() ) ).isNull();
		assertThat( findUser( created.getId() ) ).isNull();
	}

	@Test
	public void testDeleteNotFound() {
		assertThat( users.delete( 404L ) ).isNull();
		assertThat( users.delete( null ) ).isNull();
	}

	@Test
	public void testLifecycle() {
		User created = users.create( new UserInput( "a", "a@x.com" ) );
		Long id = created.getId();

		User found = users.readById( id );
		assertThat( found.getUsername() ).isEqualTo( "a" );
		assertThat( found.getEmail() ).isEqualTo( "a@x.com" );
		assertThat( found.isActive() ).isTrue();

		User updated = users.update( id, UserUpdateInput.settingBio( "new" ) );
		assertThat( updated.getBio() ).isEqualTo( "new" );
		assertThat( updated.getUsername() ).isEqualTo( "a" );
		assertThat( updated.getEmail() ).isEqualTo( "a@x.com" );

		assertThat( users.delete( id ) ).isNotNull();
		assertThat( users.readById( id ) ).isNull();
	}

	@Test
	public void testUnknownIdentifierField() {
		CrudSpecialization<User, UserInput, UserUpdateInput, UserFilter> specialization =
				Crud.specialize( User.class, UserInput.class, UserUpdateInput.class, UserFilter.class );

		assertThatThrownBy( () -> specialization.accessor( openCrudSession(), "uuid" ) )
				.isInstanceOf( CrudConfigurationException.class )
				.hasMessageContaining( "CRUD000201" );
		assertThatThrownBy( () -> specialization.accessor( openCrudSession(), null ) )
				.isInstanceOf( CrudConfigurationException.class );
	}

	@Test
	public void testMissingSession() {
		CrudSpecialization<User, UserInput, UserUpdateInput, UserFilter> specialization =
				Crud.specialize( User.class, UserInput.class, UserUpdateInput.class, UserFilter.class );

		assertThatThrownBy( () -> specialization.accessor( null, "id" ) )
				.isInstanceOf( CrudConfigurationException.class )
				.hasMessageContaining( "CRUD000202" );
	}

	@Test
	public void testUnspecializedAccessor() {
		assertThatThrownBy( () -> new CrudAccessor<User, UserInput, UserUpdateInput, UserFilter>( null, openCrudSession(), "id" ) )
				.isInstanceOf( CrudConfigurationException.class )
				.hasMessageContaining( "CRUD000200" );
	}

	@Test
	public void testAccessorByOtherIdentifier() {
		CrudAccessor<User, UserInput, UserUpdateInput, UserFilter> byUsername =
				Crud.specialize( User.class, UserInput.class, UserUpdateInput.class, UserFilter.class )
						.accessor( users.getSession(), "username" );
		users.create( new UserInput( "a", "a@x.com" ) );

		assertThat( byUsername.readById( "a" ).getEmail() ).isEqualTo( "a@x.com" );
		assertThat( byUsername.update( "a", UserUpdateInput.settingBio( "by name" ) ).getBio() ).isEqualTo( "by name" );
		assertThat( byUsername.delete( "a" ) ).isNotNull();
		assertThat( users.read() ).isEmpty();
	}

	public record IdArrayFilter(Long[] id) {
	}

	public record PrimitiveIdArrayFilter(long[] id) {
	}

	public record ActiveUpdate(Optional<Boolean> active) {
	}
}

/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.example;

import java.util.List;
import java.util.Optional;

import org.hibernate.Session;
import org.hibernate.SessionFactory;

import io.crudbase.Crud;
import io.crudbase.CrudAccessor;
import io.crudbase.session.impl.OrmCrudSession;

import static java.lang.System.out;
import static jakarta.persistence.Persistence.createEntityManagerFactory;

/**
 * Demonstrates the blocking {@link CrudAccessor} over a Hibernate ORM
 * session.
 */
public class Main {

	// The first argument can be used to select a persistence unit.
	// Check resources/META-INF/persistence.xml for available names.
	public static void main(String[] args) {
		out.println( "== Blocking API Example ==" );

		// obtain a session factory based on the standard JPA configuration
		// properties specified in resources/META-INF/persistence.xml
		SessionFactory factory = createEntityManagerFactory(
				ExampleProperties.persistenceUnitName( args, "postgresql-blocking-example" ),
				ExampleProperties.overrides()
		).unwrap( SessionFactory.class );

		try ( Session session = factory.openSession() ) {
			CrudAccessor<User, UserInput, UserUpdateInput, UserFilter> users =
					Crud.specialize( User.class, UserInput.class, UserUpdateInput.class, UserFilter.class )
							.accessor( new OrmCrudSession( session ), "id" );

			User iain = users.create( new UserInput( "iain", "iain@example.org", "Writes about the Culture" ) );
			User neal = users.create( new UserInput( "neal", "neal@example.org", null ) );
			out.println( "Created " + iain + " and " + neal );

			// the bio is removed, the other fields stay as they are
			users.update( neal.getId(), new UserUpdateInput( null, null, Optional.empty(), false ) );
			out.println( "Updated " + users.readById( neal.getId() ) );

			List<User> active = users.read( new UserFilter( null, null, true, null ) );
			out.println( "Active users: " + active );

			List<User> firstPage = users.read( 1, 0 );
			out.println( "First page: " + firstPage );

			users.delete( iain.getId() );
			users.delete( neal.getId() );
			out.println( "Remaining users: " + users.read() );
		}
		finally {
			// remember to shut down the factory
			factory.close();
		}
	}
}

/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.example;

import java.util.Optional;

import io.crudbase.Crud;
import io.crudbase.mutiny.MutinyCrudAccessor;
import io.crudbase.session.impl.StageCrudSession;

import static java.lang.System.out;
import static jakarta.persistence.Persistence.createEntityManagerFactory;
import static org.hibernate.reactive.stage.Stage.SessionFactory;

/**
 * Demonstrates the Mutiny-based {@link MutinyCrudAccessor} over a
 * Hibernate Reactive session.
 */
public class MutinyMain {

	// The first argument can be used to select a persistence unit.
	// Check resources/META-INF/persistence.xml for available names.
	public static void main(String[] args) {
		out.println( "== Mutiny API Example ==" );

		SessionFactory factory = createEntityManagerFactory(
				ExampleProperties.persistenceUnitName( args, "postgresql-example" ),
				ExampleProperties.overrides()
		).unwrap( SessionFactory.class );

		try {
			factory.withSession( session -> {
				MutinyCrudAccessor<User, UserInput, UserUpdateInput, UserFilter> users =
						Crud.specialize( User.class, UserInput.class, UserUpdateInput.class, UserFilter.class )
								.mutiny( new StageCrudSession( factory, session ), "id" );

				return users.create( new UserInput( "neal", "neal@example.org", "Wrote Snow Crash" ) )
						.invoke( neal -> out.println( "Created " + neal ) )
						.chain( neal -> users.update( neal.getId(), new UserUpdateInput( null, null, Optional.empty(), false ) ) )
						.invoke( neal -> out.println( "Updated " + neal ) )
						.chain( neal -> users.read( new UserFilter( null, null, false, null ) )
								.invoke( inactive -> out.println( "Inactive users: " + inactive ) )
								.chain( () -> users.delete( neal.getId() ) ) )
						.invoke( deleted -> out.println( "Deleted " + deleted ) )
						.chain( () -> users.delete( -1L ) )
						.invoke( nothing -> out.println( "Deleting user -1 returns " + nothing ) )
						.replaceWithVoid()
						.subscribeAsCompletionStage();
			} )
					// wait for it to finish
					.toCompletableFuture().join();
		}
		finally {
			// remember to shut down the factory
			factory.close();
		}
	}
}

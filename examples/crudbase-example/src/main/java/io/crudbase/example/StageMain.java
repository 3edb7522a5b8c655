/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.example;

import java.util.Optional;

import io.crudbase.Crud;
import io.crudbase.session.impl.StageCrudSession;
import io.crudbase.stage.StageCrudAccessor;

import static java.lang.System.out;
import static jakarta.persistence.Persistence.createEntityManagerFactory;
import static org.hibernate.reactive.stage.Stage.SessionFactory;

/**
 * Demonstrates the {@link java.util.concurrent.CompletionStage}-based
 * {@link StageCrudAccessor} over a Hibernate Reactive session.
 */
public class StageMain {

	// The first argument can be used to select a persistence unit.
	// Check resources/META-INF/persistence.xml for available names.
	public static void main(String[] args) {
		out.println( "== CompletionStage API Example ==" );

		// obtain a factory for reactive sessions based on the
		// standard JPA configuration properties specified in
		// resources/META-INF/persistence.xml
		SessionFactory factory = createEntityManagerFactory(
				ExampleProperties.persistenceUnitName( args, "postgresql-example" ),
				ExampleProperties.overrides()
		).unwrap( SessionFactory.class );

		try {
			factory.withSession( session -> {
				StageCrudAccessor<User, UserInput, UserUpdateInput, UserFilter> users =
						Crud.specialize( User.class, UserInput.class, UserUpdateInput.class, UserFilter.class )
								.stage( new StageCrudSession( factory, session ), "id" );

				return users.create( new UserInput( "iain", "iain@example.org", null ) )
						.thenAccept( iain -> out.println( "Created " + iain ) )
						// filter on one field
						.thenCompose( v -> users.read( new UserFilter( "iain", null, null, null ) ) )
						.thenApply( found -> found.get( 0 ) )
						// change the bio only
						.thenCompose( iain -> users.update( iain.getId(), new UserUpdateInput(
								null,
								null,
								Optional.of( "Writes about the Culture" ),
								null
						) ) )
						.thenAccept( iain -> out.println( "Updated " + iain ) )
						.thenCompose( v -> users.read() )
						.thenAccept( all -> out.println( "All users: " + all ) )
						// an unknown identifier is not an error
						.thenCompose( v -> users.readById( -1L ) )
						.thenAccept( nobody -> out.println( "User -1: " + nobody ) )
						.thenCompose( v -> users.read( new UserFilter( "iain", null, null, null ) ) )
						.thenCompose( found -> users.delete( found.get( 0 ).getId() ) )
						.thenAccept( deleted -> out.println( "Deleted " + deleted ) );
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

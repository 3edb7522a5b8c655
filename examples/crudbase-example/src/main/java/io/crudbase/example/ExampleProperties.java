/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.example;

import java.util.HashMap;
import java.util.Map;

/**
 * Connection settings that override the ones in
 * {@code resources/META-INF/persistence.xml}, taken from the system
 * properties of the same name.
 * <p>
 * For example: {@code -Djakarta.persistence.jdbc.url=jdbc:postgresql://db:5432/crudbase}
 */
final class ExampleProperties {

	private static final String[] OVERRIDABLE = {
			"jakarta.persistence.jdbc.url",
			"jakarta.persistence.jdbc.user",
			"jakarta.persistence.jdbc.password",
			"jakarta.persistence.schema-generation.database.action",
			"hibernate.show_sql"
	};

	private ExampleProperties() {
	}

	static Map<String, String> overrides() {
		Map<String, String> overrides = new HashMap<>();
		for ( String name : OVERRIDABLE ) {
			String value = System.getProperty( name );
			if ( value != null ) {
				overrides.put( name, value );
			}
		}
		return overrides;
	}

	/**
	 * Return the persistence unit name to use in the example.
	 *
	 * @param args the first element is the persistence unit name if present
	 * @param defaultName the unit to use otherwise
	 * @return the selected persistence unit name or the default one
	 */
	static String persistenceUnitName(String[] args, String defaultName) {
		return args.length > 0 ? args[0] : defaultName;
	}
}

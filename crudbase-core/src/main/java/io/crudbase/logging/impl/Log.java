/* Hibernate, Relational Persistence for Idiomatic Java
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright: Red Hat Inc. and Hibernate Authors
 */
package io.crudbase.logging.impl;


import java.util.Collection;

import jakarta.persistence.EntityNotFoundException;

import io.crudbase.exception.CrudConfigurationException;
import io.crudbase.exception.CrudException;
import io.crudbase.exception.CrudValidationException;

import org.jboss.logging.BasicLogger;
import org.jboss.logging.annotations.Cause;
import org.jboss.logging.annotations.LogMessage;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageLogger;

import static org.jboss.logging.Logger.Level.DEBUG;
import static org.jboss.logging.Logger.Level.ERROR;
import static org.jboss.logging.Logger.Level.INFO;
import static org.jboss.logging.Logger.Level.TRACE;
import static org.jboss.logging.Logger.Level.WARN;

@MessageLogger(projectCode = "CRUD")
public interface Log extends BasicLogger {

	@LogMessage(level = DEBUG)
	@Message(id = 1, value = "Specialized accessor [%1$s]")
	void specialized(String signature);

	@LogMessage(level = DEBUG)
	@Message(id = 2, value = "create: %1$s from %2$s")
	void creating(String entityName, Object payload);

	@LogMessage(level = INFO)
	@Message(id = 3, value = "create: created %1$s with %2$s=%3$s")
	void created(String entityName, String idField, Object id);

	@LogMessage(level = ERROR)
	@Message(id = 4, value = "create: commit failed for %1$s")
	void createFailed(String entityName, @Cause Throwable cause);

	@LogMessage(level = DEBUG)
	@Message(id = 5, value = "read: querying %1$s with limit=%2$s, offset=%3$s, filter=%4$s")
	void reading(String entityName, Integer limit, Integer offset, Object filter);

	@LogMessage(level = INFO)
	@Message(id = 6, value = "read: retrieved %2$d %1$s entities")
	void retrieved(String entityName, int count);

	@LogMessage(level = DEBUG)
	@Message(id = 7, value = "get: querying %1$s with %2$s=%3$s")
	void readingById(String entityName, String idField, Object id);

	@LogMessage(level = INFO)
	@Message(id = 8, value = "get: found %1$s with %2$s=%3$s")
	void found(String entityName, String idField, Object id);

	@LogMessage(level = WARN)
	@Message(id = 9, value = "get: no %1$s found with %2$s=%3$s")
	void notFound(String entityName, String idField, Object id);

	@LogMessage(level = DEBUG)
	@Message(id = 10, value = "update: updating %1$s with %2$s=%3$s using fields %4$s")
	void updating(String entityName, String idField, Object id, Collection<String> fields);

	@LogMessage(level = INFO)
	@Message(id = 11, value = "update: updated %1$s with %2$s=%3$s")
	void updated(String entityName, String idField, Object id);

	@LogMessage(level = ERROR)
	@Message(id = 12, value = "update: commit failed for %1$s with %2$s=%3$s")
	void updateFailed(String entityName, String idField, Object id, @Cause Throwable cause);

	@LogMessage(level = WARN)
	@Message(id = 13, value = "delete: no %1$s found with %2$s=%3$s")
	void nothingToDelete(String entityName, String idField, Object id);

	@LogMessage(level = INFO)
	@Message(id = 14, value = "delete: deleted %1$s with %2$s=%3$s")
	void deleted(String entityName, String idField, Object id);

	@LogMessage(level = ERROR)
	@Message(id = 15, value = "delete: commit failed for %1$s with %2$s=%3$s")
	void deleteFailed(String entityName, String idField, Object id, @Cause Throwable cause);

	@LogMessage(level = TRACE)
	@Message(id = 16, value = "Ignoring field '%2$s' of %3$s: not a persistent field of %1$s")
	void ignoringUnmappedField(String entityName, String field, String payloadName);

	@LogMessage(level = WARN)
	@Message(id = 17, value = "Rollback failed after an unsuccessful commit")
	void rollbackFailed(@Cause Throwable cause);

	@Message(id = 100, value = "Type argument '%1$s' must not be null")
	CrudValidationException nullTypeArgument(String role);

	@Message(id = 101, value = "Type %1$s is not a mapped entity class (missing @jakarta.persistence.Entity)")
	CrudValidationException notAnEntityType(String typeName);

	@Message(id = 102, value = "Create payload type %1$s must be a record")
	CrudValidationException createPayloadNotARecord(String typeName);

	@Message(id = 103, value = "Update payload type %1$s must be a record")
	CrudValidationException updatePayloadNotARecord(String typeName);

	@Message(id = 104, value = "Filter payload type %1$s must be a record")
	CrudValidationException filterPayloadNotARecord(String typeName);

	@Message(id = 105, value = "Create payload type %1$s declares components that are not persistent fields of %2$s: %3$s")
	CrudValidationException createPayloadHasUnmappedFields(String typeName, String entityName, Collection<String> fields);

	@Message(id = 106, value = "update: no valid fields to update for %1$s with %2$s=%3$s")
	CrudValidationException nothingToUpdate(String entityName, String idField, Object id);

	@Message(id = 107, value = "read: limit must not be negative: %1$d")
	CrudValidationException negativeLimit(int limit);

	@Message(id = 108, value = "read: offset must not be negative: %1$d")
	CrudValidationException negativeOffset(int offset);

	@Message(id = 109, value = "Component '%2$s' of payload type %1$s has type %3$s, which cannot be assigned to field '%2$s' of %4$s of type %5$s")
	CrudValidationException incompatibleComponentType(String typeName, String component, String componentType, String entityName, String fieldType);

	@Message(id = 110, value = "Value %3$s cannot be assigned to field '%2$s' of %1$s of type %4$s")
	CrudValidationException incompatibleValue(String entityName, String field, Object value, String fieldType);

	@Message(id = 200, value = "Accessor must be obtained from Crud.specialize() with concrete type arguments")
	CrudConfigurationException notSpecialized();

	@Message(id = 201, value = "Entity %1$s has no field '%2$s'")
	CrudConfigurationException unknownIdentifierField(String entityName, String field);

	@Message(id = 202, value = "Accessor requires a session")
	CrudConfigurationException nullSession();

	@Message(id = 203, value = "Entity %1$s does not declare a no-argument constructor")
	CrudConfigurationException noDefaultConstructor(String entityName, @Cause Throwable cause);

	@Message(id = 300, value = "update: no %1$s found with %2$s=%3$s")
	EntityNotFoundException noEntityToUpdate(String entityName, String idField, Object id);

	@Message(id = 301, value = "Could not instantiate entity %1$s")
	CrudException couldNotInstantiate(String entityName, @Cause Throwable cause);

	@Message(id = 302, value = "Could not access component '%2$s' of %1$s")
	CrudException couldNotReadComponent(String typeName, String component, @Cause Throwable cause);
}

package org.carball.sift.exception;

import java.util.List;
import java.util.Map;

/**
 * Thrown when two different field-path sets hash to the same schema name and the
 * disambiguating suffix does not separate them either.
 */
public class SchemaNameCollisionException extends SiftException {

    public SchemaNameCollisionException(String schemaName, List<String> registeredPaths, List<String> incomingPaths) {
        super("SCHEMA_NAME_COLLISION", "assignSchemaName",
                String.format("Schema name %s is already bound to a different shape", schemaName),
                Map.of("schemaName", schemaName,
                        "registeredPaths", registeredPaths,
                        "incomingPaths", incomingPaths),
                null);
    }
}

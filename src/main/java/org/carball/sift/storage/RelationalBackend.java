package org.carball.sift.storage;

import org.carball.sift.model.decision.StorageLocation;
import org.carball.sift.model.schema.RelationalSchema;

import java.util.List;
import java.util.Map;

/**
 * A relational store the pipeline writes into.
 * <p>
 * {@link #apply} must create every table of the schema if it does not exist yet, as a
 * single unit, and must succeed when another caller is applying the same schema at the
 * same time.
 */
public interface RelationalBackend {

    String getName();

    StorageLocation apply(RelationalSchema schema);

    void insert(String tableName, List<Map<String, Object>> rows);
}

package org.carball.sift.storage;

import com.fasterxml.jackson.databind.JsonNode;
import org.carball.sift.model.decision.StorageLocation;
import org.carball.sift.model.schema.DocumentSchema;

import java.util.List;

/**
 * A document store the pipeline writes into. {@link #apply} creates the collection if it
 * does not exist and tolerates concurrent creation.
 */
public interface DocumentBackend {

    String getName();

    StorageLocation apply(DocumentSchema schema);

    void insert(String collectionName, List<JsonNode> documents);
}

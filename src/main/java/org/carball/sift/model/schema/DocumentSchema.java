package org.carball.sift.model.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import org.carball.sift.model.decision.StorageType;

import java.util.Map;

/**
 * A collection and the tree of fields its documents carry. Nested objects and arrays of
 * objects are marked {@code nested} and describe their own {@code fields}.
 */
@Value
@Builder
public class DocumentSchema implements StorageSchema {
    String collectionName;
    Map<String, DocumentField> fieldStructure;

    @Override
    @JsonIgnore
    public String getName() {
        return collectionName;
    }

    @Override
    @JsonIgnore
    public StorageType getStorageType() {
        return StorageType.NOSQL;
    }
}

package org.carball.sift.model.schema;

import org.carball.sift.model.decision.StorageType;

/**
 * A schema a storage backend can apply: either a {@link RelationalSchema} or a
 * {@link DocumentSchema}.
 */
public interface StorageSchema {

    String getName();

    StorageType getStorageType();
}

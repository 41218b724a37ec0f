package org.carball.sift.model.decision;

import java.util.List;

/**
 * Where a decision's records live once its schema is applied.
 */
public record StorageLocation(
        StorageType storageType,
        String backend,
        String location,
        List<String> tables,
        int recordsWritten
) {

    public StorageLocation withRecordsWritten(int count) {
        return new StorageLocation(storageType, backend, location, tables, count);
    }

    public String describe() {
        return location + " (" + storageType.getLabel() + ")";
    }
}

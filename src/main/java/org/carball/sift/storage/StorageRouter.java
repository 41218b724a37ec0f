package org.carball.sift.storage;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.sift.exception.BackendApplyException;
import org.carball.sift.exception.BackendInsertException;
import org.carball.sift.exception.SiftException;
import org.carball.sift.model.decision.SchemaDecision;
import org.carball.sift.model.decision.StorageLocation;
import org.carball.sift.model.schema.RelationalSchema;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Sends a decision's schema and records to the backend it was routed to.
 * <p>
 * Applying a schema is retried under the configured {@link RetryPolicy}; once the
 * attempts are exhausted a {@link BackendApplyException} is thrown. Inserts are not
 * retried and a failed insert does not undo the applied schema.
 */
@Slf4j
public class StorageRouter {

    private final RelationalBackend relationalBackend;
    private final DocumentBackend documentBackend;
    private final RetryPolicy retryPolicy;
    private final RowShredder rowShredder;

    public StorageRouter(RelationalBackend relationalBackend,
                         DocumentBackend documentBackend,
                         RetryPolicy retryPolicy,
                         KeyAllocator keyAllocator) {
        this.relationalBackend = relationalBackend;
        this.documentBackend = documentBackend;
        this.retryPolicy = retryPolicy;
        this.rowShredder = new RowShredder(keyAllocator);
    }

    public StorageLocation apply(SchemaDecision decision) {
        StorageLocation location;
        switch (decision.getStorageType()) {
            case SQL:
                location = applyWithRetry(relationalBackend.getName(), decision.getSchemaName(),
                        () -> relationalBackend.apply(decision.getRelationalSchema()));
                break;
            case NOSQL:
                location = applyWithRetry(documentBackend.getName(), decision.getSchemaName(),
                        () -> documentBackend.apply(decision.getDocumentSchema()));
                break;
            default:
                throw new IllegalArgumentException("Unsupported storage type: " + decision.getStorageType());
        }
        log.info("Applied schema {} at {}", decision.getSchemaName(), location.describe());
        return location;
    }

    public StorageLocation insert(SchemaDecision decision, StorageLocation location, List<JsonNode> records) {
        String backend = location.backend();
        String target = decision.getSchemaName();
        try {
            switch (decision.getStorageType()) {
                case SQL:
                    insertRows(decision.getRelationalSchema(), records);
                    break;
                case NOSQL:
                    documentBackend.insert(decision.getDocumentSchema().getCollectionName(), records);
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported storage type: " + decision.getStorageType());
            }
        } catch (SiftException e) {
            log.error("Insert into {} on {} failed: {}", target, backend, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Insert into {} on {} failed: {}", target, backend, e.getMessage());
            throw new BackendInsertException(backend, target, records.size(), e);
        }

        log.info("Wrote {} record(s) to {}", records.size(), location.describe());
        return location.withRecordsWritten(records.size());
    }

    public StorageLocation store(SchemaDecision decision, List<JsonNode> records) {
        return insert(decision, apply(decision), records);
    }

    private void insertRows(RelationalSchema schema, List<JsonNode> records) {
        Map<String, List<Map<String, Object>>> rows = rowShredder.shred(schema, records);
        for (Map.Entry<String, List<Map<String, Object>>> table : rows.entrySet()) {
            if (!table.getValue().isEmpty()) {
                relationalBackend.insert(table.getKey(), table.getValue());
            }
        }
    }

    private StorageLocation applyWithRetry(String backend, String target, Supplier<StorageLocation> action) {
        try {
            return retryPolicy.execute("Apply " + target + " on " + backend, RuntimeException.class, action);
        } catch (RuntimeException e) {
            log.error("Giving up applying {} on {} after {} attempt(s): {}",
                    target, backend, retryPolicy.getMaxAttempts(), e.getMessage());
            throw BackendApplyException.exhausted(backend, target, retryPolicy.getMaxAttempts(), e);
        }
    }
}

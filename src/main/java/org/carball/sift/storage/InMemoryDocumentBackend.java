package org.carball.sift.storage;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.sift.exception.BackendInsertException;
import org.carball.sift.model.decision.StorageLocation;
import org.carball.sift.model.decision.StorageType;
import org.carball.sift.model.schema.DocumentSchema;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Slf4j
public class InMemoryDocumentBackend implements DocumentBackend {

    public static final String NAME = "memory-docs";

    private final ConcurrentMap<String, List<JsonNode>> collections = new ConcurrentHashMap<>();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public StorageLocation apply(DocumentSchema schema) {
        String collection = schema.getCollectionName();
        collections.computeIfAbsent(collection, name -> {
            log.info("Created collection {}", name);
            return new CopyOnWriteArrayList<>();
        });
        return new StorageLocation(StorageType.NOSQL, NAME, "memory://docs/" + collection,
                List.of(collection), 0);
    }

    @Override
    public void insert(String collectionName, List<JsonNode> documents) {
        List<JsonNode> collection = collections.get(collectionName);
        if (collection == null) {
            throw new BackendInsertException(NAME, collectionName, "collection does not exist");
        }
        for (JsonNode document : documents) {
            collection.add(document.deepCopy());
        }
        log.debug("Inserted {} document(s) into {}", documents.size(), collectionName);
    }

    public boolean hasCollection(String collectionName) {
        return collections.containsKey(collectionName);
    }

    public Set<String> getCollectionNames() {
        return new TreeSet<>(collections.keySet());
    }

    public List<JsonNode> documents(String collectionName) {
        List<JsonNode> collection = collections.get(collectionName);
        return collection == null ? List.of() : List.copyOf(collection);
    }
}

package org.carball.sift.storage;

import org.carball.sift.TestJson;
import org.carball.sift.analyzer.StructureAnalyzer;
import org.carball.sift.builder.IdentifierNormalizer;
import org.carball.sift.builder.RelationalSchemaBuilder;
import org.carball.sift.exception.BackendInsertException;
import org.carball.sift.model.decision.StorageLocation;
import org.carball.sift.model.decision.StorageType;
import org.carball.sift.model.schema.RelationalSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class InMemoryRelationalBackendTest {

    private InMemoryRelationalBackend backend;
    private RelationalSchema schema;

    @BeforeEach
    void setUp() {
        backend = new InMemoryRelationalBackend();
        schema = new RelationalSchemaBuilder(new IdentifierNormalizer(), 32).build(
                new StructureAnalyzer().analyze(TestJson.parse("{\"name\":\"a\",\"tags\":[\"x\"]}")), "people");
    }

    @Test
    void shouldCreateEveryTableOfSchema() {
        // When
        StorageLocation location = backend.apply(schema);

        // Then
        assertThat(location.storageType()).isEqualTo(StorageType.SQL);
        assertThat(location.backend()).isEqualTo("memory-sql");
        assertThat(location.location()).isEqualTo("memory://sql/people");
        assertThat(location.tables()).containsExactly("people", "people_tags");
        assertThat(backend.getTableNames()).containsExactly("people", "people_tags");
        assertThat(backend.getAppliedDdl()).hasSize(2);
    }

    @Test
    void applyShouldBeIdempotent() {
        // When
        backend.apply(schema);
        backend.apply(schema);

        // Then
        assertThat(backend.getAppliedDdl()).hasSize(2);
    }

    @Test
    void concurrentAppliesShouldCreateEachTableOnce() throws Exception {
        // Given
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<StorageLocation>> futures = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < 16; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return backend.apply(schema);
                }));
            }
            start.countDown();
            for (Future<StorageLocation> future : futures) {
                assertThat(future.get().tables()).containsExactly("people", "people_tags");
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertThat(backend.getAppliedDdl()).hasSize(2);
    }

    @Test
    void shouldStoreInsertedRows() {
        // Given
        backend.apply(schema);

        // When
        backend.insert("people", List.of(Map.of("id", 1L, "name", "a")));

        // Then
        assertThat(backend.rows("people")).containsExactly(Map.of("id", 1L, "name", "a"));
        assertThat(backend.rows("missing")).isEmpty();
    }

    @Test
    void shouldRejectInsertIntoMissingTable() {
        assertThatThrownBy(() -> backend.insert("ghost", List.of(Map.of("id", 1L))))
                .isInstanceOf(BackendInsertException.class)
                .hasMessageContaining("table does not exist");
    }

    @Test
    void shouldRejectRowsWithUnknownColumns() {
        // Given
        backend.apply(schema);

        // When/Then
        assertThatThrownBy(() -> backend.insert("people", List.of(Map.of("id", 1L, "age", 3))))
                .isInstanceOf(BackendInsertException.class)
                .hasMessageContaining("unknown column(s) [age]");
        assertThat(backend.rows("people")).isEmpty();
    }

    @Test
    void shouldRejectPrimaryKeyAlreadyStored() {
        // Given
        backend.apply(schema);
        backend.insert("people", List.of(Map.of("id", 1L, "name", "a")));

        // When/Then
        assertThatThrownBy(() -> backend.insert("people", List.of(
                Map.of("id", 2L, "name", "b"), Map.of("id", 1L, "name", "c"))))
                .isInstanceOf(BackendInsertException.class)
                .hasMessageContaining("duplicate primary key id=1");
        assertThat(backend.rows("people")).containsExactly(Map.of("id", 1L, "name", "a"));
    }

    @Test
    void shouldRejectPrimaryKeyRepeatedWithinBatch() {
        // Given
        backend.apply(schema);

        // When/Then
        assertThatThrownBy(() -> backend.insert("people", List.of(
                Map.of("id", 1L, "name", "a"), Map.of("id", 1L, "name", "b"))))
                .isInstanceOf(BackendInsertException.class)
                .hasMessageContaining("duplicate primary key");
        assertThat(backend.rows("people")).isEmpty();
    }

    @Test
    void shouldRejectRowWithoutPrimaryKey() {
        // Given
        backend.apply(schema);

        // When/Then
        assertThatThrownBy(() -> backend.insert("people", List.of(Map.of("name", "a"))))
                .isInstanceOf(BackendInsertException.class)
                .hasMessageContaining("null value for primary key id");
    }
}

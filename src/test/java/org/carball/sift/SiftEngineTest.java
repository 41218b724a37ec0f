package org.carball.sift;

import com.fasterxml.jackson.databind.JsonNode;
import org.carball.sift.config.DecisionThresholds;
import org.carball.sift.config.SiftConfig;
import org.carball.sift.exception.BackendApplyException;
import org.carball.sift.index.InMemoryIndexPersistence;
import org.carball.sift.model.decision.SchemaDecision;
import org.carball.sift.model.decision.StorageLocation;
import org.carball.sift.model.decision.StorageType;
import org.carball.sift.model.index.IndexFilter;
import org.carball.sift.model.index.IngestionDetails;
import org.carball.sift.model.index.IngestionKind;
import org.carball.sift.model.schema.RelationalSchema;
import org.carball.sift.storage.InMemoryRelationalBackend;
import org.carball.sift.storage.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SiftEngineTest {

    @Test
    void shouldWorkWithDefaults() {
        // Given
        SiftEngine engine = SiftEngine.builder().build();

        // When
        SchemaDecision decision = engine.analyzeAndDecide(TestJson.parse("{\"id\":1,\"name\":\"a\"}"));
        StorageLocation location = engine.store(decision, TestJson.records("[{\"id\":1,\"name\":\"a\"}]"));

        // Then
        assertThat(decision.getStorageType()).isEqualTo(StorageType.SQL);
        assertThat(location.recordsWritten()).isEqualTo(1);
        assertThat(engine.getThresholds().getSqlMaxFieldCount()).isEqualTo(50);
        assertThat(engine.getNameRegistry().size()).isEqualTo(1);
    }

    @Test
    void shouldTakeThresholdsFromConfigWhenNotGiven() {
        // Given
        SiftConfig config = SiftConfig.defaults();
        config.setSqlMaxFieldCount(1);

        // When
        SiftEngine engine = SiftEngine.builder().config(config).build();

        // Then
        assertThat(engine.getThresholds().getSqlMaxFieldCount()).isEqualTo(1);
        assertThat(engine.analyzeAndDecide(TestJson.parse("{\"a\":1,\"b\":2}")).getStorageType())
                .isEqualTo(StorageType.NOSQL);
    }

    @Test
    void explicitThresholdsShouldOverrideConfig() {
        // Given
        SiftConfig config = SiftConfig.defaults();
        config.setSqlMaxFieldCount(1);

        // When
        SiftEngine engine = SiftEngine.builder()
                .config(config)
                .thresholds(DecisionThresholds.defaults())
                .build();

        // Then
        assertThat(engine.getThresholds().getSqlMaxFieldCount()).isEqualTo(50);
    }

    @Test
    void shouldApplyIdentifierLengthFromConfig() {
        // Given
        SiftConfig config = SiftConfig.defaults();
        config.setMaxIdentifierLength(12);
        SiftEngine engine = SiftEngine.builder().config(config).build();

        // When
        SchemaDecision decision = engine.analyzeAndDecide(TestJson.parse("{\"a_rather_long_field_name\":1}"));

        // Then
        RelationalSchema schema = decision.getRelationalSchema();
        assertThat(schema.getTableName()).hasSize(12);
        assertThat(schema.findColumn("a_rather_lon")).isNotNull();
    }

    @Test
    void shouldUseConfiguredRetryPolicyForSchemaApply() {
        // Given
        AtomicInteger attempts = new AtomicInteger();
        InMemoryRelationalBackend failing = new InMemoryRelationalBackend() {
            @Override
            public StorageLocation apply(RelationalSchema schema) {
                attempts.incrementAndGet();
                throw new IllegalStateException("unreachable");
            }
        };
        SiftEngine engine = SiftEngine.builder()
                .relationalBackend(failing)
                .retryPolicy(RetryPolicy.builder().maxAttempts(4).sleeper(millis -> { }).build())
                .build();
        SchemaDecision decision = engine.analyzeAndDecide(TestJson.parse("{\"id\":1}"));

        // When/Then
        assertThatThrownBy(() -> engine.applySchema(decision))
                .isInstanceOf(BackendApplyException.class);
        assertThat(attempts).hasValue(4);
    }

    @Test
    void shouldIndexThroughInjectedPersistenceAndClock() {
        // Given
        Instant now = Instant.parse("2024-06-01T08:00:00Z");
        InMemoryIndexPersistence persistence = new InMemoryIndexPersistence();
        SiftEngine engine = SiftEngine.builder()
                .indexPersistence(persistence)
                .clock(Clock.fixed(now, ZoneOffset.UTC))
                .build();

        // When
        long id = engine.recordIngestion(IngestionDetails.media("cat.jpg", "image/jpeg", "animals", "p"));

        // Then
        assertThat(id).isEqualTo(1);
        assertThat(engine.search(IndexFilter.all())).singleElement()
                .satisfies(entry -> assertThat(entry.createdAt()).isEqualTo(now));
        assertThat(engine.stats().count(IngestionKind.MEDIA)).isEqualTo(1);
    }

    @Test
    void unavailableClassifierShouldFallBackToFilename() {
        // Given
        SiftEngine engine = SiftEngine.builder().build();

        // Then
        assertThat(engine.resolveMediaCategory(new byte[0], "beach_travel.png")).isEqualTo("travel");
    }

    @Test
    void sameShapeWithNullableIdentifierShouldReuseStoredTables() {
        // Given
        InMemoryRelationalBackend relational = new InMemoryRelationalBackend();
        SiftEngine engine = SiftEngine.builder().relationalBackend(relational).build();
        List<JsonNode> first = TestJson.records("[{\"id\":1,\"name\":\"a\"}]");
        List<JsonNode> second = TestJson.records("[{\"id\":2,\"name\":\"b\"},{\"id\":null,\"name\":\"c\"}]");

        // When
        SchemaDecision firstDecision = engine.analyzeAndDecide(first);
        engine.store(firstDecision, first);
        SchemaDecision secondDecision = engine.analyzeAndDecide(second);
        StorageLocation location = engine.store(secondDecision, second);

        // Then
        assertThat(secondDecision.getSchemaName()).isEqualTo(firstDecision.getSchemaName());
        assertThat(location.recordsWritten()).isEqualTo(2);
        assertThat(relational.rows(firstDecision.getSchemaName()))
                .extracting(row -> row.get("id_2"))
                .containsExactly(1L, 2L, null);
    }

    @Test
    void scalarAndArrayValuesUnderOnePathShouldGetSeparateSchemas() {
        // Given
        InMemoryRelationalBackend relational = new InMemoryRelationalBackend();
        SiftEngine engine = SiftEngine.builder().relationalBackend(relational).build();
        List<JsonNode> listed = TestJson.records("[{\"tags\":[\"x\"]}]");
        List<JsonNode> single = TestJson.records("[{\"tags\":\"x\"}]");

        // When
        SchemaDecision listedDecision = engine.analyzeAndDecide(listed);
        engine.store(listedDecision, listed);
        SchemaDecision singleDecision = engine.analyzeAndDecide(single);
        engine.store(singleDecision, single);

        // Then
        assertThat(singleDecision.getSchemaName()).isNotEqualTo(listedDecision.getSchemaName());
        assertThat(relational.rows(listedDecision.getSchemaName() + "_tags"))
                .extracting(row -> row.get("value")).containsExactly("x");
        assertThat(relational.rows(singleDecision.getSchemaName()))
                .extracting(row -> row.get("tags")).containsExactly("x");
    }

    @Test
    void storingSameRecordsTwiceShouldKeepPrimaryKeysUnique() {
        // Given
        InMemoryRelationalBackend relational = new InMemoryRelationalBackend();
        SiftEngine engine = SiftEngine.builder().relationalBackend(relational).build();
        List<JsonNode> records = TestJson.records("[{\"id\":1,\"name\":\"a\"},{\"id\":1,\"name\":\"b\"}]");

        // When
        SchemaDecision decision = engine.analyzeAndDecide(records);
        engine.store(decision, records);
        engine.store(engine.analyzeAndDecide(records), records);

        // Then
        assertThat(relational.rows(decision.getSchemaName()))
                .extracting(row -> row.get("id"))
                .containsExactly(1L, 2L, 3L, 4L);
    }
}

package org.carball.sift.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.sift.SiftEngine;
import org.carball.sift.exception.SiftException;
import org.carball.sift.exception.UnsupportedContentException;
import org.carball.sift.media.CategoryDirectoryLayout;
import org.carball.sift.media.DocumentProcessor;
import org.carball.sift.media.ImageMetadataReader;
import org.carball.sift.media.KeywordCategoryMatcher;
import org.carball.sift.media.TextExtractor;
import org.carball.sift.model.decision.SchemaDecision;
import org.carball.sift.model.decision.StorageLocation;
import org.carball.sift.model.index.IngestionDetails;
import org.carball.sift.model.index.IngestionKind;
import org.carball.sift.model.media.ImageMetadata;
import org.carball.sift.model.media.ProcessedDocument;
import org.carball.sift.model.structure.FieldProfile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runs an upload through the pipeline for its content type and assembles the result.
 * Media and documents are written under the category directory layout; JSON payloads
 * are analyzed, routed and written to the chosen backend. Each successful ingestion is
 * indexed exactly once.
 */
@Slf4j
public class IngestionGateway {

    static final String STRUCTURE_SINGLE = "single";
    static final String STRUCTURE_BATCH = "batch";
    private static final int SAMPLE_KEY_COUNT = 5;

    private final SiftEngine engine;
    private final MimeTypeDetector mimeTypeDetector;
    private final DocumentProcessor documentProcessor;
    private final CategoryDirectoryLayout layout;
    private final ObjectMapper objectMapper;
    private final ImageMetadataReader imageMetadataReader = new ImageMetadataReader();

    public IngestionGateway(SiftEngine engine, TextExtractor textExtractor, Path storageRoot) {
        this(engine,
                new MimeTypeDetector(),
                new DocumentProcessor(textExtractor,
                        new KeywordCategoryMatcher(engine.getConfig().getCategoryVocabulary())),
                new CategoryDirectoryLayout(storageRoot));
    }

    public IngestionGateway(SiftEngine engine,
                            MimeTypeDetector mimeTypeDetector,
                            DocumentProcessor documentProcessor,
                            CategoryDirectoryLayout layout) {
        this.engine = engine;
        this.mimeTypeDetector = mimeTypeDetector;
        this.documentProcessor = documentProcessor;
        this.layout = layout;
        this.objectMapper = new ObjectMapper();
    }

    public IngestionResult ingest(UploadedFile upload) throws IOException {
        String mimeType = mimeTypeDetector.detect(upload.filename(), upload.declaredType(), upload.content());
        IngestionKind kind = mimeTypeDetector.route(mimeType)
                .orElseThrow(() -> new UnsupportedContentException(upload.filename(), mimeType));

        log.info("Ingesting {} as {} ({})", upload.filename(), kind.label(), mimeType);
        switch (kind) {
            case MEDIA:
                return ingestMedia(upload, mimeType);
            case DOCUMENT:
                return ingestDocument(upload, mimeType);
            case JSON:
                return ingestJson(upload, mimeType);
            default:
                throw new UnsupportedContentException(upload.filename(), mimeType);
        }
    }

    /**
     * Ingests every upload; a failing item is reported in its result and does not stop
     * the rest.
     */
    public List<IngestionResult> ingestAll(List<UploadedFile> uploads) {
        List<IngestionResult> results = new ArrayList<>();
        for (UploadedFile upload : uploads) {
            try {
                results.add(ingest(upload));
            } catch (SiftException e) {
                log.error("Failed to ingest {}: {}", upload.filename(), e.getStructuredMessage());
                results.add(IngestionResult.failure(upload.filename(), e));
            } catch (IOException | RuntimeException e) {
                log.error("Failed to ingest {}", upload.filename(), e);
                results.add(IngestionResult.failure(upload.filename(), e));
            }
        }
        return results;
    }

    private IngestionResult ingestMedia(UploadedFile upload, String mimeType) throws IOException {
        String category = engine.resolveMediaCategory(upload.content(), upload.filename());
        Path saved = layout.store(category, upload.filename(), upload.content());

        boolean image = mimeType.startsWith("image/");
        Optional<ImageMetadata> header = image ? imageMetadataReader.read(upload.content()) : Optional.empty();
        String format = header.map(ImageMetadata::format).orElse(fileType(mimeType));

        Map<String, Object> facts = new LinkedHashMap<>();
        facts.put("format", format);
        facts.put("file_size", upload.content().length);
        header.ifPresent(h -> {
            facts.put("width", h.width());
            facts.put("height", h.height());
        });

        long id = engine.recordIngestion(IngestionDetails
                .media(upload.filename(), mimeType, category, saved.toString())
                .withMetadata(facts));

        Map<String, Object> inside = new LinkedHashMap<>();
        inside.put("summary", fileType(mimeType) + " " + mimeType.substring(0, mimeType.indexOf('/'))
                + " categorized as " + category);
        inside.put("format", format);
        if (image) {
            inside.put("dimensions", header.map(ImageMetadata::dimensions).orElse("unknown"));
        }
        inside.put("size_bytes", upload.content().length);
        inside.put("description", "Category: " + category + " | Format: " + format
                + " | Size: " + upload.content().length + " bytes");

        return IngestionResult.builder()
                .status(IngestionResult.SUCCESS)
                .filename(upload.filename())
                .kind(IngestionKind.MEDIA)
                .fileType(fileType(mimeType))
                .mimeType(mimeType)
                .categoryOrSchema(category)
                .location(saved.toString())
                .indexId(id)
                .whatsInside(inside)
                .build();
    }

    private IngestionResult ingestDocument(UploadedFile upload, String mimeType) throws IOException {
        ProcessedDocument document = documentProcessor.process(upload.content(), upload.filename(), mimeType);
        Path saved = layout.store(document.category(), upload.filename(), upload.content());
        long id = engine.recordIngestion(IngestionDetails.document(
                upload.filename(), mimeType, document.category(), saved.toString(), document.text()));

        Map<String, Object> inside = new LinkedHashMap<>();
        inside.put("summary", fileType(mimeType) + " document with " + document.wordCount() + " words");
        inside.put("word_count", document.wordCount());
        inside.put("character_count", document.charCount());
        inside.put("line_count", document.lineCount());
        inside.put("has_text", !document.text().isEmpty());
        inside.put("text_preview", document.preview());
        inside.put("properties", document.properties());

        return IngestionResult.builder()
                .status(IngestionResult.SUCCESS)
                .filename(upload.filename())
                .kind(IngestionKind.DOCUMENT)
                .fileType(fileType(mimeType))
                .mimeType(mimeType)
                .categoryOrSchema(document.category())
                .location(saved.toString())
                .indexId(id)
                .whatsInside(inside)
                .build();
    }

    private IngestionResult ingestJson(UploadedFile upload, String mimeType) {
        JsonNode payload = parse(upload);
        SchemaDecision decision = engine.analyzeAndDecide(payload);

        List<JsonNode> records = new ArrayList<>();
        if (payload.isArray()) {
            payload.elements().forEachRemaining(records::add);
        } else {
            records.add(payload);
        }

        StorageLocation location = engine.store(decision, records);
        String structureType = payload.isArray() ? STRUCTURE_BATCH : STRUCTURE_SINGLE;
        List<String> sampleKeys = decision.getDescriptor().getTopLevelFields().stream()
                .map(FieldProfile::getName)
                .limit(SAMPLE_KEY_COUNT)
                .collect(Collectors.toList());

        Map<String, Object> facts = new LinkedHashMap<>();
        facts.put("structure_type", structureType);
        facts.put("sample_keys", sampleKeys);
        long id = engine.recordIngestion(IngestionDetails.json(
                upload.filename(), decision.getSchemaName(), decision.getStorageType(), location.location())
                .withMetadata(facts));

        Map<String, Object> inside = new LinkedHashMap<>();
        inside.put("summary", records.size() + " record(s) stored in " + decision.getStorageType().getLabel()
                + " as " + decision.getSchemaName());
        inside.put("structure_type", structureType);
        inside.put("sample_keys", sampleKeys);
        inside.put("record_count", records.size());
        inside.put("field_count", decision.getReasoning().fieldCount());
        inside.put("nesting_depth", decision.getReasoning().nestingDepth());
        inside.put("consistency", decision.getReasoning().consistency());
        inside.put("tables", location.tables());

        return IngestionResult.builder()
                .status(IngestionResult.SUCCESS)
                .filename(upload.filename())
                .kind(IngestionKind.JSON)
                .fileType(fileType(mimeType))
                .mimeType(mimeType)
                .categoryOrSchema(decision.getSchemaName())
                .location(location.location())
                .indexId(id)
                .whatsInside(inside)
                .decision(decision)
                .recordsWritten(location.recordsWritten())
                .build();
    }

    private JsonNode parse(UploadedFile upload) {
        try {
            return objectMapper.readTree(upload.content());
        } catch (JsonProcessingException e) {
            throw new UnsupportedContentException(upload.filename(), e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UnsupportedContentException(upload.filename(), e.getMessage(), e);
        }
    }

    private String fileType(String mimeType) {
        if (mimeType.endsWith("wordprocessingml.document")) {
            return "DOCX";
        }
        return mimeType.substring(mimeType.lastIndexOf('/') + 1).toUpperCase(Locale.ROOT);
    }
}

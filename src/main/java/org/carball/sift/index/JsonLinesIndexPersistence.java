package org.carball.sift.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.sift.model.index.IndexEntry;
import org.carball.sift.model.index.IndexFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keeps index entries in a file, one JSON object per line. Appends are serialized within
 * this process.
 */
@Slf4j
public class JsonLinesIndexPersistence implements IndexPersistence {

    private static final Pattern ID_FIELD = Pattern.compile("\"id\"\\s*:\\s*(\\d{1,18})");

    private final Path file;
    private final ObjectMapper mapper;

    public JsonLinesIndexPersistence(Path file) {
        this.file = file;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public long nextId() throws IOException {
        Contents contents = readAll();
        long highest = contents.entries().stream().mapToLong(IndexEntry::id).max().orElse(0L);
        return Math.max(highest, contents.highestSkippedId()) + 1;
    }

    @Override
    public synchronized void append(IndexEntry entry) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String line = mapper.writeValueAsString(entry) + System.lineSeparator();
        Files.writeString(file, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    @Override
    public List<IndexEntry> query(IndexFilter filter) throws IOException {
        List<IndexEntry> matches = new ArrayList<>();
        for (IndexEntry entry : readAll().entries()) {
            if (filter.matches(entry)) {
                matches.add(entry);
            }
        }
        return matches;
    }

    @Override
    public String describe() {
        return file.toString();
    }

    /**
     * Reads every entry. A line that does not parse, typically one cut short by a crash
     * during append, is skipped with a warning; an id still readable from it keeps
     * counting towards the next id.
     */
    private synchronized Contents readAll() throws IOException {
        if (!Files.exists(file)) {
            return new Contents(List.of(), 0L);
        }
        List<IndexEntry> entries = new ArrayList<>();
        long highestSkippedId = 0L;
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(mapper.readValue(line, IndexEntry.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable index entry at {}:{}: {}", file, i + 1, e.getOriginalMessage());
                Matcher id = ID_FIELD.matcher(line);
                if (id.find()) {
                    highestSkippedId = Math.max(highestSkippedId, Long.parseLong(id.group(1)));
                }
            }
        }
        log.debug("Read {} index entries from {}", entries.size(), file);
        return new Contents(entries, highestSkippedId);
    }

    private record Contents(List<IndexEntry> entries, long highestSkippedId) {}
}

package org.carball.sift.analyzer;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.sift.config.DecisionThresholds;
import org.carball.sift.exception.EmptyInputException;
import org.carball.sift.exception.InconsistentArrayException;
import org.carball.sift.model.structure.FieldProfile;
import org.carball.sift.model.structure.FieldType;
import org.carball.sift.model.structure.StructuralDescriptor;
import org.carball.sift.model.structure.ValuePattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Derives a {@link StructuralDescriptor} from one JSON record or a batch of them.
 * <p>
 * Records are flattened into field paths using {@code .} between object levels and
 * {@code []} for the elements of arrays of objects, so {@code orders[].sku} is the
 * {@code sku} field of every element of {@code orders}. Arrays of arrays are not
 * descended into. The result depends only on the input and its order.
 */
@Slf4j
public class StructureAnalyzer {

    private static final String ROOT = "";

    private final int maxAnalysisDepth;
    private final PatternDetector patternDetector;

    public StructureAnalyzer() {
        this(DecisionThresholds.defaults().getMaxAnalysisDepth());
    }

    public StructureAnalyzer(int maxAnalysisDepth) {
        this(maxAnalysisDepth, new PatternDetector());
    }

    public StructureAnalyzer(int maxAnalysisDepth, PatternDetector patternDetector) {
        this.maxAnalysisDepth = maxAnalysisDepth;
        this.patternDetector = patternDetector;
    }

    /**
     * Analyzes a single payload: either one object or an array of objects.
     */
    public StructuralDescriptor analyze(JsonNode payload) {
        if (payload == null || payload.isMissingNode()) {
            throw new EmptyInputException("payload");
        }
        if (payload.isObject()) {
            return describe(List.of(payload), false);
        }
        if (payload.isArray()) {
            List<JsonNode> records = new ArrayList<>();
            payload.elements().forEachRemaining(records::add);
            if (records.isEmpty()) {
                throw new EmptyInputException("array payload");
            }
            requireObjects(records);
            return describe(records, true);
        }
        throw InconsistentArrayException.nonObjectRecord(ROOT, FieldType.of(payload).label());
    }

    /**
     * Analyzes a batch of records, each of which must be an object.
     */
    public StructuralDescriptor analyze(List<JsonNode> records) {
        if (records == null || records.isEmpty()) {
            throw new EmptyInputException("record batch");
        }
        requireObjects(records);
        return describe(records, true);
    }

    private void requireObjects(List<JsonNode> records) {
        boolean sawObject = false;
        JsonNode firstOther = null;
        for (JsonNode record : records) {
            if (record != null && record.isObject()) {
                sawObject = true;
            } else if (firstOther == null) {
                firstOther = record;
            }
        }
        if (firstOther == null) {
            return;
        }
        if (sawObject) {
            throw InconsistentArrayException.mixedElements(ROOT);
        }
        throw InconsistentArrayException.nonObjectRecord(ROOT, FieldType.of(firstOther).label());
    }

    private StructuralDescriptor describe(List<JsonNode> records, boolean arrayRoot) {
        Walk walk = new Walk();
        for (JsonNode record : records) {
            walk.visitObject(record, ROOT, ROOT, 0);
        }

        Map<String, FieldProfile> fields = new LinkedHashMap<>();
        int maxLevel = -1;
        for (FieldAccumulator acc : walk.accumulators.values()) {
            int parentInstances = walk.instances.getOrDefault(acc.parentKey(), 0);
            fields.put(acc.path, acc.toProfile(parentInstances));
            maxLevel = Math.max(maxLevel, acc.level);
        }

        int nestingDepth = fields.isEmpty() ? 0 : maxLevel + 1;
        double consistency = computeConsistency(records);

        StructuralDescriptor descriptor = StructuralDescriptor.builder()
                .fieldCount(fields.size())
                .nestingDepth(nestingDepth)
                .fields(Collections.unmodifiableMap(fields))
                .consistency(consistency)
                .arrayRoot(arrayRoot)
                .recordCount(records.size())
                .build();

        log.debug("Analyzed {} record(s): {} field paths, depth {}, consistency {}",
                records.size(), descriptor.getFieldCount(), nestingDepth, consistency);
        return descriptor;
    }

    /**
     * Share of records whose top-level key set equals the most common one. Ties go to the
     * key set seen first.
     */
    private double computeConsistency(List<JsonNode> records) {
        if (records.size() <= 1) {
            return 1.0;
        }

        Map<Set<String>, Integer> counts = new LinkedHashMap<>();
        for (JsonNode record : records) {
            Set<String> keys = new TreeSet<>();
            record.fieldNames().forEachRemaining(keys::add);
            counts.merge(keys, 1, Integer::sum);
        }

        int mode = 0;
        for (int count : counts.values()) {
            if (count > mode) {
                mode = count;
            }
        }
        return (double) mode / records.size();
    }

    private final class Walk {
        private final Map<String, FieldAccumulator> accumulators = new LinkedHashMap<>();
        private final Map<String, Integer> instances = new HashMap<>();

        /**
         * @param parentKey  path of the field owning this object, or "" for a record
         * @param prefix     prefix prepended to child names
         * @param childLevel separator count of the child paths
         */
        void visitObject(JsonNode object, String parentKey, String prefix, int childLevel) {
            if (childLevel + 1 > maxAnalysisDepth) {
                throw InconsistentArrayException.nestingLimitExceeded(
                        parentKey.isEmpty() ? ROOT : parentKey, maxAnalysisDepth);
            }
            instances.merge(parentKey, 1, Integer::sum);

            Iterator<Map.Entry<String, JsonNode>> it = object.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String name = entry.getKey();
                String path = prefix + name;
                JsonNode value = entry.getValue();

                FieldAccumulator acc = accumulators.computeIfAbsent(path,
                        p -> new FieldAccumulator(p, name, parentKey.isEmpty() ? null : parentKey, childLevel));
                acc.observe(value);

                if (value.isObject()) {
                    visitObject(value, path, path + ".", childLevel + 1);
                } else if (value.isArray()) {
                    visitArray(value, acc, childLevel);
                }
            }
        }

        private void visitArray(JsonNode array, FieldAccumulator acc, int level) {
            boolean sawObject = false;
            boolean sawScalar = false;
            for (JsonNode element : array) {
                if (element.isNull()) {
                    continue;
                }
                if (element.isObject()) {
                    sawObject = true;
                } else {
                    sawScalar = true;
                }
                if (sawObject && sawScalar) {
                    throw InconsistentArrayException.mixedElements(acc.path);
                }
            }

            for (JsonNode element : array) {
                if (element.isNull()) {
                    continue;
                }
                acc.observeElement(element);
                if (element.isObject()) {
                    visitObject(element, acc.path, acc.path + "[].", level + 2);
                }
            }
        }
    }

    private final class FieldAccumulator {
        private final String path;
        private final String name;
        private final String parentPath;
        private final int level;

        private FieldType type;
        private boolean sawNull;
        private int occurrences;
        private boolean array;
        private FieldType itemType;
        private boolean integral = true;
        private boolean patternSeen;
        private ValuePattern pattern;

        FieldAccumulator(String path, String name, String parentPath, int level) {
            this.path = path;
            this.name = name;
            this.parentPath = parentPath;
            this.level = level;
        }

        String parentKey() {
            return parentPath == null ? ROOT : parentPath;
        }

        void observe(JsonNode value) {
            occurrences++;
            FieldType observed = FieldType.of(value);
            if (observed == FieldType.NULL) {
                sawNull = true;
            }
            type = type == null ? observed : type.widen(observed);

            if (observed == FieldType.ARRAY) {
                array = true;
            }
            observeScalar(value);
        }

        void observeElement(JsonNode element) {
            FieldType observed = FieldType.of(element);
            itemType = itemType == null ? observed : itemType.widen(observed);
            observeScalar(element);
        }

        private void observeScalar(JsonNode value) {
            if (value.isNumber() && !value.isIntegralNumber()) {
                integral = false;
            }
            if (value.isTextual()) {
                ValuePattern detected = patternDetector.detect(value).orElse(null);
                if (!patternSeen) {
                    pattern = detected;
                    patternSeen = true;
                } else if (pattern != detected) {
                    pattern = null;
                }
            }
        }

        FieldProfile toProfile(int parentInstances) {
            boolean hasNumbers = type == FieldType.NUMBER || itemType == FieldType.NUMBER;
            return FieldProfile.builder()
                    .path(path)
                    .name(name)
                    .parentPath(parentPath)
                    .depth(level)
                    .inferredType(type)
                    .nullable(sawNull || occurrences < parentInstances)
                    .pattern(pattern)
                    .array(array)
                    .itemType(itemType)
                    .integral(hasNumbers && integral)
                    .occurrences(occurrences)
                    .build();
        }
    }
}

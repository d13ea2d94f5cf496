package io.probeflow.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.probeflow.core.model.ProbeRecord;
import io.probeflow.core.model.TagSet;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * JSON view of a {@link ProbeRecord}, used by expression transforms and the
 * console sink.
 *
 * <p>
 * The tag set is rendered as a sorted array of strings under {@code tags}.
 * Field values go through Jackson's default conversion; a value Jackson
 * cannot serialize is rendered as its {@code toString()}.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class RecordJson {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private RecordJson() {}

    public static ObjectNode toJson(ProbeRecord record) {
        ObjectNode node = MAPPER.createObjectNode();
        for (Map.Entry<String, Object> field : record.fields().entrySet()) {
            if (ProbeRecord.TAGS.equals(field.getKey())) {
                ArrayNode tags = node.putArray(ProbeRecord.TAGS);
                record.tags().sorted().forEach(tags::add);
            } else {
                node.set(field.getKey(), valueToTree(field.getValue()));
            }
        }
        return node;
    }

    /**
     * Builds a record from a JSON object. A {@code tags} array becomes the tag
     * set; without one, {@code fallbackTags} is used.
     *
     * @throws IllegalArgumentException if {@code node} is not an object or its
     *                                  {@code tags} entry is not an array of
     *                                  strings
     */
    public static ProbeRecord fromJson(JsonNode node, TagSet fallbackTags) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("record JSON must be an object, got: " + node);
        }
        ProbeRecord.Builder builder = ProbeRecord.builder().tags(fallbackTags);
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (ProbeRecord.TAGS.equals(field.getKey())) {
                builder.tags(tagsFromJson(field.getValue()));
            } else {
                builder.put(field.getKey(), MAPPER.convertValue(field.getValue(), Object.class));
            }
        }
        return builder.build();
    }

    public static String toJsonString(ProbeRecord record) {
        return toJson(record).toString();
    }

    private static TagSet tagsFromJson(JsonNode tags) {
        if (!tags.isArray()) {
            throw new IllegalArgumentException("'tags' must be an array of strings, got: " + tags);
        }
        List<String> values = new ArrayList<>(tags.size());
        for (JsonNode tag : tags) {
            if (!tag.isTextual()) {
                throw new IllegalArgumentException("'tags' must be an array of strings, got: " + tags);
            }
            values.add(tag.asText());
        }
        return TagSet.of(values);
    }

    private static JsonNode valueToTree(Object value) {
        if (value instanceof TagSet) {
            ArrayNode array = MAPPER.createArrayNode();
            ((TagSet) value).sorted().forEach(array::add);
            return array;
        }
        try {
            return MAPPER.valueToTree(value);
        } catch (IllegalArgumentException e) {
            return TextNode.valueOf(String.valueOf(value));
        }
    }
}

package org.openfda.maude.bulkload;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * One document of a bulk request: its {@code index} action line and its source line.
 */
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class BulkDocSection {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final String NEWLINE = "\n";

    @EqualsAndHashCode.Include
    @Getter
    private final String docId;
    private final String serialized;

    private BulkDocSection(String docId, String serialized) {
        this.docId = docId;
        this.serialized = serialized;
    }

    /**
     * Build a section from one JSON line, taking the document id from {@code idField}.
     */
    public static BulkDocSection fromJsonLine(String jsonLine, String idField) {
        JsonNode source;
        try {
            source = OBJECT_MAPPER.readTree(jsonLine);
        } catch (IOException e) {
            throw new DeserializationException("Failed to parse source doc: " + e.getMessage());
        }
        if (source == null || !source.isObject()) {
            throw new DeserializationException("Source doc is not a JSON object");
        }
        JsonNode id = source.get(idField);
        if (id == null || id.isNull() || id.asText().isEmpty()) {
            throw new DeserializationException("Source doc has no '" + idField + "' field");
        }
        ObjectNode action = OBJECT_MAPPER.createObjectNode();
        action.putObject("index").put("_id", id.asText());
        try {
            return new BulkDocSection(id.asText(),
                OBJECT_MAPPER.writeValueAsString(action) + NEWLINE + OBJECT_MAPPER.writeValueAsString(source));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize bulk section for " + id.asText(), e);
        }
    }

    public String asString() {
        return serialized;
    }

    /** Length in bytes of this section in a bulk body, including its trailing newline. */
    public long getSerializedLength() {
        return serialized.getBytes(StandardCharsets.UTF_8).length + 1L;
    }

    public static String convertToBulkRequestBody(Collection<BulkDocSection> bulkSections) {
        StringBuilder builder = new StringBuilder();
        for (BulkDocSection section : bulkSections) {
            builder.append(section.serialized).append(NEWLINE);
        }
        return builder.toString();
    }

    public static class DeserializationException extends RuntimeException {
        public DeserializationException(String message) {
            super(message);
        }
    }
}

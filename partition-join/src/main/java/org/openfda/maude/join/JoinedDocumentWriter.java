package org.openfda.maude.join;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Map;

import org.openfda.maude.ir.Category;
import org.openfda.maude.ir.JoinedDocument;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Writes joined documents as JSON lines: the master fields in schema order, followed by one array per
 * dependent category ({@code patient}, {@code device}, {@code mdr_text}).
 */
public class JoinedDocumentWriter implements AutoCloseable {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final String NEWLINE = "\n";

    private final Writer writer;

    public JoinedDocumentWriter(Writer writer) {
        this.writer = writer instanceof BufferedWriter ? writer : new BufferedWriter(writer);
    }

    public static ObjectNode toJson(JoinedDocument document) {
        ObjectNode node = OBJECT_MAPPER.createObjectNode();
        document.fields().forEach(node::put);
        for (Category category : Category.DEPENDENTS) {
            ArrayNode array = node.putArray(category.nestedName());
            for (Map<String, String> row : document.dependents(category)) {
                ObjectNode child = array.addObject();
                row.forEach(child::put);
            }
        }
        return node;
    }

    public static String toJsonLine(JoinedDocument document) {
        try {
            return OBJECT_MAPPER.writeValueAsString(toJson(document));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize document " + document.key(), e);
        }
    }

    public void write(JoinedDocument document) {
        try {
            writer.write(toJsonLine(document));
            writer.write(NEWLINE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write document " + document.key(), e);
        }
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}

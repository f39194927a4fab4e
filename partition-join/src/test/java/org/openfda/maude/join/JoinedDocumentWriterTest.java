package org.openfda.maude.join;

import java.io.StringWriter;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.openfda.maude.ir.Category;
import org.openfda.maude.ir.JoinKey;
import org.openfda.maude.ir.JoinedDocument;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JoinedDocumentWriterTest {

    @Test
    void masterFieldsThenDependentArrays() throws Exception {
        var fields = new LinkedHashMap<String, String>();
        fields.put("mdr_report_key", "4");
        fields.put("event_key", "");
        var dependents = new EnumMap<Category, List<Map<String, String>>>(Category.class);
        dependents.put(Category.DEVICE, List.of(Map.of("mdr_report_key", "4")));
        var document = new JoinedDocument(new JoinKey("4"), fields, dependents);

        var out = new StringWriter();
        try (var writer = new JoinedDocumentWriter(out)) {
            writer.write(document);
        }

        assertEquals("{\"mdr_report_key\":\"4\",\"event_key\":\"\",\"patient\":[],"
            + "\"device\":[{\"mdr_report_key\":\"4\"}],\"mdr_text\":[]}\n", out.toString());
    }
}

package org.openfda.maude.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One delimiter-separated record. The delimiter is never escaped, so splitting is a plain scan
 * that keeps empty and trailing fields.
 */
public record Row(List<String> fields) {

    public static Row parse(String line, char delimiter) {
        List<String> fields = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == delimiter) {
                fields.add(line.substring(start, i));
                start = i + 1;
            }
        }
        fields.add(line.substring(start));
        return new Row(Collections.unmodifiableList(fields));
    }

    /** The first field of a line without splitting the rest of it. */
    public static String firstField(String line, char delimiter) {
        int end = line.indexOf(delimiter);
        return end < 0 ? line : line.substring(0, end);
    }

    public String field(int index) {
        return fields.get(index);
    }

    public int size() {
        return fields.size();
    }
}

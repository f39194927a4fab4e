package org.openfda.maude.ir;

/**
 * The shared {@code mdr_report_key} value. Keys are matched on their exact text; the shard is derived
 * from the numeric value one digit at a time, so keys longer than a {@code long} still route correctly.
 */
public record JoinKey(String value) {

    public JoinKey {
        if (!isValid(value)) {
            throw new IllegalArgumentException("Join key must be a non-empty run of digits: " + value);
        }
    }

    /** True when the field is non-empty and made only of ASCII digits. */
    public static boolean isValid(String field) {
        if (field == null || field.isEmpty()) {
            return false;
        }
        for (int i = 0; i < field.length(); i++) {
            char c = field.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    /** {@code key mod shardCount}. */
    public int shard(int shardCount) {
        if (shardCount <= 0) {
            throw new IllegalArgumentException("Shard count must be positive: " + shardCount);
        }
        long remainder = 0;
        for (int i = 0; i < value.length(); i++) {
            remainder = (remainder * 10 + (value.charAt(i) - '0')) % shardCount;
        }
        return (int) remainder;
    }

    @Override
    public String toString() {
        return value;
    }
}

package org.openfda.maude.ir;

/**
 * Identifies one of the N partitions of the key space, and names the files that belong to it.
 */
public record ShardId(int number) {

    public static final String JOINED_SUFFIX = ".maude.json";

    public ShardId {
        if (number < 0) {
            throw new IllegalArgumentException("Shard number cannot be negative: " + number);
        }
    }

    /** e.g. {@code 5.mdrfoi.txt} */
    public String categoryFileName(Category category) {
        return number + "." + category.fileToken() + ".txt";
    }

    /** e.g. {@code 5.maude.json} */
    public String joinedFileName() {
        return number + JOINED_SUFFIX;
    }
}

package org.openfda.maude.common;

import java.nio.file.Path;

/**
 * A shard or category file is structurally unusable: its header is missing or wrong, it cannot be
 * created, or the partition layout does not match the join. Fatal to the enclosing stage.
 */
public class SchemaIntegrityException extends MaudePipelineException {
    private final transient Path file;

    public SchemaIntegrityException(Path file, String message) {
        super(message + ": " + file);
        this.file = file;
    }

    public SchemaIntegrityException(Path file, String message, Throwable cause) {
        super(message + ": " + file, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}

package com.musicgraph.harvester.error;

import java.nio.file.Path;

/**
 * Local filesystem failure. Never recorded in the negative cache since the condition may clear
 * on its own.
 */
public class FileStorageException extends HarvesterException {
    private final Path path;

    public FileStorageException(String message, Path path, Throwable cause) {
        super(message, true, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}

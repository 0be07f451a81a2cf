package io.lightchain.core.storage;

import java.io.IOException;
import java.io.UncheckedIOException;

/** Header file I/O failure; fatal for the affected chain until the directory is back. */
public class HeaderStorageException extends UncheckedIOException {
    public HeaderStorageException(String message, IOException cause) {
        super(message, cause);
    }
}

package com.docsort.image;

import java.nio.file.Path;

/**
 * A document could not be turned into an image at all. Fatal for that
 * document; it is reported as a processing error and never retried.
 */
public class ImageAcquisitionException extends Exception {

    private final transient Path file;

    public ImageAcquisitionException(Path file, String message) {
        super(message);
        this.file = file;
    }

    public ImageAcquisitionException(Path file, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}

package com.docsort.recognition;

/**
 * One recognition attempt failed or timed out. The retry ladder treats it as
 * an empty result and moves on.
 */
public class RecognitionException extends Exception {

    public RecognitionException(String message) {
        super(message);
    }

    public RecognitionException(String message, Throwable cause) {
        super(message, cause);
    }
}

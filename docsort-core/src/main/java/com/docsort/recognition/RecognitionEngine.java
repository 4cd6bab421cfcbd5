package com.docsort.recognition;

import com.docsort.model.ImageVariant;

/**
 * Optical text recognition over one image variant.
 */
@FunctionalInterface
public interface RecognitionEngine {

    /**
     * @return the recognized text, possibly empty, in the engine's casing
     * @throws RecognitionException if the engine fails on this variant
     */
    String recognize(ImageVariant variant) throws RecognitionException;
}

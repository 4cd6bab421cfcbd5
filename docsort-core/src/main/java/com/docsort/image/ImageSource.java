package com.docsort.image;

import com.docsort.model.ImageVariant;
import com.docsort.model.Orientation;

import java.nio.file.Path;

/**
 * Supplies the page image for a document and the transforms the retry
 * ladder needs. Transforms must be pure and deterministic.
 */
public interface ImageSource {

    /**
     * Load the first page of a document, upright and at native scale.
     *
     * @throws ImageAcquisitionException if no image can be produced
     */
    ImageVariant load(Path file) throws ImageAcquisitionException;

    ImageVariant rotate(ImageVariant variant, Orientation orientation);

    ImageVariant upscale(ImageVariant variant, double factor);
}

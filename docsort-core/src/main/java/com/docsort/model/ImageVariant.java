package com.docsort.model;

import java.awt.image.BufferedImage;
import java.util.Locale;
import java.util.Objects;

/**
 * One in-memory rendering of a page as submitted to the recognition engine.
 * Variants are never written to disk.
 *
 * @param image       the raster
 * @param orientation rotation relative to the loaded page
 * @param scale       whether the raster has been upscaled
 */
public record ImageVariant(BufferedImage image, Orientation orientation, Scale scale) {

    public enum Scale { NATIVE, UPSCALED }

    public ImageVariant {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(orientation, "orientation");
        Objects.requireNonNull(scale, "scale");
    }

    /** The page as loaded: upright, native resolution. */
    public static ImageVariant original(BufferedImage image) {
        return new ImageVariant(image, Orientation.DEG_0, Scale.NATIVE);
    }

    public int width() { return image.getWidth(); }

    public int height() { return image.getHeight(); }

    public String describe() {
        return "%d° %s %dx%d".formatted(orientation.degrees(), scale.name().toLowerCase(Locale.ROOT),
                width(), height());
    }
}

package com.docsort.image;

import com.docsort.model.Orientation;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;

/**
 * Raster transforms used between recognition attempts.
 */
public final class ImageTransforms {

    private ImageTransforms() {}

    /**
     * Rotate clockwise by a quarter-turn multiple. {@code DEG_0} returns the
     * same instance; 90 and 270 swap width and height.
     */
    public static BufferedImage rotate(BufferedImage src, Orientation orientation) {
        if (orientation == Orientation.DEG_0) return src;

        int w = src.getWidth();
        int h = src.getHeight();
        boolean quarter = orientation != Orientation.DEG_180;
        int outW = quarter ? h : w;
        int outH = quarter ? w : h;

        AffineTransform at = new AffineTransform();
        switch (orientation) {
            case DEG_90 -> {
                at.translate(h, 0);
                at.quadrantRotate(1);
            }
            case DEG_180 -> {
                at.translate(w, h);
                at.quadrantRotate(2);
            }
            case DEG_270 -> {
                at.translate(0, w);
                at.quadrantRotate(3);
            }
            default -> throw new IllegalStateException("Unhandled orientation " + orientation);
        }

        BufferedImage out = new BufferedImage(outW, outH, workingType(src));
        Graphics2D g = out.createGraphics();
        try {
            g.drawImage(src, at, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    /**
     * Enlarge by {@code factor} in both directions with bicubic interpolation.
     *
     * @throws IllegalArgumentException if factor is not positive
     */
    public static BufferedImage upscale(BufferedImage src, double factor) {
        if (!(factor > 0)) {
            throw new IllegalArgumentException("Scale factor must be positive: " + factor);
        }
        int outW = Math.max(1, (int) Math.round(src.getWidth() * factor));
        int outH = Math.max(1, (int) Math.round(src.getHeight() * factor));

        BufferedImage out = new BufferedImage(outW, outH, workingType(src));
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(src, 0, 0, outW, outH, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    // Custom-typed rasters (TYPE_CUSTOM, e.g. from some TIFF decoders) cannot be
    // allocated directly.
    private static int workingType(BufferedImage src) {
        int type = src.getType();
        return type == BufferedImage.TYPE_CUSTOM ? BufferedImage.TYPE_INT_RGB : type;
    }
}

package com.docsort.pipeline;

import com.docsort.image.ImageSource;
import com.docsort.model.ImageVariant;
import com.docsort.model.Orientation;

import java.util.ArrayList;
import java.util.List;

/**
 * One step of the recognition retry ladder: how to derive the image variant
 * for that attempt from the loaded page.
 */
public sealed interface AttemptPlan {

    /** Default upscale factor for the final attempt. */
    double DEFAULT_UPSCALE_FACTOR = 2.0;

    /**
     * Produce this attempt's variant from the upright, native-scale page.
     */
    ImageVariant produce(ImageSource source, ImageVariant original);

    String describe();

    /** The page turned clockwise by a quarter-turn multiple. */
    record Rotation(Orientation orientation) implements AttemptPlan {
        @Override
        public ImageVariant produce(ImageSource source, ImageVariant original) {
            return source.rotate(original, orientation);
        }

        @Override
        public String describe() {
            return "rotation " + orientation.degrees() + "°";
        }
    }

    /** The upright page enlarged by {@code factor}. */
    record Upscale(double factor) implements AttemptPlan {
        public Upscale {
            if (!(factor > 0)) {
                throw new IllegalArgumentException("Scale factor must be positive: " + factor);
            }
        }

        @Override
        public ImageVariant produce(ImageSource source, ImageVariant original) {
            return source.upscale(original, factor);
        }

        @Override
        public String describe() {
            return "upscale x" + factor;
        }
    }

    /**
     * Four rotations in order 0, 90, 180, 270, then one upscale of the
     * upright page: at most five recognition calls.
     */
    static List<AttemptPlan> standardLadder(double upscaleFactor) {
        List<AttemptPlan> plan = new ArrayList<>(5);
        for (Orientation o : Orientation.values()) {
            plan.add(new Rotation(o));
        }
        plan.add(new Upscale(upscaleFactor));
        return List.copyOf(plan);
    }

    static List<AttemptPlan> standardLadder() {
        return standardLadder(DEFAULT_UPSCALE_FACTOR);
    }
}

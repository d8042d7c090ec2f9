package com.example.inkbatch.pipeline;

import com.example.inkbatch.error.ValidationException;

/**
 * Typed configuration of a step. Each implementation validates itself on construction.
 */
public interface StepParameters {

    record None() implements StepParameters {
    }

    record Crop(int threshold, int minMargin) implements StepParameters {
        public Crop {
            if (threshold < 0 || threshold > 255) {
                throw new ValidationException("Crop threshold must be between 0 and 255, got " + threshold);
            }
            if (minMargin < 0) {
                throw new ValidationException("Crop margin must be non-negative, got " + minMargin);
            }
        }
    }

    record Resize(Resolution target) implements StepParameters {
        public Resize {
            if (target == null) {
                throw new ValidationException("Resize target is required");
            }
        }
    }

    record Contrast(double factor) implements StepParameters {
        public Contrast {
            requirePositive("Contrast", factor);
        }
    }

    record Sharpen(double factor) implements StepParameters {
        public Sharpen {
            requirePositive("Sharpen", factor);
        }
    }

    record Quantize(int levels) implements StepParameters {
        public Quantize {
            if (levels < 2 || levels > 256) {
                throw new ValidationException("Quantize levels must be between 2 and 256, got " + levels);
            }
        }
    }

    private static void requirePositive(String name, double factor) {
        if (!(factor > 0) || Double.isInfinite(factor)) {
            throw new ValidationException(name + " factor must be a positive number, got " + factor);
        }
    }
}

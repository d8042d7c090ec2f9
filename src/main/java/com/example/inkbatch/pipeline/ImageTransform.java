package com.example.inkbatch.pipeline;

import java.awt.image.BufferedImage;

/**
 * A raw image operation configured by typed parameters. Implementations must not mutate their input.
 */
@FunctionalInterface
public interface ImageTransform<P extends StepParameters> {
    BufferedImage apply(BufferedImage image, P parameters) throws Exception;
}

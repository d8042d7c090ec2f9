package com.example.inkbatch.pipeline;

/**
 * Factories for the built-in step kinds.
 */
public final class Steps {
    public static final int DEFAULT_CROP_THRESHOLD = 245;
    public static final int DEFAULT_CROP_MARGIN = 10;
    public static final int DEFAULT_QUANTIZE_LEVELS = 16;

    private Steps() {
    }

    public static Step crop(int threshold, int minMargin) {
        return Step.of("crop", StepKind.CROP, new StepParameters.Crop(threshold, minMargin), ImageTransforms::cropMargins);
    }

    public static Step crop() {
        return crop(DEFAULT_CROP_THRESHOLD, DEFAULT_CROP_MARGIN);
    }

    public static Step resize(Resolution target) {
        return Step.of("resize", StepKind.RESIZE, new StepParameters.Resize(target), ImageTransforms::resize)
                .when(image -> image.getWidth() != target.width() || image.getHeight() != target.height());
    }

    public static Step contrast(double factor) {
        return Step.of("contrast", StepKind.CONTRAST, new StepParameters.Contrast(factor), ImageTransforms::contrast)
                .when(image -> factor != 1.0);
    }

    public static Step sharpen(double factor) {
        return Step.of("sharpen", StepKind.SHARPEN, new StepParameters.Sharpen(factor), ImageTransforms::sharpen)
                .when(image -> factor != 1.0);
    }

    public static Step quantize(int levels) {
        return Step.of("quantize", StepKind.QUANTIZE, new StepParameters.Quantize(levels), ImageTransforms::quantize);
    }

    public static Step quantize() {
        return quantize(DEFAULT_QUANTIZE_LEVELS);
    }

    public static Step custom(String name, ImageTransform<StepParameters.None> transform) {
        return Step.of(name, StepKind.CUSTOM, new StepParameters.None(), transform);
    }
}

package com.example.inkbatch.pipeline;

public enum StepKind {
    CROP(true),
    RESIZE(false),
    CONTRAST(false),
    SHARPEN(false),
    QUANTIZE(false),
    CUSTOM(false);

    private final boolean preResize;

    StepKind(boolean preResize) {
        this.preResize = preResize;
    }

    /**
     * Steps of this kind run on the source image before it is scaled to the device resolution.
     */
    public boolean preResize() {
        return preResize;
    }
}

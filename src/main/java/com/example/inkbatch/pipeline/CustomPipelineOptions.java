package com.example.inkbatch.pipeline;

import java.util.Optional;

/**
 * Explicit feature selection for an ad-hoc pipeline; absent entries are left out of the pipeline.
 */
public record CustomPipelineOptions(
        Optional<StepParameters.Crop> crop,
        Optional<Double> contrast,
        Optional<Double> sharpen,
        Optional<Integer> quantizeLevels
) {
    public static CustomPipelineOptions none() {
        return new CustomPipelineOptions(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    public CustomPipelineOptions withCrop(int threshold, int minMargin) {
        return new CustomPipelineOptions(Optional.of(new StepParameters.Crop(threshold, minMargin)), contrast, sharpen, quantizeLevels);
    }

    public CustomPipelineOptions withContrast(double factor) {
        return new CustomPipelineOptions(crop, Optional.of(factor), sharpen, quantizeLevels);
    }

    public CustomPipelineOptions withSharpen(double factor) {
        return new CustomPipelineOptions(crop, contrast, Optional.of(factor), quantizeLevels);
    }

    public CustomPipelineOptions withQuantize(int levels) {
        return new CustomPipelineOptions(crop, contrast, sharpen, Optional.of(levels));
    }
}

package com.example.inkbatch;

import com.example.inkbatch.device.DeviceCatalog;
import com.example.inkbatch.device.DeviceSpec;
import com.example.inkbatch.error.ValidationException;
import com.example.inkbatch.pipeline.CustomPipelineOptions;
import com.example.inkbatch.pipeline.Pipeline;
import com.example.inkbatch.pipeline.PresetFactory;
import com.example.inkbatch.pipeline.Resolution;
import com.example.inkbatch.pipeline.Steps;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Reads a JSON batch configuration, applies defaults and resolves the pipeline.
 */
public class ConfigLoader {
    static final String DEFAULT_PRESET = "kindle";
    static final int DEFAULT_QUALITY = 6;
    static final int DEFAULT_WORKERS = 4;
    static final int DEFAULT_MAX_RETRIES = 3;
    static final long DEFAULT_BASE_DELAY_MILLIS = 1000L;
    static final double DEFAULT_BACKOFF_FACTOR = 2.0;
    static final String DEFAULT_ERROR_REPORT = "errors.json";

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public BatchConfig load(Path path) throws IOException {
        RawConfig raw;
        try {
            raw = mapper.readValue(path.toFile(), RawConfig.class);
        } catch (JsonProcessingException ex) {
            throw new ValidationException("Malformed config file " + path + ": " + ex.getOriginalMessage(), ex);
        }

        if (isBlank(raw.sourceDirectory) || isBlank(raw.destinationDirectory)) {
            throw new ValidationException("Config must include sourceDirectory and destinationDirectory.");
        }
        if (!isBlank(raw.device) && !isBlank(raw.resolution)) {
            throw new ValidationException("Use either device or resolution, not both; a device sets its own resolution.");
        }
        if (!isBlank(raw.preset) && raw.customPipeline != null) {
            throw new ValidationException("Use either preset or customPipeline, not both.");
        }

        Path source = Path.of(raw.sourceDirectory);
        Path destination = Path.of(raw.destinationDirectory);

        Resolution resolution = Resolution.DEFAULT;
        Pipeline pipeline;
        if (!isBlank(raw.device)) {
            DeviceSpec device = DeviceCatalog.get(raw.device);
            resolution = device.resolution();
            pipeline = raw.customPipeline != null ? customPipeline(raw.customPipeline) : devicePipeline(device, raw.preset);
        } else {
            if (!isBlank(raw.resolution)) {
                resolution = Resolution.parse(raw.resolution);
            }
            pipeline = raw.customPipeline != null
                    ? customPipeline(raw.customPipeline)
                    : PresetFactory.getPreset(optionalString(raw.preset, DEFAULT_PRESET));
        }

        int quality = raw.quality != null ? raw.quality : DEFAULT_QUALITY;
        int workers = raw.workers != null ? raw.workers : DEFAULT_WORKERS;
        int maxRetries = raw.maxRetries != null ? raw.maxRetries : DEFAULT_MAX_RETRIES;
        long baseDelayMillis = raw.baseDelayMillis != null ? raw.baseDelayMillis : DEFAULT_BASE_DELAY_MILLIS;
        if (baseDelayMillis < 0) {
            throw new ValidationException("baseDelayMillis must be non-negative.");
        }
        double backoffFactor = raw.backoffFactor != null ? raw.backoffFactor : DEFAULT_BACKOFF_FACTOR;
        boolean continueOnError = raw.continueOnError == null || raw.continueOnError;
        boolean dryRun = raw.dryRun != null && raw.dryRun;
        boolean verbose = raw.verbose != null && raw.verbose;
        Optional<Path> errorReportFile = Optional.ofNullable(raw.errorReportFile)
                .filter(value -> !value.isBlank())
                .map(Path::of)
                .or(() -> Optional.of(destination.resolve(DEFAULT_ERROR_REPORT)));

        return new BatchConfig(
                source,
                destination,
                pipeline,
                resolution,
                quality,
                workers,
                maxRetries,
                Duration.ofMillis(baseDelayMillis),
                backoffFactor,
                continueOnError,
                dryRun,
                verbose,
                errorReportFile
        );
    }

    private Pipeline devicePipeline(DeviceSpec device, String preset) {
        return isBlank(preset) ? PresetFactory.fromDevice(device) : PresetFactory.getPreset(preset);
    }

    private Pipeline customPipeline(RawCustomPipeline raw) {
        CustomPipelineOptions options = CustomPipelineOptions.none();
        if (raw.crop != null && raw.crop) {
            options = options.withCrop(
                    raw.cropThreshold != null ? raw.cropThreshold : Steps.DEFAULT_CROP_THRESHOLD,
                    raw.cropMargin != null ? raw.cropMargin : Steps.DEFAULT_CROP_MARGIN);
        }
        if (raw.contrast != null) {
            options = options.withContrast(raw.contrast);
        }
        if (raw.sharpen != null) {
            options = options.withSharpen(raw.sharpen);
        }
        if (raw.quantizeLevels != null) {
            options = options.withQuantize(raw.quantizeLevels);
        }
        return PresetFactory.custom(options);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private String optionalString(String value, String fallback) {
        if (isBlank(value)) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String sourceDirectory;
        public String destinationDirectory;
        public String resolution;
        public String device;
        public String preset;
        public RawCustomPipeline customPipeline;
        public Integer quality;
        public Integer workers;
        public Integer maxRetries;
        public Long baseDelayMillis;
        public Double backoffFactor;
        public Boolean continueOnError;
        public Boolean dryRun;
        public Boolean verbose;
        public String errorReportFile;
    }

    private static class RawCustomPipeline {
        public Boolean crop;
        public Integer cropThreshold;
        public Integer cropMargin;
        public Double contrast;
        public Double sharpen;
        public Integer quantizeLevels;
    }
}

package com.example.inkbatch.pipeline;

import com.example.inkbatch.device.DeviceSpec;
import com.example.inkbatch.device.DisplayType;
import com.example.inkbatch.error.UnknownPresetException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Named default pipelines and builders for device-derived and ad-hoc ones.
 * Presets never contain a resize step; the batch driver inserts one for the target resolution.
 */
public final class PresetFactory {
    private static final Map<String, Supplier<Pipeline>> PRESETS = new LinkedHashMap<>();

    static {
        PRESETS.put("kindle", () -> eink(1.5, 1.2));
        PRESETS.put("kobo", () -> eink(1.6, 1.3));
        PRESETS.put("tolino", () -> eink(1.5, 1.2));
        PRESETS.put("pocketbook", () -> eink(1.5, 1.2));
        PRESETS.put("pocketbook_color", () -> color(1.3, 1.1));
        PRESETS.put("ipad", () -> color(1.2, 1.4));
        PRESETS.put("eink", () -> eink(1.5, 1.2));
        PRESETS.put("tablet", () -> color(1.3, 1.1));
        PRESETS.put("print", () -> new Pipeline().addStep(Steps.sharpen(1.05)));
        PRESETS.put("high_quality", () -> new Pipeline()
                .addStep(Steps.contrast(1.2))
                .addStep(Steps.sharpen(1.4)));
        PRESETS.put("minimal", Pipeline::new);
        PRESETS.put("scanned_manga", () -> new Pipeline()
                .addStep(Steps.crop(240, 8))
                .addStep(Steps.contrast(1.6))
                .addStep(Steps.sharpen(1.3))
                .addStep(Steps.quantize()));
    }

    private PresetFactory() {
    }

    /**
     * Returns a fresh, mutable pipeline for the named preset (case-insensitive).
     */
    public static Pipeline getPreset(String name) {
        Supplier<Pipeline> preset = PRESETS.get(name.toLowerCase(Locale.ROOT));
        if (preset == null) {
            throw new UnknownPresetException(name, presetNames());
        }
        return preset.get();
    }

    public static List<String> presetNames() {
        return List.copyOf(PRESETS.keySet());
    }

    public static Pipeline custom(CustomPipelineOptions options) {
        Pipeline pipeline = new Pipeline();
        options.crop().ifPresent(crop -> pipeline.addStep(Steps.crop(crop.threshold(), crop.minMargin())));
        options.contrast().ifPresent(factor -> pipeline.addStep(Steps.contrast(factor)));
        options.sharpen().ifPresent(factor -> pipeline.addStep(Steps.sharpen(factor)));
        options.quantizeLevels().ifPresent(levels -> pipeline.addStep(Steps.quantize(levels)));
        return pipeline;
    }

    /**
     * Derives a pipeline from a device's display. E-ink gets more contrast than backlit panels,
     * high-ppi panels get more sharpening, and gray-only panels below 16 bits are quantized
     * to their native gray levels.
     */
    public static Pipeline fromDevice(DeviceSpec device) {
        boolean eink = device.displayType() == DisplayType.EINK;
        double contrast;
        double sharpen;
        if (eink) {
            contrast = device.colorSupport() ? 1.3 : 1.6;
            sharpen = device.ppi() >= 300 ? 1.3 : 1.2;
        } else {
            contrast = 1.2;
            sharpen = device.ppi() >= 300 ? 1.4 : 1.3;
        }
        Pipeline pipeline = new Pipeline()
                .addStep(Steps.crop())
                .addStep(Steps.contrast(contrast))
                .addStep(Steps.sharpen(sharpen));
        if (!device.colorSupport() && device.bitDepth() < 16) {
            pipeline.addStep(Steps.quantize(Math.min(256, 1 << device.bitDepth())));
        }
        return pipeline;
    }

    private static Pipeline eink(double contrast, double sharpen) {
        return new Pipeline()
                .addStep(Steps.crop())
                .addStep(Steps.contrast(contrast))
                .addStep(Steps.sharpen(sharpen))
                .addStep(Steps.quantize());
    }

    private static Pipeline color(double contrast, double sharpen) {
        return new Pipeline()
                .addStep(Steps.crop())
                .addStep(Steps.contrast(contrast))
                .addStep(Steps.sharpen(sharpen));
    }
}

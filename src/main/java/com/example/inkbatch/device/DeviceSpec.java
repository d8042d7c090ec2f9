package com.example.inkbatch.device;

import com.example.inkbatch.pipeline.Resolution;

/**
 * Display characteristics of a target reading device.
 */
public record DeviceSpec(
        String key,
        String name,
        Resolution resolution,
        DisplayType displayType,
        int ppi,
        boolean colorSupport,
        int bitDepth
) {
    @Override
    public String toString() {
        return name + " (" + resolution + ", " + displayType + ", " + (colorSupport ? "Color" : "B&W") + ")";
    }
}

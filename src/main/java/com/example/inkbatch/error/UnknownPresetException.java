package com.example.inkbatch.error;

import java.util.List;

public class UnknownPresetException extends ValidationException {
    private final String presetName;

    public UnknownPresetException(String presetName, List<String> available) {
        super("Unknown preset '" + presetName + "'. Available presets: " + String.join(", ", available));
        this.presetName = presetName;
    }

    public String presetName() {
        return presetName;
    }
}

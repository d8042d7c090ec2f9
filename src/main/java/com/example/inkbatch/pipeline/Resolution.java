package com.example.inkbatch.pipeline;

import com.example.inkbatch.error.ValidationException;

import java.util.Locale;

/**
 * Target output size in pixels.
 */
public record Resolution(int width, int height) {
    public static final Resolution DEFAULT = new Resolution(1404, 1872);

    public Resolution {
        if (width <= 0 || height <= 0) {
            throw new ValidationException("Resolution values must be positive, got " + width + "x" + height);
        }
    }

    /**
     * Parses {@code WIDTHxHEIGHT}, e.g. {@code 1236x1648}.
     */
    public static Resolution parse(String value) {
        String[] parts = value.trim().toLowerCase(Locale.ROOT).split("x");
        if (parts.length != 2) {
            throw new ValidationException("Resolution must be WIDTHxHEIGHT, got '" + value + "'");
        }
        try {
            return new Resolution(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
        } catch (NumberFormatException ex) {
            throw new ValidationException("Resolution must be WIDTHxHEIGHT, got '" + value + "'");
        }
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}

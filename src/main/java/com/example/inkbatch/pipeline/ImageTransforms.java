package com.example.inkbatch.pipeline;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.ConvolveOp;
import java.awt.image.Kernel;

/**
 * Java2D implementations of the built-in transforms. None of them mutate the input image.
 */
final class ImageTransforms {
    // 3x3 smoothing kernel, centre-weighted; the sharpen step extrapolates away from it.
    private static final float[] SMOOTH_KERNEL = {
            1f / 13, 1f / 13, 1f / 13,
            1f / 13, 5f / 13, 1f / 13,
            1f / 13, 1f / 13, 1f / 13
    };

    private ImageTransforms() {
    }

    static BufferedImage cropMargins(BufferedImage image, StepParameters.Crop parameters) {
        int width = image.getWidth();
        int height = image.getHeight();
        int minX = width;
        int minY = height;
        int maxX = -1;
        int maxY = -1;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (luminance(image.getRGB(x, y)) < parameters.threshold()) {
                    minX = Math.min(minX, x);
                    minY = Math.min(minY, y);
                    maxX = Math.max(maxX, x);
                    maxY = Math.max(maxY, y);
                }
            }
        }
        if (maxX < 0) {
            // Blank page.
            return image;
        }
        int left = Math.max(0, minX - parameters.minMargin());
        int top = Math.max(0, minY - parameters.minMargin());
        int right = Math.min(width - 1, maxX + parameters.minMargin());
        int bottom = Math.min(height - 1, maxY + parameters.minMargin());
        if (left == 0 && top == 0 && right == width - 1 && bottom == height - 1) {
            return image;
        }
        BufferedImage cropped = new BufferedImage(right - left + 1, bottom - top + 1, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = cropped.createGraphics();
        g.drawImage(image, -left, -top, null);
        g.dispose();
        return cropped;
    }

    /**
     * Scales to fit inside the target while keeping the aspect ratio, then pads with white to the exact size.
     */
    static BufferedImage resize(BufferedImage image, StepParameters.Resize parameters) {
        Resolution target = parameters.target();
        double scale = Math.min(
                (double) target.width() / image.getWidth(),
                (double) target.height() / image.getHeight());
        int scaledWidth = Math.max(1, (int) Math.round(image.getWidth() * scale));
        int scaledHeight = Math.max(1, (int) Math.round(image.getHeight() * scale));
        BufferedImage output = new BufferedImage(target.width(), target.height(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = output.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, target.width(), target.height());
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            int x = (target.width() - scaledWidth) / 2;
            int y = (target.height() - scaledHeight) / 2;
            g.drawImage(image, x, y, scaledWidth, scaledHeight, null);
        } finally {
            g.dispose();
        }
        return output;
    }

    /**
     * Scales each channel's distance from the mean luminance by {@code factor}.
     */
    static BufferedImage contrast(BufferedImage image, StepParameters.Contrast parameters) {
        BufferedImage source = toRgb(image);
        int width = source.getWidth();
        int height = source.getHeight();
        long sum = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                sum += luminance(source.getRGB(x, y));
            }
        }
        double mean = (double) sum / ((long) width * height);
        double factor = parameters.factor();
        BufferedImage output = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rgb = source.getRGB(x, y);
                int r = clamp(mean + factor * (((rgb >> 16) & 0xFF) - mean));
                int gr = clamp(mean + factor * (((rgb >> 8) & 0xFF) - mean));
                int b = clamp(mean + factor * ((rgb & 0xFF) - mean));
                output.setRGB(x, y, (r << 16) | (gr << 8) | b);
            }
        }
        return output;
    }

    /**
     * Blends between a smoothed copy ({@code factor == 0}) and the original ({@code factor == 1}); above 1 sharpens.
     */
    static BufferedImage sharpen(BufferedImage image, StepParameters.Sharpen parameters) {
        BufferedImage source = toRgb(image);
        ConvolveOp smooth = new ConvolveOp(new Kernel(3, 3, SMOOTH_KERNEL), ConvolveOp.EDGE_NO_OP, null);
        BufferedImage blurred = smooth.filter(source, null);
        double factor = parameters.factor();
        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage output = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int original = source.getRGB(x, y);
                int soft = blurred.getRGB(x, y);
                int r = blend((soft >> 16) & 0xFF, (original >> 16) & 0xFF, factor);
                int gr = blend((soft >> 8) & 0xFF, (original >> 8) & 0xFF, factor);
                int b = blend(soft & 0xFF, original & 0xFF, factor);
                output.setRGB(x, y, (r << 16) | (gr << 8) | b);
            }
        }
        return output;
    }

    /**
     * Converts to grayscale and snaps every pixel to one of {@code levels} evenly spaced gray values.
     */
    static BufferedImage quantize(BufferedImage image, StepParameters.Quantize parameters) {
        int steps = parameters.levels() - 1;
        int width = image.getWidth();
        int height = image.getHeight();
        BufferedImage output = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int gray = luminance(image.getRGB(x, y));
                int level = (int) Math.round(gray * steps / 255.0);
                int value = (int) Math.round(level * 255.0 / steps);
                output.getRaster().setSample(x, y, 0, value);
            }
        }
        return output;
    }

    static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, image.getWidth(), image.getHeight());
        g.drawImage(image, 0, 0, null);
        g.dispose();
        return rgb;
    }

    static int luminance(int rgb) {
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        return (r * 299 + g * 587 + b * 114) / 1000;
    }

    private static int blend(int from, int to, double factor) {
        return clamp(from + factor * (to - from));
    }

    private static int clamp(double value) {
        return (int) Math.max(0, Math.min(255, Math.round(value)));
    }
}

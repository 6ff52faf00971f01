package com.kmg.tagger.model;

import java.awt.image.BufferedImage;

/**
 * Single-channel luminance samples in row-major order, 0-255 scale.
 */
public record LuminanceBuffer(int width, int height, double[] samples) {

    public LuminanceBuffer {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Buffer dimensions must be positive.");
        }
        if (samples.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " samples but got " + samples.length);
        }
    }

    public static LuminanceBuffer fromImage(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        double[] samples = new double[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rgb = image.getRGB(x, y);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                samples[y * width + x] = 0.299 * r + 0.587 * g + 0.114 * b;
            }
        }
        return new LuminanceBuffer(width, height, samples);
    }

    public double at(int x, int y) {
        return samples[y * width + x];
    }
}

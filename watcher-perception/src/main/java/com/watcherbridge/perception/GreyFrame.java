package com.watcherbridge.perception;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import javax.imageio.ImageIO;

/**
 * Decoded 8-bit luminance plane of a camera frame (ITU-R 601 weights).
 */
final class GreyFrame {

    private final int width;
    private final int height;
    private final int[] luma;

    private GreyFrame(int width, int height, int[] luma) {
        this.width = width;
        this.height = height;
        this.luma = luma;
    }

    /**
     * @return the decoded frame, or {@code null} when the bytes are not an image ImageIO can read
     */
    static GreyFrame decode(byte[] encoded) throws IOException {
        if (encoded == null || encoded.length == 0) {
            return null;
        }
        BufferedImage img = ImageIO.read(new ByteArrayInputStream(encoded));
        return img != null ? of(img) : null;
    }

    static GreyFrame of(BufferedImage img) {
        int w = img.getWidth();
        int h = img.getHeight();
        int[] out = new int[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int rgb = img.getRGB(x, y);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                out[y * w + x] = (r * 299 + g * 587 + b * 114) / 1000;
            }
        }
        return new GreyFrame(w, h, out);
    }

    /**
     * Bilinear rescale to the given size; returns {@code this} when it already matches.
     */
    GreyFrame resizeTo(int newW, int newH) {
        if (newW == width && newH == height) {
            return this;
        }
        BufferedImage src = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                src.getRaster().setSample(x, y, 0, luma[y * width + x]);
            }
        }
        BufferedImage resized = new BufferedImage(newW, newH, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = resized.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        g.drawImage(src, 0, 0, newW, newH, null);
        g.dispose();

        int[] out = new int[newW * newH];
        for (int y = 0; y < newH; y++) {
            for (int x = 0; x < newW; x++) {
                out[y * newW + x] = resized.getRaster().getSample(x, y, 0);
            }
        }
        return new GreyFrame(newW, newH, out);
    }

    /**
     * Fraction of pixels whose luminance differs from {@code other} by more than {@code pixelDelta}.
     * Both frames must have the same dimensions.
     */
    double changedRatio(GreyFrame other, int pixelDelta) {
        int changed = 0;
        for (int i = 0; i < luma.length; i++) {
            if (Math.abs(luma[i] - other.luma[i]) > pixelDelta) {
                changed++;
            }
        }
        return luma.length == 0 ? 0.0 : (double) changed / luma.length;
    }

    int width() {
        return width;
    }

    int height() {
        return height;
    }
}

package com.document.intelligence.service;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * Synthetic page rasters for imaging tests.
 */
final class TestPages {

    private TestPages() {
    }

    static BufferedImage blank(int width, int height) {
        BufferedImage page = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = page.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, width, height);
        g.dispose();
        return page;
    }

    /**
     * Twenty text-line-like bars, rotated about the page centre. Positive
     * degrees make the lines descend to the right.
     */
    static BufferedImage textLines(int width, int height, double degrees) {
        BufferedImage page = blank(width, height);
        Graphics2D g = page.createGraphics();
        g.rotate(Math.toRadians(degrees), width / 2.0, height / 2.0);
        g.setColor(Color.BLACK);
        int left = width / 6;
        int barWidth = width * 2 / 3;
        for (int i = 0; i < 20; i++) {
            g.fillRect(left, height / 8 + i * 40, barWidth, 8);
        }
        g.dispose();
        return page;
    }

    /**
     * Header bar, logo block, ruled table and footer bar, all placed by page
     * ratios so the layout is identical at any size.
     */
    static BufferedImage receiptLayout(int width, int height) {
        BufferedImage page = blank(width, height);
        Graphics2D g = page.createGraphics();
        g.setColor(Color.BLACK);

        fill(g, width, height, 0.10, 0.03, 0.80, 0.07);      // header
        fill(g, width, height, 0.02, 0.15, 0.05, 0.05);      // logo

        int stroke = Math.max(2, (int) Math.round(height * 0.004));
        int x0 = px(0.10, width), x1 = px(0.90, width);
        int y0 = px(0.30, height), y1 = px(0.70, height);
        g.fillRect(x0, y0, x1 - x0, stroke);
        g.fillRect(x0, y1 - stroke, x1 - x0, stroke);
        g.fillRect(x0, y0, stroke, y1 - y0);
        g.fillRect(x1 - stroke, y0, stroke, y1 - y0);
        for (int row = 1; row <= 4; row++) {
            g.fillRect(x0, px(0.30 + 0.08 * row, height), x1 - x0, stroke);
        }

        fill(g, width, height, 0.10, 0.88, 0.80, 0.06);      // footer
        g.dispose();
        return page;
    }

    static void fill(Graphics2D g, int width, int height, double x, double y, double w, double h) {
        int x0 = px(x, width), y0 = px(y, height);
        g.fillRect(x0, y0, px(x + w, width) - x0, px(y + h, height) - y0);
    }

    private static int px(double ratio, int size) {
        return (int) Math.round(ratio * size);
    }
}

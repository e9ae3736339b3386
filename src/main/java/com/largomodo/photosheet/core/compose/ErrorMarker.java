package com.largomodo.photosheet.core.compose;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;

/**
 * Paints the placeholder shown in a cell whose photo could not be read.
 * <p>
 * Light grey panel, red border and a red diagonal cross. Contains no text so the engine
 * stays independent of fonts and locale.
 */
public final class ErrorMarker {

    static final Color FILL = new Color(0xEE, 0xEE, 0xEE);
    static final Color INK = new Color(0xD0, 0x20, 0x20);

    private ErrorMarker() {
    }

    public static void paint(Graphics2D g, int x, int y, int width, int height) {
        Graphics2D marker = (Graphics2D) g.create();
        try {
            marker.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            marker.setColor(FILL);
            marker.fillRect(x, y, width, height);

            float stroke = Math.max(1f, Math.min(width, height) / 60f);
            int inset = Math.round(stroke / 2);
            marker.setColor(INK);
            marker.setStroke(new BasicStroke(stroke));
            marker.drawRect(x + inset, y + inset, width - 1 - 2 * inset, height - 1 - 2 * inset);
            marker.drawLine(x, y, x + width - 1, y + height - 1);
            marker.drawLine(x + width - 1, y, x, y + height - 1);
        } finally {
            marker.dispose();
        }
    }
}

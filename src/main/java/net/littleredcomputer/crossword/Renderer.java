// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Draws a (possibly partial) assignment onto its crossword's grid.
 */
public final class Renderer {
    static final char BLOCK = '█';
    private static final int cellSize = 100;
    private static final int cellBorder = 2;
    private static final int interiorSize = cellSize - 2 * cellBorder;

    private Renderer() {}

    /** @return the letter placed in each cell, or 0 where there is none */
    static char[][] letterGrid(Crossword c, Assignment a) {
        char[][] letters = new char[c.height()][c.width()];
        for (Map.Entry<Variable, String> e : a.asMap().entrySet()) {
            Variable v = e.getKey();
            String w = e.getValue();
            for (int k = 0; k < w.length() && k < v.length(); ++k) {
                letters[v.row(k)][v.column(k)] = w.charAt(k);
            }
        }
        return letters;
    }

    /**
     * @return one line per grid row: blocked cells as a full block, open cells as their
     * letter or a space
     */
    public static String toText(Crossword c, Assignment a) {
        char[][] letters = letterGrid(c, a);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < c.height(); ++i) {
            for (int j = 0; j < c.width(); ++j) {
                if (!c.isOpen(i, j)) sb.append(BLOCK);
                else sb.append(letters[i][j] != 0 ? letters[i][j] : ' ');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public static BufferedImage toImage(Crossword c, Assignment a) {
        char[][] letters = letterGrid(c, a);
        BufferedImage img = new BufferedImage(c.width() * cellSize, c.height() * cellSize, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, img.getWidth(), img.getHeight());
            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 80));
            for (int i = 0; i < c.height(); ++i) {
                for (int j = 0; j < c.width(); ++j) {
                    if (!c.isOpen(i, j)) continue;
                    int x = j * cellSize + cellBorder;
                    int y = i * cellSize + cellBorder;
                    g.setColor(Color.WHITE);
                    g.fillRect(x, y, interiorSize, interiorSize);
                    if (letters[i][j] == 0) continue;
                    String s = String.valueOf(letters[i][j]);
                    FontMetrics fm = g.getFontMetrics();
                    g.setColor(Color.BLACK);
                    g.drawString(s,
                            x + (interiorSize - fm.stringWidth(s)) / 2,
                            y + (interiorSize - fm.getHeight()) / 2 + fm.getAscent());
                }
            }
        } finally {
            g.dispose();
        }
        return img;
    }

    public static void savePng(Crossword c, Assignment a, Path file) throws IOException {
        if (!ImageIO.write(toImage(c, a), "png", file.toFile())) {
            throw new IOException("no PNG writer available");
        }
    }
}

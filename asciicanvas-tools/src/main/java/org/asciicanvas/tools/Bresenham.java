package org.asciicanvas.tools;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Integer line rasterization.
 */
public final class Bresenham {

    public record Point(int x, int y) {
    }

    private Bresenham() {
    }

    /**
     * Cells of the segment from (x1, y1) to (x2, y2), both ends included, in that order.
     * <p>
     * Stepping always starts from the endpoint with the smaller (x, y), so swapping the endpoints
     * visits exactly the same cells in reverse order.
     */
    public static List<Point> line(int x1, int y1, int x2, int y2) {
        boolean swap = x1 > x2 || (x1 == x2 && y1 > y2);
        List<Point> points = swap ? step(x2, y2, x1, y1) : step(x1, y1, x2, y2);
        if (swap) {
            Collections.reverse(points);
        }
        return points;
    }

    private static List<Point> step(int x1, int y1, int x2, int y2) {
        int dx = Math.abs(x2 - x1);
        int dy = Math.abs(y2 - y1);
        int sx = x1 < x2 ? 1 : -1;
        int sy = y1 < y2 ? 1 : -1;
        int err = dx - dy;
        int x = x1;
        int y = y1;
        List<Point> points = new ArrayList<>(Math.max(dx, dy) + 1);
        while (true) {
            points.add(new Point(x, y));
            if (x == x2 && y == y2) {
                break;
            }
            int e2 = 2 * err;
            if (e2 > -dy) {
                err -= dy;
                x += sx;
            }
            if (e2 < dx) {
                err += dx;
                y += sy;
            }
        }
        return points;
    }
}

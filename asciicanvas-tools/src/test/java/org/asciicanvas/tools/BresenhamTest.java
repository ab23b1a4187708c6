package org.asciicanvas.tools;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BresenhamTest {

    @Test
    void singlePoint() {
        assertEquals(List.of(new Bresenham.Point(3, 3)), Bresenham.line(3, 3, 3, 3));
    }

    @Test
    void horizontal_includesBothEnds() {
        List<Bresenham.Point> points = Bresenham.line(0, 2, 4, 2);
        assertEquals(5, points.size());
        assertEquals(new Bresenham.Point(0, 2), points.get(0));
        assertEquals(new Bresenham.Point(4, 2), points.get(4));
    }

    @Test
    void diagonal_stepsBothAxes() {
        List<Bresenham.Point> points = Bresenham.line(0, 0, 3, 3);
        assertEquals(List.of(new Bresenham.Point(0, 0), new Bresenham.Point(1, 1),
                new Bresenham.Point(2, 2), new Bresenham.Point(3, 3)), points);
    }

    @Test
    void reversedEndpoints_visitSameCells() {
        int[][] cases = { { 0, 0, 2, 1 }, { 5, 1, 0, 3 }, { 1, 7, 4, 0 }, { 0, 0, 7, 3 }, { 3, 3, 3, 9 } };
        for (int[] c : cases) {
            List<Bresenham.Point> forward = Bresenham.line(c[0], c[1], c[2], c[3]);
            List<Bresenham.Point> backward = new ArrayList<>(Bresenham.line(c[2], c[3], c[0], c[1]));
            Collections.reverse(backward);
            assertEquals(forward, backward);
            assertEquals(new Bresenham.Point(c[0], c[1]), forward.get(0));
            assertEquals(new Bresenham.Point(c[2], c[3]), forward.get(forward.size() - 1));
        }
    }

    @Test
    void consecutivePoints_areAdjacent() {
        List<Bresenham.Point> points = Bresenham.line(-3, 8, 11, -2);
        for (int i = 1; i < points.size(); i++) {
            assertTrue(Math.abs(points.get(i).x() - points.get(i - 1).x()) <= 1);
            assertTrue(Math.abs(points.get(i).y() - points.get(i - 1).y()) <= 1);
        }
        assertEquals(15, points.size());
    }
}

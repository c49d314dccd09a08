package org.janelia.medslice.measure;

import java.util.List;

import org.janelia.medslice.image.VoxelSpacing;

/**
 * In-plane measurements in physical units. Points are (x, y) pixel positions, x along the columns.
 */
public class Measurements {

    public static double distance(double[] p1, double[] p2, VoxelSpacing spacing) {
        checkPoint(p1);
        checkPoint(p2);
        double dx = (p1[0] - p2[0]) * spacing.getWidth();
        double dy = (p1[1] - p2[1]) * spacing.getHeight();
        return Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * Area of the simple polygon with the given vertices (shoelace formula).
     * Fewer than 3 vertices enclose no area.
     */
    public static double polygonArea(List<double[]> vertices, VoxelSpacing spacing) {
        if (vertices.size() < 3) {
            return 0;
        }
        double twiceArea = 0;
        for (int i = 0; i < vertices.size(); i++) {
            double[] p = vertices.get(i);
            double[] q = vertices.get((i + 1) % vertices.size());
            checkPoint(p);
            twiceArea += p[0] * q[1] - q[0] * p[1];
        }
        return Math.abs(twiceArea) / 2 * spacing.getWidth() * spacing.getHeight();
    }

    private static void checkPoint(double[] p) {
        if (p == null || p.length != 2) {
            throw new IllegalArgumentException("A point must have exactly 2 coordinates");
        }
    }
}

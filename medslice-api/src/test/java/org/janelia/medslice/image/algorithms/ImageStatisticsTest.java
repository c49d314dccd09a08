package org.janelia.medslice.image.algorithms;

import org.janelia.medslice.TestUtils;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class ImageStatisticsTest {

    @Test
    public void statisticsOfFiniteSamples() {
        ImageStatistics statistics = ImageStatistics.compute(TestUtils.createVolume(new double[][] {
                {2, 4, 4, 4},
                {5, 5, 7, 9},
                {Double.NaN, Double.NEGATIVE_INFINITY, 4, 5}
        }).getData());
        // 2 4 4 4 5 5 7 9 4 5
        assertEquals(10, statistics.getCount());
        assertEquals(4.9, statistics.getMean(), 1e-9);
        assertEquals(Math.sqrt(3.29), statistics.getStd(), 1e-9);
        assertEquals(2, statistics.getMin(), 0);
        assertEquals(9, statistics.getMax(), 0);
    }

    @Test
    public void emptyStatisticsWithoutFiniteSamples() {
        ImageStatistics statistics = ImageStatistics.compute(TestUtils.createVolume(new double[][] {
                {Double.NaN, Double.POSITIVE_INFINITY}
        }).getData());
        assertEquals(0, statistics.getCount());
        assertEquals(0, statistics.getMean(), 0);
        assertEquals(0, statistics.getStd(), 0);
    }
}

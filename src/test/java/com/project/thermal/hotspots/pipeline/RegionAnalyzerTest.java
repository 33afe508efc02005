package com.project.thermal.hotspots.pipeline;

import com.project.thermal.hotspots.exceptions.InvalidInputException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RegionAnalyzerTest {
    private final RegionAnalyzer analyzer = new RegionAnalyzer(new ArrayMorphologyEngine());

    private static double[][] flat(int rows, int cols, double value) {
        double[][] g = new double[rows][cols];
        for (double[] row : g) Arrays.fill(row, value);
        return g;
    }

    private static LabelMap single(int rows, int cols, int... rowColPairs) {
        int[] lab = new int[rows * cols];
        for (int i = 0; i < rowColPairs.length; i += 2) {
            lab[rowColPairs[i] * cols + rowColPairs[i + 1]] = 1;
        }
        return LabelMap.of(rows, cols, lab, 1);
    }

    @Test
    void analyze_measuresRegionAgainstRingBackground() {
        double[][] t = flat(5, 5, 10.0);
        t[2][2] = 50.0;
        t[1][2] = 30.0;

        List<Region> regions = analyzer.analyze(Grid.of(t), single(5, 5, 2, 2), 1);

        assertThat(regions).hasSize(1);
        Region r = regions.get(0);
        assertThat(r.id()).isEqualTo(1);
        assertThat(r.areaPx()).isEqualTo(1);
        assertThat(r.tMax()).isEqualTo(50.0);
        assertThat(r.tMean()).isEqualTo(50.0);
        // ring {30, 10, 10, 10}
        assertThat(r.tBg()).isEqualTo(10.0);
        assertThat(r.deltaT()).isEqualTo(40.0);
        assertThat(r.row()).isEqualTo(2);
        assertThat(r.col()).isEqualTo(2);
    }

    @Test
    void analyze_peakTie_keepsFirstInRowMajorOrder() {
        double[][] t = flat(3, 5, 0.0);
        t[1][1] = 50.0;
        t[1][2] = 40.0;
        t[1][3] = 50.0;

        Region r = analyzer.analyze(Grid.of(t), single(3, 5, 1, 1, 1, 2, 1, 3), 2).get(0);

        assertThat(r.row()).isEqualTo(1);
        assertThat(r.col()).isEqualTo(1);
        assertThat(r.areaPx()).isEqualTo(3);
        assertThat(r.tMean()).isCloseTo(140.0 / 3, within(1e-12));
    }

    @Test
    void analyze_ringWidthZero_fallsBackToOutsideMedian() {
        double[][] t = flat(3, 3, 20.0);
        t[0][0] = 90.0;
        t[1][1] = 60.0;

        Region r = analyzer.analyze(Grid.of(t), single(3, 3, 1, 1), 0).get(0);

        assertThat(r.tBg()).isEqualTo(20.0);
        assertThat(r.deltaT()).isEqualTo(40.0);
    }

    @Test
    void analyze_regionCoveringGrid_usesGridMedian() {
        Grid g = Grid.of(new double[][]{{1, 2}, {3, 10}});
        LabelMap all = LabelMap.of(2, 2, new int[]{1, 1, 1, 1}, 1);

        Region r = analyzer.analyze(g, all, 5).get(0);

        assertThat(r.tBg()).isEqualTo(2.5);
        assertThat(r.deltaT()).isEqualTo(7.5);
    }

    @Test
    void analyze_ranksByPeakThenContrast() {
        double[][] t = flat(9, 9, 20.0);
        t[1][1] = 60.0;                  // region 1
        t[1][7] = 70.0;                  // region 2, hottest
        t[7][1] = 60.0;                  // region 3, same peak as 1, cooler surroundings
        t[6][0] = 10.0; t[6][1] = 10.0; t[6][2] = 10.0;
        t[7][0] = 10.0; t[7][2] = 10.0;
        t[8][0] = 10.0; t[8][1] = 10.0; t[8][2] = 10.0;
        int[] lab = new int[81];
        lab[1 * 9 + 1] = 1;
        lab[1 * 9 + 7] = 2;
        lab[7 * 9 + 1] = 3;

        List<Region> regions = analyzer.analyze(Grid.of(t), LabelMap.of(9, 9, lab, 3), 1);

        assertThat(regions).extracting(Region::id).containsExactly(2, 3, 1);
        assertThat(regions.get(1).deltaT()).isEqualTo(50.0);
        assertThat(regions.get(2).deltaT()).isEqualTo(40.0);
    }

    @Test
    void ranking_breaksFullTiesById() {
        List<Region> regions = new ArrayList<>(List.of(
                new Region(3, 10, 80, 50, 20, 60, 0, 0),
                new Region(1, 10, 80, 50, 20, 60, 0, 0),
                new Region(2, 10, 90, 50, 20, 70, 0, 0)));

        regions.sort(RegionAnalyzer.RANKING);

        assertThat(regions).extracting(Region::id).containsExactly(2, 1, 3);
    }

    @Test
    void analyze_noRegions_isEmpty() {
        LabelMap none = LabelMap.of(2, 2, new int[4], 0);
        assertThat(analyzer.analyze(Grid.filled(2, 2, 1.0), none, 3)).isEmpty();
    }

    @Test
    void analyze_rejectsShapeMismatch() {
        LabelMap labels = LabelMap.of(2, 3, new int[6], 0);
        assertThatThrownBy(() -> analyzer.analyze(Grid.filled(3, 2, 1.0), labels, 1))
                .isInstanceOf(InvalidInputException.class);
    }
}

package com.project.thermal.hotspots.pipeline;

import com.project.thermal.hotspots.exceptions.InvalidParameterException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class HotspotPipelineTest {
    private final HotspotPipeline pipeline = HotspotPipeline.arrayBacked();

    static Grid withBlocks(int size, double background, double[]... blocks) {
        return withBlocks(size, size, background, blocks);
    }

    static Grid withBlocks(int rows, int cols, double background, double[]... blocks) {
        double[][] t = new double[rows][cols];
        for (int r = 0; r < rows; r++)
            for (int c = 0; c < cols; c++)
                t[r][c] = background;
        // {r0, c0, r1, c1, value}
        for (double[] b : blocks) {
            for (int r = (int) b[0]; r <= (int) b[2]; r++)
                for (int c = (int) b[1]; c <= (int) b[3]; c++)
                    t[r][c] = b[4];
        }
        return Grid.of(t);
    }

    @Test
    void detect_uniformGrid_findsNothing() {
        HotspotDetection det = pipeline.detect(Grid.filled(30, 30, 20.0), DetectionParameters.defaults());

        assertThat(det.hasHotspots()).isFalse();
        assertThat(det.candidates().isEmpty()).isTrue();
        assertThat(det.mask().isEmpty()).isTrue();
        assertThat(det.labels().count()).isZero();
    }

    @Test
    void detect_singleHotBlock() {
        Grid grid = withBlocks(10, 20.0, new double[]{4, 4, 6, 6, 80.0});

        HotspotDetection det = pipeline.detect(grid, DetectionParameters.defaults().withMinRegionArea(5));

        assertThat(det.regions()).hasSize(1);
        Region r = det.regions().get(0);
        assertThat(r.id()).isEqualTo(1);
        assertThat(r.tMax()).isEqualTo(80.0);
        assertThat(r.row()).isBetween(4, 6);
        assertThat(r.col()).isBetween(4, 6);
        assertThat(r.tBg()).isEqualTo(20.0);
        assertThat(r.deltaT()).isEqualTo(60.0);
        assertThat(r.tMean()).isBetween(20.0, 80.0);
        assertThat(r.areaPx()).isGreaterThanOrEqualTo(5);
    }

    @Test
    void detect_singleHotBlock_belowDefaultMinimumArea_isDropped() {
        Grid grid = withBlocks(10, 20.0, new double[]{4, 4, 6, 6, 80.0});

        HotspotDetection det = pipeline.detect(grid, DetectionParameters.defaults());

        assertThat(det.hasHotspots()).isFalse();
        assertThat(det.candidates().isEmpty()).isFalse();
    }

    @Test
    void detect_twoBlocks_rankedHottestFirst() {
        Grid grid = withBlocks(40, 20.0,
                new double[]{8, 8, 12, 12, 80.0},
                new double[]{26, 26, 30, 30, 70.0});
        DetectionParameters params = DetectionParameters.defaults()
                .withGradientPercentile(90)
                .withMinRegionArea(20);

        List<Region> regions = pipeline.detect(grid, params).regions();

        assertThat(regions).hasSize(2);
        assertThat(regions.get(0).tMax()).isEqualTo(80.0);
        assertThat(regions.get(0).row()).isBetween(8, 12);
        assertThat(regions.get(1).tMax()).isEqualTo(70.0);
        assertThat(regions.get(1).row()).isBetween(26, 30);
        assertThat(regions).allSatisfy(r -> assertThat(r.tBg()).isEqualTo(20.0));
    }

    @Test
    void detect_twoBlocksOnStandardFrame_withDefaults_ignoresFlatBackground() {
        // most of the frame has zero gradient, so p97 of the magnitude lands on the minimum
        Grid grid = withBlocks(240, 320, 20.0,
                new double[]{48, 48, 57, 57, 80.0},
                new double[]{144, 144, 153, 153, 70.0});

        HotspotDetection det = pipeline.detect(grid, DetectionParameters.defaults());

        assertThat(det.tau()).isEqualTo(0.0);
        assertThat(det.candidates().count()).isPositive().isLessThan(2_000);
        assertThat(det.candidates().get(0, 0)).isFalse();
        assertThat(det.candidates().get(239, 319)).isFalse();
        assertThat(det.regions()).hasSize(2);
        assertThat(det.regions().get(0).tMax()).isEqualTo(80.0);
        assertThat(det.regions().get(0).row()).isBetween(48, 57);
        assertThat(det.regions().get(1).tMax()).isEqualTo(70.0);
        assertThat(det.regions().get(1).row()).isBetween(144, 153);
        assertThat(det.regions()).allSatisfy(r -> {
            assertThat(r.tBg()).isEqualTo(20.0);
            assertThat(r.areaPx()).isLessThan(1_000);
        });
    }

    @Test
    void detect_outputsAreConsistent() {
        Grid grid = withBlocks(40, 20.0,
                new double[]{8, 8, 12, 12, 80.0},
                new double[]{26, 26, 30, 30, 70.0});
        DetectionParameters params = DetectionParameters.defaults()
                .withGradientPercentile(90)
                .withMinRegionArea(20);

        HotspotDetection det = pipeline.detect(grid, params);

        assertThat(det.labels().count()).isEqualTo(det.regions().size());
        assertThat(det.labels().foreground()).isEqualTo(det.mask());
        int totalArea = det.regions().stream().mapToInt(Region::areaPx).sum();
        assertThat(totalArea).isEqualTo(det.mask().count());
        assertThat(det.regions()).allSatisfy(r -> {
            assertThat(r.areaPx()).isGreaterThanOrEqualTo(params.minRegionArea());
            assertThat(r.deltaT()).isEqualTo(r.tMax() - r.tBg());
            assertThat(r.tMean()).isLessThanOrEqualTo(r.tMax());
            assertThat(det.labels().get(r.row(), r.col())).isEqualTo(r.id());
            assertThat(grid.get(r.row(), r.col())).isEqualTo(r.tMax());
        });
        for (int i = 1; i < det.regions().size(); i++) {
            assertThat(RegionAnalyzer.RANKING.compare(det.regions().get(i - 1), det.regions().get(i)))
                    .isNegative();
        }
    }

    @Test
    void detect_doesNotModifyInput_andIsDeterministic() {
        Grid grid = withBlocks(40, 20.0, new double[]{8, 8, 12, 12, 80.0});
        double[] before = grid.toArray();
        DetectionParameters params = DetectionParameters.defaults().withMinRegionArea(10);

        HotspotDetection first = pipeline.detect(grid, params);
        HotspotDetection second = pipeline.detect(grid, params);

        assertThat(grid.toArray()).containsExactly(before);
        assertThat(second.regions()).isEqualTo(first.regions());
        assertThat(second.mask()).isEqualTo(first.mask());
    }

    @Test
    void detect_rejectsInvalidParametersBeforeWork() {
        Grid grid = Grid.filled(5, 5, 1.0);

        assertThatThrownBy(() -> pipeline.detect(grid, new DetectionParameters(0, 97, 50, 5)))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("gaussianSigma");
        assertThatThrownBy(() -> pipeline.detect(grid, new DetectionParameters(1, 120, 50, 5)))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> pipeline.detect(grid, new DetectionParameters(1, 97, 0, 5)))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("minRegionArea");
        assertThatThrownBy(() -> pipeline.detect(grid, new DetectionParameters(1, 97, 50, -1)))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("ringWidth");
    }
}

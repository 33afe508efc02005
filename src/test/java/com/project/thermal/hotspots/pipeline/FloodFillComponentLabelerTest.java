package com.project.thermal.hotspots.pipeline;

import org.junit.jupiter.api.Test;

import static com.project.thermal.hotspots.pipeline.MaskFixtures.block;
import static com.project.thermal.hotspots.pipeline.MaskFixtures.mask;
import static org.assertj.core.api.Assertions.*;

class FloodFillComponentLabelerTest {
    private final ComponentLabeler labeler = new FloodFillComponentLabeler();

    @Test
    void label_usesFourConnectivity_inRasterOrder() {
        LabelMap labels = labeler.label(mask(
                "##..#",
                "##...",
                "..#..",
                "....#"));

        assertThat(labels.count()).isEqualTo(4);
        assertThat(labels.get(0, 0)).isEqualTo(1);
        assertThat(labels.get(1, 1)).isEqualTo(1);
        assertThat(labels.get(0, 4)).isEqualTo(2);
        // diagonal neighbors are separate regions
        assertThat(labels.get(2, 2)).isEqualTo(3);
        assertThat(labels.get(3, 4)).isEqualTo(4);
        assertThat(labels.areas()).containsExactly(13, 4, 1, 1, 1);
    }

    @Test
    void label_emptyMask_hasNoRegions() {
        LabelMap labels = labeler.label(BinaryMask.empty(4, 4));

        assertThat(labels.count()).isZero();
        assertThat(labels.foreground().isEmpty()).isTrue();
    }

    @Test
    void label_largeRegion_doesNotOverflowStack() {
        LabelMap labels = labeler.label(block(600, 800, 0, 0, 599, 799));

        assertThat(labels.count()).isEqualTo(1);
        assertThat(labels.areas()[1]).isEqualTo(600 * 800);
    }

    @Test
    void label_uShape_isOneRegion() {
        LabelMap labels = labeler.label(mask(
                "#...#",
                "#...#",
                "#####"));

        assertThat(labels.count()).isEqualTo(1);
        assertThat(labels.regionMask(1).count()).isEqualTo(9);
    }
}

package com.project.thermal.hotspots.pipeline;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class GradientFieldTest {
    private final GradientField field = new GradientField();

    @Test
    void gradient_ofLinearRamp_isConstantIncludingEdges() {
        double[][] ramp = new double[4][5];
        for (int r = 0; r < 4; r++)
            for (int c = 0; c < 5; c++)
                ramp[r][c] = 2.0 * c;

        Grid g = field.gradient(Grid.of(ramp));

        for (double v : g.toArray()) {
            assertThat(v).isCloseTo(2.0, within(1e-12));
        }
    }

    @Test
    void gradient_combinesBothAxes() {
        double[][] plane = new double[3][3];
        for (int r = 0; r < 3; r++)
            for (int c = 0; c < 3; c++)
                plane[r][c] = 3.0 * r + 4.0 * c;

        assertThat(field.gradient(Grid.of(plane)).get(1, 1)).isCloseTo(5.0, within(1e-12));
    }

    @Test
    void gradient_usesOneSidedDifferencesAtBorders() {
        Grid g = field.gradient(Grid.of(new double[][]{{0, 1, 4, 9}}));

        // single row: no vertical derivative
        assertThat(g.toArray()).containsExactly(1.0, 2.0, 4.0, 5.0);
    }

    @Test
    void gradient_ofSinglePixel_isZero() {
        assertThat(field.gradient(Grid.filled(1, 1, 42.0)).get(0, 0)).isEqualTo(0.0);
    }

    @Test
    void gradient_ofConstantGrid_isZeroEverywhere() {
        Grid g = field.gradient(Grid.filled(6, 7, 21.5));

        assertThat(g.rows()).isEqualTo(6);
        assertThat(g.cols()).isEqualTo(7);
        for (double v : g.toArray()) {
            assertThat(v).isEqualTo(0.0);
        }
        assertThat(g.max()).isEqualTo(0.0);
    }
}

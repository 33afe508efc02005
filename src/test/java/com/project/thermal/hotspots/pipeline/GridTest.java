package com.project.thermal.hotspots.pipeline;

import com.project.thermal.hotspots.exceptions.InvalidInputException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class GridTest {

    @Test
    void of_nestedRows_isRowMajor() {
        Grid g = Grid.of(new double[][]{{1, 2, 3}, {4, 5, 6}});

        assertThat(g.rows()).isEqualTo(2);
        assertThat(g.cols()).isEqualTo(3);
        assertThat(g.get(1, 0)).isEqualTo(4.0);
        assertThat(g.toArray()).containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(g.min()).isEqualTo(1.0);
        assertThat(g.max()).isEqualTo(6.0);
    }

    @Test
    void of_rejectsEmptyRaggedAndNonFinite() {
        assertThatThrownBy(() -> Grid.of(new double[0][])).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> Grid.of(new double[][]{{}})).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> Grid.of(new double[][]{{1, 2}, {3}}))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("not rectangular");
        assertThatThrownBy(() -> Grid.of(new double[][]{{1, Double.NaN}}))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("row 0, col 1");
        assertThatThrownBy(() -> Grid.of(1, 2, new double[]{1, Double.POSITIVE_INFINITY}))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> Grid.of(2, 2, new double[3])).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void grid_isNotAffectedBySourceOrCopies() {
        double[] src = {1, 2, 3, 4};
        Grid g = Grid.of(2, 2, src);
        src[0] = 99;
        g.toArray()[1] = 99;

        assertThat(g.get(0, 0)).isEqualTo(1.0);
        assertThat(g.get(0, 1)).isEqualTo(2.0);
        assertThat(g).isEqualTo(Grid.of(new double[][]{{1, 2}, {3, 4}}));
    }
}

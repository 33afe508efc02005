package com.project.thermal.hotspots.service;

import com.project.thermal.hotspots.DTOs.HotspotReport;
import com.project.thermal.hotspots.exceptions.InvalidInputException;
import com.project.thermal.hotspots.exceptions.InvalidParameterException;
import com.project.thermal.hotspots.pipeline.DetectionParameters;
import com.project.thermal.hotspots.pipeline.Grid;
import com.project.thermal.hotspots.pipeline.HotspotPipeline;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class HotspotDetectionServiceTest {
    private final HotspotDetectionService service = new HotspotDetectionService(
            new CsvGridLoader(), HotspotPipeline.arrayBacked(), new GridStatistics(),
            new HotspotRenderingService(), new HotspotCsvExporter(), 2, 98);

    static String blockCsv(int size, int r0, int r1, double hot) {
        StringBuilder sb = new StringBuilder("Thermal export\nUnits,C\n");
        for (int r = 0; r < size; r++) {
            sb.append(r);
            for (int c = 0; c < size; c++) {
                boolean inBlock = r >= r0 && r <= r1 && c >= r0 && c <= r1;
                sb.append(',').append(inBlock ? hot : 20.0);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    @Test
    void analyze_csv_producesRankedReportWithArtifacts() {
        byte[] csv = blockCsv(30, 12, 16, 75.0).getBytes(StandardCharsets.UTF_8);

        HotspotReport report = service.analyze(csv, new CsvGridLoader.Shape(30, 30),
                DetectionParameters.defaults().withGradientPercentile(90).withMinRegionArea(20));

        assertThat(report.rows()).isEqualTo(30);
        assertThat(report.cols()).isEqualTo(30);
        assertThat(report.encoding()).isEqualTo("UTF-8");
        assertThat(report.hasHotspots()).isTrue();
        assertThat(report.regions().get(0).tMax()).isEqualTo(75.0);
        assertThat(report.regions().get(0).tBg()).isEqualTo(20.0);
        assertThat(report.top(3)).hasSize(report.regions().size());
        assertThat(report.temperatureStats().max()).isEqualTo(75.0);
        assertThat(report.gradientStats().min()).isEqualTo(0.0);
        assertThat(report.candidatePixels()).isPositive();
        assertThat(report.thermalPng()).isNotEmpty();
        assertThat(report.gradientPng()).isNotEmpty();
        assertThat(report.maskPng()).isNotEmpty();
        assertThat(report.gradientMapPng()).isNotEmpty();
        assertThat(report.histogramPng()).isNotEmpty();
        assertThat(report.thermalInfernoPng()).isNotEmpty();
        assertThat(report.topRegionsPng()).isNotEmpty();
        assertThat(new String(report.csv(), StandardCharsets.UTF_8))
                .startsWith(HotspotCsvExporter.HEADER)
                .contains(",75.0,");
    }

    @Test
    void analyze_flatGrid_reportsNoHotspots() {
        HotspotReport report = service.analyze(Grid.filled(20, 20, 22.0), "UTF-8", DetectionParameters.defaults());

        assertThat(report.hasHotspots()).isFalse();
        assertThat(report.candidatePixels()).isZero();
        assertThat(report.top(3)).isEmpty();
        assertThat(new String(report.csv(), StandardCharsets.UTF_8)).isEqualTo(HotspotCsvExporter.HEADER + "\n");
    }

    @Test
    void analyze_invalidParameters_failBeforeParsing() {
        assertThatThrownBy(() -> service.analyze(new byte[0], null, new DetectionParameters(1, 97, 0, 5)))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void analyze_garbage_isInvalidInput() {
        byte[] garbage = "not,a\nthermal,export\nat,all\n".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> service.analyze(garbage, null, DetectionParameters.defaults()))
                .isInstanceOf(InvalidInputException.class);
    }
}

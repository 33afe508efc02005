package com.project.thermal.hotspots.service;

import com.project.thermal.hotspots.pipeline.Region;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

/** Serializes ranked regions as {@code hotspot_stats.csv}, one record per region, hottest first. */
@Component
public class HotspotCsvExporter {

    public static final String FILENAME = "hotspot_stats.csv";
    public static final String HEADER = "ID,area_px,Tmax_C,Tmean_C,Tbg_C,DeltaT_C,row,col";

    private static final char DELIMITER = ',';
    private static final String NEWLINE = "\n";

    public byte[] export(List<Region> regions) {
        StringBuilder sb = new StringBuilder(64 + regions.size() * 64);
        sb.append(HEADER).append(NEWLINE);
        for (Region r : regions) {
            sb.append(r.id())
                    .append(DELIMITER).append(r.areaPx())
                    .append(DELIMITER).append(num(r.tMax()))
                    .append(DELIMITER).append(num(r.tMean()))
                    .append(DELIMITER).append(num(r.tBg()))
                    .append(DELIMITER).append(num(r.deltaT()))
                    .append(DELIMITER).append(r.row())
                    .append(DELIMITER).append(r.col())
                    .append(NEWLINE);
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    // shortest round-tripping decimal, never in exponent notation
    private static String num(double v) {
        return BigDecimal.valueOf(v).toPlainString();
    }
}

package com.project.thermal.hotspots.config;

import com.project.thermal.hotspots.pipeline.HotspotPipeline;
import com.project.thermal.hotspots.pipeline.OpenCvSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Chooses the pipeline strategies once at startup from {@code app.hotspots.engine}:
 * {@code array} (default) or {@code opencv}. The two can yield different masks on real data,
 * so the choice is fixed for the lifetime of the deployment.
 */
@Configuration
public class HotspotPipelineConfig {
    private static final Logger log = LoggerFactory.getLogger(HotspotPipelineConfig.class);

    public enum Engine { ARRAY, OPENCV }

    @Bean
    public HotspotPipeline hotspotPipeline(@Value("${app.hotspots.engine:array}") String engineName) {
        Engine engine = parse(engineName);
        log.info("Hotspot pipeline engine: {}", engine);
        if (engine == Engine.ARRAY) {
            return HotspotPipeline.arrayBacked();
        }
        if (!OpenCvSupport.isAvailable()) {
            throw new IllegalStateException("app.hotspots.engine=opencv but the OpenCV native library could not be loaded");
        }
        return HotspotPipeline.openCvBacked();
    }

    static Engine parse(String name) {
        try {
            return Engine.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unknown app.hotspots.engine '" + name + "', expected array or opencv", e);
        }
    }
}

package com.jedi.catalog.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class CatalogConfig {

    @Value("${jedi.catalog.threshold-time-prior-flare-minutes:240}")
    private double thresholdTimePriorFlareMinutes;

    @Value("${jedi.catalog.dimming-window-relative-to-flare-minutes-left:0}")
    private double dimmingWindowLeftMinutes;

    @Value("${jedi.catalog.dimming-window-relative-to-flare-minutes-right:240}")
    private double dimmingWindowRightMinutes;

    @Value("${jedi.catalog.threshold-minimum-dimming-window-minutes:120}")
    private double minimumDimmingWindowMinutes;

    @Value("${jedi.catalog.fit-uncertainty:0.002545}")
    private double fitUncertainty;

    @Value("${jedi.catalog.output-path:./jedi-catalog}")
    private String outputPath;

    @Value("${jedi.catalog.verbose:false}")
    private boolean verbose;

    @Bean
    public CatalogSettings catalogSettings() {
        return new CatalogSettings(
                thresholdTimePriorFlareMinutes,
                dimmingWindowLeftMinutes,
                dimmingWindowRightMinutes,
                minimumDimmingWindowMinutes,
                fitUncertainty,
                Path.of(outputPath),
                verbose
        ).validate();
    }
}

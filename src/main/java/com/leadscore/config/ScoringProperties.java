package com.leadscore.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;


@Validated
@ConfigurationProperties(prefix = "scoring")
@Getter
@Setter
public class ScoringProperties {

    @NotBlank
    private String configDir = "configs";
    @NotBlank
    private String configFilePrefix = "SCORE_TUNING_CONFIG_";
    private String baselinePath = "store/baselines/MASTER_PEOPLE_STATS.json";
    @Min(1)
    private int configCacheSize = 16;
    @Min(1)
    private long configCacheTtlMinutes = 60;
}

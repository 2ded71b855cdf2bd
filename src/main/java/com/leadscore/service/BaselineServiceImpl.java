package com.leadscore.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadscore.config.ScoringProperties;
import com.leadscore.dto.NormalizationBaseline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads the prior-run score range used to keep contact and lead scores on a stable scale. A
 * missing or unreadable file is not an error: scoring falls back to batch-relative normalization.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BaselineServiceImpl implements BaselineService {

    private final ObjectMapper objectMapper;
    private final ScoringProperties properties;

    @Override
    public NormalizationBaseline loadBaseline() {
        if (StringUtils.isBlank(properties.getBaselinePath())) {
            return NormalizationBaseline.none();
        }
        Path path = Paths.get(properties.getBaselinePath());
        if (!Files.isRegularFile(path)) {
            log.warn("Baseline stats not found at {}; falling back to batch normalization", path);
            return NormalizationBaseline.none();
        }
        try {
            NormalizationBaseline baseline = objectMapper.readValue(path.toFile(), NormalizationBaseline.class);
            if (baseline == null || baseline.isEmpty()) {
                log.warn("Baseline stats at {} carry no score bounds; falling back to batch normalization", path);
                return NormalizationBaseline.none();
            }
            log.info("Loaded normalization baseline from {}: {}", path, baseline);
            return baseline;
        } catch (IOException e) {
            log.warn("Failed to load baseline stats from {}: {}", path, e.getMessage());
            return NormalizationBaseline.none();
        }
    }
}

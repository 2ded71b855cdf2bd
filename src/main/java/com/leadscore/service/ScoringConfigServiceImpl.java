package com.leadscore.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.leadscore.config.ScoringProperties;
import com.leadscore.exceptions.BadRequestException;
import com.leadscore.exceptions.InternalServerErrorException;
import com.leadscore.models.ScoringConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads the newest local tuning document ({@code <prefix>yyyyMMdd_HHmmss.json}) from the
 * configured directory. Parsed configurations are cached by file name, so a run that scores
 * several batches parses the document once.
 */
@Slf4j
@Service
public class ScoringConfigServiceImpl implements ScoringConfigService {

    private final ObjectMapper objectMapper;
    private final ScoringConfigParser parser;
    private final ScoringProperties properties;
    private final Cache<String, ScoringConfig> configCache;

    public ScoringConfigServiceImpl(ObjectMapper objectMapper,
                                    ScoringConfigParser parser,
                                    ScoringProperties properties,
                                    @Qualifier("scoringConfigCache") Cache<String, ScoringConfig> configCache) {
        this.objectMapper = objectMapper;
        this.parser = parser;
        this.properties = properties;
        this.configCache = configCache;
    }

    @Override
    public ScoringConfig loadLatest() {
        Path latest = findLatestConfigFile()
                .orElseThrow(() -> new BadRequestException(
                        "No " + properties.getConfigFilePrefix() + "*.json found in " + properties.getConfigDir()));
        String key = latest.toAbsolutePath().toString();
        return configCache.get(key, k -> {
            log.info("Loading scoring config: {}", latest.getFileName());
            try (InputStream in = Files.newInputStream(latest)) {
                return load(in);
            } catch (IOException e) {
                throw new InternalServerErrorException("Failed to read scoring config " + latest + ": " + e.getMessage(), e);
            }
        });
    }

    @Override
    public ScoringConfig load(InputStream document) {
        JsonNode root;
        try {
            root = objectMapper.readTree(document);
        } catch (JsonProcessingException e) {
            throw new BadRequestException("Scoring config is not valid JSON: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new InternalServerErrorException("Failed to read scoring config: " + e.getMessage(), e);
        }
        return parser.parse(root);
    }

    Optional<Path> findLatestConfigFile() {
        Path dir = Paths.get(properties.getConfigDir());
        if (!Files.isDirectory(dir)) {
            log.warn("Scoring config directory {} does not exist", dir.toAbsolutePath());
            return Optional.empty();
        }
        String prefix = properties.getConfigFilePrefix();
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(prefix) && name.endsWith(".json");
                    })
                    .max(Comparator.comparing(p -> p.getFileName().toString()));
        } catch (IOException e) {
            throw new InternalServerErrorException("Failed to list scoring configs in " + dir + ": " + e.getMessage(), e);
        }
    }
}

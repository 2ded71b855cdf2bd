package com.leadscore.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.leadscore.exceptions.BadRequestException;
import com.leadscore.models.Keyword;
import com.leadscore.models.PillarConfig;
import com.leadscore.models.Pillars;
import com.leadscore.models.ScoreRule;
import com.leadscore.models.ScoringComponent;
import com.leadscore.models.ScoringConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds an immutable {@link ScoringConfig} from the tuning document.
 * <p>
 * Keyword lists are compiled here, once per component, and every component score is resolved to
 * either a base score or a signed modifier. People pillars store their weight under
 * {@code weight} or, in documents exported from the tuning sheet, under {@code description}.
 * </p>
 */
@Slf4j
@Component
public class ScoringConfigParser {

    static final String PEOPLE_SCORE = "peopleScore";
    static final String COMPANY_SCORE = "companyScore";
    static final String PILLARS = "pillars";
    static final String WEIGHT = "weight";
    static final String LEGACY_WEIGHT = "description";
    static final String COMPONENTS = "components";
    static final String KEYWORDS = "Keywords to Match";
    static final String SCORE = "Score";

    public ScoringConfig parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new BadRequestException("Scoring config must be a JSON object");
        }
        JsonNode peoplePillars = requirePillars(root, PEOPLE_SCORE);
        JsonNode companyPillars = requirePillars(root, COMPANY_SCORE);

        ImmutableMap.Builder<String, PillarConfig> people = ImmutableMap.builder();
        for (String pillar : Pillars.PEOPLE) {
            JsonNode node = peoplePillars.get(pillar);
            if (node == null || node.isNull()) {
                log.warn("Pillar '{}' not found in config; it contributes 0", pillar);
                continue;
            }
            boolean weighted = Pillars.WEIGHTED_PEOPLE.contains(pillar);
            double weight = weighted ? requireWeight(node, pillar, WEIGHT, LEGACY_WEIGHT) : 0.0;
            people.put(pillar, PillarConfig.builder()
                    .name(pillar)
                    .weight(weight)
                    .components(parseComponents(pillar, node.get(COMPONENTS)))
                    .build());
        }

        ImmutableMap.Builder<String, Double> company = ImmutableMap.builder();
        for (String pillar : Pillars.COMPANY) {
            JsonNode node = companyPillars.get(pillar);
            if (node == null || node.isNull()) {
                log.warn("Pillar '{}' not found in config; it contributes 0", pillar);
                continue;
            }
            company.put(pillar, requireWeight(node, pillar, WEIGHT));
        }

        ScoringConfig config = ScoringConfig.builder()
                .peoplePillars(people.build())
                .companyWeights(company.build())
                .build();
        requirePositiveTotal(PEOPLE_SCORE, Pillars.WEIGHTED_PEOPLE.stream().mapToDouble(config::peopleWeight).sum());
        requirePositiveTotal(COMPANY_SCORE, Pillars.COMPANY.stream().mapToDouble(config::companyWeight).sum());

        log.info("Loaded scoring config: people pillars={}, company weights={}",
                config.getPeoplePillars().keySet(), config.getCompanyWeights());
        return config;
    }

    /**
     * Compiles keywords into one case-insensitive pattern. Each keyword must be bounded on both
     * sides by the start/end of the title or by a non-letter.
     */
    public static Pattern compileKeywords(List<String> keywords) {
        String alternation = keywords.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("(^|[^a-z])(" + alternation + ")($|[^a-z])", Pattern.CASE_INSENSITIVE);
    }

    static List<String> splitKeywords(String keywords) {
        if (keywords == null) {
            return List.of();
        }
        return Arrays.stream(keywords.split(","))
                .map(String::trim)
                .filter(k -> !k.isEmpty())
                .collect(Collectors.toList());
    }

    private JsonNode requirePillars(JsonNode root, String section) {
        JsonNode pillars = root.path(section).path(PILLARS);
        if (!pillars.isObject()) {
            throw new BadRequestException("Scoring config is missing '" + section + "." + PILLARS + "'");
        }
        return pillars;
    }

    private double requireWeight(JsonNode pillarNode, String pillar, String... fieldNames) {
        for (String field : fieldNames) {
            JsonNode value = pillarNode.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            OptionalDouble weight = readNumber(value);
            if (weight.isEmpty() || weight.getAsDouble() < 0) {
                throw new BadRequestException("Pillar '" + pillar + "' has an invalid weight: " + value);
            }
            return weight.getAsDouble();
        }
        throw new BadRequestException("Pillar '" + pillar + "' is missing a weight");
    }

    private void requirePositiveTotal(String section, double total) {
        if (total <= 0) {
            throw new BadRequestException("Pillar weights of '" + section + "' must not all be zero");
        }
    }

    private ImmutableList<ScoringComponent> parseComponents(String pillar, JsonNode componentsNode) {
        if (componentsNode == null || !componentsNode.isObject()) {
            return ImmutableList.of();
        }
        ImmutableList.Builder<ScoringComponent> components = ImmutableList.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = componentsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            parseComponent(pillar, field.getKey(), field.getValue()).ifPresent(components::add);
        }
        return components.build();
    }

    private Optional<ScoringComponent> parseComponent(String pillar, String name, JsonNode node) {
        List<String> keywords = splitKeywords(node.path(KEYWORDS).asText(""));
        if (keywords.isEmpty()) {
            log.debug("Skipping component '{}/{}' without keywords", pillar, name);
            return Optional.empty();
        }
        ScoreRule rule = parseRule(pillar, name, node.get(SCORE));
        if (rule == null) {
            return Optional.empty();
        }

        List<Keyword> compiled = new ArrayList<>(keywords.size());
        for (String keyword : keywords) {
            compiled.add(new Keyword(keyword, compileKeywords(List.of(keyword))));
        }
        return Optional.of(ScoringComponent.builder()
                .name(name)
                .keywords(ImmutableList.copyOf(compiled))
                .pattern(compileKeywords(keywords))
                .rule(rule)
                .build());
    }

    private ScoreRule parseRule(String pillar, String name, JsonNode score) {
        if (score == null || score.isNull()) {
            log.debug("Skipping component '{}/{}' without a score", pillar, name);
            return null;
        }
        if (score.isNumber()) {
            int value = score.asInt();
            return value == 0 ? null : new ScoreRule.BaseScore(value);
        }

        String text = score.asText("").trim();
        if (text.isEmpty()) {
            return null;
        }
        // domain rules only take numeric scores
        if (Pillars.DOMAIN.equals(pillar)) {
            log.warn("Skipping component '{}/{}' with non-numeric score '{}'", pillar, name, text);
            return null;
        }
        boolean modifier = text.startsWith("+") || text.startsWith("-");
        try {
            int value = Integer.parseInt(text);
            if (value == 0) {
                return null;
            }
            return modifier ? new ScoreRule.ScoreModifier(value) : new ScoreRule.BaseScore(value);
        } catch (NumberFormatException e) {
            log.warn("Skipping component '{}/{}' with unparseable score '{}'", pillar, name, text);
            return null;
        }
    }

    private OptionalDouble readNumber(JsonNode value) {
        if (value.isNumber()) {
            return OptionalDouble.of(value.asDouble());
        }
        try {
            return OptionalDouble.of(Double.parseDouble(value.asText().trim()));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }
}

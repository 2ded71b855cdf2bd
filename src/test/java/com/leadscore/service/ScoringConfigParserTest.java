package com.leadscore.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadscore.TestConfigs;
import com.leadscore.exceptions.BadRequestException;
import com.leadscore.models.Pillars;
import com.leadscore.models.ScoreRule;
import com.leadscore.models.ScoringComponent;
import com.leadscore.models.ScoringConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class ScoringConfigParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ScoringConfigParser parser = new ScoringConfigParser();

    @Test
    void parse_shouldBuildStandardConfig() {
        ScoringConfig config = TestConfigs.standard();

        assertEquals(50.0, config.peopleWeight(Pillars.SENIORITY));
        assertEquals(50.0, config.peopleWeight(Pillars.DOMAIN));
        assertEquals(0.0, config.peopleWeight(Pillars.WARMTH));
        assertEquals(0.0, config.peopleWeight(Pillars.ONE_OFFS));
        assertEquals(40.0, config.companyWeight(Pillars.BUDGET));

        List<ScoringComponent> seniority = config.components(Pillars.SENIORITY);
        assertEquals(7, seniority.size());
        ScoringComponent senior = seniority.stream().filter(c -> c.getName().equals("Senior")).findFirst().orElseThrow();
        assertEquals(new ScoreRule.ScoreModifier(10), senior.getRule());
        assertEquals(new ScoreRule.BaseScore(95), seniority.get(0).getRule(), "components keep document order");
        assertEquals(2, config.components(Pillars.ONE_OFFS).size());
    }

    @Test
    void parse_shouldReadWeightField_andLegacyDescription() {
        ScoringConfig config = parser.parse(read("""
                {"peopleScore": {"pillars": {
                    "Seniority": {"weight": 2, "components": {}},
                    "Domain": {"description": " 1.5 ", "components": {}},
                    "Warmth": {"weight": "0"}}},
                 "companyScore": {"pillars": {"Alignment": {"weight": 1}, "Budget": {"weight": 1}, "Demand": {"weight": 1}}}}
                """));

        assertEquals(2.0, config.peopleWeight(Pillars.SENIORITY));
        assertEquals(1.5, config.peopleWeight(Pillars.DOMAIN));
    }

    @Test
    void parse_shouldTreatAbsentPillarAsContributingNothing() {
        ScoringConfig config = parser.parse(read("""
                {"peopleScore": {"pillars": {"Seniority": {"weight": 1, "components": {
                    "CEO": {"Keywords to Match": "ceo", "Score": 90}}}}},
                 "companyScore": {"pillars": {"Budget": {"weight": 1}}}}
                """));

        assertEquals(0.0, config.peopleWeight(Pillars.DOMAIN));
        assertTrue(config.components(Pillars.DOMAIN).isEmpty());
        assertTrue(config.components(Pillars.ONE_OFFS).isEmpty());
        assertEquals(0.0, config.companyWeight(Pillars.ALIGNMENT));
        assertEquals(1, config.components(Pillars.SENIORITY).size());
    }

    @Test
    void parse_shouldSkipComponentsWithoutKeywordsOrScore() {
        ScoringConfig config = parser.parse(read("""
                {"peopleScore": {"pillars": {"Seniority": {"weight": 1, "components": {
                    "Empty": {"Keywords to Match": " , ", "Score": 50},
                    "Zero": {"Keywords to Match": "intern", "Score": 0},
                    "Broken": {"Keywords to Match": "lead", "Score": "high"},
                    "Textual": {"Keywords to Match": "head of", "Score": "60"},
                    "Minus": {"Keywords to Match": "jr", "Score": "-15"}}}}},
                 "companyScore": {"pillars": {"Budget": {"weight": 1}}}}
                """));

        List<ScoringComponent> components = config.components(Pillars.SENIORITY);
        assertEquals(List.of("Textual", "Minus"), components.stream().map(ScoringComponent::getName).toList());
        assertEquals(new ScoreRule.BaseScore(60), components.get(0).getRule());
        assertEquals(new ScoreRule.ScoreModifier(-15), components.get(1).getRule());
    }

    @Test
    void parse_shouldSkipTextScores_inDomainPillar() {
        ScoringConfig config = parser.parse(read("""
                {"peopleScore": {"pillars": {
                    "Seniority": {"weight": 1, "components": {
                        "Head": {"Keywords to Match": "head of", "Score": "60"}}},
                    "Domain": {"weight": 1, "components": {
                        "Product": {"Keywords to Match": "product", "Score": "80"},
                        "Boost": {"Keywords to Match": "live ops", "Score": "+10"},
                        "Art": {"Keywords to Match": "art", "Score": 20}}}}},
                 "companyScore": {"pillars": {"Budget": {"weight": 1}}}}
                """));

        assertEquals(List.of("Art"), config.components(Pillars.DOMAIN).stream().map(ScoringComponent::getName).toList());
        assertEquals(new ScoreRule.BaseScore(60), config.components(Pillars.SENIORITY).get(0).getRule());
    }

    @Test
    void parse_shouldRejectMissingSections() {
        assertThrows(BadRequestException.class, () -> parser.parse(read("""
                {"companyScore": {"pillars": {"Budget": {"weight": 1}}}}
                """)));
        assertThrows(BadRequestException.class, () -> parser.parse(read("[]")));
    }

    @Test
    void parse_shouldRejectPresentPillarWithoutUsableWeight() {
        assertThrows(BadRequestException.class, () -> parser.parse(read("""
                {"peopleScore": {"pillars": {"Seniority": {"components": {}}}},
                 "companyScore": {"pillars": {"Budget": {"weight": 1}}}}
                """)));
        assertThrows(BadRequestException.class, () -> parser.parse(read("""
                {"peopleScore": {"pillars": {"Seniority": {"weight": "heavy"}}},
                 "companyScore": {"pillars": {"Budget": {"weight": 1}}}}
                """)));
        assertThrows(BadRequestException.class, () -> parser.parse(read("""
                {"peopleScore": {"pillars": {"Seniority": {"weight": 1}}},
                 "companyScore": {"pillars": {"Budget": {}}}}
                """)));
    }

    @Test
    void parse_shouldRejectAllZeroWeights() {
        assertThrows(BadRequestException.class, () -> parser.parse(read("""
                {"peopleScore": {"pillars": {"Seniority": {"weight": 0}, "Domain": {"weight": 0}}},
                 "companyScore": {"pillars": {"Budget": {"weight": 1}}}}
                """)));
        assertThrows(BadRequestException.class, () -> parser.parse(read("""
                {"peopleScore": {"pillars": {"Seniority": {"weight": 1}}},
                 "companyScore": {"pillars": {"Alignment": {"weight": 0}, "Budget": {"weight": 0}}}}
                """)));
    }

    @Test
    void compileKeywords_shouldMatchOnNonLetterBoundaries() {
        Pattern pattern = ScoringConfigParser.compileKeywords(List.of("vp", "c++", "head of"));

        assertTrue(pattern.matcher("vp, sales").find());
        assertTrue(pattern.matcher("svp/vp growth").find());
        assertTrue(pattern.matcher("c++ engineer").find());
        assertTrue(pattern.matcher("head of art").find());
        assertTrue(pattern.matcher("VP").find(), "case-insensitive");
        assertFalse(pattern.matcher("vpn admin").find());
        assertFalse(pattern.matcher("forehead of").find());
    }

    @Test
    void splitKeywords_shouldTrimAndDropEmptyEntries() {
        assertEquals(List.of("ceo", "chief executive"), ScoringConfigParser.splitKeywords(" ceo, ,chief executive ,"));
        assertTrue(ScoringConfigParser.splitKeywords(null).isEmpty());
    }

    private JsonNode read(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }
}

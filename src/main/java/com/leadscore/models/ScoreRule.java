package com.leadscore.models;

/**
 * What a matching component contributes: a base score or an additive modifier, never both.
 */
public sealed interface ScoreRule permits ScoreRule.BaseScore, ScoreRule.ScoreModifier {

    record BaseScore(int value) implements ScoreRule {
    }

    record ScoreModifier(int delta) implements ScoreRule {
    }
}

package com.leadscore.dto;

public record ContactScores(double seniority, double domain, double warmth, double contactScore) {
}

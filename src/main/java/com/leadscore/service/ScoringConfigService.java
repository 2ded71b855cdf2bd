package com.leadscore.service;

import com.leadscore.models.ScoringConfig;

import java.io.InputStream;

public interface ScoringConfigService {
    ScoringConfig loadLatest();
    ScoringConfig load(InputStream document);
}

package com.leadscore.service;

import com.leadscore.dto.NormalizationBaseline;

public interface BaselineService {
    NormalizationBaseline loadBaseline();
}

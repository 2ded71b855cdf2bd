package com.leadscore.utils.media.csv;

import org.apache.commons.lang3.StringUtils;

import java.util.Map;

public final class RowValidator {

    private RowValidator() {
        throw new UnsupportedOperationException("Unsupported operation");
    }

    public static boolean hasIdentity(String identity) {
        return StringUtils.isNotBlank(identity);
    }

    public static boolean hasAnyValue(Map<String, String> row) {
        return row != null && row.values().stream().anyMatch(StringUtils::isNotBlank);
    }
}

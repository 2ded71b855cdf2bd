package com.leadscore.config.factory;

import com.leadscore.utils.media.csv.RowValidator;

import java.util.List;
import java.util.Map;

/**
 * Builds one typed record from a table row keyed by canonical header.
 */
public interface RecordFactory<T> {

    String tableName();

    List<String> requiredHeaders();

    T createRecord(Map<String, String> row);

    default boolean isValid(Map<String, String> row) {
        return RowValidator.hasAnyValue(row);
    }
}

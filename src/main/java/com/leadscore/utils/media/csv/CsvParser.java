package com.leadscore.utils.media.csv;

import com.leadscore.config.factory.RecordFactory;
import com.leadscore.exceptions.BadRequestException;
import com.leadscore.exceptions.InternalServerErrorException;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
public final class CsvParser {

    public static final char COMMA = ',';
    public static final char TAB = '\t';

    private CsvParser() {
        throw new UnsupportedOperationException("Unsupported");
    }

    /**
     * Tab for {@code .tsv} files, comma for anything else.
     */
    public static char separatorFor(String filename) {
        return filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".tsv") ? TAB : COMMA;
    }

    public static <T> List<T> parse(InputStream inputStream, char separator, RecordFactory<T> recordFactory) {
        try (InputStreamReader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8);
             CSVReader csvReader = new CSVReaderBuilder(reader)
                     .withCSVParser(new RFC4180ParserBuilder().withSeparator(separator).build())
                     .withKeepCarriageReturn(false)
                     .build()) {

            String[] headers = csvReader.readNext();
            Map<String, Integer> headerMap = validateAndNormalizeHeaders(headers, recordFactory);
            return parseRows(csvReader, headerMap, recordFactory);

        } catch (CsvValidationException e) {
            log.error("Malformed {} table: {}", recordFactory.tableName(), e.getMessage());
            throw new BadRequestException("Malformed " + recordFactory.tableName() + " table: " + e.getMessage());
        } catch (IOException e) {
            log.error("Error reading {} table: {}", recordFactory.tableName(), e.getMessage(), e);
            throw new InternalServerErrorException("Error reading " + recordFactory.tableName() + " table", e);
        }
    }

    private static Map<String, Integer> validateAndNormalizeHeaders(String[] headers, RecordFactory<?> recordFactory) {
        if (headers == null || headers.length == 0) {
            log.error("{} table has no header row", recordFactory.tableName());
            throw new BadRequestException("The " + recordFactory.tableName() + " table must have a header row");
        }

        Map<String, Integer> headerMap = HeaderNormalizer.normalizeHeaders(headers);
        List<String> missing = recordFactory.requiredHeaders().stream()
                .filter(required -> !headerMap.containsKey(required))
                .toList();
        if (!missing.isEmpty()) {
            log.error("{} table is missing required columns {}. Raw headers: {}",
                    recordFactory.tableName(), missing, Arrays.toString(headers));
            throw new BadRequestException("The " + recordFactory.tableName()
                    + " table is missing required columns: " + String.join(", ", missing));
        }

        log.debug("Normalized headers: {}", headerMap.keySet());
        return headerMap;
    }

    private static <T> List<T> parseRows(CSVReader csvReader, Map<String, Integer> headerMap,
                                         RecordFactory<T> recordFactory) throws IOException, CsvValidationException {
        List<T> records = new ArrayList<>();
        String[] csvRow;
        int rowIndex = 0;
        int skippedCount = 0;

        while ((csvRow = csvReader.readNext()) != null) {
            rowIndex++;
            T parsed = safelyParseRow(headerMap, csvRow, rowIndex, recordFactory);
            if (parsed != null) {
                records.add(parsed);
            } else {
                skippedCount++;
            }
        }

        log.info("Parsed {} table. Total rows: {}, Parsed: {}, Skipped: {}",
                recordFactory.tableName(), rowIndex, records.size(), skippedCount);
        return records;
    }

    private static <T> T safelyParseRow(Map<String, Integer> headerMap, String[] row, int rowIndex,
                                        RecordFactory<T> recordFactory) {
        try {
            Map<String, String> values = new HashMap<>();
            for (Map.Entry<String, Integer> entry : headerMap.entrySet()) {
                values.put(entry.getKey(), extractValue(row, entry.getValue()));
            }
            if (!recordFactory.isValid(values)) {
                log.debug("Row {}: skipped, no identifying values. Row data: {}", rowIndex, Arrays.toString(row));
                return null;
            }
            return recordFactory.createRecord(values);
        } catch (RuntimeException e) {
            log.warn("Skipping row {} due to parsing error: {}. Row data: {}", rowIndex, e.getMessage(), Arrays.toString(row));
            return null;
        }
    }

    private static String extractValue(String[] row, int index) {
        String value = (index < row.length && row[index] != null) ? row[index] : "";
        return ValueSanitizer.sanitize(value);
    }
}

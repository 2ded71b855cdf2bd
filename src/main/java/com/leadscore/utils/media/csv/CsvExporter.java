package com.leadscore.utils.media.csv;

import com.leadscore.exceptions.BadRequestException;
import com.leadscore.exceptions.InternalServerErrorException;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import java.util.function.Function;


@Slf4j
public final class CsvExporter {

    private CsvExporter() {
        throw new UnsupportedOperationException("Utility class");
    }

    public interface FieldExtractor<T> {
        String header();

        String extract(T entity);

        static <T> FieldExtractor<T> of(String header, Function<T, String> extractor) {
            return new FieldExtractor<>() {
                @Override
                public String header() {
                    return header;
                }

                @Override
                public String extract(T entity) {
                    return extractor.apply(entity);
                }
            };
        }
    }

    /**
     * Writes a header row and one row per entity. Cells are quoted only where the separator, a
     * quote or a line break requires it.
     */
    public static <T> String export(List<T> entities, char separator, List<FieldExtractor<T>> fieldExtractors) {
        if (entities == null) {
            throw new BadRequestException("Entities list cannot be null");
        }
        if (fieldExtractors == null || fieldExtractors.isEmpty()) {
            throw new BadRequestException("Field extractors cannot be null or empty");
        }

        String[] headers = fieldExtractors.stream()
                .map(FieldExtractor::header)
                .toArray(String[]::new);

        try (StringWriter stringWriter = new StringWriter();
             CSVWriter writer = new CSVWriter(stringWriter, separator, ICSVWriter.DEFAULT_QUOTE_CHARACTER,
                     ICSVWriter.DEFAULT_QUOTE_CHARACTER, "\n")) {
            writer.writeNext(headers, false);

            int written = 0;
            for (T entity : entities) {
                if (entity == null) {
                    log.warn("Skipping null row during export");
                    continue;
                }
                writer.writeNext(mapEntityToRow(entity, fieldExtractors), false);
                written++;
            }
            writer.flush();
            log.info("Exported {} rows, {} columns", written, headers.length);
            return stringWriter.toString();

        } catch (IOException e) {
            log.error("Error generating table export: {}", e.getMessage(), e);
            throw new InternalServerErrorException("Failed to export table", e);
        }
    }

    private static <T> String[] mapEntityToRow(T entity, List<FieldExtractor<T>> fieldExtractors) {
        String[] row = new String[fieldExtractors.size()];
        for (int i = 0; i < fieldExtractors.size(); i++) {
            row[i] = ValueSanitizer.sanitize(fieldExtractors.get(i).extract(entity));
        }
        return row;
    }
}

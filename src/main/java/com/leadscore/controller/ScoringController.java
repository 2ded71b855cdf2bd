package com.leadscore.controller;

import com.leadscore.config.factory.CompanyRecordFactory;
import com.leadscore.config.factory.ContactRecordFactory;
import com.leadscore.config.factory.RecordFactory;
import com.leadscore.dto.CompanyRecord;
import com.leadscore.dto.ContactRecord;
import com.leadscore.dto.ScoredCompany;
import com.leadscore.dto.ScoredContact;
import com.leadscore.exceptions.InternalServerErrorException;
import com.leadscore.models.ScoringConfig;
import com.leadscore.service.BaselineService;
import com.leadscore.service.ScoringConfigService;
import com.leadscore.service.ScoringService;
import com.leadscore.utils.media.csv.CsvExporter;
import com.leadscore.utils.media.csv.CsvParser;
import com.leadscore.utils.media.csv.FieldsExtractor;
import com.leadscore.utils.validation.FileValidationUtility;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Scores uploaded company and contact tables with the latest local tuning config.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/scoring")
public class ScoringController {

    static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);
    static final MediaType TEXT_TSV = new MediaType("text", "tab-separated-values", StandardCharsets.UTF_8);

    private final ScoringService scoringService;
    private final ScoringConfigService scoringConfigService;
    private final BaselineService baselineService;
    private final CompanyRecordFactory companyRecordFactory;
    private final ContactRecordFactory contactRecordFactory;

    @PostMapping(value = "/companies", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<String> scoreCompanies(@RequestPart("companies") MultipartFile companies) {
        ScoringConfig config = scoringConfigService.loadLatest();
        List<ScoredCompany> scored = scoringService.scoreCompanies(readTable(companies, companyRecordFactory), config);

        String body = CsvExporter.export(scored, CsvParser.COMMA, FieldsExtractor.getScoredCompanyFieldExtractors());
        return ResponseEntity.ok().contentType(TEXT_CSV).body(body);
    }

    /**
     * The companies part is the raw company table; it is scored in the same request so contacts are
     * matched against scores built from the same config.
     */
    @PostMapping(value = "/contacts", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<String> scoreContacts(@RequestPart("contacts") MultipartFile contacts,
                                                @RequestPart("companies") MultipartFile companies) {
        ScoringConfig config = scoringConfigService.loadLatest();
        List<ContactRecord> contactRecords = readTable(contacts, contactRecordFactory);
        List<CompanyRecord> companyRecords = readTable(companies, companyRecordFactory);

        List<ScoredCompany> scoredCompanies = scoringService.scoreCompanies(companyRecords, config);
        List<ScoredContact> scored = scoringService.scoreContacts(contactRecords, scoredCompanies, config,
                baselineService.loadBaseline());
        scoringService.summarize(scored);

        String body = CsvExporter.export(scored, CsvParser.TAB, FieldsExtractor.getScoredContactFieldExtractors());
        return ResponseEntity.ok().contentType(TEXT_TSV).body(body);
    }

    private <T> List<T> readTable(MultipartFile file, RecordFactory<T> recordFactory) {
        FileValidationUtility.validateTable(file, recordFactory.tableName());
        char separator = CsvParser.separatorFor(file.getOriginalFilename());
        log.info("Reading {} table '{}' ({} bytes)", recordFactory.tableName(), file.getOriginalFilename(), file.getSize());
        try (InputStream in = file.getInputStream()) {
            return CsvParser.parse(in, separator, recordFactory);
        } catch (IOException e) {
            throw new InternalServerErrorException("Unable to read the " + recordFactory.tableName() + " table", e);
        }
    }
}

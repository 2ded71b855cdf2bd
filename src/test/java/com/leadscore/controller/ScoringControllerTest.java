package com.leadscore.controller;

import com.leadscore.TestConfigs;
import com.leadscore.config.factory.CompanyRecordFactory;
import com.leadscore.config.factory.ContactRecordFactory;
import com.leadscore.dto.CompanyRecord;
import com.leadscore.dto.ContactRecord;
import com.leadscore.dto.NormalizationBaseline;
import com.leadscore.dto.ScoredCompany;
import com.leadscore.dto.ScoredContact;
import com.leadscore.exceptions.GlobalExceptionHandler;
import com.leadscore.models.ScoringConfig;
import com.leadscore.service.BaselineService;
import com.leadscore.service.ScoringConfigService;
import com.leadscore.service.ScoringService;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class ScoringControllerTest {

    private static ScoringConfig config;

    @Mock
    private ScoringService scoringService;
    @Mock
    private ScoringConfigService scoringConfigService;
    @Mock
    private BaselineService baselineService;

    @Captor
    private ArgumentCaptor<List<CompanyRecord>> companiesCaptor;
    @Captor
    private ArgumentCaptor<List<ContactRecord>> contactsCaptor;

    private MockMvc mockMvc;

    @BeforeAll
    static void loadConfig() {
        config = TestConfigs.standard();
    }

    @BeforeEach
    void setUp() {
        ScoringController controller = new ScoringController(scoringService, scoringConfigService, baselineService,
                new CompanyRecordFactory(), new ContactRecordFactory());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void scoreCompanies_shouldReturnScoredTableAsCsv() throws Exception {
        when(scoringConfigService.loadLatest()).thenReturn(config);
        when(scoringService.scoreCompanies(anyList(), eq(config))).thenReturn(List.of(ScoredCompany.builder()
                .companyName("Supercell Oy").companyScore(80.0).alignment(100.0).normalizedName("supercell")
                .build()));

        MockMultipartFile companies = csv("companies", "companies.csv", """
                Company Name,Rev <30D (ST)
                Supercell Oy,"$1,000"
                ,5
                """);

        mockMvc.perform(multipart("/api/v1/scoring/companies").file(companies))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().string(startsWith("Company Name,Company Score,Alignment,Budget")))
                .andExpect(content().string(containsString("Supercell Oy,80,100,0,")));

        verify(scoringService).scoreCompanies(companiesCaptor.capture(), eq(config));
        List<CompanyRecord> parsed = companiesCaptor.getValue();
        assertEquals(1, parsed.size());
        assertEquals("Supercell Oy", parsed.get(0).getCompanyName());
        assertEquals("$1,000", parsed.get(0).getRevenue());
    }

    @Test
    void scoreCompanies_shouldReturn400_whenTableIsMissing() throws Exception {
        mockMvc.perform(multipart("/api/v1/scoring/companies"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorMsg").value("Missing required table 'companies'"));

        verifyNoInteractions(scoringService);
    }

    @Test
    void scoreCompanies_shouldReturn400_whenTableIsEmpty() throws Exception {
        when(scoringConfigService.loadLatest()).thenReturn(config);
        MockMultipartFile empty = new MockMultipartFile("companies", "companies.csv", "text/csv", new byte[0]);

        mockMvc.perform(multipart("/api/v1/scoring/companies").file(empty))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorMsg").value("The companies table cannot be null or empty"));
    }

    @Test
    void scoreCompanies_shouldReturn400_whenRequiredColumnIsMissing() throws Exception {
        when(scoringConfigService.loadLatest()).thenReturn(config);
        MockMultipartFile companies = csv("companies", "companies.csv", """
                Website URL,Country
                supercell.com,Finland
                """);

        mockMvc.perform(multipart("/api/v1/scoring/companies").file(companies))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorMsg").value(containsString("Company Name")));

        verifyNoInteractions(scoringService);
    }

    @Test
    void scoreContacts_shouldScoreCompaniesThenContacts_andReturnTsv() throws Exception {
        NormalizationBaseline baseline = new NormalizationBaseline(0.0, 100.0, 0.0, 80.0);
        List<ScoredCompany> scoredCompanies = List.of(ScoredCompany.builder()
                .companyName("Supercell Oy").companyScore(80.0).normalizedName("supercell").build());
        when(scoringConfigService.loadLatest()).thenReturn(config);
        when(baselineService.loadBaseline()).thenReturn(baseline);
        when(scoringService.scoreCompanies(anyList(), eq(config))).thenReturn(scoredCompanies);
        when(scoringService.scoreContacts(anyList(), eq(scoredCompanies), eq(config), eq(baseline)))
                .thenReturn(List.of(ScoredContact.builder()
                        .firstName("Ilkka").lastName("Paananen").fullName("Ilkka Paananen").jobTitle("CEO")
                        .companyName("Supercell").leadScore(100).contactScore(100).companyScore(80L)
                        .matchedCompany("Supercell Oy").matchConfidence(100L)
                        .build()));

        MockMultipartFile contacts = csv("contacts", "contacts.tsv",
                "First Name\tLast Name\tJob Title\tCompany Name\nIlkka\tPaananen\tCEO\tSupercell\n");
        MockMultipartFile companies = csv("companies", "companies.csv", "Company Name\nSupercell Oy\n");

        mockMvc.perform(multipart("/api/v1/scoring/contacts").file(contacts).file(companies))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/tab-separated-values"))
                .andExpect(content().string(startsWith("First Name\tLast Name\tFull Name\tJob Title\tCompany Name\tLead Score")))
                .andExpect(content().string(containsString("Ilkka\tPaananen\tIlkka Paananen\tCEO\tSupercell\t100\t100\t80")));

        verify(scoringService).scoreContacts(contactsCaptor.capture(), eq(scoredCompanies), eq(config), eq(baseline));
        ContactRecord parsed = contactsCaptor.getValue().get(0);
        assertEquals("Ilkka", parsed.getFirstName());
        assertEquals("CEO", parsed.getJobTitle());
        assertEquals("Supercell", parsed.getCompanyName());
        verify(scoringService).summarize(anyList());
    }

    @Test
    void scoreContacts_shouldReturn400_whenCompaniesTableIsMissing() throws Exception {
        MockMultipartFile contacts = csv("contacts", "contacts.csv", "First Name,Last Name,Company Name\nA,B,C\n");

        mockMvc.perform(multipart("/api/v1/scoring/contacts").file(contacts))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorMsg").value("Missing required table 'companies'"));
    }

    private static MockMultipartFile csv(String part, String filename, String content) {
        return new MockMultipartFile(part, filename, "text/csv", content.getBytes(StandardCharsets.UTF_8));
    }
}

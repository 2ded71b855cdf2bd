package com.leadscore.config.factory;

import com.leadscore.dto.CompanyRecord;
import com.leadscore.utils.basic.Constant;
import com.leadscore.utils.media.csv.RowValidator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class CompanyRecordFactory implements RecordFactory<CompanyRecord> {

    @Override
    public String tableName() {
        return "companies";
    }

    @Override
    public List<String> requiredHeaders() {
        return List.of(Constant.COMPANY_NAME);
    }

    @Override
    public boolean isValid(Map<String, String> row) {
        return RowValidator.hasIdentity(row.get(Constant.COMPANY_NAME));
    }

    @Override
    public CompanyRecord createRecord(Map<String, String> row) {
        return CompanyRecord.builder()
                .companyName(row.get(Constant.COMPANY_NAME))
                .normalizedName(cell(row, Constant.NORMALIZED_NAME))
                .revenue(cell(row, Constant.REVENUE))
                .revenueFallback(cell(row, Constant.REVENUE_FALLBACK))
                .revenueChange(cell(row, Constant.REVENUE_CHANGE))
                .totalFunding(cell(row, Constant.TOTAL_FUNDING))
                .latestFundingAmount(cell(row, Constant.LATEST_FUNDING_AMOUNT))
                .latestFundingDate(cell(row, Constant.LATEST_FUNDING_DATE))
                .employeeCount(cell(row, Constant.EMPLOYEE_COUNT))
                .employeeChange(cell(row, Constant.EMPLOYEE_CHANGE))
                .closeStatus(cell(row, Constant.CLOSE_STATUS))
                .closeStatusChangeDate(cell(row, Constant.CLOSE_STATUS_CHANGE_DATE))
                .makesGames(cell(row, Constant.MAKES_GAMES))
                .freeToPlay(cell(row, Constant.F2P))
                .mobile(cell(row, Constant.MOBILE))
                .foundedYear(cell(row, Constant.FOUNDED_YEAR))
                .type(cell(row, Constant.TYPE))
                .websiteUrl(cell(row, Constant.WEBSITE_URL))
                .linkedinUrl(cell(row, Constant.LINKEDIN_URL))
                .country(cell(row, Constant.COUNTRY))
                .flag(cell(row, Constant.FLAG))
                .notes(cell(row, Constant.NOTES))
                .discoverSource(cell(row, Constant.DISCOVER_SOURCE))
                .createdDate(cell(row, Constant.CREATED_DATE))
                .build();
    }

    static String cell(Map<String, String> row, String header) {
        return row.getOrDefault(header, "");
    }
}

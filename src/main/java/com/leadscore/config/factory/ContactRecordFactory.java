package com.leadscore.config.factory;

import com.leadscore.dto.ContactRecord;
import com.leadscore.utils.basic.Constant;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static com.leadscore.config.factory.CompanyRecordFactory.cell;

@Component
public class ContactRecordFactory implements RecordFactory<ContactRecord> {

    @Override
    public String tableName() {
        return "contacts";
    }

    @Override
    public List<String> requiredHeaders() {
        return List.of(Constant.FIRST_NAME, Constant.LAST_NAME, Constant.COMPANY_NAME);
    }

    @Override
    public ContactRecord createRecord(Map<String, String> row) {
        return ContactRecord.builder()
                .firstName(cell(row, Constant.FIRST_NAME))
                .lastName(cell(row, Constant.LAST_NAME))
                .jobTitle(cell(row, Constant.JOB_TITLE))
                .companyName(cell(row, Constant.COMPANY_NAME))
                .normalCompany(cell(row, Constant.NORMAL_COMPANY))
                .source(cell(row, Constant.SOURCE))
                .dateCreated(cell(row, Constant.DATE_CREATED))
                .dateUpdated(cell(row, Constant.DATE_UPDATED))
                .extraData(cell(row, Constant.EXTRA_DATA))
                .build();
    }
}

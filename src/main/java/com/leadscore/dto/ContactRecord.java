package com.leadscore.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Builder
@Getter
@ToString
public class ContactRecord {
    private final String firstName;
    private final String lastName;
    private final String jobTitle;
    private final String companyName;
    private final String normalCompany;
    private final String source;
    private final String dateCreated;
    private final String dateUpdated;
    private final String extraData;
}

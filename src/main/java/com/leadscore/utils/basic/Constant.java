package com.leadscore.utils.basic;

/**
 * Column names of the company and contact tables, as they appear in the exported sheets.
 */
public final class Constant {
    private Constant() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static final String COMPANY_NAME = "Company Name";
    public static final String COMPANY = "Company";
    public static final String NORMALIZED_NAME = "Normalized Name";
    public static final String NORMAL_COMPANY = "Normal Company";

    public static final String REVENUE = "Rev <30D (ST)";
    public static final String REVENUE_FALLBACK = "Annual Revenue (Growjo)";
    public static final String REVENUE_CHANGE = "Rev Change % (ST)";
    public static final String TOTAL_FUNDING = "Total Funding Amount";
    public static final String LATEST_FUNDING_AMOUNT = "Latest Funding Amount";
    public static final String LATEST_FUNDING_DATE = "Latest Funding Date";
    public static final String EMPLOYEE_COUNT = "Current Employee Count (GJ)";
    public static final String EMPLOYEE_CHANGE = "Employee Change % (GJ)";
    public static final String CLOSE_STATUS = "Close Status";
    public static final String CLOSE_STATUS_CHANGE_DATE = "Close Status Change Dt";
    public static final String MAKES_GAMES = "Makes Games";
    public static final String F2P = "F2P";
    public static final String MOBILE = "Mobile";
    public static final String FOUNDED_YEAR = "Founded Year";
    public static final String TYPE = "Type";
    public static final String WEBSITE_URL = "Website URL";
    public static final String LINKEDIN_URL = "Company Linkedin URL";
    public static final String COUNTRY = "Country";
    public static final String FLAG = "FLAG";
    public static final String NOTES = "Notes";
    public static final String DISCOVER_SOURCE = "Discover Source";
    public static final String CREATED_DATE = "Created Date";

    public static final String FIRST_NAME = "First Name";
    public static final String LAST_NAME = "Last Name";
    public static final String JOB_TITLE = "Job Title";
    public static final String SOURCE = "Source";
    public static final String EXTRA_DATA = "Extra Data";
    public static final String DATE_CREATED = "Date Created";
    public static final String DATE_UPDATED = "Date Updated";

    public static final String CO_DEVELOPER = "co-developer";
    public static final String FLAG_MARKER = "X";
}

package com.jobflow.scheduling;

import java.util.Objects;

/**
 * Request to schedule one account through a {@link DynamicSchedulerTemplate}.
 */
public final class DynamicSchedulerRequest {

    private final String templateId;
    private final String accountId;
    private final String cronPattern;

    /**
     * @param cronPattern pattern to use, or null for the template's pattern of this account
     */
    public DynamicSchedulerRequest(String templateId, String accountId, String cronPattern) {
        this.templateId = Objects.requireNonNull(templateId, "templateId");
        this.accountId = Objects.requireNonNull(accountId, "accountId");
        this.cronPattern = cronPattern;
    }

    public static DynamicSchedulerRequest of(String templateId, String accountId) {
        return new DynamicSchedulerRequest(templateId, accountId, null);
    }

    public String getTemplateId() {
        return templateId;
    }

    public String getAccountId() {
        return accountId;
    }

    public String getCronPattern() {
        return cronPattern;
    }

    @Override
    public String toString() {
        return "DynamicSchedulerRequest{template='" + templateId + "', account='" + accountId + "', cron="
                + cronPattern + "}";
    }
}

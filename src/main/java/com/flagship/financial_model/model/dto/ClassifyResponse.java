package com.flagship.financial_model.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.financial_model.classification.ClassifiedRecord;
import com.flagship.financial_model.classification.FsliCategory;
import com.flagship.financial_model.classification.MappingStats;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ClassifyResponse {

    @JsonProperty("records")
    List<ClassifiedAccount> records;

    @JsonProperty("mapping_stats")
    MappingStats mappingStats;

    @Value
    @Builder
    public static class ClassifiedAccount {

        @JsonProperty("account_number")
        Integer accountNumber;

        @JsonProperty("account_name")
        String accountName;

        @JsonProperty("category")
        FsliCategory category;

        static ClassifiedAccount from(ClassifiedRecord classified) {
            return ClassifiedAccount.builder()
                .accountNumber(classified.getRecord().getAccountNumber())
                .accountName(classified.getRecord().getAccountName())
                .category(classified.getCategory())
                .build();
        }
    }

    public static ClassifyResponse from(List<ClassifiedRecord> classified, MappingStats stats) {
        return ClassifyResponse.builder()
            .records(classified.stream().map(ClassifiedAccount::from).toList())
            .mappingStats(stats)
            .build();
    }
}

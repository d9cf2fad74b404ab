package com.flagship.financial_model.classification;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Data-quality summary of a classification pass.
 */
@Value
@Builder
public class MappingStats {

    @JsonProperty("total_accounts")
    int totalAccounts;

    @JsonProperty("mapped_accounts")
    int mappedAccounts;

    @JsonProperty("unclassified_accounts")
    int unclassifiedAccounts;

    /**
     * Share of mapped records, 0 when there are no records.
     */
    @JsonProperty("mapping_rate")
    double mappingRate;

    @JsonProperty("category_distribution")
    Map<FsliCategory, Integer> categoryDistribution;

    public static MappingStats empty() {
        return MappingStats.builder()
            .categoryDistribution(Map.of())
            .build();
    }
}

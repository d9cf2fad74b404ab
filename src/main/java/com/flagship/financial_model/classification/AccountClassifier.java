package com.flagship.financial_model.classification;

import com.flagship.financial_model.ledger.LedgerRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps ledger accounts to FSLI categories.
 *
 * Precedence, first hit wins:
 * 1. Accrued-account rule (payroll keywords decide between accrued payroll
 *    and other current liabilities)
 * 2. Alias table, compared under the configured {@link ClassificationPolicy}
 * 3. Account-number range table
 * 4. UNCLASSIFIED
 *
 * Classification is a pure function of name, number and range table.
 */
@Service
@Slf4j
public class AccountClassifier {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final List<String> PAYROLL_KEYWORDS =
        List.of("payroll", "wage", "salary", "bonus", "compensation");

    private final ClassificationPolicy policy;

    public AccountClassifier(
            @Value("${financial-model.classification.policy:PERMISSIVE_SUBSTRING}") ClassificationPolicy policy) {
        this.policy = policy;
    }

    public ClassificationPolicy getPolicy() {
        return policy;
    }

    /**
     * Classifies an account against the default range table.
     */
    public FsliCategory classify(String accountName, Integer accountNumber) {
        return classify(accountName, accountNumber, AccountRangeTable.defaults());
    }

    /**
     * Classifies an account.
     *
     * @param accountName raw account name, may be null
     * @param accountNumber account number, may be null
     * @param ranges range table for the numeric fallback; null means defaults
     */
    public FsliCategory classify(String accountName, Integer accountNumber, AccountRangeTable ranges) {
        return classifyByName(accountName)
            .or(() -> classifyByRange(accountNumber, ranges))
            .orElse(FsliCategory.UNCLASSIFIED);
    }

    public Optional<FsliCategory> classifyByName(String accountName) {
        String normalized = normalize(accountName);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }

        // Accrued accounts are ambiguous until the payroll keywords are checked
        if (normalized.contains("accrued")) {
            return Optional.of(classifyAccrued(normalized));
        }

        for (Map.Entry<FsliCategory, List<String>> entry : AccountAliasTable.aliases().entrySet()) {
            for (String alias : entry.getValue()) {
                if (policy.matches(normalized, alias)) {
                    return Optional.of(entry.getKey());
                }
            }
        }
        return Optional.empty();
    }

    public Optional<FsliCategory> classifyByRange(Integer accountNumber, AccountRangeTable ranges) {
        if (accountNumber == null) {
            return Optional.empty();
        }
        AccountRangeTable table = ranges != null ? ranges : AccountRangeTable.defaults();
        return table.lookup(accountNumber);
    }

    /**
     * Classifies every record of a dataset.
     */
    public List<ClassifiedRecord> classifyAll(List<LedgerRecord> records, AccountRangeTable ranges) {
        List<ClassifiedRecord> classified = records.stream()
            .map(record -> ClassifiedRecord.of(record,
                classify(record.getAccountName(), record.getAccountNumber(), ranges)))
            .toList();

        if (log.isDebugEnabled()) {
            long unclassified = classified.stream()
                .filter(c -> !c.getCategory().isClassified())
                .count();
            log.debug("Classified {} records: unclassified={}, policy={}", classified.size(), unclassified, policy);
        }
        return classified;
    }

    public MappingStats mappingStats(List<ClassifiedRecord> classified) {
        if (classified == null || classified.isEmpty()) {
            return MappingStats.empty();
        }

        Map<FsliCategory, Integer> counts = new EnumMap<>(FsliCategory.class);
        for (ClassifiedRecord record : classified) {
            counts.merge(record.getCategory(), 1, Integer::sum);
        }

        int total = classified.size();
        int unclassified = counts.getOrDefault(FsliCategory.UNCLASSIFIED, 0);
        int mapped = total - unclassified;

        return MappingStats.builder()
            .totalAccounts(total)
            .mappedAccounts(mapped)
            .unclassifiedAccounts(unclassified)
            .mappingRate((double) mapped / total)
            .categoryDistribution(new LinkedHashMap<>(counts))
            .build();
    }

    /**
     * Lowercases, trims, collapses whitespace, strips commas and periods and
     * spells out ampersands. Null becomes the empty string.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String normalized = WHITESPACE.matcher(name.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
        return normalized.replace(",", "").replace(".", "").replace("&", "and");
    }

    static FsliCategory classifyAccrued(String normalizedName) {
        for (String keyword : PAYROLL_KEYWORDS) {
            if (normalizedName.contains(keyword)) {
                return FsliCategory.ACCRUED_PAYROLL;
            }
        }
        return FsliCategory.OTHER_CURRENT_LIABILITIES;
    }
}

package com.flagship.financial_model.observability;

import com.flagship.financial_model.classification.AccountClassifier;
import com.flagship.financial_model.classification.AccountRangeTable;
import com.flagship.financial_model.classification.FsliCategory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the active classification policy and checks that the default
 * range table still resolves a known cash account.
 */
@Component("classifierHealth")
public class ClassifierHealthIndicator implements HealthIndicator {

    private static final int PROBE_ACCOUNT = 1000;

    private final AccountClassifier classifier;

    public ClassifierHealthIndicator(AccountClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public Health health() {
        AccountRangeTable ranges = AccountRangeTable.defaults();
        FsliCategory probe = classifier.classify(null, PROBE_ACCOUNT, ranges);

        Health.Builder builder = probe == FsliCategory.CASH ? Health.up() : Health.down();
        return builder
                .withDetail("policy", classifier.getPolicy().name())
                .withDetail("defaultRanges", ranges.size())
                .withDetail("probeAccount", PROBE_ACCOUNT)
                .withDetail("probeCategory", probe.key())
                .build();
    }
}

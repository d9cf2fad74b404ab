package com.flagship.financial_model.classification;

/**
 * How a normalized account name is compared against a normalized alias.
 *
 * PERMISSIVE_SUBSTRING accepts the alias anywhere inside the name, or the
 * whole name inside the alias. Short aliases such as "ar" over-match
 * ("retained earnings" contains "ar"); that is accepted behavior.
 *
 * WORD_BOUNDARY requires the shorter string to appear as whole words in the
 * longer one. It is opt-in.
 */
public enum ClassificationPolicy {

    PERMISSIVE_SUBSTRING {
        @Override
        public boolean matches(String normalizedName, String normalizedAlias) {
            return normalizedName.contains(normalizedAlias) || normalizedAlias.contains(normalizedName);
        }
    },

    WORD_BOUNDARY {
        @Override
        public boolean matches(String normalizedName, String normalizedAlias) {
            return containsWords(normalizedName, normalizedAlias) || containsWords(normalizedAlias, normalizedName);
        }
    };

    public abstract boolean matches(String normalizedName, String normalizedAlias);

    private static boolean containsWords(String text, String phrase) {
        return (" " + text + " ").contains(" " + phrase + " ");
    }
}

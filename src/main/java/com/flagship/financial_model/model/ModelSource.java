package com.flagship.financial_model.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which datasets a model was built from.
 */
public enum ModelSource {
    MERGED,
    TRIAL_BALANCE_ONLY,
    GL_ACTIVITY_ONLY;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}

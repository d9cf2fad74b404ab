package com.flagship.financial_model.model;

/**
 * Neither a trial balance nor GL activity was supplied.
 */
public class MissingDatasetException extends RuntimeException {

    public MissingDatasetException() {
        super("At least one of trial_balance or gl_activity must contain records");
    }
}

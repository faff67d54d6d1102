package com.cheflink.agent.observability;

import com.fasterxml.jackson.annotation.JsonValue;

/** Why a run stopped. Every trace carries exactly one. */
public enum TerminationReason {

    FINAL_MESSAGE("final_message"),
    ITERATION_LIMIT("iteration_limit"),
    TIME_LIMIT("time_limit"),
    COST_LIMIT("cost_limit"),
    /** Part of the trace vocabulary; the loop reports exhausted corrective retries as FATAL_ERROR. */
    PARSE_FAILURE("parse_failure"),
    FATAL_ERROR("fatal_error");

    private final String wireName;

    TerminationReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isBudgetLimit() {
        return this == ITERATION_LIMIT || this == TIME_LIMIT || this == COST_LIMIT;
    }

    /** Terminations that end with an apology instead of an answer. */
    public boolean isFailure() {
        return this == PARSE_FAILURE || this == FATAL_ERROR;
    }
}

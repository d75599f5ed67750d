package com.decisiontrace.verify;

/**
 * One semantic check over a run's records. Rules are pure: same input, same
 * result, no side effects, and no dependency on other rules, so new ones can be
 * added to the battery without touching the rest.
 */
public interface VerificationRule {

    /** Stable snake_case name, used as the key of the report. */
    String name();

    /** One-line statement of what the rule requires. */
    String description();

    RuleResult evaluate(VerificationInput input);
}

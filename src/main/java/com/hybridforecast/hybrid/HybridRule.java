package com.hybridforecast.hybrid;

/**
 * One entry of the ordered hybrid selection policy. Rules are pure; the first rule
 * whose {@link #matches} returns true decides the outcome.
 */
public interface HybridRule {

    boolean matches(SelectionContext context);

    HybridOutcome outcome(SelectionContext context);
}

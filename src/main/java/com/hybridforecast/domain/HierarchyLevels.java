package com.hybridforecast.domain;

/**
 * Hierarchy levels a series is reported at. Informational: reconciliation
 * arithmetic does not depend on them.
 */
public record HierarchyLevels(int product, int location, int customer, int distributionChannel) {

    public static final HierarchyLevels TS_DEFAULT = new HierarchyLevels(7, 1, 5, 1);
    public static final HierarchyLevels ML_DEFAULT = new HierarchyLevels(7, 5, 4, 1);

    @Override
    public String toString() {
        return product + "/" + location + "/" + customer + "/" + distributionChannel;
    }
}

package com.hybridforecast.reconciliation;

import java.util.List;

/**
 * Pairs TS and ML buckets that share a dimensional key and overlap in time.
 * <p>
 * Every implementation keeps unmatched TS buckets (ML absent) and unmatched ML buckets
 * (TS filled with zero), and returns rows in {@link JoinedRow#ORDER}.
 */
public interface IntervalJoinStrategy {

    List<JoinedRow> join(List<BucketedForecast> ts, List<BucketedForecast> ml);
}

package com.hybridforecast.reconciliation;

import com.hybridforecast.domain.DimensionalKey;
import com.hybridforecast.domain.ReconciledRecord;
import com.hybridforecast.domain.SegmentAssignment;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Left join of reconciled records against the segment lookup. The first assignment
 * of a key wins; keys without an assignment keep an absent segment.
 */
@Component
public class SegmentEnricher {

    public List<ReconciledRecord> enrich(List<ReconciledRecord> records, List<SegmentAssignment> segments) {
        if (segments == null || segments.isEmpty()) {
            return records;
        }
        Map<DimensionalKey, String> lookup = new HashMap<>();
        for (SegmentAssignment assignment : segments) {
            lookup.putIfAbsent(assignment.key(), assignment.segmentName());
        }
        return records.stream()
            .map(r -> r.toBuilder().segmentName(lookup.get(r.getKey())).build())
            .toList();
    }
}

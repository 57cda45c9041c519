package com.hybridforecast.hybrid;

import com.hybridforecast.domain.HybridRecord;
import com.hybridforecast.domain.ReconciledRecord;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Applies the hybrid selection policy record by record:
 * <ol>
 *   <li>{@link MlPreferenceRule}</li>
 *   <li>{@link NearZeroTsRule}</li>
 *   <li>{@link EnsembleRule}</li>
 * </ol>
 */
@Component
public class HybridSelectionEngine {

    private final List<HybridRule> rules = List.of(
        new MlPreferenceRule(),
        new NearZeroTsRule(),
        new EnsembleRule());

    public List<HybridRecord> select(List<ReconciledRecord> records, double zeroDemandThreshold) {
        return records.stream()
            .map(r -> select(r, zeroDemandThreshold))
            .toList();
    }

    public HybridRecord select(ReconciledRecord record, double zeroDemandThreshold) {
        SelectionContext ctx = SelectionContext.of(record, zeroDemandThreshold);
        for (HybridRule rule : rules) {
            if (rule.matches(ctx)) {
                HybridOutcome outcome = rule.outcome(ctx);
                return HybridRecord.builder()
                    .reconciled(record)
                    .hybridForecastValue(outcome.hybridValue())
                    .forecastSource(outcome.source())
                    .ensembleForecastValue(outcome.ensembleValue())
                    .build();
            }
        }
        throw new IllegalStateException("No hybrid rule matched " + record.getKey());
    }
}

package com.hybridforecast.reconciliation;

import com.hybridforecast.domain.ForecastHorizon;
import com.hybridforecast.domain.Period;
import com.hybridforecast.domain.ReconciledRecord;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collapses joined rows to one reconciled record per (key, period start).
 */
@Component
public class CanonicalAggregator {

    public static final String DEFAULT_DEMAND_TYPE = "regular";
    public static final String DEFAULT_ASSORTMENT_TYPE = "old";

    public List<ReconciledRecord> aggregate(List<JoinedRow> rows) {
        Map<CanonicalCell, Accumulator> cells = new TreeMap<>();
        for (JoinedRow row : rows) {
            cells.computeIfAbsent(row.cell(), Accumulator::new).add(row);
        }
        List<ReconciledRecord> records = new ArrayList<>(cells.size());
        cells.values().forEach(acc -> records.add(acc.toRecord()));
        return records;
    }

    private static final class Accumulator {
        private final CanonicalCell cell;
        private LocalDate periodEnd;
        private double tsSum;
        private Double mlFirst;
        private String demandType;
        private String assortmentType;

        private Accumulator(CanonicalCell cell) {
            this.cell = cell;
        }

        private void add(JoinedRow row) {
            LocalDate end = row.period().end();
            if (periodEnd == null || end.isBefore(periodEnd)) {
                periodEnd = end;
            }
            if (row.tsValue() != null) {
                tsSum += row.tsValue();
            }
            if (mlFirst == null) {
                mlFirst = row.mlValue();
            }
            if (demandType == null) {
                demandType = row.demandType();
            }
            if (assortmentType == null) {
                assortmentType = row.assortmentType();
            }
        }

        private ReconciledRecord toRecord() {
            return ReconciledRecord.builder()
                .key(cell.key())
                .period(new Period(cell.periodStart(), periodEnd))
                .tsForecastValueRec(tsSum)
                .mlForecastValue(mlFirst)
                .demandType(demandType != null ? demandType : DEFAULT_DEMAND_TYPE)
                .assortmentType(assortmentType != null ? assortmentType : DEFAULT_ASSORTMENT_TYPE)
                .horizon(ForecastHorizon.SHORT_TERM)
                .build();
        }
    }
}

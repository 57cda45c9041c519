package com.hybridforecast.reconciliation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pulls the TS magnitude of every canonical cell onto the ML total for that cell while
 * keeping the TS split across the rows of the cell.
 * <p>
 * Ratio policy: {@code ml / ts} when the TS total is positive and an ML total exists,
 * {@code 1.0} when the TS total is positive but ML is absent, {@code 0.0} when the TS
 * total is zero, negative or absent.
 */
@Slf4j
@Component
public class RatioReconciler {

    public static final double DEFAULT_RATIO = 1.0;

    public List<JoinedRow> reconcile(List<JoinedRow> rows) {
        Map<CanonicalCell, Double> ratios = ratios(rows);
        log.debug("Ratio reconciliation | cells={} | rows={}", ratios.size(), rows.size());
        return rows.stream()
            .map(row -> row.tsValue() == null
                ? row
                : row.withTsValue(row.tsValue() * ratios.getOrDefault(row.cell(), DEFAULT_RATIO)))
            .toList();
    }

    public Map<CanonicalCell, Double> ratios(List<JoinedRow> rows) {
        Map<CanonicalCell, Totals> totals = new HashMap<>();
        for (JoinedRow row : rows) {
            totals.computeIfAbsent(row.cell(), c -> new Totals()).add(row);
        }
        Map<CanonicalCell, Double> ratios = new HashMap<>();
        totals.forEach((cell, t) -> ratios.put(cell, ratio(t.mlTotal, t.tsTotal)));
        return ratios;
    }

    public static double ratio(Double mlTotal, Double tsTotal) {
        if (tsTotal == null || tsTotal <= 0.0) {
            return 0.0;
        }
        if (mlTotal == null) {
            return 1.0;
        }
        return mlTotal / tsTotal;
    }

    private static final class Totals {
        private Double tsTotal;
        private Double mlTotal;
        private final Set<Integer> mlSources = new HashSet<>();

        private void add(JoinedRow row) {
            if (row.tsValue() != null) {
                tsTotal = tsTotal == null ? row.tsValue() : tsTotal + row.tsValue();
            }
            // an ML bucket joined to several TS rows of the cell is counted once
            if (row.mlValue() != null && (!row.hasMlSource() || mlSources.add(row.mlSourceIndex()))) {
                mlTotal = mlTotal == null ? row.mlValue() : mlTotal + row.mlValue();
            }
        }
    }
}

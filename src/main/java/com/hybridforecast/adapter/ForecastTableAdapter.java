package com.hybridforecast.adapter;

import com.hybridforecast.domain.DimensionalKey;
import com.hybridforecast.domain.RawForecastRecord;
import com.hybridforecast.domain.SegmentAssignment;
import com.hybridforecast.exception.ForecastTableFormatException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns tabular rows into canonical records before the pipeline runs.
 * <p>
 * Key columns come in a lower-case ({@code product_lvl_id}) and an upper-case
 * ({@code PRODUCT_LVL_ID}) variant; the first one holding a value is used. Dates may
 * be ISO dates, ISO date-times with or without offset (time and offset are dropped)
 * or epoch milliseconds, read in UTC. Integral numeric ids are
 * written without a fraction, so {@code 7} and {@code 7.0} name the same member.
 */
@Component
public class ForecastTableAdapter {

    public static final String TS_TABLE = "tsForecast";
    public static final String ML_TABLE = "mlForecast";
    public static final String SEGMENT_TABLE = "segments";

    private static final String[] PRODUCT = {"product_lvl_id", "PRODUCT_LVL_ID"};
    private static final String[] LOCATION = {"location_lvl_id", "LOCATION_LVL_ID"};
    private static final String[] CUSTOMER = {"customer_lvl_id", "CUSTOMER_LVL_ID"};
    private static final String[] CHANNEL = {"distr_channel_lvl_id", "DISTR_CHANNEL_LVL_ID"};

    private static final String[] PERIOD_START = {"PERIOD_DT", "period_dt"};
    private static final String[] PERIOD_END = {"PERIOD_END_DT", "period_end_dt"};
    private static final String[] TS_VALUE = {"FORECAST_VALUE", "forecast_value"};
    private static final String[] ML_VALUE = {"FORECAST_VALUE", "forecast_value", "FORECAST_VALUE_total"};
    private static final String[] DEMAND_TYPE = {"DEMAND_TYPE", "demand_type"};
    private static final String[] ASSORTMENT_TYPE = {"ASSORTMENT_TYPE", "assortment_type"};
    private static final String[] SEGMENT_NAME = {"SEGMENT_NAME", "segment_name"};

    public List<RawForecastRecord> toTsRecords(List<Map<String, Object>> rows) {
        return toForecastRecords(rows, TS_TABLE, TS_VALUE);
    }

    public List<RawForecastRecord> toMlRecords(List<Map<String, Object>> rows) {
        return toForecastRecords(rows, ML_TABLE, ML_VALUE);
    }

    public List<SegmentAssignment> toSegments(List<Map<String, Object>> rows) {
        if (rows == null) {
            return List.of();
        }
        List<SegmentAssignment> segments = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            segments.add(new SegmentAssignment(key(row, SEGMENT_TABLE, i), text(row, SEGMENT_NAME)));
        }
        return segments;
    }

    private List<RawForecastRecord> toForecastRecords(
            List<Map<String, Object>> rows, String table, String[] valueColumns) {
        if (rows == null) {
            return List.of();
        }
        List<RawForecastRecord> records = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            LocalDate start = date(row, PERIOD_START, table, i);
            if (start == null) {
                throw new ForecastTableFormatException(table, i, "PERIOD_DT is required");
            }
            records.add(RawForecastRecord.builder()
                .key(key(row, table, i))
                .periodStart(start)
                .periodEnd(date(row, PERIOD_END, table, i))
                .forecastValue(number(row, valueColumns, table, i))
                .demandType(text(row, DEMAND_TYPE))
                .assortmentType(text(row, ASSORTMENT_TYPE))
                .segmentName(text(row, SEGMENT_NAME))
                .build());
        }
        return records;
    }

    private DimensionalKey key(Map<String, Object> row, String table, int index) {
        return new DimensionalKey(
            requiredId(row, PRODUCT, table, index),
            requiredId(row, LOCATION, table, index),
            requiredId(row, CUSTOMER, table, index),
            requiredId(row, CHANNEL, table, index));
    }

    private String requiredId(Map<String, Object> row, String[] columns, String table, int index) {
        Object value = first(row, columns);
        if (value == null) {
            throw new ForecastTableFormatException(table, index, columns[0] + " is required");
        }
        return id(value);
    }

    // pandas hands integral ids over as floats once a column has gaps
    private static String id(Object value) {
        if (value instanceof Number n && Double.isFinite(n.doubleValue()) && n.doubleValue() == Math.rint(n.doubleValue())) {
            return Long.toString(n.longValue());
        }
        return String.valueOf(value);
    }

    private LocalDate date(Map<String, Object> row, String[] columns, String table, int index) {
        Object value = first(row, columns);
        if (value == null) {
            return null;
        }
        if (value instanceof Number epochMillis) {
            return Instant.ofEpochMilli(epochMillis.longValue()).atOffset(ZoneOffset.UTC).toLocalDate();
        }
        String text = value.toString().trim();
        try {
            if (text.length() <= 10) {
                return LocalDate.parse(text);
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                text, OffsetDateTime::from, LocalDateTime::from);
            return parsed instanceof OffsetDateTime odt
                ? odt.toLocalDate()
                : LocalDateTime.from(parsed).toLocalDate();
        } catch (DateTimeParseException ex) {
            throw new ForecastTableFormatException(table, index,
                columns[0] + " is not an ISO date: '" + text + "'", ex);
        }
    }

    private Double number(Map<String, Object> row, String[] columns, String table, int index) {
        Object value = first(row, columns);
        double parsed;
        if (value == null) {
            return null;
        } else if (value instanceof Number n) {
            parsed = n.doubleValue();
        } else {
            try {
                parsed = Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException ex) {
                throw new ForecastTableFormatException(table, index,
                    columns[0] + " is not numeric: '" + value + "'", ex);
            }
        }
        return Double.isNaN(parsed) ? null : parsed;
    }

    private String text(Map<String, Object> row, String[] columns) {
        Object value = first(row, columns);
        return value == null ? null : value.toString();
    }

    private Object first(Map<String, Object> row, String[] columns) {
        for (String column : columns) {
            Object value = row.get(column);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}

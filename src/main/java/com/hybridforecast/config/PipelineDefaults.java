package com.hybridforecast.config;

import com.hybridforecast.domain.HierarchyLevels;
import com.hybridforecast.domain.ReconciliationConfig;
import com.hybridforecast.dto.PipelineConfigRequest;
import com.hybridforecast.exception.InvalidPipelineConfigException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Application-level defaults for the pipeline, overridable per request.
 */
@Component
public class PipelineDefaults {

    @Value("${forecast.history-end-date:}")
    private String historyEndDate;

    @Value("${forecast.horizon-days:90}")
    private int forecastHorizonDays;

    @Value("${forecast.delay-horizon-days:0}")
    private int delayHorizonDays;

    @Value("${forecast.zero-demand-threshold:0.01}")
    private double zeroDemandThreshold;

    @Value("${forecast.ts.time-level:MONTH}")
    private String tsTimeLevel;

    @Value("${forecast.ts.levels:7,1,5,1}")
    private String tsLevels;

    @Value("${forecast.ml.time-level:WEEK.2}")
    private String mlTimeLevel;

    @Value("${forecast.ml.levels:7,5,4,1}")
    private String mlLevels;

    public ReconciliationConfig resolve(PipelineConfigRequest overrides) {
        PipelineConfigRequest o = overrides != null ? overrides : PipelineConfigRequest.builder().build();
        HierarchyLevels ts = parseLevels("forecast.ts.levels", tsLevels);
        HierarchyLevels ml = parseLevels("forecast.ml.levels", mlLevels);

        ReconciliationConfig config = ReconciliationConfig.builder()
            .historyEndDate(o.getHistoryEndDate() != null ? o.getHistoryEndDate() : defaultHistoryEnd())
            .forecastHorizonDays(o.getForecastHorizonDays() != null ? o.getForecastHorizonDays() : forecastHorizonDays)
            .delayHorizonDays(o.getDelayHorizonDays() != null ? o.getDelayHorizonDays() : delayHorizonDays)
            .tsTimeLevel(o.getTsTimeLevel() != null ? o.getTsTimeLevel() : tsTimeLevel)
            .mlTimeLevel(o.getMlTimeLevel() != null ? o.getMlTimeLevel() : mlTimeLevel)
            .tsLevels(new HierarchyLevels(
                pick(o.getTsProductLevel(), ts.product()),
                pick(o.getTsLocationLevel(), ts.location()),
                pick(o.getTsCustomerLevel(), ts.customer()),
                pick(o.getTsChannelLevel(), ts.distributionChannel())))
            .mlLevels(new HierarchyLevels(
                pick(o.getMlProductLevel(), ml.product()),
                pick(o.getMlLocationLevel(), ml.location()),
                pick(o.getMlCustomerLevel(), ml.customer()),
                pick(o.getMlChannelLevel(), ml.distributionChannel())))
            .zeroDemandThreshold(o.getZeroDemandThreshold() != null ? o.getZeroDemandThreshold() : zeroDemandThreshold)
            .build();

        validate(config);
        return config;
    }

    private LocalDate defaultHistoryEnd() {
        if (historyEndDate == null || historyEndDate.isBlank()) {
            return LocalDate.now();
        }
        try {
            return LocalDate.parse(historyEndDate.trim());
        } catch (DateTimeParseException ex) {
            throw new InvalidPipelineConfigException(
                "forecast.history-end-date is not an ISO date: '" + historyEndDate + "'");
        }
    }

    private HierarchyLevels parseLevels(String property, String raw) {
        String[] parts = raw.split(",");
        if (parts.length != 4) {
            throw new InvalidPipelineConfigException(property + " needs four comma-separated levels, got '" + raw + "'");
        }
        try {
            return new HierarchyLevels(
                Integer.parseInt(parts[0].trim()),
                Integer.parseInt(parts[1].trim()),
                Integer.parseInt(parts[2].trim()),
                Integer.parseInt(parts[3].trim()));
        } catch (NumberFormatException ex) {
            throw new InvalidPipelineConfigException(property + " must be numeric, got '" + raw + "'");
        }
    }

    private void validate(ReconciliationConfig config) {
        if (config.getForecastHorizonDays() < 0 || config.getDelayHorizonDays() < 0) {
            throw new InvalidPipelineConfigException("forecast and delay horizons must be >= 0");
        }
        if (config.getZeroDemandThreshold() < 0.0 || Double.isNaN(config.getZeroDemandThreshold())) {
            throw new InvalidPipelineConfigException("zeroDemandThreshold must be >= 0");
        }
    }

    private static int pick(Integer override, int fallback) {
        return override != null ? override : fallback;
    }
}

package com.kotsin.predictive.forecast;

import com.kotsin.predictive.exception.ConfigurationException;
import com.kotsin.predictive.forecast.model.ArimaForecastModel;
import com.kotsin.predictive.forecast.model.ExponentialSmoothingModel;
import com.kotsin.predictive.forecast.model.ForecastModel;
import com.kotsin.predictive.forecast.model.LinearForecastModel;
import com.kotsin.predictive.forecast.model.SeasonalDecompositionModel;
import com.kotsin.predictive.model.ForecastModelType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps configured model tags to their {@link ForecastModel} strategy.
 */
@Slf4j
@Component
public class ForecastModelRegistry {

    private final Map<ForecastModelType, ForecastModel> models = new EnumMap<>(ForecastModelType.class);

    public ForecastModelRegistry(List<ForecastModel> available) {
        for (ForecastModel model : available) {
            ForecastModel previous = models.put(model.type(), model);
            if (previous != null) {
                throw new ConfigurationException("Duplicate forecast model registered for '" + model.type().code() + "'");
            }
        }
        log.info("Forecast models registered: {}", models.keySet());
    }

    /**
     * Registry holding one instance of every built-in model.
     */
    public static ForecastModelRegistry withDefaults() {
        return new ForecastModelRegistry(List.of(
                new LinearForecastModel(),
                new ExponentialSmoothingModel(),
                new SeasonalDecompositionModel(),
                new ArimaForecastModel()));
    }

    /**
     * @throws ConfigurationException when no strategy is registered for the type
     */
    public ForecastModel resolve(ForecastModelType type) {
        ForecastModel model = models.get(type);
        if (model == null) {
            throw new ConfigurationException("No forecast model registered for '" + type.code() + "'");
        }
        return model;
    }

    /**
     * Resolve tags in order, dropping duplicates.
     *
     * @throws ConfigurationException on an unknown or unregistered tag
     */
    public List<ForecastModel> resolveAll(List<ForecastModelType> types) {
        List<ForecastModel> resolved = new ArrayList<>(types.size());
        for (ForecastModelType type : types) {
            ForecastModel model = resolve(type);
            if (!resolved.contains(model)) {
                resolved.add(model);
            }
        }
        return resolved;
    }
}

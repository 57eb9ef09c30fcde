package com.kotsin.predictive.forecast;

import com.kotsin.predictive.exception.AnalyticsException;
import com.kotsin.predictive.forecast.model.ModelFit;
import com.kotsin.predictive.model.ForecastModelType;
import lombok.Value;

/**
 * Outcome of running one model on one metric: either a fit or the failure.
 */
@Value
public class ModelRun {
    ForecastModelType type;
    ModelFit fit;
    AnalyticsException failure;

    public static ModelRun success(ModelFit fit) {
        return new ModelRun(fit.getType(), fit, null);
    }

    public static ModelRun failure(ForecastModelType type, AnalyticsException failure) {
        return new ModelRun(type, null, failure);
    }

    public boolean isSuccess() {
        return fit != null;
    }
}

package com.kotsin.predictive.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AdvancedForecastReport {

    List<Forecast> forecasts;
    List<EnsembleForecast> ensembles;
    MarketOutlook marketOutlook;
    List<SeasonalInsight> seasonalInsights;
}

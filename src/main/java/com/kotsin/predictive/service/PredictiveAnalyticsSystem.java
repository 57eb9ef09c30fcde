package com.kotsin.predictive.service;

import com.kotsin.predictive.anomaly.AnomalyDetector;
import com.kotsin.predictive.config.AnalyticsConfig;
import com.kotsin.predictive.exception.AnalyticsException;
import com.kotsin.predictive.forecast.EnsembleCombiner;
import com.kotsin.predictive.forecast.ForecastEngine;
import com.kotsin.predictive.forecast.ForecastModelRegistry;
import com.kotsin.predictive.forecast.ModelRun;
import com.kotsin.predictive.forecast.SeasonalityAnalyzer;
import com.kotsin.predictive.insight.InsightGenerator;
import com.kotsin.predictive.logging.AnalyticsTraceLogger;
import com.kotsin.predictive.metrics.AnalyticsMetrics;
import com.kotsin.predictive.model.ActionTimeline;
import com.kotsin.predictive.model.AdvancedForecastReport;
import com.kotsin.predictive.model.AnalyticsInsight;
import com.kotsin.predictive.model.AnomalyContextReport;
import com.kotsin.predictive.model.AnomalyContextReport.AlertLevel;
import com.kotsin.predictive.model.AnomalyRecord;
import com.kotsin.predictive.model.AnomalyRecord.AnomalyKind;
import com.kotsin.predictive.model.AnomalyRecord.Severity;
import com.kotsin.predictive.model.AnomalySummary;
import com.kotsin.predictive.model.BusinessImpact;
import com.kotsin.predictive.model.DashboardInsights;
import com.kotsin.predictive.model.DashboardSummary;
import com.kotsin.predictive.model.EnsembleForecast;
import com.kotsin.predictive.model.Forecast;
import com.kotsin.predictive.model.ForecastPoint;
import com.kotsin.predictive.model.MarketOutlook;
import com.kotsin.predictive.model.MarketOutlook.Outlook;
import com.kotsin.predictive.model.MetricHistory;
import com.kotsin.predictive.model.Recommendation;
import com.kotsin.predictive.model.Recommendation.Category;
import com.kotsin.predictive.model.Recommendation.Priority;
import com.kotsin.predictive.model.RecommendationReport;
import com.kotsin.predictive.model.RiskAssessment;
import com.kotsin.predictive.model.RiskAssessment.RiskLevel;
import com.kotsin.predictive.model.SeasonalInsight;
import com.kotsin.predictive.model.TrendAnalysis;
import com.kotsin.predictive.model.TrendAnalysis.TrendDirection;
import com.kotsin.predictive.model.TrendInsightReport;
import com.kotsin.predictive.recommendation.RecommendationGenerator;
import com.kotsin.predictive.trend.TrendAnalyzer;
import com.kotsin.predictive.util.MathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * PredictiveAnalyticsSystem - Entry point of the analytics core
 *
 * Composes trend analysis, anomaly detection, forecasting, ensembles and recommendations
 * into batch reports and one dashboard payload.
 *
 * BATCH SEMANTICS:
 * - Work for each metric runs as its own task on {@code analyticsExecutor}
 * - Results keep input order
 * - A metric whose task fails or misses the per-call timeout is logged and excluded;
 *   the batch itself never fails because of one metric
 *
 * Single-metric methods ({@link #analyzeTrend}, {@link #generateForecast}) surface
 * {@link com.kotsin.predictive.exception.InsufficientDataException} to the caller.
 */
@Service
@Slf4j
public class PredictiveAnalyticsSystem {

    // Risk and narrative thresholds
    private static final double NARRATIVE_TREND_STRENGTH = 0.7;
    private static final double RISK_DECLINE_STRENGTH = 0.6;

    // Anomaly alerting
    private static final int HIGH_ANOMALIES_FOR_CRITICAL = 2;
    private static final int TOTAL_ANOMALIES_FOR_WARNING = 5;
    private static final int REPEATED_KIND_THRESHOLD = 2;

    // Market outlook
    private static final double MIN_OUTLOOK_ACCURACY = 0.5;
    private static final int OUTLOOK_POINTS = 5;
    private static final double OUTLOOK_CHANGE_PERCENT = 5.0;

    // Seasonal insights
    private static final int MIN_SEASONAL_OBSERVATIONS = 14;
    private static final int MAX_SEASONAL_LAG = 30;
    private static final double MIN_SEASONAL_STRENGTH = 0.3;

    // Business impact
    private static final int MAX_PRIORITY_ACTIONS = 5;
    private static final int REVENUE_FORECAST_POINTS = 7;
    private static final double REVENUE_IMPACT_SHARE = 0.1;
    private static final double SCORE_SCALE = 10.0;
    private static final int MAX_SCORE = 100;

    private final AnalyticsConfig config;
    private final TrendAnalyzer trendAnalyzer;
    private final AnomalyDetector anomalyDetector;
    private final ForecastEngine forecastEngine;
    private final EnsembleCombiner ensembleCombiner;
    private final RecommendationGenerator recommendationGenerator;
    private final InsightGenerator insightGenerator;
    private final DashboardCacheService dashboardCache;
    private final AnalyticsTraceLogger traceLogger;
    private final AnalyticsMetrics metrics;
    private final Executor executor;
    private final Clock clock;

    @Autowired
    public PredictiveAnalyticsSystem(AnalyticsConfig config,
                                     TrendAnalyzer trendAnalyzer,
                                     AnomalyDetector anomalyDetector,
                                     ForecastEngine forecastEngine,
                                     EnsembleCombiner ensembleCombiner,
                                     RecommendationGenerator recommendationGenerator,
                                     InsightGenerator insightGenerator,
                                     DashboardCacheService dashboardCache,
                                     AnalyticsTraceLogger traceLogger,
                                     AnalyticsMetrics metrics,
                                     @Qualifier("analyticsExecutor") Executor executor,
                                     Clock clock) {
        this.config = config.snapshot();
        this.trendAnalyzer = trendAnalyzer;
        this.anomalyDetector = anomalyDetector;
        this.forecastEngine = forecastEngine;
        this.ensembleCombiner = ensembleCombiner;
        this.recommendationGenerator = recommendationGenerator;
        this.insightGenerator = insightGenerator;
        this.dashboardCache = dashboardCache;
        this.traceLogger = traceLogger;
        this.metrics = metrics;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Standalone system running every metric on the calling thread.
     *
     * @throws com.kotsin.predictive.exception.ConfigurationException when the config is invalid
     */
    public static PredictiveAnalyticsSystem create(AnalyticsConfig config) {
        return create(config, Clock.systemUTC());
    }

    public static PredictiveAnalyticsSystem create(AnalyticsConfig config, Clock clock) {
        config.validated();
        AnalyticsMetrics metrics = new AnalyticsMetrics();
        ForecastEngine engine = new ForecastEngine(config,
                ForecastModelRegistry.withDefaults(), metrics, clock);
        return new PredictiveAnalyticsSystem(config,
                new TrendAnalyzer(),
                new AnomalyDetector(config),
                engine,
                new EnsembleCombiner(engine),
                new RecommendationGenerator(config, clock),
                new InsightGenerator(clock),
                new DashboardCacheService(config),
                new AnalyticsTraceLogger(),
                metrics,
                Runnable::run,
                clock);
    }

    public AnalyticsMetrics getMetrics() {
        return metrics;
    }

    // ======================== SINGLE METRIC ========================

    public TrendAnalysis analyzeTrend(MetricHistory history) {
        return trendAnalyzer.analyze(history);
    }

    public List<AnomalyRecord> detectAnomalies(MetricHistory history) {
        return anomalyDetector.detect(history);
    }

    public Forecast generateForecast(MetricHistory history) {
        return forecastEngine.forecast(history);
    }

    public EnsembleForecast generateEnsembleForecast(MetricHistory history) {
        return ensembleCombiner.combine(history);
    }

    // ======================== TRENDS ========================

    public TrendInsightReport analyzeTrendsWithInsights(List<MetricHistory> histories) {
        List<TrendAnalysis> trends = fanOut("trend", histories, trendAnalyzer::analyze);

        List<String> insights = new ArrayList<>();
        List<String> actionableSteps = new ArrayList<>();
        List<String> riskFactors = new ArrayList<>();
        List<String> mitigation = new ArrayList<>();

        for (TrendAnalysis trend : trends) {
            String metric = trend.getMetric();
            String confidence = MathUtils.format1(trend.getStrength() * 100);
            // volatile trends have R² < 0.3, so they never pass the strength bar on their own
            if (trend.getDirection() != TrendDirection.VOLATILE && !trend.isStrong(NARRATIVE_TREND_STRENGTH)) {
                continue;
            }
            switch (trend.getDirection()) {
                case INCREASING:
                    insights.add(metric + " shows strong positive growth (" + confidence + "% confidence)");
                    actionableSteps.add("Scale successful strategies for " + metric);
                    actionableSteps.add("Allocate additional resources to maintain " + metric + " momentum");
                    break;
                case DECREASING:
                    insights.add(metric + " is declining significantly (" + confidence + "% confidence)");
                    riskFactors.add("Declining " + metric + " trend");
                    actionableSteps.add("Investigate root causes of " + metric + " decline");
                    mitigation.add("Implement corrective measures for " + metric);
                    break;
                case VOLATILE:
                    insights.add(metric + " shows high volatility and requires stabilization");
                    riskFactors.add("Unstable " + metric + " performance");
                    actionableSteps.add("Identify volatility sources in " + metric);
                    mitigation.add("Implement stability controls for " + metric);
                    break;
                case STABLE:
                    insights.add(metric + " maintains stable performance");
                    actionableSteps.add("Monitor " + metric + " for optimization opportunities");
                    break;
                default:
                    break;
            }
        }

        RiskAssessment risk = RiskAssessment.builder()
                .level(assessRisk(trends))
                .factors(List.copyOf(riskFactors))
                .mitigation(List.copyOf(mitigation))
                .build();

        traceLogger.logTrends(trends.size(), histories.size() - trends.size(), risk.getLevel().code());

        return TrendInsightReport.builder()
                .trends(trends)
                .insights(List.copyOf(insights))
                .actionableSteps(List.copyOf(actionableSteps))
                .riskAssessment(risk)
                .build();
    }

    static RiskLevel assessRisk(List<TrendAnalysis> trends) {
        long decreasing = trends.stream()
                .filter(t -> t.getDirection() == TrendDirection.DECREASING && t.isStrong(RISK_DECLINE_STRENGTH))
                .count();
        long volatileCount = trends.stream()
                .filter(t -> t.getDirection() == TrendDirection.VOLATILE)
                .count();

        if (decreasing >= 2 || volatileCount >= 3) return RiskLevel.CRITICAL;
        if (decreasing >= 1 || volatileCount >= 2) return RiskLevel.HIGH;
        if (volatileCount >= 1) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }

    // ======================== ANOMALIES ========================

    public AnomalyContextReport detectAnomaliesWithContext(List<MetricHistory> histories) {
        List<AnomalyRecord> anomalies = fanOut("anomaly", histories, anomalyDetector::detect).stream()
                .flatMap(List::stream)
                .collect(Collectors.toList());

        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        Map<String, Integer> byKind = new LinkedHashMap<>();
        double confidenceSum = 0.0;
        for (AnomalyRecord anomaly : anomalies) {
            bySeverity.merge(anomaly.getSeverity().code(), 1, Integer::sum);
            byKind.merge(anomaly.getKind().code(), 1, Integer::sum);
            confidenceSum += anomaly.getConfidence();
        }
        AnomalySummary summary = AnomalySummary.builder()
                .total(anomalies.size())
                .bySeverity(bySeverity)
                .byKind(byKind)
                .averageConfidence(MathUtils.safeDivide(confidenceSum, anomalies.size(), 0.0))
                .build();

        int critical = summary.countSeverity(Severity.CRITICAL);
        int high = summary.countSeverity(Severity.HIGH);

        List<String> recommendations = new ArrayList<>();
        if (critical > 0) {
            recommendations.add("Immediate investigation required for " + critical + " critical anomalies");
            recommendations.add("Implement emergency response protocols");
        }
        if (high > 0) {
            recommendations.add("Review " + high + " high-severity anomalies within 24 hours");
        }
        if (summary.countKind(AnomalyKind.SPIKE) > REPEATED_KIND_THRESHOLD) {
            recommendations.add("Multiple spikes detected: check for system overload or data quality issues");
        }
        if (summary.countKind(AnomalyKind.DROP) > REPEATED_KIND_THRESHOLD) {
            recommendations.add("Multiple drops detected: investigate potential service disruptions");
        }

        AlertLevel alertLevel = alertLevel(critical, high, anomalies.size());
        traceLogger.logAnomalies(anomalies.size(), critical, high, alertLevel.code());

        return AnomalyContextReport.builder()
                .anomalies(List.copyOf(anomalies))
                .summary(summary)
                .recommendations(List.copyOf(recommendations))
                .alertLevel(alertLevel)
                .build();
    }

    static AlertLevel alertLevel(int critical, int high, int total) {
        if (critical > 0 || high > HIGH_ANOMALIES_FOR_CRITICAL) return AlertLevel.CRITICAL;
        if (high > 0 || total > TOTAL_ANOMALIES_FOR_WARNING) return AlertLevel.WARNING;
        return AlertLevel.NORMAL;
    }

    // ======================== FORECASTS ========================

    public AdvancedForecastReport generateAdvancedForecasts(List<MetricHistory> histories) {
        List<Forecast> forecasts = new ArrayList<>();
        List<EnsembleForecast> ensembles = new ArrayList<>();

        if (config.getForecasting().isEnabled()) {
            List<MetricForecast> results = fanOut("forecast", histories, this::forecastMetric);
            for (MetricForecast result : results) {
                forecasts.add(result.forecast);
                ensembles.add(result.ensemble);
            }
        }

        MarketOutlook outlook = analyzeMarketConditions(forecasts);
        List<SeasonalInsight> seasonalInsights = histories.stream()
                .map(PredictiveAnalyticsSystem::extractSeasonalInsight)
                .collect(Collectors.toList());

        traceLogger.logForecasts(forecasts.size(), histories.size() - forecasts.size(),
                outlook.getOutlook().code(), outlook.getConfidence());
        traceLogger.logEnsembles(ensembles.size(),
                (int) seasonalInsights.stream().filter(SeasonalInsight::isHasSeasonality).count());

        return AdvancedForecastReport.builder()
                .forecasts(List.copyOf(forecasts))
                .ensembles(List.copyOf(ensembles))
                .marketOutlook(outlook)
                .seasonalInsights(List.copyOf(seasonalInsights))
                .build();
    }

    /**
     * One set of model runs feeds both the best-model forecast and the ensemble.
     */
    private MetricForecast forecastMetric(MetricHistory history) {
        List<ModelRun> runs = forecastEngine.runModels(history);
        return new MetricForecast(forecastEngine.selectBest(history, runs), ensembleCombiner.combine(history, runs));
    }

    private static final class MetricForecast {
        private final Forecast forecast;
        private final EnsembleForecast ensemble;

        private MetricForecast(Forecast forecast, EnsembleForecast ensemble) {
            this.forecast = forecast;
            this.ensemble = ensemble;
        }
    }

    /**
     * Accuracy-weighted vote of near-term forecast direction. Forecasts below 0.5 accuracy
     * or starting at 0 abstain.
     */
    static MarketOutlook analyzeMarketConditions(List<Forecast> forecasts) {
        List<String> factors = new ArrayList<>();
        double netSignal = 0.0;
        double accuracySum = 0.0;
        int contributing = 0;

        for (Forecast forecast : forecasts) {
            if (forecast.getAccuracy() < MIN_OUTLOOK_ACCURACY) {
                continue;
            }
            List<ForecastPoint> nearTerm = forecast.nearTerm(OUTLOOK_POINTS);
            if (nearTerm.isEmpty() || nearTerm.get(0).getPredictedValue() <= 0) {
                continue;
            }
            double current = nearTerm.get(0).getPredictedValue();
            double future = nearTerm.get(nearTerm.size() - 1).getPredictedValue();
            double changePercent = (future - current) / current * 100.0;

            if (changePercent > OUTLOOK_CHANGE_PERCENT) {
                netSignal += forecast.getAccuracy();
                factors.add(forecast.getMetric() + " forecasted to grow " + MathUtils.format1(changePercent) + "%");
            } else if (changePercent < -OUTLOOK_CHANGE_PERCENT) {
                netSignal -= forecast.getAccuracy();
                factors.add(forecast.getMetric() + " forecasted to decline " + MathUtils.format1(-changePercent) + "%");
            }
            accuracySum += forecast.getAccuracy();
            contributing++;
        }

        Outlook outlook;
        if (netSignal > MathUtils.EPSILON) {
            outlook = Outlook.POSITIVE;
        } else if (netSignal < -MathUtils.EPSILON) {
            outlook = Outlook.NEGATIVE;
        } else {
            outlook = Outlook.NEUTRAL;
        }
        return MarketOutlook.builder()
                .outlook(outlook)
                .confidence(MathUtils.safeDivide(accuracySum, contributing, 0.0))
                .factors(List.copyOf(factors))
                .build();
    }

    /**
     * Seasonal period, strength and the next peak/trough of the per-phase mean profile.
     */
    static SeasonalInsight extractSeasonalInsight(MetricHistory history) {
        double[] values = history.values();
        if (values.length < MIN_SEASONAL_OBSERVATIONS) {
            return SeasonalInsight.none(history.getMetricName());
        }

        int period = SeasonalityAnalyzer.detectPeriod(values, MAX_SEASONAL_LAG);
        double strength = SeasonalityAnalyzer.seasonalStrength(values, period);
        if (strength < MIN_SEASONAL_STRENGTH) {
            return SeasonalInsight.none(history.getMetricName());
        }

        double[] profile = SeasonalityAnalyzer.phaseMeans(values, period);
        int peak = 0;
        int trough = 0;
        for (int phase = 1; phase < period; phase++) {
            if (profile[phase] > profile[peak]) peak = phase;
            if (profile[phase] < profile[trough]) trough = phase;
        }

        int currentPhase = (values.length - 1) % period;
        Duration interval = history.getMeanInterval();
        Instant last = history.getEndTime();

        return SeasonalInsight.builder()
                .metric(history.getMetricName())
                .hasSeasonality(true)
                .period(period)
                .strength(strength)
                .nextPeak(last.plus(interval.multipliedBy(stepsUntil(peak, currentPhase, period))))
                .nextTrough(last.plus(interval.multipliedBy(stepsUntil(trough, currentPhase, period))))
                .build();
    }

    private static int stepsUntil(int targetPhase, int currentPhase, int period) {
        return targetPhase > currentPhase ? targetPhase - currentPhase : period - currentPhase + targetPhase;
    }

    // ======================== RECOMMENDATIONS ========================

    public RecommendationReport generateActionableRecommendations(List<TrendAnalysis> trends,
                                                                  List<AnomalyRecord> anomalies,
                                                                  List<Forecast> forecasts) {
        List<Recommendation> recommendations = recommendationGenerator.generate(trends, anomalies, forecasts);

        List<String> priorityActions = recommendations.stream()
                .filter(r -> r.getPriority() == Priority.CRITICAL || r.getPriority() == Priority.HIGH)
                .limit(MAX_PRIORITY_ACTIONS)
                .map(Recommendation::getTitle)
                .collect(Collectors.toList());

        BusinessImpact impact = estimateBusinessImpact(recommendations, forecasts);
        traceLogger.logRecommendations(recommendations.size(), priorityActions.size(),
                impact.getRisk(), impact.getOpportunity());

        return RecommendationReport.builder()
                .recommendations(recommendations)
                .priorityActions(List.copyOf(priorityActions))
                .businessImpact(impact)
                .timeline(organizeByTimeline(recommendations))
                .build();
    }

    /**
     * risk / opportunity: Σ impact multiplier × confidence × 10 per category, capped at 100.
     * revenue: Σ estimated value × confidence of opportunities, plus 10% of the accuracy-weighted
     * mean near-term prediction of every metric whose name mentions revenue.
     */
    static BusinessImpact estimateBusinessImpact(List<Recommendation> recommendations, List<Forecast> forecasts) {
        double revenue = 0.0;
        double risk = 0.0;
        double opportunity = 0.0;

        for (Recommendation recommendation : recommendations) {
            double weighted = recommendation.getImpact().multiplier() * recommendation.getConfidence() * SCORE_SCALE;
            if (recommendation.getCategory() == Category.RISK_MITIGATION) {
                risk += weighted;
            } else if (recommendation.getCategory() == Category.OPPORTUNITY) {
                opportunity += weighted;
                if (recommendation.getEstimatedValue() != null) {
                    revenue += recommendation.getEstimatedValue() * recommendation.getConfidence();
                }
            }
        }

        for (Forecast forecast : forecasts) {
            if (!forecast.getMetric().toLowerCase(Locale.ROOT).contains("revenue")) {
                continue;
            }
            double meanPredicted = forecast.nearTerm(REVENUE_FORECAST_POINTS).stream()
                    .mapToDouble(ForecastPoint::getPredictedValue)
                    .average()
                    .orElse(0.0);
            revenue += meanPredicted * forecast.getAccuracy() * REVENUE_IMPACT_SHARE;
        }

        return new BusinessImpact(
                Math.round(revenue),
                (int) Math.min(MAX_SCORE, Math.round(risk)),
                (int) Math.min(MAX_SCORE, Math.round(opportunity)));
    }

    static ActionTimeline organizeByTimeline(List<Recommendation> recommendations) {
        List<String> immediate = new ArrayList<>();
        List<String> shortTerm = new ArrayList<>();
        List<String> longTerm = new ArrayList<>();

        for (Recommendation recommendation : recommendations) {
            String timeframe = recommendation.getTimeframe() == null
                    ? "" : recommendation.getTimeframe().toLowerCase(Locale.ROOT);
            if (recommendation.getPriority() == Priority.CRITICAL
                    || timeframe.contains("immediate") || timeframe.contains("urgent")) {
                immediate.add(recommendation.getTitle());
            } else if (timeframe.contains("week") || timeframe.contains("short")) {
                shortTerm.add(recommendation.getTitle());
            } else {
                longTerm.add(recommendation.getTitle());
            }
        }
        return new ActionTimeline(List.copyOf(immediate), List.copyOf(shortTerm), List.copyOf(longTerm));
    }

    // ======================== INSIGHTS & DASHBOARD ========================

    public List<AnalyticsInsight> generateInsights(List<MetricHistory> histories) {
        List<TrendAnalysis> trends = fanOut("trend", histories, trendAnalyzer::analyze);
        List<AnomalyRecord> anomalies = fanOut("anomaly", histories, anomalyDetector::detect).stream()
                .flatMap(List::stream)
                .collect(Collectors.toList());
        List<Forecast> forecasts = config.getForecasting().isEnabled()
                ? fanOut("forecast", histories, forecastEngine::forecast)
                : List.of();
        List<Recommendation> recommendations = recommendationGenerator.generate(trends, anomalies, forecasts);
        return insightGenerator.generate(trends, anomalies, forecasts, recommendations);
    }

    /**
     * Everything above in one payload. Empty input gives empty sections, a neutral
     * outlook and low risk. Identical input within the cache TTL is served from cache.
     */
    public DashboardInsights generateDashboardInsights(List<MetricHistory> histories) {
        long start = System.nanoTime();
        DashboardCacheService.Fingerprint fingerprint = DashboardCacheService.fingerprint(histories);

        Optional<DashboardInsights> cached = dashboardCache.get(fingerprint);
        if (cached.isPresent()) {
            metrics.incDashboardCacheHit();
            traceLogger.logDashboard(histories.size(), cached.get().getInsights().size(), true, elapsedMillis(start));
            return cached.get();
        }

        traceLogger.logInput("dashboard", histories.size(),
                histories.stream().mapToInt(MetricHistory::size).sum());

        TrendInsightReport trendReport = analyzeTrendsWithInsights(histories);
        AnomalyContextReport anomalyReport = detectAnomaliesWithContext(histories);
        AdvancedForecastReport forecastReport = generateAdvancedForecasts(histories);
        RecommendationReport recommendationReport = generateActionableRecommendations(
                trendReport.getTrends(), anomalyReport.getAnomalies(), forecastReport.getForecasts());
        List<AnalyticsInsight> insights = insightGenerator.generate(trendReport.getTrends(),
                anomalyReport.getAnomalies(), forecastReport.getForecasts(),
                recommendationReport.getRecommendations());

        DashboardInsights dashboard = DashboardInsights.builder()
                .summary(DashboardSummary.builder()
                        .totalMetrics(histories.size())
                        .trendsAnalyzed(trendReport.getTrends().size())
                        .anomaliesDetected(anomalyReport.getAnomalies().size())
                        .forecastsGenerated(forecastReport.getForecasts().size())
                        .recommendationsCount(recommendationReport.getRecommendations().size())
                        .build())
                .trends(trendReport.getTrends())
                .anomalies(anomalyReport.getAnomalies())
                .forecasts(forecastReport.getForecasts())
                .ensembles(forecastReport.getEnsembles())
                .recommendations(recommendationReport.getRecommendations())
                .marketOutlook(forecastReport.getMarketOutlook())
                .riskAssessment(trendReport.getRiskAssessment())
                .alertLevel(anomalyReport.getAlertLevel())
                .insights(insights)
                .generatedAt(clock.instant())
                .build();

        dashboardCache.put(fingerprint, dashboard);
        metrics.incDashboardComputed();
        traceLogger.logDashboard(histories.size(), insights.size(), false, elapsedMillis(start));
        return dashboard;
    }

    // ======================== FAN-OUT ========================

    /**
     * Run {@code task} once per history on the analytics executor and collect the results
     * in input order. Failed and timed-out metrics are logged and left out; a timed-out
     * task is cancelled with an interrupt so it releases its executor thread.
     */
    private <T> List<T> fanOut(String stage, List<MetricHistory> histories, Function<MetricHistory, T> task) {
        List<FutureTask<T>> futures = new ArrayList<>(histories.size());
        for (MetricHistory history : histories) {
            FutureTask<T> future = new FutureTask<>(() -> task.apply(history));
            futures.add(future);
            executor.execute(future);
        }

        long deadline = System.nanoTime() + config.getExecution().getTimeout().toNanos();
        List<T> results = new ArrayList<>(histories.size());
        for (int i = 0; i < futures.size(); i++) {
            String metric = histories.get(i).getMetricName();
            FutureTask<T> future = futures.get(i);
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                T result = future.get(remaining, TimeUnit.NANOSECONDS);
                if (result != null) {
                    results.add(result);
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                metrics.incMetricSkipped(stage);
                log.warn("[{}] Skipping {}: exceeded {} timeout", stage.toUpperCase(Locale.ROOT), metric,
                        config.getExecution().getTimeout());
            } catch (ExecutionException e) {
                metrics.incMetricSkipped(stage);
                Throwable cause = e.getCause();
                if (cause instanceof AnalyticsException) {
                    log.warn("[{}] Skipping {}: {}", stage.toUpperCase(Locale.ROOT), metric, cause.getMessage());
                } else {
                    log.warn("[{}] Skipping {} after unexpected failure", stage.toUpperCase(Locale.ROOT), metric, cause);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AnalyticsException("Interrupted while waiting for " + stage + " results", e);
            }
        }
        return List.copyOf(results);
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}

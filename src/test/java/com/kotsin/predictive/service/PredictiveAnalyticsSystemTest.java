package com.kotsin.predictive.service;

import com.kotsin.predictive.MetricHistories;
import com.kotsin.predictive.anomaly.AnomalyDetector;
import com.kotsin.predictive.config.AnalyticsConfig;
import com.kotsin.predictive.exception.ConfigurationException;
import com.kotsin.predictive.exception.InsufficientDataException;
import com.kotsin.predictive.forecast.EnsembleCombiner;
import com.kotsin.predictive.forecast.ForecastEngine;
import com.kotsin.predictive.forecast.ForecastModelRegistry;
import com.kotsin.predictive.insight.InsightGenerator;
import com.kotsin.predictive.logging.AnalyticsTraceLogger;
import com.kotsin.predictive.metrics.AnalyticsMetrics;
import com.kotsin.predictive.model.ActionTimeline;
import com.kotsin.predictive.model.AdvancedForecastReport;
import com.kotsin.predictive.model.AggregationPeriod;
import com.kotsin.predictive.model.AnomalyContextReport;
import com.kotsin.predictive.model.AnomalyContextReport.AlertLevel;
import com.kotsin.predictive.model.AnomalyRecord;
import com.kotsin.predictive.model.BusinessImpact;
import com.kotsin.predictive.model.DashboardInsights;
import com.kotsin.predictive.model.Forecast;
import com.kotsin.predictive.model.ForecastModelType;
import com.kotsin.predictive.model.ForecastPoint;
import com.kotsin.predictive.model.MarketOutlook;
import com.kotsin.predictive.model.MarketOutlook.Outlook;
import com.kotsin.predictive.model.MetricHistory;
import com.kotsin.predictive.model.Recommendation;
import com.kotsin.predictive.model.Recommendation.Category;
import com.kotsin.predictive.model.Recommendation.Level;
import com.kotsin.predictive.model.Recommendation.Priority;
import com.kotsin.predictive.model.RecommendationReport;
import com.kotsin.predictive.model.RiskAssessment.RiskLevel;
import com.kotsin.predictive.model.SeasonalInsight;
import com.kotsin.predictive.model.TrendAnalysis;
import com.kotsin.predictive.model.TrendAnalysis.TrendDirection;
import com.kotsin.predictive.model.TrendInsightReport;
import com.kotsin.predictive.recommendation.RecommendationGenerator;
import com.kotsin.predictive.trend.TrendAnalyzer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PredictiveAnalyticsSystem
 *
 * Tests cover:
 * - Batch trend, anomaly, forecast and recommendation reports
 * - Per-metric failure isolation in batches
 * - Dashboard assembly, empty input and caching
 * - Static risk, alert, outlook, impact and timeline rules
 */
class PredictiveAnalyticsSystemTest {

    private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");

    private AnalyticsConfig config;
    private PredictiveAnalyticsSystem system;

    @BeforeEach
    void setUp() {
        config = new AnalyticsConfig();
        system = PredictiveAnalyticsSystem.create(config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ========== Fixtures ==========

    private static TrendAnalysis trend(String metric, TrendDirection direction, double strength) {
        return trend(metric, direction, strength, 0.0);
    }

    private static TrendAnalysis trend(String metric, TrendDirection direction, double strength, double slope) {
        return TrendAnalysis.builder()
                .metric(metric)
                .direction(direction)
                .strength(strength)
                .slope(slope)
                .rSquared(strength)
                .period(AggregationPeriod.DAILY)
                .build();
    }

    private static Forecast forecast(String metric, double accuracy, double... values) {
        List<ForecastPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(ForecastPoint.of(NOW.plus(Duration.ofDays(i + 1)), values[i], 0.8, 5));
        }
        return Forecast.builder()
                .metric(metric)
                .model(ForecastModelType.LINEAR)
                .points(points)
                .accuracy(accuracy)
                .generatedAt(NOW)
                .validUntil(NOW.plus(Duration.ofHours(24)))
                .build();
    }

    private static Recommendation recommendation(String title, Priority priority, Category category,
                                                 Level impact, double confidence, Double estimatedValue,
                                                 String timeframe) {
        return Recommendation.builder()
                .id(title)
                .title(title)
                .priority(priority)
                .category(category)
                .impact(impact)
                .effort(Level.MEDIUM)
                .confidence(confidence)
                .estimatedValue(estimatedValue)
                .timeframe(timeframe)
                .build();
    }

    // ========== Construction Tests ==========

    @Test
    @DisplayName("create() rejects an invalid configuration")
    void testCreateValidatesConfig() {
        AnalyticsConfig invalid = new AnalyticsConfig();
        invalid.getForecasting().setModels(List.of("prophet"));

        assertThrows(ConfigurationException.class, () -> PredictiveAnalyticsSystem.create(invalid));
    }

    @Test
    @DisplayName("Single-metric trend surfaces InsufficientDataException")
    void testSingleMetricTrendInsufficient() {
        assertThrows(InsufficientDataException.class, () -> system.analyzeTrend(MetricHistories.of("revenue", 42)));
    }

    // ========== Trend Report Tests ==========

    @Test
    @DisplayName("Strong decline: narrative, risk factor and HIGH risk")
    void testTrendsWithInsightsDecline() {
        TrendInsightReport report = system.analyzeTrendsWithInsights(List.of(
                MetricHistories.linear("conversions", 20, 500, -3),
                MetricHistories.constant("uptime", 20, 99)));

        assertEquals(2, report.getTrends().size());
        assertEquals(RiskLevel.HIGH, report.getRiskAssessment().getLevel());
        assertTrue(report.getInsights().contains("conversions is declining significantly (100.0% confidence)"));
        assertTrue(report.getRiskAssessment().getFactors().contains("Declining conversions trend"));
        assertTrue(report.getActionableSteps().contains("Investigate root causes of conversions decline"));
        assertTrue(report.getRiskAssessment().getMitigation().contains("Implement corrective measures for conversions"));
    }

    @Test
    @DisplayName("A metric with too few points is skipped, the batch still completes")
    void testTrendBatchSkipsShortHistory() {
        TrendInsightReport report = system.analyzeTrendsWithInsights(List.of(
                MetricHistories.linear("revenue", 30, 100, 2),
                MetricHistories.of("single", 5)));

        assertEquals(1, report.getTrends().size());
        assertEquals("revenue", report.getTrends().get(0).getMetric());
        assertEquals(1L, system.getMetrics().getMetricsSkippedByStage().get("trend"));
    }

    @Test
    @DisplayName("Risk levels from strong declines and volatile trends")
    void testAssessRisk() {
        assertEquals(RiskLevel.LOW, PredictiveAnalyticsSystem.assessRisk(List.of(
                trend("a", TrendDirection.INCREASING, 0.9),
                trend("b", TrendDirection.DECREASING, 0.5))));
        assertEquals(RiskLevel.MEDIUM, PredictiveAnalyticsSystem.assessRisk(List.of(
                trend("a", TrendDirection.VOLATILE, 0.1))));
        assertEquals(RiskLevel.HIGH, PredictiveAnalyticsSystem.assessRisk(List.of(
                trend("a", TrendDirection.DECREASING, 0.65))));
        assertEquals(RiskLevel.HIGH, PredictiveAnalyticsSystem.assessRisk(List.of(
                trend("a", TrendDirection.VOLATILE, 0.1),
                trend("b", TrendDirection.VOLATILE, 0.2))));
        assertEquals(RiskLevel.CRITICAL, PredictiveAnalyticsSystem.assessRisk(List.of(
                trend("a", TrendDirection.DECREASING, 0.9),
                trend("b", TrendDirection.DECREASING, 0.8))));
        assertEquals(RiskLevel.CRITICAL, PredictiveAnalyticsSystem.assessRisk(List.of(
                trend("a", TrendDirection.VOLATILE, 0.1),
                trend("b", TrendDirection.VOLATILE, 0.1),
                trend("c", TrendDirection.VOLATILE, 0.1))));
    }

    // ========== Anomaly Report Tests ==========

    @Test
    @DisplayName("One critical spike: CRITICAL alert with counts by severity and kind")
    void testAnomaliesWithContext() {
        AnomalyContextReport report = system.detectAnomaliesWithContext(List.of(
                MetricHistories.generate("orders", 30, i -> i == 20 ? 500 : 100),
                MetricHistories.constant("uptime", 30, 99)));

        assertEquals(1, report.getAnomalies().size());
        assertEquals(AlertLevel.CRITICAL, report.getAlertLevel());
        assertEquals(1, report.getSummary().getTotal());
        assertEquals(Map.of("critical", 1), report.getSummary().getBySeverity());
        assertEquals(Map.of("spike", 1), report.getSummary().getByKind());
        assertEquals(1.0, report.getSummary().getAverageConfidence(), 1e-12);
        assertEquals(List.of(
                "Immediate investigation required for 1 critical anomalies",
                "Implement emergency response protocols"), report.getRecommendations());
    }

    @Test
    @DisplayName("Alert levels from severity counts")
    void testAlertLevel() {
        assertEquals(AlertLevel.CRITICAL, PredictiveAnalyticsSystem.alertLevel(1, 0, 1));
        assertEquals(AlertLevel.CRITICAL, PredictiveAnalyticsSystem.alertLevel(0, 3, 3));
        assertEquals(AlertLevel.WARNING, PredictiveAnalyticsSystem.alertLevel(0, 1, 1));
        assertEquals(AlertLevel.WARNING, PredictiveAnalyticsSystem.alertLevel(0, 0, 6));
        assertEquals(AlertLevel.NORMAL, PredictiveAnalyticsSystem.alertLevel(0, 0, 5));
        assertEquals(AlertLevel.NORMAL, PredictiveAnalyticsSystem.alertLevel(0, 0, 0));
    }

    // ========== Forecast Report Tests ==========

    @Test
    @DisplayName("Weekly cycle: forecast, ensemble and a 7-step seasonal insight")
    void testAdvancedForecastsWeeklyCycle() {
        MetricHistory sessions = MetricHistories.weeklySine("sessions", 60);

        AdvancedForecastReport report = system.generateAdvancedForecasts(List.of(sessions));

        assertEquals(1, report.getForecasts().size());
        assertEquals(1, report.getEnsembles().size());
        assertEquals(14, report.getForecasts().get(0).getPoints().size());

        SeasonalInsight seasonal = report.getSeasonalInsights().get(0);
        assertTrue(seasonal.isHasSeasonality());
        assertEquals(7, seasonal.getPeriod());
        assertTrue(seasonal.getStrength() > 0.9);
        assertTrue(seasonal.getNextPeak().isAfter(sessions.getEndTime()));
        assertTrue(seasonal.getNextTrough().isAfter(sessions.getEndTime()));
        assertFalse(seasonal.getNextPeak().isAfter(sessions.getEndTime().plus(Duration.ofDays(7))));
    }

    @Test
    @DisplayName("Short histories get no forecast and no seasonality, others are unaffected")
    void testAdvancedForecastsSkipsShortHistory() {
        AdvancedForecastReport report = system.generateAdvancedForecasts(List.of(
                MetricHistories.linear("revenue", 30, 100, 2),
                MetricHistories.of("fresh", 1, 2, 3)));

        assertEquals(1, report.getForecasts().size());
        assertEquals("revenue", report.getForecasts().get(0).getMetric());
        assertEquals(2, report.getSeasonalInsights().size());
        assertFalse(report.getSeasonalInsights().get(1).isHasSeasonality());
        assertNull(report.getSeasonalInsights().get(1).getPeriod());
        assertEquals(1L, system.getMetrics().getMetricsSkippedByStage().get("forecast"));
    }

    @Test
    @DisplayName("Forecasting disabled: no forecasts, seasonal insights still computed")
    void testForecastingDisabled() {
        config.getForecasting().setEnabled(false);
        system = PredictiveAnalyticsSystem.create(config, Clock.fixed(NOW, ZoneOffset.UTC));

        AdvancedForecastReport report = system.generateAdvancedForecasts(List.of(MetricHistories.weeklySine("sessions", 60)));

        assertTrue(report.getForecasts().isEmpty());
        assertTrue(report.getEnsembles().isEmpty());
        assertEquals(Outlook.NEUTRAL, report.getMarketOutlook().getOutlook());
        assertTrue(report.getSeasonalInsights().get(0).isHasSeasonality());
    }

    @Test
    @DisplayName("Outlook: accuracy-weighted vote of near-term direction")
    void testMarketOutlook() {
        MarketOutlook positive = PredictiveAnalyticsSystem.analyzeMarketConditions(List.of(
                forecast("revenue", 0.8, 100, 105, 110, 115, 120)));
        assertEquals(Outlook.POSITIVE, positive.getOutlook());
        assertEquals(0.8, positive.getConfidence(), 1e-12);
        assertEquals(List.of("revenue forecasted to grow 20.0%"), positive.getFactors());

        MarketOutlook negative = PredictiveAnalyticsSystem.analyzeMarketConditions(List.of(
                forecast("revenue", 0.8, 100, 105, 110, 115, 120),
                forecast("orders", 0.9, 100, 95, 90, 85, 80)));
        assertEquals(Outlook.NEGATIVE, negative.getOutlook());
        assertEquals(0.85, negative.getConfidence(), 1e-12);

        MarketOutlook neutral = PredictiveAnalyticsSystem.analyzeMarketConditions(List.of(
                forecast("revenue", 0.4, 100, 200, 300),
                forecast("orders", 0.9, 0, 50, 100)));
        assertEquals(Outlook.NEUTRAL, neutral.getOutlook());
        assertEquals(0.0, neutral.getConfidence());
        assertTrue(neutral.getFactors().isEmpty());
    }

    // ========== Recommendation Report Tests ==========

    @Test
    @DisplayName("Business impact: weighted risk/opportunity scores and revenue estimate")
    void testEstimateBusinessImpact() {
        List<Recommendation> recommendations = List.of(
                recommendation("Decline", Priority.HIGH, Category.RISK_MITIGATION, Level.HIGH, 0.9, null, "1-2 weeks"),
                recommendation("Growth", Priority.MEDIUM, Category.OPPORTUNITY, Level.MEDIUM, 0.8, 30.0, "2-4 weeks"));
        List<Forecast> forecasts = List.of(
                forecast("Revenue", 0.5, 100, 100, 100, 100, 100, 100, 100, 900),
                forecast("orders", 0.9, 1000));

        BusinessImpact impact = PredictiveAnalyticsSystem.estimateBusinessImpact(recommendations, forecasts);

        assertEquals(27, impact.getRisk());
        assertEquals(16, impact.getOpportunity());
        assertEquals(29L, impact.getRevenue());
    }

    @Test
    @DisplayName("Risk and opportunity scores are capped at 100")
    void testBusinessImpactCap() {
        List<Recommendation> recommendations = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            recommendations.add(recommendation("r" + i, Priority.HIGH, Category.RISK_MITIGATION, Level.HIGH, 1.0, null, "1-2 weeks"));
        }

        assertEquals(100, PredictiveAnalyticsSystem.estimateBusinessImpact(recommendations, List.of()).getRisk());
    }

    @Test
    @DisplayName("Timeline: critical or immediate, then weekly, then the rest")
    void testOrganizeByTimeline() {
        ActionTimeline timeline = PredictiveAnalyticsSystem.organizeByTimeline(List.of(
                recommendation("A", Priority.CRITICAL, Category.RISK_MITIGATION, Level.HIGH, 0.9, null, "3 months"),
                recommendation("B", Priority.MEDIUM, Category.MAINTENANCE, Level.LOW, 0.9, null, "Immediate"),
                recommendation("C", Priority.HIGH, Category.RISK_MITIGATION, Level.HIGH, 0.9, null, "1-2 weeks"),
                recommendation("D", Priority.LOW, Category.OPTIMIZATION, Level.LOW, 0.9, null, "Next quarter"),
                recommendation("E", Priority.LOW, Category.OPTIMIZATION, Level.LOW, 0.9, null, null)));

        assertEquals(List.of("A", "B"), timeline.getImmediate());
        assertEquals(List.of("C"), timeline.getShortTerm());
        assertEquals(List.of("D", "E"), timeline.getLongTerm());
    }

    @Test
    @DisplayName("Priority actions are the titles of critical and high recommendations")
    void testActionableRecommendations() {
        RecommendationReport report = system.generateActionableRecommendations(
                List.of(trend("users", TrendDirection.INCREASING, 0.8, 3.0),
                        trend("revenue", TrendDirection.DECREASING, 0.9, -2.0)),
                List.of(),
                List.of());

        assertEquals(2, report.getRecommendations().size());
        assertEquals(List.of("Declining revenue Trend Detected"), report.getPriorityActions());
        assertEquals(List.of("Declining revenue Trend Detected", "Strong Growth in users"), report.getTimeline().getShortTerm());
        assertTrue(report.getBusinessImpact().getRisk() > 0);
        assertTrue(report.getBusinessImpact().getOpportunity() > 0);
    }

    // ========== Dashboard Tests ==========

    @Test
    @DisplayName("Empty input: empty sections, neutral outlook, low risk, normal alert")
    void testEmptyDashboard() {
        DashboardInsights dashboard = system.generateDashboardInsights(List.of());

        assertEquals(0, dashboard.getSummary().getTotalMetrics());
        assertEquals(0, dashboard.getSummary().getRecommendationsCount());
        assertTrue(dashboard.getTrends().isEmpty());
        assertTrue(dashboard.getAnomalies().isEmpty());
        assertTrue(dashboard.getForecasts().isEmpty());
        assertTrue(dashboard.getInsights().isEmpty());
        assertEquals(Outlook.NEUTRAL, dashboard.getMarketOutlook().getOutlook());
        assertEquals(RiskLevel.LOW, dashboard.getRiskAssessment().getLevel());
        assertEquals(AlertLevel.NORMAL, dashboard.getAlertLevel());
        assertEquals(NOW, dashboard.getGeneratedAt());
    }

    @Test
    @DisplayName("Dashboard summary counts agree with its sections")
    void testDashboardSummary() {
        // gentle slope keeps every step inside the trailing window's band
        DashboardInsights dashboard = system.generateDashboardInsights(List.of(
                MetricHistories.linear("revenue", 30, 100, 0.2),
                MetricHistories.generate("orders", 30, i -> i == 20 ? 500 : 100),
                MetricHistories.of("fresh", 7)));

        assertEquals(3, dashboard.getSummary().getTotalMetrics());
        assertEquals(2, dashboard.getSummary().getTrendsAnalyzed());
        assertEquals(dashboard.getTrends().size(), dashboard.getSummary().getTrendsAnalyzed());
        assertEquals(1, dashboard.getSummary().getAnomaliesDetected());
        assertEquals(2, dashboard.getSummary().getForecastsGenerated());
        assertEquals(2, dashboard.getEnsembles().size());
        assertEquals(dashboard.getRecommendations().size(), dashboard.getSummary().getRecommendationsCount());
        assertEquals(AlertLevel.CRITICAL, dashboard.getAlertLevel());
        assertTrue(dashboard.getRecommendations().stream().anyMatch(r -> r.getId().equals("anomalies-critical")));
        assertFalse(dashboard.getInsights().isEmpty());
    }

    @Test
    @DisplayName("Identical input within the TTL is served from cache")
    void testDashboardCacheHit() {
        List<MetricHistory> histories = List.of(MetricHistories.linear("revenue", 30, 100, 2));

        DashboardInsights first = system.generateDashboardInsights(histories);
        DashboardInsights second = system.generateDashboardInsights(List.of(MetricHistories.linear("revenue", 30, 100, 2)));

        assertSame(first, second);
        assertEquals(1L, system.getMetrics().getDashboardCacheHits());
        assertEquals(1L, system.getMetrics().getDashboardsComputed());

        system.generateDashboardInsights(List.of(MetricHistories.linear("revenue", 31, 100, 2)));
        assertEquals(2L, system.getMetrics().getDashboardsComputed());
    }

    @Test
    @DisplayName("A metric that misses the timeout is interrupted and skipped, others are kept")
    void testTimedOutMetricInterrupted() throws InterruptedException {
        AnalyticsConfig timed = new AnalyticsConfig();
        timed.getExecution().setTimeout(Duration.ofMillis(300));
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        CountDownLatch interrupted = new CountDownLatch(1);
        AnomalyDetector blockingDetector = new AnomalyDetector(timed) {
            @Override
            public List<AnomalyRecord> detect(MetricHistory history) {
                if (!history.getMetricName().equals("stuck")) {
                    return super.detect(history);
                }
                try {
                    Thread.sleep(60_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                }
                return List.of();
            }
        };
        AnalyticsMetrics metrics = new AnalyticsMetrics();
        ForecastEngine engine = new ForecastEngine(timed, ForecastModelRegistry.withDefaults(), metrics, clock);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            PredictiveAnalyticsSystem pooled = new PredictiveAnalyticsSystem(timed, new TrendAnalyzer(),
                    blockingDetector, engine, new EnsembleCombiner(engine), new RecommendationGenerator(timed, clock),
                    new InsightGenerator(clock), new DashboardCacheService(timed), new AnalyticsTraceLogger(),
                    metrics, pool, clock);

            AnomalyContextReport report = pooled.detectAnomaliesWithContext(List.of(
                    MetricHistories.generate("orders", 30, i -> i == 20 ? 500 : 100),
                    MetricHistories.constant("stuck", 30, 100)));

            assertEquals(1, report.getAnomalies().size());
            assertEquals("orders", report.getAnomalies().get(0).getMetric());
            assertEquals(1L, metrics.getMetricsSkippedByStage().get("anomaly"));
            assertTrue(interrupted.await(5, TimeUnit.SECONDS), "Timed-out task should be interrupted");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Different input with the same value sum is computed, not served from cache")
    void testDashboardCacheDistinctInput() {
        DashboardInsights flat = system.generateDashboardInsights(List.of(MetricHistories.constant("orders", 30, 100)));
        DashboardInsights spiked = system.generateDashboardInsights(List.of(
                MetricHistories.generate("orders", 30, i -> i == 15 ? 500 : i == 16 ? -300 : 100)));

        assertNotSame(flat, spiked);
        assertTrue(flat.getAnomalies().isEmpty());
        assertFalse(spiked.getAnomalies().isEmpty());
        assertEquals(15, spiked.getAnomalies().get(0).getIndex());
        assertEquals(0L, system.getMetrics().getDashboardCacheHits());
        assertEquals(2L, system.getMetrics().getDashboardsComputed());
    }

    @Test
    @DisplayName("Editing the config after creation does not change a running system")
    void testConfigEditsAfterCreate() {
        config.getForecasting().setEnabled(false);
        config.getAnomalyDetection().setEnabled(false);

        AdvancedForecastReport forecasts = system.generateAdvancedForecasts(List.of(MetricHistories.linear("revenue", 30, 100, 2)));
        AnomalyContextReport anomalies = system.detectAnomaliesWithContext(List.of(
                MetricHistories.generate("orders", 30, i -> i == 20 ? 500 : 100)));

        assertEquals(1, forecasts.getForecasts().size());
        assertEquals(1, anomalies.getAnomalies().size());
    }

    @Test
    @DisplayName("Cache disabled: every call recomputes")
    void testDashboardCacheDisabled() {
        AnalyticsConfig uncached = new AnalyticsConfig();
        uncached.getCache().setEnabled(false);
        PredictiveAnalyticsSystem uncachedSystem = PredictiveAnalyticsSystem.create(uncached, Clock.fixed(NOW, ZoneOffset.UTC));
        List<MetricHistory> histories = List.of(MetricHistories.linear("revenue", 30, 100, 2));

        DashboardInsights first = uncachedSystem.generateDashboardInsights(histories);
        DashboardInsights second = uncachedSystem.generateDashboardInsights(histories);

        assertNotSame(first, second);
        assertEquals(0L, uncachedSystem.getMetrics().getDashboardCacheHits());
        assertEquals(2L, uncachedSystem.getMetrics().getDashboardsComputed());
    }
}

package com.kotsin.predictive.logging;

import com.kotsin.predictive.util.MathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * AnalyticsTraceLogger - One log line per analytics stage
 *
 * Shows the complete flow:
 * INPUT → TREND → ANOMALY → FORECAST → ENSEMBLE → RECOMMEND → DASHBOARD
 *
 * Format: [STAGE] counts | key results
 */
@Slf4j
@Component
public class AnalyticsTraceLogger {

    public void logInput(String operation, int metricCount, int observationCount) {
        log.info("┌─[INPUT] {} | metrics={} observations={}", operation, metricCount, observationCount);
    }

    public void logTrends(int analyzed, int skipped, String riskLevel) {
        log.info("├─[TREND] analyzed={} skipped={} | risk={}", analyzed, skipped, riskLevel);
    }

    public void logAnomalies(int total, int critical, int high, String alertLevel) {
        log.info("├─[ANOMALY] total={} critical={} high={} | alert={}", total, critical, high, alertLevel);
    }

    public void logForecasts(int generated, int skipped, String outlook, double outlookConfidence) {
        log.info("├─[FORECAST] generated={} skipped={} | outlook={} conf={}",
                generated, skipped, outlook, MathUtils.format2(outlookConfidence));
    }

    public void logEnsembles(int blended, int seasonalMetrics) {
        log.info("├─[ENSEMBLE] blended={} | seasonal={}", blended, seasonalMetrics);
    }

    public void logRecommendations(int count, int priorityActions, int risk, int opportunity) {
        log.info("├─[RECOMMEND] count={} priority={} | risk={} opportunity={}",
                count, priorityActions, risk, opportunity);
    }

    public void logDashboard(int metrics, int insights, boolean cached, long elapsedMillis) {
        log.info("└─[DASHBOARD] metrics={} insights={} | cached={} | {}ms",
                metrics, insights, cached ? "✓" : "✗", elapsedMillis);
    }
}

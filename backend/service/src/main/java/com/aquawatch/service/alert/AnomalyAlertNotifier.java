package com.aquawatch.service.alert;

import com.aquawatch.core.bus.EventBus;
import com.aquawatch.core.events.AnomalyDetected;
import com.aquawatch.core.model.PredictionResult;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records every anomalous result and sends one summary alert per batch. Publishing is best-effort.
 */
public class AnomalyAlertNotifier {
    private static final Logger LOGGER = Logger.getLogger(AnomalyAlertNotifier.class.getName());
    public static final String ANOMALY_REASON = "high discharge";

    private final AlertPublisher publisher;
    private final EventBus eventBus;
    private final Clock clock;

    public AnomalyAlertNotifier(AlertPublisher publisher, EventBus eventBus, Clock clock) {
        this.publisher = publisher;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * @return number of anomalous results in the batch
     */
    public int notify(List<PredictionResult> results, String parameterCode) {
        StringBuilder message = new StringBuilder();
        int count = 0;
        for (PredictionResult result : results) {
            if (!result.anomalous()) {
                continue;
            }
            count++;
            message.append(formatLine(result)).append('\n');
            eventBus.publish(new AnomalyDetected(
                    clock.instant(),
                    result.siteId(),
                    parameterCode,
                    result.observedValue(),
                    result.predictedValue(),
                    result.percentChange(),
                    ANOMALY_REASON,
                    result.datasetKey()
            ));
        }
        if (count == 0) {
            return 0;
        }
        String subject = subject(count);
        try {
            publisher.publish(subject, message.toString());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed publishing alert '" + subject + "'", e);
        }
        return count;
    }

    static String subject(int count) {
        return "AquaWatch Anomalies Detected (" + count + ")";
    }

    static String formatLine(PredictionResult result) {
        String line = String.format(Locale.ROOT, "Site %s anomalous: observed=%.2f predicted=%.2f (%.1f%%)",
                result.siteId(), result.observedValue(), result.predictedValue(), result.percentChange());
        return result.placeholderData() ? line + " [placeholder data]" : line;
    }
}

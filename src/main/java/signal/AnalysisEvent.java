package signal;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Write-once detection record, persisted to the analysis table. */
public record AnalysisEvent(
        String pairAddress,
        EventType type,
        Instant detectedAt,
        Map<String, Object> details
) {
    public AnalysisEvent {
        details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}

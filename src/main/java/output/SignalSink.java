package output;

import signal.AnalysisEvent;
import signal.TradeSignal;

/**
 * Outbound side of the engine. Implementations must not block the caller on delivery.
 */
public interface SignalSink {

    void submit(TradeSignal signal);

    void submit(AnalysisEvent event);

    void notify(String text);
}

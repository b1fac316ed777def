package support;

import output.SignalSink;
import signal.AnalysisEvent;
import signal.TradeSignal;

import java.util.ArrayList;
import java.util.List;

public class RecordingSink implements SignalSink {

    public final List<TradeSignal> signals = new ArrayList<>();
    public final List<AnalysisEvent> events = new ArrayList<>();
    public final List<String> texts = new ArrayList<>();

    @Override
    public void submit(TradeSignal signal) {
        signals.add(signal);
    }

    @Override
    public void submit(AnalysisEvent event) {
        events.add(event);
    }

    @Override
    public void notify(String text) {
        texts.add(text);
    }
}

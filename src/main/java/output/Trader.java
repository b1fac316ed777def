package output;

import signal.TradeSignal;

import java.io.IOException;

public interface Trader {
    void execute(TradeSignal signal) throws IOException;
}

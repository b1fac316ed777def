package output;

import signal.TradeSignal;

public interface SignalPrinter {
    void print(TradeSignal s);
}

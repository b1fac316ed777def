package output;

import signal.TradeSignal;

import java.io.PrintStream;

public class ConsoleSignalPrinter implements SignalPrinter {

    private final PrintStream out;

    public ConsoleSignalPrinter() {
        this(System.out);
    }

    public ConsoleSignalPrinter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void print(TradeSignal s) {
        out.printf(
                """
━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
%s %s - %s
Price: %.8f
Amount: %.4f

Reason: %s

Links:
  • DexScreener: https://dexscreener.com/%s/%s
━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
""",
                s.baseSymbol(), s.chainId(), s.action(),
                s.price(),
                s.amount(),
                s.reason(),
                s.chainId(), s.pairAddress()
        );
    }
}

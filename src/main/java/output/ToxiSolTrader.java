package output;

import signal.TradeSignal;

import java.io.IOException;
import java.util.Locale;

/**
 * Trades by messaging the ToxiSol bot: "@bot /buy {pair} {amount} {chain}",
 * then tells the chat what was done.
 */
public class ToxiSolTrader implements Trader {

    private final Notifier notifier;
    private final String botHandle;

    public ToxiSolTrader(Notifier notifier, String botHandle) {
        this.notifier = notifier;
        this.botHandle = botHandle;
    }

    @Override
    public void execute(TradeSignal s) throws IOException {
        notifier.send("@" + botHandle + " " + command(s));
        notifier.send(String.format(Locale.US, "%s executed for %s (%s): %s units",
                s.action().name(), s.baseSymbol(), s.pairAddress(), amount(s.amount())));
    }

    static String command(TradeSignal s) {
        return "/" + s.action().command() + " " + s.pairAddress() + " " + amount(s.amount()) + " " + s.chainId();
    }

    private static String amount(double v) {
        return String.format(Locale.US, "%.4f", v).replaceAll("0+$", "").replaceAll("\\.$", "");
    }
}

package output;

import org.junit.jupiter.api.Test;
import signal.TradeAction;
import signal.TradeSignal;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ToxiSolTraderTest {

    private static TradeSignal signal(TradeAction action, double amount) {
        return new TradeSignal("0xpair", "ethereum", "PEPE", action, amount, 0.0001, "test");
    }

    @Test
    void commandHasActionPairAmountChain() {
        assertEquals("/buy 0xpair 50 ethereum", ToxiSolTrader.command(signal(TradeAction.BUY, 50)));
        assertEquals("/sell 0xpair 0.5 ethereum", ToxiSolTrader.command(signal(TradeAction.SELL, 0.5)));
        assertEquals("/buy 0xpair 12.345 ethereum", ToxiSolTrader.command(signal(TradeAction.BUY, 12.345)));
    }

    @Test
    void executeMessagesBotThenChat() throws Exception {
        List<String> sent = new ArrayList<>();
        new ToxiSolTrader(sent::add, "ToxiSolanaBot").execute(signal(TradeAction.SELL, 0.5));

        assertEquals(List.of(
                "@ToxiSolanaBot /sell 0xpair 0.5 ethereum",
                "SELL executed for PEPE (0xpair): 0.5 units"
        ), sent);
    }

    @Test
    void negativeAmountIsRejectedBySignal() {
        assertThrows(IllegalArgumentException.class, () -> signal(TradeAction.BUY, -1));
        assertThrows(IllegalArgumentException.class, () -> signal(TradeAction.BUY, Double.NaN));
    }
}

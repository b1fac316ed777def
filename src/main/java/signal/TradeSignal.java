package signal;

public record TradeSignal(
        String pairAddress,
        String chainId,
        String baseSymbol,
        TradeAction action,
        double amount,
        double price,
        String reason
) {
    public TradeSignal {
        if (!(amount >= 0)) {
            throw new IllegalArgumentException("amount must be >= 0: " + amount);
        }
    }
}

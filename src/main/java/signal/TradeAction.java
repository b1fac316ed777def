package signal;

public enum TradeAction {
    BUY,
    SELL;

    /** Lower-case form used in trade commands and the trades table. */
    public String command() {
        return name().toLowerCase();
    }
}

package signal;

public enum EventType {
    NEW("new"),
    RUG("rug"),
    PUMP("pump");

    public final String code;
    EventType(String code) { this.code = code; }

    @Override public String toString() { return code; }
}

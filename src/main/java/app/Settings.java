package app;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

public final class Settings {

    private Settings() {}

    // Global run flag, checked by the poll loop between pairs
    public static volatile boolean RUNNING = true;

    // ====== Sources ======
    public static List<String> CHAINS = List.of("ethereum", "bsc", "polygon");

    // extra pairs polled one by one, format chain:pairAddress
    public static List<String> WATCH_PAIRS = List.of();

    public static String DEXSCREENER_URL = "https://api.dexscreener.com/latest/dex/pairs";
    public static String RUGCHECK_URL    = "https://rugcheck.xyz";
    public static String FAKE_VOLUME_URL = "https://api.pocketuniverse.app/v1/check_volume";

    // ====== Notifications / trading ======
    public static String TELEGRAM_URL     = "https://api.telegram.org";
    public static String TELEGRAM_TOKEN   = "";
    public static String TELEGRAM_CHAT_ID = "";
    public static String TOXISOL_BOT      = "ToxiSolanaBot";

    public static int DISPATCH_QUEUE_CAPACITY = 1_000;

    // ====== Storage ======
    public static String DB_PATH     = "token_analysis.db";
    public static String CONFIG_FILE = "config.json";

    // ====== Timings ======
    public static long REQUEST_DELAY_MS = 200;
    public static long CYCLE_SLEEP_MS   = 300_000;
    // upper bound for every external call (reputation, fake volume, notify)
    public static long HTTP_TIMEOUT_MS  = 5_000;

    // ====== Detection ======
    public static double RUG_THRESHOLD  = -50;
    public static double PUMP_THRESHOLD = 100;
    public static int NEW_PAIR_HOURS    = 24;

    public static final double RUG_MAX_LIQUIDITY = 1_000;
    public static final double PUMP_MIN_VOLUME   = 100_000;
    public static final double DIP_THRESHOLD     = -10;
    public static final double DIP_SELL_AMOUNT   = 0.5;

    // ====== Adaptive thresholds ======
    public static int VOLATILITY_WINDOW_HOURS = 6;
    public static final double VOLATILITY_DIVISOR = 50.0;

    // ====== Sharpe-like confidence ======
    public static final int SHARPE_WINDOW      = 50;
    public static final int SHARPE_MIN_RETURNS = 5;
    public static final double SHARPE_EPSILON  = 1e-6;
    public static double RISK_FREE_RATE        = 0.0;

    // ====== Risk sizing ======
    public static double POSITION_FRACTION = 0.10;
    public static double PORTFOLIO_VALUE   = 10_000;
    public static final double MIN_SIZING_LIQUIDITY = 100;
    public static final double MAX_LIQUIDITY_SHARE  = 0.01;

    // share of the traded amount booked as fee in the trades table
    public static double TRADE_FEE_RATE = 0.003;

    static void loadFrom(Properties p) {
        CHAINS          = getList  (p, "chains", CHAINS);
        WATCH_PAIRS     = getList  (p, "watch.pairs", WATCH_PAIRS);

        DEXSCREENER_URL = getString(p, "dexscreener.url", DEXSCREENER_URL);
        RUGCHECK_URL    = getString(p, "rugcheck.url", RUGCHECK_URL);
        FAKE_VOLUME_URL = getString(p, "fake.volume.url", FAKE_VOLUME_URL);

        TELEGRAM_URL     = getString(p, "telegram.url", TELEGRAM_URL);
        TELEGRAM_TOKEN   = getString(p, "telegram.token", TELEGRAM_TOKEN);
        TELEGRAM_CHAT_ID = getString(p, "telegram.chat.id", TELEGRAM_CHAT_ID);
        TOXISOL_BOT      = getString(p, "toxisol.bot", TOXISOL_BOT);
        DISPATCH_QUEUE_CAPACITY = getInt(p, "dispatch.queue.capacity", DISPATCH_QUEUE_CAPACITY);

        DB_PATH     = getString(p, "db.path", DB_PATH);
        CONFIG_FILE = getString(p, "config.file", CONFIG_FILE);

        REQUEST_DELAY_MS = getLong(p, "request.delay.ms", REQUEST_DELAY_MS);
        CYCLE_SLEEP_MS   = getLong(p, "cycle.sleep.ms", CYCLE_SLEEP_MS);
        HTTP_TIMEOUT_MS  = Math.min(5_000L, getLong(p, "http.timeout.ms", HTTP_TIMEOUT_MS));

        RUG_THRESHOLD  = getDouble(p, "rug.threshold", RUG_THRESHOLD);
        PUMP_THRESHOLD = getDouble(p, "pump.threshold", PUMP_THRESHOLD);
        NEW_PAIR_HOURS = getInt   (p, "new.pair.hours", NEW_PAIR_HOURS);
        VOLATILITY_WINDOW_HOURS = getInt(p, "volatility.window.hours", VOLATILITY_WINDOW_HOURS);
        RISK_FREE_RATE = getDouble(p, "risk.free.rate", RISK_FREE_RATE);

        POSITION_FRACTION = getDouble(p, "risk.position.fraction", POSITION_FRACTION);
        PORTFOLIO_VALUE   = getDouble(p, "risk.portfolio.value", PORTFOLIO_VALUE);
        TRADE_FEE_RATE    = getDouble(p, "trade.fee.rate", TRADE_FEE_RATE);
    }

    private static String getString(Properties p, String key, String def) {
        String v = p.getProperty(key);
        return v == null ? def : v.trim();
    }

    private static List<String> getList(Properties p, String key, List<String> def) {
        String v = p.getProperty(key);
        if (v == null) return def;
        List<String> out = new ArrayList<>();
        for (String part : v.split(",")) {
            if (!part.isBlank()) out.add(part.trim());
        }
        return List.copyOf(out);
    }

    private static double getDouble(Properties p, String key, double def) {
        String v = p.getProperty(key);
        if (v == null) return def;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            System.err.println("[Settings] bad double for " + key + ": " + v);
            return def;
        }
    }

    private static long getLong(Properties p, String key, long def) {
        String v = p.getProperty(key);
        if (v == null) return def;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            System.err.println("[Settings] bad long for " + key + ": " + v);
            return def;
        }
    }

    private static int getInt(Properties p, String key, int def) {
        String v = p.getProperty(key);
        if (v == null) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            System.err.println("[Settings] bad int for " + key + ": " + v);
            return def;
        }
    }
}

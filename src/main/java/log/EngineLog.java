package log;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Line logger for the scanner.
 *
 * Writes lines such as:
 * 2025-02-01 12:34:56.789 [PUMP] [main] 0xabc... change=152.30% volume=150000
 *
 * Usage:
 *   EngineLog.log("RUG", pairAddress, "change=-61.00% liquidity=500");
 *   EngineLog.logSkip(pairAddress, "not rated good");
 *   EngineLog.warn("DexScreener", "HTTP 503 for ethereum");
 */
public final class EngineLog {

    private static final String LOG_DIR = "logs";
    private static final String LOG_FILE = "dex_analysis.log";

    private static final DateTimeFormatter TS_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    private static BufferedWriter writer;
    private static final Object LOCK = new Object();

    static {
        init();
    }

    private EngineLog() {}

    private static void init() {
        try {
            Path dir = Paths.get(LOG_DIR);
            if (!Files.exists(dir)) {
                Files.createDirectories(dir);
            }
            writer = new BufferedWriter(new FileWriter(dir.resolve(LOG_FILE).toFile(), true));
        } catch (IOException e) {
            // console fallback in log()
            System.err.println("[EngineLog] cannot open " + LOG_DIR + "/" + LOG_FILE + ": " + e.getMessage());
        }
    }

    /**
     * @param tag     message kind: NEW, RUG, PUMP, SKIP, FILTER, WARN, ERROR...
     * @param subject pair address or component name, may be null
     * @param msg     text without timestamp/prefix
     */
    public static void log(String tag, String subject, String msg) {
        String ts = LocalDateTime.now().format(TS_FORMAT);
        String thread = Thread.currentThread().getName();

        String line = String.format(
                "%s [%s] [%s] %s %s",
                ts,
                tag,
                thread,
                subject != null ? subject : "-",
                msg
        );

        synchronized (LOCK) {
            if (writer == null) {
                System.out.println(line);
                return;
            }
            try {
                writer.write(line);
                writer.newLine();
                writer.flush();
            } catch (IOException e) {
                System.out.println(line);
            }
        }
    }

    /** Pair dropped by a gate or the admission filter. */
    public static void logSkip(String pairAddress, String reason) {
        log("SKIP", pairAddress, reason);
    }

    public static void info(String source, String msg) {
        log("INFO", source, msg);
    }

    public static void debug(String source, String msg) {
        log("DEBUG", source, msg);
    }

    public static void warn(String source, String msg) {
        log("WARN", source, msg);
    }

    public static void error(String source, String msg, Throwable t) {
        log("ERROR", source, msg + (t != null ? ": " + t : ""));
    }

    /** Called on regular shutdown. */
    public static void shutdown() {
        synchronized (LOCK) {
            if (writer != null) {
                try {
                    writer.close();
                } catch (IOException e) {
                    System.err.println("[EngineLog] close failed: " + e.getMessage());
                }
                writer = null;
            }
        }
    }
}

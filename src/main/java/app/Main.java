package app;

import config.BotConfig;
import config.ConfigStore;
import core.AnalysisEngine;
import core.AnomalyClassifier;
import core.CycleReport;
import core.EngineState;
import core.RiskSizer;
import log.EngineLog;
import net.DexScreenerClient;
import net.FakeVolumeClient;
import net.HttpClients;
import net.RugCheckClient;
import okhttp3.OkHttpClient;
import output.ConsoleSignalPrinter;
import output.FileSignalLogger;
import output.Notifier;
import output.SignalDispatcher;
import output.TelegramNotifier;
import output.ToxiSolTrader;
import store.SqliteAnalysisStore;
import tuning.AdaptiveThresholdTracker;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Launcher. Scans every configured chain, sleeps, repeats.
 * Type "stop" in the console to finish the current pair and exit.
 */
public class Main {

    public static void main(String[] args) throws Exception {

        Settings.RUNNING = true;

        // 1) settings
        try (var is = Main.class.getResourceAsStream("/settings.properties")) {
            if (is != null) {
                var props = new java.util.Properties();
                props.load(is);
                Settings.loadFrom(props);
                System.out.println("✅ settings.properties loaded");
            } else {
                System.out.println("⚠ settings.properties not found, using defaults");
            }
        } catch (Exception e) {
            System.err.println("⚠ Could not load settings.properties: " + e.getMessage());
        }

        // 2) config.json + state
        ConfigStore configStore = new ConfigStore(Path.of(Settings.CONFIG_FILE));
        BotConfig cfg = configStore.load();
        EngineState state = new EngineState(
                cfg.filters(),
                cfg.blacklist(),
                new AdaptiveThresholdTracker(Settings.PUMP_THRESHOLD, Settings.RUG_THRESHOLD,
                        Settings.VOLATILITY_DIVISOR)
        );

        // 3) collaborators
        OkHttpClient http = HttpClients.withTimeout(Settings.HTTP_TIMEOUT_MS);
        SqliteAnalysisStore store = SqliteAnalysisStore.open(Settings.DB_PATH);

        Notifier notifier;
        if (Settings.TELEGRAM_TOKEN.isBlank()) {
            System.out.println("⚠ telegram.token is empty, notifications go to the log only");
            notifier = text -> EngineLog.log("NOTIFY", null, text);
        } else {
            notifier = new TelegramNotifier(http, Settings.TELEGRAM_URL,
                    Settings.TELEGRAM_TOKEN, Settings.TELEGRAM_CHAT_ID);
        }

        SignalDispatcher dispatcher = new SignalDispatcher(
                new ToxiSolTrader(notifier, Settings.TOXISOL_BOT),
                notifier,
                List.of(new ConsoleSignalPrinter(), new FileSignalLogger(Path.of("signals.log"))),
                Settings.DISPATCH_QUEUE_CAPACITY
        ).start();

        Clock clock = Clock.systemUTC();
        AnomalyClassifier classifier = new AnomalyClassifier(
                new RugCheckClient(http, Settings.RUGCHECK_URL),
                new FakeVolumeClient(http, Settings.FAKE_VOLUME_URL),
                store,
                new RiskSizer(Settings.POSITION_FRACTION, Settings.PORTFOLIO_VALUE,
                        Settings.MIN_SIZING_LIQUIDITY, Settings.MAX_LIQUIDITY_SHARE),
                clock,
                Duration.ofHours(Settings.NEW_PAIR_HOURS),
                Settings.RISK_FREE_RATE
        );

        AnalysisEngine engine = new AnalysisEngine(
                state,
                classifier,
                store,
                new DexScreenerClient(http, Settings.DEXSCREENER_URL),
                dispatcher,
                configStore,
                clock,
                AnalysisEngine.Options.fromSettings()
        );

        EngineLog.info("Main", "scanner initialized, chains=" + Settings.CHAINS + " " + cfg.filters());
        System.out.println("▶ Scanning " + Settings.CHAINS + " (type 'help' for commands)");

        CountDownLatch stopLatch = new CountDownLatch(1);

        // ===== console commands =====
        Thread console = new Thread(() -> {
            try (var scanner = new java.util.Scanner(System.in)) {
                while (scanner.hasNextLine()) {
                    String input = scanner.nextLine().trim().toLowerCase();

                    switch (input) {

                        case "stop":
                            System.out.println("\n🛑 STOP received, finishing the current pair...");
                            requestStop(stopLatch);
                            return;

                        case "help":
                            System.out.println("""
                                    📌 Commands:
                                       help     - this menu
                                       status   - thresholds, filters, blacklist, queue
                                       reload   - re-read config.json now
                                       stop     - finish the current pair and exit
                                    """);
                            break;

                        case "status":
                            System.out.println("🔎 " + state.thresholds());
                            System.out.println("   filters:   " + state.filters());
                            System.out.println("   blacklist: " + state.blacklist());
                            System.out.println("   dispatch:  pending=" + dispatcher.pending()
                                    + " delivered=" + dispatcher.delivered()
                                    + " failed=" + dispatcher.failed()
                                    + " dropped=" + dispatcher.dropped());
                            break;

                        case "reload":
                            // applied between pairs by the engine thread on the next cycle
                            configStore.markStale();
                            System.out.println("🔄 config.json will be re-read at the next cycle");
                            break;

                        default:
                            System.out.println("❓ Unknown command. Type 'help'");
                    }
                }
            }
        }, "ConsoleCommandListener");
        console.setDaemon(true);
        console.start();

        // ===== main loop =====
        while (Settings.RUNNING) {
            CycleReport report = engine.runCycle(Settings.CHAINS, Settings.WATCH_PAIRS);
            System.out.println("✅ Cycle: " + report.summary());
            if (!Settings.RUNNING || report.interrupted()) break;

            EngineLog.info("Main", "completed scan of " + Settings.CHAINS + ", sleeping "
                    + Settings.CYCLE_SLEEP_MS / 1000 + "s");
            if (sleepUntilStop(stopLatch, Settings.CYCLE_SLEEP_MS)) break;
        }

        dispatcher.close();
        store.close();
        System.out.println("🚪 Shutting down...");
        EngineLog.info("Main", "stopped");
        EngineLog.shutdown();
    }

    /**
     * Stop request from the console. The engine sees the flag between pairs,
     * so the pair in flight (and its HTTP calls) completes normally.
     */
    static void requestStop(CountDownLatch stopLatch) {
        Settings.RUNNING = false;
        stopLatch.countDown();
    }

    /** @return true when a stop was requested during the pause */
    static boolean sleepUntilStop(CountDownLatch stopLatch, long ms) {
        try {
            return stopLatch.await(ms, TimeUnit.MILLISECONDS) || !Settings.RUNNING;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}

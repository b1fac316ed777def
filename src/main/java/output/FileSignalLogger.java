package output;

import log.EngineLog;
import signal.TradeSignal;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

public class FileSignalLogger implements SignalPrinter {

    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path file;

    public FileSignalLogger(Path file) {
        this.file = file;
    }

    @Override
    public void print(TradeSignal s) {
        try (FileWriter fw = new FileWriter(file.toFile(), true)) {
            String text = String.format("""
                    ================================
                    Time: %s
                    Pair: %s (%s)
                    Chain: %s
                    Action: %s

                    Price: %.8f
                    Amount: %.4f

                    DexScreener: https://dexscreener.com/%s/%s

                    Reason: %s
                    ================================

                    """,
                    TS.format(LocalDateTime.now()),
                    s.baseSymbol(), s.pairAddress(),
                    s.chainId(),
                    s.action(),
                    s.price(),
                    s.amount(),
                    s.chainId(), s.pairAddress(),
                    s.reason()
            );
            fw.write(text);
        } catch (IOException e) {
            EngineLog.error("FileSignalLogger", "cannot write " + file, e);
        }
    }
}

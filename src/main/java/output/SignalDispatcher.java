package output;

import log.EngineLog;
import signal.AnalysisEvent;
import signal.TradeSignal;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Queue between the engine and the outside world. The engine only enqueues;
 * a single daemon thread prints, trades and notifies. Delivery failures are
 * logged and dropped, a full queue drops the newest message.
 */
public class SignalDispatcher implements SignalSink, AutoCloseable {

    private static final String SRC = "Dispatcher";

    private record Outbound(TradeSignal signal, AnalysisEvent event, String text) {}

    private static final Outbound STOP = new Outbound(null, null, null);

    private final BlockingQueue<Outbound> queue;
    private final Trader trader;
    private final Notifier notifier;
    private final List<SignalPrinter> printers;
    private final Thread worker;

    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public SignalDispatcher(Trader trader, Notifier notifier, List<SignalPrinter> printers, int capacity) {
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.trader = trader;
        this.notifier = notifier;
        this.printers = List.copyOf(printers);
        this.worker = new Thread(this::loop, "signal-dispatcher");
        this.worker.setDaemon(true);
    }

    public SignalDispatcher start() {
        worker.start();
        return this;
    }

    @Override
    public void submit(TradeSignal signal) {
        offer(new Outbound(signal, null, null));
    }

    @Override
    public void submit(AnalysisEvent event) {
        offer(new Outbound(null, event, null));
    }

    @Override
    public void notify(String text) {
        offer(new Outbound(null, null, text));
    }

    private void offer(Outbound o) {
        if (!queue.offer(o)) {
            dropped.incrementAndGet();
            EngineLog.warn(SRC, "queue full, dropped " + describe(o));
        }
    }

    private void loop() {
        while (true) {
            Outbound o;
            try {
                o = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (o == STOP) return;
            deliver(o);
        }
    }

    private void deliver(Outbound o) {
        try {
            if (o.signal() != null) {
                for (SignalPrinter p : printers) p.print(o.signal());
                trader.execute(o.signal());
            } else if (o.event() != null) {
                notifier.send(format(o.event()));
            } else {
                notifier.send(o.text());
            }
            delivered.incrementAndGet();
        } catch (Exception e) {
            failed.incrementAndGet();
            EngineLog.error(SRC, "delivery failed for " + describe(o), e);
        }
    }

    static String format(AnalysisEvent e) {
        StringBuilder sb = new StringBuilder();
        sb.append(e.type().code.toUpperCase(Locale.ROOT)).append(" detected: ").append(e.pairAddress());
        for (Map.Entry<String, Object> d : e.details().entrySet()) {
            sb.append("\n  ").append(d.getKey()).append(": ").append(d.getValue());
        }
        return sb.toString();
    }

    private static String describe(Outbound o) {
        if (o.signal() != null) return o.signal().action() + " " + o.signal().pairAddress();
        if (o.event() != null) return o.event().type() + " " + o.event().pairAddress();
        return "text";
    }

    public int pending() {
        return queue.size();
    }

    public long delivered() {
        return delivered.get();
    }

    public long failed() {
        return failed.get();
    }

    public long dropped() {
        return dropped.get();
    }

    /** Delivers what is already queued (up to {@code timeoutMs}), then stops the worker. */
    public void close(long timeoutMs) {
        if (!worker.isAlive()) return;
        try {
            // STOP must get in even when the queue is full
            if (!queue.offer(STOP, timeoutMs, TimeUnit.MILLISECONDS)) {
                worker.interrupt();
            }
            worker.join(timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (worker.isAlive()) {
            worker.interrupt();
            EngineLog.warn(SRC, "stopped with " + queue.size() + " undelivered messages");
        }
    }

    @Override
    public void close() {
        close(10_000L);
    }
}

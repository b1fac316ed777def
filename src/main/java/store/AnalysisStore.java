package store;

import signal.AnalysisEvent;
import signal.TradeSignal;
import state.PairSnapshot;
import state.PriceHistoryRecord;

import java.time.Instant;
import java.util.List;

/**
 * Persistence seen by the engine. Every method may throw {@link StoreException}.
 */
public interface AnalysisStore extends AutoCloseable {

    /**
     * Insert the pair row if its address is unknown; existing rows are left untouched.
     *
     * @return true when a new row was created
     */
    boolean upsertPair(PairSnapshot snapshot, Instant firstSeen);

    void appendHistory(PriceHistoryRecord record);

    void appendEvent(AnalysisEvent event);

    void recordTrade(TradeSignal signal, double fee, Instant at);

    /** Last {@code limit} records of one pair, oldest first. */
    List<PriceHistoryRecord> recentHistory(String pairAddress, int limit);

    /** 24h price-change samples of all pairs recorded at or after {@code since}. */
    List<Double> recentPriceChanges(Instant since);

    @Override
    void close();
}

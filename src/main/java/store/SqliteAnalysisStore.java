package store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import signal.AnalysisEvent;
import signal.TradeSignal;
import state.PairSnapshot;
import state.PriceHistoryRecord;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * JDBC store on SQLite (jdbc:sqlite:). Tables are created on open.
 * One connection, used from the engine thread only.
 */
public final class SqliteAnalysisStore implements AnalysisStore {

    private final Connection conn;
    private final ObjectMapper mapper = new ObjectMapper();

    public SqliteAnalysisStore(String url) {
        try {
            this.conn = DriverManager.getConnection(url);
            SchemaInit.init(this.conn);
        } catch (SQLException e) {
            throw new StoreException("cannot open " + url, e);
        }
    }

    public static SqliteAnalysisStore open(String dbPath) {
        return new SqliteAnalysisStore("jdbc:sqlite:" + dbPath);
    }

    @Override
    public boolean upsertPair(PairSnapshot s, Instant firstSeen) {
        try (PreparedStatement ps = conn.prepareStatement("""
            INSERT OR IGNORE INTO token_pairs(pair_address, chain_id, base_token, quote_token, created_at, first_seen, dev_wallet)
            VALUES(?,?,?,?,?,?,?)
        """)) {
            ps.setString(1, s.pairAddress());
            ps.setString(2, s.chainId());
            ps.setString(3, s.baseSymbol());
            ps.setString(4, s.quoteSymbol());
            ps.setLong(5, s.createdAt().getEpochSecond());
            ps.setLong(6, firstSeen.toEpochMilli());
            ps.setString(7, s.creatorWallet());
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("upsertPair " + s.pairAddress(), e);
        }
    }

    @Override
    public void appendHistory(PriceHistoryRecord r) {
        try (PreparedStatement ps = conn.prepareStatement("""
            INSERT INTO price_history(pair_address, price_usd, volume_24h, liquidity_usd, price_change_24h, ts_ms)
            VALUES(?,?,?,?,?,?)
        """)) {
            ps.setString(1, r.pairAddress());
            ps.setDouble(2, r.priceUsd());
            ps.setDouble(3, r.volume24h());
            ps.setDouble(4, r.liquidityUsd());
            ps.setDouble(5, r.priceChange24h());
            ps.setLong(6, r.timestamp().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("appendHistory " + r.pairAddress(), e);
        }
    }

    @Override
    public void appendEvent(AnalysisEvent e) {
        String details;
        try {
            details = mapper.writeValueAsString(e.details());
        } catch (JsonProcessingException ex) {
            throw new StoreException("details of " + e.type() + " for " + e.pairAddress(), ex);
        }
        try (PreparedStatement ps = conn.prepareStatement("""
            INSERT INTO analysis(pair_address, event_type, detected_at_ms, details)
            VALUES(?,?,?,?)
        """)) {
            ps.setString(1, e.pairAddress());
            ps.setString(2, e.type().code);
            ps.setLong(3, e.detectedAt().toEpochMilli());
            ps.setString(4, details);
            ps.executeUpdate();
        } catch (SQLException ex) {
            throw new StoreException("appendEvent " + e.pairAddress(), ex);
        }
    }

    @Override
    public void recordTrade(TradeSignal s, double fee, Instant at) {
        try (PreparedStatement ps = conn.prepareStatement("""
            INSERT INTO trades(pair_address, action, amount, price, fee, ts_ms, reason)
            VALUES(?,?,?,?,?,?,?)
        """)) {
            ps.setString(1, s.pairAddress());
            ps.setString(2, s.action().command());
            ps.setDouble(3, s.amount());
            ps.setDouble(4, s.price());
            ps.setDouble(5, fee);
            ps.setLong(6, at.toEpochMilli());
            ps.setString(7, s.reason());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("recordTrade " + s.pairAddress(), e);
        }
    }

    @Override
    public List<PriceHistoryRecord> recentHistory(String pairAddress, int limit) {
        try (PreparedStatement ps = conn.prepareStatement("""
            SELECT price_usd, volume_24h, liquidity_usd, price_change_24h, ts_ms
            FROM price_history
            WHERE pair_address = ?
            ORDER BY ts_ms DESC, id DESC
            LIMIT ?
        """)) {
            ps.setString(1, pairAddress);
            ps.setInt(2, limit);
            List<PriceHistoryRecord> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new PriceHistoryRecord(
                            pairAddress,
                            rs.getDouble(1),
                            rs.getDouble(2),
                            rs.getDouble(3),
                            rs.getDouble(4),
                            Instant.ofEpochMilli(rs.getLong(5))
                    ));
                }
            }
            Collections.reverse(out);
            return out;
        } catch (SQLException e) {
            throw new StoreException("recentHistory " + pairAddress, e);
        }
    }

    @Override
    public List<Double> recentPriceChanges(Instant since) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT price_change_24h FROM price_history WHERE ts_ms >= ? ORDER BY ts_ms")) {
            ps.setLong(1, since.toEpochMilli());
            List<Double> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    double v = rs.getDouble(1);
                    if (!rs.wasNull()) out.add(v);
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("recentPriceChanges", e);
        }
    }

    @Override
    public void close() {
        try {
            conn.close();
        } catch (SQLException e) {
            throw new StoreException("close", e);
        }
    }
}

package store;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

final class SchemaInit {

    private SchemaInit() {}

    static void init(Connection c) throws SQLException {
        try (Statement st = c.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS token_pairs (
                    pair_address TEXT PRIMARY KEY,
                    chain_id TEXT,
                    base_token TEXT,
                    quote_token TEXT,
                    created_at INTEGER,
                    first_seen INTEGER,
                    dev_wallet TEXT
                )
            """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS price_history (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    pair_address TEXT,
                    price_usd REAL,
                    volume_24h REAL,
                    liquidity_usd REAL,
                    price_change_24h REAL,
                    ts_ms INTEGER,
                    FOREIGN KEY (pair_address) REFERENCES token_pairs (pair_address)
                )
            """);

            st.execute("""
                CREATE INDEX IF NOT EXISTS idx_price_history_pair_ts
                    ON price_history (pair_address, ts_ms)
            """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS analysis (
                    pair_address TEXT,
                    event_type TEXT,
                    detected_at_ms INTEGER,
                    details TEXT,
                    FOREIGN KEY (pair_address) REFERENCES token_pairs (pair_address)
                )
            """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS trades (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    pair_address TEXT,
                    action TEXT,
                    amount REAL,
                    price REAL,
                    fee REAL,
                    ts_ms INTEGER,
                    reason TEXT,
                    FOREIGN KEY (pair_address) REFERENCES token_pairs (pair_address)
                )
            """);
        }
    }
}

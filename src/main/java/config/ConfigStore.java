package config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import filters.Blacklist;
import filters.FilterConfig;
import log.EngineLog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * config.json:
 * <pre>
 * {
 *   "filters": {"min_liquidity": 1000, "min_volume_24h": 10000, "min_price_change": -1000},
 *   "blacklisted_coins": ["SCAM", "0xpair..."],
 *   "blacklisted_devs": ["0xwallet..."]
 * }
 * </pre>
 * A missing or broken file never stops the scanner: defaults are used instead.
 */
public final class ConfigStore {

    private static final String SRC = "Config";

    private final Path file;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private FileTime loadedStamp;
    private volatile boolean stale;

    public ConfigStore(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    /** Startup read: a missing or broken file gives the defaults. */
    public BotConfig load() {
        stale = false;
        loadedStamp = stamp();
        if (!Files.exists(file)) {
            EngineLog.warn(SRC, file + " not found, using defaults");
            return BotConfig.defaults();
        }
        return read().orElseGet(() -> {
            EngineLog.warn(SRC, "using defaults");
            return BotConfig.defaults();
        });
    }

    /**
     * Reloads when the file's modification time moved since the last load, or after {@link #markStale()}.
     * A file that cannot be read now (half-written, deleted, bad values) keeps the current config.
     */
    public Optional<BotConfig> reloadIfChanged() {
        FileTime now = stamp();
        if (!stale && (now == null || now.equals(loadedStamp))) {
            return Optional.empty();
        }
        stale = false;
        loadedStamp = now;
        EngineLog.info(SRC, file + " changed, reloading");
        if (now == null) {
            EngineLog.warn(SRC, file + " is gone, keeping current config");
            return Optional.empty();
        }
        Optional<BotConfig> cfg = read();
        if (cfg.isEmpty()) {
            EngineLog.warn(SRC, "keeping current config until " + file + " is fixed");
        }
        return cfg;
    }

    private Optional<BotConfig> read() {
        try {
            JsonNode root = mapper.readTree(file.toFile());
            if (root == null || !root.isObject()) {
                EngineLog.warn(SRC, file + " is not a JSON object");
                return Optional.empty();
            }
            return Optional.of(parse(root));
        } catch (IOException | IllegalArgumentException e) {
            EngineLog.warn(SRC, "config load failed: " + e.getMessage());
            return Optional.empty();
        }
    }

    /** Forces a reload on the next {@link #reloadIfChanged()} call; safe from any thread. */
    public void markStale() {
        stale = true;
    }

    /**
     * Writes both blacklists back to the file. Other keys of the document are kept.
     *
     * @throws IOException also when the existing file cannot be parsed; it is left untouched
     */
    public void saveBlacklist(Blacklist blacklist) throws IOException {
        ObjectNode root = readObjectOrEmpty();
        root.set("blacklisted_coins", toArray(blacklist.coins()));
        root.set("blacklisted_devs", toArray(blacklist.devs()));

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), root);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);

        // our own write is not a config change
        loadedStamp = stamp();
    }

    private BotConfig parse(JsonNode root) {
        JsonNode f = root.path("filters");
        FilterConfig filters = new FilterConfig(
                number(f, "min_liquidity", FilterConfig.DEFAULT_MIN_LIQUIDITY),
                number(f, "min_volume_24h", FilterConfig.DEFAULT_MIN_VOLUME_24H),
                number(f, "min_price_change", FilterConfig.DEFAULT_MIN_PRICE_CHANGE)
        );
        Blacklist blacklist = new Blacklist(
                strings(root.path("blacklisted_coins")),
                strings(root.path("blacklisted_devs"))
        );
        return new BotConfig(filters, blacklist);
    }

    private static double number(JsonNode node, String key, double def) {
        JsonNode v = node.get(key);
        if (v == null || v.isNull()) return def;
        if (!v.isNumber()) {
            throw new IllegalArgumentException("filters." + key + " is not a number: " + v);
        }
        return v.asDouble();
    }

    private static List<String> strings(JsonNode arr) {
        List<String> out = new ArrayList<>();
        if (!arr.isArray()) return out;
        for (JsonNode n : arr) {
            if (n.isTextual()) out.add(n.asText());
        }
        return out;
    }

    private ArrayNode toArray(List<String> values) {
        ArrayNode arr = mapper.createArrayNode();
        values.stream().sorted().forEach(arr::add);
        return arr;
    }

    private ObjectNode readObjectOrEmpty() throws IOException {
        if (!Files.exists(file)) {
            return mapper.createObjectNode();
        }
        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new IOException("not overwriting unreadable " + file + ": " + e.getMessage(), e);
        }
        if (root instanceof ObjectNode obj) return obj;
        if (root == null || root.isMissingNode()) return mapper.createObjectNode();
        throw new IOException("not overwriting " + file + ": top level is not a JSON object");
    }

    private FileTime stamp() {
        try {
            return Files.exists(file) ? Files.getLastModifiedTime(file) : null;
        } catch (IOException e) {
            return null;
        }
    }
}

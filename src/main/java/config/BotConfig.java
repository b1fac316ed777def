package config;

import filters.Blacklist;
import filters.FilterConfig;

/** Contents of config.json. */
public record BotConfig(FilterConfig filters, Blacklist blacklist) {

    public static BotConfig defaults() {
        return new BotConfig(FilterConfig.defaults(), new Blacklist());
    }
}

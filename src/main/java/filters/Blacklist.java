package filters;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Disqualified coins (token symbols and pair addresses) and developer wallets.
 * Only grows at runtime; owned by the engine thread, so no locking.
 */
public final class Blacklist {

    private final Set<String> coins = new LinkedHashSet<>();
    private final Set<String> devs = new LinkedHashSet<>();

    public Blacklist() {}

    public Blacklist(Collection<String> coins, Collection<String> devs) {
        addAll(coins, this.coins);
        addAll(devs, this.devs);
    }

    /** @return true if the value was not listed before */
    public boolean addCoin(String symbolOrAddress) {
        if (symbolOrAddress == null || symbolOrAddress.isBlank()) return false;
        return coins.add(symbolOrAddress);
    }

    public boolean addDev(String wallet) {
        if (wallet == null || wallet.isBlank()) return false;
        return devs.add(wallet);
    }

    public boolean containsCoin(String symbolOrAddress) {
        return symbolOrAddress != null && coins.contains(symbolOrAddress);
    }

    public boolean containsDev(String wallet) {
        return wallet != null && devs.contains(wallet);
    }

    /** Union with another list, e.g. after the config file was edited by hand. */
    public void merge(Blacklist other) {
        coins.addAll(other.coins);
        devs.addAll(other.devs);
    }

    public List<String> coins() {
        return List.copyOf(coins);
    }

    public List<String> devs() {
        return List.copyOf(devs);
    }

    public int size() {
        return coins.size() + devs.size();
    }

    private static void addAll(Collection<String> src, Set<String> dst) {
        if (src == null) return;
        for (String v : src) {
            if (v != null && !v.isBlank()) dst.add(v);
        }
    }

    @Override
    public String toString() {
        return "Blacklist{coins=" + coins.size() + ", devs=" + devs.size() + "}";
    }
}

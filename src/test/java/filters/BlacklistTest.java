package filters;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BlacklistTest {

    @Test
    void addReportsOnlyNewEntries() {
        Blacklist bl = new Blacklist();
        assertTrue(bl.addCoin("SCAM"));
        assertFalse(bl.addCoin("SCAM"));
        assertTrue(bl.addDev("0xdev"));
        assertFalse(bl.addDev("0xdev"));
        assertEquals(List.of("SCAM"), bl.coins());
        assertEquals(2, bl.size());
    }

    @Test
    void blankAndNullAreIgnored() {
        Blacklist bl = new Blacklist(Arrays.asList("A", null, " "), List.of(""));
        assertFalse(bl.addCoin(null));
        assertFalse(bl.addDev("  "));
        assertEquals(List.of("A"), bl.coins());
        assertTrue(bl.devs().isEmpty());
        assertFalse(bl.containsCoin(null));
    }

    @Test
    void coinsAndDevsAreSeparateNamespaces() {
        Blacklist bl = new Blacklist(List.of("0xabc"), List.of());
        assertTrue(bl.containsCoin("0xabc"));
        assertFalse(bl.containsDev("0xabc"));
    }

    @Test
    void mergeIsUnion() {
        Blacklist a = new Blacklist(List.of("A", "B"), List.of("d1"));
        a.merge(new Blacklist(List.of("B", "C"), List.of("d1", "d2")));
        assertEquals(List.of("A", "B", "C"), a.coins());
        assertEquals(List.of("d1", "d2"), a.devs());
    }
}

package net;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;

public interface FakeVolumeOracle {

    record Verdict(boolean fakeVolume, @Nullable String reason) {
        public static final Verdict CLEAN = new Verdict(false, null);
    }

    Verdict check(String chain, String pairAddress, double volume24h, double liquidityUsd) throws IOException;
}

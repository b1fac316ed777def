package net;

import java.io.IOException;

public interface ReputationOracle {

    /**
     * @return the raw rating; implementations throw on transport errors
     */
    String rating(String pairAddress) throws IOException;

    /** Only an exact "good" (any case) passes; failures count as not good. */
    static boolean isGood(String rating) {
        return rating != null && rating.trim().equalsIgnoreCase("good");
    }
}

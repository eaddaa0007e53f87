package dev.pekelund.zuvp.fees;

import java.util.Locale;

/**
 * Derives the 10-digit variable symbol used to pair bank transfers with a request.
 *
 * <p>The symbol depends on the request id only: the first ten hexadecimal characters of the id (dashes
 * removed) are read as a base-16 number and reduced modulo 10<sup>10</sup>.
 */
public final class VariableSymbolGenerator {

    static final int LENGTH = 10;
    private static final long MODULUS = 10_000_000_000L;

    private VariableSymbolGenerator() {
    }

    public static String generate(String requestId) {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be blank");
        }
        String hex = requestId.toLowerCase(Locale.ROOT).replaceAll("[^0-9a-f]", "");
        if (hex.isEmpty()) {
            // ids outside the UUID alphabet still map deterministically
            hex = Integer.toHexString(requestId.hashCode());
        }
        String prefix = hex.length() > LENGTH ? hex.substring(0, LENGTH) : hex;
        long value = Long.parseLong(prefix, 16) % MODULUS;
        return String.format(Locale.ROOT, "%010d", value);
    }
}

package uz.greenwhite.delegation.util;

import java.security.SecureRandom;

public final class RandomStrings {

    private static final String ALPHANUMERIC =
            "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

    // Largest multiple of the alphabet size that fits in a byte; higher bytes are redrawn.
    private static final int ACCEPT_BELOW = 256 - (256 % ALPHANUMERIC.length());

    private static final SecureRandom RANDOM = new SecureRandom();

    private RandomStrings() {
    }

    /**
     * Uniformly distributed alphanumeric string of the given length.
     */
    public static String alphanumeric(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("length must be > 0");
        }

        StringBuilder sb = new StringBuilder(length);
        byte[] buffer = new byte[length];

        while (sb.length() < length) {
            RANDOM.nextBytes(buffer);
            for (byte b : buffer) {
                int value = b & 0xFF;
                if (value < ACCEPT_BELOW) {
                    sb.append(ALPHANUMERIC.charAt(value % ALPHANUMERIC.length()));
                    if (sb.length() == length) {
                        break;
                    }
                }
            }
        }
        return sb.toString();
    }
}

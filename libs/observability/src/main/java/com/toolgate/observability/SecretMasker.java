package com.toolgate.observability;

/**
 * Masks bearer secrets before they reach a log line or an exception message.
 * <p>
 * The recognisable prefix ({@code ghp_}, {@code gho_}, {@code github_pat_} and so on) and the
 * last four characters are kept so operators can
 * still tell credentials apart; everything in between becomes {@value #MASK}.
 */
public final class SecretMasker {

    /** Replacement for the hidden middle of a secret. */
    public static final String MASK = "****";

    private static final int VISIBLE_SUFFIX = 4;
    private static final int MAX_SHORT_PREFIX = 4;
    private static final String FINE_GRAINED_PREFIX = "github_pat_";

    private SecretMasker() {
        // Utility class
    }

    /**
     * Returns a loggable form of the secret. {@code null} and blank input yield {@code "<none>"};
     * secrets too short to keep a suffix are fully masked.
     *
     * @param secret the raw credential
     * @return masked representation
     */
    public static String mask(String secret) {
        if (secret == null || secret.isBlank()) {
            return "<none>";
        }
        String prefix = prefixOf(secret);
        String body = secret.substring(prefix.length());
        if (body.length() <= VISIBLE_SUFFIX * 2) {
            return prefix + MASK;
        }
        return prefix + MASK + body.substring(body.length() - VISIBLE_SUFFIX);
    }

    private static String prefixOf(String secret) {
        if (secret.startsWith(FINE_GRAINED_PREFIX)) {
            return FINE_GRAINED_PREFIX;
        }
        int underscore = secret.indexOf('_');
        return underscore > 0 && underscore <= MAX_SHORT_PREFIX ? secret.substring(0, underscore + 1) : "";
    }
}

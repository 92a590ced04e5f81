package com.toolgate.security;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns a raw Authorization header value into a typed {@link Credential}.
 * <p>
 * Accepted forms are {@code "Bearer <token>"} (scheme matched case-insensitively) and a bare
 * token. The token is matched against the {@link CredentialType} prefixes in declaration order;
 * if none matches, a 40-character lowercase hex string is still accepted as a classic token
 * issued before prefixes existed.
 */
public final class CredentialClassifier {

    /** Scheme that looks like a bearer header but is not accepted here. */
    public static final String UNSUPPORTED_SCHEME_PREFIX = "GitHub-Bearer ";

    private static final String BEARER_PREFIX = "bearer ";
    private static final Pattern LEGACY_CLASSIC_TOKEN = Pattern.compile("\\A[a-f0-9]{40}\\z");

    private CredentialClassifier() {
        // utility class
    }

    /**
     * Classifies the given header value.
     *
     * @param authorizationHeader the Authorization header value (may be null)
     * @return the classified credential, never with type {@link CredentialType#UNKNOWN}
     * @throws CredentialException if the header is missing, uses an unsupported scheme or
     *                             carries an unrecognised token
     */
    public static Credential classify(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isEmpty()) {
            throw new CredentialException(CredentialException.Reason.MISSING_CREDENTIAL);
        }
        if (authorizationHeader.startsWith(UNSUPPORTED_SCHEME_PREFIX)) {
            throw new CredentialException(CredentialException.Reason.UNSUPPORTED_SCHEME);
        }

        String token = stripBearer(authorizationHeader);
        CredentialType type = typeOf(token);
        if (type == CredentialType.UNKNOWN) {
            throw new CredentialException(CredentialException.Reason.MALFORMED_CREDENTIAL);
        }
        return new Credential(token, type);
    }

    /**
     * Returns the credential type for a bare token, or {@link CredentialType#UNKNOWN}.
     */
    public static CredentialType typeOf(String token) {
        if (token == null || token.isEmpty()) {
            return CredentialType.UNKNOWN;
        }
        for (CredentialType type : CredentialType.values()) {
            if (type.prefix().filter(token::startsWith).isPresent()) {
                return type;
            }
        }
        if (LEGACY_CLASSIC_TOKEN.matcher(token).matches()) {
            return CredentialType.CLASSIC_TOKEN;
        }
        return CredentialType.UNKNOWN;
    }

    private static String stripBearer(String header) {
        // "Bearer " on its own leaves nothing to classify; let it fall through as malformed
        if (header.length() > BEARER_PREFIX.length()
                && header.substring(0, BEARER_PREFIX.length()).toLowerCase(Locale.ROOT).equals(BEARER_PREFIX)) {
            return header.substring(BEARER_PREFIX.length());
        }
        return header;
    }
}

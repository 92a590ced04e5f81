package com.toolgate.security;

/**
 * Thrown when an Authorization header cannot be turned into a {@link Credential}.
 * <p>
 * The {@link Reason} decides the response: a missing credential gets a 401 with a discovery
 * pointer, the other two get a plain 400.
 */
public class CredentialException extends RuntimeException {

    public enum Reason {
        MISSING_CREDENTIAL("missing required Authorization header"),
        MALFORMED_CREDENTIAL("Authorization header is badly formatted"),
        UNSUPPORTED_SCHEME("unsupported Authorization header");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private final Reason reason;

    public CredentialException(Reason reason) {
        super("bad request: " + reason.description());
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}

package com.toolgate.security.scope;

/**
 * OAuth scopes referenced by the operation catalogue.
 * <p>
 * Scope checks work on plain strings so that unknown scopes reported upstream are carried
 * through untouched; this enum only names the ones the gateway itself knows about.
 */
public enum Scope {

    REPO("repo"),
    PUBLIC_REPO("public_repo"),
    READ_ORG("read:org"),
    WRITE_ORG("write:org"),
    ADMIN_ORG("admin:org"),
    GIST("gist"),
    NOTIFICATIONS("notifications"),
    READ_PROJECT("read:project"),
    PROJECT("project"),
    SECURITY_EVENTS("security_events"),
    USER("user"),
    READ_USER("read:user"),
    USER_EMAIL("user:email"),
    READ_PACKAGES("read:packages"),
    WRITE_PACKAGES("write:packages");

    private final String value;

    Scope(String value) {
        this.value = value;
    }

    /** The scope name as it appears on the wire (e.g. "read:org"). */
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}

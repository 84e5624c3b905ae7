package com.commitpulse.pipeline.model;

/**
 * A deduplicated author or committer. Two raw signatures that derive the same
 * {@link #stableKey()} are the same identity.
 */
public record Identity(
        String stableKey,
        String login,
        String name,
        String email
) {

    public static final String UNKNOWN = "Unknown";

    /**
     * Builds an identity from raw fragments. Blank fragments are treated as absent.
     */
    public static Identity of(String login, String name, String email) {
        String normalizedLogin = emptyToNull(login);
        String normalizedName = emptyToNull(name);
        String normalizedEmail = emptyToNull(email);
        return new Identity(stableKeyOf(normalizedLogin, normalizedName, normalizedEmail),
                normalizedLogin, normalizedName, normalizedEmail);
    }

    /**
     * Derives the stable key: login, else name, else email, else {@value #UNKNOWN}.
     */
    public static String stableKeyOf(String login, String name, String email) {
        if (!isBlank(login)) {
            return login;
        }
        if (!isBlank(name)) {
            return name;
        }
        if (!isBlank(email)) {
            return email;
        }
        return UNKNOWN;
    }

    /**
     * Human-readable label, same precedence as the stable key.
     */
    public String label() {
        return stableKeyOf(login, name, email);
    }

    private static String emptyToNull(String value) {
        return isBlank(value) ? null : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

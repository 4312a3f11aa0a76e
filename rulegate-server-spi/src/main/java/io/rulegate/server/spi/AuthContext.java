package io.rulegate.server.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Authentication state captured from a request: an optional principal record and an admin flag.
 *
 * <p>The principal is exposed to rules as {@code auth}; its {@code id} field identifies the
 * principal across requests.
 */
public final class AuthContext {

    private static final AuthContext ANONYMOUS = new AuthContext(null, false);

    private final Map<String, Object> principal;
    private final boolean admin;

    private AuthContext(Map<String, Object> principal, boolean admin) {
        this.principal = principal == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(principal));
        this.admin = admin;
    }

    public static AuthContext anonymous() {
        return ANONYMOUS;
    }

    public static AuthContext of(Map<String, Object> principal) {
        return new AuthContext(Objects.requireNonNull(principal, "principal"), false);
    }

    public static AuthContext admin(Map<String, Object> principal) {
        return new AuthContext(principal, true);
    }

    /** Principal record, or {@code null} for anonymous requests. */
    public Map<String, Object> principal() {
        return principal;
    }

    public boolean isAdmin() {
        return admin;
    }

    public boolean isAnonymous() {
        return principal == null && !admin;
    }

    /** The principal's {@code id} field, if any. */
    public Optional<String> principalId() {
        if (principal == null) return Optional.empty();
        Object id = principal.get("id");
        return id == null ? Optional.empty() : Optional.of(id.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AuthContext other)) return false;
        return admin == other.admin && Objects.equals(principal, other.principal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(principal, admin);
    }

    @Override
    public String toString() {
        return "AuthContext{principalId=" + principalId().orElse(null) + ", admin=" + admin + "}";
    }
}

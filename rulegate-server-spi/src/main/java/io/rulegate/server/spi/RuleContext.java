package io.rulegate.server.spi;

import java.util.Map;

/**
 * Values visible to an access rule.
 *
 * <p>Rules reach these through the roots {@code auth}, {@code record} and {@code data}. Any of
 * them may be {@code null}. {@code admin=true} short-circuits every check to allow.
 *
 * @param auth   principal record of the caller
 * @param record target record
 * @param data   incoming payload of a create/update
 * @param admin  whether the caller is an administrator
 */
public record RuleContext(Map<String, Object> auth, Map<String, Object> record, Map<String, Object> data, boolean admin) {

    public static RuleContext of(AuthContext auth, Map<String, Object> record) {
        return of(auth, record, null);
    }

    public static RuleContext of(AuthContext auth, Map<String, Object> record, Map<String, Object> data) {
        AuthContext a = auth == null ? AuthContext.anonymous() : auth;
        return new RuleContext(a.principal(), record, data, a.isAdmin());
    }

    /** Context holding only a record, as used by subscription filters. */
    public static RuleContext recordOnly(Map<String, Object> record) {
        return new RuleContext(null, record, null, false);
    }
}

package io.rulegate.server.spi;

import java.util.Optional;

/**
 * Re-fetches the live authentication state of a principal captured earlier.
 *
 * <p>Used at delivery time when live auth refresh is enabled. An empty result means the
 * principal is no longer valid and the event is not delivered.
 */
@FunctionalInterface
public interface AuthResolver {

    Optional<AuthContext> resolve(AuthContext captured);

    /**
     * Resolver that keeps the captured snapshot.
     */
    static AuthResolver snapshot() {
        return Optional::of;
    }
}

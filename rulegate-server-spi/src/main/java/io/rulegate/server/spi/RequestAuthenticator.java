package io.rulegate.server.spi;

import java.util.List;
import java.util.Map;

/**
 * Authenticates realtime HTTP requests.
 *
 * <p>Session issuance and token validation belong to the host application; this SPI only maps
 * request headers to an {@link AuthContext}.
 */
@FunctionalInterface
public interface RequestAuthenticator {

    /**
     * @param headers request headers (names as received)
     * @return the caller's auth context; {@link AuthContext#anonymous()} if unauthenticated
     */
    AuthContext authenticate(Map<String, List<String>> headers);

    static RequestAuthenticator anonymous() {
        return headers -> AuthContext.anonymous();
    }
}

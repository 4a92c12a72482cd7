package com.metalend.core.port;

import com.metalend.core.exception.UnauthorizedException;

/**
 * External authorization check. The read path of every component is unrestricted; writes that need a
 * role go through {@link #require(String, Role)}.
 */
public interface AuthorizationPort {

    boolean hasRole(String party, Role role);

    default void require(String party, Role role) {
        if (party == null || !hasRole(party, role)) {
            throw new UnauthorizedException("Caller " + party + " lacks role " + role);
        }
    }
}

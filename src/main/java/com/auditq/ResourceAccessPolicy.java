package com.auditq;

import java.security.Principal;

/**
 * Decides whether a caller may act on a resource. Host applications replace the default allow-all
 * bean with one backed by their own ownership model.
 */
@FunctionalInterface
public interface ResourceAccessPolicy {

    boolean canAccess(Principal principal, String resourceId);

    static ResourceAccessPolicy allowAll() {
        return (principal, resourceId) -> true;
    }
}

package com.gocomet.bustracking.security;

/**
 * Turns a bearer credential into a principal.
 */
public interface IdentityVerifier {

    /**
     * @param authorizationHeader raw {@code Authorization} header value
     * @throws com.gocomet.bustracking.common.exception.UnauthorizedException on a missing,
     *         invalid or expired credential
     */
    AuthPrincipal verify(String authorizationHeader);

    /**
     * Verifies the credential and requires one of the given roles.
     */
    AuthPrincipal verify(String authorizationHeader, Role... allowedRoles);
}

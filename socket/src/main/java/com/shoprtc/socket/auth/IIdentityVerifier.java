package com.shoprtc.socket.auth;

import com.shoprtc.core.model.Identity;

import java.util.Optional;

/**
 * Interface for bearer token verification (Dependency Inversion Principle).
 * <p>
 * Enables testing the upgrade path without signing real tokens.
 * </p>
 */
public interface IIdentityVerifier {
    /**
     * Verifies a token and extracts the identity it was issued for.
     *
     * @param token raw token from the connection request
     * @return the identity, or empty if the token is malformed, expired or wrongly signed
     */
    Optional<Identity> verify(String token);
}

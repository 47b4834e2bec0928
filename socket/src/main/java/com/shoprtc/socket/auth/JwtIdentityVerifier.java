package com.shoprtc.socket.auth;

import com.shoprtc.core.model.Identity;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Optional;

/**
 * Verifies HS256 tokens issued by the shop backend.
 * <p>
 * Claims: {@code uid} (required), {@code shop_name}, {@code email}, {@code shop_slug}.
 * The display name is the shop name, falling back to the local part of the email.
 * </p>
 */
public class JwtIdentityVerifier implements IIdentityVerifier {
    private static final Logger log = LoggerFactory.getLogger(JwtIdentityVerifier.class);

    static final String CLAIM_USER_ID = "uid";
    static final String CLAIM_SHOP_NAME = "shop_name";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_SHOP_SLUG = "shop_slug";

    private final Key key;

    /**
     * @param secret shared secret; at least 32 bytes once UTF-8 encoded
     */
    public JwtIdentityVerifier(String secret) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public Optional<Identity> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        Claims claims;
        try {
            claims = Jwts.parserBuilder()
                .setSigningKey(key)
                .build()
                .parseClaimsJws(token)
                .getBody();
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Invalid JWT token: {}", e.getMessage());
            return Optional.empty();
        }

        String userId = stringClaim(claims, CLAIM_USER_ID);
        if (userId == null || userId.isBlank()) {
            log.warn("JWT token without {} claim", CLAIM_USER_ID);
            return Optional.empty();
        }
        return Optional.of(Identity.authenticated(
            userId,
            displayName(stringClaim(claims, CLAIM_SHOP_NAME), stringClaim(claims, CLAIM_EMAIL)),
            stringClaim(claims, CLAIM_SHOP_SLUG)
        ));
    }

    private static String displayName(String shopName, String email) {
        if (shopName != null && !shopName.isBlank()) {
            return shopName;
        }
        if (email != null && !email.isBlank()) {
            int at = email.indexOf('@');
            return at > 0 ? email.substring(0, at) : email;
        }
        return "User";
    }

    // uid may be issued as a number
    private static String stringClaim(Claims claims, String name) {
        Object value = claims.get(name);
        return value != null ? value.toString() : null;
    }
}

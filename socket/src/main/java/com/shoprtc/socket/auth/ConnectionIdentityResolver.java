package com.shoprtc.socket.auth;

import com.shoprtc.core.model.Identity;
import lombok.Value;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Resolves the identity of a WebSocket upgrade request from its query parameters.
 * <p>
 * Room channels accept a {@code token} or a self-asserted guest ({@code guestId}, optional
 * {@code guestName}); the presence channel accepts only a {@code token}. A token that is
 * present but does not verify is rejected even if guest parameters are present too.
 * </p>
 */
public class ConnectionIdentityResolver {
    static final String DEFAULT_GUEST_NAME = "Guest";

    public static final String INVALID_TOKEN = "Invalid token";
    public static final String MISSING_ROOM_IDENTITY = "Missing token or guestId";
    public static final String MISSING_TOKEN = "Missing token";

    private final IIdentityVerifier verifier;

    public ConnectionIdentityResolver(IIdentityVerifier verifier) {
        this.verifier = verifier;
    }

    public Resolution forRoom(Map<String, List<String>> params) {
        Optional<String> token = param(params, "token");
        if (token.isPresent()) {
            return fromToken(token.get());
        }
        Optional<String> guestId = param(params, "guestId");
        if (guestId.isPresent()) {
            String guestName = param(params, "guestName").orElse(DEFAULT_GUEST_NAME);
            return Resolution.accepted(Identity.guest(guestId.get(), guestName));
        }
        return Resolution.rejected(MISSING_ROOM_IDENTITY, "missing_identity");
    }

    public Resolution forPresence(Map<String, List<String>> params) {
        return param(params, "token")
            .map(this::fromToken)
            .orElseGet(() -> Resolution.rejected(MISSING_TOKEN, "missing_identity"));
    }

    private Resolution fromToken(String token) {
        return verifier.verify(token)
            .map(Resolution::accepted)
            .orElseGet(() -> Resolution.rejected(INVALID_TOKEN, "invalid_token"));
    }

    private static Optional<String> param(Map<String, List<String>> params, String name) {
        return Stream.ofNullable(params.get(name))
            .flatMap(Collection::stream)
            .filter(value -> !value.isBlank())
            .findFirst();
    }

    /**
     * Outcome of resolving one request: either an identity or a 401 message.
     */
    @Value
    public static class Resolution {
        Identity identity;
        String error;

        /**
         * Short tag for the rejection counter.
         */
        String reason;

        static Resolution accepted(Identity identity) {
            return new Resolution(identity, null, null);
        }

        static Resolution rejected(String error, String reason) {
            return new Resolution(null, error, reason);
        }

        public boolean isAccepted() {
            return identity != null;
        }
    }
}

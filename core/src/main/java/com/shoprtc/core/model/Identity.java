package com.shoprtc.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Identity a connection was opened with.
 * <p>
 * Either verified from a token ({@code guest == false}, {@code shopSlug} may be set)
 * or self-asserted by an unauthenticated storefront visitor ({@code guest == true}).
 * Actors trust whatever identity the upgrade handler hands them.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class Identity {
    String userId;
    String username;

    /**
     * Stable shop identifier used to route notifications; {@code null} for guests
     * and for users without a shop.
     */
    String shopSlug;

    boolean guest;

    public static Identity authenticated(String userId, String username, String shopSlug) {
        return new Identity(userId, username, shopSlug == null || shopSlug.isBlank() ? null : shopSlug, false);
    }

    public static Identity guest(String guestId, String guestName) {
        return new Identity(guestId, guestName, null, true);
    }
}

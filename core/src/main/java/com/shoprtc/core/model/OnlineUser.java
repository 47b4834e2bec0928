package com.shoprtc.core.model;

import lombok.Value;

/**
 * Row of the {@code ONLINE_USERS} event.
 */
@Value
public class OnlineUser {
    String userId;
    String username;
    PresenceStatus status;
}

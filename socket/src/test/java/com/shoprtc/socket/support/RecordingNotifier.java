package com.shoprtc.socket.support;

import com.shoprtc.socket.actor.RoomNotifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingNotifier implements RoomNotifier {
    public final List<String[]> roomNotifications = new CopyOnWriteArrayList<>();
    public final List<String[]> identityNotifications = new CopyOnWriteArrayList<>();

    @Override
    public void notifyRoom(String roomKey, String payloadJson) {
        roomNotifications.add(new String[]{roomKey, payloadJson});
    }

    @Override
    public void notifyIdentity(String targetSlug, String payloadJson) {
        identityNotifications.add(new String[]{targetSlug, payloadJson});
    }
}

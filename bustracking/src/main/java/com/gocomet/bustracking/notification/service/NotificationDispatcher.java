package com.gocomet.bustracking.notification.service;

import com.gocomet.bustracking.notification.dto.RiderNotification;

/**
 * Fire-and-forget enqueue of a push/in-app message. Never throws.
 */
public interface NotificationDispatcher {

    void enqueue(RiderNotification notification);
}

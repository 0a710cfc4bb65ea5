package com.gocomet.bustracking.missedbus.model;

/**
 * Rider-facing copy for each stage of the missed-bus flow.
 */
public final class MissedBusMessages {

    public static final String MAINTENANCE =
            "This feature is currently under maintenance. Sorry for the inconvenience caused";
    public static final String SEARCHING = "Searching other buses to help you. We'll notify you shortly.";
    public static final String REQUEST_PENDING =
            "Pickup request sent to nearby buses. We'll notify you when a driver accepts.";
    public static final String NO_CANDIDATES =
            "Currently no bus is available to pick you up. Please wait for the next bus or try again later.";
    public static final String REQUEST_EXPIRED = "Your pickup request expired. Please try again if needed.";
    public static final String REQUEST_CANCELLED = "Your pickup request was cancelled.";
    public static final String RATE_LIMITED = "You have reached the missed-bus request limit. Try again later.";
    public static final String ALREADY_HAS_PENDING = "You already have a pending or approved missed-bus request.";

    private MissedBusMessages() {
    }

    public static String requestAccepted(String busId, String stopName) {
        return String.format("Good news, Bus %s will pick you up. Please head to %s.", busId, stopName);
    }
}

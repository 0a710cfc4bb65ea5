package com.gocomet.bustracking.broadcast;

public final class RealtimeEvents {

    public static final String LOCATION_UPDATE = "location_update";

    public static final String WAITING_FLAG_CREATED = "waiting_flag_created";
    public static final String WAITING_FLAG_UPDATED = "waiting_flag_updated";
    public static final String WAITING_FLAG_REMOVED = "waiting_flag_removed";
    public static final String FLAG_ACKNOWLEDGED = "flag_acknowledged";
    public static final String FLAG_EXPIRED = "flag_expired";

    public static final String MISSED_BUS_APPROVED = "missed_bus_approved";
    public static final String MISSED_BUS_REJECTED = "missed_bus_rejected";
    public static final String MISSED_BUS_EXPIRED = "missed_bus_expired";
    public static final String MISSED_BUS_PICKUP = "missed_bus_pickup";

    private RealtimeEvents() {
    }
}

package com.gocomet.bustracking.broadcast;

public final class RealtimeChannels {

    private RealtimeChannels() {
    }

    /** Location updates for every bus on a route. */
    public static String route(String routeId) {
        return "route_" + routeId;
    }

    /** Waiting-flag events for the driver of a bus. */
    public static String waitingFlags(String busId) {
        return "waiting_flags_" + busId;
    }

    /** Missed-bus pickups dispatched to the driver of a candidate bus. */
    public static String driverWaitRequest(String busId) {
        return "driver_wait_request_" + busId;
    }

    /** Events addressed to one rider. */
    public static String student(String studentId) {
        return "student_" + studentId;
    }
}

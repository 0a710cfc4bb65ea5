package com.gocomet.bustracking.common.geo;

/**
 * Great-circle distance and speed helpers shared by ingestion, flags and matching.
 */
public final class GeoUtils {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoUtils() {
    }

    /**
     * Calculate distance between two points using the Haversine formula.
     */
    public static double distanceKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    public static double distanceMeters(double lat1, double lng1, double lat2, double lng2) {
        return distanceKm(lat1, lng1, lat2, lng2) * 1000.0;
    }

    /**
     * Speed implied by covering the distance between two fixes in the elapsed time.
     * Returns positive infinity for a non-zero distance covered in zero or negative time.
     */
    public static double impliedSpeedKmh(double lat1, double lng1, double lat2, double lng2, long elapsedMillis) {
        double km = distanceKm(lat1, lng1, lat2, lng2);
        if (elapsedMillis <= 0) {
            return km == 0 ? 0 : Double.POSITIVE_INFINITY;
        }
        double hours = elapsedMillis / 3_600_000.0;
        return km / hours;
    }

    public static boolean isValidCoordinate(double lat, double lng) {
        return Double.isFinite(lat) && Double.isFinite(lng)
                && lat >= -90 && lat <= 90
                && lng >= -180 && lng <= 180;
    }
}

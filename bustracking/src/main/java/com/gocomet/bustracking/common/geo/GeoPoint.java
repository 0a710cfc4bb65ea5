package com.gocomet.bustracking.common.geo;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A latitude/longitude pair in decimal degrees.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class GeoPoint {

    private double latitude;
    private double longitude;

    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude);
    }

    public boolean isValid() {
        return GeoUtils.isValidCoordinate(latitude, longitude);
    }

    public double distanceMetersTo(GeoPoint other) {
        return GeoUtils.distanceMeters(latitude, longitude, other.latitude, other.longitude);
    }
}

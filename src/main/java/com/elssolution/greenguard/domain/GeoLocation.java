package com.elssolution.greenguard.domain;

/** Named site with WGS84 coordinates. */
public record GeoLocation(String name, double latitude, double longitude) {

    public static final GeoLocation UNKNOWN = new GeoLocation("unknown", 0.0, 0.0);

    public GeoLocation {
        name = (name == null || name.isBlank()) ? "unknown" : name;
    }

    /** Coordinates a live provider will accept. */
    public boolean hasValidCoordinates() {
        return Double.isFinite(latitude) && Double.isFinite(longitude)
                && Math.abs(latitude) <= 90.0 && Math.abs(longitude) <= 180.0;
    }

    public double clampedLatitude() {
        return Double.isFinite(latitude) ? Maths.clamp(latitude, -90.0, 90.0) : 0.0;
    }

    public double clampedLongitude() {
        return Double.isFinite(longitude) ? Maths.clamp(longitude, -180.0, 180.0) : 0.0;
    }
}

package com.linlay.citygeo.model;

public record GeoPoint(
        double latitude,
        double longitude,
        String displayName,
        String timezone
) {

    public GeoPoint withTimezone(String timezone) {
        return new GeoPoint(latitude, longitude, displayName, timezone);
    }

    public boolean hasTimezone() {
        return timezone != null && !timezone.isBlank();
    }
}

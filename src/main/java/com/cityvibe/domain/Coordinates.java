package com.cityvibe.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Latitude/longitude pair returned by a geocoding provider.
 */
public final class Coordinates {

    @JsonProperty("lat")
    private final double latitude;

    @JsonProperty("lng")
    private final double longitude;

    @JsonCreator
    public Coordinates(@JsonProperty("lat") double latitude, @JsonProperty("lng") double longitude) {
        if (latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("Latitude out of range: " + latitude);
        }
        if (longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("Longitude out of range: " + longitude);
        }
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    @Override
    public String toString() {
        return "(" + latitude + ", " + longitude + ")";
    }
}

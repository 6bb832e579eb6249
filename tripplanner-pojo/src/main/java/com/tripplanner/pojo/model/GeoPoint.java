package com.tripplanner.pojo.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class GeoPoint {

    double lat;

    double lng;

    public static GeoPoint of(double lat, double lng) {
        return new GeoPoint(lat, lng);
    }
}

package com.linlay.citygeo.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OpenMeteoGeoResult(
        long id,
        String name,
        double latitude,
        double longitude,
        String timezone,
        String country,
        String admin1,
        long population
) {
}

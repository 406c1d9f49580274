package com.linlay.citygeo.model.api;

public record CityTimezoneResponse(
        String timezone,
        String city
) {
}

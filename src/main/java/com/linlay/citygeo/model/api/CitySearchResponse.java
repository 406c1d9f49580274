package com.linlay.citygeo.model.api;

import java.util.List;

public record CitySearchResponse(
        List<CityResult> results
) {

    public record CityResult(
            String displayName,
            double lat,
            double lon
    ) {
    }
}

package com.linlay.citygeo.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NominatimPlace(
        @JsonProperty("place_id") long placeId,
        String lat,
        String lon,
        String name,
        @JsonProperty("display_name") String displayName,
        @JsonProperty("class") String category,
        String type,
        double importance,
        @JsonProperty("addresstype") String addressType,
        NominatimAddress address
) {
}

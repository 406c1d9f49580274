package com.linlay.citygeo.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sparse address block; population varies by country, so every field may be null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NominatimAddress(
        String city,
        String town,
        String village,
        String county,
        String state,
        String province,
        String country,
        @JsonProperty("country_code") String countryCode
) {
}

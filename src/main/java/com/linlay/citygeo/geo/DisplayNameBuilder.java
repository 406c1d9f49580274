package com.linlay.citygeo.geo;

import com.linlay.citygeo.provider.NominatimAddress;
import com.linlay.citygeo.provider.NominatimPlace;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Composes "settlement, region, country" out of a Nominatim address block.
 * Field values are already localized by the accept-language of the search.
 */
public final class DisplayNameBuilder {

    private static final NominatimAddress EMPTY_ADDRESS =
            new NominatimAddress(null, null, null, null, null, null, null, null);

    private DisplayNameBuilder() {
    }

    public static String buildDisplayName(NominatimPlace place) {
        NominatimAddress address = place.address() == null ? EMPTY_ADDRESS : place.address();

        String settlement = ScriptVariantSelector.selectPreferredVariant(firstNonEmpty(
                place.name(), address.city(), address.town(), address.village(), address.county()));
        String region = ScriptVariantSelector.selectPreferredVariant(firstNonEmpty(
                address.state(), address.province()));
        String country = ScriptVariantSelector.selectPreferredVariant(address.country());

        List<String> parts = new ArrayList<>(3);
        if (!settlement.isEmpty()) {
            parts.add(settlement);
        }
        // only region is compared against settlement; "Singapore, Singapore" style country repeats stay
        if (!region.isEmpty() && !region.equals(settlement)) {
            parts.add(region);
        }
        if (!country.isEmpty()) {
            parts.add(country);
        }

        if (parts.isEmpty()) {
            return place.displayName() == null ? "" : place.displayName();
        }
        return String.join(", ", parts);
    }

    private static String firstNonEmpty(String... candidates) {
        for (String candidate : candidates) {
            if (StringUtils.hasLength(candidate)) {
                return candidate;
            }
        }
        return "";
    }
}

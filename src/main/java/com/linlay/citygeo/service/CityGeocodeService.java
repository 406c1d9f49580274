package com.linlay.citygeo.service;

import com.linlay.citygeo.model.GeoPoint;
import com.linlay.citygeo.timezone.TimezoneResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Single best match for a city, enriched with its timezone when the lookup succeeds.
 */
@Service
public class CityGeocodeService {

    private static final Logger log = LoggerFactory.getLogger(CityGeocodeService.class);

    private final CitySearchService citySearchService;
    private final TimezoneResolver timezoneResolver;

    public CityGeocodeService(CitySearchService citySearchService, TimezoneResolver timezoneResolver) {
        this.citySearchService = citySearchService;
        this.timezoneResolver = timezoneResolver;
    }

    public Mono<GeoPoint> geocodeCity(String city, String language) {
        return citySearchService.searchCities(city, 1, language)
                .flatMap(points -> {
                    if (points.isEmpty()) {
                        return Mono.error(new CityNotFoundException(city));
                    }
                    GeoPoint point = points.get(0);
                    if (point.hasTimezone()) {
                        return Mono.just(point);
                    }
                    return enrichTimezone(point);
                });
    }

    private Mono<GeoPoint> enrichTimezone(GeoPoint point) {
        String latitude = formatCoordinate(point.latitude());
        String longitude = formatCoordinate(point.longitude());
        return Mono.defer(() -> timezoneResolver.resolveTimezone(latitude, longitude))
                .map(point::withTimezone)
                .defaultIfEmpty(point)
                .onErrorResume(ex -> {
                    log.warn("timezone lookup failed for {} ({}, {}): {}",
                            point.displayName(), latitude, longitude, ex.getMessage());
                    return Mono.just(point);
                });
    }

    public static String formatCoordinate(double value) {
        return String.format(Locale.ROOT, "%f", value);
    }
}

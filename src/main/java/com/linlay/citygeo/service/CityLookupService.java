package com.linlay.citygeo.service;

import com.linlay.citygeo.model.GeoPoint;
import com.linlay.citygeo.provider.GeoProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Nominatim first; Open-Meteo geocoding when Nominatim fails or finds nothing.
 * When both fail the Open-Meteo error is reported.
 */
@Service
public class CityLookupService {

    private static final Logger log = LoggerFactory.getLogger(CityLookupService.class);

    private final CitySearchService citySearchService;
    private final CityGeocodeService cityGeocodeService;
    private final OpenMeteoCitySearchService openMeteoCitySearchService;

    public CityLookupService(
            CitySearchService citySearchService,
            CityGeocodeService cityGeocodeService,
            OpenMeteoCitySearchService openMeteoCitySearchService
    ) {
        this.citySearchService = citySearchService;
        this.cityGeocodeService = cityGeocodeService;
        this.openMeteoCitySearchService = openMeteoCitySearchService;
    }

    public Mono<List<GeoPoint>> searchCities(String query, int count, String language) {
        return citySearchService.searchCities(query, count, language)
                .onErrorResume(CityLookupService::isFallbackCandidate, ex -> {
                    log.warn("nominatim search failed q={}, falling back to open-meteo: {}", query, ex.getMessage());
                    return openMeteoCitySearchService.searchCities(query, count, language);
                });
    }

    public Mono<GeoPoint> geocodeCity(String city, String language) {
        return cityGeocodeService.geocodeCity(city, language)
                .onErrorResume(CityLookupService::isFallbackCandidate, ex -> {
                    log.warn("nominatim geocode failed city={}, falling back to open-meteo: {}", city, ex.getMessage());
                    return openMeteoCitySearchService.searchCities(city, 1, language)
                            .map(points -> points.get(0));
                });
    }

    private static boolean isFallbackCandidate(Throwable ex) {
        return ex instanceof GeoProviderException || ex instanceof CityNotFoundException;
    }
}

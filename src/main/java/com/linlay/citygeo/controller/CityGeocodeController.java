package com.linlay.citygeo.controller;

import com.linlay.citygeo.geo.GeoLanguage;
import com.linlay.citygeo.model.GeoPoint;
import com.linlay.citygeo.model.api.ApiResponse;
import com.linlay.citygeo.model.api.CitySearchResponse;
import com.linlay.citygeo.model.api.CityTimezoneResponse;
import com.linlay.citygeo.service.CityGeocodeService;
import com.linlay.citygeo.service.CityLookupService;
import com.linlay.citygeo.service.CityQueryException;
import com.linlay.citygeo.timezone.TimezoneResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/widgets")
public class CityGeocodeController {

    private static final Logger log = LoggerFactory.getLogger(CityGeocodeController.class);
    private static final int SEARCH_COUNT = 8;

    private final CityLookupService cityLookupService;
    private final TimezoneResolver timezoneResolver;

    public CityGeocodeController(CityLookupService cityLookupService, TimezoneResolver timezoneResolver) {
        this.cityLookupService = cityLookupService;
        this.timezoneResolver = timezoneResolver;
    }

    @GetMapping("/geocode")
    public Mono<ApiResponse<CitySearchResponse>> geocode(
            @RequestParam(required = false) String query,
            @RequestParam(required = false) String q,
            @RequestParam(required = false) String lang
    ) {
        String cityQuery = firstText(query, q);
        if (cityQuery.isEmpty()) {
            return Mono.error(new CityQueryException("query required"));
        }
        Mono<List<GeoPoint>> search = cityLookupService.searchCities(cityQuery, SEARCH_COUNT, lang);
        if (GeoLanguage.from(lang) == GeoLanguage.ZH) {
            search = search.onErrorResume(ex -> {
                log.info("zh city search failed q={}, retrying in en: {}", cityQuery, ex.getMessage());
                return cityLookupService.searchCities(cityQuery, SEARCH_COUNT, "en")
                        .onErrorResume(fallbackEx -> Mono.error(ex));
            });
        }
        return search.map(points -> ApiResponse.success(new CitySearchResponse(points.stream()
                .map(point -> new CitySearchResponse.CityResult(
                        point.displayName(),
                        point.latitude(),
                        point.longitude()
                ))
                .toList())));
    }

    @GetMapping("/timezone")
    public Mono<ApiResponse<CityTimezoneResponse>> timezone(
            @RequestParam(required = false) String city,
            @RequestParam(required = false) String q,
            @RequestParam(required = false) String lang
    ) {
        String cityQuery = firstText(city, q);
        if (cityQuery.isEmpty()) {
            return Mono.error(new CityQueryException("city required"));
        }
        Mono<GeoPoint> geocode = cityLookupService.geocodeCity(cityQuery, lang);
        if (GeoLanguage.from(lang) == GeoLanguage.ZH) {
            geocode = geocode.onErrorResume(ex -> cityLookupService.geocodeCity(cityQuery, "en"));
        }
        return geocode
                .flatMap(point -> point.hasTimezone()
                        ? Mono.just(point)
                        : timezoneResolver.resolveTimezone(
                                        CityGeocodeService.formatCoordinate(point.latitude()),
                                        CityGeocodeService.formatCoordinate(point.longitude()))
                                .map(point::withTimezone))
                .map(point -> ApiResponse.success(new CityTimezoneResponse(
                        point.timezone().trim(),
                        StringUtils.hasText(point.displayName()) ? point.displayName() : cityQuery
                )));
    }

    private String firstText(String primary, String secondary) {
        if (StringUtils.hasText(primary)) {
            return primary.trim();
        }
        return StringUtils.hasText(secondary) ? secondary.trim() : "";
    }
}

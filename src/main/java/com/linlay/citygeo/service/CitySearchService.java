package com.linlay.citygeo.service;

import com.linlay.citygeo.geo.ChineseQueryTranslator;
import com.linlay.citygeo.geo.DisplayNameBuilder;
import com.linlay.citygeo.geo.GeoLanguage;
import com.linlay.citygeo.model.GeoPoint;
import com.linlay.citygeo.provider.NominatimClient;
import com.linlay.citygeo.provider.NominatimPlace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 城市搜索（自动补全）入口。
 * <p>
 * 负责查询规范化、中文城市名转写、调用 Nominatim、按 place_id 去重，
 * 并把原始结果映射为带层级显示名的 {@link GeoPoint}。
 */
@Service
public class CitySearchService {

    private static final Logger log = LoggerFactory.getLogger(CitySearchService.class);

    static final int DEFAULT_COUNT = 8;
    static final int MAX_COUNT = 20;

    private final NominatimClient nominatimClient;

    public CitySearchService(NominatimClient nominatimClient) {
        this.nominatimClient = nominatimClient;
    }

    public Mono<List<GeoPoint>> searchCities(String query, int count, String language) {
        return Mono.defer(() -> {
            String cityQuery = normalizeQuery(query);
            int limit = clampCount(count);
            String acceptLanguage = GeoLanguage.from(language).acceptLanguage();

            String searchTerm = cityQuery;
            if (ChineseQueryTranslator.containsHan(cityQuery)) {
                // untranslated names may still be international cities written in Chinese
                searchTerm = ChineseQueryTranslator.translate(cityQuery);
            }
            boolean translated = !searchTerm.equals(cityQuery);
            log.debug("search cities q={} term={} count={} accept-language={}",
                    cityQuery, searchTerm, limit, acceptLanguage);

            Mono<List<NominatimPlace>> results = nominatimClient.search(searchTerm, limit * 2, acceptLanguage);
            if (translated) {
                results = results.flatMap(places -> places.isEmpty()
                        ? nominatimClient.search(cityQuery, limit * 2, acceptLanguage)
                        : Mono.just(places));
            }
            return results.map(places -> toGeoPoints(cityQuery, places, limit));
        });
    }

    static String normalizeQuery(String query) {
        String trimmed = query == null ? "" : query.trim();
        if (trimmed.isEmpty()) {
            throw new CityQueryException("city required");
        }
        // "City, State, Country" -> "City"
        int comma = indexOfComma(trimmed);
        if (comma >= 0) {
            trimmed = trimmed.substring(0, comma).trim();
            if (trimmed.isEmpty()) {
                throw new CityQueryException("city required");
            }
        }
        return trimmed;
    }

    static int clampCount(int count) {
        if (count <= 0) {
            return DEFAULT_COUNT;
        }
        return Math.min(count, MAX_COUNT);
    }

    private static int indexOfComma(String text) {
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == ',' || ch == '，') {
                return i;
            }
        }
        return -1;
    }

    private List<GeoPoint> toGeoPoints(String cityQuery, List<NominatimPlace> places, int limit) {
        if (places.isEmpty()) {
            throw new CityNotFoundException(cityQuery);
        }
        Set<Long> seen = new HashSet<>();
        List<GeoPoint> points = new ArrayList<>(limit);
        for (NominatimPlace place : places) {
            if (points.size() >= limit) {
                break;
            }
            if (!seen.add(place.placeId())) {
                continue;
            }
            points.add(new GeoPoint(
                    parseCoordinate(place.lat()),
                    parseCoordinate(place.lon()),
                    DisplayNameBuilder.buildDisplayName(place),
                    ""
            ));
        }
        if (points.isEmpty()) {
            throw new CityNotFoundException(cityQuery);
        }
        return List.copyOf(points);
    }

    private static double parseCoordinate(String value) {
        if (value == null) {
            return 0.0;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ex) {
            return 0.0;
        }
    }
}

package com.linlay.citygeo.service;

import com.linlay.citygeo.geo.ChineseQueryTranslator;
import com.linlay.citygeo.geo.GeoLanguage;
import com.linlay.citygeo.geo.PinyinVariants;
import com.linlay.citygeo.model.GeoPoint;
import com.linlay.citygeo.provider.GeoProviderException;
import com.linlay.citygeo.provider.OpenMeteoGeoResult;
import com.linlay.citygeo.provider.OpenMeteoGeocodingClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * 基于 Open-Meteo 地理编码接口的城市搜索，作为 Nominatim 不可用或无结果时的后备。
 * <p>
 * Open-Meteo 的中文数据不稳定：同一个城市用英文、拼音、zh、zh-CN 搜索得到的结果差别很大，
 * 所以这里按 id 合并多次查询的结果，再按人口排序、按约 1km 的坐标网格去重。
 * 结果直接带时区。
 */
@Service
public class OpenMeteoCitySearchService {

    private static final Logger log = LoggerFactory.getLogger(OpenMeteoCitySearchService.class);

    private final OpenMeteoGeocodingClient geocodingClient;

    public OpenMeteoCitySearchService(OpenMeteoGeocodingClient geocodingClient) {
        this.geocodingClient = geocodingClient;
    }

    public Mono<List<GeoPoint>> searchCities(String query, int count, String language) {
        return Mono.defer(() -> {
            String cityQuery = CitySearchService.normalizeQuery(query);
            int limit = CitySearchService.clampCount(count);
            boolean chinese = GeoLanguage.from(language) == GeoLanguage.ZH;
            String pinyin = ChineseQueryTranslator.containsHan(cityQuery)
                    ? PinyinVariants.pinyinVariant(cityQuery)
                    : "";
            int fetchCount = limit * 2;
            MergedResults merged = new MergedResults();

            // english first: best coverage of major cities
            Mono<Void> steps = fetch(merged, cityQuery, fetchCount, "en", results -> merged.merge(results, false));
            if (!pinyin.isEmpty()) {
                steps = steps.then(fetch(merged, pinyin, fetchCount, "en", results -> merged.merge(results, false)));
            }
            steps = steps.then(fetch(merged, cityQuery, fetchCount, "zh", results -> merged.merge(results, true)));
            if (chinese) {
                // zh alone may answer in Traditional script
                steps = steps.then(fetch(merged, cityQuery, fetchCount, "zh-CN", merged::overrideSimplifiedNames));
                if (!pinyin.isEmpty()) {
                    steps = steps
                            .then(fetch(merged, pinyin, fetchCount, "zh-CN", merged::fillSimplifiedNames))
                            .then(fetch(merged, pinyin, fetchCount, "zh", merged::fillChineseRegions));
                }
            }
            return steps.then(Mono.fromCallable(() -> merged.toGeoPoints(cityQuery, limit, chinese)));
        });
    }

    private Mono<Void> fetch(
            MergedResults merged,
            String name,
            int count,
            String language,
            Consumer<List<OpenMeteoGeoResult>> mergeStep
    ) {
        return Mono.defer(() -> geocodingClient.search(name, count, language))
                .doOnNext(results -> {
                    merged.anyFetchSucceeded = true;
                    mergeStep.accept(results);
                })
                .onErrorResume(GeoProviderException.class, ex -> {
                    log.warn("open-meteo geocoding failed name={} language={}: {}", name, language, ex.getMessage());
                    if (merged.firstFailure == null) {
                        merged.firstFailure = ex;
                    }
                    return Mono.empty();
                })
                .then();
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }

    private static final class MergedPlace {

        private final OpenMeteoGeoResult source;
        private String nameZh = "";
        private String nameEn = "";
        private String admin1Zh = "";
        private String admin1En = "";
        private String country;
        private long population;

        private MergedPlace(OpenMeteoGeoResult source) {
            this.source = source;
            this.country = source.country();
            this.population = source.population();
        }
    }

    private record GridKey(long lat, long lon) {
    }

    private static final class MergedResults {

        private final Map<Long, MergedPlace> byId = new LinkedHashMap<>();
        private boolean anyFetchSucceeded;
        private GeoProviderException firstFailure;

        void merge(List<OpenMeteoGeoResult> results, boolean chinese) {
            for (OpenMeteoGeoResult result : results) {
                if (result.id() == 0) {
                    continue;
                }
                MergedPlace place = byId.get(result.id());
                if (place == null) {
                    place = new MergedPlace(result);
                    byId.put(result.id(), place);
                } else if (result.population() > place.population) {
                    place.population = result.population();
                }
                if (chinese) {
                    place.nameZh = place.nameZh.isEmpty() ? trim(result.name()) : place.nameZh;
                    place.admin1Zh = place.admin1Zh.isEmpty() ? trim(result.admin1()) : place.admin1Zh;
                } else {
                    place.nameEn = place.nameEn.isEmpty() ? trim(result.name()) : place.nameEn;
                    place.admin1En = place.admin1En.isEmpty() ? trim(result.admin1()) : place.admin1En;
                }
            }
        }

        void overrideSimplifiedNames(List<OpenMeteoGeoResult> results) {
            forKnown(results, (place, result) -> {
                String name = trim(result.name());
                if (!name.isEmpty()) {
                    place.nameZh = name;
                }
            });
        }

        void fillSimplifiedNames(List<OpenMeteoGeoResult> results) {
            forKnown(results, (place, result) -> {
                String name = trim(result.name());
                if (!name.isEmpty() && place.nameZh.isEmpty()) {
                    place.nameZh = name;
                }
            });
        }

        void fillChineseRegions(List<OpenMeteoGeoResult> results) {
            forKnown(results, (place, result) -> {
                String admin1 = trim(result.admin1());
                if (!admin1.isEmpty() && place.admin1Zh.isEmpty()) {
                    place.admin1Zh = admin1;
                }
                String country = trim(result.country());
                if (!country.isEmpty() && ChineseQueryTranslator.containsHan(country)) {
                    place.country = country;
                }
            });
        }

        private void forKnown(List<OpenMeteoGeoResult> results,
                              BiConsumer<MergedPlace, OpenMeteoGeoResult> action) {
            for (OpenMeteoGeoResult result : results) {
                if (result.id() == 0) {
                    continue;
                }
                MergedPlace place = byId.get(result.id());
                if (place != null) {
                    action.accept(place, result);
                }
            }
        }

        List<GeoPoint> toGeoPoints(String cityQuery, int limit, boolean chinese) {
            if (byId.isEmpty()) {
                if (!anyFetchSucceeded && firstFailure != null) {
                    throw firstFailure;
                }
                throw new CityNotFoundException(cityQuery);
            }
            List<MergedPlace> places = new ArrayList<>(byId.values());
            places.sort(Comparator.comparingLong((MergedPlace place) -> place.population).reversed());

            Set<GridKey> seen = new HashSet<>();
            List<GeoPoint> points = new ArrayList<>(limit);
            for (MergedPlace place : places) {
                if (points.size() >= limit) {
                    break;
                }
                GridKey key = new GridKey(
                        Math.round(place.source.latitude() * 100),
                        Math.round(place.source.longitude() * 100));
                if (!seen.add(key)) {
                    continue;
                }
                points.add(new GeoPoint(
                        place.source.latitude(),
                        place.source.longitude(),
                        displayName(place, chinese),
                        trim(place.source.timezone())
                ));
            }
            return List.copyOf(points);
        }

        private String displayName(MergedPlace place, boolean chinese) {
            String name;
            String admin1;
            String country = trim(place.country);
            if (chinese) {
                name = StringUtils.hasLength(place.nameZh) ? place.nameZh : place.nameEn;
                admin1 = StringUtils.hasLength(place.admin1Zh) ? place.admin1Zh : place.admin1En;
                if (country.isEmpty() || "China".equals(country)) {
                    country = "中国";
                }
            } else {
                name = StringUtils.hasLength(place.nameEn) ? place.nameEn : place.nameZh;
                admin1 = StringUtils.hasLength(place.admin1En) ? place.admin1En : place.admin1Zh;
            }
            if (name.isEmpty()) {
                name = trim(place.source.name());
            }
            if (!admin1.isEmpty() && !country.isEmpty()) {
                return name + ", " + admin1 + ", " + country;
            }
            if (!country.isEmpty()) {
                return name + ", " + country;
            }
            return name;
        }
    }
}

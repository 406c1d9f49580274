package com.linlay.citygeo.timezone;

import reactor.core.publisher.Mono;

/**
 * Maps a coordinate pair, given as decimal strings, to an IANA zone name such as {@code Asia/Shanghai}.
 */
public interface TimezoneResolver {

    Mono<String> resolveTimezone(String latitude, String longitude);
}

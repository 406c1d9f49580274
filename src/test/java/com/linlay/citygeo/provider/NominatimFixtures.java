package com.linlay.citygeo.provider;

public final class NominatimFixtures {

    private NominatimFixtures() {
    }

    public static NominatimPlace place(long placeId, String lat, String lon, String name, NominatimAddress address) {
        return new NominatimPlace(placeId, lat, lon, name, "", "place", "city", 0.5, "city", address);
    }

    public static NominatimPlace place(long placeId, String name, String state, String country) {
        return place(placeId, "31.2304", "121.4737", name, address(null, state, null, country));
    }

    public static NominatimAddress address(String city, String state, String province, String country) {
        return new NominatimAddress(city, null, null, null, state, province, country, null);
    }

    public static NominatimAddress emptyAddress() {
        return new NominatimAddress(null, null, null, null, null, null, null, null);
    }
}

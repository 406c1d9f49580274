package com.linlay.citygeo.service;

public class CityNotFoundException extends RuntimeException {

    private final String query;

    public CityNotFoundException(String query) {
        super("city not found");
        this.query = query;
    }

    public String getQuery() {
        return query;
    }
}

package com.linlay.citygeo.service;

public class CityQueryException extends IllegalArgumentException {

    public CityQueryException(String message) {
        super(message);
    }
}

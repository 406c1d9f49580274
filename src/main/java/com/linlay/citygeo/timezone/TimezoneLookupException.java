package com.linlay.citygeo.timezone;

public class TimezoneLookupException extends RuntimeException {

    public TimezoneLookupException(String message) {
        super(message);
    }

    public TimezoneLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}

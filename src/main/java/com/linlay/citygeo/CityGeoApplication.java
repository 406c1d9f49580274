package com.linlay.citygeo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CityGeoApplication {

    public static void main(String[] args) {
        SpringApplication.run(CityGeoApplication.class, args);
    }
}

package com.wheelseye.respserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * RESP server entry point.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RespServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RespServerApplication.class, args);
    }
}

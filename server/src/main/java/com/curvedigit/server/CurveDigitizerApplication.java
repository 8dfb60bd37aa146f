package com.curvedigit.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CurveDigitizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CurveDigitizerApplication.class, args);
    }
}

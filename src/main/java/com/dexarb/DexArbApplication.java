package com.dexarb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class DexArbApplication {

    public static void main(String[] args) {
        System.setProperty("java.net.preferIPv4Stack", "true"); // Often helpful for OkHttp
        SpringApplication.run(DexArbApplication.class, args);
    }

}

package com.polygonmev.arb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MevArbApplication {

    public static void main(String[] args) {
        System.setProperty("java.net.preferIPv4Stack", "true"); // Often helpful for OkHttp
        SpringApplication.run(MevArbApplication.class, args);
    }

}

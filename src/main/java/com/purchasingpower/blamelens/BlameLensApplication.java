package com.purchasingpower.blamelens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableAsync
@EnableScheduling
public class BlameLensApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlameLensApplication.class, args);
    }
}

package com.watchtide;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class WatchtideApplication {

    public static void main(String[] args) {
        SpringApplication.run(WatchtideApplication.class, args);
    }
}

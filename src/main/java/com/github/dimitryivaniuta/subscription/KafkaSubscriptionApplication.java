package com.github.dimitryivaniuta.subscription;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KafkaSubscriptionApplication {

    public static void main(String[] args) {
        SpringApplication.run(KafkaSubscriptionApplication.class, args);
    }
}

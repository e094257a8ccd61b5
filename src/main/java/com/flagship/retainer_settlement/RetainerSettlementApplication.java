package com.flagship.retainer_settlement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RetainerSettlementApplication {

    public static void main(String[] args) {
        SpringApplication.run(RetainerSettlementApplication.class, args);
    }
}

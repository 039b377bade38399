package com.barthel.tradeshift;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TradeshiftApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeshiftApplication.class, args);
    }
}

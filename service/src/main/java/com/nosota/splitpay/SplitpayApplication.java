package com.nosota.splitpay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SplitpayApplication {
    public static void main(String[] args) {
        SpringApplication.run(SplitpayApplication.class, args);
    }
}

package com.nosota.assetpay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AssetpayApplication {
    public static void main(String[] args) {
        SpringApplication.run(AssetpayApplication.class, args);
    }
}

package com.ureca.campaign;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CampaignSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(CampaignSyncApplication.class, args);
    }
}

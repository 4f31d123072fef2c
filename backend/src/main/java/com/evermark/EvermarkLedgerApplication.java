package com.evermark;

import com.evermark.ingestion.config.LedgerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(LedgerProperties.class)
public class EvermarkLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(EvermarkLedgerApplication.class, args);
    }
}

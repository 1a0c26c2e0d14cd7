package com.nosota.bounty;

import com.nosota.bounty.config.BountyProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(BountyProperties.class)
public class BountyApplication {
    public static void main(String[] args) {
        SpringApplication.run(BountyApplication.class, args);
    }
}

package com.premiergroup.ad_optimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableJpaRepositories
@EnableScheduling
public class AdOptimizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdOptimizerApplication.class, args);
    }
}

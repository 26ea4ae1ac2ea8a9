package com.eduhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * EduHub tenancy service: tenant directory, request resolution, isolated
 * record storage and plan quotas for institutions sharing one deployment.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@EnableScheduling
public class EduHubApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(EduHubApplication.class, args);
    }
}

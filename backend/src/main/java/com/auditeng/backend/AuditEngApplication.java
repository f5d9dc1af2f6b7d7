package com.auditeng.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AuditEngApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuditEngApplication.class, args);
    }
}

package com.elssolution.greenguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class GreenGuardAuditApplication {

    public static void main(String[] args) {
        SpringApplication.run(GreenGuardAuditApplication.class, args);
    }

}

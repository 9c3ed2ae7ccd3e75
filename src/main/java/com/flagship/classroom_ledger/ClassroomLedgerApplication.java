package com.flagship.classroom_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ClassroomLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClassroomLedgerApplication.class, args);
    }
}

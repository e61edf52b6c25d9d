package com.malwa.record_store;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RecordStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecordStoreApplication.class, args);
    }
}

package com.yizhaoqi.kb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KbIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(KbIngestApplication.class, args);
    }
}

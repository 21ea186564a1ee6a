package com.example.bullets;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication
public class BulletProcessorApplication {

    public static void main(String[] args) {
        SpringApplication.run(BulletProcessorApplication.class, args);
        log.info("Bullet processor started");
    }
}

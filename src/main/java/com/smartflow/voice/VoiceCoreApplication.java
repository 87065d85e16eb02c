package com.smartflow.voice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * SmartFlow voice core: resilient real-time inference orchestration behind every caller turn.
 */
@SpringBootApplication
@EnableScheduling
public class VoiceCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceCoreApplication.class, args);
    }
}

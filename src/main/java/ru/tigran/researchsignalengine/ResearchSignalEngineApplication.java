package ru.tigran.researchsignalengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ResearchSignalEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResearchSignalEngineApplication.class, args);
    }
}

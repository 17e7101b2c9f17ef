package com.numbersgame.puzzleserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NumbersPuzzleApplication {

    private static final Logger log = LoggerFactory.getLogger(NumbersPuzzleApplication.class);

    public static void main(String[] args) {
        log.info("Starting Numbers Puzzle server...");
        SpringApplication.run(NumbersPuzzleApplication.class, args);
        log.info("Application startup completed");
    }
}

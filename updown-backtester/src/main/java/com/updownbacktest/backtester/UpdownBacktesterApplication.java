package com.updownbacktest.backtester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the up/down market backtester service.
 */
@SpringBootApplication
public class UpdownBacktesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(UpdownBacktesterApplication.class, args);
    }

}

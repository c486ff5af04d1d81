package com.ivamare.callsession;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Call session management service.
 */
@SpringBootApplication
public class CallSessionApplication {

    public static void main(String[] args) {
        SpringApplication.run(CallSessionApplication.class, args);
    }
}

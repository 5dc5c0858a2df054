package com.replyline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for Replyline - agent response cache, priority dispatch and token streaming.
 */
@SpringBootApplication
@EnableScheduling
public class ReplylineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReplylineApplication.class, args);
    }
}

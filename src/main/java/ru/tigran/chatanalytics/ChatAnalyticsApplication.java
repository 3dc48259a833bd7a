package ru.tigran.chatanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatAnalyticsApplication.class, args);
    }
}

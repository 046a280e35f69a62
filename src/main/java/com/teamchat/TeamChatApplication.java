package com.teamchat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TeamChatApplication {
    public static void main(String[] args) {
        SpringApplication.run(TeamChatApplication.class, args);
    }
}

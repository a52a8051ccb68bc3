package org.example.playerapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PlayerApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlayerApiApplication.class, args);
    }
}

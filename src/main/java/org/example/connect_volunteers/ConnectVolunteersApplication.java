package org.example.connect_volunteers;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ConnectVolunteersApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConnectVolunteersApplication.class, args);
    }
}

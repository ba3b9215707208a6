package com.example.shortsbot_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class ShortsbotBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(ShortsbotBackendApplication.class, args);
	}

}

package com.example.rooms;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RoomAvailabilityApplication {

	public static void main(String[] args) {
		SpringApplication.run(RoomAvailabilityApplication.class, args);
	}

}

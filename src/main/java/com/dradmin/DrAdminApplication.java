package com.dradmin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DrAdminApplication {

	public static void main(String[] args) {
		SpringApplication.run(DrAdminApplication.class, args);
	}

}

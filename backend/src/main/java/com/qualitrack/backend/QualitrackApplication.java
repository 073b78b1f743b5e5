package com.qualitrack.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QualitrackApplication {

	public static void main(String[] args) {
		// grant expiry and audit timestamps are compared in UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(QualitrackApplication.class, args);
	}

}

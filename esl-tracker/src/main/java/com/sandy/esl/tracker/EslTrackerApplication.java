package com.sandy.esl.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EslTrackerApplication {

	public static void main(String[] args) {
		SpringApplication.run(EslTrackerApplication.class, args);
	}

}

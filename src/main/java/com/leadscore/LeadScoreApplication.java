package com.leadscore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LeadScoreApplication {

	public static void main(String[] args) {
		SpringApplication.run(LeadScoreApplication.class, args);
	}

}

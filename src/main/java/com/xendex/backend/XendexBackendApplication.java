package com.xendex.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class XendexBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(XendexBackendApplication.class, args);
	}
}

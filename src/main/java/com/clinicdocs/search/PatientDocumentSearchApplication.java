package com.clinicdocs.search;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

@EnableRetry
@SpringBootApplication
@ConfigurationPropertiesScan
public class PatientDocumentSearchApplication {

	public static void main(String[] args) {
		SpringApplication.run(PatientDocumentSearchApplication.class, args);
	}
}

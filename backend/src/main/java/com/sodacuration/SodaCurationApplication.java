package com.sodacuration;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SODA curation - bounded-context model execution and output verification for manuscript curation.
 */
@SpringBootApplication
public class SodaCurationApplication {

	public static void main(String[] args) {
		SpringApplication.run(SodaCurationApplication.class, args);
	}

}

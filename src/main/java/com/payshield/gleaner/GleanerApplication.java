package com.payshield.gleaner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.payshield.gleaner")
@EnableJpaRepositories(basePackages = "com.payshield.gleaner.infrastructure.jpa")
@EntityScan(basePackages = "com.payshield.gleaner.infrastructure.jpa")
public class GleanerApplication {
	public static void main(String[] args) {
		SpringApplication.run(GleanerApplication.class, args);
	}
}

package com.social.violation.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.social.violation")
public class ViolationPipelineApplication {

	public static void main(String[] args) {
		SpringApplication.run(ViolationPipelineApplication.class, args);
	}
}

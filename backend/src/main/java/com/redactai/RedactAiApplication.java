package com.redactai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * RedactAi - multi-pass PII detection and redaction service.
 */
@SpringBootApplication
public class RedactAiApplication {

	public static void main(String[] args) {
		SpringApplication.run(RedactAiApplication.class, args);
	}

}

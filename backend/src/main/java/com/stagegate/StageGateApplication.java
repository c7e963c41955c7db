package com.stagegate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * StageGate - evidence-led validation gates and onboarding stage progression.
 */
@SpringBootApplication
public class StageGateApplication {

	public static void main(String[] args) {
		SpringApplication.run(StageGateApplication.class, args);
	}

}

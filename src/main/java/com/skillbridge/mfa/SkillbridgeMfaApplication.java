package com.skillbridge.mfa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.skillbridge.mfa")
@EnableJpaRepositories(basePackages = "com.skillbridge.mfa.infrastructure.jpa")
@EntityScan(basePackages = "com.skillbridge.mfa.infrastructure.jpa")
public class SkillbridgeMfaApplication {
	public static void main(String[] args) {
		SpringApplication.run(SkillbridgeMfaApplication.class, args);
	}
}

package com.project.normalizer.schema_normalizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@EnableJpaRepositories("com.project.normalizer.schema_normalizer.repository")
@SpringBootApplication
public class SchemaNormalizerApplication {

	public static void main(String[] args) {
		SpringApplication.run(SchemaNormalizerApplication.class, args);
	}

}

package com.di.migrationplanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MigrationPlannerApplication {

	public static void main(String[] args) {
		SpringApplication.run(MigrationPlannerApplication.class, args);
	}

}

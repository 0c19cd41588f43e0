package com.schoolmate.backend;

import java.time.ZoneOffset;
import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * School administration back end: tenant resolution, staff permissions and approval of sensitive
 * school profile changes.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SchoolmateApplication {

	public static void main(String[] args) {
		TimeZone.setDefault(TimeZone.getTimeZone(ZoneOffset.UTC));
		SpringApplication.run(SchoolmateApplication.class, args);
	}
}

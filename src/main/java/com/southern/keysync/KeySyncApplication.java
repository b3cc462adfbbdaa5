package com.southern.keysync;


import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;


@SpringBootApplication
@ConfigurationPropertiesScan
public class KeySyncApplication {

	public static void main(String[] args) {
		SpringApplication.run(KeySyncApplication.class, args);
	}

}

package com.maslen.favsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FavSyncApplication {

	public static void main(String[] args) {
		SpringApplication.run(FavSyncApplication.class, args);
	}

}

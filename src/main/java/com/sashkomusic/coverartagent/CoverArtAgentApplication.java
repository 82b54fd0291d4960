package com.sashkomusic.coverartagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CoverArtAgentApplication {

	public static void main(String[] args) {
		SpringApplication.run(CoverArtAgentApplication.class, args);
	}

}

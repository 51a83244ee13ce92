package com.peerdrop;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling // closed-session sweep and relay stats
public class PeerDropApplication {

	public static void main(String[] args) {
		SpringApplication.run(PeerDropApplication.class, args);
	}

}

package com.example.media_registry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MediaRegistryApplication {

	public static void main(String[] args) {
		SpringApplication.run(MediaRegistryApplication.class, args);
	}

}

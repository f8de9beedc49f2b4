package com.example.framegen_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FramegenBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(FramegenBackendApplication.class, args);
	}

}

package com.example.downloadgateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DownloadGatewayApplication {

	public static void main(String[] args) {
		SpringApplication.run(DownloadGatewayApplication.class, args);
	}

}

package com.example.drivetransfer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DriveTransferApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(DriveTransferApplication.class, args)));
	}

}

package com.tony.npbStats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NpbStatsApplication {

	public static void main(String[] args) {
		SpringApplication.run(NpbStatsApplication.class, args);
	}

}

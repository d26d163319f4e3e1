package com.hal9001.backend;

import com.hal9001.backend.global.common.time.TimeConfig;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Hal9001Application {

	public static void main(String[] args) {
		TimeConfig.applyDefaultZone();
		SpringApplication.run(Hal9001Application.class, args);
	}

}

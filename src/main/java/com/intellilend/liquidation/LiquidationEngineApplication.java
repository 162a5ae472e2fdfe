package com.intellilend.liquidation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class LiquidationEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(LiquidationEngineApplication.class, args);
	}

}

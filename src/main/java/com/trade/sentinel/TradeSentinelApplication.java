package com.trade.sentinel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class TradeSentinelApplication {

	public static void main(String[] args) {
		SpringApplication.run(TradeSentinelApplication.class, args);
	}

}

package com.al.pricetransparency;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class PriceTransparencyApplication {

	public static void main(String[] args) {
		SpringApplication.run(PriceTransparencyApplication.class, args);
	}

}

package com.loanauction;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@EnableAsync
@SpringBootApplication
public class LoanAuctionApplication {

	public static void main(String[] args) {
		SpringApplication.run(LoanAuctionApplication.class, args);
	}

}

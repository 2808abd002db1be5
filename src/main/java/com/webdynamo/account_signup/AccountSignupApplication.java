package com.webdynamo.account_signup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AccountSignupApplication {

	public static void main(String[] args) {
		SpringApplication.run(AccountSignupApplication.class, args);
	}

}

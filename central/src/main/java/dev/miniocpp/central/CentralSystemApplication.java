package dev.miniocpp.central;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the central system Spring Boot application.
 */
@SpringBootApplication
public class CentralSystemApplication {

	/**
	 * Bootstrap the Spring Boot application.
	 * @param args application arguments passed from the command line
	 */
	public static void main(String[] args) {
		SpringApplication.run(CentralSystemApplication.class, args);
	}

}

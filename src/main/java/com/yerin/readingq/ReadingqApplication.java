package com.yerin.readingq;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReadingqApplication {

	public static void main(String[] args) {
		SpringApplication.run(ReadingqApplication.class, args);
	}

}

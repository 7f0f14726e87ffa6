package com.flamingo.ai.redline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the redline document service. */
@SpringBootApplication
public class RedlineApplication {

  public static void main(String[] args) {
    SpringApplication.run(RedlineApplication.class, args);
  }
}

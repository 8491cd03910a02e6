package com.scholary.podfeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PodfeedApplication {

  public static void main(String[] args) {
    SpringApplication.run(PodfeedApplication.class, args);
  }
}

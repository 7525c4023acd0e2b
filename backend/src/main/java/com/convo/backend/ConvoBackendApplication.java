package com.convo.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ConvoBackendApplication {

  public static void main(String[] args) {
    SpringApplication.run(ConvoBackendApplication.class, args);
  }
}

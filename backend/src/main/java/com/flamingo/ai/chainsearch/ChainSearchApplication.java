package com.flamingo.ai.chainsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the chain search backend. */
@SpringBootApplication
public class ChainSearchApplication {

  public static void main(String[] args) {
    SpringApplication.run(ChainSearchApplication.class, args);
  }
}

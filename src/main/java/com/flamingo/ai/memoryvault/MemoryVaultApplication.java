package com.flamingo.ai.memoryvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Memory vault service entry point. */
@SpringBootApplication
public class MemoryVaultApplication {

  public static void main(String[] args) {
    SpringApplication.run(MemoryVaultApplication.class, args);
  }
}

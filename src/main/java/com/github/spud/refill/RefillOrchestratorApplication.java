package com.github.spud.refill;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class RefillOrchestratorApplication {

  public static void main(String[] args) {
    SpringApplication.run(RefillOrchestratorApplication.class, args);
  }

}

package com.flamingo.ai.flowbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the flowbridge conversion backend. */
@SpringBootApplication
public class FlowbridgeApplication {

  public static void main(String[] args) {
    SpringApplication.run(FlowbridgeApplication.class, args);
  }
}

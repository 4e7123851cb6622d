package com.gtmalpha.research;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ResearchOrchestratorApplication {

  public static void main(String[] args) {
    SpringApplication.run(ResearchOrchestratorApplication.class, args);
  }
}

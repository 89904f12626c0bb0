package com.delta.domaincheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DomainCheckApplication {

  public static void main(String[] args) {
    SpringApplication.run(DomainCheckApplication.class, args);
  }
}

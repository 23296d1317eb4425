package com.delta.jobimporter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobImporterApplication {

  public static void main(String[] args) {
    SpringApplication.run(JobImporterApplication.class, args);
  }
}

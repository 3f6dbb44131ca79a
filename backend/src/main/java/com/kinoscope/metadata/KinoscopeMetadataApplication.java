package com.kinoscope.metadata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class KinoscopeMetadataApplication {

  public static void main(String[] args) {
    SpringApplication.run(KinoscopeMetadataApplication.class, args);
  }
}

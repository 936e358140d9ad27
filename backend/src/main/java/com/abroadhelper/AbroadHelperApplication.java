package com.abroadhelper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AbroadHelperApplication {

  public static void main(String[] args) {
    SpringApplication.run(AbroadHelperApplication.class, args);
  }
}

package com.tarantula;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TarantulaApplication {

  public static void main(String[] args) {
    SpringApplication.run(TarantulaApplication.class, args);
  }
}

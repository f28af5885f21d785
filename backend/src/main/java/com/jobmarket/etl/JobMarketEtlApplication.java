package com.jobmarket.etl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobMarketEtlApplication {

  public static void main(String[] args) {
    SpringApplication.run(JobMarketEtlApplication.class, args);
  }
}

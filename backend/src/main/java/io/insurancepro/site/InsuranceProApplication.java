package io.insurancepro.site;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InsuranceProApplication {

  public static void main(String[] args) {
    SpringApplication.run(InsuranceProApplication.class, args);
  }
}

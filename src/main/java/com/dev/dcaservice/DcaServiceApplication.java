package com.dev.dcaservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * This class contains the startup of the application.
 */
@SpringBootApplication
public class DcaServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(DcaServiceApplication.class, args);
  }

}

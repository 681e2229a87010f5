package io.b2mash.workhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkhubApplication {

  public static void main(String[] args) {
    SpringApplication.run(WorkhubApplication.class, args);
  }
}

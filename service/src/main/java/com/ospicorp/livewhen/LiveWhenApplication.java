package com.ospicorp.livewhen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LiveWhenApplication {

  public static void main(String[] args) {
    SpringApplication.run(LiveWhenApplication.class, args);
  }
}

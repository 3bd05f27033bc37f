package com.mk.fx.qa.codepage.execution;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CodepageExecutionApplication {

  public static void main(String[] args) {
    SpringApplication.run(CodepageExecutionApplication.class, args);
  }
}

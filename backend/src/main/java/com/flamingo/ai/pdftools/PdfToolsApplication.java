package com.flamingo.ai.pdftools;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the PDF tools conversion service. */
@SpringBootApplication
public class PdfToolsApplication {

  public static void main(String[] args) {
    SpringApplication.run(PdfToolsApplication.class, args);
  }
}

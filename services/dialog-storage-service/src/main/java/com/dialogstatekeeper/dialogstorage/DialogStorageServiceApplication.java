package com.dialogstatekeeper.dialogstorage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DialogStorageServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(DialogStorageServiceApplication.class, args);
  }
}

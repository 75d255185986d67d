package io.b2mash.b2b.rolepermissions;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RolePermissionsApplication {

  public static void main(String[] args) {
    SpringApplication.run(RolePermissionsApplication.class, args);
  }
}

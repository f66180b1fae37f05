package tech.yump.securebox;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.securebox.config.SecureBoxProperties;

@SpringBootApplication
@EnableConfigurationProperties(SecureBoxProperties.class)
public class SecureBoxApplication {

  public static final String VERSION = "0.1.0";

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(SecureBoxApplication.class, args)));
  }
}

package tech.yump.reconciler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.reconciler.config.ReconcilerProperties;

@SpringBootApplication
@EnableConfigurationProperties(ReconcilerProperties.class)
public class SecretReconcilerApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(SecretReconcilerApplication.class, args)));
  }
}

package tech.yump.auditstore;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;
import tech.yump.auditstore.config.AuditStoreProperties;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(AuditStoreProperties.class)
@EnableScheduling
public class LiteAuditStoreApplication {

  public static void main(String[] args) {
    SpringApplication.run(LiteAuditStoreApplication.class, args);
    log.info(">>> LiteAuditStore Application Started <<<");
  }
}

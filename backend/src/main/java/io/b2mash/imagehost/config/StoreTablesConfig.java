package io.b2mash.imagehost.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
public class StoreTablesConfig {

  @Bean(name = "storeTransactionTemplate")
  public TransactionTemplate storeTransactionTemplate(
      PlatformTransactionManager transactionManager, StoreTablesProperties properties) {
    var template = new TransactionTemplate(transactionManager);
    template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
    template.setTimeout((int) Math.max(1, properties.transactionTimeout().toSeconds()));
    return template;
  }
}

package io.shiftmate.backend.config;

import io.shiftmate.backend.billing.BillingProperties;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties(BillingProperties.class)
public class BillingExecutorConfig {

  @Bean(name = "billingExecutor")
  ThreadPoolTaskExecutor billingExecutor(BillingProperties properties) {
    var pool = properties.executor();
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(pool.corePoolSize());
    executor.setMaxPoolSize(pool.maxPoolSize());
    executor.setQueueCapacity(pool.queueCapacity());
    executor.setThreadNamePrefix("billing-");
    // a saturated pool bills on the requesting thread instead of failing the report
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}

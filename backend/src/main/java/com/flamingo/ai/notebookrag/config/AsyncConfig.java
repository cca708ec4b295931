package com.flamingo.ai.notebookrag.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for background jobs (ingestion, notebook content, audio overview). */
@Configuration
@EnableAsync
public class AsyncConfig {

  @Bean(name = "backgroundJobExecutor")
  public ThreadPoolTaskExecutor backgroundJobExecutor(RagConfig ragConfig) {
    RagConfig.Jobs jobs = ragConfig.getJobs();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(jobs.getCorePoolSize());
    executor.setMaxPoolSize(jobs.getMaxPoolSize());
    executor.setQueueCapacity(jobs.getQueueCapacity());
    executor.setThreadNamePrefix("bg-job-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}

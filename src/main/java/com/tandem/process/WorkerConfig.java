package com.tandem.process;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WorkerConfig {

    @Bean
    @ConditionalOnMissingBean(WorkerLauncher.class)
    public WorkerLauncher commandLineWorkerLauncher(TandemProperties properties) {
        return new CommandLineWorkerLauncher(properties);
    }
}

package com.qcollector.backend.config;

import com.qcollector.backend.service.queue.MigrationJobProcessor;
import com.qcollector.backend.service.queue.MigrationJobStore;
import com.qcollector.backend.service.queue.MigrationQueue;
import jakarta.validation.Validator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class MigrationQueueConfig {

    @Bean(initMethod = "start", destroyMethod = "close")
    public MigrationQueue migrationQueue(MigrationJobStore jobStore,
                                         MigrationJobProcessor processor,
                                         Validator validator,
                                         MigrationProperties properties,
                                         Clock clock) {
        return new MigrationQueue(jobStore, processor, validator, properties, clock);
    }
}

package io.cadence4j.config;

import io.cadence4j.Scheduler;
import io.cadence4j.core.InstanceResolver;
import io.cadence4j.core.Mutex;
import io.cadence4j.internal.memory.InMemoryMutex;
import io.cadence4j.internal.memory.InMemoryScheduler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;

import java.util.stream.Collectors;

/**
 * Spring Boot auto-configuration entrypoint for the scheduler.
 */
@AutoConfiguration
@ConditionalOnClass(Scheduler.class)
@EnableConfigurationProperties(SchedulerProperties.class)
@ConditionalOnProperty(prefix = "cadence", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CadenceConfig {

    @Bean
    @ConditionalOnMissingBean
    public InstanceResolver instanceResolver(ApplicationContext applicationContext) {
        return new BeanFactoryInstanceResolver(applicationContext.getAutowireCapableBeanFactory());
    }

    @Bean
    @ConditionalOnMissingBean
    public Mutex schedulerMutex() {
        return new InMemoryMutex();
    }

    @Bean
    @ConditionalOnMissingBean
    public Scheduler scheduler(SchedulerProperties props, InstanceResolver resolver, Mutex mutex) {
        return new InMemoryScheduler(props, resolver, mutex);
    }

    @Bean
    @ConditionalOnMissingBean
    public CadenceLifecycle cadenceLifecycle(Scheduler scheduler, ObjectProvider<SchedulerConfigurer> configurers) {
        return new CadenceLifecycle(scheduler, configurers.orderedStream().collect(Collectors.toList()));
    }
}

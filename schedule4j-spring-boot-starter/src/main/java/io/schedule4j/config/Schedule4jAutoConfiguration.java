package io.schedule4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.schedule4j.JobHandler;
import io.schedule4j.ScheduledJobService;
import io.schedule4j.Scheduler;
import io.schedule4j.core.CronEvaluator;
import io.schedule4j.core.HandlerRegistry;
import io.schedule4j.core.ScheduleCalculator;
import io.schedule4j.internal.DefaultScheduledJobService;
import io.schedule4j.internal.DefaultScheduler;
import io.schedule4j.internal.PollingTickTrigger;
import io.schedule4j.internal.mongo.MongoJobStore;
import io.schedule4j.internal.mongo.MongoRunRecorder;
import io.schedule4j.spi.JobStore;
import io.schedule4j.spi.RunRecorder;
import io.schedule4j.utils.QuartzCronEvaluator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for schedule4j components.
 *
 * <p>Every {@link JobHandler} bean in the context is registered. Properties live under {@code schedule4j.*}.
 */
@AutoConfiguration
@ConditionalOnClass({Scheduler.class, MongoTemplate.class})
@ConditionalOnProperty(prefix = "schedule4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class Schedule4jAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "schedule4j")
    public SchedulerProperties schedulerProperties() {
        return new SchedulerProperties();
    }

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate) {
        return new MongoJobStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(RunRecorder.class)
    protected MongoRunRecorder mongoRunRecorder(MongoTemplate mongoTemplate) {
        return new MongoRunRecorder(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected Schedule4jMongoIndexConfig schedule4jMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new Schedule4jMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public HandlerRegistry handlerRegistry(ObjectProvider<List<JobHandler<?>>> handlersProvider) {
        List<JobHandler<?>> handlers = handlersProvider.getIfAvailable(List::of);
        return new HandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public CronEvaluator cronEvaluator(SchedulerProperties props) {
        String zone = props.getCronZone();
        return new QuartzCronEvaluator(zone == null || zone.isBlank() ? ZoneId.of("UTC") : ZoneId.of(zone));
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleCalculator scheduleCalculator(CronEvaluator cronEvaluator) {
        return new ScheduleCalculator(cronEvaluator);
    }

    @Bean
    @ConditionalOnMissingBean
    public Scheduler scheduler(SchedulerProperties props,
                               JobStore jobStore,
                               HandlerRegistry registry,
                               ScheduleCalculator calculator,
                               RunRecorder runRecorder,
                               ObjectProvider<ObjectMapper> objectMapper,
                               ObjectProvider<Clock> clock) {
        return new DefaultScheduler(
                props,
                jobStore,
                registry,
                calculator,
                runRecorder,
                objectMapper.getIfAvailable(ObjectMapper::new),
                clock.getIfAvailable(Clock::systemUTC)
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduledJobService scheduledJobService(JobStore jobStore,
                                                   ScheduleCalculator calculator,
                                                   ObjectProvider<ObjectMapper> objectMapper,
                                                   ObjectProvider<Clock> clock) {
        return new DefaultScheduledJobService(
                jobStore,
                calculator,
                objectMapper.getIfAvailable(ObjectMapper::new),
                clock.getIfAvailable(Clock::systemUTC)
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public PollingTickTrigger pollingTickTrigger(SchedulerProperties props, Scheduler scheduler) {
        return new PollingTickTrigger(props, scheduler);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerLifecycle schedulerLifecycle(PollingTickTrigger trigger) {
        return new SchedulerLifecycle(trigger);
    }

    @Bean
    @ConditionalOnProperty(prefix = "schedule4j", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton schedule4jIndexesInitializer(Schedule4jMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}

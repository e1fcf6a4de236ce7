package io.herald4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.herald4j.ContentSource;
import io.herald4j.DedupeGuard;
import io.herald4j.Herald;
import io.herald4j.JobStateMachine;
import io.herald4j.Publisher;
import io.herald4j.core.NoopDedupeGuard;
import io.herald4j.internal.mongo.MongoContentSource;
import io.herald4j.internal.mongo.MongoHerald;
import io.herald4j.internal.mongo.MongoJobStateMachine;
import io.herald4j.internal.mongo.MongoJobStore;
import io.herald4j.internal.mongo.MongoPublishedRecordStore;
import io.herald4j.internal.mongo.MongoScheduleStore;
import io.herald4j.internal.mongo.MongoSelectionHistoryStore;
import io.herald4j.internal.redis.RedissonDedupeGuard;
import io.herald4j.recurrence.CompiledRuleCache;
import io.herald4j.recurrence.RecurrenceResolver;
import org.redisson.api.RedissonClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for herald4j.
 *
 * <p>The scheduler itself is only created when the application provides a {@link Publisher}. A
 * {@link RedissonClient} bean, when present, enables the Redis dedupe guard; otherwise the unique job index alone
 * prevents duplicate jobs. The client is looked up when the guard is created rather than by a bean condition, so
 * it is found whichever auto-configuration registers it.
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration",
        "org.redisson.spring.starter.RedissonAutoConfigurationV2",
        "org.redisson.spring.starter.RedissonAutoConfiguration"
})
@ConditionalOnClass({Herald.class, MongoTemplate.class})
@EnableConfigurationProperties(HeraldProperties.class)
@ConditionalOnProperty(prefix = "herald", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HeraldConfig {
    private static final Logger log = LoggerFactory.getLogger(HeraldConfig.class);

    @Bean
    @ConditionalOnMissingBean(name = "heraldClock")
    public Clock heraldClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    protected MongoScheduleStore mongoScheduleStore(MongoTemplate mongoTemplate) {
        return new MongoScheduleStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate) {
        return new MongoJobStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected MongoSelectionHistoryStore mongoSelectionHistoryStore(MongoTemplate mongoTemplate) {
        return new MongoSelectionHistoryStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected MongoPublishedRecordStore mongoPublishedRecordStore(MongoTemplate mongoTemplate) {
        return new MongoPublishedRecordStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobStateMachine jobStateMachine(MongoTemplate mongoTemplate, @Qualifier("heraldClock") Clock clock) {
        return new MongoJobStateMachine(mongoTemplate, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ContentSource contentSource(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoContentSource(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public RecurrenceResolver recurrenceResolver(HeraldProperties props) {
        return new RecurrenceResolver(new CompiledRuleCache(props.getRuleCacheSize()));
    }

    @Bean
    @ConditionalOnMissingBean
    protected HeraldMongoIndexConfig heraldMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new HeraldMongoIndexConfig(mongoTemplate);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.redisson.api.RedissonClient")
    static class RedissonDedupeConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public DedupeGuard redissonDedupeGuard(ObjectProvider<RedissonClient> redissonClient, HeraldProperties props) {
            RedissonClient client = redissonClient.getIfUnique();
            if (client == null) {
                log.info("Herald dedupe guard disabled: no unique RedissonClient bean");
                return NoopDedupeGuard.INSTANCE;
            }
            return new RedissonDedupeGuard(client, props.getDedupeLockTtl(),
                    MongoHerald.resolveWorkerId(props.getWorkerId()));
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public DedupeGuard dedupeGuard() {
        return NoopDedupeGuard.INSTANCE;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(Publisher.class)
    public Herald herald(HeraldProperties props,
                         MongoScheduleStore scheduleStore,
                         MongoJobStore jobStore,
                         MongoSelectionHistoryStore historyStore,
                         MongoPublishedRecordStore publishedStore,
                         JobStateMachine stateMachine,
                         ContentSource contentSource,
                         Publisher publisher,
                         DedupeGuard dedupeGuard,
                         RecurrenceResolver resolver,
                         @Qualifier("heraldClock") Clock clock) {
        return new MongoHerald(props, scheduleStore, jobStore, historyStore, publishedStore, stateMachine,
                contentSource, publisher, dedupeGuard, resolver, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(Herald.class)
    public HeraldLifecycle heraldLifecycle(Herald herald, HeraldProperties props) {
        return new HeraldLifecycle(herald, props);
    }

    @Bean
    @ConditionalOnProperty(prefix = "herald", name = "ensure-indexes-on-startup", havingValue = "true", matchIfMissing = true)
    public SmartInitializingSingleton heraldIndexesInitializer(HeraldMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}

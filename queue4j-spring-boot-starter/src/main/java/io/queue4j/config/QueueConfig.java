package io.queue4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.queue4j.JobQueue;
import io.queue4j.cli.QueueCommandLine;
import io.queue4j.exec.CommandExecutor;
import io.queue4j.exec.ShellCommandExecutor;
import io.queue4j.internal.mongo.MongoConfigStore;
import io.queue4j.internal.mongo.MongoJobMetrics;
import io.queue4j.internal.mongo.MongoJobQueue;
import io.queue4j.internal.mongo.MongoJobStore;
import io.queue4j.worker.ShutdownSignal;
import io.queue4j.worker.StopFileShutdownSignal;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.nio.file.Path;

/**
 * Spring Boot auto-configuration entrypoint for queue components.
 */
@AutoConfiguration
@ConditionalOnClass({JobQueue.class, MongoTemplate.class})
@EnableConfigurationProperties(QueueProperties.class)
@ConditionalOnProperty(prefix = "queue4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class QueueConfig {

    @Bean
    @ConditionalOnMissingBean
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate) {
        return new MongoJobStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected MongoConfigStore mongoConfigStore(MongoTemplate mongoTemplate) {
        return new MongoConfigStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected MongoJobMetrics mongoJobMetrics(MongoTemplate mongoTemplate) {
        return new MongoJobMetrics(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected QueueMongoIndexConfig queueMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new QueueMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandExecutor commandExecutor() {
        return new ShellCommandExecutor();
    }

    @Bean
    @ConditionalOnMissingBean
    public ShutdownSignal shutdownSignal(QueueProperties props) {
        return new StopFileShutdownSignal(Path.of(props.getStopFile()));
    }

    @Bean
    @ConditionalOnMissingBean
    public JobQueue jobQueue(QueueProperties props,
                             MongoJobStore jobStore,
                             MongoConfigStore configStore,
                             MongoJobMetrics metrics,
                             CommandExecutor executor,
                             ShutdownSignal signal) {
        return new MongoJobQueue(props, jobStore, configStore, metrics, executor, signal);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "queue4j", name = "auto-start", havingValue = "true")
    public QueueLifecycle queueLifecycle(JobQueue queue, QueueProperties props) {
        return new QueueLifecycle(queue, props.getWorkerCount());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "queue4j.cli", name = "enabled", havingValue = "true")
    public QueueCommandLine queueCommandLine(JobQueue queue, QueueProperties props, ObjectProvider<ObjectMapper> objectMapper) {
        return new QueueCommandLine(queue, objectMapper.getIfAvailable(ObjectMapper::new), props.getWorkerCount());
    }

    @Bean
    @ConditionalOnProperty(prefix = "queue4j", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton queueIndexesInitializer(QueueMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}

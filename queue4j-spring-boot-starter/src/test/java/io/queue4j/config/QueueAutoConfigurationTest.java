package io.queue4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.queue4j.JobQueue;
import io.queue4j.cli.QueueCommandLine;
import io.queue4j.exec.CommandExecutor;
import io.queue4j.exec.ShellCommandExecutor;
import io.queue4j.worker.ShutdownSignal;
import io.queue4j.worker.StopFileShutdownSignal;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class QueueAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(QueueConfig.class))
            .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withPropertyValues(
                    "queue4j.worker-id=test-worker",
                    "queue4j.poll-interval=250ms",
                    "queue4j.default-backoff-base=3",
                    "queue4j.stop-file=build/test.stop"
            );

    @Test
    void shouldAutoConfigureQueueBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(JobQueue.class);
            assertThat(context).hasSingleBean(QueueProperties.class);
            assertThat(context).hasSingleBean(QueueMongoIndexConfig.class);
            assertThat(context).getBean(CommandExecutor.class).isInstanceOf(ShellCommandExecutor.class);
            assertThat(context).doesNotHaveBean(QueueLifecycle.class);
            assertThat(context).doesNotHaveBean(QueueCommandLine.class);
        });
    }

    @Test
    void shouldBindProperties() {
        contextRunner.run(context -> {
            QueueProperties props = context.getBean(QueueProperties.class);
            assertThat(props.getWorkerId()).isEqualTo("test-worker");
            assertThat(props.getPollInterval()).isEqualTo(Duration.ofMillis(250));
            assertThat(props.getDefaultBackoffBase()).isEqualTo(3.0);
            assertThat(props.getDefaultMaxRetries()).isEqualTo(3);

            ShutdownSignal signal = context.getBean(ShutdownSignal.class);
            assertThat(signal).isInstanceOf(StopFileShutdownSignal.class);
            assertThat(((StopFileShutdownSignal) signal).getStopFile()).isEqualTo(Path.of("build/test.stop"));
        });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("queue4j.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(JobQueue.class));
    }

    @Test
    void shouldRegisterCommandLineWhenEnabled() {
        contextRunner
                .withPropertyValues("queue4j.cli.enabled=true")
                .run(context -> assertThat(context).hasSingleBean(QueueCommandLine.class));
    }

    @Test
    void autoStartShouldStartWorkersWithConfiguredCount() {
        JobQueue queue = mock(JobQueue.class);
        contextRunner
                .withBean(JobQueue.class, () -> queue)
                .withPropertyValues("queue4j.auto-start=true", "queue4j.worker-count=2")
                .run(context -> {
                    assertThat(context).hasSingleBean(QueueLifecycle.class);
                    assertThat(context.getBean(QueueLifecycle.class).isRunning()).isTrue();
                    verify(queue).startWorkers(2);
                });
    }
}

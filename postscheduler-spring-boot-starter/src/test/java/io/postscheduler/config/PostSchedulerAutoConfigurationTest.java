package io.postscheduler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.postscheduler.ExecutionAgent;
import io.postscheduler.PostScheduler;
import io.postscheduler.agent.ProcessExecutionAgent;
import io.postscheduler.core.AgentResult;
import io.postscheduler.core.JobStore;
import io.postscheduler.internal.mongo.MongoJobStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class PostSchedulerAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PostSchedulerAutoConfiguration.class))
            .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withPropertyValues(
                    "postscheduler.auto-start=false",
                    "postscheduler.poll-interval=500ms",
                    "postscheduler.pause-between-jobs=0s"
            );

    @Test
    void shouldAutoConfigureSchedulerBeans() {
        contextRunner
                .withBean(ExecutionAgent.class, DemoAgent::new)
                .run(context -> {
                    assertThat(context).hasSingleBean(PostScheduler.class);
                    assertThat(context).hasSingleBean(PostSchedulerLifecycle.class);
                    assertThat(context).hasSingleBean(PostSchedulerProperties.class);
                    assertThat(context).hasSingleBean(MongoJobStore.class);
                    assertThat(context).hasSingleBean(PostSchedulerMongoIndexConfig.class);
                    assertThat(context).doesNotHaveBean(ProcessExecutionAgent.class);
                    assertThat(context.getBean(PostSchedulerLifecycle.class).isAutoStartup()).isFalse();
                });
    }

    @Test
    void shouldCreateProcessAgentWhenCommandIsConfigured() {
        contextRunner
                .withPropertyValues("postscheduler.agent.command=python3,bot.py")
                .run(context -> {
                    assertThat(context).hasSingleBean(ProcessExecutionAgent.class);
                    assertThat(context).hasSingleBean(PostScheduler.class);
                });
    }

    @Test
    void userAgentShouldWinOverProcessAgent() {
        contextRunner
                .withBean(ExecutionAgent.class, DemoAgent::new)
                .withPropertyValues("postscheduler.agent.command=python3,bot.py")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(ProcessExecutionAgent.class);
                    assertThat(context).hasSingleBean(ExecutionAgent.class);
                });
    }

    @Test
    void shouldFailFastWithoutAnAgent() {
        contextRunner.run(context -> {
            assertThat(context).hasFailed();
            assertThat(context.getStartupFailure()).rootCause()
                    .hasMessageContaining("No ExecutionAgent available");
        });
    }

    @Test
    void shouldRejectStaleThresholdShorterThanAgentTimeout() {
        contextRunner
                .withBean(ExecutionAgent.class, DemoAgent::new)
                .withPropertyValues("postscheduler.agent-timeout=20m")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void customJobStoreShouldReplaceMongoStore() {
        contextRunner
                .withBean(ExecutionAgent.class, DemoAgent::new)
                .withBean(JobStore.class, () -> mock(JobStore.class))
                .run(context -> {
                    assertThat(context).hasSingleBean(JobStore.class);
                    assertThat(context).doesNotHaveBean(MongoJobStore.class);
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("postscheduler.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(PostScheduler.class));
    }

    static class DemoAgent implements ExecutionAgent {
        @Override
        public AgentResult execute(io.postscheduler.core.AgentRequest request) {
            // no-op for context bootstrap test
            return AgentResult.succeeded();
        }
    }
}

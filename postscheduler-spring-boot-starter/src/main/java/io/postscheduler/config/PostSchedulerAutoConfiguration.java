package io.postscheduler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.postscheduler.ExecutionAgent;
import io.postscheduler.ExecutionListener;
import io.postscheduler.PostScheduler;
import io.postscheduler.agent.ProcessExecutionAgent;
import io.postscheduler.core.JobStore;
import io.postscheduler.internal.DefaultPostScheduler;
import io.postscheduler.internal.mongo.MongoJobStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the post scheduler.
 *
 * <p>An {@link ExecutionAgent} is required: either declare one as a bean, or set
 * {@code postscheduler.agent.command} to run the automation as an external process.
 */
@AutoConfiguration
@ConditionalOnClass({PostScheduler.class, MongoTemplate.class})
@EnableConfigurationProperties(PostSchedulerProperties.class)
@ConditionalOnProperty(prefix = "postscheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PostSchedulerAutoConfiguration {

    private static final Duration MAX_SHUTDOWN_WAIT = Duration.ofSeconds(30);

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate) {
        return new MongoJobStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected PostSchedulerMongoIndexConfig postSchedulerMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new PostSchedulerMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(ExecutionAgent.class)
    @Conditional(AgentCommandCondition.class)
    public ProcessExecutionAgent processExecutionAgent(PostSchedulerProperties props,
                                                       ObjectProvider<ObjectMapper> objectMapper) {
        PostSchedulerProperties.Agent agent = props.getAgent();
        return new ProcessExecutionAgent(agent.getCommand(), agent.getWorkingDirectory(),
                objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public PostScheduler postScheduler(PostSchedulerProperties props,
                                       JobStore jobStore,
                                       ObjectProvider<ExecutionAgent> agentProvider,
                                       ObjectProvider<ExecutionListener> listenersProvider) {
        ExecutionAgent agent = agentProvider.getIfAvailable();
        if (agent == null) {
            throw new IllegalStateException(
                    "No ExecutionAgent available: declare an ExecutionAgent bean or set postscheduler.agent.command");
        }
        List<ExecutionListener> listeners = listenersProvider.orderedStream().toList();
        return new DefaultPostScheduler(props.toOptions(), jobStore, agent, listeners, Clock.systemDefaultZone());
    }

    @Bean
    @ConditionalOnMissingBean
    public PostSchedulerLifecycle postSchedulerLifecycle(PostScheduler postScheduler, PostSchedulerProperties props) {
        Duration wait = props.getAgentTimeout().compareTo(MAX_SHUTDOWN_WAIT) < 0
                ? props.getAgentTimeout()
                : MAX_SHUTDOWN_WAIT;
        return new PostSchedulerLifecycle(postScheduler, props.isAutoStart(), wait);
    }

    @Bean
    @ConditionalOnProperty(prefix = "postscheduler", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton postSchedulerIndexesInitializer(PostSchedulerMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }

    /**
     * Matches when {@code postscheduler.agent.command} binds to a non-empty list, written either
     * as a comma separated value or as indexed entries.
     */
    static class AgentCommandCondition extends SpringBootCondition {
        @Override
        public ConditionOutcome getMatchOutcome(ConditionContext context, AnnotatedTypeMetadata metadata) {
            boolean configured = Binder.get(context.getEnvironment())
                    .bind("postscheduler.agent.command", Bindable.listOf(String.class))
                    .map(command -> !command.isEmpty())
                    .orElse(false);
            return configured
                    ? ConditionOutcome.match("postscheduler.agent.command is set")
                    : ConditionOutcome.noMatch("postscheduler.agent.command is not set");
        }
    }
}

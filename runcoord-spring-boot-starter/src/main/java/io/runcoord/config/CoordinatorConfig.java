package io.runcoord.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.runcoord.Coordinator;
import io.runcoord.CredentialProvider;
import io.runcoord.ExecutionApi;
import io.runcoord.FailureNotifier;
import io.runcoord.RunHistory;
import io.runcoord.ScheduleStore;
import io.runcoord.TokenRefresher;
import io.runcoord.TokenSource;
import io.runcoord.core.CoordinatorSettings;
import io.runcoord.internal.ExecutionRequestFactory;
import io.runcoord.internal.ExpiryAwareCredentialProvider;
import io.runcoord.internal.ManualRunTrigger;
import io.runcoord.internal.RetryController;
import io.runcoord.internal.ScheduleCoordinator;
import io.runcoord.internal.mongo.MongoRunHistory;
import io.runcoord.internal.mongo.MongoScheduleStore;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for the schedule coordinator.
 *
 * <p>The application supplies an {@link ExecutionApi} and either a {@link CredentialProvider} or a
 * {@link TokenSource} plus {@link TokenRefresher} pair; the store, history and runtime are wired here.
 */
@AutoConfiguration
@ConditionalOnClass({Coordinator.class, MongoTemplate.class})
@EnableConfigurationProperties(CoordinatorProperties.class)
@ConditionalOnProperty(prefix = "runcoord", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CoordinatorConfig {

    @Bean
    @ConditionalOnMissingBean
    public CoordinatorSettings coordinatorSettings(CoordinatorProperties props) {
        return props.toSettings(ScheduleCoordinator.resolveWorkerId(props.getWorkerId()));
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock coordinatorClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(ScheduleStore.class)
    public MongoScheduleStore mongoScheduleStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, CoordinatorSettings settings) {
        return new MongoScheduleStore(mongoTemplate, objectMapper, settings.workerId());
    }

    @Bean
    @ConditionalOnMissingBean(RunHistory.class)
    public MongoRunHistory mongoRunHistory(MongoTemplate mongoTemplate) {
        return new MongoRunHistory(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected CoordinatorMongoIndexConfig coordinatorMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new CoordinatorMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public FailureNotifier failureNotifier() {
        return FailureNotifier.logging();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionRequestFactory executionRequestFactory() {
        return new ExecutionRequestFactory();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryController retryController() {
        return new RetryController();
    }

    @Bean
    @ConditionalOnMissingBean(CredentialProvider.class)
    @ConditionalOnBean({TokenSource.class, TokenRefresher.class})
    public ExpiryAwareCredentialProvider expiryAwareCredentialProvider(
            TokenSource tokenSource,
            TokenRefresher tokenRefresher,
            CoordinatorProperties props,
            Clock clock
    ) {
        return new ExpiryAwareCredentialProvider(tokenSource, tokenRefresher, props.getTokenRefreshBuffer(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({ExecutionApi.class, CredentialProvider.class})
    public Coordinator coordinator(
            CoordinatorSettings settings,
            ScheduleStore store,
            RunHistory history,
            CredentialProvider credentials,
            ExecutionApi api,
            ExecutionRequestFactory requestFactory,
            RetryController retryController,
            FailureNotifier notifier,
            Clock clock
    ) {
        return new ScheduleCoordinator(settings, store, history, credentials, api, requestFactory, retryController, notifier, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({ExecutionApi.class, CredentialProvider.class})
    public ManualRunTrigger manualRunTrigger(
            ScheduleStore store,
            RunHistory history,
            CredentialProvider credentials,
            ExecutionApi api,
            ExecutionRequestFactory requestFactory,
            Clock clock
    ) {
        return new ManualRunTrigger(store, history, credentials, api, requestFactory, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(Coordinator.class)
    public CoordinatorLifecycle coordinatorLifecycle(Coordinator coordinator) {
        return new CoordinatorLifecycle(coordinator);
    }

    @Bean
    @ConditionalOnProperty(prefix = "runcoord", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton coordinatorIndexesInitializer(CoordinatorMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}

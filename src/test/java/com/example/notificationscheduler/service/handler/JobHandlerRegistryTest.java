package com.example.notificationscheduler.service.handler;

import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.service.handler.payload.JobPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JobHandlerRegistry Tests")
class JobHandlerRegistryTest {

    private JobHandlerRegistry registry;

    private final JobHandler notificationCheckHandler = stubHandler(JobType.NOTIFICATION_CHECK);

    private final JobHandler customHandler = stubHandler(JobType.CUSTOM);

    private static JobHandler stubHandler(JobType type) {
        return new JobHandler() {
            @Override
            public JobType getJobType() {
                return type;
            }

            @Override
            public JobExecutionResult execute(JobPayload payload) {
                return JobExecutionResult.success();
            }
        };
    }

    @BeforeEach
    void setUp() {
        registry = new JobHandlerRegistry(List.of(notificationCheckHandler, customHandler));
        registry.initialize();
    }

    @Test
    @DisplayName("Should register and retrieve handlers")
    void shouldRegisterAndRetrieveHandlers() {
        assertThat(registry.getHandler(JobType.NOTIFICATION_CHECK)).containsSame(notificationCheckHandler);
        assertThat(registry.getHandler(JobType.CUSTOM)).containsSame(customHandler);
    }

    @Test
    @DisplayName("Should return empty for unregistered type")
    void shouldReturnEmptyForUnregisteredType() {
        assertThat(registry.getHandler(JobType.DAILY_SUMMARY)).isEmpty();
        assertThat(registry.hasHandler(JobType.DAILY_SUMMARY)).isFalse();
    }

    @Test
    @DisplayName("Should let the last handler win for a duplicated type")
    void shouldOverrideDuplicateHandler() {
        var replacement = stubHandler(JobType.CUSTOM);
        registry = new JobHandlerRegistry(List.of(customHandler, replacement));
        registry.initialize();

        assertThat(registry.getHandler(JobType.CUSTOM)).containsSame(replacement);
    }

    @Test
    @DisplayName("Should return registered types")
    void shouldReturnRegisteredTypes() {
        assertThat(registry.getRegisteredTypes())
                .containsExactlyInAnyOrder(JobType.NOTIFICATION_CHECK, JobType.CUSTOM);
    }

    @Test
    @DisplayName("Should match only its own type")
    void shouldSupportOwnType() {
        assertThat(customHandler.supports(JobType.CUSTOM)).isTrue();
        assertThat(customHandler.supports(JobType.NOTIFICATION_CHECK)).isFalse();
    }
}

package com.github.dimitryivaniuta.subscription.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Quarantine and replay settings, bound from {@code app.dead-letter.*}.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "app.dead-letter")
public class DeadLetterProperties {

    @Min(1)
    private int maxPoisonEventsPerTopic = 1000;
    private Duration retryInterval = Duration.ofMinutes(1);
    @NotBlank
    private String inboxGroupSuffix = "-poison-inbox";
    private Duration fetchTimeout = Duration.ofSeconds(30);
    private StoreType store = StoreType.JDBC;
    private LockType lock = LockType.POSTGRES;
    private Duration lockPollInterval = Duration.ofSeconds(1);

    public enum StoreType {
        JDBC,
        IN_MEMORY
    }

    public enum LockType {
        POSTGRES,
        IN_MEMORY
    }
}

package com.github.dimitryivaniuta.subscription.config;

import com.github.dimitryivaniuta.subscription.batch.BatchHandlingStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Subscriptions, bound from {@code app.subscription.*}. A subscription reads one or more topics with a
 * single consumer per instance; its settings apply to all of them.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "app.subscription")
public class SubscriptionProperties {

    private Duration pollTimeout = Duration.ofSeconds(1);
    private Duration restartDelay = Duration.ofSeconds(5);
    @Valid
    private List<Subscription> subscriptions = new ArrayList<>();

    @Getter
    @Setter
    public static class Subscription {

        @NotEmpty
        private List<@NotBlank String> topics = new ArrayList<>();

        /**
         * Defaults to {@code spring.kafka.consumer.group-id}.
         */
        private String groupId;

        /**
         * Message type name used when a record has no {@code x-message-type} header.
         */
        private String messageType;

        @Min(1)
        private int consumerInstances = 1;

        private boolean batchProcessing;

        @Valid
        private Batch batch = new Batch();

        private boolean deadLetterEnabled;
    }

    @Getter
    @Setter
    public static class Batch {

        @Min(1)
        private int maxBatchSize = 500;

        /**
         * Events held at most, open batch included. Zero means three batches.
         */
        @Min(0)
        private int maxBufferSize;

        /**
         * Non-positive disables the timer: batches close by size only.
         */
        private Duration batchTriggerTimeout = Duration.ofSeconds(1);

        private BatchHandlingStrategy handlingStrategy = BatchHandlingStrategy.SINGLE_TYPE;

        public int effectiveMaxBufferSize() {
            return maxBufferSize > 0 ? maxBufferSize : 3 * maxBatchSize;
        }
    }
}

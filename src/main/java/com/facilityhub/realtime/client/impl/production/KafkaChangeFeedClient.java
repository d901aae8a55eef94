package com.facilityhub.realtime.client.impl.production;

import com.facilityhub.realtime.client.ChangeFeedClient;
import com.facilityhub.realtime.client.ChangeFeedListener;
import com.facilityhub.realtime.client.ChangeFeedSubscription;
import com.facilityhub.realtime.client.FeedStatus;
import com.facilityhub.realtime.config.RealtimeProperties;
import com.facilityhub.realtime.model.domain.ChannelSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.event.ConsumerFailedToStartEvent;
import org.springframework.kafka.event.ConsumerStoppedEvent;
import org.springframework.kafka.event.NonResponsiveConsumerEvent;
import org.springframework.kafka.listener.ConsumerAwareRebalanceListener;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.KafkaMessageListenerContainer;
import org.springframework.kafka.listener.MessageListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Change feed backed by Debezium CDC topics, one topic per table.
 *
 * <p>Each subscription runs its own listener container in its own consumer
 * group that starts at the latest offset, so nothing missed while disconnected
 * is replayed. The subscription counts as established once the group assigns
 * partitions.
 */
@Slf4j
@Service
@Profile("!test & !demo")
public class KafkaChangeFeedClient implements ChangeFeedClient {

    private final ConsumerFactory<String, String> consumerFactory;
    private final RealtimeProperties properties;
    private final CdcEventParser parser;

    public KafkaChangeFeedClient(ConsumerFactory<String, String> consumerFactory,
                                 RealtimeProperties properties,
                                 ObjectMapper objectMapper) {
        this.consumerFactory = consumerFactory;
        this.properties = properties;
        this.parser = new CdcEventParser(objectMapper, properties.getKafka().getTopicPrefix(), Clock.systemUTC());
    }

    @Override
    public ChangeFeedSubscription subscribe(ChannelSpec spec, ChangeFeedListener listener) {
        String[] topics = spec.tables().stream()
                .map(table -> properties.getKafka().getTopicPrefix() + table)
                .toArray(String[]::new);
        String groupId = properties.getKafka().getGroupPrefix() + spec.name() + "-" + UUID.randomUUID();

        ContainerProperties containerProperties = new ContainerProperties(topics);
        containerProperties.setGroupId(groupId);
        containerProperties.setKafkaConsumerProperties(consumerOverrides());
        containerProperties.setMessageListener((MessageListener<String, String>) record -> onRecord(record, listener));

        AtomicBoolean assigned = new AtomicBoolean(false);
        containerProperties.setConsumerRebalanceListener(new ConsumerAwareRebalanceListener() {
            @Override
            public void onPartitionsAssigned(Consumer<?, ?> consumer, Collection<TopicPartition> partitions) {
                if (assigned.compareAndSet(false, true)) {
                    log.info("Channel {} subscribed to {} partition(s) of {}", spec.name(), partitions.size(),
                            String.join(",", topics));
                    listener.onStatus(FeedStatus.SUBSCRIBED, null);
                }
            }
        });

        KafkaMessageListenerContainer<String, String> container =
                new KafkaMessageListenerContainer<>(consumerFactory, containerProperties);
        container.setBeanName("realtime-" + spec.name());
        container.setApplicationEventPublisher(event -> onContainerEvent(spec.name(), event, listener));

        KafkaSubscription subscription = new KafkaSubscription(spec.name(), groupId, container);
        log.debug("Starting listener container for channel {} in group {}", spec.name(), groupId);
        try {
            container.start();
        } catch (RuntimeException e) {
            log.warn("Listener container for channel {} failed to start: {}", spec.name(), e.getMessage());
            listener.onStatus(FeedStatus.CHANNEL_ERROR, e);
        }
        return subscription;
    }

    @Override
    public void unsubscribe(ChangeFeedSubscription subscription) {
        if (!(subscription instanceof KafkaSubscription kafka)) {
            return;
        }
        if (kafka.stopped().compareAndSet(false, true)) {
            try {
                kafka.container().stop(() -> log.debug("Listener container for channel {} stopped",
                        kafka.channelName()));
            } catch (RuntimeException e) {
                log.warn("Error stopping listener container for channel {}: {}", kafka.channelName(), e.getMessage());
            }
        }
    }

    private void onRecord(ConsumerRecord<String, String> record, ChangeFeedListener listener) {
        try {
            parser.parse(record.topic(), record.value()).ifPresent(listener::onEvent);
        } catch (RuntimeException e) {
            // a poison record must not stop the container
            log.error("Failed to handle record {}-{}@{}: {}", record.topic(), record.partition(), record.offset(),
                    e.getMessage(), e);
        }
    }

    private void onContainerEvent(String channelName, Object event, ChangeFeedListener listener) {
        if (event instanceof ConsumerFailedToStartEvent) {
            log.warn("Consumer for channel {} failed to start", channelName);
            listener.onStatus(FeedStatus.CHANNEL_ERROR, null);
        } else if (event instanceof NonResponsiveConsumerEvent nonResponsive) {
            log.warn("Consumer for channel {} is not responding ({} ms since last poll)", channelName,
                    nonResponsive.getTimeSinceLastPoll());
            listener.onStatus(FeedStatus.TIMED_OUT, null);
        } else if (event instanceof ConsumerStoppedEvent stopped) {
            if (stopped.getReason() == ConsumerStoppedEvent.Reason.NORMAL) {
                listener.onStatus(FeedStatus.CLOSED, null);
            } else {
                log.warn("Consumer for channel {} stopped abnormally: {}", channelName, stopped.getReason());
                listener.onStatus(FeedStatus.CHANNEL_ERROR,
                        new IllegalStateException("Consumer stopped: " + stopped.getReason()));
            }
        }
    }

    private static Properties consumerOverrides() {
        Properties overrides = new Properties();
        overrides.setProperty(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        overrides.setProperty(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        return overrides;
    }

    private record KafkaSubscription(String channelName,
                                     String groupId,
                                     KafkaMessageListenerContainer<String, String> container,
                                     AtomicBoolean stopped) implements ChangeFeedSubscription {

        KafkaSubscription(String channelName, String groupId, KafkaMessageListenerContainer<String, String> container) {
            this(channelName, groupId, container, new AtomicBoolean(false));
        }
    }
}

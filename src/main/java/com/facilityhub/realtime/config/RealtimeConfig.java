package com.facilityhub.realtime.config;

import com.facilityhub.realtime.service.notification.SseEventStream;
import com.facilityhub.realtime.service.realtime.RetryPolicy;
import com.facilityhub.realtime.service.routing.EscalationPolicy;
import com.facilityhub.realtime.service.routing.NotificationDurations;
import com.facilityhub.realtime.service.routing.RoutingTable;
import com.facilityhub.realtime.service.routing.RoutingTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableCaching
@EnableConfigurationProperties(RealtimeProperties.class)
public class RealtimeConfig {

    private static final Logger logger = LoggerFactory.getLogger(RealtimeConfig.class);

    @Bean
    public EscalationPolicy escalationPolicy(RealtimeProperties properties) {
        RealtimeProperties.Escalation escalation = properties.getEscalation();
        logger.info("Escalating on fields {} with values {}", escalation.getPriorityFields(),
                escalation.getHighValues());
        return new EscalationPolicy(escalation.getPriorityFields(), escalation.getHighValues());
    }

    @Bean
    public NotificationDurations notificationDurations(RealtimeProperties properties) {
        RealtimeProperties.Notifications n = properties.getNotifications();
        return new NotificationDurations(n.getBriefMs(), n.getShortMs(), n.getStandardMs(), n.getLongMs(),
                n.getCriticalMs());
    }

    @Bean
    public RetryPolicy retryPolicy(RealtimeProperties properties) {
        RealtimeProperties.Retry retry = properties.getRetry();
        logger.info("Channel retry policy: {} backoff from {}, at most {} attempts, connect timeout {}",
                retry.getBackoff(), retry.getBaseDelay(), retry.getMaxAttempts(), properties.getConnectTimeout());
        return RetryPolicy.from(properties);
    }

    @Bean
    @Qualifier("adminRoutingTable")
    public RoutingTable adminRoutingTable(EscalationPolicy escalationPolicy) {
        return RoutingTables.admin(escalationPolicy);
    }

    @Bean
    @Qualifier("userRoutingTable")
    public RoutingTable userRoutingTable(EscalationPolicy escalationPolicy) {
        return RoutingTables.user(escalationPolicy);
    }

    @Bean
    @Qualifier("adminEventStream")
    public SseEventStream adminEventStream(RealtimeProperties properties) {
        return new SseEventStream("admin", properties.getSseTimeout().toMillis());
    }

    @Bean
    @Qualifier("realtimeNotificationExecutor")
    public ThreadPoolTaskExecutor realtimeNotificationExecutor(RealtimeProperties properties) {
        int threads = properties.getNotifications().getDispatchThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("realtime-notify-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}

package com.facilityhub.realtime.model.domain;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable description of one logical subscription.
 *
 * @param name   unique channel name within a manager
 * @param topics table patterns this channel listens to
 */
public record ChannelSpec(String name, List<TopicSpec> topics) {

    public ChannelSpec {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Channel name must not be blank");
        }
        if (topics == null || topics.isEmpty()) {
            throw new IllegalArgumentException("Channel " + name + " must declare at least one topic");
        }
        topics = List.copyOf(topics);
    }

    public static ChannelSpec of(String name, TopicSpec... topics) {
        return new ChannelSpec(name, List.of(topics));
    }

    /**
     * True if at least one topic of this channel accepts the event.
     */
    public boolean accepts(ChangeEvent event) {
        for (TopicSpec topic : topics) {
            if (topic.matches(event)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> tables() {
        Set<String> tables = new LinkedHashSet<>();
        topics.forEach(t -> tables.add(t.table()));
        return tables;
    }
}

package com.facilityhub.realtime.model.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate connectivity of a subscription manager.
 *
 * @param connected true iff at least one channel is registered and all of them are SUBSCRIBED
 * @param channels  per-channel detail keyed by channel name
 */
public record ManagerStatus(boolean connected, Map<String, ChannelSnapshot> channels) {

    public static final ManagerStatus EMPTY = new ManagerStatus(false, Map.of());

    public ManagerStatus {
        channels = Collections.unmodifiableMap(new LinkedHashMap<>(channels));
    }

    public static ManagerStatus of(Map<String, ChannelSnapshot> channels) {
        boolean connected = !channels.isEmpty() && channels.values().stream()
                .allMatch(c -> c.state() == ChannelState.SUBSCRIBED);
        return new ManagerStatus(connected, channels);
    }

    public Map<String, ChannelState> channelStates() {
        Map<String, ChannelState> states = new LinkedHashMap<>();
        channels.forEach((name, snapshot) -> states.put(name, snapshot.state()));
        return states;
    }

    public ChannelState stateOf(String channelName) {
        ChannelSnapshot snapshot = channels.get(channelName);
        return snapshot == null ? null : snapshot.state();
    }

    public boolean isDegraded() {
        return channels.values().stream().anyMatch(ChannelSnapshot::retriesExhausted);
    }

    public long countInState(ChannelState state) {
        return channels.values().stream().filter(c -> c.state() == state).count();
    }
}

package com.github.dimitryivaniuta.apigateway.proxy.balancer;

import com.github.dimitryivaniuta.apigateway.proxy.error.NoHealthyBackendException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Strict rotation in configured order, one cursor per service. Concurrent callers each get a distinct
 * cursor value, so over any {@code n} consecutive selections every instance of an {@code n}-instance
 * list is picked exactly once.
 */
@Component
public class RoundRobinBackendSelector implements BackendSelector {

    private final Map<String, AtomicLong> cursors = new ConcurrentHashMap<>();

    @Override
    public String select(String service, List<String> instances) {
        if (instances == null || instances.isEmpty()) {
            throw new NoHealthyBackendException("No backend instances configured for service " + service);
        }
        long tick = cursors.computeIfAbsent(service, s -> new AtomicLong()).getAndIncrement();
        return instances.get((int) Math.floorMod(tick, (long) instances.size()));
    }

    public void reset() {
        cursors.clear();
    }
}

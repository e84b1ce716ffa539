package com.chainwatch.ingestion.watch;

import com.chainwatch.watcher.WatcherHandle;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory id -> watcher map. Watchers that stopped on their own stay listed until removed via {@link #stop}.
 */
@Component
@Slf4j
public class WatcherRegistry {

    private final Map<String, RegisteredWatcher> watchers = new ConcurrentHashMap<>();

    public RegisteredWatcher register(WatchKind kind, String target, WatcherHandle handle) {
        String id = newId(kind);
        RegisteredWatcher registered = new RegisteredWatcher(id, kind, target, handle, Instant.now());
        watchers.put(id, registered);
        log.info("Registered watcher {} ({} {})", id, kind, target);
        return registered;
    }

    /**
     * Watchers ordered by start time.
     */
    public List<RegisteredWatcher> list() {
        return watchers.values().stream()
                .sorted(Comparator.comparing(RegisteredWatcher::startedAt).thenComparing(RegisteredWatcher::id))
                .toList();
    }

    public Optional<RegisteredWatcher> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(watchers.get(id));
    }

    /**
     * Stops and removes the watcher. Returns false when the id is unknown.
     */
    public boolean stop(String id) {
        RegisteredWatcher removed = id == null ? null : watchers.remove(id);
        if (removed == null) {
            return false;
        }
        removed.handle().stop();
        log.info("Stopped watcher {} at slot {}", id, removed.handle().lastAcceptedSlot());
        return true;
    }

    public int size() {
        return watchers.size();
    }

    @PreDestroy
    public void stopAll() {
        if (watchers.isEmpty()) {
            return;
        }
        log.info("Stopping {} watcher(s)", watchers.size());
        for (String id : List.copyOf(watchers.keySet())) {
            stop(id);
        }
    }

    private static String newId(WatchKind kind) {
        String prefix = kind.name().toLowerCase(Locale.ROOT).replace('_', '-');
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}

package org.marinchat.service.ws;

import jakarta.annotation.PreDestroy;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Minuteries nommées par connexion ("idle", "grace", "ping").
 * Replanifier une minuterie annule la précédente du même nom.
 */
@Component
public class IdleTimeouts {

    public static final String IDLE = "idle";
    public static final String GRACE = "grace";
    public static final String PING = "ping";

    private final ScheduledThreadPoolExecutor scheduler;
    // clé = connectionId:nom
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    public IdleTimeouts() {
        CustomizableThreadFactory tf = new CustomizableThreadFactory("ws-idle-");
        tf.setDaemon(true);
        this.scheduler = new ScheduledThreadPoolExecutor(2, tf);
        this.scheduler.setRemoveOnCancelPolicy(true);
    }

    public void schedule(String connectionId, String name, Duration delay, Runnable task) {
        String key = key(connectionId, name);
        AtomicReference<ScheduledFuture<?>> self = new AtomicReference<>();
        ScheduledFuture<?> next = scheduler.schedule(() -> {
            tasks.remove(key, self.get());
            task.run();
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
        self.set(next);
        ScheduledFuture<?> previous = tasks.put(key, next);
        if (previous != null) previous.cancel(false);
    }

    /** Minuterie périodique, jusqu'à {@link #cancel} ou {@link #cancelAllOf}. */
    public void scheduleAtFixedRate(String connectionId, String name, Duration period, Runnable task) {
        long millis = period.toMillis();
        ScheduledFuture<?> next = scheduler.scheduleAtFixedRate(task, millis, millis, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = tasks.put(key(connectionId, name), next);
        if (previous != null) previous.cancel(false);
    }

    public void cancel(String connectionId, String name) {
        ScheduledFuture<?> f = tasks.remove(key(connectionId, name));
        if (f != null) f.cancel(false);
    }

    public void cancelAllOf(String connectionId) {
        String prefix = connectionId + ":";
        Iterator<Map.Entry<String, ScheduledFuture<?>>> it = tasks.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, ScheduledFuture<?>> e = it.next();
            if (e.getKey().startsWith(prefix)) {
                e.getValue().cancel(false);
                it.remove();
            }
        }
    }

    public boolean isScheduled(String connectionId, String name) {
        return tasks.containsKey(key(connectionId, name));
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }

    private String key(String connectionId, String name) {
        return connectionId + ":" + name;
    }
}

package org.marinchat.service.ws;

import org.marinchat.model.Connection;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionRegistryTest {

    private static final String TOPIC = "main-chat";

    private final ConnectionRegistry registry = new ConnectionRegistry();

    private String register(String name) {
        return registry.register(Connection.pending(name, Instant.now()), new RecordingSink());
    }

    // --------------------------------------------------------------
    // register / find
    // --------------------------------------------------------------
    @Test
    void register_assigneUnIdUniqueEtGardeLesMetadonnees() {
        String a = register("Alice");
        String b = register("Bob");

        assertThat(a).isNotBlank().isNotEqualTo(b);
        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.find(a)).hasValueSatisfying(c -> {
            assertThat(c.getConnectionId()).isEqualTo(a);
            assertThat(c.getDisplayName()).isEqualTo("Alice");
            assertThat(c.getJoinedAt()).isNotNull();
        });
    }

    @Test
    void find_idInconnu_renvoieVide() {
        assertThat(registry.find("nope")).isEmpty();
    }

    // --------------------------------------------------------------
    // subscribe / snapshot
    // --------------------------------------------------------------
    @Test
    void broadcastSnapshot_respecteLOrdreDAbonnement() {
        String a = register("Alice");
        String b = register("Bob");
        String c = register("Carol");
        registry.subscribe(c, TOPIC);
        registry.subscribe(a, TOPIC);
        registry.subscribe(b, TOPIC);

        assertThat(registry.broadcastSnapshot(TOPIC))
                .extracting(Subscriber::connectionId)
                .containsExactly(c, a, b);
    }

    @Test
    void broadcastSnapshot_estUneCopie() {
        String a = register("Alice");
        registry.subscribe(a, TOPIC);

        List<Subscriber> snapshot = registry.broadcastSnapshot(TOPIC);
        registry.unregister(a);

        assertThat(snapshot).hasSize(1);
        assertThat(registry.broadcastSnapshot(TOPIC)).isEmpty();
    }

    @Test
    void subscribe_idInconnu_estIgnore() {
        registry.subscribe("ghost", TOPIC);

        assertThat(registry.broadcastSnapshot(TOPIC)).isEmpty();
        assertThat(registry.topicNames()).isEmpty();
    }

    @Test
    void unsubscribe_retireSeulementCeTopic() {
        String a = register("Alice");
        registry.subscribe(a, TOPIC);
        registry.subscribe(a, "other");

        registry.unsubscribe(a, "other");

        assertThat(registry.subscriptions(a)).containsExactly(TOPIC);
        assertThat(registry.topicNames()).containsExactly(TOPIC);
    }

    @Test
    void displayNames_trieSansTenirCompteDeLaCasse() {
        registry.subscribe(register("bob"), TOPIC);
        registry.subscribe(register("Alice"), TOPIC);
        registry.subscribe(register("Carol"), TOPIC);
        register("PasAbonne");

        assertThat(registry.displayNames(TOPIC)).containsExactly("Alice", "bob", "Carol");
    }

    // --------------------------------------------------------------
    // unregister
    // --------------------------------------------------------------
    @Test
    void unregister_estIdempotent() {
        String a = register("Alice");
        registry.subscribe(a, TOPIC);

        assertThat(registry.unregister(a)).isTrue();
        assertThat(registry.unregister(a)).isFalse();
        assertThat(registry.unregister(null)).isFalse();

        assertThat(registry.size()).isZero();
        assertThat(registry.subscriptions(a)).isEmpty();
        assertThat(registry.topicNames()).isEmpty();
    }

    @Test
    void unregister_concurrent_unSeulGagnant() throws Exception {
        String a = register("Alice");
        registry.subscribe(a, TOPIC);

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            results.add(pool.submit(() -> {
                start.await();
                return registry.unregister(a);
            }));
        }
        start.countDown();

        int winners = 0;
        for (Future<Boolean> f : results) {
            if (f.get(5, TimeUnit.SECONDS)) winners++;
        }
        pool.shutdownNow();

        assertThat(winners).isEqualTo(1);
    }
}

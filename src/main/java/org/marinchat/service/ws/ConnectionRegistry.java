package org.marinchat.service.ws;

import org.marinchat.model.Connection;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Source de vérité unique : connectionId → connexion, et topic → abonnés.
 * <p>
 * Toutes les opérations passent par le même moniteur ; on n'y fait jamais
 * d'I/O. Les broadcasts itèrent une copie ({@link #broadcastSnapshot}).
 */
@Service
public class ConnectionRegistry {

    private final Object lock = new Object();
    private final Map<String, Subscriber> connections = new LinkedHashMap<>();
    private final Map<String, Set<String>> topics = new HashMap<>();

    public String register(Connection connection, EventSink sink) {
        synchronized (lock) {
            String id;
            do {
                id = UUID.randomUUID().toString();
            } while (connections.containsKey(id));
            connections.put(id, new Subscriber(connection.withConnectionId(id), sink));
            return id;
        }
    }

    /**
     * Retire la connexion et tous ses abonnements.
     *
     * @return true seulement pour l'appel qui l'a effectivement retirée
     */
    public boolean unregister(String connectionId) {
        if (connectionId == null) return false;
        synchronized (lock) {
            if (connections.remove(connectionId) == null) return false;
            topics.values().forEach(members -> members.remove(connectionId));
            topics.values().removeIf(Set::isEmpty);
            return true;
        }
    }

    public void subscribe(String connectionId, String topic) {
        synchronized (lock) {
            if (!connections.containsKey(connectionId)) return;
            topics.computeIfAbsent(topic, t -> new LinkedHashSet<>()).add(connectionId);
        }
    }

    public void unsubscribe(String connectionId, String topic) {
        synchronized (lock) {
            Set<String> members = topics.get(topic);
            if (members == null) return;
            members.remove(connectionId);
            if (members.isEmpty()) topics.remove(topic);
        }
    }

    /** Copie des abonnés du topic, dans l'ordre d'abonnement. */
    public List<Subscriber> broadcastSnapshot(String topic) {
        synchronized (lock) {
            Set<String> members = topics.get(topic);
            if (members == null) return List.of();
            List<Subscriber> out = new ArrayList<>(members.size());
            for (String id : members) {
                Subscriber s = connections.get(id);
                if (s != null) out.add(s);
            }
            return out;
        }
    }

    public List<Subscriber> snapshotAll() {
        synchronized (lock) {
            return List.copyOf(connections.values());
        }
    }

    public Optional<Connection> find(String connectionId) {
        synchronized (lock) {
            return Optional.ofNullable(connections.get(connectionId)).map(Subscriber::connection);
        }
    }

    public Set<String> subscriptions(String connectionId) {
        synchronized (lock) {
            Set<String> out = new LinkedHashSet<>();
            topics.forEach((topic, members) -> {
                if (members.contains(connectionId)) out.add(topic);
            });
            return out;
        }
    }

    public List<String> displayNames(String topic) {
        return namesOf(broadcastSnapshot(topic));
    }

    /** Pseudos triés sans tenir compte de la casse. */
    public static List<String> namesOf(List<Subscriber> members) {
        List<String> names = new ArrayList<>(members.size());
        for (Subscriber s : members) {
            names.add(s.connection().getDisplayName());
        }
        names.sort(String.CASE_INSENSITIVE_ORDER);
        return names;
    }

    public int size() {
        synchronized (lock) {
            return connections.size();
        }
    }

    Collection<String> topicNames() {
        synchronized (lock) {
            return List.copyOf(topics.keySet());
        }
    }
}

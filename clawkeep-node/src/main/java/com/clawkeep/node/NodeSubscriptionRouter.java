package com.clawkeep.node;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Bidirectional node ↔ session subscription table with per-node fanout.
 *
 * <p>
 * Both directions are mutated under the router's monitor so the
 * "first subscriber" check and the insert are atomic. Delivery runs outside
 * the monitor on a snapshot of the subscriber set; each node's send is
 * isolated from the others.
 * </p>
 */
@Slf4j
public class NodeSubscriptionRouter {

    /** nodeId → sessionKeys it listens to. */
    private final Map<String, Set<String>> nodeSubscriptions = new HashMap<>();

    /** sessionKey → nodeIds listening to it. */
    private final Map<String, Set<String>> sessionSubscribers = new HashMap<>();

    private final ObjectMapper objectMapper;
    private final BiConsumer<String, String> onSubscribe;

    public NodeSubscriptionRouter(ObjectMapper objectMapper) {
        this(objectMapper, null);
    }

    /**
     * @param onSubscribe called with (nodeId, sessionKey) when a session gains
     *                    its first subscriber; may be null
     */
    public NodeSubscriptionRouter(ObjectMapper objectMapper, BiConsumer<String, String> onSubscribe) {
        this.objectMapper = objectMapper;
        this.onSubscribe = onSubscribe;
    }

    // ==================== Subscribe / Unsubscribe ====================

    /** Subscribe a node to a session's events. */
    public void subscribe(String nodeId, String sessionKey) {
        String nId = normalize(nodeId);
        String sKey = normalize(sessionKey);
        if (nId.isEmpty() || sKey.isEmpty()) return;

        boolean firstSubscriber;
        synchronized (this) {
            Set<String> nodes = sessionSubscribers.computeIfAbsent(sKey, k -> new LinkedHashSet<>());
            firstSubscriber = nodes.isEmpty();
            nodes.add(nId);
            nodeSubscriptions.computeIfAbsent(nId, k -> new LinkedHashSet<>()).add(sKey);
        }

        if (firstSubscriber && onSubscribe != null) {
            try {
                onSubscribe.accept(nId, sKey);
            } catch (Exception e) {
                log.warn("onSubscribe failed for node {} session {}: {}", nId, sKey, e.getMessage());
            }
        }
    }

    /** Remove a single node ↔ session relation. */
    public synchronized void unsubscribe(String nodeId, String sessionKey) {
        String nId = normalize(nodeId);
        String sKey = normalize(sessionKey);
        if (nId.isEmpty() || sKey.isEmpty()) return;

        removeFrom(nodeSubscriptions, nId, sKey);
        removeFrom(sessionSubscribers, sKey, nId);
    }

    /** Remove every relation of a node (e.g. when the node disconnects). */
    public synchronized void unsubscribeAll(String nodeId) {
        String nId = normalize(nodeId);
        Set<String> sessions = nodeSubscriptions.remove(nId);
        if (sessions == null) return;

        for (String sessionKey : sessions) {
            removeFrom(sessionSubscribers, sessionKey, nId);
        }
    }

    /** Clear all subscriptions. */
    public synchronized void clear() {
        nodeSubscriptions.clear();
        sessionSubscribers.clear();
    }

    // ==================== Event Sending ====================

    /**
     * Send an event to every node subscribed to a session.
     *
     * @param sessionKey the session that originated the event
     * @param event      event name
     * @param payload    event payload (serialized to JSON once)
     * @param sendEvent  delivery callback, invoked once per subscribed node
     */
    public void sendToSession(String sessionKey, String event, Object payload, Consumer<NodeEvent> sendEvent) {
        String sKey = normalize(sessionKey);
        if (sKey.isEmpty() || sendEvent == null) return;

        List<String> nodes;
        synchronized (this) {
            Set<String> subscribed = sessionSubscribers.get(sKey);
            if (subscribed == null || subscribed.isEmpty()) return;
            nodes = new ArrayList<>(subscribed);
        }
        deliver(nodes, event, toPayloadJSON(payload), sendEvent);
    }

    /** Send an event to every node that has at least one subscription. */
    public void sendToAllSubscribed(String event, Object payload, Consumer<NodeEvent> sendEvent) {
        if (sendEvent == null) return;

        List<String> nodes;
        synchronized (this) {
            nodes = new ArrayList<>(nodeSubscriptions.keySet());
        }
        deliver(nodes, event, toPayloadJSON(payload), sendEvent);
    }

    /**
     * Send an event to all currently connected nodes, subscribed or not.
     *
     * @param listConnected supplier of currently connected node IDs
     */
    public void sendToAllConnected(String event,
                                   Object payload,
                                   Supplier<List<String>> listConnected,
                                   Consumer<NodeEvent> sendEvent) {
        if (sendEvent == null || listConnected == null) return;
        deliver(listConnected.get(), event, toPayloadJSON(payload), sendEvent);
    }

    private void deliver(List<String> nodeIds, String event, String payloadJSON, Consumer<NodeEvent> sendEvent) {
        for (String nodeId : nodeIds) {
            try {
                sendEvent.accept(new NodeEvent(nodeId, event, payloadJSON));
            } catch (Exception e) {
                log.warn("Failed to send event {} to node {}: {}", event, nodeId, e.getMessage());
            }
        }
    }

    // ==================== Query ====================

    /** Session keys a node is subscribed to, in subscription order. */
    public synchronized List<String> getSessionKeysForNode(String nodeId) {
        Set<String> sessions = nodeSubscriptions.get(normalize(nodeId));
        return sessions != null ? List.copyOf(sessions) : List.of();
    }

    /** Nodes subscribed to a session. */
    public synchronized Set<String> getSubscribedNodes(String sessionKey) {
        Set<String> nodes = sessionSubscribers.get(normalize(sessionKey));
        return nodes != null ? Collections.unmodifiableSet(new LinkedHashSet<>(nodes)) : Set.of();
    }

    // ==================== Helpers ====================

    private static void removeFrom(Map<String, Set<String>> table, String key, String value) {
        Set<String> set = table.get(key);
        if (set == null) return;
        set.remove(value);
        if (set.isEmpty()) table.remove(key);
    }

    private String toPayloadJSON(Object payload) {
        if (payload == null) return null;
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (Exception e) {
            log.warn("Failed to serialize node event payload: {}", e.getMessage());
            return null;
        }
    }

    private static String normalize(String value) {
        return value != null ? value.trim() : "";
    }
}

package com.clawkeep.node;

/**
 * An event addressed to one node.
 *
 * @param nodeId      receiving node
 * @param event       event name
 * @param payloadJSON serialized payload, or null when the event has none
 */
public record NodeEvent(String nodeId, String event, String payloadJSON) {
    public NodeEvent {
        if (event == null || event.isBlank()) {
            throw new IllegalArgumentException("event name required");
        }
    }
}

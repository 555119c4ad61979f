package com.watchtide.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.watchtide.model.QueueItem;

/**
 * Downstream action for one queue item type. Throwing marks the item failed.
 */
public interface EventHandler {

    String type();

    void handle(QueueItem item, JsonNode payload) throws Exception;
}

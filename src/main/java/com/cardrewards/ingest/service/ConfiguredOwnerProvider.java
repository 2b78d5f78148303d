package com.cardrewards.ingest.service;

import com.cardrewards.ingest.config.IngestProperties;
import org.springframework.stereotype.Component;

/**
 * Owner taken from {@code ingest.owner-id}; the watcher runs on behalf of one household account.
 */
@Component
public class ConfiguredOwnerProvider implements OwnerProvider {

    private final String ownerId;

    public ConfiguredOwnerProvider(IngestProperties properties) {
        this.ownerId = properties.ownerId();
    }

    @Override
    public String currentOwnerId() {
        return ownerId;
    }
}

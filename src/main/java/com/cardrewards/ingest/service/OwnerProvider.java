package com.cardrewards.ingest.service;

/**
 * Supplies the identity persisted rows are attributed to.
 */
public interface OwnerProvider {

    String currentOwnerId();
}

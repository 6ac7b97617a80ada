package com.truthfeed.anchor;

/**
 * External tamper-evidence service. Commits a hash outside the engine's own
 * storage and returns an opaque reference to the commitment.
 *
 * Implementations may be slow or transiently unavailable; the engine never
 * blocks an append on a failed anchor.
 */
public interface AnchoringService {

    /**
     * @param payloadHash hex hash to commit
     * @return opaque anchor reference
     * @throws AnchoringUnavailableException if the service cannot be reached right now
     */
    String anchor(String payloadHash) throws AnchoringUnavailableException;
}

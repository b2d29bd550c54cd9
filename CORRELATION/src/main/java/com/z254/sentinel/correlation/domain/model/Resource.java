package com.z254.sentinel.correlation.domain.model;

/**
 * Infrastructure resource an incident was raised against.
 *
 * @param type resource kind, for example {@code database} or {@code k8s-pod}
 * @param id   resource identifier, also the node id used for topology lookups
 */
public record Resource(String type, String id) {

    public static Resource of(String type, String id) {
        return new Resource(type, id);
    }
}

package com.z254.sentinel.correlation.exception;

public class GroupNotFoundException extends CorrelationException {

    public GroupNotFoundException(String groupId) {
        super("Correlation group " + groupId + " not found", "GROUP_NOT_FOUND");
    }
}

package com.z254.sentinel.correlation.exception;

import com.z254.sentinel.correlation.domain.model.GroupStatus;

public class IllegalGroupTransitionException extends CorrelationException {

    public IllegalGroupTransitionException(String groupId, GroupStatus from, GroupStatus to) {
        super("Correlation group " + groupId + " cannot move from " + from + " to " + to, "ILLEGAL_TRANSITION");
    }
}

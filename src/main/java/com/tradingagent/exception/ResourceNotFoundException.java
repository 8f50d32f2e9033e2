package com.tradingagent.exception;

import java.util.Map;

public class ResourceNotFoundException extends AgentException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(ErrorCode.NOT_FOUND, resourceType + " '" + identifier + "' not found",
                Map.of("type", resourceType, "id", identifier), null);
    }
}

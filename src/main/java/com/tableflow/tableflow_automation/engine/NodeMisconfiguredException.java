package com.tableflow.tableflow_automation.engine;

import lombok.Getter;

import java.util.UUID;

@Getter
public class NodeMisconfiguredException extends RuntimeException {

    private final UUID nodeId;

    public NodeMisconfiguredException(UUID nodeId, Throwable cause) {
        super("Node " + nodeId + " is misconfigured: " + cause.getMessage(), cause);
        this.nodeId = nodeId;
    }
}

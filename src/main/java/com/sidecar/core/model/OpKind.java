package com.sidecar.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Kind of access an execution made to a global state key.
 */
public enum OpKind {
    @JsonProperty("Read") READ,
    @JsonProperty("Write") WRITE,
    @JsonProperty("Add") ADD,
    @JsonProperty("NoOp") NO_OP
}

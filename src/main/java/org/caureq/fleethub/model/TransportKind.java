package org.caureq.fleethub.model;

public enum TransportKind { GRPC, WEBSOCKET }

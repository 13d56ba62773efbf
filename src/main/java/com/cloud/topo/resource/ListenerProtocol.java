package com.cloud.topo.resource;

public enum ListenerProtocol {
    HTTP,
    HTTPS
}

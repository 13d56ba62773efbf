package com.cloud.topo.resource;

public enum IpProtocol {
    TCP("tcp"),
    UDP("udp");

    private final String wireName;

    IpProtocol(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}

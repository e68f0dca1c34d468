package org.bpmn2drawio.bpmn.models;

public enum GatewayType {
    EXCLUSIVE("exclusiveGateway"),
    PARALLEL("parallelGateway"),
    INCLUSIVE("inclusiveGateway"),
    EVENT_BASED("eventBasedGateway"),
    COMPLEX("complexGateway");

    private final String tag;

    GatewayType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static GatewayType fromTag(String tag) {
        for (GatewayType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        return null;
    }
}

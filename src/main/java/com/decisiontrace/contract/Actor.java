package com.decisiontrace.contract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Who or what made a decision. {@code type} is drawn from an open set;
 * the constants below are the values the bundled agents use.
 */
@JsonPropertyOrder({"id", "name", "type"})
public record Actor(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("type") String type
) {

    public static final String AGENT = "agent";
    public static final String SYSTEM = "system";
    public static final String HUMAN = "human";

    public static Actor agent(String id, String name) {
        return new Actor(id, name, AGENT);
    }

    public static Actor system(String id) {
        return new Actor(id, id, SYSTEM);
    }
}

package com.cartsafety.common.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ModelDescriptor(
    @JsonProperty("id")          String id,
    @JsonProperty("name")        String name,
    @JsonProperty("description") String description,
    @JsonProperty("suitableFor") List<String> suitableFor,
    @JsonProperty("requires")    List<String> requires
) {}

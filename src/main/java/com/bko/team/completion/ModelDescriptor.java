package com.bko.team.completion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelDescriptor(
        String name,
        String model,
        @JsonProperty("modified_at") String modifiedAt,
        long size,
        String digest
) {
}

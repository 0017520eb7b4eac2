package io.incentedge.webhooks.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Old and new value of one changed field. */
public record FieldChange(@JsonProperty("old") Object oldValue, @JsonProperty("new") Object newValue) {}

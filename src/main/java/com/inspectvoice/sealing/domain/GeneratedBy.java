package com.inspectvoice.sealing.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Attribution for a sealed bundle. Not an authorization statement.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class GeneratedBy {

    private final String userId;
    private final String displayName;

    @JsonCreator
    public GeneratedBy(
            @JsonProperty("user_id") String userId,
            @JsonProperty("display_name") String displayName) {
        this.userId = userId;
        this.displayName = displayName;
    }

    @JsonProperty("user_id")
    public String getUserId() {
        return userId;
    }

    @JsonProperty("display_name")
    public String getDisplayName() {
        return displayName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GeneratedBy)) {
            return false;
        }
        GeneratedBy that = (GeneratedBy) o;
        return Objects.equals(userId, that.userId) && Objects.equals(displayName, that.displayName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, displayName);
    }

    @Override
    public String toString() {
        return "GeneratedBy{userId='" + userId + "', displayName='" + displayName + "'}";
    }
}

package com.poc.vmmigration.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.poc.vmmigration.exception.InvalidArgumentException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * User credentials for system access.
 * Immutable; validated on construction.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Credentials {

    private final String username;

    @ToString.Exclude
    private final String password;

    private final String domain;

    @JsonCreator
    public Credentials(
            @JsonProperty("username") String username,
            @JsonProperty("password") String password,
            @JsonProperty("domain") String domain) {
        if (StringUtils.isEmpty(username) || StringUtils.isEmpty(password)) {
            throw new InvalidArgumentException("Username and password cannot be null or empty");
        }
        this.username = username;
        this.password = password;
        this.domain = domain;
    }
}

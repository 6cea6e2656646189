package com.poc.vmmigration.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.poc.vmmigration.exception.InvalidArgumentException;
import com.poc.vmmigration.exception.InvalidStateException;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * A machine taking part in a migration, either as a persisted source
 * or as the target VM descriptor embedded in a {@link MigrationTarget}.
 * <p>
 * The IP is the natural key and cannot change once assigned. Deserialized
 * instances go through the same constructor, so the guard is active for them too.
 */
@EqualsAndHashCode
@ToString
public class Workload {

    private String ip;
    private Credentials credentials;
    private Storage storage;

    @JsonIgnore
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private boolean ipAssigned;

    @JsonCreator
    public Workload(
            @JsonProperty("ip") String ip,
            @JsonProperty("credentials") Credentials credentials,
            @JsonProperty("storage") Storage storage) {
        setIp(ip);
        setCredentials(credentials);
        setStorage(storage == null ? new Storage() : storage);
    }

    public Workload(String ip, Credentials credentials) {
        this(ip, credentials, new Storage());
    }

    public String getIp() {
        return ip;
    }

    /**
     * Assign the IP. Only the constructor can do this successfully.
     *
     * @throws InvalidStateException if the IP was already assigned
     */
    public final void setIp(String ip) {
        if (ipAssigned) {
            throw new InvalidStateException("IP address cannot be changed once set (current: " + this.ip + ")");
        }
        if (StringUtils.isEmpty(ip)) {
            throw new InvalidArgumentException("IP cannot be null or empty");
        }
        this.ip = ip;
        this.ipAssigned = true;
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public final void setCredentials(Credentials credentials) {
        if (credentials == null) {
            throw new InvalidArgumentException("Credentials cannot be null");
        }
        this.credentials = credentials;
    }

    public Storage getStorage() {
        return storage;
    }

    public final void setStorage(Storage storage) {
        if (storage == null) {
            throw new InvalidArgumentException("Storage cannot be null");
        }
        this.storage = storage;
    }

    /**
     * Deep copy with the same IP. Credentials are immutable and shared.
     */
    public Workload copy() {
        return new Workload(ip, credentials, storage.copy());
    }
}

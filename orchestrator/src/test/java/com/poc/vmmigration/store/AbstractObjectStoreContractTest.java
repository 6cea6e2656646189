package com.poc.vmmigration.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.vmmigration.TestFixtures;
import com.poc.vmmigration.config.JacksonConfiguration;
import com.poc.vmmigration.exception.AlreadyExistsException;
import com.poc.vmmigration.exception.InvalidArgumentException;
import com.poc.vmmigration.exception.NotFoundException;
import com.poc.vmmigration.model.Credentials;
import com.poc.vmmigration.model.MountPoint;
import com.poc.vmmigration.model.Workload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Behavior every {@link ObjectStore} implementation must share.
 * Subclasses provide the store under test.
 */
abstract class AbstractObjectStoreContractTest {

    protected final ObjectMapper objectMapper = JacksonConfiguration.createObjectMapper();

    protected ObjectStore<Workload> store;

    protected abstract ObjectStore<Workload> createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    @Test
    void createThenRead() {
        Workload workload = TestFixtures.sourceWorkload("10.0.0.1");

        store.create("10.0.0.1", workload);

        assertThat(store.read("10.0.0.1")).isEqualTo(workload);
    }

    @Test
    void createRejectsExistingKey() {
        store.create("10.0.0.1", TestFixtures.sourceWorkload("10.0.0.1"));

        assertThatThrownBy(() -> store.create("10.0.0.1", TestFixtures.sourceWorkload("10.0.0.1")))
                .isInstanceOf(AlreadyExistsException.class);
    }

    @Test
    void readReturnsIndependentInstances() {
        store.create("10.0.0.1", TestFixtures.sourceWorkload("10.0.0.1"));

        Workload first = store.read("10.0.0.1");
        first.getStorage().addMountPoint(new MountPoint("E:\\", 1));

        assertThat(store.read("10.0.0.1").getStorage().getMountPoints()).hasSize(2);
    }

    @Test
    void updateReplacesStoredObject() {
        store.create("10.0.0.1", TestFixtures.sourceWorkload("10.0.0.1"));
        Workload changed = store.read("10.0.0.1");
        changed.setCredentials(new Credentials("root", "rotated", "corp"));

        store.update("10.0.0.1", changed);

        assertThat(store.read("10.0.0.1").getCredentials().getPassword()).isEqualTo("rotated");
    }

    @Test
    void missingKeysAreReportedAsNotFound() {
        Workload workload = TestFixtures.sourceWorkload("10.0.0.9");

        assertThatThrownBy(() -> store.read("10.0.0.9")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.update("10.0.0.9", workload)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.delete("10.0.0.9")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void deleteRemovesObject() {
        store.create("10.0.0.1", TestFixtures.sourceWorkload("10.0.0.1"));

        store.delete("10.0.0.1");

        assertThatThrownBy(() -> store.read("10.0.0.1")).isInstanceOf(NotFoundException.class);
        assertThat(store.listAll()).isEmpty();
    }

    @Test
    void listAllReturnsObjectsOrderedByKey() {
        store.create("10.0.0.2", TestFixtures.sourceWorkload("10.0.0.2"));
        store.create("10.0.0.1", TestFixtures.sourceWorkload("10.0.0.1"));

        assertThat(store.listAll()).extracting(Workload::getIp).containsExactly("10.0.0.1", "10.0.0.2");
    }

    @Test
    void rejectsKeysThatAreNotFileSafe() {
        Workload workload = TestFixtures.sourceWorkload("10.0.0.1");

        assertThatThrownBy(() -> store.create("../escape", workload)).isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> store.read("a/b")).isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> store.read("")).isInstanceOf(InvalidArgumentException.class);
    }
}

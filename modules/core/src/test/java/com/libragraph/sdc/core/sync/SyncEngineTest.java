package com.libragraph.sdc.core.sync;

import com.libragraph.sdc.core.container.DataContainer;
import com.libragraph.sdc.core.model.IdentityDefaults;
import com.libragraph.sdc.core.model.SchemaViolationException;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.libragraph.sdc.core.ContainerFixtures.*;
import static org.assertj.core.api.Assertions.*;

class SyncEngineTest {

    private static final Credential ALICE = new Credential("alice-key");
    private static final Credential BOB = new Credential("bob-key");

    private InMemoryRemoteStore store;
    private SyncEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryRemoteStore();
        engine = new SyncEngine(store, IdentityDefaults.none(), Duration.ofSeconds(5));
    }

    /** Rebuilds a mutable container under the same uuid with the given modification time. */
    private static DataContainer nextStep(DataContainer previous, Instant modified) {
        DataContainer next = create(previous.items());
        next.editContent(c -> c.withModified(modified));
        return next;
    }

    @Test
    void shouldCreateUnknownDataset() {
        DataContainer container = dice(true);

        UploadResult result = engine.upload(container, ALICE);

        assertThat(result.outcome()).isEqualTo(UploadResult.Outcome.CREATED);
        assertThat(result.container()).isSameAs(container);
        assertThat(container.isMutable()).isFalse();
        assertThat(container.content().storageTime()).isNotNull();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void multiStepUploadShouldRequireStrictlyLaterModification() {
        DataContainer step1 = dice(false);
        step1.editContent(c -> c.withModified(Instant.parse("2999-01-01T00:00:10Z")));
        engine.upload(step1, ALICE);
        Instant t1 = step1.modified();

        DataContainer same = nextStep(step1, t1);
        assertThatThrownBy(() -> engine.upload(same, ALICE)).isInstanceOf(StaleWriteException.class);

        DataContainer earlier = nextStep(step1, Instant.parse("2999-01-01T00:00:09Z"));
        assertThatThrownBy(() -> engine.upload(earlier, ALICE)).isInstanceOf(StaleWriteException.class);

        assertThat(engine.download(step1.uuid(), ALICE).modified()).isEqualTo(t1);
    }

    @Test
    void laterStepShouldReplaceRemoteContent() {
        DataContainer step1 = dice(false);
        step1.editContent(c -> c.withModified(Instant.parse("2999-01-01T00:00:10Z")));
        engine.upload(step1, ALICE);

        DataContainer step2 = nextStep(step1, Instant.parse("2999-01-01T00:00:11Z"));
        step2.set("sim/dice.json", List.of(6, 6, 6));
        UploadResult result = engine.upload(step2, ALICE);

        assertThat(result.outcome()).isEqualTo(UploadResult.Outcome.REPLACED);
        DataContainer remote = engine.download(step1.uuid(), ALICE);
        assertThat(remote.get("sim/dice.json")).isEqualTo(List.of(6, 6, 6));
        assertThat(remote.modified()).isEqualTo(Instant.parse("2999-01-01T00:00:11Z"));
    }

    @Test
    void completeDatasetShouldBeTerminal() {
        DataContainer container = dice(true);
        engine.upload(container, ALICE);

        DataContainer again = nextStep(container, container.modified().plusSeconds(60));

        assertThatThrownBy(() -> engine.upload(again, ALICE)).isInstanceOf(ImmutableRemoteException.class);
    }

    @Test
    void uploadingSameCompleteContainerTwiceShouldFail() {
        DataContainer container = dice(true);
        engine.upload(container, ALICE);

        assertThatThrownBy(() -> engine.upload(container, ALICE)).isInstanceOf(ImmutableRemoteException.class);
    }

    @Test
    void staticContainersShouldDeduplicate() {
        DataContainer first = create(payload("X"));
        first.freeze();
        engine.upload(first, ALICE);

        DataContainer second = create(payload("X"));
        second.freeze();
        String secondUuid = second.uuid();
        UploadResult result = engine.upload(second, BOB);

        assertThat(secondUuid).isNotEqualTo(first.uuid());
        assertThat(result.outcome()).isEqualTo(UploadResult.Outcome.DEDUPLICATED);
        assertThat(second.uuid()).isEqualTo(first.uuid());
        assertThat(second.content().created()).isEqualTo(first.content().created());
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void staticContainersOfDifferentTypeShouldNotDeduplicate() {
        DataContainer first = create(payload("X"));
        first.freeze();
        engine.upload(first, ALICE);

        DataContainer second = create(payload("Y"));
        second.freeze();

        assertThat(engine.upload(second, ALICE).outcome()).isEqualTo(UploadResult.Outcome.CREATED);
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void supersessionShouldRequireOwnership() {
        DataContainer original = dice(true);
        engine.upload(original, ALICE);

        DataContainer successor = dice(true);
        successor.editContent(c -> c.withReplaces(original.uuid()));

        assertThatThrownBy(() -> engine.upload(successor, BOB)).isInstanceOf(NotOwnerException.class);
    }

    @Test
    void supersessionOfUnknownDatasetShouldFail() {
        DataContainer successor = dice(true);
        successor.editContent(c -> c.withReplaces("6f1c1a4e-8a8c-4d8e-9d2e-3f1f7c1e2b3a"));

        assertThatThrownBy(() -> engine.upload(successor, ALICE)).isInstanceOf(DatasetNotFoundException.class);
    }

    @Test
    void downloadShouldFollowReplacesChain() {
        DataContainer v1 = dice(true);
        engine.upload(v1, ALICE);

        DataContainer v2 = dice(true);
        v2.editContent(c -> c.withReplaces(v1.uuid()));
        engine.upload(v2, ALICE);

        DataContainer v3 = dice(true);
        v3.set("sim/dice.json", List.of(4));
        v3.editContent(c -> c.withReplaces(v2.uuid()));
        engine.upload(v3, ALICE);

        DataContainer latest = engine.download(v1.uuid(), ALICE);

        assertThat(latest.uuid()).isEqualTo(v3.uuid());
        assertThat(latest.get("sim/dice.json")).isEqualTo(List.of(4));
        assertThat(latest.isMutable()).isFalse();
    }

    @Test
    void supersededDatasetShouldRejectUploads() {
        DataContainer v1 = dice(false);
        engine.upload(v1, ALICE);
        DataContainer v2 = dice(true);
        v2.editContent(c -> c.withReplaces(v1.uuid()));
        engine.upload(v2, ALICE);

        DataContainer step = nextStep(v1, v1.modified().plusSeconds(60));

        assertThatThrownBy(() -> engine.upload(step, ALICE)).isInstanceOf(ImmutableRemoteException.class);
    }

    @Test
    void releasedCopyShouldUploadAsNewLineage() {
        DataContainer v1 = dice(true);
        engine.upload(v1, ALICE);
        String old = v1.uuid();

        v1.release();
        v1.editContent(c -> c.withReplaces(old));

        assertThat(engine.upload(v1, ALICE).outcome()).isEqualTo(UploadResult.Outcome.CREATED);
        assertThat(engine.download(old, ALICE).uuid()).isEqualTo(v1.uuid());
    }

    @Test
    void tamperedStaticHashShouldBeRejected() {
        Map<String, Object> payload = payload("X");
        @SuppressWarnings("unchecked")
        Map<String, Object> content = (Map<String, Object>) payload.get("content.json");
        content.put("static", true);
        content.put("hash", "0".repeat(64));
        DataContainer forged = create(payload);

        assertThatThrownBy(() -> engine.upload(forged, ALICE)).isInstanceOf(SchemaViolationException.class);
    }

    @Test
    void downloadOfUnknownDatasetShouldFail() {
        assertThatThrownBy(() -> engine.download("6f1c1a4e-8a8c-4d8e-9d2e-3f1f7c1e2b3a", ALICE))
                .isInstanceOf(DatasetNotFoundException.class);
    }

    @Test
    void downloadShouldDetectRedirectCycles() {
        RemoteStore looping = new RemoteStore() {
            @Override
            public Uni<DataContainer> create(DataContainer container, Credential credential) {
                return Uni.createFrom().failure(new UnsupportedOperationException());
            }

            @Override
            public Uni<DataContainer> replace(String uuid, DataContainer container, Credential credential) {
                return Uni.createFrom().failure(new UnsupportedOperationException());
            }

            @Override
            public Uni<RemoteLookup> get(String uuid, Credential credential) {
                return Uni.createFrom().item(new RemoteLookup.Redirect(uuid.equals("a") ? "b" : "a"));
            }

            @Override
            public Uni<Optional<DataContainer>> findStatic(String typeName, String hash, Credential credential) {
                return Uni.createFrom().item(Optional.empty());
            }
        };
        SyncEngine cyclic = new SyncEngine(looping, IdentityDefaults.none(), Duration.ofSeconds(1));

        assertThatThrownBy(() -> cyclic.download("a", ALICE))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    void slowStoreShouldTimeOut() {
        RemoteStore silent = new InMemoryRemoteStore() {
            @Override
            public Uni<RemoteLookup> get(String uuid, Credential credential) {
                return Uni.createFrom().nothing();
            }
        };
        SyncEngine impatient = new SyncEngine(silent, IdentityDefaults.none(), Duration.ofMillis(100));

        assertThatThrownBy(() -> impatient.download("a", ALICE))
                .isInstanceOf(RemoteStoreException.class)
                .hasMessageContaining("Timed out");
    }

    @Test
    void shouldUseDefaultCredential() {
        IdentityDefaults withKey = new IdentityDefaults() {
            @Override
            public Optional<String> author() {
                return Optional.empty();
            }

            @Override
            public Optional<String> email() {
                return Optional.empty();
            }

            @Override
            public Optional<URI> server() {
                return Optional.empty();
            }

            @Override
            public Optional<String> credential() {
                return Optional.of("alice-key");
            }
        };
        SyncEngine configured = new SyncEngine(store, withKey, Duration.ofSeconds(5));
        DataContainer original = dice(true);
        configured.upload(original);

        DataContainer successor = dice(true);
        successor.editContent(c -> c.withReplaces(original.uuid()));

        assertThat(engine.upload(successor, ALICE).outcome()).isEqualTo(UploadResult.Outcome.CREATED);
        assertThatThrownBy(() -> engine.upload(dice(true))).isInstanceOf(IllegalStateException.class);
    }

    private static Map<String, Object> payload(String typeName) {
        Map<String, Object> payload = dicePayload(true);
        payload.put("content.json", content(typeName, true));
        return payload;
    }
}

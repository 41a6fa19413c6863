package com.libragraph.sdc.core.hash;

import com.libragraph.sdc.core.container.DataContainer;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.libragraph.sdc.core.ContainerFixtures.*;
import static org.assertj.core.api.Assertions.*;

class ContentHasherTest {

    private final ContentHasher hasher = new ContentHasher(REGISTRY);

    private static Map<String, Object> payload(List<String> order) {
        Map<String, Object> items = Map.of(
                "sim/dice.json", List.of(2, 5, 1),
                "sim/notes.txt", "rolled three times",
                "raw/frame.bin", new byte[]{0, 1, 2, 3},
                "license.txt", "CC0");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("meta.json", meta());
        for (String name : order) {
            payload.put(name, items.get(name));
        }
        payload.put("content.json", content("X", true));
        return payload;
    }

    @Test
    void independentBuildsShouldHashIdentically() {
        DataContainer first = create(payload(List.of("sim/dice.json", "sim/notes.txt", "raw/frame.bin", "license.txt")));
        DataContainer second = create(payload(List.of("license.txt", "raw/frame.bin", "sim/notes.txt", "sim/dice.json")));
        second.editContent(c -> c.withTimestamps(Instant.parse("2020-05-01T12:00:00Z"),
                Instant.parse("2020-05-02T12:00:00Z")));

        first.freeze();
        second.freeze();

        assertThat(first.uuid()).isNotEqualTo(second.uuid());
        assertThat(first.content().created()).isNotEqualTo(second.content().created());
        assertThat(first.content().hash()).isEqualTo(second.content().hash());
    }

    @Test
    void differentContentShouldHashDifferently() {
        DataContainer first = dice(true);
        DataContainer second = dice(true);
        second.set("sim/dice.json", List.of(2, 5, 2));

        assertThat(first.hash()).isNotEqualTo(second.hash());
    }

    @Test
    void itemNameShouldBePartOfDigest() {
        DataContainer first = dice(true);
        DataContainer second = dice(true);
        second.delete("sim/dice.json");
        second.set("sim/die.json", List.of(2, 5, 1));

        assertThat(first.hash()).isNotEqualTo(second.hash());
    }

    @Test
    void attributesShouldBePartOfDigest() {
        DataContainer first = dice(true);
        DataContainer second = dice(true);
        second.editMeta(m -> m.withTitle("Other"));

        assertThat(first.hash()).isNotEqualTo(second.hash());
    }

    @Test
    void bookkeepingFieldsShouldNotAffectDigest() {
        DataContainer container = dice(true);
        String before = container.hash();

        container.release();

        assertThat(container.hash()).isEqualTo(before);
    }

    @Test
    void hasherShouldNotStoreDigest() {
        DataContainer container = dice(true);
        container.seal();

        String digest = hasher.hash(container).toHex();

        assertThat(container.content().hash()).isNull();
        assertThat(container.hash()).isEqualTo(digest);
    }

    @Test
    void reformattedJsonShouldHashIdentically() {
        byte[] compact = "[2,5,1]".getBytes(StandardCharsets.UTF_8);
        byte[] spaced = "[ 2, 5,\n 1 ]".getBytes(StandardCharsets.UTF_8);

        assertThat(REGISTRY.hash("json", compact)).isEqualTo(REGISTRY.hash("json", spaced));
    }

    @Test
    void excludedFieldsShouldCoverBookkeeping() {
        assertThat(ContentHasher.EXCLUDED_CONTENT)
                .contains("uuid", "replaces", "created", "modified", "storageTime", "hash", "modelVersion");
        assertThat(ContentHasher.EXCLUDED_META).containsExactly("created");
    }
}

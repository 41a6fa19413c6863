package com.libragraph.sdc.core.archive;

import com.libragraph.sdc.core.container.ContainerState;
import com.libragraph.sdc.core.container.DataContainer;
import com.libragraph.sdc.core.model.SchemaViolationException;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

import static com.libragraph.sdc.core.ContainerFixtures.*;
import static org.assertj.core.api.Assertions.*;

class ContainerArchiveTest {

    private final ContainerArchive archive = new ContainerArchive(REGISTRY, VALIDATOR);

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteLoadableDiceArchive() {
        DataContainer container = dice(true);
        Path file = tempDir.resolve("dice" + ContainerArchive.FILE_EXTENSION);

        archive.write(container, file);
        DataContainer loaded = archive.read(file);

        assertThat(container.isMutable()).isFalse();
        assertThat(loaded.state()).isEqualTo(ContainerState.IMMUTABLE);
        assertThat(loaded.get("sim/dice.json")).isEqualTo(List.of(2, 5, 1));
        assertThatCode(() -> UUID.fromString(loaded.uuid())).doesNotThrowAnyException();
        assertThat(loaded.uuid()).isEqualTo(container.uuid());
        assertThat(loaded.meta()).isEqualTo(container.meta());
        assertThat(loaded.hash()).isEqualTo(container.hash());
    }

    @Test
    void shouldWriteReservedEntriesFirst() throws IOException {
        DataContainer container = dice(true);
        container.set("a.txt", "first by name");
        Path file = tempDir.resolve("order.zdc");

        archive.write(container, file);

        List<String> names = new ArrayList<>();
        try (ZipFile zip = ZipFile.builder().setFile(file.toFile()).get()) {
            Collections.list(zip.getEntriesInPhysicalOrder()).forEach(e -> names.add(e.getName()));
        }
        assertThat(names).containsExactly("content.json", "meta.json", "a.txt", "sim/dice.json");
    }

    @Test
    void shouldRoundTripThroughBytes() {
        DataContainer container = dice(false);
        container.set("raw/frame.bin", new byte[]{9, 8, 7});
        container.set("log/run.log", "line 1\nline 2");

        DataContainer loaded = archive.fromBytes(archive.toBytes(container));

        assertThat(loaded.names()).isEqualTo(container.names());
        assertThat(loaded.get("raw/frame.bin")).isEqualTo(new byte[]{9, 8, 7});
        assertThat(loaded.get("log/run.log")).isEqualTo("line 1\nline 2");
        assertThat(loaded.content().completeFlag()).isFalse();
    }

    @Test
    void shouldReplaceExistingFile() {
        Path file = tempDir.resolve("c.zdc");
        archive.write(dice(true), file);
        DataContainer second = dice(true);

        archive.write(second, file);

        assertThat(archive.read(file).uuid()).isEqualTo(second.uuid());
        assertThat(tempFiles()).isEmpty();
    }

    @Test
    void failedWriteShouldLeaveExistingFileAndNoTemporaries() {
        Path file = tempDir.resolve("c.zdc");
        DataContainer first = dice(true);
        archive.write(first, file);

        DataContainer broken = dice(true);
        broken.set("bad.json", Map.of("x", new Object()));

        assertThatThrownBy(() -> archive.write(broken, file)).isInstanceOf(RuntimeException.class);
        assertThat(archive.read(file).uuid()).isEqualTo(first.uuid());
        assertThat(tempFiles()).isEmpty();
    }

    @Test
    void unknownExtensionBytesShouldSurviveArchiving() {
        DataContainer container = dice(true);
        byte[] blob = {0, 1, 2, (byte) 0xff};
        container.set("data/blob.dat", blob);

        DataContainer loaded = archive.fromBytes(archive.toBytes(container));

        assertThat(loaded.get("data/blob.dat")).isInstanceOf(byte[].class).isEqualTo(blob);
    }

    @Test
    void loadedContainerShouldFreeze() {
        DataContainer loaded = archive.fromBytes(archive.toBytes(dice(true)));

        loaded.freeze();

        assertThat(loaded.isStatic()).isTrue();
        assertThat(loaded.verifyHash()).isTrue();
        assertThat(archive.fromBytes(archive.toBytes(loaded)).verifyHash()).isTrue();
    }

    @Test
    void shouldKeepUnknownExtensionsAsRawBytes() throws IOException {
        byte[] data = zip(Map.of(
                "content.json", contentJson(),
                "meta.json", "{\"author\":\"A\",\"email\":\"a@x\",\"title\":\"T\"}".getBytes(StandardCharsets.UTF_8),
                "data/cube.npy", new byte[]{(byte) 0x93, 'N', 'U', 'M'}));

        DataContainer loaded = archive.fromBytes(data);

        assertThat(loaded.get("data/cube.npy")).isEqualTo(new byte[]{(byte) 0x93, 'N', 'U', 'M'});
        assertThat(archive.fromBytes(archive.toBytes(loaded)).get("data/cube.npy"))
                .isEqualTo(new byte[]{(byte) 0x93, 'N', 'U', 'M'});
    }

    @Test
    void missingReservedEntryShouldBeCorrupt() throws IOException {
        byte[] data = zip(Map.of("content.json", contentJson()));

        assertThatThrownBy(() -> archive.fromBytes(data))
                .isInstanceOf(CorruptArchiveException.class)
                .hasMessageContaining("meta.json");
    }

    @Test
    void malformedJsonShouldBeCorrupt() throws IOException {
        byte[] data = zip(Map.of(
                "content.json", contentJson(),
                "meta.json", "{not json".getBytes(StandardCharsets.UTF_8)));

        assertThatThrownBy(() -> archive.fromBytes(data)).isInstanceOf(CorruptArchiveException.class);
    }

    @Test
    void schemaProblemsShouldBeSchemaViolations() throws IOException {
        byte[] data = zip(Map.of(
                "content.json", contentJson(),
                "meta.json", "{\"author\":\"A\",\"email\":\"a@x\"}".getBytes(StandardCharsets.UTF_8)));

        assertThatThrownBy(() -> archive.fromBytes(data)).isInstanceOf(SchemaViolationException.class);
    }

    @Test
    void garbageShouldBeCorrupt() {
        assertThatThrownBy(() -> archive.fromBytes("not a zip".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(CorruptArchiveException.class);
    }

    @Test
    void missingFileShouldFail() {
        assertThatThrownBy(() -> archive.read(tempDir.resolve("absent.zdc")))
                .isInstanceOf(ArchiveException.class);
    }

    private static byte[] contentJson() {
        return "{\"containerType\":{\"name\":\"demo\"},\"static\":false,\"complete\":true}"
                .getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] zip(Map<String, byte[]> entries) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipArchiveOutputStream zip = new ZipArchiveOutputStream(out)) {
            for (var entry : entries.entrySet()) {
                zip.putArchiveEntry(new ZipArchiveEntry(entry.getKey()));
                zip.write(entry.getValue());
                zip.closeArchiveEntry();
            }
        }
        return out.toByteArray();
    }

    private List<Path> tempFiles() {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".tmp")).toList();
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }
}

package com.libragraph.sdc.core.archive;

import com.libragraph.sdc.core.container.DataContainer;
import com.libragraph.sdc.core.model.AttributeMapper;
import com.libragraph.sdc.core.model.AttributeValidator;
import com.libragraph.sdc.formats.api.CodecException;
import com.libragraph.sdc.formats.registry.CodecRegistry;
import com.libragraph.sdc.types.InvalidNameException;
import com.libragraph.sdc.types.ItemName;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.jboss.logging.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Date;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads and writes containers as ZIP packages ({@code .zdc}).
 *
 * <p>Layout: {@code content.json} and {@code meta.json} first, then every item
 * under its qualified name ({@code part/name.ext}, root items unprefixed).
 * Files are written to a temporary sibling and moved into place, so a failed
 * write never replaces an existing archive.
 */
public class ContainerArchive {

    private static final Logger log = Logger.getLogger(ContainerArchive.class);

    public static final String FILE_EXTENSION = ".zdc";

    private static final String JSON = "json";

    private final CodecRegistry registry;
    private final AttributeValidator validator;

    public ContainerArchive(CodecRegistry registry, AttributeValidator validator) {
        this.registry = registry;
        this.validator = validator;
    }

    /**
     * Writes the container to {@code target}, sealing it first.
     *
     * @throws ArchiveException on I/O errors; {@code target} is left untouched
     */
    public void write(DataContainer container, Path target) {
        container.seal();
        Path absolute = target.toAbsolutePath();
        Path temp = null;
        boolean moved = false;
        try {
            Files.createDirectories(absolute.getParent());
            temp = Files.createTempFile(absolute.getParent(), "." + absolute.getFileName(), ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                writeTo(container, out);
            }
            try {
                Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE,
                        StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
            moved = true;
            log.debugf("Wrote container %s to %s", container.uuid(), absolute);
        } catch (IOException e) {
            throw new ArchiveException("Failed to write archive: " + absolute, e);
        } finally {
            if (temp != null && !moved) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    log.warnf(e, "Failed to remove temporary archive %s", temp);
                }
            }
        }
    }

    /**
     * Serializes the container into archive bytes, sealing it first.
     */
    public byte[] toBytes(DataContainer container) {
        container.seal();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            writeTo(container, out);
        } catch (IOException e) {
            throw new ArchiveException("Failed to serialize container " + container.uuid(), e);
        }
        return out.toByteArray();
    }

    /**
     * Loads an immutable container from a file.
     *
     * @throws ArchiveException        if the file does not exist
     * @throws CorruptArchiveException if the file is not a valid container archive
     */
    public DataContainer read(Path source) {
        if (!Files.isRegularFile(source)) {
            throw new ArchiveException("No such archive: " + source);
        }
        try (ZipFile zip = ZipFile.builder().setFile(source.toFile()).get()) {
            return readFrom(zip, source.toString());
        } catch (IOException e) {
            throw new CorruptArchiveException("Unreadable archive: " + source, e);
        }
    }

    /**
     * Loads an immutable container from archive bytes.
     *
     * @throws CorruptArchiveException if the bytes are not a valid container archive
     */
    public DataContainer fromBytes(byte[] data) {
        try (ZipFile zip = ZipFile.builder()
                .setSeekableByteChannel(new SeekableInMemoryByteChannel(data))
                .get()) {
            return readFrom(zip, "<memory>");
        } catch (IOException e) {
            throw new CorruptArchiveException("Unreadable archive data", e);
        }
    }

    private void writeTo(DataContainer container, OutputStream out) throws IOException {
        Date time = Date.from(container.modified());
        try (ZipArchiveOutputStream zip = new ZipArchiveOutputStream(out)) {
            zip.setEncoding("UTF-8");
            putEntry(zip, ItemName.CONTENT.toString(), time,
                    registry.encode(JSON, AttributeMapper.toMap(container.content())));
            putEntry(zip, ItemName.META.toString(), time,
                    registry.encode(JSON, AttributeMapper.toMap(container.meta())));
            for (ItemName name : container.itemNames()) {
                if (!name.isReserved()) {
                    putEntry(zip, name.toString(), time, container.encoded(name));
                }
            }
            zip.finish();
        }
    }

    private static void putEntry(ZipArchiveOutputStream zip, String name, Date time, byte[] data)
            throws IOException {
        ZipArchiveEntry entry = new ZipArchiveEntry(name);
        entry.setTime(time.getTime());
        entry.setSize(data.length);
        zip.putArchiveEntry(entry);
        zip.write(data);
        zip.closeArchiveEntry();
    }

    private DataContainer readFrom(ZipFile zip, String source) throws IOException {
        Map<ItemName, byte[]> entries = new TreeMap<>();
        var iterator = zip.getEntries();
        while (iterator.hasMoreElements()) {
            ZipArchiveEntry entry = iterator.nextElement();
            if (entry.isDirectory()) {
                continue;
            }
            ItemName name;
            try {
                name = ItemName.parse(entry.getName());
            } catch (InvalidNameException e) {
                throw new CorruptArchiveException("Illegal entry in " + source + ": " + entry.getName(), e);
            }
            byte[] data;
            try (InputStream in = zip.getInputStream(entry)) {
                data = in.readAllBytes();
            }
            if (entries.put(name, data) != null) {
                throw new CorruptArchiveException("Duplicate entry in " + source + ": " + name);
            }
        }

        Object content = decodeReserved(entries.remove(ItemName.CONTENT), ItemName.CONTENT, source);
        Object meta = decodeReserved(entries.remove(ItemName.META), ItemName.META, source);

        for (var entry : entries.entrySet()) {
            ItemName name = entry.getKey();
            try {
                registry.decode(name.extension(), entry.getValue());
            } catch (CodecException e) {
                throw new CorruptArchiveException("Undecodable item " + name + " in " + source, e);
            }
        }

        DataContainer container = DataContainer.restore(AttributeMapper.content(content),
                AttributeMapper.meta(meta), entries, registry, validator);
        log.debugf("Loaded container %s from %s (%d items)", container.uuid(), source, entries.size());
        return container;
    }

    private Object decodeReserved(byte[] data, ItemName name, String source) {
        if (data == null) {
            throw new CorruptArchiveException("Missing " + name + " in " + source);
        }
        try {
            return registry.decode(JSON, data);
        } catch (CodecException e) {
            throw new CorruptArchiveException("Malformed " + name + " in " + source, e);
        }
    }
}

package com.libragraph.sdc.types;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * Qualified name of a container item: {@code [part/]name.ext}.
 *
 * <p>The part is the path-like prefix up to the last slash (empty for the
 * root part). Names sort by part first, then by file name, so root items
 * come before every other part.
 */
public record ItemName(String part, String fileName) implements Comparable<ItemName> {

    public static final ItemName CONTENT = new ItemName("", "content.json");
    public static final ItemName META = new ItemName("", "meta.json");
    public static final ItemName LICENSE = new ItemName("", "license.txt");

    private static final Comparator<ItemName> ORDER =
            Comparator.comparing(ItemName::part).thenComparing(ItemName::fileName);

    public ItemName {
        Objects.requireNonNull(part, "part cannot be null");
        Objects.requireNonNull(fileName, "fileName cannot be null");
    }

    /**
     * Parses and validates a qualified name.
     *
     * @throws InvalidNameException if the name is empty, absolute, contains
     *                              empty, {@code .} or {@code ..} segments or
     *                              backslashes, or has no extension
     */
    public static ItemName parse(String qualified) {
        if (qualified == null || qualified.isEmpty()) {
            throw new InvalidNameException(String.valueOf(qualified), "empty name");
        }
        if (qualified.indexOf('\\') >= 0) {
            throw new InvalidNameException(qualified, "backslash not allowed");
        }
        if (qualified.startsWith("/") || qualified.endsWith("/")) {
            throw new InvalidNameException(qualified, "leading or trailing '/'");
        }
        for (String segment : qualified.split("/", -1)) {
            if (segment.isEmpty()) {
                throw new InvalidNameException(qualified, "empty path segment");
            }
            if (segment.equals(".") || segment.equals("..")) {
                throw new InvalidNameException(qualified, "path traversal segment");
            }
        }

        int slash = qualified.lastIndexOf('/');
        String part = slash < 0 ? "" : qualified.substring(0, slash);
        String fileName = qualified.substring(slash + 1);

        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            throw new InvalidNameException(qualified, "missing name or extension");
        }
        return new ItemName(part, fileName);
    }

    /** Lower-case extension without the dot. */
    public String extension() {
        return fileName.substring(fileName.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
    }

    public boolean isRoot() {
        return part.isEmpty();
    }

    /** True for the two mandatory attribute records. */
    public boolean isReserved() {
        return equals(CONTENT) || equals(META);
    }

    @Override
    public int compareTo(ItemName other) {
        return ORDER.compare(this, other);
    }

    /**
     * Returns the archive key: {@code part/name.ext}, or {@code name.ext} in the root part.
     */
    @Override
    public String toString() {
        return part.isEmpty() ? fileName : part + "/" + fileName;
    }
}

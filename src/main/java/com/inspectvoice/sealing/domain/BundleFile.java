package com.inspectvoice.sealing.domain;

import java.util.Objects;

/**
 * An in-memory file handed over by an export feature for sealing.
 * The byte array is copied on the way in and on the way out.
 */
public final class BundleFile {

    private final String path;
    private final byte[] data;
    private final String contentType;

    public BundleFile(String path, byte[] data, String contentType) {
        this.path = path;
        this.data = Objects.requireNonNull(data, "data").clone();
        this.contentType = contentType;
    }

    public String getPath() {
        return path;
    }

    public byte[] getData() {
        return data.clone();
    }

    public int getLength() {
        return data.length;
    }

    public String getContentType() {
        return contentType;
    }

    @Override
    public String toString() {
        return "BundleFile{path='" + path + "', bytes=" + data.length + ", contentType='" + contentType + "'}";
    }
}

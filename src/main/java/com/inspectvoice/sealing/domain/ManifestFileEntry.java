package com.inspectvoice.sealing.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One packaged file as declared in the manifest.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class ManifestFileEntry {

    private final String path;
    private final String sha256;
    private final long bytes;
    private final String contentType;

    @JsonCreator
    public ManifestFileEntry(
            @JsonProperty("path") String path,
            @JsonProperty("sha256") String sha256,
            @JsonProperty("bytes") long bytes,
            @JsonProperty("content_type") String contentType) {
        this.path = path;
        this.sha256 = sha256;
        this.bytes = bytes;
        this.contentType = contentType;
    }

    @JsonProperty("path")
    public String getPath() {
        return path;
    }

    @JsonProperty("sha256")
    public String getSha256() {
        return sha256;
    }

    @JsonProperty("bytes")
    public long getBytes() {
        return bytes;
    }

    @JsonProperty("content_type")
    public String getContentType() {
        return contentType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ManifestFileEntry)) {
            return false;
        }
        ManifestFileEntry that = (ManifestFileEntry) o;
        return bytes == that.bytes
                && Objects.equals(path, that.path)
                && Objects.equals(sha256, that.sha256)
                && Objects.equals(contentType, that.contentType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, sha256, bytes, contentType);
    }

    @Override
    public String toString() {
        return "ManifestFileEntry{path='" + path + "', sha256='" + sha256 + "', bytes=" + bytes + "}";
    }
}

package io.storvix.core.artifact;

import java.util.Arrays;

public record Artifact(
    byte[] content,
    String filename,
    String mimeType
) {
    public Artifact {
        content = content == null ? new byte[0] : content.clone();
        filename = filename == null ? "" : filename;
        mimeType = mimeType == null ? "application/octet-stream" : mimeType;
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Artifact that
            && Arrays.equals(content, that.content)
            && filename.equals(that.filename)
            && mimeType.equals(that.mimeType);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(content) + filename.hashCode()) + mimeType.hashCode();
    }

    @Override
    public String toString() {
        return "Artifact[filename=" + filename + ", mimeType=" + mimeType + ", size=" + content.length + "]";
    }
}

package io.storvix.core.artifact;

public class ArtifactProductionException extends Exception {
    public ArtifactProductionException(String message) {
        super(message);
    }

    public ArtifactProductionException(String message, Throwable cause) {
        super(message, cause);
    }
}

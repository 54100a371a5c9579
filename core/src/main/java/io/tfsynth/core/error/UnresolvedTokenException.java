package io.tfsynth.core.error;

import java.util.List;

/**
 * Thrown when a token marker is not registered in the token table used for resolution, usually
 * because the marker was created by a different table.
 */
public final class UnresolvedTokenException extends SynthException {

    private static final long serialVersionUID = 1L;

    private final int tokenId;

    public UnresolvedTokenException(String message, int tokenId) {
        super(message, List.of(), Phase.CONSTRUCTION);
        this.tokenId = tokenId;
    }

    public int tokenId() {
        return tokenId;
    }
}

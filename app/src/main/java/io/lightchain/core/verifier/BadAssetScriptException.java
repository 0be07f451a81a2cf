package io.lightchain.core.verifier;

import io.lightchain.core.protocol.MalformedDataException;

public class BadAssetScriptException extends MalformedDataException {
    public BadAssetScriptException(String message) {
        super(message);
    }
}

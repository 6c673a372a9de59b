package io.fusionlite.core;

/** An area or image has dimensions that cannot be used for the requested operation. */
public class SizeException extends FusionException {

    public SizeException(String message) {
        super(message);
    }
}

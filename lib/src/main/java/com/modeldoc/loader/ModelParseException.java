package com.modeldoc.loader;

/** Raised when an opened {@code ADDEQ} block does not follow the equation grammar. */
public class ModelParseException extends LoaderException {
    public ModelParseException(String message) {
        super(message);
    }

    public ModelParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

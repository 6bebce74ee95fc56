package com.modeldoc.loader;

/**
 * Checked exception signalling that the pipeline could not produce a model. Any failure of this
 * type aborts the run before an output document is written.
 */
public class LoaderException extends Exception {
    public LoaderException(String message) {
        super(message);
    }

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}

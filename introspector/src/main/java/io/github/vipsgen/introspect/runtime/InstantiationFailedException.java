package io.github.vipsgen.introspect.runtime;

/** Raised when the runtime cannot create a transient instance of a type. */
public class InstantiationFailedException extends Exception {

    public InstantiationFailedException(String message) {
        super(message);
    }

    public InstantiationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}

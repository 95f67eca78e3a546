package io.github.vipsgen.introspect;

/** Fatal failure of a discovery run; no partial result is produced. */
public class IntrospectionException extends Exception {

    public IntrospectionException(String message) {
        super(message);
    }

    public IntrospectionException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.catalogconnector.client;

/**
 * What went wrong during a conformance run. Only {@link #RESPONSE_CONFORMANCE} blames the
 * connector's data; the other kinds point at the request, the connector transport or the
 * local setup.
 */
public enum ErrorKind {
    /** The operation name is not one of {@link Operation}. */
    UNSUPPORTED_OPERATION,

    /** The request payload does not parse into the operation's request type. */
    REQUEST_DECODE,

    /** The catalog client could not be created or the catalog call failed. */
    CONNECTOR_INVOCATION,

    /** The connector response could not be turned into JSON. */
    RESPONSE_SERIALIZATION,

    /** The taxonomy reference does not point at a readable schema definition. */
    SCHEMA_RESOLUTION,

    /** The response breaks one or more taxonomy rules. */
    RESPONSE_CONFORMANCE
}

package io.rrproxy.standalone.proxy;

/** The client closed its connection before the upstream response head arrived. */
final class ClientDisconnectedException extends Exception {

    private static final long serialVersionUID = 1L;

    ClientDisconnectedException(String message) {
        super(message);
    }
}

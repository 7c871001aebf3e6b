package com.adlanda.codeindex.exception;

/**
 * No GitHub credential is available for the caller.
 */
public class NotConnectedException extends RuntimeException {

    public NotConnectedException(String user) {
        super("GitHub account not connected for user '" + user + "'");
    }
}

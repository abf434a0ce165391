package com.hydro.petcmp.engine;

/** A formula returned an output the engine cannot accept. */
public class InvalidOutputException extends RuntimeException {

    public InvalidOutputException(String message) {
        super(message);
    }
}

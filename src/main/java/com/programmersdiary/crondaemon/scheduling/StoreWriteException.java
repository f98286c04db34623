package com.programmersdiary.crondaemon.scheduling;

import java.io.IOException;
import java.io.UncheckedIOException;

public class StoreWriteException extends UncheckedIOException {

    public StoreWriteException(String message, IOException cause) {
        super(message, cause);
    }
}

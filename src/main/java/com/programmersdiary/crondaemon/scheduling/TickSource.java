package com.programmersdiary.crondaemon.scheduling;

import java.util.function.Consumer;

/**
 * Emits one {@link Tick} per wall-clock minute.
 */
public interface TickSource {

    void start(Consumer<Tick> listener);

    void stop();
}

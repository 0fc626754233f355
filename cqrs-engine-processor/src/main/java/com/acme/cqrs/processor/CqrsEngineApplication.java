package com.acme.cqrs.processor;

import io.micronaut.runtime.Micronaut;

/**
 * Command engine - accepts versioned commands, orders them per aggregate, materializes the latest
 * state and notifies sync handlers. Sweepers drive the change stream and timeouts; several
 * instances may run against the same database.
 */
public class CqrsEngineApplication {
    public static void main(String[] args) {
        Micronaut.run(CqrsEngineApplication.class, args);
    }
}

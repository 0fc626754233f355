package com.acme.cqrs.stream;

/** A change event as delivered by the stream, with the position used to acknowledge it. */
public record ChangeStreamEntry(long id, ChangeEvent event) {}

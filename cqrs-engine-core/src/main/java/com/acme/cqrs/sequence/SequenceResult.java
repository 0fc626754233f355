package com.acme.cqrs.sequence;

import java.time.Instant;

public record SequenceResult(
    long no, String formattedNo, Instant issuedAt, String scopeKey, String period) {}

package com.acme.cqrs.repository;

/** Scan direction over sort keys. */
public enum QueryOrder {
  ASC,
  DESC
}

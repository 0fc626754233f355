package com.acme.cqrs.domain;

/**
 * Who is submitting and from where. Populated by the surrounding application from its
 * authentication layer.
 */
public record InvocationContext(String userId, String ip, String requestId, String sourceLabel) {

  public static InvocationContext system(String sourceLabel) {
    return new InvocationContext("system", "127.0.0.1", null, sourceLabel);
  }
}

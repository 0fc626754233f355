package com.acme.cqrs.config;

import java.time.Duration;

/**
 * Timeouts for ordering and synchronous publication. Pure POJO - no framework dependencies.
 */
public class TimeoutConfig {

  private Duration predecessorWait = Duration.ofMinutes(5);
  // Longest single invocation the host platform allows; a predecessor wait never exceeds it.
  private Duration maxInvocationDuration = Duration.ofMinutes(15);
  private Duration submitTimeout = Duration.ofSeconds(30);
  private Duration statusPollInterval = Duration.ofMillis(100);

  /** Effective predecessor wait, clamped to the maximum invocation duration. */
  public Duration getPredecessorWait() {
    return predecessorWait.compareTo(maxInvocationDuration) > 0
        ? maxInvocationDuration
        : predecessorWait;
  }

  public void setPredecessorWait(Duration predecessorWait) {
    this.predecessorWait = predecessorWait;
  }

  public Duration getMaxInvocationDuration() {
    return maxInvocationDuration;
  }

  public void setMaxInvocationDuration(Duration maxInvocationDuration) {
    this.maxInvocationDuration = maxInvocationDuration;
  }

  public Duration getSubmitTimeout() {
    return submitTimeout;
  }

  public void setSubmitTimeout(Duration submitTimeout) {
    this.submitTimeout = submitTimeout;
  }

  public Duration getStatusPollInterval() {
    return statusPollInterval;
  }

  public void setStatusPollInterval(Duration statusPollInterval) {
    this.statusPollInterval = statusPollInterval;
  }

  public long getStatusPollIntervalMillis() {
    return statusPollInterval.toMillis();
  }
}

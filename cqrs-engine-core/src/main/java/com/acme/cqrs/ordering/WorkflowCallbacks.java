package com.acme.cqrs.ordering;

import com.acme.cqrs.domain.AggregateKey;
import java.util.Map;
import java.util.Optional;

/**
 * Suspend/resume primitive the orchestrator parks versions on. A token is handed out when a version
 * is suspended; resuming or failing it later is a separate call, possibly from another process.
 */
public interface WorkflowCallbacks {

  /** Issue the token that will later resume or fail the suspended version. */
  String suspendWithToken(AggregateKey aggregateKey, int version);

  /**
   * Signal successful completion of the version owning the token.
   *
   * @return the signalled task, empty for an unknown token
   */
  Optional<OrderingTask> resume(String callbackToken, Map<String, Object> payload);

  /** Signal failure of the version owning the token. */
  Optional<OrderingTask> fail(String callbackToken, String error);
}

package com.acme.cqrs.core;

/** A synchronously published command reached the terminal FAILED state. */
public class CommandFailedException extends PermanentException {

  private final String commandSortKey;

  public CommandFailedException(String commandSortKey, String error) {
    super("Command " + commandSortKey + " failed: " + error);
    this.commandSortKey = commandSortKey;
  }

  public String getCommandSortKey() {
    return commandSortKey;
  }
}

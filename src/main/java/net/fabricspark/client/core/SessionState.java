package net.fabricspark.client.core;

import java.util.EnumSet;
import java.util.Set;

/** Lifecycle states a Livy session reports. */
public enum SessionState {
  NOT_STARTED("not_started"),
  STARTING("starting"),
  IDLE("idle"),
  BUSY("busy"),
  SHUTTING_DOWN("shutting_down"),
  ERROR("error"),
  DEAD("dead"),
  KILLED("killed"),
  SUCCESS("success"),
  UNKNOWN("unknown");

  // a session in one of these states can not be reused
  private static final Set<SessionState> INVALID_STATES = EnumSet.of(DEAD, SHUTTING_DOWN, KILLED);

  private final String description;

  SessionState(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }

  public boolean isStarting() {
    return this == NOT_STARTED || this == STARTING;
  }

  public boolean isInvalid() {
    return INVALID_STATES.contains(this);
  }

  /** @return true if a session being created will never become idle from this state */
  public boolean isFailed() {
    return isInvalid() || this == ERROR;
  }

  public static SessionState fromString(String state) {
    if (state != null) {
      for (SessionState s : values()) {
        if (s.description.equalsIgnoreCase(state)) {
          return s;
        }
      }
    }
    return UNKNOWN;
  }
}

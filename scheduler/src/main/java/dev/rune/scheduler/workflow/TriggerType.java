package dev.rune.scheduler.workflow;

import java.util.Locale;

/**
 * Marker stored on a workflow telling the platform how it is started. A workflow with no marker
 * can only be run by hand.
 */
public enum TriggerType {
  MANUAL,
  SCHEDULED,
  WEBHOOK;

  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

}

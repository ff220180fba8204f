package io.tabdeck.status;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StatusState {
  RUNNING("running"),
  RESTARTING("restarting"),
  ERROR("error");

  private final String wireName;

  StatusState(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}

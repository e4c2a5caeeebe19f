package dev.scrapeproxy.redirect;

import com.fasterxml.jackson.annotation.JsonValue;

/** Follow-up suggested to the catalogue owner after a redirect. */
public enum SuggestedAction {
  UPDATE_URL("update_url"),
  MARK_DISCONTINUED("mark_discontinued"),
  NONE("none");

  private final String label;

  SuggestedAction(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }
}

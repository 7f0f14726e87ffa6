package com.flamingo.ai.redline.service.editor;

/**
 * Identity recorded on tracked changes and comments.
 *
 * @param name display name
 * @param email contact address
 */
public record Author(String name, String email) {

  /** Two-letter initials used by comment markers. */
  public String initials() {
    if (name == null || name.isBlank()) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    for (String part : name.trim().split("\\s+")) {
      sb.append(Character.toUpperCase(part.charAt(0)));
      if (sb.length() == 2) {
        break;
      }
    }
    return sb.toString();
  }
}

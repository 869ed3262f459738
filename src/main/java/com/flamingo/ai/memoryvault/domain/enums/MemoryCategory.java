package com.flamingo.ai.memoryvault.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Fixed set of categories a memory record can belong to. */
public enum MemoryCategory {
  /** Likes, dislikes and habitual choices. */
  PREFERENCE,

  /** Plain statements about the world or the user. */
  FACT,

  /** Technical or organisational decisions. */
  DECISION,

  /** Named things: people, addresses, dates, identifiers. */
  ENTITY,

  /** How something is done. */
  PROCEDURE,

  /** Background for ongoing work. */
  CONTEXT,

  OTHER;

  /** Lower-case name used on the wire and in exports. */
  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a category name case-insensitively.
   *
   * @param value the category name, may be null or blank
   * @return the matching category, or {@link #OTHER} when the value is null or blank
   * @throws IllegalArgumentException if the value names no category
   */
  @JsonCreator
  public static MemoryCategory fromValue(String value) {
    if (value == null || value.isBlank()) {
      return OTHER;
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}

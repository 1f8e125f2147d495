package io.owlbind.model;

/** What a slug names; decides its prefix. */
public enum SlugRole {
  /** Classes and other plain names: no prefix. */
  PLAIN(""),
  /** Relations: {@code has} prefix, {@code @} characters removed first. */
  PROPERTY("has"),
  /** Individuals: {@code ind} prefix. */
  INDIVIDUAL("ind");

  private final String prefix;

  SlugRole(String prefix) {
    this.prefix = prefix;
  }

  public String prefix() {
    return prefix;
  }
}

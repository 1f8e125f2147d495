package io.owlbind.model;

import java.util.List;
import java.util.Map;

/**
 * Configuration of how individuals get their public identity.
 *
 * @param idAttributes relation names carrying an identifier, by priority
 * @param nameAttributes relation names carrying a display name, by priority
 * @param typeAliases public type name to the prefix used in identifier based names
 */
public record NamingConfig(
    List<String> idAttributes, List<String> nameAttributes, Map<String, String> typeAliases) {

  public NamingConfig {
    idAttributes = List.copyOf(idAttributes);
    nameAttributes = List.copyOf(nameAttributes);
    typeAliases = Map.copyOf(typeAliases);
  }

  /**
   * Creates default configuration: {@code ID}/{@code id} identifiers, {@code Name}/{@code name}
   * display names, no aliases.
   *
   * @return default configuration
   */
  public static NamingConfig defaults() {
    return new NamingConfig(List.of("ID", "id"), List.of("Name", "name"), Map.of());
  }

  /** Returns the alias of a type name, or the name itself. */
  public String aliasOf(String type) {
    return typeAliases.getOrDefault(type, type);
  }
}

package io.owlbind.model;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the public identity of individuals on first request and remembers it.
 *
 * <p>An individual with an identifier assertion is named {@code <alias(type)>-<id>}; any other
 * individual is named {@code slugify(type + displayName, INDIVIDUAL)}. The display name is the
 * value of the first name assertion found in priority order, falling back to the base name.
 */
public final class IdentityResolver {
  private final NamingConfig config;
  private final Map<Individual, Identity> identities = new IdentityHashMap<>();

  public IdentityResolver(NamingConfig config) {
    this.config = config;
  }

  public NamingConfig getConfig() {
    return config;
  }

  /** Returns the IRI fragment of an individual. */
  public String slug(Individual individual) {
    return identity(individual).slug();
  }

  /** Returns the human readable label of an individual. */
  public String displayName(Individual individual) {
    return identity(individual).displayName();
  }

  /** Returns the identifier value, if the individual carries one. */
  public Optional<String> id(Individual individual) {
    return Optional.ofNullable(identity(individual).id());
  }

  private Identity identity(Individual individual) {
    Identity identity = identities.get(individual);
    if (identity == null) {
      identity = resolve(individual);
      identities.put(individual, identity);
    }
    return identity;
  }

  private Identity resolve(Individual individual) {
    String id = firstValue(individual, config.idAttributes().toArray(String[]::new));
    String name = firstValue(individual, config.nameAttributes().toArray(String[]::new));
    String displayName = name != null ? name : individual.getBaseName();
    String type = individual.getType() == null ? "" : individual.getType();

    String slug;
    if (id != null) {
      slug = config.aliasOf(type) + "-" + id;
    } else {
      slug = Slugs.slugify(type + displayName, SlugRole.INDIVIDUAL);
    }
    return new Identity(slug, displayName, id);
  }

  private String firstValue(Individual individual, String... attributes) {
    for (String attribute : attributes) {
      for (Has has : individual.getAssertions()) {
        if (has.getAttribute().equals(attribute)) {
          return render(has.getValue());
        }
      }
    }
    return null;
  }

  private String render(Value value) {
    if (value instanceof Literal) {
      return ((Literal) value).getLexicalForm();
    }
    return displayName((Individual) value);
  }

  private record Identity(String slug, String displayName, String id) {}
}

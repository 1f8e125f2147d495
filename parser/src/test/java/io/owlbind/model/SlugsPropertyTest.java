package io.owlbind.model;

import static org.assertj.core.api.Assertions.assertThat;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.PropertyDefaults;
import net.jqwik.api.Provide;

@PropertyDefaults(tries = 300)
class SlugsPropertyTest {

  @Property
  void plainSlugsAreIdempotent(@ForAll("phrases") String phrase) {
    String slug = Slugs.slugify(phrase);
    assertThat(Slugs.slugify(slug)).isEqualTo(slug);
  }

  @Property
  void slugsAreDeterministic(@ForAll("phrases") String phrase) {
    assertThat(Slugs.slugify(phrase, SlugRole.INDIVIDUAL))
        .isEqualTo(Slugs.slugify(phrase, SlugRole.INDIVIDUAL));
  }

  @Property
  void slugsContainNoDelimiters(@ForAll("phrases") String phrase) {
    String slug = Slugs.slugify(phrase, SlugRole.PROPERTY);
    assertThat(slug).startsWith("has").doesNotContain(" ", "_", "-", ",", "\t", "\n");
  }

  @Provide
  Arbitrary<String> phrases() {
    Arbitrary<Character> first = Arbitraries.chars().range('a', 'z');
    Arbitrary<String> rest =
        Arbitraries.strings()
            .withChars("abcdeXYZ0123456789 _-,#+./&*=%<>\t")
            .ofMaxLength(40);
    return Combinators.combine(first, rest).as((c, r) -> c + r);
  }
}

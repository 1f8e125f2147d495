package io.owlbind.model.rule;

import java.util.List;

/**
 * A named implication: when every body atom holds, every head atom holds. Rules are data for the
 * ontology reasoner; nothing here evaluates them.
 *
 * @param name rule label
 * @param body premises
 * @param head conclusions
 */
public record Rule(String name, List<Atom> body, List<Atom> head) {
  public Rule {
    body = List.copyOf(body);
    head = List.copyOf(head);
  }

  public Rule(String name, List<Atom> body, Atom head) {
    this(name, body, List.of(head));
  }
}

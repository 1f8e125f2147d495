package io.owlbind.model;

/** The object of a {@link Has} assertion: a {@link Literal} or an {@link Individual}. */
public interface Value extends GraphEntry {}

package io.owlbind.model;

/**
 * Anything that can appear at the top level of an entity graph: declarations produced by the
 * schema compiler and the values produced by parsing documents.
 */
public interface GraphEntry {}

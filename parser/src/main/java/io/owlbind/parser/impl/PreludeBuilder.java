package io.owlbind.parser.impl;

import io.owlbind.model.GraphEntry;
import io.owlbind.model.OwlClass;
import io.owlbind.model.PropertyNote;
import io.owlbind.parser.api.OwlbindException;
import io.owlbind.parser.api.SchemaDefectException;
import io.owlbind.parser.api.SchemaOptions;
import io.owlbind.parser.internal_api.schema.AttributeDecl;
import io.owlbind.parser.internal_api.schema.Choice;
import io.owlbind.parser.internal_api.schema.ComplexType;
import io.owlbind.parser.internal_api.schema.ContentModel;
import io.owlbind.parser.internal_api.schema.ElementDecl;
import io.owlbind.parser.internal_api.schema.Enumeration;
import io.owlbind.parser.internal_api.schema.Extension;
import io.owlbind.parser.internal_api.schema.Particle;
import io.owlbind.parser.internal_api.schema.Sequence;
import io.owlbind.parser.internal_api.schema.SimpleType;
import io.owlbind.parser.internal_api.schema.TypeDefinition;
import io.owlbind.parser.internal_api.schema.TypeKind;
import io.owlbind.parser.internal_api.schema.TypeRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the schema prelude in two phases.
 *
 * <ol>
 *   <li>Push-down: documentation of every flattened type moves to the type or relation that
 *       survives flattening. Documentation that cannot move stays on the relations of the
 *       elements bound to the flattened type.
 *   <li>Declarations: walking from the root elements, one class per public class name of every
 *       non-flattened complex type (marking the type), one class plus its term individuals per
 *       vocabulary, and a note for every documented relation. Named types that no root reaches
 *       are declared afterwards under their own names.
 * </ol>
 */
final class PreludeBuilder {
  private static final Logger LOG = LoggerFactory.getLogger(PreludeBuilder.class);

  private final SchemaOptions options;
  private final TypeRegistry registry;
  private final Collection<ElementDecl> roots;
  private final Collection<TypeDefinition> namedTypes;
  private final List<TypeDefinition> declaredTypes;
  private final List<ElementDecl> declaredElements;

  private final List<GraphEntry> prelude = new ArrayList<>();
  private final Set<String> declaredClasses = new HashSet<>();
  private final Set<PropertyNote> notes = new HashSet<>();
  private final Set<TypeDefinition> visited = identitySet();

  PreludeBuilder(
      SchemaOptions options,
      TypeRegistry registry,
      Collection<ElementDecl> roots,
      Collection<TypeDefinition> namedTypes,
      List<TypeDefinition> declaredTypes,
      List<ElementDecl> declaredElements) {
    this.options = options;
    this.registry = registry;
    this.roots = roots;
    this.namedTypes = namedTypes;
    this.declaredTypes = declaredTypes;
    this.declaredElements = declaredElements;
  }

  List<GraphEntry> build() throws OwlbindException {
    pushDown();
    for (ElementDecl root : roots) {
      visitElement(root);
    }
    for (TypeDefinition type : namedTypes) {
      declareUnreached(type);
    }
    LOG.debug(
        "Prelude holds {} entries, {} of them classes", prelude.size(), declaredClasses.size());
    return prelude;
  }

  private void pushDown() throws OwlbindException {
    for (TypeDefinition type : declaredTypes) {
      if (!(type instanceof ComplexType) || !type.isAlone() || type.getAnnotations().isEmpty()) {
        continue;
      }
      ComplexType wrapper = (ComplexType) type;
      boolean skipped = options.skipPushdown().contains(wrapper.getPath());
      if (skipped || !pushInto(wrapper, wrapper.getAnnotations(), identitySet())) {
        LOG.debug("Keeping documentation of {} on its relations", wrapper.describe());
        for (ElementDecl element : declaredElements) {
          if (element.getType().refersTo(wrapper)) {
            element.addRelationAnnotations(wrapper.getAnnotations());
          }
        }
      }
    }
  }

  /** Returns false when the flattened type has no child able to receive the documentation. */
  private boolean pushInto(ComplexType wrapper, List<String> pushed, Set<TypeDefinition> seen)
      throws OwlbindException {
    if (!seen.add(wrapper)) {
      return false;
    }
    ContentModel content = wrapper.getContent();
    Collection<ElementDecl> targets = List.of();
    if (content instanceof Sequence && ((Sequence) content).childCount() == 1) {
      targets = ((Sequence) content).names().values();
    } else if (content instanceof Choice) {
      targets = ((Choice) content).names().values();
    }
    if (!targets.isEmpty()) {
      for (ElementDecl target : targets) {
        pushIntoElement(target, pushed, seen);
      }
      return true;
    }
    if (wrapper.getAttributes().size() == 1) {
      wrapper.getAttributes().get(0).addRelationAnnotations(pushed);
      return true;
    }
    return false;
  }

  private void pushIntoElement(ElementDecl element, List<String> pushed, Set<TypeDefinition> seen)
      throws OwlbindException {
    TypeDefinition target = element.getType().resolve(registry);
    if (target.isAlone() && pushInto((ComplexType) target, pushed, seen)) {
      return;
    }
    if (target.isAlone() || target.getKind() == TypeKind.LITERAL) {
      element.addRelationAnnotations(pushed);
      return;
    }
    target.receiveAnnotations(pushed);
  }

  private void visitElement(ElementDecl element) throws OwlbindException {
    String relation = options.aliasOf(element.getName().localName());
    note(relation, element.getRelationAnnotations());
    TypeDefinition type = element.getType().resolve(registry);
    if (type.getKind() == TypeKind.SIMPLE) {
      declareVocabulary((SimpleType) type);
    } else if (type.getKind() == TypeKind.COMPLEX) {
      if (!type.isAlone()) {
        declareClass(relation, type);
      }
      visitStructure((ComplexType) type);
    }
  }

  private void visitStructure(ComplexType type) throws OwlbindException {
    if (!visited.add(type)) {
      return;
    }
    for (AttributeDecl attribute : type.getAttributes()) {
      visitAttribute(attribute);
    }
    ContentModel content = type.getContent();
    if (content instanceof Extension) {
      Extension extension = (Extension) content;
      for (AttributeDecl attribute : extension.getAttributes()) {
        visitAttribute(attribute);
      }
      TypeDefinition base = extension.getBase().resolve(registry);
      if (base instanceof ComplexType) {
        visitStructure((ComplexType) base);
      } else if (base instanceof SimpleType) {
        declareVocabulary((SimpleType) base);
      }
    } else if (content instanceof Particle) {
      for (ElementDecl element : ((Particle) content).names().values()) {
        visitElement(element);
      }
    }
  }

  private void visitAttribute(AttributeDecl attribute) throws OwlbindException {
    note(attribute.getName(), attribute.getRelationAnnotations());
    TypeDefinition type = attribute.getType().resolve(registry);
    if (type.getKind() == TypeKind.COMPLEX) {
      throw SchemaDefectException.notAnAttributeType(type.describe());
    }
    if (type.getKind() == TypeKind.SIMPLE) {
      declareVocabulary((SimpleType) type);
    }
  }

  private void declareUnreached(TypeDefinition type) throws OwlbindException {
    if (type instanceof SimpleType) {
      declareVocabulary((SimpleType) type);
    } else if (type instanceof ComplexType) {
      if (!type.isAlone() && !type.isMarked()) {
        declareClass(type.getName().localName(), type);
      }
      visitStructure((ComplexType) type);
    }
  }

  private void declareClass(String className, TypeDefinition type) {
    if (declaredClasses.add(className)) {
      prelude.add(new OwlClass(className, type.getClassAnnotations()));
    }
    type.mark();
  }

  private void declareVocabulary(SimpleType type) {
    if (!type.mark() || type.getRestriction().getEnumerations().isEmpty()) {
      return;
    }
    if (declaredClasses.add(type.getClassName())) {
      prelude.add(new OwlClass(type.getClassName(), type.getClassAnnotations()));
    }
    for (Enumeration term : type.getRestriction().getEnumerations()) {
      prelude.add(term.getIndividual());
    }
  }

  private void note(String relation, List<String> annotations) {
    if (annotations.isEmpty()) {
      return;
    }
    PropertyNote note = new PropertyNote(relation, annotations);
    if (notes.add(note)) {
      prelude.add(note);
    }
  }

  private static Set<TypeDefinition> identitySet() {
    return Collections.newSetFromMap(new IdentityHashMap<>());
  }
}

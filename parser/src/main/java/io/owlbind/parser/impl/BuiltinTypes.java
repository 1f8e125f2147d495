package io.owlbind.parser.impl;

import io.owlbind.model.LiteralKind;
import io.owlbind.model.Namespaces;
import io.owlbind.model.QualifiedName;
import io.owlbind.parser.internal_api.schema.LiteralType;
import io.owlbind.parser.internal_api.schema.TypeDefinition;
import java.util.LinkedHashMap;
import java.util.Map;

/** The XSD built-in types the compiler knows, pre-registered in every registry. */
final class BuiltinTypes {
  private BuiltinTypes() {}

  private static final Map<String, LiteralKind> KINDS = new LinkedHashMap<>();

  static {
    for (String text :
        new String[] {
          "string", "token", "normalizedString", "anyURI", "NMTOKEN", "ID", "IDREF", "NCName",
          "Name", "language", "anySimpleType", "boolean", "decimal", "dateTime"
        }) {
      KINDS.put(text, LiteralKind.TEXT);
    }
    KINDS.put("date", LiteralKind.DATE);
    for (String integer :
        new String[] {"integer", "int", "long", "short", "nonNegativeInteger", "positiveInteger",
          "gYear"}) {
      KINDS.put(integer, LiteralKind.INTEGER);
    }
    for (String fragment : new String[] {"gMonth", "gDay", "gMonthDay"}) {
      KINDS.put(fragment, LiteralKind.DATE_FRAGMENT);
    }
  }

  static void registerInto(Map<QualifiedName, TypeDefinition> registry) {
    for (Map.Entry<String, LiteralKind> e : KINDS.entrySet()) {
      QualifiedName name = Namespaces.xs(e.getKey());
      registry.put(name, new LiteralType(name, e.getValue()));
    }
  }

  static boolean isBuiltin(QualifiedName name) {
    return Namespaces.XS.equals(name.namespace()) && KINDS.containsKey(name.localName());
  }
}

// Copyright 2026 The Stackwire Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.stackwire.java.extract;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.annotation.Nullable;
import net.stackwire.java.config.ReservedIdentifiers;
import net.stackwire.java.discover.Binding;
import net.stackwire.java.discover.Declaration;
import net.stackwire.java.discover.Discovery;
import net.stackwire.java.discover.ImportTable;
import net.stackwire.java.syntax.BinaryOperatorExpression;
import net.stackwire.java.syntax.CallExpression;
import net.stackwire.java.syntax.CompositeLiteral;
import net.stackwire.java.syntax.Expression;
import net.stackwire.java.syntax.FloatLiteral;
import net.stackwire.java.syntax.Identifier;
import net.stackwire.java.syntax.IndexExpression;
import net.stackwire.java.syntax.IntLiteral;
import net.stackwire.java.syntax.Node;
import net.stackwire.java.syntax.SelectorExpression;
import net.stackwire.java.syntax.StringLiteral;
import net.stackwire.java.syntax.TokenKind;
import net.stackwire.java.syntax.UnaryOperatorExpression;

/**
 * A {@link ValueExtractor} that evaluates the initializers recorded by a scan, without running
 * any code.
 *
 * <p>Names of resources and parameters evaluate to {@code {"Ref": name}}, {@code X.Attr} on a
 * resource to {@code {"Fn::GetAtt": [X, Attr]}}, and conditions to {@code {"Condition": name}}.
 * Intrinsic shapes such as {@code Sub{...}} become their template forms. Any other binding is
 * inlined. Fields of structured values that hold nil, an empty string, an empty list or an empty
 * map are omitted. Arithmetic on constant strings and numbers is folded.
 */
public final class StaticValueExtractor implements ValueExtractor {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Field names of each intrinsic shape, in positional order. */
  private static final ImmutableMap<String, ImmutableList<String>> INTRINSIC_FIELDS =
      ImmutableMap.<String, ImmutableList<String>>builder()
          .put("Ref", ImmutableList.of("LogicalName"))
          .put("GetAtt", ImmutableList.of("LogicalName", "Attribute"))
          .put("Sub", ImmutableList.of("String"))
          .put("SubWithMap", ImmutableList.of("String", "Variables"))
          .put("Join", ImmutableList.of("Delimiter", "Values"))
          .put("Select", ImmutableList.of("Index", "List"))
          .put("GetAZs", ImmutableList.of("Region"))
          .put("If", ImmutableList.of("Condition", "ValueIfTrue", "ValueIfFalse"))
          .put("Equals", ImmutableList.of("Value1", "Value2"))
          .put("And", ImmutableList.of("Conditions"))
          .put("Or", ImmutableList.of("Conditions"))
          .put("Not", ImmutableList.of("Condition"))
          .put("Base64", ImmutableList.of("Value"))
          .put("ImportValue", ImmutableList.of("ExportName"))
          .put("FindInMap", ImmutableList.of("MapName", "TopKey", "SecondKey"))
          .put("Split", ImmutableList.of("Delimiter", "Source"))
          .put("Cidr", ImmutableList.of("IPBlock", "Count", "CidrBits"))
          .put("Transform", ImmutableList.of("Name", "Parameters"))
          .put("Condition", ImmutableList.of("Name"))
          .put("Tag", ImmutableList.of("Key", "Value"))
          .buildOrThrow();

  /** Intrinsic shapes whose literals are maps keyed by expressions. */
  private static final ImmutableSet<String> MAP_SHAPES = ImmutableSet.of("Mapping", "Json");

  private static final ImmutableMap<String, Object> NO_VALUE =
      ImmutableMap.of("Ref", "AWS::NoValue");

  private final Discovery discovery;
  private final ReservedIdentifiers reserved;

  public StaticValueExtractor(Discovery discovery, ReservedIdentifiers reserved) {
    this.discovery = discovery;
    this.reserved = reserved;
  }

  @Override
  public ImmutableMap<String, Object> extract(List<DeclarationSite> sites)
      throws ExtractionException {
    Evaluation evaluation = new Evaluation();
    ImmutableMap.Builder<String, Object> values = ImmutableMap.builder();
    for (DeclarationSite site : sites) {
      Binding binding = discovery.bindings().get(site.name());
      if (binding == null) {
        throw new ExtractionException(
            String.format("%s:%d: no binding named %s", site.file(), site.line(), site.name()));
      }
      Object value = evaluation.evalBinding(binding);
      if (value != null) {
        values.put(site.name(), value);
      }
    }
    ImmutableMap<String, Object> result = values.buildOrThrow();
    logger.atFine().log("extracted %d of %d values", result.size(), sites.size());
    return result;
  }

  /** The state of one extraction: the bindings being inlined and those already evaluated. */
  private final class Evaluation {
    private final Deque<String> inlining = new ArrayDeque<>();
    private final Map<String, Object> cache = new HashMap<>();

    @Nullable
    Object evalBinding(Binding binding) throws ExtractionException {
      String name = binding.name();
      if (cache.containsKey(name)) {
        return cache.get(name);
      }
      if (inlining.contains(name)) {
        List<String> cycle = new ArrayList<>();
        inlining.descendingIterator().forEachRemaining(cycle::add);
        cycle = cycle.subList(cycle.indexOf(name), cycle.size());
        throw new ExtractionException(
            String.format(
                "%s: initialization cycle: %s -> %s",
                binding.location(), Joiner.on(" -> ").join(cycle), name));
      }
      inlining.push(name);
      try {
        Object value =
            binding.initializer() == null ? null : eval(binding.initializer(), binding.imports());
        cache.put(name, value);
        return value;
      } finally {
        inlining.pop();
      }
    }

    @Nullable
    Object eval(Expression expr, ImportTable imports) throws ExtractionException {
      switch (expr.kind()) {
        case STRING_LITERAL:
          return ((StringLiteral) expr).getValue();
        case INT_LITERAL:
          return ((IntLiteral) expr).getValue();
        case FLOAT_LITERAL:
          return ((FloatLiteral) expr).getValue();
        case IDENTIFIER:
          return evalIdentifier((Identifier) expr);
        case SELECTOR:
          return evalSelector((SelectorExpression) expr, imports);
        case COMPOSITE_LITERAL:
          return evalCompositeLiteral((CompositeLiteral) expr, imports);
        case UNARY_OPERATOR:
          return evalUnaryOperator((UnaryOperatorExpression) expr, imports);
        case BINARY_OPERATOR:
          return evalBinaryOperator((BinaryOperatorExpression) expr, imports);
        case CALL:
          return evalCall((CallExpression) expr, imports);
        case INDEX:
          return evalIndex((IndexExpression) expr, imports);
        default:
          throw error(expr, "cannot evaluate %s", expr.kind().toString().toLowerCase(Locale.ROOT));
      }
    }

    @Nullable
    private Object evalIdentifier(Identifier id) throws ExtractionException {
      String name = id.getName();
      switch (name) {
        case "true":
          return true;
        case "false":
          return false;
        case "nil":
          return null;
        default:
          break;
      }
      Declaration declaration = discovery.declaration(name);
      if (declaration != null) {
        switch (declaration.kind()) {
          case RESOURCE:
          case PARAMETER:
            return ImmutableMap.of("Ref", name);
          case CONDITION:
            return ImmutableMap.of("Condition", name);
          default:
            break;
        }
      }
      Binding binding = discovery.bindings().get(name);
      if (binding != null) {
        return evalBinding(binding);
      }
      String pseudo = reserved.pseudoParameter(name);
      if (pseudo != null) {
        return ImmutableMap.of("Ref", pseudo);
      }
      throw error(id, "undefined: %s", name);
    }

    @Nullable
    private Object evalSelector(SelectorExpression selector, ImportTable imports)
        throws ExtractionException {
      String field = selector.getField().getName();
      if (selector.getObject() instanceof Identifier object) {
        String name = object.getName();
        if (imports.isAlias(name)) {
          String pseudo = reserved.pseudoParameter(field);
          if (imports.isIntrinsicNamespace(name) && pseudo != null) {
            return ImmutableMap.of("Ref", pseudo);
          }
          throw error(selector, "cannot evaluate %s.%s", name, field);
        }
        Declaration declaration = discovery.declaration(name);
        if (declaration != null && declaration.kind() == Declaration.Kind.RESOURCE) {
          return getAtt(name, field);
        }
        if (declaration != null && declaration.kind() == Declaration.Kind.PARAMETER) {
          throw error(selector, "cannot select %s of parameter %s", field, name);
        }
      }
      Object base = eval(selector.getObject(), imports);
      if (base instanceof Map<?, ?> map) {
        if (map.get("Fn::GetAtt") instanceof List<?> getAtt && getAtt.size() == 2) {
          return getAtt(String.valueOf(getAtt.get(0)), getAtt.get(1) + "." + field);
        }
        return map.get(field);
      }
      throw error(selector, "cannot select %s of %s", field, describe(base));
    }

    @Nullable
    private Object evalCompositeLiteral(CompositeLiteral literal, ImportTable imports)
        throws ExtractionException {
      Expression type = literal.getType();
      String intrinsic = intrinsicShape(type, imports);
      if (intrinsic != null && INTRINSIC_FIELDS.containsKey(intrinsic)) {
        return evalIntrinsic(intrinsic, literal, imports);
      }
      if (type != null && type.kind() == Expression.Kind.ARRAY_TYPE) {
        return evalList(literal, imports);
      }
      if (type != null && type.kind() == Expression.Kind.MAP_TYPE
          || intrinsic != null && MAP_SHAPES.contains(intrinsic)) {
        return evalMap(literal, imports, false);
      }
      if (type == null && !literal.getElements().isEmpty() && !literal.isKeyed()) {
        return evalList(literal, imports);
      }
      return evalMap(literal, imports, true);
    }

    private ImmutableList<Object> evalList(CompositeLiteral literal, ImportTable imports)
        throws ExtractionException {
      ImmutableList.Builder<Object> list = ImmutableList.builder();
      for (CompositeLiteral.Element element : literal.getElements()) {
        if (element.isKeyed()) {
          throw error(element.getKey(), "indexed elements are not supported");
        }
        Object value = eval(element.getValue(), imports);
        if (value != null) {
          list.add(value);
        }
      }
      return list.build();
    }

    /**
     * Evaluates a keyed literal. In a struct, identifier keys are field names and zero values
     * are omitted; otherwise keys are evaluated.
     */
    private ImmutableMap<String, Object> evalMap(
        CompositeLiteral literal, ImportTable imports, boolean struct) throws ExtractionException {
      Map<String, Object> map = new LinkedHashMap<>();
      for (CompositeLiteral.Element element : literal.getElements()) {
        if (!element.isKeyed()) {
          throw error(element.getValue(), "expected key: value element");
        }
        String key;
        if (struct && element.getFieldName() != null) {
          key = element.getFieldName();
        } else {
          Object evaluated = eval(element.getKey(), imports);
          if (!(evaluated instanceof String || evaluated instanceof Number
              || evaluated instanceof Boolean)) {
            throw error(element.getKey(), "invalid map key %s", describe(evaluated));
          }
          key = String.valueOf(evaluated);
        }
        Object value = eval(element.getValue(), imports);
        if (value == null || struct && isZero(value)) {
          continue;
        }
        if (map.put(key, value) != null) {
          throw error(element.getKey(), "duplicate key %s", key);
        }
      }
      return ImmutableMap.copyOf(map);
    }

    private Object evalIntrinsic(String shape, CompositeLiteral literal, ImportTable imports)
        throws ExtractionException {
      Map<String, Expression> fields = intrinsicFields(shape, literal);
      switch (shape) {
        case "Ref":
          return ImmutableMap.of(
              "Ref", logicalName(required(shape, fields, literal, "LogicalName"), imports));
        case "GetAtt":
          return getAtt(
              logicalName(required(shape, fields, literal, "LogicalName"), imports),
              string(required(shape, fields, literal, "Attribute"), imports));
        case "Sub":
          return ImmutableMap.of(
              "Fn::Sub", string(required(shape, fields, literal, "String"), imports));
        case "SubWithMap":
          return ImmutableMap.of(
              "Fn::Sub",
              ImmutableList.of(
                  string(required(shape, fields, literal, "String"), imports),
                  optional(fields, "Variables", imports, ImmutableMap.of())));
        case "Join":
          return ImmutableMap.of(
              "Fn::Join",
              ImmutableList.of(
                  optional(fields, "Delimiter", imports, ""),
                  optional(fields, "Values", imports, ImmutableList.of())));
        case "Select":
          return ImmutableMap.of(
              "Fn::Select",
              ImmutableList.of(
                  optional(fields, "Index", imports, 0L),
                  value(shape, fields, literal, "List", imports)));
        case "GetAZs":
          return ImmutableMap.of("Fn::GetAZs", optional(fields, "Region", imports, ""));
        case "If":
          return ImmutableMap.of(
              "Fn::If",
              ImmutableList.of(
                  conditionName(required(shape, fields, literal, "Condition"), imports),
                  optional(fields, "ValueIfTrue", imports, NO_VALUE),
                  optional(fields, "ValueIfFalse", imports, NO_VALUE)));
        case "Equals":
          return ImmutableMap.of(
              "Fn::Equals",
              ImmutableList.of(
                  value(shape, fields, literal, "Value1", imports),
                  value(shape, fields, literal, "Value2", imports)));
        case "And":
        case "Or":
          return ImmutableMap.of(
              "Fn::" + shape, value(shape, fields, literal, "Conditions", imports));
        case "Not":
          return ImmutableMap.of(
              "Fn::Not", ImmutableList.of(value(shape, fields, literal, "Condition", imports)));
        case "Base64":
          return ImmutableMap.of("Fn::Base64", value(shape, fields, literal, "Value", imports));
        case "ImportValue":
          return ImmutableMap.of(
              "Fn::ImportValue", value(shape, fields, literal, "ExportName", imports));
        case "FindInMap":
          return ImmutableMap.of(
              "Fn::FindInMap",
              ImmutableList.of(
                  logicalName(required(shape, fields, literal, "MapName"), imports),
                  value(shape, fields, literal, "TopKey", imports),
                  value(shape, fields, literal, "SecondKey", imports)));
        case "Split":
          return ImmutableMap.of(
              "Fn::Split",
              ImmutableList.of(
                  optional(fields, "Delimiter", imports, ""),
                  value(shape, fields, literal, "Source", imports)));
        case "Cidr":
          return ImmutableMap.of(
              "Fn::Cidr",
              ImmutableList.of(
                  value(shape, fields, literal, "IPBlock", imports),
                  value(shape, fields, literal, "Count", imports),
                  value(shape, fields, literal, "CidrBits", imports)));
        case "Transform":
          return ImmutableMap.of(
              "Fn::Transform",
              ImmutableMap.of(
                  "Name", string(required(shape, fields, literal, "Name"), imports),
                  "Parameters", optional(fields, "Parameters", imports, ImmutableMap.of())));
        case "Condition":
          return ImmutableMap.of(
              "Condition", conditionName(required(shape, fields, literal, "Name"), imports));
        case "Tag":
          return ImmutableMap.of(
              "Key", value(shape, fields, literal, "Key", imports),
              "Value", optional(fields, "Value", imports, ""));
        default:
          throw new IllegalStateException(shape);
      }
    }

    /** Maps the elements of an intrinsic literal to field names, keyed or positionally. */
    private Map<String, Expression> intrinsicFields(String shape, CompositeLiteral literal)
        throws ExtractionException {
      ImmutableList<String> names = INTRINSIC_FIELDS.get(shape);
      Map<String, Expression> fields = new HashMap<>();
      List<CompositeLiteral.Element> elements = literal.getElements();
      if (literal.isKeyed()) {
        for (CompositeLiteral.Element element : elements) {
          String field = element.getFieldName();
          if (field == null) {
            throw error(element, "fields of %s must be named", shape);
          }
          if (!names.contains(field)) {
            throw error(element, "unknown field %s in %s", field, shape);
          }
          fields.put(field, element.getValue());
        }
        return fields;
      }
      if (elements.size() > names.size()) {
        throw error(literal, "too many values in %s", shape);
      }
      for (int i = 0; i < elements.size(); i++) {
        fields.put(names.get(i), elements.get(i).getValue());
      }
      return fields;
    }

    private Expression required(
        String shape, Map<String, Expression> fields, CompositeLiteral literal, String field)
        throws ExtractionException {
      Expression expr = fields.get(field);
      if (expr == null) {
        throw error(literal, "%s requires field %s", shape, field);
      }
      return expr;
    }

    private Object value(
        String shape,
        Map<String, Expression> fields,
        CompositeLiteral literal,
        String field,
        ImportTable imports)
        throws ExtractionException {
      Expression expr = required(shape, fields, literal, field);
      Object value = eval(expr, imports);
      if (value == null) {
        throw error(expr, "%s field %s has no value", shape, field);
      }
      return value;
    }

    private Object optional(
        Map<String, Expression> fields, String field, ImportTable imports, Object defaultValue)
        throws ExtractionException {
      Expression expr = fields.get(field);
      Object value = expr == null ? null : eval(expr, imports);
      return value == null ? defaultValue : value;
    }

    private String string(Expression expr, ImportTable imports) throws ExtractionException {
      Object value = eval(expr, imports);
      if (!(value instanceof String s)) {
        throw error(expr, "expected a string, got %s", describe(value));
      }
      return s;
    }

    /** Returns the name a {@code Ref} or {@code Fn::GetAtt} should carry for the expression. */
    private String logicalName(Expression expr, ImportTable imports) throws ExtractionException {
      if (expr instanceof Identifier id) {
        if (discovery.declaration(id.getName()) != null) {
          return id.getName();
        }
        String pseudo = reserved.pseudoParameter(id.getName());
        if (pseudo != null && !discovery.bindings().containsKey(id.getName())) {
          return pseudo;
        }
      }
      if (expr instanceof SelectorExpression selector
          && selector.getObject() instanceof Identifier object
          && imports.isIntrinsicNamespace(object.getName())) {
        String pseudo = reserved.pseudoParameter(selector.getField().getName());
        if (pseudo != null) {
          return pseudo;
        }
      }
      return string(expr, imports);
    }

    private String conditionName(Expression expr, ImportTable imports)
        throws ExtractionException {
      if (expr instanceof Identifier id) {
        Declaration declaration = discovery.declaration(id.getName());
        if (declaration != null && declaration.kind() == Declaration.Kind.CONDITION) {
          return id.getName();
        }
      }
      return string(expr, imports);
    }

    @Nullable
    private Object evalUnaryOperator(UnaryOperatorExpression unop, ImportTable imports)
        throws ExtractionException {
      Object x = eval(unop.getX(), imports);
      switch (unop.getOperator()) {
        case AMPERSAND:
          return x;
        case MINUS:
          if (x instanceof Long l) {
            return -l;
          }
          if (x instanceof Double d) {
            return -d;
          }
          break;
        case PLUS:
          if (x instanceof Long || x instanceof Double) {
            return x;
          }
          break;
        case EXCLAMATION:
          if (x instanceof Boolean b) {
            return !b;
          }
          break;
        default:
          break;
      }
      throw error(unop, "unsupported operation: %s%s", unop.getOperator(), describe(x));
    }

    private Object evalBinaryOperator(BinaryOperatorExpression binop, ImportTable imports)
        throws ExtractionException {
      Object x = eval(binop.getX(), imports);
      Object y = eval(binop.getY(), imports);
      TokenKind op = binop.getOperator();
      Object result = null;
      if (x instanceof String xs && y instanceof String ys) {
        result = foldStrings(op, xs, ys);
      } else if (x instanceof Long xl && y instanceof Long yl) {
        if ((op == TokenKind.SLASH || op == TokenKind.PERCENT) && yl == 0) {
          throw error(binop, "integer division by zero");
        }
        result = foldLongs(op, xl, yl);
      } else if (x instanceof Number xn && y instanceof Number yn) {
        if (op == TokenKind.SLASH && yn.doubleValue() == 0) {
          throw error(binop, "division by zero");
        }
        result = foldDoubles(op, xn.doubleValue(), yn.doubleValue());
        if (result instanceof Double d && !Double.isFinite(d)) {
          throw error(binop, "floating-point overflow");
        }
      } else if (x instanceof Boolean xb && y instanceof Boolean yb) {
        result = foldBooleans(op, xb, yb);
      }
      if (result == null) {
        throw error(binop, "unsupported operation: %s %s %s", describe(x), op, describe(y));
      }
      return result;
    }

    @Nullable
    private Object evalCall(CallExpression call, ImportTable imports)
        throws ExtractionException {
      String function = intrinsicShape(call.getFunction(), imports);
      if ("List".equals(function) || "Any".equals(function)) {
        ImmutableList.Builder<Object> list = ImmutableList.builder();
        for (Expression arg : call.getArguments()) {
          Object value = eval(arg, imports);
          if (value != null) {
            list.add(value);
          }
        }
        return list.build();
      }
      if ("Param".equals(function) && call.getArguments().size() == 1) {
        return ImmutableMap.of("Ref", string(call.getArguments().get(0), imports));
      }
      throw error(call, "unsupported call of %s", function != null ? function : "a function");
    }

    @Nullable
    private Object evalIndex(IndexExpression index, ImportTable imports)
        throws ExtractionException {
      Object object = eval(index.getObject(), imports);
      Object key = eval(index.getKey(), imports);
      if (object instanceof List<?> list && key instanceof Long i) {
        if (i < 0 || i >= list.size()) {
          throw error(index, "index %d out of range [0:%d]", i, list.size());
        }
        return list.get(i.intValue());
      }
      if (object instanceof Map<?, ?> map && key != null) {
        return map.get(String.valueOf(key));
      }
      throw error(index, "cannot index %s with %s", describe(object), describe(key));
    }

    /**
     * Returns the name of the intrinsic shape or function an expression refers to, or null.
     * Unqualified names count as intrinsic unless a binding of the scan has the same name.
     */
    @Nullable
    private String intrinsicShape(@Nullable Expression expr, ImportTable imports) {
      if (expr instanceof Identifier id) {
        return discovery.bindings().containsKey(id.getName()) ? null : id.getName();
      }
      if (expr instanceof SelectorExpression selector
          && selector.getObject() instanceof Identifier object
          && imports.isIntrinsicNamespace(object.getName())) {
        return selector.getField().getName();
      }
      return null;
    }
  }

  private static ImmutableMap<String, Object> getAtt(String resource, String attribute) {
    return ImmutableMap.of("Fn::GetAtt", ImmutableList.of(resource, attribute));
  }

  @Nullable
  private static Object foldStrings(TokenKind op, String x, String y) {
    switch (op) {
      case PLUS:
        return x + y;
      case EQUALS_EQUALS:
        return x.equals(y);
      case NOT_EQUALS:
        return !x.equals(y);
      default:
        return null;
    }
  }

  @Nullable
  private static Object foldLongs(TokenKind op, long x, long y) {
    switch (op) {
      case PLUS:
        return x + y;
      case MINUS:
        return x - y;
      case STAR:
        return x * y;
      case SLASH:
        return x / y;
      case PERCENT:
        return x % y;
      case LESS_LESS:
        return x << y;
      case GREATER_GREATER:
        return x >> y;
      default:
        return foldComparison(op, Long.compare(x, y));
    }
  }

  @Nullable
  private static Object foldDoubles(TokenKind op, double x, double y) {
    switch (op) {
      case PLUS:
        return x + y;
      case MINUS:
        return x - y;
      case STAR:
        return x * y;
      case SLASH:
        return x / y;
      default:
        return foldComparison(op, Double.compare(x, y));
    }
  }

  @Nullable
  private static Boolean foldComparison(TokenKind op, int cmp) {
    switch (op) {
      case EQUALS_EQUALS:
        return cmp == 0;
      case NOT_EQUALS:
        return cmp != 0;
      case LESS:
        return cmp < 0;
      case LESS_EQUALS:
        return cmp <= 0;
      case GREATER:
        return cmp > 0;
      case GREATER_EQUALS:
        return cmp >= 0;
      default:
        return null;
    }
  }

  @Nullable
  private static Boolean foldBooleans(TokenKind op, boolean x, boolean y) {
    switch (op) {
      case AMPERSAND_AMPERSAND:
        return x && y;
      case PIPE_PIPE:
        return x || y;
      case EQUALS_EQUALS:
        return x == y;
      case NOT_EQUALS:
        return x != y;
      default:
        return null;
    }
  }

  private static boolean isZero(Object value) {
    return value instanceof String s && s.isEmpty()
        || value instanceof List<?> list && list.isEmpty()
        || value instanceof Map<?, ?> map && map.isEmpty();
  }

  private static String describe(@Nullable Object value) {
    if (value == null) {
      return "nil";
    }
    if (value instanceof String) {
      return "string";
    }
    if (value instanceof Long) {
      return "int";
    }
    if (value instanceof Double) {
      return "float";
    }
    if (value instanceof Boolean) {
      return "bool";
    }
    return value instanceof List ? "list" : "map";
  }

  @FormatMethod
  private static ExtractionException error(Node node, String format, Object... args) {
    return new ExtractionException(node.getStartLocation() + ": " + String.format(format, args));
  }
}

package com.aiadvent.mcp.workflowgraph.extraction;

import com.aiadvent.mcp.workflowgraph.ast.SyntaxNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Node type names of the tree-sitter TypeScript grammar and lookups shared by extractors. */
final class TypeScriptNodes {

  static final String CALL_EXPRESSION = "call_expression";
  static final String MEMBER_EXPRESSION = "member_expression";
  static final String ARGUMENTS = "arguments";
  static final String OBJECT = "object";
  static final String PAIR = "pair";
  static final String SHORTHAND_PROPERTY = "shorthand_property_identifier";
  static final String SHORTHAND_PROPERTY_PATTERN = "shorthand_property_identifier_pattern";
  static final String METHOD_DEFINITION = "method_definition";
  static final String ARRAY = "array";
  static final String STRING = "string";
  static final String TEMPLATE_STRING = "template_string";
  static final String IDENTIFIER = "identifier";
  static final String IMPORT_STATEMENT = "import_statement";
  static final String IMPORT_CLAUSE = "import_clause";
  static final String IMPORT_SPECIFIER = "import_specifier";
  static final String NAMESPACE_IMPORT = "namespace_import";
  static final String VARIABLE_DECLARATOR = "variable_declarator";
  static final String FORMAL_PARAMETERS = "formal_parameters";
  static final String REQUIRED_PARAMETER = "required_parameter";
  static final String OPTIONAL_PARAMETER = "optional_parameter";
  static final String STATEMENT_BLOCK = "statement_block";
  static final String PROGRAM = "program";
  static final String IF_STATEMENT = "if_statement";
  static final String ELSE_CLAUSE = "else_clause";
  static final String RETURN_STATEMENT = "return_statement";
  static final String FOR_STATEMENT = "for_statement";
  static final String FOR_IN_STATEMENT = "for_in_statement";
  static final String WHILE_STATEMENT = "while_statement";
  static final String DO_STATEMENT = "do_statement";
  static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";

  static final Set<String> LOOP_TYPES =
      Set.of(FOR_STATEMENT, FOR_IN_STATEMENT, WHILE_STATEMENT, DO_STATEMENT);

  static final Set<String> FUNCTION_TYPES =
      Set.of("arrow_function", "function_expression", "function", METHOD_DEFINITION);

  private TypeScriptNodes() {}

  record MemberCallee(String object, String property) {}

  /** {@code a.b(...)} yields {@code (a, b)}; any other callee shape is empty. */
  static Optional<MemberCallee> memberCallee(SyntaxNode call) {
    if (!CALL_EXPRESSION.equals(call.type())) {
      return Optional.empty();
    }
    Optional<SyntaxNode> function = call.childForField("function");
    if (function.isEmpty()) {
      function = call.namedChild(0);
    }
    return function
        .filter(fn -> MEMBER_EXPRESSION.equals(fn.type()))
        .flatMap(TypeScriptNodes::member);
  }

  static Optional<MemberCallee> member(SyntaxNode memberExpression) {
    Optional<SyntaxNode> object = memberExpression.childForField("object");
    Optional<SyntaxNode> property = memberExpression.childForField("property");
    if (object.isEmpty() || property.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new MemberCallee(object.get().text(), property.get().text()));
  }

  static List<SyntaxNode> arguments(SyntaxNode call) {
    return call.childForField("arguments")
        .filter(args -> ARGUMENTS.equals(args.type()))
        .map(SyntaxNode::namedChildren)
        .orElse(List.of());
  }

  static Optional<SyntaxNode> firstArgument(SyntaxNode call) {
    List<SyntaxNode> args = arguments(call);
    return args.isEmpty() ? Optional.empty() : Optional.of(args.get(0));
  }

  static Optional<SyntaxNode> firstObjectArgument(SyntaxNode call) {
    return arguments(call).stream().filter(arg -> OBJECT.equals(arg.type())).findFirst();
  }

  /** Value node of {@code key: value} inside an object literal. */
  static Optional<SyntaxNode> propertyValue(SyntaxNode object, String key) {
    for (SyntaxNode property : object.namedChildren()) {
      if (!PAIR.equals(property.type())) {
        continue;
      }
      Optional<SyntaxNode> keyNode = property.childForField("key");
      if (keyNode.isPresent() && key.equals(stripQuotes(keyNode.get().text()))) {
        return property.childForField("value");
      }
    }
    return Optional.empty();
  }

  /** Top-level keys of an object literal, shorthand properties included. */
  static List<String> propertyKeys(SyntaxNode object) {
    List<String> keys = new ArrayList<>();
    for (SyntaxNode property : object.namedChildren()) {
      String type = property.type();
      if (PAIR.equals(type)) {
        property.childForField("key").ifPresent(key -> keys.add(stripQuotes(key.text())));
      } else if (SHORTHAND_PROPERTY.equals(type) || SHORTHAND_PROPERTY_PATTERN.equals(type)) {
        keys.add(property.text());
      }
    }
    return keys;
  }

  /** String or template literal content, otherwise empty. */
  static Optional<String> literalText(SyntaxNode value) {
    if (STRING.equals(value.type()) || TEMPLATE_STRING.equals(value.type())) {
      return Optional.of(stripQuotes(value.text()).trim());
    }
    return Optional.empty();
  }

  static List<String> stringArray(SyntaxNode value) {
    if (!ARRAY.equals(value.type())) {
      return List.of();
    }
    List<String> items = new ArrayList<>();
    for (SyntaxNode element : value.namedChildren()) {
      if (STRING.equals(element.type())) {
        items.add(stripQuotes(element.text()));
      }
    }
    return items;
  }

  static String stripQuotes(String text) {
    if (text == null || text.length() < 2) {
      return text;
    }
    char first = text.charAt(0);
    char last = text.charAt(text.length() - 1);
    if ((first == '"' || first == '\'' || first == '`') && first == last) {
      return text.substring(1, text.length() - 1);
    }
    return text;
  }

  /** Condition of an if/while/do statement without the surrounding parentheses. */
  static String conditionText(SyntaxNode statement) {
    return statement.childForField("condition").map(TypeScriptNodes::unwrapParentheses).orElse("?");
  }

  static String unwrapParentheses(SyntaxNode expression) {
    if (PARENTHESIZED_EXPRESSION.equals(expression.type())) {
      List<SyntaxNode> inner = expression.namedChildren();
      if (inner.size() == 1) {
        return inner.get(0).text().trim();
      }
    }
    return expression.text().trim();
  }
}

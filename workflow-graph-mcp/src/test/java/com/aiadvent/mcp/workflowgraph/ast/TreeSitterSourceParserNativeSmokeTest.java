package com.aiadvent.mcp.workflowgraph.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.aiadvent.mcp.workflowgraph.WorkflowGraphTestSupport;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TreeSitterSourceParserNativeSmokeTest {

  private TreeSitterSourceParser parser;

  @BeforeEach
  void setUp() {
    assumeTrue(
        WorkflowGraphTestSupport.grammarAvailable(),
        "tree-sitter TypeScript grammar not available");
    parser = new TreeSitterSourceParser(WorkflowGraphTestSupport.engine());
  }

  @Test
  void parsesTypeScriptWithNativeBinding() {
    ParsedSource parsed =
        parser.parse("import { a } from \"./a.js\";\nconst b: number = await ctx.run(a, {});\n");

    SyntaxNode root = parsed.root();
    assertThat(parsed.hasNativeTree()).isTrue();
    assertThat(parsed.hasError()).isFalse();
    assertThat(root.type()).isEqualTo("program");
    assertThat(root.namedChildren())
        .extracting(SyntaxNode::type)
        .containsExactly("import_statement", "lexical_declaration");

    SyntaxNode call = root.firstDescendantOfType("call_expression").orElseThrow();
    assertThat(call.text()).isEqualTo("ctx.run(a, {})");
    assertThat(call.startLine()).isEqualTo(2);
    assertThat(call.childForField("function").map(SyntaxNode::type)).contains("member_expression");
    assertThat(call.isDescendantOf(root)).isTrue();
    assertThat(root.contains(call)).isTrue();
  }

  @Test
  void wrappersOfTheSameNodeAreEqual() {
    SyntaxNode root = parser.parse("if (x) { y(); }").root();

    SyntaxNode viaSearch = root.firstDescendantOfType("if_statement").orElseThrow();
    SyntaxNode viaParent =
        root.firstDescendantOfType("statement_block").orElseThrow().parent().orElseThrow();

    assertThat(viaParent).isEqualTo(viaSearch);
    assertThat(viaParent.hashCode()).isEqualTo(viaSearch.hashCode());
  }

  @Test
  void offsetsAreBytesAndTextIsDecoded() {
    SyntaxNode root = parser.parse("const s = \"привет\";\nfoo(s);").root();

    SyntaxNode string = root.firstDescendantOfType("string").orElseThrow();
    SyntaxNode call = root.firstDescendantOfType("call_expression").orElseThrow();

    assertThat(string.text()).isEqualTo("\"привет\"");
    assertThat(string.endOffset() - string.startOffset()).isEqualTo(14);
    assertThat(call.text()).isEqualTo("foo(s)");
  }

  @Test
  void brokenSourceStillYieldsTree() {
    ParsedSource parsed = parser.parse("const x = foo(;\n");

    assertThat(parsed.hasError()).isTrue();
    assertThat(parsed.root().type()).isEqualTo("program");
  }

  @Test
  void commentsAreNotNamedChildren() {
    SyntaxNode root = parser.parse("// leading\nfoo();\n/* trailing */").root();

    List<SyntaxNode> named = root.namedChildren();
    assertThat(named).extracting(SyntaxNode::type).containsExactly("expression_statement");
    assertThat(root.children()).hasSizeGreaterThan(named.size());
  }

  @Test
  void nullSourceParsesAsEmptyProgram() {
    ParsedSource parsed = parser.parse(null);

    assertThat(parsed.root().namedChildren()).isEmpty();
  }
}

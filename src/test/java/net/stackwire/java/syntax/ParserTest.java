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
package net.stackwire.java.syntax;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the declaration file parser. */
@RunWith(JUnit4.class)
public class ParserTest {

  private static SourceFile parseFile(String... lines) {
    return SourceFile.parse(ParserInput.fromString(Joiner.on("\n").join(lines), "test.wire"));
  }

  private static Expression parseExpression(String source) throws SyntaxError.Exception {
    return SourceFile.parseExpression(ParserInput.fromString(source, "test.wire"));
  }

  private static List<String> errors(SourceFile file) {
    List<String> messages = new ArrayList<>();
    for (SyntaxError error : file.errors()) {
      messages.add(error.toString());
    }
    return messages;
  }

  private static BindingStatement.ValueSpec onlySpec(SourceFile file) {
    assertThat(file.getBindings()).hasSize(1);
    assertThat(file.getBindings().get(0).getSpecs()).hasSize(1);
    return file.getBindings().get(0).getSpecs().get(0);
  }

  @Test
  public void testPackageAndImports() {
    SourceFile file =
        parseFile(
            "package storage",
            "",
            "import (",
            "  . \"stackwire/intrinsics\"",
            "  \"stackwire/resources/s3\"",
            "  awsiam \"stackwire/resources/iam\"",
            "  _ \"side/effect\"",
            ")",
            "import \"single\"");
    assertThat(errors(file)).isEmpty();
    assertThat(file.getPackageName()).isEqualTo("storage");

    List<ImportDeclaration.ImportSpec> imports = file.getImports();
    assertThat(imports).hasSize(5);
    assertThat(imports.get(0).isDotImport()).isTrue();
    assertThat(imports.get(0).getPath().getValue()).isEqualTo("stackwire/intrinsics");
    assertThat(imports.get(1).getAlias()).isNull();
    assertThat(imports.get(1).getLocalName()).isEqualTo("s3");
    assertThat(imports.get(2).getLocalName()).isEqualTo("awsiam");
    assertThat(imports.get(3).isBlankImport()).isTrue();
    assertThat(imports.get(4).getLocalName()).isEqualTo("single");
  }

  @Test
  public void testCompositeLiteralBinding() {
    SourceFile file =
        parseFile(
            "var DataBucket = s3.Bucket{",
            "  BucketName: \"data\",",
            "  Tags: []any{Tag{Key: \"env\", Value: Env}},",
            "}");
    assertThat(errors(file)).isEmpty();
    BindingStatement.ValueSpec spec = onlySpec(file);
    assertThat(spec.getNames().get(0).getName()).isEqualTo("DataBucket");
    assertThat(spec.getNames().get(0).getStartLine()).isEqualTo(1);

    CompositeLiteral bucket = (CompositeLiteral) spec.getInitializer(0);
    assertThat(bucket.getType().toString()).isEqualTo("s3.Bucket");
    assertThat(bucket.isKeyed()).isTrue();
    assertThat(bucket.getElements()).hasSize(2);
    assertThat(bucket.getElements().get(0).getFieldName()).isEqualTo("BucketName");
    assertThat(((StringLiteral) bucket.getElements().get(0).getValue()).getValue())
        .isEqualTo("data");

    CompositeLiteral tags = (CompositeLiteral) bucket.getElements().get(1).getValue();
    assertThat(tags.getType().kind()).isEqualTo(Expression.Kind.ARRAY_TYPE);
    assertThat(tags.getType().toString()).isEqualTo("[]any");
    CompositeLiteral tag = (CompositeLiteral) tags.getElements().get(0).getValue();
    assertThat(tag.getType().toString()).isEqualTo("Tag");
    assertThat(tag.getElements().get(1).getValue().toString()).isEqualTo("Env");
  }

  @Test
  public void testGroupedBindings() {
    SourceFile file =
        parseFile(
            "var (",
            "  A = 1",
            "  B, C = \"b\", \"c\"",
            "  D, E = pair()",
            "  F string",
            ")",
            "const Prefix = \"app\"");
    assertThat(errors(file)).isEmpty();
    assertThat(file.getBindings()).hasSize(2);

    BindingStatement vars = file.getBindings().get(0);
    assertThat(vars.isConst()).isFalse();
    assertThat(vars.getSpecs()).hasSize(4);
    assertThat(vars.getSpecs().get(1).getInitializer(1).toString()).isEqualTo("\"c\"");
    assertThat(vars.getSpecs().get(2).getInitializer(0)).isNull();
    assertThat(vars.getSpecs().get(3).getType().toString()).isEqualTo("string");
    assertThat(vars.getSpecs().get(3).getInitializer(0)).isNull();

    BindingStatement consts = file.getBindings().get(1);
    assertThat(consts.isConst()).isTrue();
    assertThat(consts.getKeyword()).isEqualTo(TokenKind.CONST);
  }

  @Test
  public void testFunctionAndTypeDeclarationsAreSkipped() {
    SourceFile file =
        parseFile(
            "func helper(a, b string) string {",
            "  return a + b",
            "}",
            "type T struct {",
            "  Name string",
            "}",
            "var X = T{Name: \"x\"}");
    assertThat(errors(file)).isEmpty();
    assertThat(onlySpec(file).getNames().get(0).getName()).isEqualTo("X");
  }

  @Test
  public void testBinaryPrecedence() throws Exception {
    BinaryOperatorExpression e = (BinaryOperatorExpression) parseExpression("1 + 2 * 3 == 7");
    assertThat(e.getOperator()).isEqualTo(TokenKind.EQUALS_EQUALS);
    BinaryOperatorExpression sum = (BinaryOperatorExpression) e.getX();
    assertThat(sum.getOperator()).isEqualTo(TokenKind.PLUS);
    assertThat(sum.getY().kind()).isEqualTo(Expression.Kind.BINARY_OPERATOR);
    assertThat(sum.getY().toString()).isEqualTo("2 * 3");
  }

  @Test
  public void testLeftAssociativity() throws Exception {
    BinaryOperatorExpression e = (BinaryOperatorExpression) parseExpression("a - b - c");
    assertThat(e.getX().toString()).isEqualTo("a - b");
    assertThat(e.getY().toString()).isEqualTo("c");
  }

  @Test
  public void testSelectorsAndUnaryOperators() throws Exception {
    Expression e = parseExpression("Role.Outputs.Arn");
    assertThat(e.kind()).isEqualTo(Expression.Kind.SELECTOR);
    assertThat(((SelectorExpression) e).getObject().toString()).isEqualTo("Role.Outputs");

    UnaryOperatorExpression ref = (UnaryOperatorExpression) parseExpression("&s3.Bucket{}");
    assertThat(ref.getOperator()).isEqualTo(TokenKind.AMPERSAND);
    assertThat(ref.getX().kind()).isEqualTo(Expression.Kind.COMPOSITE_LITERAL);

    UnaryOperatorExpression neg = (UnaryOperatorExpression) parseExpression("-5");
    assertThat(neg.getOperator()).isEqualTo(TokenKind.MINUS);
    assertThat(((IntLiteral) neg.getX()).getValue()).isEqualTo(5L);
  }

  @Test
  public void testMapAndUntypedLiterals() throws Exception {
    CompositeLiteral map =
        (CompositeLiteral) parseExpression("map[string]any{\"us-east-1\": {\"AMI\": \"ami-1\"}}");
    assertThat(map.getType().kind()).isEqualTo(Expression.Kind.MAP_TYPE);
    assertThat(map.getType().toString()).isEqualTo("map[string]any");
    CompositeLiteral inner = (CompositeLiteral) map.getElements().get(0).getValue();
    assertThat(inner.getType()).isNull();
    assertThat(inner.getElements().get(0).getFieldName()).isNull();

    CompositeLiteral list = (CompositeLiteral) parseExpression("[]interface{}{1, 2.5}");
    assertThat(list.getType().toString()).isEqualTo("[]any");
    assertThat(list.isKeyed()).isFalse();
  }

  @Test
  public void testCallsIndexesAndSlices() throws Exception {
    CallExpression call = (CallExpression) parseExpression("List(a, rest...)");
    assertThat(call.getFunction().toString()).isEqualTo("List");
    assertThat(call.getArguments()).hasSize(2);

    IndexExpression index = (IndexExpression) parseExpression("zones[0]");
    assertThat(index.getObject().toString()).isEqualTo("zones");

    SliceExpression slice = (SliceExpression) parseExpression("zones[1:]");
    assertThat(slice.getHi()).isNull();
    assertThat(slice.getLo().toString()).isEqualTo("1");
  }

  @Test
  public void testFunctionLiteralIsOpaque() throws Exception {
    Expression e = parseExpression("func(x int) (string, error) { return \"\", nil }");
    assertThat(e.kind()).isEqualTo(Expression.Kind.FUNCTION_LITERAL);
  }

  @Test
  public void testSyntaxErrorLocation() {
    SourceFile file = parseFile("var = 1");
    assertThat(file.ok()).isFalse();
    assertThat(errors(file))
        .containsExactly("test.wire:1:5: syntax error at '=': expected identifier");
  }

  @Test
  public void testErrorsAreCapped() {
    SourceFile file = parseFile("1", "2", "3", "4", "5", "6", "7", "8");
    assertThat(file.errors()).hasSize(5);
    assertThat(file.errors().get(0).message())
        .isEqualTo("syntax error at '1': expected declaration");
  }

  @Test
  public void testParseExpressionReportsErrors() {
    SyntaxError.Exception e =
        assertThrows(SyntaxError.Exception.class, () -> parseExpression("1 +"));
    assertThat(e.errors().get(0).message()).contains("expected expression");
  }
}

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
package net.stackwire.java.discover;

import static com.google.common.truth.Truth.assertThat;

import net.stackwire.java.config.ReservedIdentifiers;
import net.stackwire.java.syntax.CompositeLiteral;
import net.stackwire.java.syntax.ParserInput;
import net.stackwire.java.syntax.SourceFile;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ReferenceExtractorTest {

  private ReservedIdentifiers reserved;
  private ImportTable imports;

  @Before
  public void setUp() throws Exception {
    reserved = ReservedIdentifiers.loadDefault();
    imports =
        ImportTable.of(
            SourceFile.parse(
                    ParserInput.fromLines(
                        "import (",
                        "  . \"stackwire/intrinsics\"",
                        "  \"stackwire/resources/s3\"",
                        ")"))
                .getImports());
  }

  private ReferenceExtractor.Extraction extract(String literal) throws Exception {
    CompositeLiteral node =
        (CompositeLiteral) SourceFile.parseExpression(ParserInput.fromString(literal, "t.wire"));
    return ReferenceExtractor.extract(node, imports, reserved);
  }

  @Test
  public void testIdentifiersAndSelectors() throws Exception {
    ReferenceExtractor.Extraction refs =
        extract(
            "s3.Function{Role: ExecRole.Arn, Environment: Env, Code: DataBucket,"
                + " Name: \"fn\", Timeout: Base + 1}");
    assertThat(refs.dependencies()).containsExactly("ExecRole", "Env", "DataBucket").inOrder();
    assertThat(refs.variableReferences().attributeReferences())
        .containsExactly(AttributeReference.create("ExecRole", "Arn", "Role"));
    assertThat(refs.variableReferences().fieldReferences())
        .containsExactly("Environment", "Env", "Code", "DataBucket")
        .inOrder();
  }

  @Test
  public void testSkipsReservedLowercaseAndImports() throws Exception {
    ReferenceExtractor.Extraction refs =
        extract(
            "s3.Bucket{Region: AWS_REGION, Versioned: true, Name: local, Kind: s3.Other,"
                + " Value: Sub{\"x\"}}");
    assertThat(refs.dependencies()).isEmpty();
    assertThat(refs.variableReferences().fieldReferences()).isEmpty();
  }

  @Test
  public void testNestedPathsThroughStringKeys() throws Exception {
    ReferenceExtractor.Extraction refs =
        extract(
            "s3.Function{Environment: s3.Function_Environment{"
                + "Variables: map[string]any{\"ROLE\": ExecRole.Arn}}}");
    assertThat(refs.dependencies()).containsExactly("ExecRole");
    assertThat(refs.variableReferences().attributeReferences())
        .containsExactly(
            AttributeReference.create("ExecRole", "Arn", "Environment.Variables.ROLE"));
  }

  @Test
  public void testPositionalElementsKeepPath() throws Exception {
    ReferenceExtractor.Extraction refs =
        extract("s3.Topic{Subscriptions: []any{QueueA.Arn, QueueB}}");
    assertThat(refs.dependencies()).containsExactly("QueueA", "QueueB").inOrder();
    assertThat(refs.variableReferences().attributeReferences())
        .containsExactly(AttributeReference.create("QueueA", "Arn", "Subscriptions"));
    assertThat(refs.variableReferences().fieldReferences())
        .containsExactly("Subscriptions", "QueueB");
  }

  @Test
  public void testCallArgumentsWalked() throws Exception {
    ReferenceExtractor.Extraction refs = extract("s3.Bucket{Tags: List(Shared)}");
    assertThat(refs.dependencies()).containsExactly("Shared");
  }
}

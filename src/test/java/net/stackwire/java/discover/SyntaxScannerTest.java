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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import net.stackwire.java.config.ReservedIdentifiers;
import net.stackwire.java.config.ShapeRegistry;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SyntaxScannerTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private ShapeRegistry registry;
  private ReservedIdentifiers reserved;

  @Before
  public void setUp() throws Exception {
    registry = ShapeRegistry.loadDefault();
    reserved = ReservedIdentifiers.loadDefault();
  }

  private Path writeFile(String relative, String... lines) throws IOException {
    Path path = tmp.getRoot().toPath().resolve(relative);
    Files.createDirectories(path.getParent());
    Files.write(path, Joiner.on("\n").join(lines).getBytes(StandardCharsets.UTF_8));
    return path;
  }

  private Discovery scan(ScanOptions options, SourceRoot... roots) throws Exception {
    return new SyntaxScanner(registry, reserved, options).scan(ImmutableList.copyOf(roots));
  }

  private Discovery scan(SourceRoot... roots) throws Exception {
    return scan(ScanOptions.DEFAULT, roots);
  }

  private SourceRoot root(String relative, boolean recursive) {
    return SourceRoot.create(tmp.getRoot().toPath().resolve(relative), recursive);
  }

  @Test
  public void testClassification() throws Exception {
    Path file =
        writeFile(
            "app/app.wire",
            "package app",
            "",
            "import (",
            "  . \"stackwire/intrinsics\"",
            "  \"stackwire/resources/s3\"",
            "  awsiam \"stackwire/resources/iam\"",
            "  \"stackwire/resources/serverless\"",
            ")",
            "",
            "var Env = Parameter{Type: \"String\", Default: \"dev\"}",
            "",
            "var DataBucket = s3.Bucket{BucketName: \"data\"}",
            "",
            "var ExecRole = awsiam.Role{RoleName: \"exec\"}",
            "",
            "var Handler = serverless.Function{",
            "  Role: ExecRole.Arn,",
            "  Environment: serverless.Function_Environment{",
            "    Variables: map[string]any{\"BUCKET\": DataBucket.Arn},",
            "  },",
            "}",
            "",
            "var BucketArn = Output{Value: DataBucket.Arn}",
            "var IsProd = Equals{Env, \"prod\"}",
            "var Regions = Mapping{}",
            "var Versioning = s3.Bucket_VersioningConfiguration{Status: \"Enabled\"}",
            "const suffix = \"-x\"");
    Discovery discovery = scan(root("app", false));

    assertThat(discovery.errors()).isEmpty();
    assertThat(discovery.ok()).isTrue();
    assertThat(discovery.resources().keySet())
        .containsExactly("DataBucket", "ExecRole", "Handler")
        .inOrder();
    assertThat(discovery.parameters().keySet()).containsExactly("Env");
    assertThat(discovery.outputs().keySet()).containsExactly("BucketArn");
    assertThat(discovery.conditions().keySet()).containsExactly("IsProd");
    assertThat(discovery.mappings().keySet()).containsExactly("Regions");
    assertThat(discovery.allBindings()).containsAtLeast("Versioning", "suffix");
    assertThat(discovery.declaration("Versioning")).isNull();

    Declaration bucket = discovery.resources().get("DataBucket");
    assertThat(bucket.shape().toString()).isEqualTo("s3.Bucket");
    assertThat(bucket.file()).isEqualTo(file.toString());
    assertThat(bucket.line()).isEqualTo(12);

    assertThat(discovery.resources().get("ExecRole").shape().namespace()).isEqualTo("iam");

    Declaration handler = discovery.declaration("Handler");
    assertThat(handler.kind()).isEqualTo(Declaration.Kind.RESOURCE);
    assertThat(handler.dependencies()).containsExactly("ExecRole", "DataBucket").inOrder();
    assertThat(handler.attributeReferences())
        .containsExactly(
            AttributeReference.create("ExecRole", "Arn", "Role"),
            AttributeReference.create("DataBucket", "Arn", "Environment.Variables.BUCKET"))
        .inOrder();
  }

  @Test
  public void testIndirectAttributeReferences() throws Exception {
    writeFile(
        "app/app.wire",
        "import \"stackwire/resources/serverless\"",
        "import \"stackwire/resources/iam\"",
        "var ExecRole = iam.Role{}",
        "var Env = serverless.Function_Environment{",
        "  Variables: map[string]any{\"ROLE\": ExecRole.Arn},",
        "}",
        "var Handler = serverless.Function{Environment: Env}");
    Discovery discovery = scan(root("app", false));

    assertThat(discovery.ok()).isTrue();
    assertThat(discovery.resources().get("Handler").dependencies()).containsExactly("Env");
    assertThat(discovery.variableReferences().get("Handler").fieldReferences())
        .containsExactly("Environment", "Env");
    assertThat(discovery.resolveAttributeReferences("Handler"))
        .containsExactly(
            AttributeReference.create("ExecRole", "Arn", "Environment.Variables.ROLE"));
  }

  @Test
  public void testUndefinedReference() throws Exception {
    Path file =
        writeFile(
            "app/app.wire",
            "import \"stackwire/resources/s3\"",
            "var Data = s3.Bucket{Policy: Foo.Arn}");
    Discovery discovery = scan(root("app", false));

    assertThat(discovery.ok()).isFalse();
    assertThat(discovery.errors()).hasSize(1);
    assertThat(discovery.errors().get(0).toString())
        .isEqualTo(file + ":2: Data references undefined resource \"Foo\"");
  }

  @Test
  public void testRedeclaration() throws Exception {
    Path first =
        writeFile("app/a.wire", "import \"stackwire/resources/s3\"", "var Data = s3.Bucket{}");
    Path second =
        writeFile("app/b.wire", "import \"stackwire/resources/s3\"", "", "var Data = s3.Bucket{}");
    Discovery discovery = scan(root("app", false));

    assertThat(discovery.resources()).hasSize(1);
    assertThat(discovery.resources().get("Data").file()).isEqualTo(first.toString());
    assertThat(discovery.errors()).hasSize(1);
    assertThat(discovery.errors().get(0).toString())
        .isEqualTo(second + ":3: Data redeclared (previous declaration at " + first + ":2)");
  }

  @Test
  public void testParseFailureAbortsOnlyItsRoot() throws Exception {
    writeFile("bad/broken.wire", "var = 1");
    writeFile("bad/fine.wire", "import \"stackwire/resources/s3\"", "var Lost = s3.Bucket{}");
    writeFile("good/app.wire", "import \"stackwire/resources/s3\"", "var Kept = s3.Bucket{}");
    SourceRoot bad = root("bad", false);
    Discovery discovery = scan(bad, root("good", false));

    assertThat(discovery.ok()).isFalse();
    assertThat(discovery.errors()).isEmpty();
    assertThat(discovery.resources().keySet()).containsExactly("Kept");
    assertThat(discovery.scanFailures()).hasSize(1);
    ScanException failure = discovery.scanFailures().get(0);
    assertThat(failure.root()).isEqualTo(bad);
    assertThat(failure.syntaxErrors()).isNotEmpty();
    assertThat(failure).hasMessageThat().startsWith(bad + ": ");
    assertThat(failure).hasMessageThat().contains("expected identifier");
  }

  @Test
  public void testMissingRoot() throws Exception {
    Discovery discovery = scan(root("absent", false));
    assertThat(discovery.scanFailures()).hasSize(1);
    assertThat(discovery.scanFailures().get(0)).hasMessageThat().endsWith("is not a directory");
  }

  @Test
  public void testRecursiveRootsAndSkippedFiles() throws Exception {
    writeFile("infra/top.wire", "import \"stackwire/resources/s3\"", "var Top = s3.Bucket{}");
    writeFile("infra/sub/deep.wire", "import \"stackwire/resources/s3\"", "var Deep = s3.Bucket{}");
    writeFile("infra/sub/deep_test.wire", "var Ignored = 1");
    writeFile("infra/notes.txt", "var Text = 1");

    assertThat(scan(root("infra", false)).allBindings()).containsExactly("Top");
    assertThat(scan(root("infra", true)).allBindings()).containsExactly("Deep", "Top");
  }

  @Test
  public void testOverlappingRootsScanFilesOnce() throws Exception {
    writeFile("infra/sub/deep.wire", "import \"stackwire/resources/s3\"", "var Deep = s3.Bucket{}");
    Discovery discovery = scan(root("infra", true), root("infra/sub", false));
    assertThat(discovery.ok()).isTrue();
    assertThat(discovery.resources().keySet()).containsExactly("Deep");
  }

  @Test
  public void testConcurrentRootsMergeInRootOrder() throws Exception {
    writeFile("one/a.wire", "import \"stackwire/resources/s3\"", "var First = s3.Bucket{}");
    writeFile("two/a.wire", "import \"stackwire/resources/s3\"", "var Second = s3.Bucket{}");
    writeFile("three/a.wire", "import \"stackwire/resources/s3\"", "var Third = s3.Bucket{}");
    Discovery discovery =
        scan(
            ScanOptions.builder().parallelism(3).build(),
            root("three", false),
            root("one", false),
            root("two", false));
    assertThat(discovery.resources().keySet())
        .containsExactly("Third", "First", "Second")
        .inOrder();
  }

  @Test
  public void testRootPatterns() {
    SourceRoot recursive = SourceRoot.parse("infra/...");
    assertThat(recursive.recursive()).isTrue();
    assertThat(recursive.path().toString()).isEqualTo("infra");
    assertThat(recursive.toString()).isEqualTo("infra/...");

    SourceRoot plain = SourceRoot.parse("infra");
    assertThat(plain.recursive()).isFalse();
    assertThat(plain.toString()).isEqualTo("infra");
  }
}

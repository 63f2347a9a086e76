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
package net.stackwire.java.pipeline;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Resources;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import net.stackwire.java.config.ReservedIdentifiers;
import net.stackwire.java.config.ShapeRegistry;
import net.stackwire.java.discover.AttributeReference;
import net.stackwire.java.discover.Discovery;
import net.stackwire.java.discover.ScanOptions;
import net.stackwire.java.discover.SourceRoot;
import net.stackwire.java.discover.SyntaxScanner;
import net.stackwire.java.extract.ExtractionException;
import net.stackwire.java.template.BuildException;
import net.stackwire.java.template.Template;
import net.stackwire.java.template.TemplateCodec;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class StackCompilerTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private ShapeRegistry registry;
  private ReservedIdentifiers reserved;

  @Before
  public void setUp() throws Exception {
    registry = ShapeRegistry.loadDefault();
    reserved = ReservedIdentifiers.loadDefault();
  }

  private static SourceRoot storageFixture() throws Exception {
    return SourceRoot.create(
        Paths.get(Resources.getResource(StackCompilerTest.class, "storage").toURI()), false);
  }

  private SourceRoot writeRoot(String dir, String... lines) throws Exception {
    Path root = tmp.newFolder(dir).toPath();
    Files.write(root.resolve("app.wire"), Joiner.on("\n").join(lines).getBytes(UTF_8));
    return SourceRoot.create(root, false);
  }

  @Test
  public void testStorageStack() throws Exception {
    BuildResult result = StackCompiler.create().compile(ImmutableList.of(storageFixture()));

    assertThat(result.errors()).isEmpty();
    assertThat(result.success()).isTrue();
    assertThat(result.resources()).containsExactly("DataBucket", "ExecRole", "Handler").inOrder();
    String expected =
        Resources.toString(Resources.getResource(StackCompilerTest.class, "storage.json"), UTF_8);
    assertThat(TemplateCodec.toJson(result.template())).isEqualTo(expected);
  }

  @Test
  public void testStorageStackYamlMatchesJson() throws Exception {
    Template template =
        StackCompiler.create().compile(ImmutableList.of(storageFixture())).template();
    String yaml = TemplateCodec.encode(template, TemplateCodec.Format.YAML);
    assertThat(TemplateCodec.decode(yaml, TemplateCodec.Format.YAML)).isEqualTo(template);
  }

  @Test
  public void testStorageAttributeReferences() throws Exception {
    Discovery discovery =
        new SyntaxScanner(registry, reserved, ScanOptions.DEFAULT)
            .scan(ImmutableList.of(storageFixture()));
    assertThat(discovery.resolveAttributeReferences("Handler"))
        .containsExactly(
            AttributeReference.create("ExecRole", "Arn", "Role"),
            AttributeReference.create("DataBucket", "Arn", "Environment.Variables.BUCKET"));
  }

  @Test
  public void testDiscoveryErrorsPreventBuild() throws Exception {
    SourceRoot root =
        writeRoot(
            "undefined",
            "import \"stackwire/resources/s3\"",
            "var Data = s3.Bucket{Policy: Foo.Arn}");
    BuildResult result = StackCompiler.create().compile(ImmutableList.of(root));

    assertThat(result.success()).isFalse();
    assertThat(result.template()).isNull();
    assertThat(result.resources()).isEmpty();
    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0)).endsWith(":2: Data references undefined resource \"Foo\"");
    assertThat(result.toJson()).startsWith("{\n  \"success\": false,\n  \"errors\": [\n");
  }

  @Test
  public void testScanFailureReported() throws Exception {
    SourceRoot root = writeRoot("broken", "var = 1");
    BuildResult result = StackCompiler.create().compile(ImmutableList.of(root));
    assertThat(result.success()).isFalse();
    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0)).startsWith(root + ": ");
  }

  @Test
  public void testCycleReported() throws Exception {
    SourceRoot root =
        writeRoot(
            "cycle",
            "import \"stackwire/resources/s3\"",
            "var A = s3.Bucket{Name: B.Arn}",
            "var B = s3.Bucket{Name: A.Arn}");
    BuildResult result = StackCompiler.create().compile(ImmutableList.of(root));
    assertThat(result.success()).isFalse();
    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0)).startsWith("circular dependency detected:\n  A (");
  }

  @Test
  public void testExtractionFailure() throws Exception {
    SourceRoot root =
        writeRoot("app", "import \"stackwire/resources/s3\"", "var Data = s3.Bucket{}");
    StackCompiler compiler =
        new StackCompiler(
            registry,
            reserved,
            ScanOptions.DEFAULT,
            discovery ->
                sites -> {
                  throw new ExtractionException("extractor unavailable");
                });
    Discovery discovery =
        new SyntaxScanner(registry, reserved, ScanOptions.DEFAULT).scan(ImmutableList.of(root));

    BuildException e = assertThrows(BuildException.class, () -> compiler.build(discovery));
    assertThat(e.kind()).isEqualTo(BuildException.Kind.VALUE_EXTRACTION);
    assertThat(e).hasMessageThat().isEqualTo("extracting values: extractor unavailable");

    BuildResult result = compiler.compile(discovery);
    assertThat(result.success()).isFalse();
    assertThat(result.errors()).containsExactly("extracting values: extractor unavailable");
  }

  @Test
  public void testInjectedValues() throws Exception {
    SourceRoot root =
        writeRoot("app", "import \"stackwire/resources/s3\"", "var Data = s3.Bucket{}");
    StackCompiler compiler =
        new StackCompiler(
            registry,
            reserved,
            ScanOptions.DEFAULT,
            discovery ->
                sites ->
                    ImmutableMap.of(
                        "Data",
                        ImmutableMap.of("BucketName", "injected")));
    BuildResult result = compiler.compile(ImmutableList.of(root));
    assertThat(result.success()).isTrue();
    assertThat(result.template().resources().get("Data").properties())
        .containsExactly("BucketName", "injected");
    assertThat(result.toJson())
        .startsWith("{\n  \"success\": true,\n  \"template\": {\n    \"AWSTemplateFormatVersion\"");
    assertThat(result.toJson()).contains("\"resources\": [\n    \"Data\"\n  ]");
  }

  @Test
  public void testBuildRequiresCleanScan() throws Exception {
    SourceRoot root = writeRoot("broken", "var = 1");
    Discovery discovery =
        new SyntaxScanner(registry, reserved, ScanOptions.DEFAULT).scan(ImmutableList.of(root));
    assertThrows(
        IllegalArgumentException.class, () -> StackCompiler.create().build(discovery));
  }
}

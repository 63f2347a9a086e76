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
package net.stackwire.java.template;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TemplateCodecTest {

  private static Template richTemplate() {
    return Template.builder()
        .formatVersion("2010-09-09")
        .transform("AWS::Serverless-2016-10-31")
        .description("demo stack")
        .parameters(
            ImmutableMap.of(
                "Env",
                ParameterDefinition.builder()
                    .description("deployment stage")
                    .defaultValue("dev")
                    .allowedValues(ImmutableList.of("dev", "prod"))
                    .minLength(1L)
                    .maxValue(10.0)
                    .noEcho(true)
                    .build()))
        .mappings(
            ImmutableMap.of(
                "RegionMap",
                ImmutableMap.of("us-east-1", ImmutableMap.of("Ami", "ami-12345678"))))
        .conditions(
            ImmutableMap.of(
                "IsProd",
                ImmutableMap.of(
                    "Fn::Equals", ImmutableList.of(ImmutableMap.of("Ref", "Env"), "prod"))))
        .resources(
            ImmutableMap.of(
                "Data",
                ResourceDefinition.create(
                    "AWS::S3::Bucket",
                    ImmutableMap.of(
                        "BucketName", "data",
                        "Count", 3L,
                        "Ratio", 0.5,
                        "Versioned", true)),
                "Handler",
                ResourceDefinition.create("AWS::Serverless::Function", ImmutableMap.of())))
        .outputs(
            ImmutableMap.of(
                "DataArn",
                OutputDefinition.create(
                    "bucket arn",
                    ImmutableMap.of("Fn::GetAtt", ImmutableList.of("Data", "Arn")),
                    ImmutableMap.of("Fn::Sub", "${AWS::StackName}-data-arn"))))
        .build();
  }

  @Test
  public void testJsonText() {
    Template template =
        Template.builder()
            .formatVersion("2010-09-09")
            .resources(
                ImmutableMap.of(
                    "Data",
                    ResourceDefinition.create(
                        "AWS::S3::Bucket", ImmutableMap.of("BucketName", "a<b"))))
            .build();
    assertThat(TemplateCodec.toJson(template))
        .isEqualTo(
            "{\n"
                + "  \"AWSTemplateFormatVersion\": \"2010-09-09\",\n"
                + "  \"Resources\": {\n"
                + "    \"Data\": {\n"
                + "      \"Type\": \"AWS::S3::Bucket\",\n"
                + "      \"Properties\": {\n"
                + "        \"BucketName\": \"a<b\"\n"
                + "      }\n"
                + "    }\n"
                + "  }\n"
                + "}\n");
  }

  @Test
  public void testSectionOrder() {
    assertThat(richTemplate().toMap().keySet())
        .containsExactly(
            "AWSTemplateFormatVersion",
            "Transform",
            "Description",
            "Parameters",
            "Mappings",
            "Conditions",
            "Resources",
            "Outputs")
        .inOrder();
  }

  @Test
  public void testEmptyTemplateKeepsResources() {
    Template template = Template.builder().formatVersion("2010-09-09").build();
    assertThat(template.toMap())
        .containsExactly("AWSTemplateFormatVersion", "2010-09-09", "Resources", ImmutableMap.of())
        .inOrder();
  }

  @Test
  public void testJsonRoundTrip() throws Exception {
    Template template = richTemplate();
    String json = TemplateCodec.encode(template, TemplateCodec.Format.JSON);
    assertThat(TemplateCodec.decode(json, TemplateCodec.Format.JSON)).isEqualTo(template);
    assertThat(TemplateCodec.toJson(template)).isEqualTo(json);
  }

  @Test
  public void testYamlRoundTrip() throws Exception {
    Template template = richTemplate();
    String yaml = TemplateCodec.encode(template, TemplateCodec.Format.YAML);
    assertThat(yaml).startsWith("AWSTemplateFormatVersion: ");
    assertThat(TemplateCodec.decode(yaml, TemplateCodec.Format.YAML)).isEqualTo(template);
  }

  @Test
  public void testYamlHasNoAliases() {
    ImmutableMap<String, Object> shared = ImmutableMap.of("BucketName", "same");
    Template template =
        Template.builder()
            .formatVersion("2010-09-09")
            .resources(
                ImmutableMap.of(
                    "A", ResourceDefinition.create("AWS::S3::Bucket", shared),
                    "B", ResourceDefinition.create("AWS::S3::Bucket", shared)))
            .build();
    String yaml = TemplateCodec.toYaml(template);
    assertThat(yaml).doesNotContain("&id");
    assertThat(yaml).doesNotContain("*id");
  }

  @Test
  public void testExportNameOverridesExport() throws Exception {
    Template template =
        TemplateCodec.fromJson(
            "{\"AWSTemplateFormatVersion\": \"2010-09-09\", \"Resources\": {},"
                + " \"Outputs\": {\"Out\": {\"Value\": 1, \"Export\": {\"Name\": \"old\"},"
                + " \"ExportName\": \"new\"}}}");
    OutputDefinition out = template.outputs().get("Out");
    assertThat(out.value()).isEqualTo(1L);
    assertThat(out.exportName()).isEqualTo("new");
  }

  @Test
  public void testDecodeErrors() {
    assertDecodeError("[1]", "template must be a mapping");
    assertDecodeError("{\"Resources\": {}}", "template has no AWSTemplateFormatVersion");
    assertDecodeError(
        "{\"AWSTemplateFormatVersion\": \"x\", \"Resources\": {\"Data\": {}}}",
        "resource Data has no Type");
    assertDecodeError(
        "{\"AWSTemplateFormatVersion\": \"x\", \"Resources\": []}", "Resources must be a mapping");
    assertDecodeError(
        "{\"AWSTemplateFormatVersion\": \"x\","
            + " \"Resources\": {\"Data\": {\"Type\": \"T\", \"Properties\": 1}}}",
        "properties of Data must be a mapping");

    TemplateCodec.FormatException e =
        assertThrows(TemplateCodec.FormatException.class, () -> TemplateCodec.fromJson("{"));
    assertThat(e).hasMessageThat().startsWith("malformed JSON template: ");
    e = assertThrows(TemplateCodec.FormatException.class, () -> TemplateCodec.fromYaml("a: ["));
    assertThat(e).hasMessageThat().startsWith("malformed YAML template: ");
  }

  private static void assertDecodeError(String json, String message) {
    TemplateCodec.FormatException e =
        assertThrows(TemplateCodec.FormatException.class, () -> TemplateCodec.fromJson(json));
    assertThat(e).hasMessageThat().isEqualTo(message);
  }

  @Test
  public void testFormatParse() {
    assertThat(TemplateCodec.Format.parse("yaml")).isEqualTo(TemplateCodec.Format.YAML);
    assertThat(TemplateCodec.Format.parse("JSON")).isEqualTo(TemplateCodec.Format.JSON);
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> TemplateCodec.Format.parse("xml"));
    assertThat(e).hasMessageThat().isEqualTo("unknown template format: xml");
  }
}

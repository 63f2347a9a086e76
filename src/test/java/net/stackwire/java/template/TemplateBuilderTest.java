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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.stackwire.java.config.ShapeRegistry;
import net.stackwire.java.discover.Declaration;
import net.stackwire.java.discover.ShapeId;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TemplateBuilderTest {

  private TemplateBuilder builder;

  @Before
  public void setUp() throws Exception {
    builder = new TemplateBuilder(ShapeRegistry.loadDefault());
  }

  private static Declaration declaration(
      Declaration.Kind kind,
      String name,
      String namespace,
      String localName,
      int line,
      String... deps) {
    return Declaration.builder()
        .kind(kind)
        .name(name)
        .shape(ShapeId.create(namespace, localName))
        .file("app.wire")
        .line(line)
        .dependencies(ImmutableList.copyOf(deps))
        .build();
  }

  private static Declaration resource(
      String name, String namespace, String localName, int line, String... deps) {
    return declaration(Declaration.Kind.RESOURCE, name, namespace, localName, line, deps);
  }

  private static Declaration parameter(String name) {
    return declaration(Declaration.Kind.PARAMETER, name, "", "Parameter", 1);
  }

  private static Declaration output(String name) {
    return declaration(Declaration.Kind.OUTPUT, name, "", "Output", 1);
  }

  @Test
  public void testResourcesInDependencyOrder() throws Exception {
    Template template =
        builder.build(
            ImmutableList.of(
                resource("Function", "lambda", "Function", 9, "Role", "Bucket", "Settings"),
                resource("Role", "iam", "Role", 5),
                resource("Bucket", "s3", "Bucket", 1)),
            ImmutableMap.of());
    assertThat(template.resources().keySet())
        .containsExactly("Bucket", "Role", "Function")
        .inOrder();
    assertThat(template.resources().get("Function").type()).isEqualTo("AWS::Lambda::Function");
    assertThat(template.resources().get("Role").properties()).isEmpty();
    assertThat(template.formatVersion()).isEqualTo("2010-09-09");
    assertThat(template.transform()).isNull();
  }

  @Test
  public void testIndependentResourcesSortedByName() throws Exception {
    ImmutableList<String> order =
        TemplateBuilder.order(
            ImmutableMap.of(
                "Zebra", resource("Zebra", "s3", "Bucket", 1),
                "Mango", resource("Mango", "s3", "Bucket", 2, "Zebra"),
                "Apple", resource("Apple", "s3", "Bucket", 3)));
    assertThat(order).containsExactly("Apple", "Zebra", "Mango").inOrder();
  }

  @Test
  public void testOrderDoesNotDependOnInsertionOrder() throws Exception {
    ImmutableList<Declaration> graph =
        ImmutableList.of(
            resource("Queue", "sqs", "Queue", 1),
            resource("Topic", "sns", "Topic", 2),
            resource("Role", "iam", "Role", 3, "Queue"),
            resource("Worker", "lambda", "Function", 4, "Role", "Queue", "Topic"),
            resource("Alarm", "cloudwatch", "Alarm", 5, "Worker"),
            resource("Bucket", "s3", "Bucket", 6));
    ImmutableList<String> expected =
        ImmutableList.of("Bucket", "Queue", "Role", "Topic", "Worker", "Alarm");

    for (int shift = 0; shift < graph.size(); shift++) {
      Map<String, Declaration> rotated = new LinkedHashMap<>();
      Map<String, Declaration> reversed = new LinkedHashMap<>();
      Map<String, Declaration> hashed = new HashMap<>();
      for (int i = 0; i < graph.size(); i++) {
        Declaration next = graph.get((i + shift) % graph.size());
        rotated.put(next.name(), next);
        hashed.put(next.name(), next);
        Declaration previous = graph.get((graph.size() - 1 - i + shift) % graph.size());
        reversed.put(previous.name(), previous);
      }
      assertThat(TemplateBuilder.order(rotated)).isEqualTo(expected);
      assertThat(TemplateBuilder.order(reversed)).isEqualTo(expected);
      assertThat(TemplateBuilder.order(hashed)).isEqualTo(expected);
    }
  }

  @Test
  public void testCycle() {
    BuildException e =
        assertThrows(
            BuildException.class,
            () ->
                builder.build(
                    ImmutableList.of(
                        resource("B", "s3", "Bucket", 2, "A"),
                        resource("A", "s3", "Bucket", 1, "B"),
                        resource("C", "s3", "Bucket", 3, "A")),
                    ImmutableMap.of()));
    assertThat(e.kind()).isEqualTo(BuildException.Kind.DEPENDENCY_CYCLE);
    assertThat(e.participants()).containsExactly("A", "B").inOrder();
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            "circular dependency detected:\n"
                + "  A (app.wire:1)\n"
                + "    -> B (app.wire:2)\n"
                + "    -> A (app.wire:1)");
  }

  @Test
  public void testSelfCycle() {
    BuildException e =
        assertThrows(
            BuildException.class,
            () ->
                TemplateBuilder.order(
                    ImmutableMap.of("Loop", resource("Loop", "s3", "Bucket", 4, "Loop"))));
    assertThat(e.participants()).containsExactly("Loop");
  }

  @Test
  public void testCycleAtTheEndOfALongChain() {
    Map<String, Declaration> resources = new HashMap<>();
    int length = 100_000;
    for (int i = 0; i < length; i++) {
      String next = i == length - 1 ? chainLink(length - 2) : chainLink(i + 1);
      resources.put(chainLink(i), resource(chainLink(i), "s3", "Bucket", i + 1, next));
    }
    BuildException e = assertThrows(BuildException.class, () -> TemplateBuilder.order(resources));
    assertThat(e.participants())
        .containsExactly(chainLink(length - 2), chainLink(length - 1))
        .inOrder();
  }

  private static String chainLink(int i) {
    return String.format("Link%06d", i);
  }

  @Test
  public void testUnknownType() {
    BuildException e =
        assertThrows(
            BuildException.class,
            () ->
                builder.build(
                    ImmutableList.of(resource("Thing", "nosuch", "Thing", 4)), ImmutableMap.of()));
    assertThat(e.kind()).isEqualTo(BuildException.Kind.UNKNOWN_TYPE);
    assertThat(e).hasMessageThat().isEqualTo("app.wire:4: unknown resource type: nosuch.Thing");
  }

  @Test
  public void testServerlessResourceSetsTransform() throws Exception {
    Template template =
        builder.build(
            ImmutableList.of(resource("Api", "serverless", "Function", 1)), ImmutableMap.of());
    assertThat(template.transform()).isEqualTo("AWS::Serverless-2016-10-31");
    assertThat(template.resources().get("Api").type()).isEqualTo("AWS::Serverless::Function");
  }

  @Test
  public void testValues() throws Exception {
    Map<String, Object> getAtt = new HashMap<>();
    getAtt.put("Fn::GetAtt", ImmutableList.of("Role", "Arn"));
    Map<String, Object> properties = new LinkedHashMap<>();
    properties.put("BucketName", "data");
    properties.put("Count", 3);
    properties.put("Nothing", null);
    properties.put("Role", getAtt);
    properties.put("Tags", ImmutableList.of(ImmutableMap.of("Key", "env", "Value", "dev")));

    Template template =
        builder
            .setDescription("demo stack")
            .build(
                ImmutableList.of(
                    resource("Data", "s3", "Bucket", 1),
                    parameter("Env"),
                    parameter("Unused"),
                    parameter("Plain"),
                    output("DataArn")),
                ImmutableMap.of(
                    "Data", properties,
                    "Env", ImmutableMap.of("Type", "String", "Default", "dev"),
                    "Plain", "not a map",
                    "DataArn", ImmutableMap.of("Value", ImmutableMap.of("Ref", "Data"))));

    assertThat(template.description()).isEqualTo("demo stack");
    assertThat(template.parameters().keySet()).containsExactly("Env", "Plain").inOrder();
    assertThat(template.parameters().get("Env").defaultValue()).isEqualTo("dev");
    assertThat(template.parameters().get("Plain").type()).isEqualTo("String");
    assertThat(template.outputs().get("DataArn").value())
        .isEqualTo(ImmutableMap.of("Ref", "Data"));

    ImmutableMap<String, Object> serialized = template.resources().get("Data").properties();
    assertThat(serialized.keySet())
        .containsExactly("BucketName", "Count", "Role", "Tags")
        .inOrder();
    assertThat(serialized.get("Count")).isEqualTo(3L);
    assertThat(serialized.get("Role"))
        .isEqualTo(ImmutableMap.of("Fn::GetAtt", ImmutableList.of("Role", "Arn")));
  }

  @Test
  public void testIntrinsicValueIsCopied() throws Exception {
    List<Object> choices = new ArrayList<>();
    choices.add("a");
    choices.add("b");
    List<Object> args = new ArrayList<>();
    args.add(1);
    args.add(choices);
    Map<String, Object> select = new HashMap<>();
    select.put("Fn::Select", args);
    Map<String, Object> properties = new HashMap<>();
    properties.put("Name", select);

    Template template =
        builder.build(
            ImmutableList.of(resource("Data", "s3", "Bucket", 1)),
            ImmutableMap.of("Data", properties));
    args.set(0, 99);
    choices.clear();

    Object name = template.resources().get("Data").properties().get("Name");
    assertThat(name)
        .isEqualTo(ImmutableMap.of("Fn::Select", ImmutableList.of(1L, ImmutableList.of("a", "b"))));
    assertThat(TemplateCodec.fromJson(TemplateCodec.toJson(template))).isEqualTo(template);
    assertThat(TemplateCodec.fromYaml(TemplateCodec.toYaml(template))).isEqualTo(template);
  }

  @Test
  public void testIntrinsicConditionKeyInPolicyStatement() throws Exception {
    Map<String, Object> statement = new LinkedHashMap<>();
    statement.put("Effect", "Allow");
    statement.put(
        "Condition", ImmutableMap.of("Bool", ImmutableMap.of("aws:SecureTransport", true)));
    statement.put("MaxAge", 600);
    Template template =
        builder.build(
            ImmutableList.of(resource("Policy", "s3", "BucketPolicy", 1)),
            ImmutableMap.of("Policy", ImmutableMap.of("Statement", ImmutableList.of(statement))));
    statement.put("Effect", "Deny");

    Object copied = template.resources().get("Policy").properties().get("Statement");
    assertThat(copied)
        .isEqualTo(
            ImmutableList.of(
                ImmutableMap.of(
                    "Effect", "Allow",
                    "Condition",
                        ImmutableMap.of("Bool", ImmutableMap.of("aws:SecureTransport", true)),
                    "MaxAge", 600L)));
  }

  @Test
  public void testNonFiniteNumber() {
    BuildException e =
        assertThrows(
            BuildException.class,
            () ->
                builder.build(
                    ImmutableList.of(resource("Queue", "sqs", "Queue", 1)),
                    ImmutableMap.of(
                        "Queue",
                        ImmutableMap.of(
                            "DelaySeconds",
                            ImmutableMap.of("Fn::Select", ImmutableList.of(0, Double.NaN))))));
    assertThat(e.kind()).isEqualTo(BuildException.Kind.INVALID_VALUE);
    assertThat(e).hasMessageThat().isEqualTo("serializing Queue: non-finite number NaN");

    e =
        assertThrows(
            BuildException.class,
            () ->
                builder.build(
                    ImmutableList.of(resource("Queue", "sqs", "Queue", 1)),
                    ImmutableMap.of(
                        "Queue", ImmutableMap.of("DelaySeconds", Double.POSITIVE_INFINITY))));
    assertThat(e).hasMessageThat().isEqualTo("serializing Queue: non-finite number Infinity");
  }

  @Test
  public void testNonStructuredResourceValue() {
    BuildException e =
        assertThrows(
            BuildException.class,
            () ->
                builder.build(
                    ImmutableList.of(resource("Data", "s3", "Bucket", 1)),
                    ImmutableMap.of("Data", ImmutableList.of("a"))));
    assertThat(e.kind()).isEqualTo(BuildException.Kind.INVALID_VALUE);
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("serializing Data: expected a structured value, got a list");
  }

  @Test
  public void testNonStructuredOutputValue() {
    BuildException e =
        assertThrows(
            BuildException.class,
            () ->
                builder.build(
                    ImmutableList.of(output("Out")), ImmutableMap.of("Out", "arn:aws:s3:::x")));
    assertThat(e.kind()).isEqualTo(BuildException.Kind.INVALID_VALUE);
    assertThat(e).hasMessageThat().isEqualTo("output Out: expected a structured value, got String");
  }

  @Test
  public void testUnsupportedScalar() {
    BuildException e =
        assertThrows(
            BuildException.class,
            () ->
                builder.build(
                    ImmutableList.of(resource("Data", "s3", "Bucket", 1)),
                    ImmutableMap.of("Data", ImmutableMap.of("When", new Object()))));
    assertThat(e.kind()).isEqualTo(BuildException.Kind.INVALID_VALUE);
    assertThat(e).hasMessageThat().contains("unsupported value of type Object");
  }

  @Test
  public void testDuplicateDeclaration() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            builder.build(
                ImmutableList.of(resource("Data", "s3", "Bucket", 1), parameter("Data")),
                ImmutableMap.of()));
  }
}

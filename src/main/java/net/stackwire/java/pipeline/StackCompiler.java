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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import net.stackwire.java.config.ConfigException;
import net.stackwire.java.config.ReservedIdentifiers;
import net.stackwire.java.config.ShapeRegistry;
import net.stackwire.java.discover.Declaration;
import net.stackwire.java.discover.Discovery;
import net.stackwire.java.discover.DiscoveryError;
import net.stackwire.java.discover.ScanException;
import net.stackwire.java.discover.ScanOptions;
import net.stackwire.java.discover.SourceRoot;
import net.stackwire.java.discover.SyntaxScanner;
import net.stackwire.java.extract.DeclarationSite;
import net.stackwire.java.extract.ExtractionException;
import net.stackwire.java.extract.StaticValueExtractor;
import net.stackwire.java.extract.ValueExtractor;
import net.stackwire.java.template.BuildException;
import net.stackwire.java.template.Template;
import net.stackwire.java.template.TemplateBuilder;

/**
 * Compiles declaration sources into a template: scans the roots, refuses to continue while the
 * scan reports errors, obtains the values of the declarations and builds the template.
 */
public final class StackCompiler {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final SyntaxScanner scanner;
  private final ShapeRegistry registry;
  private final Function<Discovery, ValueExtractor> extractorFactory;

  /**
   * Creates a compiler.
   *
   * @param extractorFactory returns the extractor for the values of a scan's declarations
   */
  public StackCompiler(
      ShapeRegistry registry,
      ReservedIdentifiers reserved,
      ScanOptions options,
      Function<Discovery, ValueExtractor> extractorFactory) {
    this.scanner = new SyntaxScanner(registry, reserved, options);
    this.registry = registry;
    this.extractorFactory = extractorFactory;
  }

  /** Creates a compiler with the bundled configuration that evaluates initializers statically. */
  public static StackCompiler create() throws ConfigException {
    ReservedIdentifiers reserved = ReservedIdentifiers.loadDefault();
    return new StackCompiler(
        ShapeRegistry.loadDefault(),
        reserved,
        ScanOptions.DEFAULT,
        discovery -> new StaticValueExtractor(discovery, reserved));
  }

  /** Scans the roots and compiles what they declare. */
  public BuildResult compile(List<SourceRoot> roots) throws InterruptedException {
    return compile(scanner.scan(roots));
  }

  /** Compiles the declarations of a completed scan. */
  public BuildResult compile(Discovery discovery) {
    if (!discovery.ok()) {
      ImmutableList.Builder<String> errors = ImmutableList.builder();
      for (ScanException failure : discovery.scanFailures()) {
        errors.add(failure.getMessage());
      }
      for (DiscoveryError error : discovery.errors()) {
        errors.add(error.toString());
      }
      ImmutableList<String> messages = errors.build();
      logger.atWarning().log("not building: %d discovery errors", messages.size());
      return BuildResult.failure(messages);
    }

    try {
      return BuildResult.success(build(discovery));
    } catch (BuildException e) {
      logger.atWarning().log("build failed: %s", e.getMessage());
      return BuildResult.failure(ImmutableList.of(e.getMessage()));
    }
  }

  /**
   * Builds the template for the declarations of a scan, which must have succeeded.
   *
   * @throws BuildException if the values cannot be extracted or the template cannot be built
   */
  public Template build(Discovery discovery) throws BuildException {
    Preconditions.checkArgument(discovery.ok(), "scan reported errors");
    ImmutableList.Builder<DeclarationSite> sites = ImmutableList.builder();
    for (Map<String, Declaration> section :
        ImmutableList.of(
            discovery.parameters(),
            discovery.mappings(),
            discovery.conditions(),
            discovery.resources(),
            discovery.outputs())) {
      for (Declaration declaration : section.values()) {
        sites.add(DeclarationSite.of(declaration));
      }
    }
    Map<String, Object> values;
    try {
      values = extractorFactory.apply(discovery).extract(sites.build());
    } catch (ExtractionException e) {
      throw new BuildException(
          BuildException.Kind.VALUE_EXTRACTION, "extracting values: " + e.getMessage(), e);
    }
    return new TemplateBuilder(registry).build(discovery, values);
  }
}

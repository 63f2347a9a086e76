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

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.stream.Stream;
import javax.annotation.Nullable;
import net.stackwire.java.config.ReservedIdentifiers;
import net.stackwire.java.config.ShapeRegistry;
import net.stackwire.java.syntax.BindingStatement;
import net.stackwire.java.syntax.CompositeLiteral;
import net.stackwire.java.syntax.Expression;
import net.stackwire.java.syntax.Identifier;
import net.stackwire.java.syntax.ParserInput;
import net.stackwire.java.syntax.SelectorExpression;
import net.stackwire.java.syntax.SourceFile;

/**
 * Scans source roots for declaration files and records their top-level bindings.
 *
 * <p>Every binding name is recorded. A binding initialized by a structured literal whose shape is
 * recognized is also classified: shapes {@code Parameter}, {@code Output} and {@code Mapping} of
 * the intrinsic namespace, and its condition combinators, become declarations of those kinds; a
 * shape whose namespace is in the {@link ShapeRegistry} and whose local name is not a nested
 * property type becomes a resource. References are extracted from every structured literal.
 *
 * <p>Each root is scanned into a private result; the results are merged in root order. A file
 * that cannot be read or parsed aborts its root only.
 */
public final class SyntaxScanner {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final ImmutableMap<String, Declaration.Kind> INTRINSIC_KINDS =
      ImmutableMap.<String, Declaration.Kind>builder()
          .put("Parameter", Declaration.Kind.PARAMETER)
          .put("Output", Declaration.Kind.OUTPUT)
          .put("Mapping", Declaration.Kind.MAPPING)
          .put("Equals", Declaration.Kind.CONDITION)
          .put("And", Declaration.Kind.CONDITION)
          .put("Or", Declaration.Kind.CONDITION)
          .put("Not", Declaration.Kind.CONDITION)
          .buildOrThrow();

  private final ShapeRegistry registry;
  private final ReservedIdentifiers reserved;
  private final ScanOptions options;

  public SyntaxScanner(ShapeRegistry registry, ReservedIdentifiers reserved, ScanOptions options) {
    this.registry = registry;
    this.reserved = reserved;
    this.options = options;
  }

  /** A binding of one file, with its classification if it has one. */
  private static final class ScannedBinding {
    final Binding binding;
    @Nullable final Declaration declaration;
    @Nullable final VariableReferences references;

    ScannedBinding(
        Binding binding,
        @Nullable Declaration declaration,
        @Nullable VariableReferences references) {
      this.binding = binding;
      this.declaration = declaration;
      this.references = references;
    }
  }

  /** The outcome of scanning one root: its bindings in file order, or the failure. */
  private static final class RootScan {
    final ImmutableMap<Path, ImmutableList<ScannedBinding>> files;
    @Nullable final ScanException failure;

    RootScan(
        ImmutableMap<Path, ImmutableList<ScannedBinding>> files,
        @Nullable ScanException failure) {
      this.files = files;
      this.failure = failure;
    }
  }

  /**
   * Scans the roots and validates the dependencies of the resources found.
   *
   * @throws InterruptedException if interrupted while waiting for concurrent root scans
   */
  public Discovery scan(List<SourceRoot> roots) throws InterruptedException {
    List<RootScan> scans = scanRoots(roots);
    return merge(scans);
  }

  private List<RootScan> scanRoots(List<SourceRoot> roots) throws InterruptedException {
    ListeningExecutorService executor =
        options.parallelism() > 1 && roots.size() > 1
            ? MoreExecutors.listeningDecorator(
                Executors.newFixedThreadPool(Math.min(options.parallelism(), roots.size())))
            : MoreExecutors.newDirectExecutorService();
    try {
      List<ListenableFuture<RootScan>> futures = new ArrayList<>();
      for (SourceRoot root : roots) {
        futures.add(executor.submit(() -> scanRootOrFail(root)));
      }
      List<RootScan> scans = new ArrayList<>();
      for (ListenableFuture<RootScan> future : futures) {
        try {
          scans.add(future.get());
        } catch (ExecutionException e) {
          Throwables.throwIfUnchecked(e.getCause());
          throw new IllegalStateException(e.getCause());
        }
      }
      return scans;
    } finally {
      executor.shutdownNow();
    }
  }

  private RootScan scanRootOrFail(SourceRoot root) {
    try {
      return new RootScan(scanRoot(root), null);
    } catch (ScanException e) {
      logger.atWarning().log("scan of %s aborted: %s", root, e.getMessage());
      return new RootScan(ImmutableMap.of(), e);
    }
  }

  private ImmutableMap<Path, ImmutableList<ScannedBinding>> scanRoot(SourceRoot root)
      throws ScanException {
    ImmutableMap.Builder<Path, ImmutableList<ScannedBinding>> files = ImmutableMap.builder();
    for (Path path : listSourceFiles(root)) {
      SourceFile file;
      try {
        file = SourceFile.parse(ParserInput.readFile(path));
      } catch (IOException e) {
        throw new ScanException(root, "reading " + path + ": " + e.getMessage(), e);
      }
      if (!file.ok()) {
        throw new ScanException(root, path.toString(), ImmutableList.copyOf(file.errors()));
      }
      ImmutableList<ScannedBinding> bindings = scanFile(file);
      logger.atFine().log("scanned %s: %d bindings", path, bindings.size());
      files.put(path.toAbsolutePath().normalize(), bindings);
    }
    return files.buildOrThrow();
  }

  private ImmutableList<Path> listSourceFiles(SourceRoot root) throws ScanException {
    Path dir = root.path();
    if (!Files.isDirectory(dir)) {
      throw new ScanException(root, dir + " is not a directory", (Throwable) null);
    }
    try (Stream<Path> paths = root.recursive() ? Files.walk(dir) : Files.list(dir)) {
      return paths
          .filter(Files::isRegularFile)
          .filter(p -> options.isSourceFile(p.getFileName().toString()))
          .sorted()
          .collect(ImmutableList.toImmutableList());
    } catch (IOException e) {
      throw new ScanException(root, "listing " + dir + ": " + e.getMessage(), e);
    }
  }

  private ImmutableList<ScannedBinding> scanFile(SourceFile file) {
    ImportTable imports = ImportTable.of(file.getImports());
    ImmutableList.Builder<ScannedBinding> result = ImmutableList.builder();
    for (BindingStatement stmt : file.getBindings()) {
      for (BindingStatement.ValueSpec spec : stmt.getSpecs()) {
        for (int i = 0; i < spec.getNames().size(); i++) {
          Identifier id = spec.getNames().get(i);
          if (id.isBlank()) {
            continue;
          }
          Binding binding =
              Binding.create(
                  id.getName(),
                  file.getFile(),
                  id.getStartLine(),
                  spec.getInitializer(i),
                  imports,
                  stmt.isConst());
          result.add(classify(binding));
        }
      }
    }
    return result.build();
  }

  private ScannedBinding classify(Binding binding) {
    if (!(binding.initializer() instanceof CompositeLiteral literal)) {
      return new ScannedBinding(binding, null, null);
    }
    ImportTable imports = binding.imports();
    Expression type = literal.getType();
    String qualifier;
    String localName;
    if (type instanceof Identifier id) {
      qualifier = "";
      localName = id.getName();
    } else if (type instanceof SelectorExpression sel
        && sel.getObject() instanceof Identifier pkg) {
      qualifier = pkg.getName();
      localName = sel.getField().getName();
    } else {
      return new ScannedBinding(binding, null, null);
    }

    ReferenceExtractor.Extraction refs = ReferenceExtractor.extract(literal, imports, reserved);
    ShapeId shape =
        ShapeId.create(qualifier.isEmpty() ? "" : imports.namespaceOf(qualifier), localName);

    Declaration.Kind kind = null;
    if (qualifier.isEmpty() || imports.isIntrinsicNamespace(qualifier)) {
      kind = INTRINSIC_KINDS.get(localName);
    }
    if (kind == null
        && shape.isQualified()
        && registry.isKnownNamespace(shape.namespace())
        && !registry.isNestedType(localName)) {
      kind = Declaration.Kind.RESOURCE;
    }
    Declaration declaration = null;
    if (kind != null) {
      declaration =
          Declaration.builder()
              .kind(kind)
              .name(binding.name())
              .shape(shape)
              .file(binding.file())
              .line(binding.line())
              .dependencies(refs.dependencies())
              .attributeReferences(refs.variableReferences().attributeReferences())
              .build();
    }
    return new ScannedBinding(binding, declaration, refs.variableReferences());
  }

  private Discovery merge(List<RootScan> scans) {
    Map<Declaration.Kind, Map<String, Declaration>> sections =
        new EnumMap<>(Declaration.Kind.class);
    for (Declaration.Kind kind : Declaration.Kind.values()) {
      sections.put(kind, new LinkedHashMap<>());
    }
    Map<String, Binding> bindings = new LinkedHashMap<>();
    Map<String, VariableReferences> references = new LinkedHashMap<>();
    List<DiscoveryError> errors = new ArrayList<>();
    ImmutableList.Builder<ScanException> failures = ImmutableList.builder();
    // Overlapping roots may list a file more than once.
    Set<Path> seenFiles = new HashSet<>();

    for (RootScan scan : scans) {
      if (scan.failure != null) {
        failures.add(scan.failure);
        continue;
      }
      for (Map.Entry<Path, ImmutableList<ScannedBinding>> file : scan.files.entrySet()) {
        if (!seenFiles.add(file.getKey())) {
          continue;
        }
        for (ScannedBinding scanned : file.getValue()) {
          Binding binding = scanned.binding;
          Binding previous = bindings.putIfAbsent(binding.name(), binding);
          if (previous != null) {
            errors.add(
                DiscoveryError.create(
                    binding.file(),
                    binding.line(),
                    String.format(
                        "%s redeclared (previous declaration at %s)",
                        binding.name(), previous.location())));
            continue;
          }
          if (scanned.references != null) {
            references.put(binding.name(), scanned.references);
          }
          if (scanned.declaration != null) {
            sections.get(scanned.declaration.kind()).put(binding.name(), scanned.declaration);
          }
        }
      }
    }

    ImmutableMap<String, Declaration> resources =
        ImmutableMap.copyOf(sections.get(Declaration.Kind.RESOURCE));
    errors.addAll(DependencyValidator.validate(resources, ImmutableSet.copyOf(bindings.keySet())));
    Discovery discovery =
        new Discovery(
            resources,
            ImmutableMap.copyOf(sections.get(Declaration.Kind.PARAMETER)),
            ImmutableMap.copyOf(sections.get(Declaration.Kind.OUTPUT)),
            ImmutableMap.copyOf(sections.get(Declaration.Kind.MAPPING)),
            ImmutableMap.copyOf(sections.get(Declaration.Kind.CONDITION)),
            ImmutableMap.copyOf(bindings),
            ImmutableMap.copyOf(references),
            ImmutableList.copyOf(errors),
            failures.build());
    logger.atInfo().log(
        "discovered %d resources, %d parameters, %d outputs, %d mappings, %d conditions"
            + " (%d bindings, %d errors)",
        discovery.resources().size(),
        discovery.parameters().size(),
        discovery.outputs().size(),
        discovery.mappings().size(),
        discovery.conditions().size(),
        bindings.size(),
        errors.size());
    return discovery;
  }
}

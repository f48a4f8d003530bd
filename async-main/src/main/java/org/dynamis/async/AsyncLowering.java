package org.dynamis.async;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.Problem;
import com.github.javaparser.Range;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.Statement;
import org.dynamis.async.ast.SourceOrder;
import org.dynamis.async.bind.AsyncParsers;
import org.dynamis.async.bind.Binder;
import org.dynamis.async.bind.SymbolSolverBinder;
import org.dynamis.async.classify.ProcedureDescriber;
import org.dynamis.async.classify.SuspensionClassifier;
import org.dynamis.async.classify.SuspensionShapes;
import org.dynamis.async.diagnostic.Diagnostic;
import org.dynamis.async.diagnostic.DiagnosticCode;
import org.dynamis.async.diagnostic.DiagnosticSink;
import org.dynamis.async.diagnostic.LoggingDiagnosticSink;
import org.dynamis.async.emit.StateMachineEmitter;
import org.dynamis.async.liveness.HoistingAnalyzer;
import org.dynamis.async.liveness.StorageTypePolicy;
import org.dynamis.async.model.AsyncProcedureDescriptor;
import org.dynamis.async.model.HoistingPlan;
import org.dynamis.async.model.Segment;
import org.dynamis.async.model.StateMachineArtifact;
import org.dynamis.async.model.SuspensionPoint;
import org.dynamis.async.model.SuspensionShape;
import org.dynamis.async.segment.BodySegmenter;
import org.dynamis.async.validate.ProcedureValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Rewrites async procedures into resumable state machines.
 *
 * <pre>{@code
 * LoweringResult result = AsyncLowering.builder()
 *         .options(LoweringOptions.fromSystemProperties())
 *         .diagnostics(sink)
 *         .build()
 *         .lowerSource(source);
 * }</pre>
 *
 * A procedure is a non-abstract method of a class whose declared return type is
 * {@code org.dynamis.async.runtime.Task<T>}. Each one is lowered on its own: a procedure that
 * cannot be lowered is reported and left untouched, the others are still rewritten.
 */
public final class AsyncLowering {

    private static final Logger log = LogManager.getLogger(AsyncLowering.class);

    private final LoweringOptions options;
    private final DiagnosticSink diagnostics;
    private final ClassLoader classLoader;
    private final Binder binder;
    private final ProcedureDescriber describer;
    private final SuspensionClassifier classifier;
    private final ProcedureValidator validator;
    private final StorageTypePolicy storageTypes;
    private final HoistingAnalyzer analyzer;
    private final BodySegmenter segmenter = new BodySegmenter();
    private final StateMachineEmitter emitter;

    private AsyncLowering(Builder builder) {
        this.options = builder.options;
        this.diagnostics = builder.diagnostics;
        this.classLoader = builder.classLoader;
        this.binder = builder.binder != null ? builder.binder : new SymbolSolverBinder(classLoader);
        this.describer = new ProcedureDescriber(binder);
        this.classifier = new SuspensionClassifier(binder);
        this.validator = new ProcedureValidator(binder, classifier, options);
        this.storageTypes = new StorageTypePolicy(binder);
        this.analyzer = new HoistingAnalyzer(options, storageTypes);
        this.emitter = new StateMachineEmitter(options);
    }

    public static Builder builder() {
        return new Builder();
    }

    public LoweringOptions getOptions() {
        return options;
    }

    // ── Whole units ────────────────────────────────────────────────────────────

    /**
     * Parses, lowers and returns the lowered unit.
     *
     * @throws SourceParseException if {@code source} is not valid Java
     */
    public LoweringResult lowerSource(String source) {
        JavaParser parser = AsyncParsers.newParser(classLoader);
        ParseResult<CompilationUnit> parsed = parser.parse(source);
        if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
            Problem problem = parsed.getProblems().get(0);
            Range range = problem.getLocation().flatMap(TokenRange::toRange).orElse(null);
            throw new SourceParseException(problem.getMessage(),
                    range == null ? 0 : range.begin.line,
                    range == null ? 0 : range.begin.column);
        }
        return lower(parsed.getResult().get());
    }

    /**
     * Lowers every async procedure of every class in {@code unit}, in place. All procedures are
     * analysed before the tree is changed.
     */
    public LoweringResult lower(CompilationUnit unit) {
        binder.attach(unit);
        List<StateMachineArtifact> artifacts = new ArrayList<>();
        List<LoweringResult.ProcedureFailure> failures = new ArrayList<>();

        for (ClassOrInterfaceDeclaration owner : unit.findAll(ClassOrInterfaceDeclaration.class)) {
            if (owner.isInterface() || owner.isLocalClassDeclaration()) {
                continue;
            }
            for (MethodDeclaration method : owner.getMethods()) {
                if (method.isAbstract() || !describer.isMarked(method)) {
                    continue;
                }
                try {
                    artifacts.add(lowerProcedure(owner, method));
                } catch (StructuralException e) {
                    failures.add(new LoweringResult.ProcedureFailure(owner.getNameAsString(), method.getNameAsString(), e));
                } catch (ClassificationException e) {
                    diagnostics.report(Diagnostic.errorAt(DiagnosticCode.CLASSIFICATION, method.getNameAsString(),
                            e.getRange().orElse(null), e.getMessage()));
                    failures.add(new LoweringResult.ProcedureFailure(owner.getNameAsString(), method.getNameAsString(), e));
                } catch (StorageTypeException e) {
                    diagnostics.report(Diagnostic.errorAt(DiagnosticCode.STORAGE_TYPE, method.getNameAsString(),
                            e.getRange().orElse(null), e.getMessage()));
                    failures.add(new LoweringResult.ProcedureFailure(owner.getNameAsString(), method.getNameAsString(), e));
                }
            }
        }

        artifacts.forEach(artifact -> apply(unit, artifact));
        if (!failures.isEmpty()) {
            log.warn("{} async procedure(s) left unlowered: {}", failures.size(),
                    failures.stream().map(LoweringResult.ProcedureFailure::procedure).collect(Collectors.toList()));
        }
        return new LoweringResult(unit, artifacts, failures);
    }

    // ── Single procedures ──────────────────────────────────────────────────────

    /**
     * Lowers one procedure without touching the tree.
     *
     * @throws StructuralException     if validation reports an error
     * @throws ClassificationException if a suspension cannot be classified
     * @throws StorageTypeException    if a hoisted variable has no nameable field type
     */
    public StateMachineArtifact lowerProcedure(ClassOrInterfaceDeclaration owner, MethodDeclaration method) {
        String name = method.getNameAsString();
        List<Diagnostic> findings = validator.validate(owner, method);
        findings.forEach(diagnostics::report);
        List<Diagnostic> errors = findings.stream().filter(Diagnostic::isError).collect(Collectors.toList());
        if (!errors.isEmpty()) {
            throw new StructuralException(name, errors);
        }

        BlockStmt body = method.getBody().orElseThrow(() -> new IllegalStateException("Validated procedure without body"));
        SourceOrder order = SourceOrder.of(body);
        AsyncProcedureDescriptor procedure = describer.describe(owner, method, order);
        storageTypes.resultType(procedure);

        List<SuspensionPoint> points = classify(body, order);
        HoistingPlan plan = analyzer.analyze(procedure, points, order);
        List<Segment> segments = segmenter.segment(procedure, points, plan);
        StateMachineArtifact artifact = emitter.emit(procedure, plan, segments);

        diagnostics.report(Diagnostic.info(DiagnosticCode.LOWERED, name, method,
                "Lowered '" + name + "' into " + segments.size() + " segment(s)"));
        log.info("Lowered {}.{} into {} segment(s), {} slot(s)", owner.getNameAsString(), name,
                segments.size(), plan.slots().size());
        return artifact;
    }

    private List<SuspensionPoint> classify(BlockStmt body, SourceOrder order) {
        List<SuspensionPoint> points = new ArrayList<>();
        for (int i = 0; i < body.getStatements().size(); i++) {
            Statement statement = body.getStatement(i);
            for (MethodCallExpr site : classifier.findSuspensions(statement)) {
                SuspensionShape shape = SuspensionShapes.shapeOf(site, statement)
                        .orElseThrow(() -> new IllegalStateException("Unvalidated suspension shape: " + site));
                points.add(classifier.classify(points.size(), site, shape, statement, i, order.ordinal(site)));
            }
        }
        return points;
    }

    /**
     * Replaces the procedure by its entry and adds the generated members and imports.
     */
    static void apply(CompilationUnit unit, StateMachineArtifact artifact) {
        artifact.imports().stream().sorted().forEach(unit::addImport);
        ClassOrInterfaceDeclaration owner = artifact.procedure().owner();
        artifact.procedure().declaration().replace(artifact.entry());
        artifact.fields().forEach(owner::addMember);
        owner.addMember(artifact.dispatch());
    }

    public static final class Builder {

        private LoweringOptions options = LoweringOptions.defaults();
        private DiagnosticSink diagnostics = new LoggingDiagnosticSink();
        private ClassLoader classLoader = AsyncLowering.class.getClassLoader();
        private Binder binder;

        private Builder() {}

        public Builder options(LoweringOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        public Builder diagnostics(DiagnosticSink diagnostics) {
            this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
            return this;
        }

        /**
         * Class loader the default binder resolves referenced types against.
         */
        public Builder classLoader(ClassLoader classLoader) {
            this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
            return this;
        }

        public Builder binder(Binder binder) {
            this.binder = Objects.requireNonNull(binder, "binder");
            return this;
        }

        public AsyncLowering build() {
            return new AsyncLowering(this);
        }
    }
}

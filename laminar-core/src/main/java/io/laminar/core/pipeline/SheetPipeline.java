package io.laminar.core.pipeline;

import io.laminar.core.LaminarConfig;
import io.laminar.core.diagram.DiagramCompiler;
import io.laminar.core.diagram.MermaidDiagramCompiler;
import io.laminar.core.document.ProcessDocument;
import io.laminar.core.exception.CollaboratorException;
import io.laminar.core.exception.ColumnResolutionException;
import io.laminar.core.exception.LaminarException;
import io.laminar.core.exception.LowConfidenceException;
import io.laminar.core.exception.ProcessValidationException;
import io.laminar.core.extraction.ExtractionCollaborator;
import io.laminar.core.extraction.ExtractionMethod;
import io.laminar.core.extraction.ExtractionMode;
import io.laminar.core.graph.Finding;
import io.laminar.core.graph.FindingKind;
import io.laminar.core.graph.GraphBuild;
import io.laminar.core.graph.GraphBuilder;
import io.laminar.core.graph.GraphValidator;
import io.laminar.core.graph.ValidationReport;
import io.laminar.core.model.Role;
import io.laminar.core.template.CanonicalRow;
import io.laminar.core.template.ColumnResolution;
import io.laminar.core.template.ColumnResolver;
import io.laminar.core.template.SheetTable;
import io.laminar.core.template.TemplateAssessment;
import io.laminar.core.template.TemplateValidator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/// Runs one sheet through resolution, scoring, graph building, validation and diagram
/// compilation.
///
/// ```
/// ColumnResolver -> TemplateValidator -> GraphBuilder -> GraphValidator -> DiagramCompiler
///                          |                   ^
///                          | below threshold   |
///                          +--> ExtractionCollaborator
/// ```
///
/// A sheet is processed synchronously on the calling thread. The only shared state is
/// the immutable {@link LaminarConfig}, so one pipeline serves every worker of a batch.
///
/// @see BatchProcessor for concurrent processing of several sheets
public final class SheetPipeline {

    private static final Logger logger = Logger.getLogger(SheetPipeline.class.getName());

    private final LaminarConfig config;
    private final ExtractionCollaborator collaborator;
    private final PipelineListener listener;
    private final ColumnResolver columnResolver;
    private final TemplateValidator templateValidator = new TemplateValidator();
    private final GraphBuilder graphBuilder = new GraphBuilder();
    private final GraphValidator graphValidator = new GraphValidator();
    private final DiagramCompiler compiler;

    /// Creates a pipeline.
    ///
    /// @param config shared configuration, not null
    /// @param collaborator AI collaborator, null when AI extraction is unavailable
    /// @param listener event listener, not null
    public SheetPipeline(
            LaminarConfig config, ExtractionCollaborator collaborator, PipelineListener listener) {
        this.config = config;
        this.collaborator = collaborator;
        this.listener = listener;
        this.columnResolver = new ColumnResolver(config.getAliases());
        this.compiler = new MermaidDiagramCompiler(config);
    }

    /// Creates a template-only pipeline without listener.
    public SheetPipeline(LaminarConfig config) {
        this(config, null, PipelineListener.NONE);
    }

    /// Processes a sheet into a persisted document and a diagram.
    ///
    /// @param sheet sheet contents, not null
    /// @param mode extraction mode, not null
    /// @return result with diagram and document, never null
    /// @throws ColumnResolutionException if forced-template and a required column is missing
    /// @throws LowConfidenceException if forced-template and the score is too low
    /// @throws CollaboratorException if the AI path was needed and failed
    /// @throws ProcessValidationException if the graph has a fatal finding
    /// @throws LaminarException for any other sheet-level failure
    public SheetResult process(SheetTable sheet, ExtractionMode mode) throws LaminarException {
        try {
            return compile(analyze(sheet, mode));
        } catch (LaminarException e) {
            listener.onSheetFailed(sheet.name(), e);
            throw e;
        }
    }

    /// Processes an already canonical document, as read from a `.json` input.
    ///
    /// @param sheetName name used for output files, not null
    /// @param document parsed document, not null
    /// @return result with diagram and document, never null
    /// @throws LaminarException if the document cannot be mapped or is invalid
    public SheetResult process(String sheetName, ProcessDocument document)
            throws LaminarException {
        try {
            return compile(analyze(sheetName, document));
        } catch (LaminarException e) {
            listener.onSheetFailed(sheetName, e);
            throw e;
        }
    }

    /// Builds and validates a sheet without compiling it.
    ///
    /// Validation failures do not throw here; they are part of the returned report.
    ///
    /// @param sheet sheet contents, not null
    /// @param mode extraction mode, not null
    /// @return analysis with every finding, never null
    /// @throws LaminarException if extraction fails
    public SheetAnalysis analyze(SheetTable sheet, ExtractionMode mode) throws LaminarException {
        listener.onSheetStarted(sheet.name());
        String processId = Role.slug(sheet.name());

        if (mode == ExtractionMode.FORCE_AI) {
            return viaCollaborator(sheet, processId, null, List.of());
        }

        ColumnResolution resolution = columnResolver.resolve(sheet.headers());
        List<CanonicalRow> rows = resolution.canonicalize(sheet);
        TemplateAssessment assessment = templateValidator.assess(resolution, rows);
        listener.onAssessed(sheet.name(), assessment);

        List<Finding> notes = new ArrayList<>();
        for (String note : resolution.notes()) {
            notes.add(Finding.of(FindingKind.AMBIGUOUS_COLUMN, null, null, note));
        }

        boolean templateFits =
                assessment.missingRequired().isEmpty()
                        && assessment.meets(config.getConfidenceThreshold());
        logger.info(
                String.format(
                        Locale.ROOT,
                        "Sheet '%s': template confidence %.2f (threshold %.2f)",
                        sheet.name(),
                        assessment.confidence(),
                        config.getConfidenceThreshold()));

        if (!templateFits) {
            if (mode == ExtractionMode.FORCE_TEMPLATE) {
                if (!assessment.missingRequired().isEmpty()) {
                    throw new ColumnResolutionException(assessment.missingRequired());
                }
                throw new LowConfidenceException(
                        assessment.confidence(), config.getConfidenceThreshold());
            }
            if (collaborator == null) {
                throw new CollaboratorException(
                        String.format(
                                Locale.ROOT,
                                "Template confidence %.2f is below threshold %.2f and no AI"
                                        + " collaborator is configured",
                                assessment.confidence(),
                                config.getConfidenceThreshold()),
                        false);
            }
            return viaCollaborator(sheet, processId, assessment, notes);
        }

        listener.onRouted(sheet.name(), ExtractionMethod.TEMPLATE);
        GraphBuild build = graphBuilder.fromRows(processId, sheet.name(), rows);
        notes.addAll(build.findings());
        return validate(sheet.name(), build, ExtractionMethod.TEMPLATE, assessment, notes);
    }

    /// Builds and validates a canonical document without compiling it.
    ///
    /// @param sheetName name used in events and output, not null
    /// @param document parsed document, not null
    /// @return analysis with every finding, never null
    /// @throws LaminarException if the document cannot be mapped
    public SheetAnalysis analyze(String sheetName, ProcessDocument document)
            throws LaminarException {
        listener.onSheetStarted(sheetName);
        listener.onRouted(sheetName, ExtractionMethod.AI);
        GraphBuild build = graphBuilder.fromDocument(document);
        return validate(sheetName, build, ExtractionMethod.AI, null, build.findings());
    }

    private SheetAnalysis viaCollaborator(
            SheetTable sheet, String processId, TemplateAssessment assessment, List<Finding> notes)
            throws LaminarException {
        if (collaborator == null) {
            throw new CollaboratorException("No AI collaborator is configured", false);
        }
        listener.onRouted(sheet.name(), ExtractionMethod.AI);
        logger.info("Sheet '" + sheet.name() + "': using AI extraction");

        ProcessDocument document = collaborator.extract(sheet);
        if (document.processId() == null || document.processId().isBlank()) {
            document =
                    new ProcessDocument(
                            processId,
                            document.processName() != null ? document.processName() : sheet.name(),
                            document.roles(),
                            document.steps());
        }
        GraphBuild build = graphBuilder.fromDocument(document);
        List<Finding> all = new ArrayList<>(notes);
        all.addAll(build.findings());
        return validate(sheet.name(), build, ExtractionMethod.AI, assessment, all);
    }

    private SheetAnalysis validate(
            String sheetName,
            GraphBuild build,
            ExtractionMethod method,
            TemplateAssessment assessment,
            List<Finding> notes) {
        listener.onGraphBuilt(sheetName, build.process());
        ValidationReport report = graphValidator.validate(build.process());
        listener.onValidated(sheetName, report);
        for (Finding warning : report.warnings()) {
            logger.warning("Sheet '" + sheetName + "': " + warning.describe());
        }
        return new SheetAnalysis(sheetName, build.process(), method, assessment, notes, report);
    }

    private SheetResult compile(SheetAnalysis analysis) throws ProcessValidationException {
        if (!analysis.report().isValid()) {
            throw ProcessValidationException.from(analysis.report());
        }
        String diagram = compiler.compile(analysis.process());
        SheetResult result =
                new SheetResult(analysis, ProcessDocument.from(analysis.process()), diagram);
        logger.info(
                "Sheet '"
                        + analysis.sheetName()
                        + "': "
                        + analysis.process().getSteps().size()
                        + " steps, "
                        + analysis.process().getRoles().size()
                        + " roles via "
                        + analysis.method());
        listener.onSheetCompleted(result);
        return result;
    }
}

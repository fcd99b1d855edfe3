package com.stg2va.core.compiler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stg2va.core.analysis.ReachabilityAnalyzer;
import com.stg2va.core.analysis.StateGraph;
import com.stg2va.core.generator.GeneratedModel;
import com.stg2va.core.generator.GeneratorConfig;
import com.stg2va.core.generator.ModelGenerator;
import com.stg2va.core.logic.PhaseTransitionTable;
import com.stg2va.core.logic.SignalLogicDeriver;
import com.stg2va.core.model.PetriNet;
import com.stg2va.core.parser.StgParser;
import com.stg2va.core.renderer.OutputRenderer;
import com.stg2va.core.renderer.RenderContext;

/**
 * Runs the compilation pipeline: parse, explore, derive, generate.
 *
 * <p>The first failing stage aborts the compilation with its
 * {@link com.stg2va.core.error.StgCompilationException}; nothing is rendered in that case.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * StgCompiler compiler = new StgCompiler();
 * CompilationContext result = compiler.compile(Paths.get("handshake.g"),
 *     GeneratorConfig.defaults(), ReachabilityAnalyzer.DEFAULT_MAX_PHASES, new VerilogAGenerator());
 * String verilogA = result.model().content();
 * }</pre>
 */
public class StgCompiler {

    private static final Logger log = LoggerFactory.getLogger(StgCompiler.class);

    private final StgParser parser;
    private final SignalLogicDeriver deriver;

    public StgCompiler() {
        this(new StgParser(), new SignalLogicDeriver());
    }

    public StgCompiler(StgParser parser, SignalLogicDeriver deriver) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.deriver = Objects.requireNonNull(deriver, "deriver must not be null");
    }

    /**
     * Compiles a {@code .g} file.
     *
     * @param input source file
     * @param config generation settings
     * @param maxPhases phase ceiling
     * @param generator generator producing the output text
     * @return context holding every stage result
     * @throws IOException if the file cannot be read
     */
    public CompilationContext compile(Path input, GeneratorConfig config, int maxPhases, ModelGenerator generator)
            throws IOException {
        Objects.requireNonNull(input, "input must not be null");
        String source = Files.readString(input, StandardCharsets.UTF_8);
        return compile(input.toString(), source, config, maxPhases, generator);
    }

    /**
     * Compiles {@code .g} text.
     *
     * @param sourceName name used in diagnostics
     * @param source net text
     * @param config generation settings
     * @param maxPhases phase ceiling
     * @param generator generator producing the output text
     * @return context holding every stage result
     */
    public CompilationContext compile(String sourceName, String source, GeneratorConfig config, int maxPhases,
                                      ModelGenerator generator) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(generator, "generator must not be null");

        CompilationContext context = CompilationContext.start(sourceName, config, maxPhases);
        log.info("Compiling {} with {}", sourceName, generator.getDisplayName());

        context = parse(context, source);
        context = explore(context);
        context = derive(context);
        context = generate(context, generator);

        log.info("Compiled {}: {} phases, {} table entries", sourceName,
            context.table().phaseCount(), context.table().entries().size());
        return context;
    }

    /**
     * Compiles a {@code .g} file and renders the result.
     *
     * @param input source file
     * @param config generation settings
     * @param maxPhases phase ceiling
     * @param generator generator producing the output text
     * @param renderer destination of the output text
     * @param renderContext renderer settings
     * @return context holding every stage result
     * @throws IOException if the file cannot be read
     */
    public CompilationContext compileAndRender(Path input, GeneratorConfig config, int maxPhases,
                                               ModelGenerator generator, OutputRenderer renderer,
                                               RenderContext renderContext) throws IOException {
        CompilationContext context = compile(input, config, maxPhases, generator);
        renderer.render(context.model(), renderContext);
        return context;
    }

    private CompilationContext parse(CompilationContext context, String source) {
        PetriNet net = parser.parse(source);
        log.debug("Parsed net '{}': {} signals, {} places, {} transitions", net.name(),
            net.signals().size(), net.places().size(), net.transitions().size());
        return context.withNet(net);
    }

    private CompilationContext explore(CompilationContext context) {
        StateGraph graph = new ReachabilityAnalyzer(context.maxPhases()).analyze(context.net());
        log.debug("Explored {} phases and {} edges", graph.phaseCount(), graph.edges().size());
        return context.withGraph(graph);
    }

    private CompilationContext derive(CompilationContext context) {
        PhaseTransitionTable table = deriver.derive(context.graph());
        return context.withTable(table);
    }

    private CompilationContext generate(CompilationContext context, ModelGenerator generator) {
        GeneratedModel model = generator.generate(context.net(), context.graph(), context.table(), context.config());
        log.debug("Generated {} ({} characters)", model.fileName(), model.content().length());
        return context.withModel(model);
    }
}

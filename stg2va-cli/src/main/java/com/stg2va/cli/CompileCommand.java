package com.stg2va.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stg2va.Stg2VaCLI;
import com.stg2va.core.compiler.CompilationContext;
import com.stg2va.core.compiler.StgCompiler;
import com.stg2va.core.config.ConfigLoader;
import com.stg2va.core.config.Stg2VaConfig;
import com.stg2va.core.error.StgCompilationException;
import com.stg2va.core.generator.GeneratorConfig;
import com.stg2va.core.generator.impl.VerilogAGenerator;
import com.stg2va.core.renderer.OutputRenderer;
import com.stg2va.core.renderer.RenderContext;
import com.stg2va.core.renderer.impl.ConsoleRenderer;
import com.stg2va.core.renderer.impl.FileSystemRenderer;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to compile a {@code .g} file into a Verilog-A model.
 *
 * <p>Runs the whole pipeline and writes the model only if every stage succeeded. Command-line
 * flags win over values from the configuration file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Writes handshake.va next to handshake.g
 * stg2va compile handshake.g
 *
 * # Rename a port and print the model
 * stg2va compile handshake.g --rename req=req_i --stdout
 * }</pre>
 */
@Command(
    name = "compile",
    description = "Compile an STG (.g) into a Verilog-A behavioral model",
    mixinStandardHelpOptions = true
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @ParentCommand
    private Stg2VaCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Input .g file")
    private Path input;

    @Option(names = {"-o", "--output"}, description = "Output .va file (default: <model>.va next to the input)")
    private Path output;

    @Option(names = {"--all-inputs"},
        description = "Observe every port signal as an input; hidden internal signals are still driven")
    private boolean allInputs;

    @Option(names = {"--see-internals"}, description = "Expose internal signals as ports")
    private boolean seeInternals;

    @Option(names = {"--rename"}, description = "Port identifier of a signal, as signal=identifier")
    private Map<String, String> renames = new LinkedHashMap<>();

    @Option(names = {"--vdd"}, description = "Supply port name (default: VDD)")
    private String vdd;

    @Option(names = {"--vss"}, description = "Ground port name (default: VSS)")
    private String vss;

    @Option(names = {"--rst"}, description = "Active-low reset port name (default: RST)")
    private String rst;

    @Option(names = {"--max-phases"}, description = "Phase ceiling of the reachability analysis")
    private Integer maxPhases;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: stg2va.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"--stdout"}, description = "Print the model instead of writing a file")
    private boolean stdout;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }
        try {
            Stg2VaConfig config = ConfigLoader.load(configPath);
            GeneratorConfig generatorConfig = buildGeneratorConfig(config);
            int phaseLimit = maxPhases != null ? maxPhases : config.maxPhases();

            FileSystemRenderer fileRenderer = new FileSystemRenderer();
            OutputRenderer renderer = stdout ? new ConsoleRenderer(spec.commandLine().getOut()) : fileRenderer;
            RenderContext renderContext = new RenderContext(
                output != null ? output.toString() : null,
                Map.of(FileSystemRenderer.OUTPUT_DIRECTORY_SETTING, inputDirectory().toString()));

            CompilationContext result = new StgCompiler().compileAndRender(
                input, generatorConfig, phaseLimit, new VerilogAGenerator(), renderer, renderContext);

            if (!stdout) {
                log.info("Wrote {} ({} phases)", fileRenderer.resolveTarget(result.model(), renderContext),
                    result.table().phaseCount());
            }
            return 0;
        } catch (StgCompilationException | IOException | IllegalArgumentException | IllegalStateException e) {
            return CommandErrors.report(spec, log, "Compilation of " + input + " failed", e);
        }
    }

    private GeneratorConfig buildGeneratorConfig(Stg2VaConfig config) {
        GeneratorConfig.Builder builder = config.toGeneratorConfig();
        if (allInputs) {
            builder.forceAllInputs(true);
        }
        if (seeInternals) {
            builder.exposeInternalSignals(true);
        }
        renames.forEach(builder::rename);
        if (vdd != null) {
            builder.vddName(vdd);
        }
        if (vss != null) {
            builder.vssName(vss);
        }
        if (rst != null) {
            builder.resetName(rst);
        }
        return builder.build();
    }

    private Path inputDirectory() {
        Path parentDir = input.toAbsolutePath().getParent();
        return parentDir != null ? parentDir : Paths.get(".");
    }
}

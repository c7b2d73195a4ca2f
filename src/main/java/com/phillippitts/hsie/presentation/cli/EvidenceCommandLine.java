package com.phillippitts.hsie.presentation.cli;

import com.phillippitts.hsie.domain.AnalyzerKind;
import com.phillippitts.hsie.domain.Evidence;
import com.phillippitts.hsie.domain.HsiScore;
import com.phillippitts.hsie.domain.ScoredPayload;
import com.phillippitts.hsie.exception.HsieException;
import com.phillippitts.hsie.service.analysis.AnalyzerSet;
import com.phillippitts.hsie.service.pipeline.EvidencePipeline;
import com.phillippitts.hsie.service.pipeline.PipelineRun;
import com.phillippitts.hsie.service.store.EvidenceJsonCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command-line surface. Runs one command when the application is started with non-option
 * arguments; without arguments the application serves the REST API instead.
 *
 * <pre>
 * capture &lt;audio-path&gt; [session-id]   preprocess &lt;id&gt;   analyze &lt;id&gt; [DIM,DIM...]
 * score &lt;id&gt;   run &lt;audio-path&gt; [session-id]   show &lt;id&gt;   lineage &lt;id&gt;   verify &lt;id&gt;
 * </pre>
 * Exit codes: 0 success, 1 pipeline error (report on stderr), 2 usage error.
 */
@Component
public class EvidenceCommandLine implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger LOG = LogManager.getLogger(EvidenceCommandLine.class);

    static final int EXIT_OK = 0;
    static final int EXIT_PIPELINE_ERROR = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = String.join(System.lineSeparator(),
            "usage: hsie <command> [args]",
            "  capture <audio-path> [session-id]",
            "  preprocess <raw-id>",
            "  analyze <preprocessed-id> [ACOUSTIC,SEMANTIC,LINGUISTIC]",
            "  score <analyzed-id>",
            "  run <audio-path> [session-id]",
            "  show <id>",
            "  lineage <id>",
            "  verify <id>");

    private final EvidencePipeline pipeline;
    private final PrintStream out;
    private final PrintStream err;
    private volatile int exitCode = EXIT_OK;

    @Autowired
    public EvidenceCommandLine(EvidencePipeline pipeline) {
        this(pipeline, System.out, System.err);
    }

    EvidenceCommandLine(EvidencePipeline pipeline, PrintStream out, PrintStream err) {
        this.pipeline = pipeline;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> argv = args.getNonOptionArgs();
        if (!argv.isEmpty()) {
            exitCode = execute(argv);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Executes one command.
     *
     * @return process exit code
     */
    int execute(List<String> argv) {
        if (argv.isEmpty()) {
            return usage("no command given");
        }
        String command = argv.get(0).toLowerCase(Locale.ROOT);
        List<String> rest = argv.subList(1, argv.size());
        try {
            switch (command) {
                case "capture" -> {
                    requireArgs(rest, 1, 2);
                    out.println(pipeline.capture(Path.of(rest.get(0)), optional(rest, 1)).id());
                }
                case "preprocess" -> {
                    requireArgs(rest, 1, 1);
                    out.println(pipeline.preprocess(rest.get(0)).id());
                }
                case "analyze" -> {
                    requireArgs(rest, 1, 2);
                    Evidence analyzed = rest.size() == 2
                            ? pipeline.analyze(rest.get(0), parseAnalyzerSet(rest.get(1)))
                            : pipeline.analyze(rest.get(0));
                    out.println(analyzed.id());
                }
                case "score" -> {
                    requireArgs(rest, 1, 1);
                    Evidence scored = pipeline.score(rest.get(0));
                    out.println(scored.id());
                    printScore(scored);
                }
                case "run" -> {
                    requireArgs(rest, 1, 2);
                    PipelineRun run = pipeline.run(Path.of(rest.get(0)), optional(rest, 1));
                    out.println("raw          " + run.raw().id());
                    out.println("preprocessed " + run.preprocessed().id());
                    out.println("analyzed     " + run.analyzed().id());
                    out.println("scored       " + run.scored().id());
                    printScore(run.scored());
                }
                case "show" -> {
                    requireArgs(rest, 1, 1);
                    out.println(EvidenceJsonCodec.toJson(pipeline.get(rest.get(0))).toString(2));
                }
                case "lineage" -> {
                    requireArgs(rest, 1, 1);
                    for (Evidence e : pipeline.lineage(rest.get(0))) {
                        out.println(e.versionKind().wireName() + " " + e.id() + " " + e.producer() + " " + e.createdAt());
                    }
                }
                case "verify" -> {
                    requireArgs(rest, 1, 1);
                    int verified = 0;
                    for (Evidence e : pipeline.lineage(rest.get(0))) {
                        pipeline.verify(e.id());
                        verified++;
                    }
                    out.println("OK " + verified + " evidence verified");
                }
                default -> {
                    return usage("unknown command '" + command + "'");
                }
            }
            return EXIT_OK;
        } catch (UsageException e) {
            return usage(e.getMessage());
        } catch (HsieException e) {
            err.println(e.toReport());
            LOG.debug("Command {} failed", command, e);
            return EXIT_PIPELINE_ERROR;
        }
    }

    private void printScore(Evidence scored) {
        HsiScore score = scored.payloadAs(ScoredPayload.class).score();
        out.println(String.format(Locale.ROOT, "HSI=%.4f HSIE=%.4f segments=%d weights=%s",
                score.hsi(), score.hsie(), score.segmentsConsidered(), score.dimensionWeights()));
    }

    private AnalyzerSet parseAnalyzerSet(String value) {
        List<AnalyzerKind> kinds = new ArrayList<>();
        for (String part : value.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            try {
                kinds.add(AnalyzerKind.parse(part));
            } catch (IllegalArgumentException e) {
                throw new UsageException("unknown dimension '" + part.trim() + "'");
            }
        }
        if (kinds.isEmpty()) {
            throw new UsageException("analyzer set must name at least one dimension");
        }
        return AnalyzerSet.of(kinds, pipeline.getDefaultAnalyzerSet().versions());
    }

    private int usage(String problem) {
        err.println("error: " + problem);
        err.println(USAGE);
        return EXIT_USAGE;
    }

    private static void requireArgs(List<String> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            throw new UsageException(min == max
                    ? "expected " + min + " argument(s), got " + args.size()
                    : "expected " + min + ".." + max + " arguments, got " + args.size());
        }
    }

    private static String optional(List<String> args, int index) {
        return args.size() > index ? args.get(index) : null;
    }

    private static final class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}

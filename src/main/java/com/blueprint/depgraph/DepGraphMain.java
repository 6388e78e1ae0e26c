package com.blueprint.depgraph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import com.blueprint.depgraph.io.DeclarationReader;
import com.blueprint.depgraph.io.GraphWriter;
import com.blueprint.depgraph.io.ProjectDefinition;
import com.blueprint.depgraph.layout.LayoutConfig;
import com.blueprint.depgraph.util.GraphExplain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Command line entry point.
 *
 * <pre>
 * DepGraphMain &lt;declarations.json&gt; &lt;output-dir&gt; [--config layout.json] [--mermaid]
 * </pre>
 */
public final class DepGraphMain {
    private static final Logger log = LogManager.getLogger(DepGraphMain.class);

    static final String MERMAID_FILE = "dep-graph.mmd";

    private DepGraphMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /** Runs the CLI and returns the process exit code. */
    static int run(String[] args) {
        Path input = null;
        Path outDir = null;
        Path configFile = null;
        boolean mermaid = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg)) {
                if (i + 1 >= args.length)
                    return usage("--config needs a file");
                configFile = Paths.get(args[++i]);
            } else if ("--mermaid".equals(arg)) {
                mermaid = true;
            } else if (arg.startsWith("--")) {
                return usage("Unknown option " + arg);
            } else if (input == null) {
                input = Paths.get(arg);
            } else if (outDir == null) {
                outDir = Paths.get(arg);
            } else {
                return usage("Unexpected argument " + arg);
            }
        }
        if (input == null || outDir == null)
            return usage("Input file and output directory are required");

        try {
            ProjectDefinition def = DeclarationReader.readFile(input);
            LayoutConfig config = configFile != null ? DeclarationReader.readConfig(configFile)
                    : def.getLayout() != null ? def.getLayout() : LayoutConfig.defaults();

            PipelineResult result = DepGraph.pipeline().withConfig(config).run(def.getDeclarations());
            GraphWriter.write(def.getProject(), result, outDir);
            if (mermaid)
                Files.writeString(outDir.resolve(MERMAID_FILE), new GraphExplain(result.graph()).toMermaid());

            log.info("Wrote {} nodes and {} edges to {} ({})", result.graph().nodeCount(),
                    result.graph().edgeCount(), outDir, result.layoutStats());
            return 0;
        } catch (IOException e) {
            log.error("Failed to process {}", input, e);
            return 1;
        } catch (IllegalArgumentException e) {
            log.error("Rejected input {}: {}", input, e.getMessage());
            return 1;
        }
    }

    private static int usage(String problem) {
        log.error("{}. Usage: DepGraphMain <declarations.json> <output-dir> [--config layout.json] [--mermaid]",
                problem);
        return 2;
    }
}

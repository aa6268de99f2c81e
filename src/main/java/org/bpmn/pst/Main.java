package org.bpmn.pst;

import lombok.extern.slf4j.Slf4j;
import org.bpmn.pst.bpmn.BpmnGenerator;
import org.bpmn.pst.bpmn.BpmnHelper;
import org.bpmn.pst.bpmn.BpmnValidator;
import org.bpmn.pst.bpmn.models.FlowGraph;
import org.bpmn.pst.config.ConverterConfig;
import org.bpmn.pst.config.ConverterConfigHelper;
import org.bpmn.pst.pst.PstNode;
import org.bpmn.pst.util.FileOutput;
import org.w3c.dom.Document;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line driver.
 *
 * <pre>
 * structure &lt;in.bpmn&gt; &lt;out.txt&gt;    BPMN to tree notation
 * render    &lt;in.txt&gt;  &lt;out.bpmn&gt;   tree notation to BPMN with diagram
 * roundtrip &lt;in.bpmn&gt; &lt;out.bpmn&gt;   BPMN to tree and back
 * validate  &lt;file.bpmn&gt;             schema check
 * </pre>
 * Any command accepts {@code --config <file.json>}.
 */
@Slf4j
public class Main {
    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private final PrintStream out;

    public Main(PrintStream out) {
        this.out = out;
    }

    public int run(String[] args) {
        List<String> positional = new ArrayList<>();
        String configPath = null;
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    return usage("--config needs a file");
                }
                configPath = args[++i];
            } else {
                positional.add(args[i]);
            }
        }
        if (positional.isEmpty()) {
            return usage("missing command");
        }

        String command = positional.get(0);
        List<String> files = positional.subList(1, positional.size());
        int expectedFiles = "validate".equals(command) ? 1 : 2;
        if (files.size() != expectedFiles) {
            return usage(command + " expects " + expectedFiles + " file argument(s)");
        }

        try {
            ConverterConfig config = configPath != null
                    ? ConverterConfigHelper.loadConfigFile(configPath)
                    : ConverterConfigHelper.loadDefault();
            ProcessConverter converter = new ProcessConverter(config);

            switch (command) {
                case "structure" -> structure(converter, files.get(0), files.get(1));
                case "render" -> render(converter, files.get(0), files.get(1));
                case "roundtrip" -> roundtrip(converter, files.get(0), files.get(1));
                case "validate" -> validate(files.get(0));
                default -> {
                    return usage("unknown command '" + command + "'");
                }
            }
            return OK;
        } catch (RuntimeException e) {
            log.debug("Command {} failed", command, e);
            out.println("❌ " + describe(e));
            return FAILED;
        }
    }

    private void structure(ProcessConverter converter, String bpmnPath, String treePath) {
        FlowGraph graph = BpmnHelper.parseBpmnFile(bpmnPath);
        String text = converter.toTreeText(graph);
        FileOutput.writeAtomically(Path.of(treePath), text);
        out.println("✅ Process Structure Tree saved as " + treePath);
    }

    private void render(ProcessConverter converter, String treePath, String bpmnPath) {
        String text;
        try {
            text = Files.readString(Path.of(treePath), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read tree file: " + treePath, e);
        }
        writeDiagram(converter, converter.parseTree(text), bpmnPath);
    }

    private void roundtrip(ProcessConverter converter, String inPath, String outPath) {
        FlowGraph graph = BpmnHelper.parseBpmnFile(inPath);
        writeDiagram(converter, converter.toTree(graph), outPath);
    }

    private void writeDiagram(ProcessConverter converter, PstNode tree, String bpmnPath) {
        Document doc = converter.toBpmnDocument(tree);
        BpmnGenerator.writeBpmnDocument(doc, bpmnPath);
        out.println("✅ BPMN diagram saved as " + bpmnPath);
    }

    private void validate(String bpmnPath) {
        BpmnValidator.validate(new File(bpmnPath));
        out.println("✅ " + bpmnPath + " is a valid BPMN document");
    }

    private int usage(String problem) {
        out.println("❌ " + problem);
        out.println("Usage: (structure <in.bpmn> <out.txt> | render <in.txt> <out.bpmn> "
                + "| roundtrip <in.bpmn> <out.bpmn> | validate <file.bpmn>) [--config <file.json>]");
        return USAGE;
    }

    private static String describe(Throwable e) {
        StringBuilder message = new StringBuilder(String.valueOf(e.getMessage()));
        Throwable cause = e.getCause();
        while (cause != null && cause != e) {
            message.append(": ").append(cause.getMessage());
            e = cause;
            cause = cause.getCause();
        }
        return message.toString();
    }

    public static void main(String[] args) {
        int exitCode = new Main(System.out).run(args);
        if (exitCode != OK) {
            System.exit(exitCode);
        }
    }
}

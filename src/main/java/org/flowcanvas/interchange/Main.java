package org.flowcanvas.interchange;

import org.camunda.bpm.model.xml.ModelException;
import org.flowcanvas.interchange.bpmn.BpmnCodecException;
import org.flowcanvas.interchange.bpmn.BpmnDecoder;
import org.flowcanvas.interchange.bpmn.BpmnEncoder;
import org.flowcanvas.interchange.bpmn.BpmnValidator;
import org.flowcanvas.interchange.bpmn.CodecWarning;
import org.flowcanvas.interchange.bpmn.DecodeMode;
import org.flowcanvas.interchange.bpmn.DecodeResult;
import org.flowcanvas.interchange.bpmn.EncodeResult;
import org.flowcanvas.interchange.bpmn.IdAllocator;
import org.flowcanvas.interchange.config.CodecConfig;
import org.flowcanvas.interchange.config.CodecConfigHelper;
import org.flowcanvas.interchange.graph.GraphFileHelper;
import org.flowcanvas.interchange.graph.ProcessGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point.
 * <pre>
 * decode    &lt;in.bpmn&gt; &lt;out.json&gt;
 * encode    &lt;in.json&gt; &lt;out.bpmn&gt;
 * roundtrip &lt;in.bpmn&gt; &lt;out.bpmn&gt;
 * validate  &lt;in.bpmn&gt;
 * options: --strict, --config &lt;file&gt;
 * </pre>
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private CodecConfig config;
    private IdAllocator ids;

    public static void main(String[] args) throws Exception {
        int status = new Main().run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return the process exit status
     */
    public int run(String[] args) {
        List<String> positional = new ArrayList<>();
        boolean strict = false;
        String configPath = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--strict" -> strict = true;
                case "--config" -> {
                    if (i + 1 >= args.length) {
                        return usage("--config needs a file");
                    }
                    configPath = args[++i];
                }
                default -> positional.add(args[i]);
            }
        }
        if (positional.isEmpty()) {
            return usage("no command given");
        }

        String command = positional.get(0);
        List<String> files = positional.subList(1, positional.size());
        try {
            config = configPath == null ? CodecConfigHelper.loadDefaults() : CodecConfigHelper.loadConfig(configPath);
            if (strict) {
                config.mode = DecodeMode.STRICT.name();
            }
            ids = CodecConfigHelper.newIdAllocator(config);

            switch (command) {
                case "decode" -> {
                    if (files.size() != 2) {
                        return usage("decode needs <in.bpmn> <out.json>");
                    }
                    GraphFileHelper.writeGraph(decode(Path.of(files.get(0))), Path.of(files.get(1)));
                }
                case "encode" -> {
                    if (files.size() != 2) {
                        return usage("encode needs <in.json> <out.bpmn>");
                    }
                    encode(GraphFileHelper.readGraph(Path.of(files.get(0))), Path.of(files.get(1)));
                }
                case "roundtrip" -> {
                    if (files.size() != 2) {
                        return usage("roundtrip needs <in.bpmn> <out.bpmn>");
                    }
                    encode(decode(Path.of(files.get(0))), Path.of(files.get(1)));
                }
                case "validate" -> {
                    if (files.size() != 1) {
                        return usage("validate needs <in.bpmn>");
                    }
                    BpmnValidator.validate(new File(files.get(0)));
                    log.info("{} is valid", files.get(0));
                }
                default -> {
                    return usage("unknown command '" + command + "'");
                }
            }
        } catch (BpmnCodecException e) {
            log.error("{} failed: {}", command, e.getMessage());
            return 1;
        } catch (ModelException e) {
            log.error("{} is not valid BPMN: {}", files.get(0), e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("{} failed: cannot access {}", command, e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            log.error("{} failed: {}", command, e.getMessage());
            return 1;
        }
        return 0;
    }

    private ProcessGraph decode(Path input) throws IOException {
        String xml = Files.readString(input, StandardCharsets.UTF_8);
        DecodeResult result = new BpmnDecoder(ids, config.decodeMode()).decode(xml);
        log.info("Decoded {}: {} node(s), {} edge(s), {} warning(s)", input,
                result.graph().nodes().size(), result.graph().edges().size(), result.warnings().size());
        return result.graph();
    }

    private void encode(ProcessGraph graph, Path output) throws IOException {
        EncodeResult result = new BpmnEncoder(ids, config).encodeWithReport(graph);
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, result.xml(), StandardCharsets.UTF_8);
        for (CodecWarning warning : result.warnings()) {
            log.debug("Left out {}: {}", warning.elementId(), warning.message());
        }
        log.info("Wrote {} ({} element(s) left out)", output, result.warnings().size());
    }

    private int usage(String problem) {
        log.error("{}. Usage: decode <in.bpmn> <out.json> | encode <in.json> <out.bpmn> | "
                + "roundtrip <in.bpmn> <out.bpmn> | validate <in.bpmn> [--strict] [--config <file>]", problem);
        return 2;
    }
}

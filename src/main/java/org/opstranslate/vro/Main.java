package org.opstranslate.vro;

import org.opstranslate.vro.action.ActionIndex;
import org.opstranslate.vro.action.ActionIndexHelper;
import org.opstranslate.vro.config.TranslatorConfigHelper;
import org.opstranslate.vro.config.models.TranslatorConfig;
import org.opstranslate.vro.integration.IntegrationMappings;
import org.opstranslate.vro.locking.LockingSetupDocGenerator;
import org.opstranslate.vro.task.models.GuardedBlock;
import org.opstranslate.vro.task.models.TaskNode;
import org.opstranslate.vro.translate.TaskWriter;
import org.opstranslate.vro.translate.WorkflowTranslator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Translates every workflow of an exported vRO bundle.
 * <p>
 * Usage: {@code Main <bundleDir> [outputDir] [translator-config.json]}
 */
public class Main {
    private static final String ACTION_SUFFIX = ".action.xml";
    private static final String WORKFLOW_SUFFIX = ".workflow.xml";

    // ------ Inputs
    private final Path bundleDir;
    private final Path outputDir;
    private final Path configPath;

    // ------- Loaded state
    private TranslatorConfig config;
    private IntegrationMappings mappings;
    private ActionIndex actionIndex;

    public Main(Path bundleDir, Path outputDir, Path configPath) {
        this.bundleDir = bundleDir;
        this.outputDir = outputDir;
        this.configPath = configPath;
    }

    public void run() throws IOException {
        loadConfig();
        buildActionIndex();
        translateWorkflows();
    }

    private void loadConfig() throws IOException {
        if (configPath != null) {
            config = TranslatorConfigHelper.loadConfig(configPath);
            mappings = TranslatorConfigHelper.mappings(config, configPath.toAbsolutePath().getParent());
        } else {
            config = TranslatorConfigHelper.defaults();
            mappings = TranslatorConfigHelper.mappings(config, null);
        }
        System.out.println("Locking: " + (config.locking.enabled ? config.locking.backend : "disabled")
                + ", approval model: " + config.approval.model);
    }

    private void buildActionIndex() {
        actionIndex = new ActionIndex();
        actionIndex.build(findFiles(ACTION_SUFFIX));
        ActionIndexHelper.saveActionIndex(actionIndex, outputDir.resolve("action_index.json"));
    }

    private void translateWorkflows() {
        WorkflowTranslator translator = new WorkflowTranslator(config, mappings, actionIndex);
        boolean usesLocking = false;

        for (Path workflowFile : findFiles(WORKFLOW_SUFFIX)) {
            List<TaskNode> tasks = translator.translate(workflowFile);
            String name = workflowFile.getFileName().toString();
            name = name.substring(0, name.length() - WORKFLOW_SUFFIX.length());

            Path target = outputDir.resolve("tasks").resolve(name + ".json");
            TaskWriter.write(tasks, target);
            System.out.println("Wrote " + tasks.size() + " tasks to " + target);

            usesLocking |= tasks.stream().anyMatch(t -> t instanceof GuardedBlock && t.tags().contains("locking"));
        }

        if (usesLocking) {
            LockingSetupDocGenerator.write(config.locking.backend, outputDir.resolve("LOCKING_SETUP.md"));
        }
    }

    // sorted, so output never depends on directory iteration order
    private List<Path> findFiles(String suffix) {
        try (Stream<Path> walk = Files.walk(bundleDir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(suffix))
                    .sorted()
                    .collect(Collectors.toCollection(ArrayList::new));
        } catch (IOException e) {
            throw new RuntimeException("Failed to scan bundle directory: " + bundleDir, e);
        }
    }

    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            System.err.println("Usage: Main <bundleDir> [outputDir] [translator-config.json]");
            System.exit(2);
        }
        Path bundleDir = Path.of(args[0]);
        Path outputDir = args.length > 1 ? Path.of(args[1]) : Path.of("output");
        Path configPath = args.length > 2 ? Path.of(args[2]) : null;

        new Main(bundleDir, outputDir, configPath).run();
    }
}

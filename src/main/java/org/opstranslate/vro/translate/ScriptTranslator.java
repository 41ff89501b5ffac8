package org.opstranslate.vro.translate;

import org.opstranslate.vro.config.models.LockingConfig;
import org.opstranslate.vro.errorhandling.ErrorHandlingExtractor;
import org.opstranslate.vro.errorhandling.ErrorHandlingTranslator;
import org.opstranslate.vro.errorhandling.models.ErrorHandlingBlock;
import org.opstranslate.vro.integration.ConfigurationFacts;
import org.opstranslate.vro.integration.IntegrationCallExtractor;
import org.opstranslate.vro.integration.IntegrationMappings;
import org.opstranslate.vro.locking.LockingHelper;
import org.opstranslate.vro.locking.LockingTaskGenerator;
import org.opstranslate.vro.locking.models.LockPattern;
import org.opstranslate.vro.script.AssignmentExtractor;
import org.opstranslate.vro.script.CallStatementExtractor;
import org.opstranslate.vro.script.LogExtractor;
import org.opstranslate.vro.script.StatementExtractor;
import org.opstranslate.vro.script.ValidationExtractor;
import org.opstranslate.vro.task.models.TargetActions;
import org.opstranslate.vro.task.models.TaskNode;
import org.opstranslate.vro.task.models.TranslatedTask;
import org.opstranslate.vro.workflow.models.WorkflowItem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates one item script. Constructs are handled outside-in: locking first, then
 * try/catch/finally, then the flat statement extractors. Only the outermost script is checked for
 * locking; fragments inside a lock are translated without it.
 */
public class ScriptTranslator {
    private final LockingConfig lockingConfig;
    private final LockingTaskGenerator lockingGenerator;
    private final List<StatementExtractor> extractors;

    public ScriptTranslator(LockingConfig lockingConfig, IntegrationMappings mappings, ConfigurationFacts facts) {
        this.lockingConfig = lockingConfig == null ? new LockingConfig() : lockingConfig;
        this.lockingGenerator = this.lockingConfig.enabled
                ? new LockingTaskGenerator(this.lockingConfig.backend)
                : null;

        IntegrationCallExtractor integrationExtractor = new IntegrationCallExtractor(mappings, facts);
        // order of the flat output
        this.extractors = List.of(
                integrationExtractor,
                new LogExtractor(),
                new ValidationExtractor(),
                new AssignmentExtractor(),
                new CallStatementExtractor(integrationExtractor::claims));
    }

    public List<TaskNode> translate(String script, WorkflowItem item) {
        if (script == null || script.isBlank()) {
            return List.of();
        }
        List<LockPattern> locks = LockingHelper.detectLockingPatterns(script);
        if (locks.isEmpty()) {
            return translateWithoutLocking(script, item);
        }
        return translateLocked(script, item, locks);
    }

    private List<TaskNode> translateLocked(String script, WorkflowItem item, List<LockPattern> locks) {
        List<TaskNode> tasks = new ArrayList<>();

        if (lockingGenerator == null) {
            tasks.add(note("Locking disabled: " + item.displayName(),
                    "Script uses LockingSystem on " + resources(locks) + " but locking synthesis is disabled; "
                            + "concurrent runs are not serialized",
                    List.of("locking", "review")));
            tasks.addAll(translateWithoutLocking(script, item));
            return tasks;
        }

        LockPattern lock = locks.get(0);
        if (!lock.isReleased() && !lockingConfig.acknowledgeUnreleased) {
            tasks.add(note("REVIEW: lock never released: " + lock.resource(),
                    "LockingSystem lock on '" + lock.resource() + "' in '" + item.displayName()
                            + "' has no matching unlock. Fix the workflow or set locking.acknowledgeUnreleased",
                    List.of("locking", "todo")));
            tasks.addAll(translateWithoutLocking(script, item));
            tasks.addAll(additionalLockNotes(locks, item));
            return tasks;
        }

        int workEnd;
        String work;
        if (!lock.isReleased()) {
            workEnd = script.length();
            work = script.substring(lock.lockEnd());
        } else {
            workEnd = lockedRegionEnd(script, lock);
            work = script.substring(lock.lockEnd(), lock.unlockPosition())
                    + script.substring(lock.unlockEnd(), workEnd);
        }

        tasks.addAll(translateWithoutLocking(script.substring(0, lock.lockPosition()), item));
        tasks.add(lockingGenerator.generateLockTasks(lock, translateWithoutLocking(work, item)));
        tasks.addAll(translateWithoutLocking(script.substring(workEnd), item));

        tasks.addAll(additionalLockNotes(locks, item));
        return tasks;
    }

    private static List<TaskNode> additionalLockNotes(List<LockPattern> locks, WorkflowItem item) {
        List<TaskNode> notes = new ArrayList<>();
        for (LockPattern other : locks.subList(1, locks.size())) {
            notes.add(note("REVIEW: additional lock: " + other.resource(),
                    "Only the first lock of '" + item.displayName() + "' is synthesized; review the lock on '"
                            + other.resource() + "' manually",
                    List.of("locking", "review")));
        }
        return notes;
    }

    // the unlock usually sits in a finally block; the whole try construct then belongs to the lock
    private static int lockedRegionEnd(String script, LockPattern lock) {
        if (lock.hasTryFinally()) {
            Optional<ErrorHandlingBlock> construct = ErrorHandlingExtractor.extract(script.substring(lock.lockEnd()));
            if (construct.isPresent()) {
                int constructEnd = lock.lockEnd() + construct.get().end();
                if (constructEnd >= lock.unlockEnd()) {
                    return constructEnd;
                }
            }
        }
        return lock.unlockEnd();
    }

    List<TaskNode> translateWithoutLocking(String script, WorkflowItem item) {
        if (script == null || script.isBlank()) {
            return List.of();
        }

        Optional<ErrorHandlingBlock> construct = ErrorHandlingExtractor.extract(script);
        if (construct.isEmpty()) {
            return translateFlat(script, item);
        }

        ErrorHandlingBlock block = construct.get();
        ErrorHandlingTranslator errorHandling =
                new ErrorHandlingTranslator(fragment -> translateWithoutLocking(fragment, item));

        List<TaskNode> tasks = new ArrayList<>(translateFlat(script.substring(0, block.tryStart()), item));
        tasks.add(errorHandling.translate(block, item));
        tasks.addAll(translateWithoutLocking(script.substring(block.end()), item));
        return tasks;
    }

    List<TaskNode> translateFlat(String script, WorkflowItem item) {
        List<TaskNode> tasks = new ArrayList<>();
        if (script.isBlank()) {
            return tasks;
        }
        for (StatementExtractor extractor : extractors) {
            tasks.addAll(extractor.extract(script, item));
        }
        return tasks;
    }

    private static String resources(List<LockPattern> locks) {
        return String.join(", ", locks.stream().map(l -> "'" + l.resource() + "'").toList());
    }

    private static TranslatedTask note(String name, String message, List<String> tags) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("msg", message);
        return TranslatedTask.builder()
                .name(name)
                .action(TargetActions.DEBUG)
                .params(params)
                .tags(tags)
                .build();
    }
}

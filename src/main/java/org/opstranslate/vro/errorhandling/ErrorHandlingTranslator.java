package org.opstranslate.vro.errorhandling;

import org.opstranslate.vro.errorhandling.models.ErrorHandlingBlock;
import org.opstranslate.vro.task.models.GuardedBlock;
import org.opstranslate.vro.task.models.TargetActions;
import org.opstranslate.vro.task.models.TaskNode;
import org.opstranslate.vro.task.models.TranslatedTask;
import org.opstranslate.vro.workflow.models.WorkflowItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Maps a try/catch/finally construct onto a guarded block: try → primary, catch → onFailure,
 * finally → always.
 */
public class ErrorHandlingTranslator {
    static final String FAILED_RESULT_MSG = "{{ ansible_failed_result.msg | default('unknown error') }}";

    private final Function<String, List<TaskNode>> fragmentTranslator;

    /**
     * @param fragmentTranslator translates the statements inside each section
     */
    public ErrorHandlingTranslator(Function<String, List<TaskNode>> fragmentTranslator) {
        this.fragmentTranslator = fragmentTranslator;
    }

    public GuardedBlock translate(ErrorHandlingBlock block, WorkflowItem item) {
        List<TaskNode> primary = fragmentTranslator.apply(block.tryBody());

        List<TaskNode> onFailure = null;
        if (block.hasCatch()) {
            onFailure = new ArrayList<>();
            onFailure.add(TranslatedTask.builder()
                    .name("Log error: " + item.displayName())
                    .action(TargetActions.DEBUG)
                    .params(Map.of("msg", FAILED_RESULT_MSG))
                    .build());
            onFailure.addAll(fragmentTranslator.apply(block.catchBody()));
            if (rethrows(block)) {
                onFailure.add(TranslatedTask.builder()
                        .name("Re-raise error: " + item.displayName())
                        .action(TargetActions.FAIL)
                        .params(Map.of("msg", FAILED_RESULT_MSG))
                        .comment("catch block rethrows " + block.catchVar())
                        .build());
            }
        }

        List<TaskNode> always = null;
        if (block.hasFinally()) {
            always = new ArrayList<>(fragmentTranslator.apply(block.finallyBody()));
            if (always.isEmpty()) {
                always.add(TranslatedTask.builder()
                        .name("Finally: " + item.displayName())
                        .action(TargetActions.DEBUG)
                        .params(Map.of("msg", "No translatable statements in finally block of " + item.displayName()))
                        .build());
            }
        }

        return GuardedBlock.builder()
                .name("Error handling: " + item.displayName())
                .primary(primary)
                .onFailure(onFailure)
                .always(always)
                .tags(List.of("error_handling"))
                .comment(describe(block) + " in " + item.name())
                .build();
    }

    private static String describe(ErrorHandlingBlock block) {
        StringBuilder construct = new StringBuilder("try");
        if (block.hasCatch()) {
            construct.append("/catch");
        }
        if (block.hasFinally()) {
            construct.append("/finally");
        }
        return construct.toString();
    }

    private static boolean rethrows(ErrorHandlingBlock block) {
        if (block.catchVar() == null) {
            return false;
        }
        return Pattern.compile("\\bthrow\\s+" + Pattern.quote(block.catchVar()) + "\\s*;")
                .matcher(block.catchBody())
                .find();
    }
}

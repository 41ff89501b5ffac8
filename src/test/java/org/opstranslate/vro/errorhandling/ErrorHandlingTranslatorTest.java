package org.opstranslate.vro.errorhandling;

import org.junit.jupiter.api.Test;
import org.opstranslate.vro.errorhandling.models.ErrorHandlingBlock;
import org.opstranslate.vro.task.models.GuardedBlock;
import org.opstranslate.vro.task.models.TargetActions;
import org.opstranslate.vro.task.models.TaskNode;
import org.opstranslate.vro.task.models.TranslatedTask;
import org.opstranslate.vro.workflow.models.WorkflowItem;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ErrorHandlingTranslatorTest {
    private static final WorkflowItem ITEM = WorkflowItem.builder()
            .name("item3")
            .displayName("Deploy")
            .build();

    // One debug task per non-blank fragment, so the sections are easy to inspect.
    private final ErrorHandlingTranslator translator = new ErrorHandlingTranslator(fragment -> fragment.isBlank()
            ? List.of()
            : List.of(new TranslatedTask("Fragment", TargetActions.DEBUG, Map.of("msg", fragment))));

    @Test
    void shouldMapTryCatchFinallyToGuardedBlock() {
        ErrorHandlingBlock block = new ErrorHandlingBlock(0, 10, "deploy();", "e", "notify();", "cleanup();");

        GuardedBlock guarded = translator.translate(block, ITEM);

        assertEquals("Error handling: Deploy", guarded.name());
        assertEquals(List.of("error_handling"), guarded.tags());
        assertEquals("try/catch/finally in item3", guarded.comment());
        assertEquals(1, guarded.primary().size());
        assertEquals("deploy();", ((TranslatedTask) guarded.primary().get(0)).params().get("msg"));

        List<TaskNode> onFailure = guarded.onFailure();
        assertEquals(2, onFailure.size());
        TranslatedTask logError = (TranslatedTask) onFailure.get(0);
        assertEquals("Log error: Deploy", logError.name());
        assertEquals(ErrorHandlingTranslator.FAILED_RESULT_MSG, logError.params().get("msg"));
        assertEquals("notify();", ((TranslatedTask) onFailure.get(1)).params().get("msg"));

        assertEquals("cleanup();", ((TranslatedTask) guarded.always().get(0)).params().get("msg"));
    }

    @Test
    void shouldReRaiseWhenCatchRethrows() {
        ErrorHandlingBlock block = new ErrorHandlingBlock(0, 10, "deploy();", "err", "System.error(err);\nthrow err;", null);

        GuardedBlock guarded = translator.translate(block, ITEM);

        TranslatedTask last = (TranslatedTask) guarded.onFailure().get(guarded.onFailure().size() - 1);
        assertEquals("Re-raise error: Deploy", last.name());
        assertEquals(TargetActions.FAIL, last.action());
        assertNull(guarded.always());
        assertEquals("try/catch in item3", guarded.comment());
    }

    @Test
    void shouldNotReRaiseWhenDifferentValueIsThrown() {
        ErrorHandlingBlock block = new ErrorHandlingBlock(0, 10, "deploy();", "err", "throw \"other\";", null);

        GuardedBlock guarded = translator.translate(block, ITEM);

        assertTrue(guarded.onFailure().stream().noneMatch(t -> t.name().startsWith("Re-raise")));
    }

    @Test
    void shouldKeepAbsentCatchAbsentAndFillEmptyFinally() {
        ErrorHandlingBlock block = new ErrorHandlingBlock(0, 10, "deploy();", null, null, "");

        GuardedBlock guarded = translator.translate(block, ITEM);

        assertNull(guarded.onFailure());
        assertEquals(1, guarded.always().size());
        assertEquals("Finally: Deploy", guarded.always().get(0).name());
        assertEquals("try/finally in item3", guarded.comment());
    }
}

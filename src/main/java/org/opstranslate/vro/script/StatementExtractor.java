package org.opstranslate.vro.script;

import org.opstranslate.vro.task.models.TranslatedTask;
import org.opstranslate.vro.workflow.models.WorkflowItem;

import java.util.List;

/**
 * Recognizes one family of statements in a script fragment and turns each occurrence into a task.
 */
public interface StatementExtractor {

    /**
     * @param script script fragment, never null
     * @param item   item the fragment belongs to, used for naming and annotations
     * @return tasks in source order, empty when nothing matched
     */
    List<TranslatedTask> extract(String script, WorkflowItem item);
}

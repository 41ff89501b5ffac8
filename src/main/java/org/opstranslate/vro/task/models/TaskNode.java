package org.opstranslate.vro.task.models;

import java.util.List;

/**
 * A node of the translated task stream: either a single {@link TranslatedTask}
 * or a {@link GuardedBlock} grouping other nodes.
 */
public interface TaskNode {

    String name();

    List<String> tags();

    String comment();
}

package org.opstranslate.vro.task.models;

import lombok.Builder;

import java.util.List;

/**
 * Guarded execution structure, the target runtime's try/catch/finally.
 * A {@code null} section is absent; it is never replaced by an empty list.
 *
 * @param name      block name
 * @param primary   tasks executed first
 * @param onFailure tasks executed when a primary task fails, or null
 * @param always    tasks executed in every case, or null
 * @param tags      classification tags
 * @param comment   explanatory annotation
 */
@Builder
public record GuardedBlock(
        String name,
        List<TaskNode> primary,
        List<TaskNode> onFailure,
        List<TaskNode> always,
        List<String> tags,
        String comment
) implements TaskNode {

    public GuardedBlock {
        primary = primary == null ? List.of() : List.copyOf(primary);
        onFailure = onFailure == null ? null : List.copyOf(onFailure);
        always = always == null ? null : List.copyOf(always);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}

package org.opstranslate.vro.task.models;

import lombok.Builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One target task produced by the translator.
 *
 * @param name       human readable task name
 * @param action     target module, e.g. "ansible.builtin.debug"
 * @param params     module parameters, insertion ordered (strings, booleans, numbers or nested maps)
 * @param when       optional guard expression
 * @param register   optional result variable
 * @param until      retry condition (lock acquisition only)
 * @param retries    retry count (lock acquisition only)
 * @param delay      delay between retries in seconds
 * @param failedWhen optional failure override
 * @param tags       classification tags
 * @param comment    explanatory annotation, usually naming the source item
 */
@Builder
public record TranslatedTask(
        String name,
        String action,
        Map<String, Object> params,
        String when,
        String register,
        String until,
        Integer retries,
        Integer delay,
        String failedWhen,
        List<String> tags,
        String comment
) implements TaskNode {

    public TranslatedTask {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public TranslatedTask(String name, String action, Map<String, Object> params) {
        this(name, action, params, null, null, null, null, null, null, new ArrayList<>(), null);
    }

    public TranslatedTaskBuilder toBuilder() {
        return TranslatedTask.builder()
                .name(this.name)
                .action(this.action)
                .params(this.params)
                .when(this.when)
                .register(this.register)
                .until(this.until)
                .retries(this.retries)
                .delay(this.delay)
                .failedWhen(this.failedWhen)
                .tags(this.tags)
                .comment(this.comment);
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }
}

package io.b2mash.workhub.task;

import java.util.List;

/** One page of a task query, with the pre-pagination match count. */
public record TaskPage(List<Task> items, long total, int limit, int offset) {}

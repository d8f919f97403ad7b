package com.github.trinity.elasticalign;

/**
 * State left by one round: the template produced by the update and the matching pass it
 * was computed from. The initialization frame carries no matching pass.
 *
 * @author trinity-xai
 */
public record IterationFrame(Template template, MatchResult match) {
}

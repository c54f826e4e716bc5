package org.Meridian.routing.ch;

/**
 * Arc added during contraction that stands for {@code source -> via -> target}.
 *
 * @param source tail node.
 * @param target head node.
 * @param cost sum of the two constituent arc costs.
 * @param via node whose contraction created the shortcut.
 * @param lowerArc arc {@code source -> via}.
 * @param upperArc arc {@code via -> target}.
 */
public record Shortcut(int source, int target, double cost, int via, int lowerArc, int upperArc) {
}

package com.signalarena.common.model;

/**
 * How a round's winner was chosen.
 *
 * <ul>
 *   <li>EXPLORE: uniform random pick among candidates</li>
 *   <li>EXPLOIT: highest weighted score</li>
 *   <li>NONE: no actionable candidate, so no winner</li>
 * </ul>
 */
public enum SelectionMode {
    EXPLORE,
    EXPLOIT,
    NONE
}

package com.neutrala.steps;

/**
 * Source location and call frame a step is attributed to.
 */
record StepOrigin(String file, int line, String function, String frameId, int callDepth) {
}

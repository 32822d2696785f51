package com.neutrala.toolchain;

/**
 * Outcome of one toolchain presence check.
 *
 * @param name   check name, e.g. {@code platform_bin} or {@code clang++}
 * @param ok     whether the check passed
 * @param detail path checked, or version output
 */
public record ToolchainCheck(String name, boolean ok, String detail) {}

package com.neutrala.toolchain;

import java.util.List;

public record ToolchainReport(List<ToolchainCheck> checks) {

    public boolean ok() {
        return checks.stream().allMatch(ToolchainCheck::ok);
    }

    public List<ToolchainCheck> failed() {
        return checks.stream().filter(c -> !c.ok()).toList();
    }
}

package com.fintech.bankrec.cli;

import java.util.Arrays;
import java.util.Optional;

public enum CliCommand {
    RECONCILE("reconcile", false),
    IMPORT_RECEIPTS("import-receipts", true),
    IMPORT_TRANSACTIONS("import-transactions", true);

    private final String name;
    private final boolean requiresFile;

    CliCommand(String name, boolean requiresFile) {
        this.name = name;
        this.requiresFile = requiresFile;
    }

    public String getName() {
        return name;
    }

    public boolean requiresFile() {
        return requiresFile;
    }

    public static Optional<CliCommand> fromName(String name) {
        return Arrays.stream(values()).filter(c -> c.name.equals(name)).findFirst();
    }
}

package com.compilebox.backend.analysis;

/**
 * Compiler AST output together with the slice of it that belongs to the
 * user's module.
 */
public record AstDump(String full, String userModule) {

    public AstDump {
        full       = full == null ? "" : full;
        userModule = userModule == null ? "" : userModule;
    }

    public static AstDump of(String full) {
        return new AstDump(full, UserModuleLocator.locate(full));
    }
}

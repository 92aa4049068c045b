package com.compilebox.backend.analysis;

import com.compilebox.backend.model.SymbolKind;

import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One text pattern applied to an AST dump, in the order declared here.
 *
 * Rules only see the dump and the symbols found by earlier rules. Most of
 * them look at the user's module; {@link #EXTERNAL_FUNCTIONS} scans the whole
 * dump because external declarations live in the library modules.
 * Unless noted, a rule never overwrites a name an earlier rule classified.
 */
public enum AstSymbolRule {

    /** {@code (Function "name" "functype"} without an External flag on the same line. */
    USER_FUNCTIONS {
        private final Pattern pattern = Pattern.compile("\\(Function \"([^\"]+)\" \"functype\"(?!.*External)");
        private final Set<String> runtimeNames = Set.of("строка", "кс", "цел64", "ф");

        @Override
        void apply(AstDump dump, Map<String, SymbolKind> symbols) {
            Matcher m = pattern.matcher(dump.userModule());
            while (m.find()) {
                String name = m.group(1);
                if (!name.startsWith("tri_") && !name.startsWith("sysapi_")
                        && !runtimeNames.contains(name) && name.length() > 1) {
                    symbols.put(name, SymbolKind.USER_FUNCTION);
                }
            }
        }
    },

    /** {@code (Import "стд::вывод"} makes {@code вывод} an imported class. */
    IMPORTS {
        private final Pattern pattern = Pattern.compile("\\(Import \"([^\"]+)\"");

        @Override
        void apply(AstDump dump, Map<String, SymbolKind> symbols) {
            Matcher m = pattern.matcher(dump.userModule());
            while (m.find()) {
                String[] parts = m.group(1).split("::");
                if (parts.length > 1) {
                    symbols.put(parts[parts.length - 1], SymbolKind.IMPORTED_CLASS);
                }
            }
        }
    },

    /** {@code (VarDecl "name" "type"}; overrides earlier rules. */
    VARIABLE_DECLARATIONS {
        private final Pattern pattern = Pattern.compile("\\(VarDecl \"([^\"]+)\" \"([^\"]*?)\"");

        @Override
        void apply(AstDump dump, Map<String, SymbolKind> symbols) {
            Matcher m = pattern.matcher(dump.userModule());
            while (m.find()) {
                String name = m.group(1);
                if (!LanguageVocabulary.isKeyword(name) && name.length() > 1) {
                    symbols.put(name, SymbolKind.USER_VARIABLE);
                }
            }
        }
    },

    /**
     * {@code (IdentExpr "type" "name")} for short names not seen yet and not
     * declared as a function earlier in the module.
     */
    PARAMETERS {
        private final Pattern pattern = Pattern.compile("\\(IdentExpr \"[^\"]+\" \"([^\"]+)\"\\)");

        @Override
        void apply(AstDump dump, Map<String, SymbolKind> symbols) {
            String module = dump.userModule();
            Matcher m = pattern.matcher(module);
            while (m.find()) {
                String name = m.group(1);
                if (LanguageVocabulary.isKeyword(name) || LanguageVocabulary.isBuiltInType(name)
                        || symbols.containsKey(name) || name.equals("RO")
                        || name.length() > MAX_PARAMETER_LENGTH || !Character.isLetter(name.charAt(0))) {
                    continue;
                }
                if (!module.substring(0, m.start()).contains(functionDeclaration(name))) {
                    symbols.put(name, SymbolKind.FUNCTION_PARAMETER);
                }
            }
        }
    },

    /** {@code (SelectorExpr "functype" "name")}: a method reached through an imported module. */
    SELECTORS {
        private final Pattern pattern = Pattern.compile("\\(SelectorExpr \"functype\" \"([^\"]+)\"\\)");

        @Override
        void apply(AstDump dump, Map<String, SymbolKind> symbols) {
            Matcher m = pattern.matcher(dump.userModule());
            while (m.find()) {
                String name = m.group(1);
                if (!symbols.containsKey(name) && !LanguageVocabulary.isKeyword(name)) {
                    symbols.put(name, SymbolKind.IMPORTED_FUNCTION);
                }
            }
        }
    },

    /** Calls without a result whose callee is defined in the user's module. */
    LOCAL_CALLS {
        private final Pattern pattern = Pattern.compile(
                "\\(CallExpr \"нет результата\" \\(IdentExpr \"functype\" RO \"([^\"]+)\"\\)");

        @Override
        void apply(AstDump dump, Map<String, SymbolKind> symbols) {
            String module = dump.userModule();
            Matcher m = pattern.matcher(module);
            while (m.find()) {
                String name = m.group(1);
                if (!symbols.containsKey(name) && !name.startsWith("std") && name.length() > 1
                        && !LanguageVocabulary.isKeyword(name)
                        && module.contains(functionDeclaration(name))) {
                    symbols.put(name, SymbolKind.USER_FUNCTION);
                }
            }
        }
    },

    /** Functions flagged External anywhere in the dump. */
    EXTERNAL_FUNCTIONS {
        private final Pattern pattern = Pattern.compile("\\(Function \"([^\"]+)\" \"functype\"[^(]*External");

        @Override
        void apply(AstDump dump, Map<String, SymbolKind> symbols) {
            Matcher m = pattern.matcher(dump.full());
            while (m.find()) {
                symbols.putIfAbsent(m.group(1), SymbolKind.IMPORTED_FUNCTION);
            }
        }
    },

    /**
     * Last resort: an identifier expression is a variable if the module also
     * declares it or assigns to/from it.
     */
    VARIABLE_USAGES {
        private final Pattern pattern = Pattern.compile("\\(IdentExpr\\s+\"[^\"]*\"\\s+\"([^\"]+)\"\\)(?!\\s*\\))");

        @Override
        void apply(AstDump dump, Map<String, SymbolKind> symbols) {
            String module = dump.userModule();
            Matcher m = pattern.matcher(module);
            while (m.find()) {
                String name = m.group(1);
                if (symbols.containsKey(name) || LanguageVocabulary.isKeyword(name)
                        || LanguageVocabulary.isBuiltInType(name) || name.length() <= 1) {
                    continue;
                }
                if (module.contains("(VarDecl \"" + name + "\"")
                        || module.contains("= " + name)
                        || module.contains(name + " =")) {
                    symbols.put(name, SymbolKind.USER_VARIABLE);
                }
            }
        }
    };

    static final int MAX_PARAMETER_LENGTH = 10;

    abstract void apply(AstDump dump, Map<String, SymbolKind> symbols);

    private static String functionDeclaration(String name) {
        return "(Function \"" + name + "\" \"functype\"";
    }
}

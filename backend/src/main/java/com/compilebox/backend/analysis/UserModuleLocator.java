package com.compilebox.backend.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the part of an AST dump that belongs to the user's own module.
 *
 * The dump lists every module the compiler loaded (standard library first),
 * so the user's code has to be picked out. Strategies are tried in order and
 * the first hit wins:
 * <ol>
 *   <li>the last module block before the last {@code Execute:} marker;</li>
 *   <li>the module block that contains {@code (EntryFn};</li>
 *   <li>the last module whose name is not a standard/system module;</li>
 *   <li>the trailing {@value #TAIL_LENGTH} characters of the dump.</li>
 * </ol>
 */
public final class UserModuleLocator {

    private static final Logger log = LoggerFactory.getLogger(UserModuleLocator.class);

    static final String MODULE_OPEN    = "(Module \"";
    static final String EXECUTE_MARKER = "Execute:";
    static final String ENTRY_MARKER   = "(EntryFn";
    static final int    TAIL_LENGTH    = 2000;

    private static final Pattern MODULE_NAME = Pattern.compile("\\(Module \"([^\"]+)\"");

    private static final List<String> SYSTEM_MODULE_PREFIXES = List.of("стд::", "sys::", "runtime::");
    private static final List<String> SYSTEM_MODULE_NAMES    = List.of("builtin", "core", "system");

    private static final List<Function<String, Optional<String>>> STRATEGIES = List.of(
            UserModuleLocator::beforeExecuteMarker,
            UserModuleLocator::containingEntryFunction,
            UserModuleLocator::lastNonSystemModule);

    private UserModuleLocator() {}

    /**
     * @return the user's module text; empty only for an empty dump
     */
    public static String locate(String astDump) {
        if (astDump == null || astDump.isEmpty()) {
            return "";
        }
        for (Function<String, Optional<String>> strategy : STRATEGIES) {
            Optional<String> found = strategy.apply(astDump);
            if (found.isPresent()) {
                log.debug("User module '{}' located ({} chars)", moduleName(found.get()), found.get().length());
                return found.get();
            }
        }
        log.warn("Could not identify user module, using last {} characters of the AST dump", TAIL_LENGTH);
        return astDump.substring(Math.max(0, astDump.length() - TAIL_LENGTH));
    }

    static Optional<String> beforeExecuteMarker(String dump) {
        int executeIndex = dump.lastIndexOf(EXECUTE_MARKER);
        if (executeIndex <= 0) {
            return Optional.empty();
        }
        int moduleStart = dump.substring(0, executeIndex).lastIndexOf(MODULE_OPEN);
        if (moduleStart < 0) {
            return Optional.empty();
        }
        return nonBlank(dump.substring(moduleStart, executeIndex));
    }

    static Optional<String> containingEntryFunction(String dump) {
        int entryIndex = dump.indexOf(ENTRY_MARKER);
        if (entryIndex < 0) {
            return Optional.empty();
        }
        int moduleStart = dump.substring(0, entryIndex).lastIndexOf(MODULE_OPEN);
        if (moduleStart < 0) {
            return Optional.empty();
        }
        return nonBlank(dump.substring(moduleStart, moduleEnd(dump, entryIndex)));
    }

    static Optional<String> lastNonSystemModule(String dump) {
        Matcher m = MODULE_NAME.matcher(dump);
        int lastUserStart = -1;
        while (m.find()) {
            if (!isSystemModule(m.group(1))) {
                lastUserStart = m.start();
            }
        }
        if (lastUserStart < 0) {
            return Optional.empty();
        }
        return nonBlank(dump.substring(lastUserStart, moduleEnd(dump, lastUserStart)));
    }

    static boolean isSystemModule(String name) {
        return SYSTEM_MODULE_PREFIXES.stream().anyMatch(name::startsWith)
                || SYSTEM_MODULE_NAMES.contains(name);
    }

    private static int moduleEnd(String dump, int from) {
        int end = dump.indexOf(EXECUTE_MARKER, from);
        return end < 0 ? dump.length() : end;
    }

    private static Optional<String> nonBlank(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
    }

    private static String moduleName(String moduleText) {
        Matcher m = MODULE_NAME.matcher(moduleText);
        return m.find() ? m.group(1) : "unknown";
    }
}

package com.compilebox.backend.analysis;

import com.compilebox.backend.model.SymbolKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns an AST dump into a name-to-kind map by running every
 * {@link AstSymbolRule} in declaration order.
 */
public final class AstSymbolExtractor {

    private static final Logger log = LoggerFactory.getLogger(AstSymbolExtractor.class);

    private AstSymbolExtractor() {}

    public static Map<String, SymbolKind> extract(String astOutput) {
        return extract(AstDump.of(astOutput));
    }

    public static Map<String, SymbolKind> extract(AstDump dump) {
        Map<String, SymbolKind> symbols = new LinkedHashMap<>();
        if (dump.full().isEmpty()) {
            return symbols;
        }
        for (AstSymbolRule rule : AstSymbolRule.values()) {
            int before = symbols.size();
            rule.apply(dump, symbols);
            log.trace("Rule {} added {} symbols", rule, symbols.size() - before);
        }
        log.debug("Extracted {} symbols from AST dump: {}", symbols.size(), symbols);
        return symbols;
    }
}

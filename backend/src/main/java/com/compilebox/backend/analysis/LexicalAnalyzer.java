package com.compilebox.backend.analysis;

import com.compilebox.backend.model.Token;
import com.compilebox.backend.model.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.compilebox.backend.analysis.LanguageVocabulary.IDENTIFIER;

/**
 * Static, line-oriented tokenizer.
 *
 * Pass 1 walks the whole snippet and collects declared function, parameter
 * and variable names. Pass 2 tokenizes each line, using those names to
 * classify identifiers that are used far from their declaration.
 *
 * <p>Within a line, tokens are emitted by category (comment, strings,
 * numbers, identifiers, operators), each category left to right. Consumers
 * that need strict document order must sort.
 *
 * <p>Never throws for string input and holds no state between calls.
 */
@Component
public class LexicalAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(LexicalAnalyzer.class);

    // Declarations (pass 1, and line-local in pass 2)
    private static final Pattern FUNCTION_DECL = Pattern.compile("фн\\s+(" + IDENTIFIER + ")\\s*\\(");
    private static final Pattern PAREN_GROUP   = Pattern.compile("\\(([^)]+)\\)");
    private static final Pattern PARAM_NAME    = Pattern.compile("(" + IDENTIFIER + ")\\s*:");
    private static final Pattern LET_DECL      = Pattern.compile("пусть\\s+(" + IDENTIFIER + ")\\s*=");
    private static final Pattern ASSIGNMENT    = Pattern.compile("(" + IDENTIFIER + ")\\s*=\\s*[^=]");

    // Lexemes (pass 2)
    private static final Pattern STRING     = Pattern.compile("\"(?:[^\"\\\\]++|\\\\.)*+\"");
    private static final Pattern NUMBER     = Pattern.compile("(?<![\\p{L}\\p{N}_])\\d+(?:\\.\\d+)?(?![\\p{L}\\p{N}_])");
    private static final Pattern IDENT      = Pattern.compile(IDENTIFIER);
    private static final Pattern OPERATOR   = Pattern.compile("[+\\-*/=<>!&|^%:;,.()\\[\\]{}]");
    private static final String  LINE_COMMENT = "//";

    /**
     * Names declared anywhere in a snippet.
     */
    record Declarations(Set<String> functions, Set<String> parameters, Set<String> variables) {}

    public List<Token> tokenize(String source) {
        String[] lines = (source == null ? "" : source).split("\n", -1);

        Declarations globals = collectDeclarations(lines);
        log.debug("Declarations: functions={}, parameters={}, variables={}",
                globals.functions(), globals.parameters(), globals.variables());

        List<Token> tokens = new ArrayList<>();
        for (int lineNo = 0; lineNo < lines.length; lineNo++) {
            tokenizeLine(lines[lineNo], lineNo, globals, tokens);
        }
        log.debug("Static pass produced {} tokens for {} lines", tokens.size(), lines.length);
        return tokens;
    }

    // ------------------------------------------------------------------
    // Pass 1
    // ------------------------------------------------------------------

    Declarations collectDeclarations(String[] lines) {
        Set<String> functions  = new LinkedHashSet<>();
        Set<String> parameters = new LinkedHashSet<>();
        Set<String> variables  = new LinkedHashSet<>();

        for (String line : lines) {
            collectGroup(FUNCTION_DECL, line, functions);
            collectParameters(line, parameters);

            collectGroup(LET_DECL, line, variables);
            Matcher assign = ASSIGNMENT.matcher(line);
            while (assign.find()) {
                String name = assign.group(1);
                if (!LanguageVocabulary.isKeyword(name) && !LanguageVocabulary.isBuiltInType(name)) {
                    variables.add(name);
                }
            }
        }
        return new Declarations(functions, parameters, variables);
    }

    private static void collectParameters(String line, Set<String> into) {
        Matcher group = PAREN_GROUP.matcher(line);
        while (group.find()) {
            collectGroup(PARAM_NAME, group.group(1), into);
        }
    }

    private static void collectGroup(Pattern pattern, String text, Set<String> into) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            into.add(m.group(1));
        }
    }

    // ------------------------------------------------------------------
    // Pass 2
    // ------------------------------------------------------------------

    private void tokenizeLine(String line, int lineNo, Declarations globals, List<Token> out) {
        List<int[]> strings = findStrings(line);

        String code = line;
        int commentStart = findCommentStart(line, strings);
        if (commentStart >= 0) {
            out.add(Token.of(lineNo, commentStart, line.length(), TokenKind.COMMENT, line.substring(commentStart)));
            code = line.substring(0, commentStart);
            strings = strings.stream().filter(range -> range[0] < commentStart).toList();
        }

        for (int[] range : strings) {
            out.add(Token.of(lineNo, range[0], range[1], TokenKind.STRING_LITERAL, code.substring(range[0], range[1])));
        }

        Matcher number = NUMBER.matcher(code);
        while (number.find()) {
            if (!inRanges(number.start(), strings)) {
                out.add(Token.of(lineNo, number.start(), number.end(), TokenKind.NUMBER_LITERAL, number.group()));
            }
        }

        emitIdentifiers(code, lineNo, strings, globals, out);

        Matcher operator = OPERATOR.matcher(code);
        while (operator.find()) {
            if (!inRanges(operator.start(), strings)) {
                out.add(Token.of(lineNo, operator.start(), operator.end(), TokenKind.OPERATOR, operator.group()));
            }
        }
    }

    private void emitIdentifiers(String code, int lineNo, List<int[]> strings,
                                 Declarations globals, List<Token> out) {
        Set<String> localFunctions  = new LinkedHashSet<>();
        Set<String> localParameters = new LinkedHashSet<>();
        collectGroup(FUNCTION_DECL, code, localFunctions);
        collectParameters(code, localParameters);

        Matcher ident = IDENT.matcher(code);
        while (ident.find()) {
            if (inRanges(ident.start(), strings)) {
                continue;
            }
            String name = ident.group();
            TokenKind kind;
            if (localFunctions.contains(name) || globals.functions().contains(name)) {
                kind = TokenKind.USER_FUNCTION;
            } else if (localParameters.contains(name) || globals.parameters().contains(name)) {
                kind = TokenKind.FUNCTION_PARAMETER;
            } else if (globals.variables().contains(name)) {
                kind = TokenKind.USER_VARIABLE;
            } else {
                kind = classifyStatic(name);
            }
            log.trace("Line {}: '{}' -> {}", lineNo, name, kind);
            out.add(Token.of(lineNo, ident.start(), ident.end(), kind, name));
        }
    }

    static TokenKind classifyStatic(String word) {
        if (LanguageVocabulary.isKeyword(word)) {
            return TokenKind.KEYWORD;
        }
        if (LanguageVocabulary.isBuiltInType(word)) {
            return TokenKind.BUILT_IN_TYPE;
        }
        if (LanguageVocabulary.BUILT_IN_FUNCTIONS.contains(word)) {
            return TokenKind.BUILT_IN_FUNCTION;
        }
        return TokenKind.IDENTIFIER;
    }

    private static List<int[]> findStrings(String line) {
        List<int[]> ranges = new ArrayList<>();
        Matcher m = STRING.matcher(line);
        while (m.find()) {
            ranges.add(new int[] {m.start(), m.end()});
        }
        return ranges;
    }

    /** First {@code //} that is not inside a string literal, or -1. */
    private static int findCommentStart(String line, List<int[]> strings) {
        int idx = line.indexOf(LINE_COMMENT);
        while (idx >= 0 && inRanges(idx, strings)) {
            idx = line.indexOf(LINE_COMMENT, idx + 1);
        }
        return idx;
    }

    private static boolean inRanges(int position, List<int[]> ranges) {
        for (int[] range : ranges) {
            if (position >= range[0] && position < range[1]) {
                return true;
            }
        }
        return false;
    }
}

package com.compilebox.backend.analysis;

import java.util.Set;

/**
 * Fixed word lists of the snippet language shared by the lexical pass and
 * AST mining.
 */
public final class LanguageVocabulary {

    public static final Set<String> KEYWORDS = Set.of(
            "модуль", "импорт", "вход", "пусть", "если", "иначе", "пока", "для",
            "фн", "функция", "класс", "тип", "константа", "переменная", "возврат", "вернуть", "прервать",
            "продолжить", "выбор", "случай", "умолчание", "и", "или", "не", "истина", "ложь");

    public static final Set<String> BUILT_IN_TYPES = Set.of(
            "Цел64", "Слово64", "Вещ64", "Лог", "Строка", "Символ", "Байт", "Пусто");

    // No built-in functions are recognised statically; imported ones come from the AST.
    public static final Set<String> BUILT_IN_FUNCTIONS = Set.of();

    /** Type names the merge step promotes to built-in types when the AST says nothing. */
    public static final Set<String> REFINED_TYPE_NAMES = Set.of("Цел64", "Строка", "Булев", "Плав64");

    /** Regex fragment for one identifier. Hyphens are legal after the first character. */
    public static final String IDENTIFIER = "[а-яёА-ЯЁa-zA-Z_][а-яёА-ЯЁa-zA-Z0-9_-]*";

    private LanguageVocabulary() {}

    public static boolean isKeyword(String word) {
        return KEYWORDS.contains(word);
    }

    public static boolean isBuiltInType(String word) {
        return BUILT_IN_TYPES.contains(word);
    }
}

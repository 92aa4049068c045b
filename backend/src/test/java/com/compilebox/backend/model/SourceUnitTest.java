package com.compilebox.backend.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SourceUnitTest {

    @Test
    void of_normalisesLineEndingsAndDropsNul() {
        SourceUnit unit = SourceUnit.of("а\r\nб\rв\0г");

        assertThat(unit.text()).isEqualTo("а\nб\nвг");
    }

    @Test
    void of_null_isBlank() {
        assertThat(SourceUnit.of(null).isBlank()).isTrue();
        assertThat(SourceUnit.of(null).length()).isZero();
    }

    @Test
    void withModulePreamble_addsModuleAndDetectedImports() {
        String wrapped = SourceUnit.of("вход { пусть с = ввод.строка(); вывод.ф(с) }").withModulePreamble();

        assertThat(wrapped).isEqualTo("""
                модуль sample

                импорт "стд::вывод"

                импорт "стд::ввод"

                вход { пусть с = ввод.строка(); вывод.ф(с) }""");
    }

    @Test
    void withModulePreamble_existingModule_unchanged() {
        String text = "модуль мой\n\nвход {}";

        assertThat(SourceUnit.of(text).withModulePreamble()).isEqualTo(text);
    }

    @Test
    void withModulePreamble_noFacilities_onlyModuleHeader() {
        assertThat(SourceUnit.of("вход {}").withModulePreamble()).isEqualTo("модуль sample\n\nвход {}");
    }
}

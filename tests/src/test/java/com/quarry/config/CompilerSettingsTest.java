package com.quarry.config;

import com.quarry.test.TestBase;
import com.quarry.test.TestCategories;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Compiler settings")
public class CompilerSettingsTest extends TestBase {

    @AfterEach
    void clearProperties() {
        System.clearProperty(CompilerSettings.PROP_DIALECT);
        System.clearProperty(CompilerSettings.PROP_SAMPLE_DEFAULT_ROWS);
        System.clearProperty(CompilerSettings.PROP_MAX_TRANSLATE_ROUNDS);
    }

    @Test
    @DisplayName("TC-CFG-001: defaults")
    void testDefaults() {
        CompilerSettings settings = CompilerSettings.defaults();

        assertThat(settings.dialect()).isEqualTo("duckdb");
        assertThat(settings.sampleDefaultRows()).isEqualTo(50_000L);
        assertThat(settings.maxTranslateRounds()).isEqualTo(100);
    }

    @Test
    @DisplayName("TC-CFG-002: with* returns a copy with one setting changed")
    void testWithers() {
        CompilerSettings settings = CompilerSettings.defaults()
            .withDialect("postgres")
            .withSampleDefaultRows(10)
            .withMaxTranslateRounds(5);

        assertThat(settings.dialect()).isEqualTo("postgres");
        assertThat(settings.sampleDefaultRows()).isEqualTo(10);
        assertThat(settings.maxTranslateRounds()).isEqualTo(5);
        assertThat(CompilerSettings.defaults().dialect()).isEqualTo("duckdb");
    }

    @Test
    @DisplayName("TC-CFG-003: invalid values are rejected")
    void testInvalidValues() {
        assertThatThrownBy(() -> CompilerSettings.defaults().withDialect(""))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CompilerSettings.defaults().withSampleDefaultRows(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sampleDefaultRows");
        assertThatThrownBy(() -> CompilerSettings.defaults().withMaxTranslateRounds(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxTranslateRounds");
    }

    @Test
    @DisplayName("TC-CFG-004: system properties override the defaults")
    void testSystemProperties() {
        System.setProperty(CompilerSettings.PROP_DIALECT, " mysql ");
        System.setProperty(CompilerSettings.PROP_SAMPLE_DEFAULT_ROWS, "250");
        System.setProperty(CompilerSettings.PROP_MAX_TRANSLATE_ROUNDS, "7");

        CompilerSettings settings = CompilerSettings.fromSystemProperties();

        assertThat(settings.dialect()).isEqualTo("mysql");
        assertThat(settings.sampleDefaultRows()).isEqualTo(250);
        assertThat(settings.maxTranslateRounds()).isEqualTo(7);
    }

    @Test
    @DisplayName("TC-CFG-005: malformed or out of range properties fall back to the defaults")
    void testMalformedProperties() {
        System.setProperty(CompilerSettings.PROP_DIALECT, "  ");
        System.setProperty(CompilerSettings.PROP_SAMPLE_DEFAULT_ROWS, "many");
        System.setProperty(CompilerSettings.PROP_MAX_TRANSLATE_ROUNDS, "0");

        CompilerSettings settings = CompilerSettings.fromSystemProperties();

        assertThat(settings.dialect()).isEqualTo(CompilerSettings.DEFAULT_DIALECT);
        assertThat(settings.sampleDefaultRows()).isEqualTo(CompilerSettings.DEFAULT_SAMPLE_ROWS);
        assertThat(settings.maxTranslateRounds()).isEqualTo(CompilerSettings.DEFAULT_MAX_TRANSLATE_ROUNDS);
    }
}

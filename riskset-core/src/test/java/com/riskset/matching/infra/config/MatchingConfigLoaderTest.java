/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.infra.config;

import com.riskset.matching.api.config.MatchingConfig;
import com.riskset.matching.api.exceptions.ConfigurationException;
import com.riskset.matching.api.model.MatchMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchingConfigLoaderTest {

    @TempDir
    Path tempDir;

    private Path writeProperties(String content) throws IOException {
        Path file = tempDir.resolve("job.properties");
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("Should load every option from a properties file")
    void shouldLoadFromFile() throws IOException {
        Path file = writeProperties("""
                matching.n_controls=3
                matching.match_vars=sex, site
                matching.extra_vars=age,region
                matching.extra_conditions=abs(age - case.age) <= 5
                matching.method=incidence_density
                matching.index_date_field=idx_date
                matching.control_date_field=evt_date
                matching.cores=4
                matching.track=true
                matching.seed=7
                matching.id_field=patid
                matching.date_fields=birth_date
                matching.date_origin=1960-01-01
                """);

        MatchingConfig config = new MatchingConfigLoader(Map.of()).load(file.toString());

        assertThat(config.getNControls()).isEqualTo(3);
        assertThat(config.getMatchVars()).containsExactly("sex", "site");
        assertThat(config.getExtraVars()).containsExactly("age", "region");
        assertThat(config.getExtraConditions()).isEqualTo("abs(age - case.age) <= 5");
        assertThat(config.getMethod()).isEqualTo(MatchMethod.INCIDENCE_DENSITY);
        assertThat(config.getIndexDateField()).isEqualTo("idx_date");
        assertThat(config.getControlDateField()).isEqualTo("evt_date");
        assertThat(config.getCores()).isEqualTo(4);
        assertThat(config.isTrack()).isTrue();
        assertThat(config.getSeed()).isEqualTo(7L);
        assertThat(config.getIdField()).isEqualTo("patid");
        assertThat(config.getDateFields()).containsExactly("birth_date");
        assertThat(config.getDateOrigin()).isEqualTo(LocalDate.of(1960, 1, 1));
    }

    @Test
    @DisplayName("Should load the default properties from the classpath")
    void shouldLoadDefaultFromClasspath() {
        MatchingConfig config = new MatchingConfigLoader(Map.of()).loadDefault();

        assertThat(config.getMatchVars()).containsExactly("sex", "practice");
        assertThat(config.getMethod()).isEqualTo(MatchMethod.EXACT);
    }

    @Test
    @DisplayName("Environment variables should override file values")
    void shouldPreferEnvironment() throws IOException {
        Path file = writeProperties("""
                matching.match_vars=sex
                matching.n_controls=2
                matching.method=incidence_density
                """);
        Map<String, String> env = Map.of(
                "MATCHING_N_CONTROLS", "5",
                "MATCHING_METHOD", "exact",
                "MATCHING_CORES", " ");

        MatchingConfig config = new MatchingConfigLoader(env).load(file.toString());

        assertThat(config.getNControls()).isEqualTo(5);
        assertThat(config.getMethod()).isEqualTo(MatchMethod.EXACT);
        assertThat(config.getCores()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should derive environment names from property keys")
    void shouldDeriveEnvironmentKeys() {
        assertThat(MatchingConfigLoader.environmentKey("n_controls")).isEqualTo("MATCHING_N_CONTROLS");
        assertThat(MatchingConfigLoader.environmentKey("index_date_field")).isEqualTo("MATCHING_INDEX_DATE_FIELD");
    }

    @Test
    @DisplayName("Should reject unparseable values")
    void shouldRejectInvalidValues() {
        Properties props = new Properties();
        props.setProperty("matching.match_vars", "sex");
        props.setProperty("matching.cores", "many");
        MatchingConfigLoader loader = new MatchingConfigLoader(Map.of());

        assertThatThrownBy(() -> loader.fromProperties(props))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("matching.cores must be an integer");

        props.setProperty("matching.cores", "2");
        props.setProperty("matching.track", "sometimes");
        assertThatThrownBy(() -> loader.fromProperties(props))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("matching.track must be a boolean");
    }

    @Test
    @DisplayName("A missing file should fall back to the environment")
    void shouldUseEnvironmentWhenFileMissing() {
        MatchingConfigLoader loader = new MatchingConfigLoader(Map.of("MATCHING_MATCH_VARS", "sex,site"));

        MatchingConfig config = loader.load(tempDir.resolve("absent.properties").toString());

        assertThat(config.getMatchVars()).containsExactly("sex", "site");
    }

    @Test
    @DisplayName("Validation errors should surface from the loaded configuration")
    void shouldValidateLoadedConfiguration() throws IOException {
        Path file = writeProperties("matching.n_controls=2\n");

        assertThatThrownBy(() -> new MatchingConfigLoader(Map.of()).load(file.toString()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("match_vars");
    }
}

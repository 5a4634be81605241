/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;

import org.junit.Test;

public class CommandLineOptionsTest {

    @Test
    public void shouldParseOptionsWithSeparateValues() {
        CommandLineOptions options = CommandLineOptions.parse(new String[]{ "-s", "my_slot", "--publication", "my_pub" });
        assertThat(options.getOption("-s", "--slot", null)).isEqualTo("my_slot");
        assertThat(options.getOption("-p", "--publication", null)).isEqualTo("my_pub");
        assertThat(options.getParameters()).isEmpty();
    }

    @Test
    public void shouldParseOptionsWithAttachedValues() {
        CommandLineOptions options = CommandLineOptions.parse(new String[]{ "--slot=my_slot", "--http-tables=a_b,c_d" });
        assertThat(options.getOption("--slot")).isEqualTo("my_slot");
        assertThat(options.getOption("--http-tables")).isEqualTo("a_b,c_d");
    }

    @Test
    public void shouldTreatOptionWithoutValueAsFlag() {
        CommandLineOptions options = CommandLineOptions.parse(new String[]{ "--create-slot", "-s", "slot" });
        assertThat(options.hasOption("--create-slot")).isTrue();
        assertThat(options.getOption("--create-slot")).isEqualTo("true");
        assertThat(options.hasOption("-h", "--help")).isFalse();
    }

    @Test
    public void shouldUseDefaultValueWhenOptionIsMissing() {
        CommandLineOptions options = CommandLineOptions.parse(new String[0]);
        assertThat(options.getOption("-f", "--format", "json")).isEqualTo("json");
    }

    @Test
    public void shouldCollectParametersAfterConsumedValues() {
        CommandLineOptions options = CommandLineOptions.parse(new String[]{ "-f", "text", "extra" });
        assertThat(options.getOption("-f")).isEqualTo("text");
        assertThat(options.getParameters()).containsExactly("extra");
    }

    @Test
    public void shouldReportUnknownOptions() {
        CommandLineOptions options = CommandLineOptions.parse(new String[]{ "-s", "slot", "--bogus", "x" });
        assertThat(options.getUnknownOptions(Set.of("-s", "--slot"))).containsExactly("--bogus");
    }
}

/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.pgrelay.annotation.Immutable;

/**
 * Utility for parsing and accessing the command line options and parameters.
 * <p>
 * Options start with '{@code -}' or '{@code --}'. A value may follow the option as the next argument or be attached with
 * '{@code =}' (e.g., {@code --slot=my_slot}). An option without a value is recorded as {@code "true"}.
 *
 * @author Randall Hauch
 */
@Immutable
public class CommandLineOptions {

    /**
     * Parse the array of arguments passed to a Java {@code main} method and create a {@link CommandLineOptions} instance.
     *
     * @param args the {@code main} method's parameters; may not be null
     * @return the representation of the command line options and parameters; never null
     */
    public static CommandLineOptions parse(String[] args) {
        Map<String, String> options = new HashMap<>();
        List<String> params = new ArrayList<>();
        String optionName = null;
        for (String arg : args) {
            String value = arg.trim();
            if (value.startsWith("-") && value.length() > 1) {
                int equals = value.indexOf('=');
                if (value.startsWith("--") && equals > 0) {
                    options.put(value.substring(0, equals), value.substring(equals + 1));
                    optionName = null;
                }
                else {
                    optionName = value;
                    options.put(optionName, "true");
                }
            }
            else if (optionName != null) {
                options.put(optionName, value);
                optionName = null;
            }
            else {
                params.add(value);
            }
        }
        return new CommandLineOptions(options, params);
    }

    private final Map<String, String> options;
    private final List<String> params;

    private CommandLineOptions(Map<String, String> options, List<String> params) {
        this.options = Collections.unmodifiableMap(options);
        this.params = Collections.unmodifiableList(params);
    }

    /**
     * Determine if the option with one of the given names was used on the command line.
     *
     * @param name the name for the option (e.g., "-h")
     * @param alternativeName an alternative name for the option (e.g., "--help"); may be null
     * @return true if the option was used, or false otherwise
     */
    public boolean hasOption(String name, String alternativeName) {
        return getOption(name, alternativeName, null) != null;
    }

    public boolean hasOption(String name) {
        return hasOption(name, null);
    }

    /**
     * Obtain the value associated with the option given the name and alternative name of the option, using the supplied default
     * value if none is found.
     *
     * @param name the name for the option (e.g., "-s")
     * @param alternativeName an alternative name for the option (e.g., "--slot"); may be null
     * @param defaultValue the value that should be returned no named option was found
     * @return the value associated with the option, or the default value if none was found
     */
    public String getOption(String name, String alternativeName, String defaultValue) {
        String result = options.get(name.trim());
        if (result == null && alternativeName != null) {
            result = options.get(alternativeName.trim());
        }
        return result != null ? result : defaultValue;
    }

    public String getOption(String name) {
        return getOption(name, null, null);
    }

    /**
     * Get the names of all options found on the command line that are not in the supplied set of known names.
     *
     * @param knownNames the names (including prefixes) of the recognized options; may not be null
     * @return the unrecognized option names; never null but possibly empty
     */
    public Set<String> getUnknownOptions(Set<String> knownNames) {
        Set<String> unknown = new LinkedHashSet<>();
        for (String name : options.keySet()) {
            if (!knownNames.contains(name)) {
                unknown.add(name);
            }
        }
        return unknown;
    }

    /**
     * Get the parameters that are not associated with any option.
     *
     * @return the parameters; never null but possibly empty
     */
    public List<String> getParameters() {
        return params;
    }

    @Override
    public String toString() {
        return "options=" + options.keySet() + ", parameters=" + params;
    }
}

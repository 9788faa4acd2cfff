package org.dynamis.control.printer;

import com.github.javaparser.printer.configuration.DefaultConfigurationOption;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration.ConfigOption;
import com.github.javaparser.printer.configuration.Indentation;
import com.github.javaparser.printer.configuration.Indentation.IndentType;
import com.github.javaparser.printer.configuration.PrinterConfiguration;

/**
 * JavaParser printer configurations used when emitting adapted nodes.
 * <p>
 * Nodes are printed on a single line: line ends become one space and nothing is
 * indented. Comments are dropped unless {@value #PRINT_COMMENTS_PROPERTY} is set to
 * {@code true}.
 */
public final class PrinterSettings {

    public static final String PRINT_COMMENTS_PROPERTY = "dynamis.control.print.comments";

    private PrinterSettings() {
    }

    public static boolean isPrintComments() {
        return Boolean.getBoolean(PRINT_COMMENTS_PROPERTY);
    }

    /**
     * The single-line configuration, honouring {@value #PRINT_COMMENTS_PROPERTY}.
     */
    public static PrinterConfiguration defaultConfiguration() {
        return singleLine(isPrintComments());
    }

    public static PrinterConfiguration singleLine(boolean printComments) {
        PrinterConfiguration configuration = new DefaultPrinterConfiguration();
        replace(configuration, ConfigOption.END_OF_LINE_CHARACTER, " ");
        replace(configuration, ConfigOption.INDENTATION, new Indentation(IndentType.SPACES, 0));
        if (!printComments) {
            configuration.removeOption(new DefaultConfigurationOption(ConfigOption.PRINT_COMMENTS));
            configuration.removeOption(new DefaultConfigurationOption(ConfigOption.PRINT_JAVADOC));
        }
        return configuration;
    }

    private static void replace(PrinterConfiguration configuration, ConfigOption option, Object value) {
        configuration.removeOption(new DefaultConfigurationOption(option));
        configuration.addOption(new DefaultConfigurationOption(option, value));
    }
}
